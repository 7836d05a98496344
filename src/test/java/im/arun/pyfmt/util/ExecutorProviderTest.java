package im.arun.pyfmt.util;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.util.concurrent.ExecutorService;

import static org.assertj.core.api.Assertions.assertThat;

class ExecutorProviderTest {

    @AfterEach
    void tearDown() {
        System.clearProperty(ExecutorProvider.WORKERS_PROPERTY);
    }

    @Test
    void workerCountFollowsProperty() {
        System.setProperty(ExecutorProvider.WORKERS_PROPERTY, "3");
        assertThat(ExecutorProvider.workerCount()).isEqualTo(3);

        System.setProperty(ExecutorProvider.WORKERS_PROPERTY, "0");
        assertThat(ExecutorProvider.workerCount()).isEqualTo(1);

        System.setProperty(ExecutorProvider.WORKERS_PROPERTY, "many");
        assertThat(ExecutorProvider.workerCount()).isEqualTo(Runtime.getRuntime().availableProcessors());
    }

    @Test
    void defaultsToProcessorCount() {
        assertThat(ExecutorProvider.workerCount()).isEqualTo(Runtime.getRuntime().availableProcessors());
    }

    @Test
    void poolIsSharedUntilShutdown() {
        ExecutorService first = ExecutorProvider.getExecutor();
        assertThat(ExecutorProvider.getExecutor()).isSameAs(first);

        ExecutorProvider.shutdown();

        assertThat(first.isShutdown()).isTrue();
        assertThat(ExecutorProvider.getExecutor()).isNotSameAs(first).matches(pool -> !pool.isShutdown());
    }
}
