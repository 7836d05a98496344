package im.arun.pyfmt.util;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Worker pool shared by every batch of files formatted in this JVM.
 *
 * <p>Formatting is CPU-bound, so the pool defaults to one worker per processor. The
 * {@code pyfmt.workers} system property overrides that count.
 */
public final class ExecutorProvider {
    private static final Logger logger = LoggerFactory.getLogger(ExecutorProvider.class);
    static final String WORKERS_PROPERTY = "pyfmt.workers";

    private static final Object LOCK = new Object();
    private static ExecutorService instance;

    private ExecutorProvider() {}

    public static ExecutorService getExecutor() {
        synchronized (LOCK) {
            if (instance == null || instance.isShutdown()) {
                int workers = workerCount();
                instance = Executors.newFixedThreadPool(workers, new WorkerFactory());
                logger.debug("Started formatting pool with {} workers", workers);
            }
            return instance;
        }
    }

    static int workerCount() {
        int processors = Runtime.getRuntime().availableProcessors();
        String configured = System.getProperty(WORKERS_PROPERTY);
        if (configured == null) {
            return processors;
        }
        try {
            return Math.max(1, Integer.parseInt(configured.trim()));
        } catch (NumberFormatException e) {
            logger.warn("Ignoring {}={}, using {} workers", WORKERS_PROPERTY, configured, processors);
            return processors;
        }
    }

    /**
     * Stops accepting work. Queued files still finish; a later {@link #getExecutor()} starts a new pool.
     */
    public static void shutdown() {
        synchronized (LOCK) {
            if (instance != null) {
                instance.shutdown();
                instance = null;
            }
        }
    }

    private static final class WorkerFactory implements ThreadFactory {
        private final AtomicInteger counter = new AtomicInteger();

        @Override
        public Thread newThread(Runnable task) {
            Thread worker = new Thread(task, "pyfmt-format-" + counter.incrementAndGet());
            worker.setDaemon(true);
            return worker;
        }
    }
}
