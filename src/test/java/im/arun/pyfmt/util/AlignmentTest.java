package im.arun.pyfmt.util;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class AlignmentTest {

    @Test
    void padsFirstColumnToWidestEntry() {
        String aligned = Alignment.align(List.of(
                new Alignment.Pair("a", "bar"),
                new Alignment.Pair("bif", "baz")), " = ");

        assertThat(aligned).isEqualTo("a   = bar\nbif = baz");
    }

    @Test
    void appliesJoinerAndTailToEveryEntry() {
        String aligned = Alignment.align(List.of(
                new Alignment.Pair("key", "1"),
                new Alignment.Pair("k", "2")), ": ", ",\n", ";");

        assertThat(aligned).isEqualTo("key: 1;,\nk  : 2;");
    }

    @Test
    void emptyInputYieldsEmptyText() {
        assertThat(Alignment.align(List.of(), " = ")).isEmpty();
        assertThat(Alignment.align(null, " = ")).isEmpty();
    }
}
