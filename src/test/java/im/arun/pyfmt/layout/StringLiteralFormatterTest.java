package im.arun.pyfmt.layout;

import im.arun.pyfmt.comment.CommentCursor;
import im.arun.pyfmt.config.FormatterConfig;
import im.arun.pyfmt.exception.StringLayoutException;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class StringLiteralFormatterTest {

    private final StringLiteralFormatter formatter = new StringLiteralFormatter();

    private static LayoutContext root(int maxLineLength) {
        FormatterConfig config = new FormatterConfig();
        config.setMaxLineLength(maxLineLength);
        return LayoutContext.root(config, CommentCursor.empty());
    }

    @Test
    void escapesControlCharactersAndDelimiter() {
        assertThat(StringLiteralFormatter.quoted("a\tb\n\"c\"\\", "\""))
                .isEqualTo("\"a\\tb\\n\\\"c\\\"\\\\\"");
        assertThat(StringLiteralFormatter.quoted("it's", "'")).isEqualTo("'it\\'s'");
        assertThat(StringLiteralFormatter.quoted("it's", "\"")).isEqualTo("\"it's\"");
    }

    @Test
    void keepsShortLiteralOnOneLine() {
        assertThat(formatter.format("hello world", root(20))).isEqualTo("\"hello world\"");
    }

    @Test
    void wrapsLongLiteralAtSpaces() {
        String wrapped = formatter.format("hello world foo", root(12));

        assertThat(wrapped).isEqualTo("(\n\t\"hello \"\n\t\"world foo\"\n)");
    }

    @Test
    void embeddedNewlineEndsSegment() {
        String wrapped = formatter.format("first line\nsecond", root(16));

        assertThat(wrapped).isEqualTo("(\n\t\"first line\\n\"\n\t\"second\"\n)");
    }

    @Test
    void inlineModeNeverWraps() {
        LayoutContext ctx = root(5).withInline(true);

        assertThat(formatter.format("hello world", ctx)).isEqualTo("\"hello world\"");
    }

    @Test
    void unbreakableTokenIsFatal() {
        assertThatThrownBy(() -> formatter.format("abcdefghijklmnop qr", root(10)))
                .isInstanceOf(StringLayoutException.class)
                .satisfies(e -> {
                    StringLayoutException error = (StringLayoutException) e;
                    assertThat(error.getToken()).isEqualTo("abcdefghijklmnop ");
                    assertThat(error.getMaxLineLength()).isEqualTo(10);
                });
    }
}
