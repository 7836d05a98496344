package im.arun.pyfmt.config;

import lombok.Data;

@Data
public class FormatterConfig {
    private int maxLineLength = 120;
    private String quote = "\"";
    private String tab = "\t";
    private String astSuffix = ".ast.json";

    /**
     * Rejects settings no layout can honour.
     */
    public void validate() {
        if (maxLineLength <= 0) {
            throw new IllegalArgumentException("max_line_length must be positive, got " + maxLineLength);
        }
        if (!"\"".equals(quote) && !"'".equals(quote)) {
            throw new IllegalArgumentException("quote must be \" or ', got " + quote);
        }
        if (tab == null || tab.isEmpty() || !tab.isBlank()) {
            throw new IllegalArgumentException("tab must be non-empty whitespace");
        }
        if (astSuffix == null || astSuffix.isEmpty()) {
            throw new IllegalArgumentException("ast_suffix must not be empty");
        }
    }
}
