package im.arun.pyfmt.service;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.nio.file.Path;

/**
 * Outcome of formatting one source file. Exactly one of {@code formatted} and
 * {@code error} is set.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class FormatResult {

    private Path path;

    private String original;

    private String formatted;

    private String error;

    public static FormatResult success(Path path, String original, String formatted) {
        return new FormatResult(path, original, formatted, null);
    }

    public static FormatResult failure(Path path, String error) {
        return new FormatResult(path, null, null, error);
    }

    public boolean isFailed() {
        return error != null;
    }

    public boolean isChanged() {
        return !isFailed() && !formatted.equals(original);
    }
}
