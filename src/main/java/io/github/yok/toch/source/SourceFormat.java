package io.github.yok.toch.source;

import io.github.yok.toch.exception.ConfigurationException;
import java.util.Arrays;
import java.util.Locale;
import java.util.stream.Collectors;
import lombok.Getter;

/**
 * Enumeration of supported source formats.
 *
 * <p>
 * Each format is selected by a case-insensitive token on the command line ({@code -type}). The
 * delimited formats carry their field separator; the spreadsheet formats are read cell by cell and
 * have no separator.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Getter
public enum SourceFormat {

    // Tab-delimited text.
    TEXT("text", '\t', false),

    // Comma-separated values.
    CSV("csv", ',', false),

    // Excel workbook (Office Open XML).
    XLSX("xlsx", '\0', true),

    // Legacy binary Excel workbook; converted to XLSX before reading.
    XLS("xls", '\0', true);

    // Command-line token (lowercase).
    private final String token;

    // Field separator for delimited formats.
    private final char separator;

    // Whether the format is a workbook read through a cell range.
    private final boolean spreadsheet;

    SourceFormat(String token, char separator, boolean spreadsheet) {
        this.token = token;
        this.separator = separator;
        this.spreadsheet = spreadsheet;
    }

    /**
     * Resolves a command-line token to a format.
     *
     * @param token format token (case-insensitive, surrounding blanks ignored)
     * @return matching format
     * @throws ConfigurationException if the token is blank or unknown
     */
    public static SourceFormat fromToken(String token) {
        String normalized = token == null ? "" : token.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values()).filter(f -> f.token.equals(normalized)).findFirst()
                .orElseThrow(() -> new ConfigurationException("unrecognized source type: "
                        + token + " (expected one of " + tokens() + ")"));
    }

    /**
     * Returns the accepted tokens joined for messages.
     *
     * @return comma-separated tokens
     */
    public static String tokens() {
        return Arrays.stream(values()).map(SourceFormat::getToken)
                .collect(Collectors.joining(", "));
    }
}
