package io.github.yok.toch.source;

import java.net.URI;
import java.util.Locale;
import lombok.Builder;
import lombok.Value;

/**
 * Immutable description of one data source; it fully determines how a
 * {@link io.github.yok.toch.reader.RowReader} is built.
 *
 * @author Yasuharu.Okawauchi
 */
@Value
@Builder(toBuilder = true)
public class SourceSpec {

    // File path or http(s) URL
    String identifier;

    // Declared format
    SourceFormat format;

    // Quote character for delimited formats; null disables quoting
    @Builder.Default
    Character quote = '"';

    // Leading rows to discard (applied inside the cell range for spreadsheets)
    int skip;

    // Cell range for spreadsheet formats
    @Builder.Default
    CellRange range = CellRange.ALL;

    // Worksheet name; null or blank selects the first sheet
    String sheetName;

    /**
     * Returns whether the identifier is an HTTP or HTTPS URL.
     *
     * @return {@code true} for remote sources
     */
    public boolean isRemote() {
        try {
            String scheme = URI.create(identifier.trim()).getScheme();
            if (scheme == null) {
                return false;
            }
            String lower = scheme.toLowerCase(Locale.ROOT);
            return "http".equals(lower) || "https".equals(lower);
        } catch (IllegalArgumentException e) {
            // Windows paths and names with spaces are not URIs
            return false;
        }
    }
}
