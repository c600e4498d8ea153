package io.github.yok.toch.source;

import io.github.yok.toch.exception.ConfigurationException;
import lombok.Value;

/**
 * Inclusive rectangular cell range of a worksheet, using 0-based row and column indices.
 *
 * <p>
 * An end index of {@code 0} means the range is unbounded on that side: it extends to the last
 * populated row or column of the sheet.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Value
public class CellRange {

    /**
     * The whole sheet.
     */
    public static final CellRange ALL = new CellRange(0, 0, 0, 0);

    int rowStart;
    int rowEnd;
    int colStart;
    int colEnd;

    /**
     * Parses command-line {@code S:E} specifications for rows and columns.
     *
     * @param rows row specification, e.g. {@code 4:0}
     * @param cols column specification, e.g. {@code 2:0}
     * @return parsed range
     * @throws ConfigurationException if either specification is malformed
     */
    public static CellRange parse(String rows, String cols) {
        int[] r = parseSpan("rows", rows);
        int[] c = parseSpan("cols", cols);
        return new CellRange(r[0], r[1], c[0], c[1]);
    }

    /**
     * Returns whether the row range is unbounded at its end.
     *
     * @return {@code true} when {@code rowEnd == 0}
     */
    public boolean isOpenRowEnd() {
        return rowEnd == 0;
    }

    /**
     * Returns whether the column range is unbounded at its end.
     *
     * @return {@code true} when {@code colEnd == 0}
     */
    public boolean isOpenColEnd() {
        return colEnd == 0;
    }

    private static int[] parseSpan(String label, String spec) {
        if (spec == null || spec.indexOf(':') < 0) {
            throw new ConfigurationException(
                    "invalid -" + label + " spec '" + spec + "': expected S:E");
        }
        String[] parts = spec.trim().split(":", -1);
        if (parts.length != 2) {
            throw new ConfigurationException(
                    "invalid -" + label + " spec '" + spec + "': expected S:E");
        }
        int start;
        int end;
        try {
            start = Integer.parseInt(parts[0].trim());
            end = Integer.parseInt(parts[1].trim());
        } catch (NumberFormatException e) {
            throw new ConfigurationException(
                    "invalid -" + label + " spec '" + spec + "': S and E must be integers", e);
        }
        if (start < 0 || end < 0) {
            throw new ConfigurationException(
                    "invalid -" + label + " spec '" + spec + "': S and E must be non-negative");
        }
        if (end != 0 && end < start) {
            throw new ConfigurationException(
                    "invalid -" + label + " spec '" + spec + "': E must be 0 or >= S");
        }
        return new int[] {start, end};
    }
}
