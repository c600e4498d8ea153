package io.github.yok.toch.reader;

import java.util.List;
import lombok.Value;

/**
 * One logical record as read from a source: an ordered list of string cells.
 *
 * <p>
 * Exists only while streaming; it is coerced and discarded right away.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Value
public class RawRow {

    // 1-based row number within the source, used in messages
    long rowNumber;

    // Cell values in column order
    List<String> cells;

    /**
     * Returns the number of cells.
     *
     * @return row width
     */
    public int size() {
        return cells.size();
    }

    /**
     * Returns the cell at the given column, or {@code null} when the row is shorter.
     *
     * @param index 0-based column index
     * @return cell value or {@code null}
     */
    public String get(int index) {
        return index < cells.size() ? cells.get(index) : null;
    }
}
