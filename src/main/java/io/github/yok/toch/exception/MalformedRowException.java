package io.github.yok.toch.exception;

import lombok.Getter;

/**
 * Raised when a row's width differs from the width fixed by the first row of the same reader (or
 * from the column count of the table schema).
 *
 * <p>
 * The offending row has already been consumed when this is thrown, so the reader can continue
 * with the next row. Under row-error tolerance the export counts the row as skipped.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Getter
public class MalformedRowException extends IngestException {

    private static final long serialVersionUID = 1L;

    // 1-based row number within the source (after any skipped rows)
    private final long rowNumber;

    // Width established by the first observed row
    private final int expectedWidth;

    // Width of the offending row
    private final int actualWidth;

    /**
     * Creates an exception describing a width mismatch.
     *
     * @param rowNumber 1-based row number within the source
     * @param expectedWidth established width
     * @param actualWidth width of the offending row
     */
    public MalformedRowException(long rowNumber, int expectedWidth, int actualWidth) {
        super(String.format("Row %d has %d columns, expected %d", rowNumber, actualWidth,
                expectedWidth));
        this.rowNumber = rowNumber;
        this.expectedWidth = expectedWidth;
        this.actualWidth = actualWidth;
    }
}
