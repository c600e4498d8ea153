package io.github.yok.toch.exception;

import lombok.Getter;

/**
 * Raised by a {@link io.github.yok.toch.db.TableWriter} when the destination refuses a single row
 * while the connection itself stays usable.
 *
 * <p>
 * Fatal when row-error tolerance is off; otherwise the row is skipped and counted.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Getter
public class RowRejectedException extends IngestException {

    private static final long serialVersionUID = 1L;

    // 1-based source row number of the rejected row
    private final long rowNumber;

    /**
     * Creates an exception for a rejected row.
     *
     * @param rowNumber 1-based source row number
     * @param message reason reported by the destination
     * @param cause underlying cause, may be {@code null}
     */
    public RowRejectedException(long rowNumber, String message, Throwable cause) {
        super("Row " + rowNumber + " rejected: " + message, cause);
        this.rowNumber = rowNumber;
    }
}
