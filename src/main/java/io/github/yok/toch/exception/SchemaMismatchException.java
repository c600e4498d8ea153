package io.github.yok.toch.exception;

/**
 * Raised when a caller-supplied type list does not have exactly one entry per column.
 *
 * @author Yasuharu.Okawauchi
 */
public class SchemaMismatchException extends IngestException {

    private static final long serialVersionUID = 1L;

    public SchemaMismatchException(String message) {
        super(message);
    }

    public SchemaMismatchException(String message, Throwable cause) {
        super(message, cause);
    }
}
