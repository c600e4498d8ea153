package io.github.yok.toch.exception;

/**
 * Raised when the destination rejects the table definition.
 *
 * @author Yasuharu.Okawauchi
 */
public class TableCreationException extends IngestException {

    private static final long serialVersionUID = 1L;

    public TableCreationException(String message) {
        super(message);
    }

    public TableCreationException(String message, Throwable cause) {
        super(message, cause);
    }
}
