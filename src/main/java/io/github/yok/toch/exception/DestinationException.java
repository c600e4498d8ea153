package io.github.yok.toch.exception;

/**
 * Raised when the destination connection itself fails. Always fatal, regardless of row-error
 * tolerance.
 *
 * @author Yasuharu.Okawauchi
 */
public class DestinationException extends IngestException {

    private static final long serialVersionUID = 1L;

    public DestinationException(String message) {
        super(message);
    }

    public DestinationException(String message, Throwable cause) {
        super(message, cause);
    }
}
