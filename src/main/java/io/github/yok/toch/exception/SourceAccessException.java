package io.github.yok.toch.exception;

/**
 * Raised when the data source cannot be opened or read.
 *
 * @author Yasuharu.Okawauchi
 */
public class SourceAccessException extends IngestException {

    private static final long serialVersionUID = 1L;

    public SourceAccessException(String message) {
        super(message);
    }

    public SourceAccessException(String message, Throwable cause) {
        super(message, cause);
    }
}
