package io.github.yok.toch.exception;

/**
 * Raised when a row cannot be written and row-error tolerance is off.
 *
 * @author Yasuharu.Okawauchi
 */
public class ExportException extends IngestException {

    private static final long serialVersionUID = 1L;

    public ExportException(String message) {
        super(message);
    }

    public ExportException(String message, Throwable cause) {
        super(message, cause);
    }
}
