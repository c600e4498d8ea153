package io.github.yok.toch.exception;

/**
 * Raised when a local source path does not exist or cannot be opened.
 *
 * @author Yasuharu.Okawauchi
 */
public class SourceNotFoundException extends SourceAccessException {

    private static final long serialVersionUID = 1L;

    public SourceNotFoundException(String message) {
        super(message);
    }

    public SourceNotFoundException(String message, Throwable cause) {
        super(message, cause);
    }
}
