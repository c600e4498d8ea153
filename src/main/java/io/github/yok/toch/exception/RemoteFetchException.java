package io.github.yok.toch.exception;

/**
 * Raised when an HTTP source cannot be fetched (transport failure or non-2xx status).
 *
 * @author Yasuharu.Okawauchi
 */
public class RemoteFetchException extends SourceAccessException {

    private static final long serialVersionUID = 1L;

    public RemoteFetchException(String message) {
        super(message);
    }

    public RemoteFetchException(String message, Throwable cause) {
        super(message, cause);
    }
}
