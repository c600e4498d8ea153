package io.github.yok.toch.exception;

/**
 * Raised when caller input is missing or invalid. Always detected before any I/O against the
 * source or the destination.
 *
 * @author Yasuharu.Okawauchi
 */
public class ConfigurationException extends IngestException {

    private static final long serialVersionUID = 1L;

    /**
     * Creates an exception with a message.
     *
     * @param message description of the invalid input
     */
    public ConfigurationException(String message) {
        super(message);
    }

    /**
     * Creates an exception with a message and a cause.
     *
     * @param message description of the invalid input
     * @param cause underlying cause
     */
    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public int getExitCode() {
        return 2;
    }
}
