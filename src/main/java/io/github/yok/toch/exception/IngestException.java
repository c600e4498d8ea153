package io.github.yok.toch.exception;

/**
 * Base class of every failure raised by the ingestion pipeline.
 *
 * <p>
 * All pipeline failures are unchecked. {@link io.github.yok.toch.Main} catches this type at the top
 * level, reports the message and ends the process with a non-zero exit status.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
public class IngestException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    /**
     * Creates an exception with a message.
     *
     * @param message description of the failure
     */
    public IngestException(String message) {
        super(message);
    }

    /**
     * Creates an exception with a message and a cause.
     *
     * @param message description of the failure
     * @param cause underlying cause
     */
    public IngestException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * Returns the process exit status used when this failure ends the run.
     *
     * @return exit status (non-zero)
     */
    public int getExitCode() {
        return 1;
    }
}
