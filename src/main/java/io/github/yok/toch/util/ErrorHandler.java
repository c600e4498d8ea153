package io.github.yok.toch.util;

import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.apache.commons.lang3.exception.ExceptionUtils;

/**
 * Utility class that logs a fatal error and echoes a concise message to {@code System.err}.
 *
 * <p>
 * <strong>Behavior:</strong>
 * </p>
 * <ul>
 * <li>Logs the error using SLF4J.</li>
 * <li>Writes a concise {@code ERROR:} line to {@code System.err}.</li>
 * <li>Does not terminate the JVM by itself; {@link io.github.yok.toch.Main} turns the failure into
 * the process exit status.</li>
 * <li>In tests, callers can switch behavior to throwing an exception via a thread-local flag.</li>
 * </ul>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public class ErrorHandler {

    private static final ThreadLocal<Boolean> EXIT_DISABLED =
            ThreadLocal.withInitial(() -> Boolean.FALSE);

    private ErrorHandler() {}

    /**
     * Switch to "throw exception instead of reporting" for the current thread (useful for tests).
     */
    public static void disableExitForCurrentThread() {
        EXIT_DISABLED.set(Boolean.TRUE);
    }

    /**
     * Restore normal behavior for the current thread.
     */
    public static void restoreExitForCurrentThread() {
        EXIT_DISABLED.remove();
    }

    /**
     * Logs the given message and cause at error level and prints a concise message to
     * {@code System.err}.
     *
     * <p>
     * The stack trace is logged only at debug level; the error line carries the cause chain
     * messages.
     * </p>
     *
     * @param message message to log
     * @param cause root cause
     * @throws IllegalStateException if reporting is disabled for the current thread
     */
    public static void errorAndExit(String message, Throwable cause) {
        log.error("{}: {}", message, ExceptionUtils.getRootCauseMessage(cause));
        log.debug("Stack trace:\n{}", ExceptionUtils.getStackTrace(cause));
        if (Boolean.TRUE.equals(EXIT_DISABLED.get())) {
            throw new IllegalStateException(message, cause);
        }
        System.err.println("ERROR: " + message + ": " + describe(cause));
    }

    /**
     * Joins the distinct messages of the cause chain, outermost first.
     *
     * <p>
     * Wrapped JDBC, HTTP and POI failures often repeat the inner message in the outer one; a
     * message already contained in the text so far is not repeated.
     * </p>
     *
     * @param cause failure
     * @return {@code "outer: inner"} style text, or the exception class name when no message is
     *         present
     */
    static String describe(Throwable cause) {
        StringBuilder sb = new StringBuilder();
        for (Throwable t : ExceptionUtils.getThrowableList(cause)) {
            String msg = StringUtils.trimToNull(t.getMessage());
            if (msg == null || sb.indexOf(msg) >= 0) {
                continue;
            }
            if (sb.length() > 0) {
                sb.append(": ");
            }
            sb.append(msg);
        }
        return sb.length() > 0 ? sb.toString() : cause.getClass().getSimpleName();
    }

    /**
     * Logs the given message at error level and prints a concise message to {@code System.err}.
     *
     * @param message message to log
     * @throws IllegalStateException if reporting is disabled for the current thread
     */
    public static void errorAndExit(String message) {
        log.error(message);
        if (Boolean.TRUE.equals(EXIT_DISABLED.get())) {
            throw new IllegalStateException(message);
        }
        System.err.println("ERROR: " + message);
    }
}
