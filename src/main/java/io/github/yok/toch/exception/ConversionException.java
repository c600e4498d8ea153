package io.github.yok.toch.exception;

/**
 * Raised when a legacy XLS workbook cannot be converted to XLSX, either because no converter
 * is available on this platform or because the converter failed.
 *
 * @author Yasuharu.Okawauchi
 */
public class ConversionException extends IngestException {

    private static final long serialVersionUID = 1L;

    public ConversionException(String message) {
        super(message);
    }

    public ConversionException(String message, Throwable cause) {
        super(message, cause);
    }
}
