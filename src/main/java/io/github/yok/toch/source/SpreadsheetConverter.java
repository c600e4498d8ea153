package io.github.yok.toch.source;

import io.github.yok.toch.exception.ConversionException;
import java.nio.file.Path;

/**
 * Converts legacy binary XLS workbooks to XLSX.
 *
 * @author Yasuharu.Okawauchi
 */
public interface SpreadsheetConverter {

    /**
     * Returns whether conversion is available on this platform.
     *
     * @return {@code true} if {@link #convertToXlsx(Path)} can be used
     */
    boolean isSupported();

    /**
     * Converts the given XLS file to an XLSX file in the same directory.
     *
     * @param xls path of the XLS file
     * @return path of the produced XLSX file
     * @throws ConversionException if conversion is unsupported or fails
     */
    Path convertToXlsx(Path xls);
}
