package io.github.yok.toch.source;

import io.github.yok.toch.config.IngestConfig;
import io.github.yok.toch.exception.ConversionException;
import java.io.File;
import java.io.IOException;
import java.nio.charset.Charset;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.TimeUnit;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.io.FileUtils;
import org.apache.commons.io.FilenameUtils;
import org.apache.commons.lang3.StringUtils;
import org.apache.commons.lang3.SystemUtils;
import org.springframework.stereotype.Component;

/**
 * {@link SpreadsheetConverter} that runs a headless LibreOffice:
 * {@code <command> --headless --convert-to xlsx --outdir <dir> <file>}.
 *
 * <p>
 * Only Linux is supported.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
@Component
public class LibreOfficeConverter implements SpreadsheetConverter {

    private final String command;
    private final long timeoutSeconds;

    /**
     * Creates a converter using the {@code toch.converter} settings.
     *
     * @param config ingestion configuration
     */
    public LibreOfficeConverter(IngestConfig config) {
        this.command = config.getConverter().getCommand();
        this.timeoutSeconds = config.getConverter().getTimeoutSeconds();
    }

    @Override
    public boolean isSupported() {
        return SystemUtils.IS_OS_LINUX;
    }

    @Override
    public Path convertToXlsx(Path xls) {
        if (!isSupported()) {
            throw new ConversionException(
                    "XLS conversion is only supported on Linux (current OS: " + SystemUtils.OS_NAME
                            + ")");
        }
        Path source = xls.toAbsolutePath();
        Path outDir = source.getParent();
        Path target = outDir.resolve(FilenameUtils.getBaseName(source.toString()) + ".xlsx");
        List<String> cmd = List.of(command, "--headless", "--convert-to", "xlsx", "--outdir",
                outDir.toString(), source.toString());
        log.info("Converting {} to XLSX: {}", source, String.join(" ", cmd));

        File output = null;
        try {
            output = Files.createTempFile("toch-convert", ".log").toFile();
            Process process = new ProcessBuilder(cmd).redirectErrorStream(true)
                    .redirectOutput(output).start();
            if (!process.waitFor(timeoutSeconds, TimeUnit.SECONDS)) {
                process.destroyForcibly();
                throw new ConversionException(
                        "Conversion of " + source + " timed out after " + timeoutSeconds + "s");
            }
            String text = FileUtils.readFileToString(output, Charset.defaultCharset());
            if (process.exitValue() != 0) {
                throw new ConversionException("Conversion of " + source + " failed (exit "
                        + process.exitValue() + "): " + StringUtils.trimToEmpty(text));
            }
            log.debug("Converter output: {}", StringUtils.trimToEmpty(text));
        } catch (IOException e) {
            throw new ConversionException(
                    "Failed to run converter '" + command + "': " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ConversionException("Interrupted while converting " + source, e);
        } finally {
            FileUtils.deleteQuietly(output);
        }

        if (!Files.isRegularFile(target)) {
            throw new ConversionException("Converter produced no output file: " + target);
        }
        return target;
    }
}
