package io.github.yok.toch.source;

import io.github.yok.toch.exception.ConversionException;
import io.github.yok.toch.exception.SourceAccessException;
import io.github.yok.toch.exception.SourceNotFoundException;
import io.github.yok.toch.reader.DelimitedRowReader;
import io.github.yok.toch.reader.RowReader;
import io.github.yok.toch.reader.SpreadsheetRowReader;
import java.io.ByteArrayInputStream;
import java.io.Closeable;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.io.FileUtils;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.ss.usermodel.WorkbookFactory;

/**
 * Turns a {@link SourceSpec} into a fresh {@link RowReader} positioned at the start of the source.
 *
 * <p>
 * <strong>Resolution rules:</strong>
 * </p>
 * <ul>
 * <li>An identifier with an {@code http}/{@code https} scheme is fetched through the
 * {@link HttpFetcher}; the body is kept so that a later {@link #resolve(SourceSpec)} of the same
 * URL does not fetch again.</li>
 * <li>Any other identifier is a local path; a missing or unreadable file raises
 * {@link SourceNotFoundException}.</li>
 * <li>XLS sources are converted to XLSX by the {@link SpreadsheetConverter} and read as XLSX. A
 * remote XLS body is first written to a temporary directory. Converted paths are kept per
 * resolver.</li>
 * </ul>
 *
 * <p>
 * One resolver serves one run. {@link #close()} deletes the temporary files it created.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
@RequiredArgsConstructor
public class SourceResolver implements Closeable {

    private final HttpFetcher fetcher;
    private final SpreadsheetConverter converter;

    // URL -> fetched body
    private final Map<String, byte[]> bodies = new HashMap<>();

    // identifier -> converted XLSX path
    private final Map<String, Path> converted = new HashMap<>();

    // Temporary directories created by this resolver
    private final List<Path> tempDirs = new ArrayList<>();

    /**
     * Builds a new reader for the given source.
     *
     * @param spec source description
     * @return reader positioned at the beginning of the source
     * @throws IOException if the source cannot be opened
     * @throws SourceAccessException if the source cannot be accessed
     * @throws ConversionException if an XLS source cannot be converted
     */
    public RowReader resolve(SourceSpec spec) throws IOException {
        String id = spec.getIdentifier();
        SourceFormat format = spec.getFormat();
        switch (format) {
            case TEXT:
            case CSV:
                return new DelimitedRowReader(id, openStream(spec), format.getSeparator(),
                        spec.getQuote(), spec.getSkip());
            case XLSX:
                return new SpreadsheetRowReader(id, openWorkbook(spec), spec.getSheetName(),
                        spec.getRange(), spec.getSkip());
            case XLS:
                Path xlsx = convertedPath(spec);
                return new SpreadsheetRowReader(id, openWorkbook(xlsx), spec.getSheetName(),
                        spec.getRange(), spec.getSkip());
            default:
                throw new IllegalArgumentException("Unsupported format: " + format);
        }
    }

    private InputStream openStream(SourceSpec spec) throws IOException {
        if (spec.isRemote()) {
            return new ByteArrayInputStream(body(spec.getIdentifier()));
        }
        return Files.newInputStream(localFile(spec.getIdentifier()));
    }

    private Workbook openWorkbook(SourceSpec spec) throws IOException {
        if (spec.isRemote()) {
            try {
                return WorkbookFactory.create(new ByteArrayInputStream(body(spec.getIdentifier())));
            } catch (IOException | RuntimeException e) {
                throw new SourceAccessException(
                        "Not a readable workbook: " + spec.getIdentifier() + ": " + e.getMessage(),
                        e);
            }
        }
        return openWorkbook(localFile(spec.getIdentifier()));
    }

    private Workbook openWorkbook(Path file) {
        try {
            return WorkbookFactory.create(file.toFile(), null, true);
        } catch (IOException | RuntimeException e) {
            throw new SourceAccessException(
                    "Not a readable workbook: " + file + ": " + e.getMessage(), e);
        }
    }

    private byte[] body(String url) {
        byte[] body = bodies.get(url);
        if (body == null) {
            body = fetcher.fetch(url);
            bodies.put(url, body);
        } else {
            log.debug("Reusing fetched body of {}", url);
        }
        return body;
    }

    private Path localFile(String identifier) {
        Path path;
        try {
            path = Paths.get(identifier);
        } catch (RuntimeException e) {
            throw new SourceNotFoundException("Invalid file path: " + identifier, e);
        }
        if (!Files.isRegularFile(path)) {
            throw new SourceNotFoundException("File not found: " + identifier);
        }
        if (!Files.isReadable(path)) {
            throw new SourceNotFoundException("File is not readable: " + identifier);
        }
        return path;
    }

    private Path convertedPath(SourceSpec spec) throws IOException {
        String id = spec.getIdentifier();
        Path cached = converted.get(id);
        if (cached != null) {
            return cached;
        }
        if (!converter.isSupported()) {
            throw new ConversionException(
                    "XLS sources are not supported on this platform: " + id);
        }
        Path xls;
        if (spec.isRemote()) {
            byte[] body = body(id);
            Path dir = Files.createTempDirectory("toch-");
            tempDirs.add(dir);
            xls = dir.resolve("source.xls");
            Files.write(xls, body);
        } else {
            xls = localFile(id);
        }
        Path xlsx = converter.convertToXlsx(xls);
        converted.put(id, xlsx);
        return xlsx;
    }

    /**
     * Deletes the temporary files created by this resolver.
     */
    @Override
    public void close() {
        for (Path dir : tempDirs) {
            try {
                FileUtils.deleteDirectory(dir.toFile());
            } catch (IOException e) {
                log.warn("Failed to delete temporary directory {}: {}", dir, e.getMessage());
            }
        }
        tempDirs.clear();
    }
}
