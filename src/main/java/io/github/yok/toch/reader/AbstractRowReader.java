package io.github.yok.toch.reader;

import io.github.yok.toch.exception.MalformedRowException;
import io.github.yok.toch.exception.SourceAccessException;
import java.io.IOException;
import java.util.Collections;
import java.util.List;

/**
 * Common behavior of the row readers: leading-row skipping, the header-before-data rule and the
 * row-width invariant.
 *
 * <p>
 * Subclasses only supply raw records through {@link #readRecord()}.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
public abstract class AbstractRowReader implements RowReader {

    // Leading records to discard
    private final int skip;

    // Source description for messages
    private final String description;

    private boolean skipDone;
    private boolean headerAllowed = true;
    private int width = -1;

    /**
     * Creates the base reader.
     *
     * @param description source description
     * @param skip number of leading records to discard
     */
    protected AbstractRowReader(String description, int skip) {
        this.description = description;
        this.skip = skip;
    }

    /**
     * Reads the next raw record.
     *
     * @return cells of the next record, or {@code null} at the end of the source
     * @throws IOException if the source cannot be read
     */
    protected abstract List<String> readRecord() throws IOException;

    /**
     * Returns the 1-based source row number of the record most recently returned by
     * {@link #readRecord()}.
     *
     * @return row number
     */
    protected abstract long currentRowNumber();

    @Override
    public List<String> readHeader() throws IOException {
        if (!headerAllowed) {
            throw new IllegalStateException(
                    "readHeader() must be called before the first row is read: " + description);
        }
        headerAllowed = false;
        List<String> cells = fetch();
        if (cells == null) {
            throw new SourceAccessException("No header row found in " + description);
        }
        return Collections.unmodifiableList(cells);
    }

    @Override
    public RawRow next() throws IOException {
        headerAllowed = false;
        List<String> cells = fetch();
        if (cells == null) {
            return null;
        }
        return new RawRow(currentRowNumber(), Collections.unmodifiableList(cells));
    }

    @Override
    public int getWidth() {
        return width;
    }

    @Override
    public String getDescription() {
        return description;
    }

    private List<String> fetch() throws IOException {
        if (!skipDone) {
            skipDone = true;
            for (int i = 0; i < skip; i++) {
                if (readRecord() == null) {
                    return null;
                }
            }
        }
        List<String> cells = readRecord();
        if (cells == null) {
            return null;
        }
        if (width < 0) {
            width = cells.size();
        } else if (cells.size() != width) {
            throw new MalformedRowException(currentRowNumber(), width, cells.size());
        }
        return cells;
    }
}
