package io.github.yok.toch.reader;

import java.io.Closeable;
import java.io.IOException;
import java.util.List;

/**
 * Lazy, finite, one-pass sequence of rows read from a source.
 *
 * <p>
 * A reader cannot be rewound. A second pass over the same data requires a new reader from
 * {@link io.github.yok.toch.source.SourceResolver#resolve}.
 * </p>
 *
 * <p>
 * The first observed row (header or data) fixes the row width. A later row of a different width
 * raises {@link io.github.yok.toch.exception.MalformedRowException}; that row is consumed and the
 * reader remains usable.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
public interface RowReader extends Closeable {

    /**
     * Reads the first row as column names. Consumes exactly one row and must be called before
     * {@link #next()}.
     *
     * @return header cells, never {@code null}
     * @throws IOException if the source cannot be read
     * @throws IllegalStateException if rows have already been read
     * @throws io.github.yok.toch.exception.SourceAccessException if the source has no rows
     */
    List<String> readHeader() throws IOException;

    /**
     * Reads the next row.
     *
     * @return next row, or {@code null} at the end of the stream
     * @throws IOException if the source cannot be read
     * @throws io.github.yok.toch.exception.MalformedRowException if the row width differs from
     *         the established width
     */
    RawRow next() throws IOException;

    /**
     * Returns the width fixed by the first observed row.
     *
     * @return row width, or {@code -1} before any row has been read
     */
    int getWidth();

    /**
     * Returns a human-readable description of the source for logs and messages.
     *
     * @return description
     */
    String getDescription();
}
