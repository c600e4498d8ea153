package io.github.yok.toch.db;

import io.github.yok.toch.exception.DestinationException;
import io.github.yok.toch.exception.RowRejectedException;
import io.github.yok.toch.exception.TableCreationException;
import io.github.yok.toch.schema.CoercedRow;
import io.github.yok.toch.schema.TableSchema;
import java.io.Closeable;

/**
 * Destination boundary of the export: creates the table and writes rows in batches.
 *
 * <p>
 * Rows appended since the last {@link #flush()} form one batch. Implementations are used from one
 * thread at a time.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
public interface TableWriter extends Closeable {

    /**
     * Creates the destination table.
     *
     * @param schema table schema
     * @throws TableCreationException if the table cannot be created
     */
    void createTable(TableSchema schema);

    /**
     * Adds a row to the current batch.
     *
     * @param row coerced row
     * @throws RowRejectedException if this row cannot be accepted; the batch is unaffected
     * @throws DestinationException if the destination is unusable
     */
    void append(CoercedRow row);

    /**
     * Sends the current batch.
     *
     * <p>
     * When the destination refuses a row of the batch while staying usable, the rows before it are
     * written, the refused row is dropped and a {@link RowRejectedException} naming it is thrown.
     * The rows after it remain pending; calling {@code flush()} again continues with them. No row
     * may be appended until a {@code flush()} call has returned normally.
     * </p>
     *
     * @throws RowRejectedException if the destination refused a row of the batch
     * @throws DestinationException if the batch cannot be written
     */
    void flush();

    /**
     * Releases the destination resources.
     */
    @Override
    void close();
}
