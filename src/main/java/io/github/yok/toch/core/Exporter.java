package io.github.yok.toch.core;

import io.github.yok.toch.db.TableWriter;
import io.github.yok.toch.exception.ExportException;
import io.github.yok.toch.exception.IngestException;
import io.github.yok.toch.exception.MalformedRowException;
import io.github.yok.toch.exception.RowRejectedException;
import io.github.yok.toch.exception.SchemaMismatchException;
import io.github.yok.toch.reader.RawRow;
import io.github.yok.toch.reader.RowReader;
import io.github.yok.toch.schema.CoercedRow;
import io.github.yok.toch.schema.TableSchema;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;

/**
 * Streams rows from a reader, coerces them and writes them to a {@link TableWriter} in batches.
 *
 * <p>
 * <strong>Pipeline:</strong>
 * </p>
 * <ul>
 * <li>The calling thread reads and coerces rows and groups them into batches of
 * {@code batchSize} rows ({@code 0} = one batch for the whole source).</li>
 * <li>A full batch is handed to a single writer thread. The next batch is built while the
 * previous one is written; before a batch is handed over the previous one must be complete, so
 * batches reach the destination in read order and at most one is in flight.</li>
 * <li>The writer appends each row and then flushes the batch.</li>
 * </ul>
 *
 * <p>
 * <strong>Failures:</strong>
 * </p>
 * <ul>
 * <li>Malformed row (width differs from the schema): skipped and counted when row errors are
 * tolerated, otherwise fatal.</li>
 * <li>{@link RowRejectedException} from the writer, raised by {@code append} or by {@code flush}
 * when the destination refuses a row: skipped and counted when tolerated. Otherwise the rows before
 * it in the batch are written and the export aborts with {@link ExportException}, so the
 * destination holds exactly the rows preceding the rejected one.</li>
 * <li>Any other failure on either side aborts the export; the in-flight batch is cancelled and the
 * writer thread is always shut down.</li>
 * </ul>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public class Exporter {

    private final ValueCoercer coercer;
    private final int batchSize;
    private final boolean tolerateRowErrors;

    /**
     * Creates an exporter.
     *
     * @param coercer value coercion
     * @param batchSize rows per batch; {@code 0} writes a single batch
     * @param tolerateRowErrors whether malformed and rejected rows are skipped
     */
    public Exporter(ValueCoercer coercer, int batchSize, boolean tolerateRowErrors) {
        if (batchSize < 0) {
            throw new IllegalArgumentException("batchSize must be non-negative: " + batchSize);
        }
        this.coercer = coercer;
        this.batchSize = batchSize;
        this.tolerateRowErrors = tolerateRowErrors;
    }

    @Value
    private static class BatchOutcome {
        int written;
        int rejected;
    }

    /**
     * Exports every remaining row of the reader.
     *
     * @param reader reader positioned at the first data row
     * @param schema destination schema
     * @param writer destination with the table already created
     * @return export counters
     * @throws IOException if the source cannot be read
     * @throws MalformedRowException for a malformed row when tolerance is off
     * @throws SchemaMismatchException if the first row's width differs from the schema
     * @throws ExportException if a row is rejected when tolerance is off
     * @throws io.github.yok.toch.exception.DestinationException if the destination fails
     */
    public ExportResult export(RowReader reader, TableSchema schema, TableWriter writer)
            throws IOException {
        ExecutorService executor = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "toch-writer");
            t.setDaemon(true);
            return t;
        });
        Future<BatchOutcome> inFlight = null;
        long read = 0;
        long written = 0;
        long skipped = 0;
        int batches = 0;
        List<CoercedRow> batch = new ArrayList<>();

        try {
            while (true) {
                RawRow raw;
                try {
                    raw = reader.next();
                } catch (MalformedRowException e) {
                    read++;
                    skipped += skipOrThrow(e);
                    continue;
                }
                if (raw == null) {
                    break;
                }
                read++;
                if (raw.size() != schema.size()) {
                    if (read == 1) {
                        throw new SchemaMismatchException("Source rows have " + raw.size()
                                + " columns but the table has " + schema.size());
                    }
                    skipped += skipOrThrow(new MalformedRowException(raw.getRowNumber(),
                            schema.size(), raw.size()));
                    continue;
                }
                batch.add(coercer.coerce(raw, schema));

                if (batchSize > 0 && batch.size() >= batchSize) {
                    BatchOutcome previous = await(inFlight);
                    if (previous != null) {
                        written += previous.getWritten();
                        skipped += previous.getRejected();
                        batches++;
                    }
                    inFlight = executor.submit(writeTask(batch, writer));
                    batch = new ArrayList<>(batchSize);
                    log.debug("Handed batch {} to the writer ({} rows read)", batches + 1, read);
                }
            }

            BatchOutcome previous = await(inFlight);
            inFlight = null;
            if (previous != null) {
                written += previous.getWritten();
                skipped += previous.getRejected();
                batches++;
            }
            if (!batch.isEmpty()) {
                BatchOutcome last = await(executor.submit(writeTask(batch, writer)));
                written += last.getWritten();
                skipped += last.getRejected();
                batches++;
            }
        } finally {
            if (inFlight != null && !inFlight.isDone()) {
                inFlight.cancel(true);
            }
            executor.shutdownNow();
        }

        log.info("Export finished: {} rows read, {} written, {} skipped, {} batches", read,
                written, skipped, batches);
        return new ExportResult(read, written, skipped, batches);
    }

    private int skipOrThrow(MalformedRowException e) {
        if (!tolerateRowErrors) {
            throw e;
        }
        log.warn("Skipped: {}", e.getMessage());
        return 1;
    }

    private Callable<BatchOutcome> writeTask(List<CoercedRow> rows, TableWriter writer) {
        return () -> {
            int ok = 0;
            int rejected = 0;
            for (CoercedRow row : rows) {
                try {
                    writer.append(row);
                    ok++;
                } catch (RowRejectedException e) {
                    if (!tolerateRowErrors) {
                        flush(writer);
                        throw new ExportException("Export aborted at source row "
                                + e.getRowNumber() + ": " + e.getMessage(), e);
                    }
                    rejected++;
                    log.warn("Skipped: {}", e.getMessage());
                }
            }
            int refused = flush(writer);
            return new BatchOutcome(ok - refused, rejected + refused);
        };
    }

    // Flushes until the batch is through; returns the number of rows the destination refused
    private int flush(TableWriter writer) {
        int refused = 0;
        while (true) {
            try {
                writer.flush();
                return refused;
            } catch (RowRejectedException e) {
                if (!tolerateRowErrors) {
                    throw new ExportException("Export aborted at source row " + e.getRowNumber()
                            + ": " + e.getMessage(), e);
                }
                refused++;
                log.warn("Skipped: {}", e.getMessage());
            }
        }
    }

    private static BatchOutcome await(Future<BatchOutcome> future) {
        if (future == null) {
            return null;
        }
        try {
            return future.get();
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof IngestException) {
                throw (IngestException) cause;
            }
            if (cause instanceof Error) {
                throw (Error) cause;
            }
            throw new ExportException("Writer failed: " + cause.getMessage(), cause);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ExportException("Interrupted while waiting for the writer", e);
        }
    }
}
