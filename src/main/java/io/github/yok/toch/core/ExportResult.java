package io.github.yok.toch.core;

import lombok.Value;

/**
 * Counters of one export.
 *
 * <p>
 * {@code rowsRead == rowsWritten + rowsSkipped} for a completed export.
 * </p>
 */
@Value
public class ExportResult {

    // Rows obtained from the reader, malformed ones included
    long rowsRead;

    long rowsWritten;

    // Malformed or rejected rows skipped under row-error tolerance
    long rowsSkipped;

    // Batches flushed to the destination
    int batches;
}
