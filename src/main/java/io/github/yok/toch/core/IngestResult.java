package io.github.yok.toch.core;

import io.github.yok.toch.schema.TableSchema;
import java.time.Duration;
import lombok.Value;

/**
 * Outcome of one ingestion run.
 */
@Value
public class IngestResult {

    // Destination table
    String table;

    // Final schema used to create the table
    TableSchema schema;

    ExportResult export;

    // Wall-clock time of the run
    Duration elapsed;
}
