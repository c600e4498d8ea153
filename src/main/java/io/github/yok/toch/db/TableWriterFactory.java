package io.github.yok.toch.db;

import io.github.yok.toch.config.IngestOptions;

/**
 * Opens a {@link TableWriter} for one run.
 *
 * @author Yasuharu.Okawauchi
 */
@FunctionalInterface
public interface TableWriterFactory {

    /**
     * Opens a writer for the destination table named in the options.
     *
     * @param options run options (table name and connection overrides)
     * @return open writer
     * @throws io.github.yok.toch.exception.DestinationException if the destination is unreachable
     */
    TableWriter open(IngestOptions options);
}
