package io.github.yok.toch.config;

import io.github.yok.toch.schema.ColumnType;
import io.github.yok.toch.source.SourceSpec;
import java.util.Collections;
import java.util.List;
import lombok.Builder;
import lombok.Value;

/**
 * Everything the caller supplied for one run, already validated.
 *
 * <p>
 * Nullable fields fall back to {@link IngestConfig} and {@link ConnectionConfig}.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Value
@Builder
public class IngestOptions {

    // Data source
    SourceSpec source;

    // Destination table
    String table;

    // Column names; empty = read from the first row
    @Builder.Default
    List<String> headerNames = Collections.emptyList();

    // Column types; empty = infer from the data
    @Builder.Default
    List<ColumnType> types = Collections.emptyList();

    // Convert header names to camel case
    boolean camelCase;

    // Skip malformed and rejected rows instead of aborting
    boolean tolerateRowErrors;

    // Date pattern; null = toch.date-pattern
    String datePattern;

    // Rows per batch; null = toch.batch-size
    Integer batchSize;

    // Connection overrides; null = clickhouse.*
    String host;
    String user;
    String password;

    // Only print usage
    boolean help;

    /**
     * Returns whether column names are supplied by the caller.
     *
     * @return {@code true} when {@code -h} was given
     */
    public boolean hasHeaderNames() {
        return !headerNames.isEmpty();
    }

    /**
     * Returns whether column types are supplied by the caller.
     *
     * @return {@code true} when {@code -t} was given
     */
    public boolean hasTypes() {
        return !types.isEmpty();
    }
}
