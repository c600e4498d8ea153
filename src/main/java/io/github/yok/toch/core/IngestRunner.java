package io.github.yok.toch.core;

import io.github.yok.toch.config.IngestConfig;
import io.github.yok.toch.config.IngestOptions;
import io.github.yok.toch.db.TableWriter;
import io.github.yok.toch.db.TableWriterFactory;
import io.github.yok.toch.exception.ConfigurationException;
import io.github.yok.toch.exception.SourceAccessException;
import io.github.yok.toch.reader.RowReader;
import io.github.yok.toch.schema.ColumnNamePolicy;
import io.github.yok.toch.schema.TableSchema;
import io.github.yok.toch.schema.TableSchemaBuilder;
import io.github.yok.toch.schema.TypeInferrer;
import io.github.yok.toch.source.HttpFetcher;
import io.github.yok.toch.source.SourceResolver;
import io.github.yok.toch.source.SourceSpec;
import io.github.yok.toch.source.SpreadsheetConverter;
import io.github.yok.toch.util.CellValueParser;
import io.github.yok.toch.util.DateParser;
import java.io.IOException;
import java.time.Duration;
import java.util.List;
import lombok.extern.slf4j.Slf4j;

/**
 * Runs one ingestion: resolves the source, builds the schema, creates the destination table and
 * exports the rows.
 *
 * <p>
 * <strong>Steps:</strong>
 * </p>
 * <ol>
 * <li>Resolve the source and build the schema: column names from {@code -h} or from the header row
 * (through {@link ColumnNamePolicy}), column types from {@code -t} or by {@link TypeInferrer}.</li>
 * <li>Inference consumes the whole reader, so the source is resolved a second time (HTTP bodies and
 * converted workbooks are reused) and the header row, if any, is skipped again. With supplied
 * types the first reader is exported directly.</li>
 * <li>Create the table and run the {@link Exporter}.</li>
 * </ol>
 *
 * <p>
 * Temporary files of the run are removed when it ends, whether it succeeds or not.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public class IngestRunner {

    // toch.* settings
    private final IngestConfig ingestConfig;

    // Remote source retrieval
    private final HttpFetcher fetcher;

    // Legacy XLS conversion
    private final SpreadsheetConverter converter;

    // Opens the destination writer
    private final TableWriterFactory writerFactory;

    /**
     * Creates a runner.
     *
     * @param ingestConfig ingestion settings
     * @param fetcher HTTP fetcher
     * @param converter XLS converter
     * @param writerFactory destination writer factory
     */
    public IngestRunner(IngestConfig ingestConfig, HttpFetcher fetcher,
            SpreadsheetConverter converter, TableWriterFactory writerFactory) {
        this.ingestConfig = ingestConfig;
        this.fetcher = fetcher;
        this.converter = converter;
        this.writerFactory = writerFactory;
    }

    /**
     * Executes the run.
     *
     * @param options validated run options
     * @return run outcome
     * @throws IOException if the source cannot be read
     * @throws io.github.yok.toch.exception.IngestException for any pipeline failure
     */
    public IngestResult run(IngestOptions options) throws IOException {
        long started = System.nanoTime();
        String datePattern = options.getDatePattern() != null ? options.getDatePattern()
                : ingestConfig.getDatePattern();
        int batchSize = options.getBatchSize() != null ? options.getBatchSize()
                : ingestConfig.getBatchSize();
        if (batchSize < 0) {
            throw new ConfigurationException("toch.batch-size must be non-negative: " + batchSize);
        }
        CellValueParser parser = new CellValueParser(new DateParser(datePattern));
        SourceSpec spec = options.getSource();

        log.info("Ingesting {} ({}) into table {}", spec.getIdentifier(),
                spec.getFormat().getToken(), options.getTable());

        try (SourceResolver resolver = new SourceResolver(fetcher, converter)) {
            RowReader reader = resolver.resolve(spec);
            try {
                TableSchema schema = buildSchema(reader, options, parser);

                if (!options.hasTypes()) {
                    // the schema pass consumed the reader
                    reader.close();
                    reader = null;
                    reader = resolver.resolve(spec);
                    if (!options.hasHeaderNames()) {
                        reader.readHeader();
                    }
                }

                ExportResult export;
                try (TableWriter writer = writerFactory.open(options)) {
                    writer.createTable(schema);
                    log.info("Created table {} with {} columns, key {}", options.getTable(),
                            schema.size(), schema.getKeyColumn());
                    export = new Exporter(new ValueCoercer(parser), batchSize,
                            options.isTolerateRowErrors()).export(reader, schema, writer);
                }
                Duration elapsed = Duration.ofNanos(System.nanoTime() - started);
                return new IngestResult(options.getTable(), schema, export, elapsed);
            } finally {
                if (reader != null) {
                    reader.close();
                }
            }
        }
    }

    private TableSchema buildSchema(RowReader reader, IngestOptions options,
            CellValueParser parser) throws IOException {
        TableSchemaBuilder builder;
        if (options.hasHeaderNames()) {
            builder = TableSchemaBuilder.withNames(options.getHeaderNames());
        } else {
            List<String> header = reader.readHeader();
            if (header.isEmpty()) {
                throw new SourceAccessException("Header row of " + reader.getDescription()
                        + " has no columns");
            }
            ColumnNamePolicy policy =
                    new ColumnNamePolicy(options.isCamelCase(), ingestConfig.getNaming());
            builder = TableSchemaBuilder.withNames(policy.apply(header));
        }

        if (options.hasTypes()) {
            builder.supplyTypes(options.getTypes());
        } else {
            new TypeInferrer(parser, ingestConfig.getAcceptanceThreshold(),
                    options.isTolerateRowErrors()).infer(reader, builder);
        }
        return builder.build();
    }
}
