package io.github.yok.toch.schema;

import io.github.yok.toch.exception.MalformedRowException;
import io.github.yok.toch.exception.SchemaMismatchException;
import io.github.yok.toch.reader.RawRow;
import io.github.yok.toch.reader.RowReader;
import io.github.yok.toch.util.CellValueParser;
import java.io.IOException;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;

/**
 * Infers column types by sampling every remaining row of a reader.
 *
 * <p>
 * For each unresolved column the non-empty (trimmed) values are counted together with those that
 * parse as a date, a 64-bit integer and a 64-bit float. The first candidate, in the order
 * {@link ColumnType#DATE}, {@link ColumnType#INT64}, {@link ColumnType#FLOAT64}, whose parsed
 * fraction reaches the acceptance threshold is chosen; otherwise the column is
 * {@link ColumnType#STRING}. A column without any non-empty value is a string column.
 * </p>
 *
 * <p>
 * Date is tried first, so an 8-digit value such as {@code 20230101} makes a date column.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public class TypeInferrer {

    private final CellValueParser parser;
    private final double threshold;
    private final boolean tolerateRowErrors;

    /**
     * Creates an inferrer.
     *
     * @param parser cell parse rules
     * @param threshold acceptance threshold in {@code (0, 1]}
     * @param tolerateRowErrors whether malformed rows are skipped instead of failing the pass
     */
    public TypeInferrer(CellValueParser parser, double threshold, boolean tolerateRowErrors) {
        if (threshold <= 0.0 || threshold > 1.0) {
            throw new IllegalArgumentException("threshold must be in (0, 1]: " + threshold);
        }
        this.parser = parser;
        this.threshold = threshold;
        this.tolerateRowErrors = tolerateRowErrors;
    }

    /**
     * Consumes the reader to its end and assigns a type to every unresolved column of the builder.
     *
     * @param reader reader positioned after the header (if any)
     * @param builder schema under construction
     * @return pass counters
     * @throws IOException if the source cannot be read
     * @throws MalformedRowException for a malformed row when tolerance is off
     * @throws SchemaMismatchException if the row width differs from the column count
     */
    public InferenceStats infer(RowReader reader, TableSchemaBuilder builder) throws IOException {
        int width = builder.size();
        long[] nonEmpty = new long[width];
        long[] dates = new long[width];
        long[] ints = new long[width];
        long[] floats = new long[width];
        long sampled = 0;
        long skipped = 0;

        while (true) {
            RawRow row;
            try {
                row = reader.next();
            } catch (MalformedRowException e) {
                if (!tolerateRowErrors) {
                    throw e;
                }
                skipped++;
                log.warn("Skipped during type inference: {}", e.getMessage());
                continue;
            }
            if (row == null) {
                break;
            }
            if (row.size() != width) {
                throw new SchemaMismatchException("Source rows have " + row.size()
                        + " columns but " + width + " column names are defined");
            }
            sampled++;
            for (int i = 0; i < width; i++) {
                if (builder.isResolved(i)) {
                    continue;
                }
                String value = StringUtils.trimToEmpty(row.get(i));
                if (value.isEmpty()) {
                    continue;
                }
                nonEmpty[i]++;
                if (parser.parseDate(value) != null) {
                    dates[i]++;
                }
                if (parser.parseInt64(value) != null) {
                    ints[i]++;
                }
                if (parser.parseFloat64(value) != null) {
                    floats[i]++;
                }
            }
        }

        for (int i = 0; i < width; i++) {
            if (builder.isResolved(i)) {
                continue;
            }
            ColumnType type = choose(nonEmpty[i], dates[i], ints[i], floats[i]);
            builder.setType(i, type, ColumnOrigin.INFERRED);
            log.info("Inferred column '{}' as {} ({} non-empty values)", builder.getName(i),
                    type.getClickHouseType(), nonEmpty[i]);
        }
        log.info("Type inference sampled {} rows, skipped {}", sampled, skipped);
        return new InferenceStats(sampled, skipped);
    }

    private ColumnType choose(long nonEmpty, long dates, long ints, long floats) {
        if (nonEmpty == 0) {
            return ColumnType.STRING;
        }
        if (accepts(dates, nonEmpty)) {
            return ColumnType.DATE;
        }
        if (accepts(ints, nonEmpty)) {
            return ColumnType.INT64;
        }
        if (accepts(floats, nonEmpty)) {
            return ColumnType.FLOAT64;
        }
        return ColumnType.STRING;
    }

    private boolean accepts(long parsed, long nonEmpty) {
        return (double) parsed / nonEmpty >= threshold;
    }
}
