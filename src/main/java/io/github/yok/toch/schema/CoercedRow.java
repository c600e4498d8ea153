package io.github.yok.toch.schema;

import java.util.List;
import lombok.Value;

/**
 * Row of typed values aligned to a {@link TableSchema}: {@link String}, {@link Long},
 * {@link Double} or {@link java.time.LocalDate}, one per column.
 */
@Value
public class CoercedRow {

    // Source row number, kept for messages
    long rowNumber;

    List<Object> values;
}
