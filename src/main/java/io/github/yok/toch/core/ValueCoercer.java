package io.github.yok.toch.core;

import io.github.yok.toch.reader.RawRow;
import io.github.yok.toch.schema.CoercedRow;
import io.github.yok.toch.schema.ColumnDefinition;
import io.github.yok.toch.schema.TableSchema;
import io.github.yok.toch.util.CellValueParser;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.apache.commons.lang3.StringUtils;

/**
 * Converts raw string cells to typed values, substituting each column's illegal-value sentinel for
 * blank, absent or unparseable cells.
 *
 * <p>
 * Coercion never fails. Numbers and dates are trimmed before parsing; strings are kept as read.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@RequiredArgsConstructor
public class ValueCoercer {

    private final CellValueParser parser;

    /**
     * Coerces a row to the schema.
     *
     * @param row raw row
     * @param schema destination schema
     * @return row with one typed value per schema column
     */
    public CoercedRow coerce(RawRow row, TableSchema schema) {
        List<Object> values = new ArrayList<>(schema.size());
        for (int i = 0; i < schema.size(); i++) {
            values.add(coerceCell(row.get(i), schema.getColumn(i)));
        }
        return new CoercedRow(row.getRowNumber(), Collections.unmodifiableList(values));
    }

    /**
     * Coerces a single cell.
     *
     * @param cell cell text, or {@code null} when absent
     * @param column destination column
     * @return typed value or the column's sentinel
     */
    public Object coerceCell(String cell, ColumnDefinition column) {
        if (StringUtils.isBlank(cell)) {
            return column.getIllegalValue();
        }
        Object value;
        switch (column.getType()) {
            case INT64:
                value = parser.parseInt64(cell);
                break;
            case FLOAT64:
                value = parser.parseFloat64(cell);
                break;
            case DATE:
                value = parser.parseDate(cell);
                break;
            default:
                value = cell;
                break;
        }
        return value != null ? value : column.getIllegalValue();
    }
}
