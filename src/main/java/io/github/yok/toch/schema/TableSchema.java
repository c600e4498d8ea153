package io.github.yok.toch.schema;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;
import org.apache.commons.lang3.StringUtils;

/**
 * Immutable, ordered description of the destination table.
 *
 * <p>
 * Column names are non-empty and unique, and the key column is one of the columns. Instances are
 * produced by {@link TableSchemaBuilder#build()}.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Getter
@ToString
@EqualsAndHashCode
public final class TableSchema {

    // Columns in source order
    private final List<ColumnDefinition> columns;

    // Ordering key of the destination table
    private final String keyColumn;

    /**
     * Creates a schema.
     *
     * @param columns columns in source order
     * @param keyColumn ordering key; must name one of the columns
     * @throws IllegalArgumentException if a name is empty or duplicated or the key is unknown
     */
    public TableSchema(List<ColumnDefinition> columns, String keyColumn) {
        if (columns.isEmpty()) {
            throw new IllegalArgumentException("A table needs at least one column");
        }
        Set<String> seen = new HashSet<>();
        for (ColumnDefinition column : columns) {
            if (StringUtils.isEmpty(column.getName())) {
                throw new IllegalArgumentException("Column name must not be empty");
            }
            if (!seen.add(column.getName())) {
                throw new IllegalArgumentException("Duplicate column name: " + column.getName());
            }
        }
        if (!seen.contains(keyColumn)) {
            throw new IllegalArgumentException("Key column is not a column: " + keyColumn);
        }
        this.columns = Collections.unmodifiableList(new ArrayList<>(columns));
        this.keyColumn = keyColumn;
    }

    /**
     * Returns the number of columns.
     *
     * @return column count
     */
    public int size() {
        return columns.size();
    }

    /**
     * Returns the column at the given position.
     *
     * @param index 0-based position
     * @return column definition
     */
    public ColumnDefinition getColumn(int index) {
        return columns.get(index);
    }

    /**
     * Returns the column names in order.
     *
     * @return column names
     */
    public List<String> getColumnNames() {
        return columns.stream().map(ColumnDefinition::getName).collect(Collectors.toList());
    }
}
