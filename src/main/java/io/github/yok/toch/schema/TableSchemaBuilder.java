package io.github.yok.toch.schema;

import io.github.yok.toch.exception.SchemaMismatchException;
import java.util.ArrayList;
import java.util.List;
import lombok.AllArgsConstructor;

/**
 * Mutable staging object used while the header is processed and column types are resolved.
 *
 * <p>
 * Columns start with an unresolved type unless one is supplied. {@link #build()} produces the
 * immutable {@link TableSchema}; the key column is the first column.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
public class TableSchemaBuilder {

    private final List<Slot> slots = new ArrayList<>();

    @AllArgsConstructor
    private static final class Slot {
        private String name;
        private ColumnType type;
        private ColumnOrigin origin;
    }

    /**
     * Creates a builder with one unresolved column per name.
     *
     * @param names column names in order
     * @return builder
     */
    public static TableSchemaBuilder withNames(List<String> names) {
        TableSchemaBuilder builder = new TableSchemaBuilder();
        names.forEach(builder::addColumn);
        return builder;
    }

    /**
     * Appends a column with an unresolved type.
     *
     * @param name column name
     * @return this builder
     */
    public TableSchemaBuilder addColumn(String name) {
        slots.add(new Slot(name, null, null));
        return this;
    }

    /**
     * Returns the number of columns.
     *
     * @return column count
     */
    public int size() {
        return slots.size();
    }

    /**
     * Returns the name of a column.
     *
     * @param index 0-based position
     * @return column name
     */
    public String getName(int index) {
        return slots.get(index).name;
    }

    /**
     * Renames a column.
     *
     * @param index 0-based position
     * @param name new name
     * @return this builder
     */
    public TableSchemaBuilder rename(int index, String name) {
        slots.get(index).name = name;
        return this;
    }

    /**
     * Returns the type of a column.
     *
     * @param index 0-based position
     * @return type, or {@code null} while unresolved
     */
    public ColumnType getType(int index) {
        return slots.get(index).type;
    }

    /**
     * Returns whether the column type has been resolved.
     *
     * @param index 0-based position
     * @return {@code true} if a type is set
     */
    public boolean isResolved(int index) {
        return slots.get(index).type != null;
    }

    /**
     * Returns whether every column has a type.
     *
     * @return {@code true} when fully resolved
     */
    public boolean isFullyResolved() {
        return slots.stream().allMatch(s -> s.type != null);
    }

    /**
     * Sets a column type.
     *
     * @param index 0-based position
     * @param type column type
     * @param origin type origin
     * @return this builder
     */
    public TableSchemaBuilder setType(int index, ColumnType type, ColumnOrigin origin) {
        Slot slot = slots.get(index);
        slot.type = type;
        slot.origin = origin;
        return this;
    }

    /**
     * Applies caller-supplied types to every column, in order.
     *
     * @param types one type per column
     * @return this builder
     * @throws SchemaMismatchException if the list length differs from the column count
     */
    public TableSchemaBuilder supplyTypes(List<ColumnType> types) {
        if (types.size() != slots.size()) {
            throw new SchemaMismatchException("Type list has " + types.size()
                    + " entries but the table has " + slots.size() + " columns");
        }
        for (int i = 0; i < types.size(); i++) {
            setType(i, types.get(i), ColumnOrigin.SUPPLIED);
        }
        return this;
    }

    /**
     * Produces the immutable schema.
     *
     * @return table schema
     * @throws SchemaMismatchException if a column type is unresolved, or a name is empty or
     *         duplicated
     */
    public TableSchema build() {
        if (slots.isEmpty()) {
            throw new SchemaMismatchException("The source has no columns");
        }
        List<ColumnDefinition> columns = new ArrayList<>(slots.size());
        for (Slot slot : slots) {
            if (slot.type == null) {
                throw new SchemaMismatchException(
                        "Type of column '" + slot.name + "' is unresolved");
            }
            columns.add(ColumnDefinition.of(slot.name, slot.type, slot.origin));
        }
        try {
            return new TableSchema(columns, slots.get(0).name);
        } catch (IllegalArgumentException e) {
            throw new SchemaMismatchException(e.getMessage(), e);
        }
    }
}
