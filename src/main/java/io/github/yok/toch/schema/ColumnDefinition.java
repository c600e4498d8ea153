package io.github.yok.toch.schema;

import lombok.Value;

/**
 * One destination column: name, type, sentinel and the origin of its type.
 *
 * @author Yasuharu.Okawauchi
 */
@Value
public class ColumnDefinition {

    String name;

    ColumnType type;

    // Value written when a cell is empty or unparseable
    Object illegalValue;

    ColumnOrigin origin;

    /**
     * Creates a definition whose sentinel is the type's fixed sentinel.
     *
     * @param name column name
     * @param type column type
     * @param origin type origin
     * @return column definition
     */
    public static ColumnDefinition of(String name, ColumnType type, ColumnOrigin origin) {
        return new ColumnDefinition(name, type, type.getIllegalValue(), origin);
    }
}
