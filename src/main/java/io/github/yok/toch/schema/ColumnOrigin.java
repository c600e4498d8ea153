package io.github.yok.toch.schema;

/**
 * Where a column's type came from.
 */
public enum ColumnOrigin {

    // Determined by sampling the data
    INFERRED,

    // Given by the caller
    SUPPLIED
}
