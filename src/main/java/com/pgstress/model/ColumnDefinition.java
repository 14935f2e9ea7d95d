package com.pgstress.model;

import java.util.Objects;

/**
 * A generated column: its name and SQL type.
 */
public record ColumnDefinition(String name, ColumnType type) {

    public ColumnDefinition {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(type, "type");
        if (name.isBlank()) {
            throw new IllegalArgumentException("Column name must not be blank");
        }
    }

    /**
     * Renders the column as it appears inside {@code CREATE TABLE}.
     *
     * @return e.g. {@code col_3_numeric NUMERIC(10,2)}
     */
    public String ddl() {
        return name + " " + type.sqlType();
    }
}
