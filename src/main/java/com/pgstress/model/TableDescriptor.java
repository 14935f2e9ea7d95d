package com.pgstress.model;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * A provisioned stress table: its name and the ordered generated columns.
 *
 * <p>The surrogate key and the two timestamp columns are not listed here; they
 * are filled in by the database.
 */
public record TableDescriptor(String name, List<ColumnDefinition> columns) {

    public TableDescriptor {
        Objects.requireNonNull(name, "name");
        columns = List.copyOf(columns);
    }

    /**
     * Returns the first INTEGER or BIGINT column, the one bulk updates increment.
     *
     * @return the first updatable column, if any
     */
    public Optional<ColumnDefinition> firstUpdatableColumn() {
        return columns.stream()
            .filter(column -> column.type().isUpdatable())
            .findFirst();
    }

    public int columnCount() {
        return columns.size();
    }
}
