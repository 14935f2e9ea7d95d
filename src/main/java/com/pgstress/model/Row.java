package com.pgstress.model;

import java.util.List;

/**
 * One generated row, values ordered like the owning table's columns.
 */
public record Row(List<Object> values) {

    public Row {
        values = List.copyOf(values);
    }

    public int arity() {
        return values.size();
    }

    public Object get(int index) {
        return values.get(index);
    }
}
