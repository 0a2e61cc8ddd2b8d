package com.mergeql.core;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * A {@code (table, column)} pair, used for exclusions and extra reference columns.
 */
public record ColumnRef(
        @JsonProperty("table") String table,
        @JsonProperty("column") String column
) {
    @JsonCreator
    public ColumnRef {
        Objects.requireNonNull(table, "table");
        Objects.requireNonNull(column, "column");
    }

    /**
     * Parses {@code table.column}.
     */
    public static ColumnRef parse(String value) {
        int dot = value == null ? -1 : value.lastIndexOf('.');
        if (dot <= 0 || dot == value.length() - 1) {
            throw new IllegalArgumentException("Expected table.column but got: " + value);
        }
        return new ColumnRef(value.substring(0, dot), value.substring(dot + 1));
    }

    @Override
    public String toString() {
        return table + "." + column;
    }
}
