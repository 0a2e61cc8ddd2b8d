package com.mergeql.core;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A structural foreign key discovered from the store catalog:
 * {@code table.column -> referencedTable.referencedColumn}.
 */
public record ForeignKeyEdge(
        @JsonProperty("table") String table,
        @JsonProperty("column") String column,
        @JsonProperty("referencedTable") String referencedTable,
        @JsonProperty("referencedColumn") String referencedColumn
) {
    public ColumnRef ref() {
        return new ColumnRef(table, column);
    }

    public boolean isSelfReferential() {
        return table.equalsIgnoreCase(referencedTable);
    }

    @Override
    public String toString() {
        return table + "." + column + " -> " + referencedTable + "." + referencedColumn;
    }
}
