package com.mergeql.core.config;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * A side table pointing at arbitrary entities through a {@code (type tag, id)} pair.
 * When {@code correlatingColumns} is not empty, at most one row may exist per
 * {@code (type tag, id, correlating values)}; rows that would repeat one already
 * held by the survivor are deleted instead of repointed.
 */
public record PolymorphicSubsystem(
        @JsonProperty("table") String table,
        @JsonProperty("idColumn") String idColumn,
        @JsonProperty("typeColumn") String typeColumn,
        @JsonProperty("resIdColumn") String resIdColumn,
        @JsonProperty("correlatingColumns") List<String> correlatingColumns
) {
    public PolymorphicSubsystem {
        idColumn = idColumn != null ? idColumn : "id";
        typeColumn = typeColumn != null ? typeColumn : "res_model";
        resIdColumn = resIdColumn != null ? resIdColumn : "res_id";
        correlatingColumns = correlatingColumns != null ? List.copyOf(correlatingColumns) : List.of();
    }

    public static PolymorphicSubsystem of(String table, String typeColumn) {
        return new PolymorphicSubsystem(table, null, typeColumn, null, null);
    }

    public static PolymorphicSubsystem correlated(String table, String typeColumn, String... correlatingColumns) {
        return new PolymorphicSubsystem(table, null, typeColumn, null, List.of(correlatingColumns));
    }

    public boolean isCorrelated() {
        return !correlatingColumns.isEmpty();
    }
}
