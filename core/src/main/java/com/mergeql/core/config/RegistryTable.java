package com.mergeql.core.config;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A registry keyed by entity type name and row id, such as external
 * identifiers or attachments.
 */
public record RegistryTable(
        @JsonProperty("table") String table,
        @JsonProperty("typeColumn") String typeColumn,
        @JsonProperty("resIdColumn") String resIdColumn
) {
    public RegistryTable {
        typeColumn = typeColumn != null ? typeColumn : "res_model";
        resIdColumn = resIdColumn != null ? resIdColumn : "res_id";
    }
}
