package com.mergeql.core.config;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Where the store keeps its metadata catalog.
 */
public record MetadataTables(
        @JsonProperty("modelTable") String modelTable,
        @JsonProperty("fieldTable") String fieldTable
) {
    public MetadataTables {
        modelTable = modelTable != null ? modelTable : "model_registry";
        fieldTable = fieldTable != null ? fieldTable : "model_field";
    }
}
