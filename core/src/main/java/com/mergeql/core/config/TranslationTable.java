package com.mergeql.core.config;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Table holding per locale values of translatable fields.
 */
public record TranslationTable(
        @JsonProperty("table") String table,
        @JsonProperty("idColumn") String idColumn,
        @JsonProperty("typeColumn") String typeColumn,
        @JsonProperty("fieldColumn") String fieldColumn,
        @JsonProperty("resIdColumn") String resIdColumn,
        @JsonProperty("langColumn") String langColumn
) {
    public TranslationTable {
        table = table != null ? table : "translation";
        idColumn = idColumn != null ? idColumn : "id";
        typeColumn = typeColumn != null ? typeColumn : "res_model";
        fieldColumn = fieldColumn != null ? fieldColumn : "field_name";
        resIdColumn = resIdColumn != null ? resIdColumn : "res_id";
        langColumn = langColumn != null ? langColumn : "lang";
    }
}
