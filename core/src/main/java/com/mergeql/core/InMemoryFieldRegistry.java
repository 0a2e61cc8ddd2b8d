package com.mergeql.core;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Field registry held in memory, built in code or deserialised from a catalog file.
 */
public class InMemoryFieldRegistry implements FieldRegistry {
    private final Map<String, EntityType> entityTypes;
    private final List<FieldMetadata> fields;

    @JsonCreator
    public InMemoryFieldRegistry(@JsonProperty("entityTypes") Map<String, EntityType> entityTypes,
                                 @JsonProperty("fields") List<FieldMetadata> fields) {
        this.entityTypes = entityTypes != null ? Map.copyOf(entityTypes) : Map.of();
        this.fields = fields != null ? List.copyOf(fields) : List.of();
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public Optional<EntityType> entityType(String name) {
        return Optional.ofNullable(entityTypes.get(name));
    }

    @Override
    public List<FieldMetadata> allFields() {
        return fields;
    }

    public static class Builder {
        private final Map<String, EntityType> entityTypes = new LinkedHashMap<>();
        private final List<FieldMetadata> fields = new ArrayList<>();

        public Builder entityType(String name, String table) {
            entityTypes.put(name, new EntityType(name, table));
            return this;
        }

        public Builder field(FieldMetadata field) {
            fields.add(field);
            return this;
        }

        public Builder fields(List<FieldMetadata> fields) {
            this.fields.addAll(fields);
            return this;
        }

        public InMemoryFieldRegistry build() {
            return new InMemoryFieldRegistry(entityTypes, fields);
        }
    }
}
