package com.mergeql.core;

import java.util.List;
import java.util.Optional;

/**
 * Read access to the metadata catalog describing entity types and their fields.
 */
public interface FieldRegistry {

    /**
     * The registered entity type, or empty when the registry no longer knows it.
     */
    Optional<EntityType> entityType(String name);

    List<FieldMetadata> allFields();

    default List<FieldMetadata> fields(String model) {
        return allFields().stream()
                .filter(f -> f.model().equals(model))
                .toList();
    }

    /**
     * Relational fields of any entity type whose declared target is {@code model}.
     */
    default List<FieldMetadata> fieldsTargeting(String model) {
        return allFields().stream()
                .filter(f -> f.category().isRelational() && f.targets(model))
                .toList();
    }

    default List<FieldMetadata> fieldsOfCategory(FieldCategory category) {
        return allFields().stream()
                .filter(f -> f.category() == category)
                .toList();
    }

    /**
     * Registered entity type or the one derived from its name.
     */
    default EntityType resolve(String name) {
        return entityType(name).orElseGet(() -> EntityType.derived(name));
    }
}
