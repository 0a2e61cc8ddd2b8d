package com.mergeql.core;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * Catalog entry for one field of one entity type.
 *
 * @param model         owning entity type name
 * @param name          field name, which is also the column name for column backed categories
 * @param category      declared type
 * @param relation      target entity type for relational categories, otherwise null
 * @param stored        whether the value is physically stored
 * @param computed      whether the value is derived from other fields
 * @param relationTable junction table of a multi reference
 * @param column1       junction column holding the owner id
 * @param column2       junction column holding the target id
 * @param inverseName   column on the target table pointing back at the owner, for reverse references
 */
public record FieldMetadata(
        @JsonProperty("model") String model,
        @JsonProperty("name") String name,
        @JsonProperty("category") FieldCategory category,
        @JsonProperty("relation") String relation,
        @JsonProperty("stored") boolean stored,
        @JsonProperty("computed") boolean computed,
        @JsonProperty("relationTable") String relationTable,
        @JsonProperty("column1") String column1,
        @JsonProperty("column2") String column2,
        @JsonProperty("inverseName") String inverseName
) {
    public FieldMetadata {
        Objects.requireNonNull(model, "model");
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(category, "category");
    }

    /**
     * Catalog file entry; {@code stored} defaults to true and {@code computed} to false.
     */
    @JsonCreator
    static FieldMetadata fromJson(@JsonProperty("model") String model,
                                  @JsonProperty("name") String name,
                                  @JsonProperty("category") FieldCategory category,
                                  @JsonProperty("relation") String relation,
                                  @JsonProperty("stored") Boolean stored,
                                  @JsonProperty("computed") Boolean computed,
                                  @JsonProperty("relationTable") String relationTable,
                                  @JsonProperty("column1") String column1,
                                  @JsonProperty("column2") String column2,
                                  @JsonProperty("inverseName") String inverseName) {
        return new FieldMetadata(model, name, category, relation,
                stored == null || stored, computed != null && computed,
                relationTable, column1, column2, inverseName);
    }

    public static FieldMetadata scalar(String model, String name, FieldCategory category) {
        return new FieldMetadata(model, name, category, null, true, false, null, null, null, null);
    }

    public static FieldMetadata reference(String model, String name, String target) {
        return new FieldMetadata(model, name, FieldCategory.SINGLE_REFERENCE, target, true, false,
                null, null, null, null);
    }

    public static FieldMetadata multiReference(String model, String name, String target,
                                               String relationTable, String column1, String column2) {
        return new FieldMetadata(model, name, FieldCategory.MULTI_REFERENCE, target, true, false,
                relationTable, column1, column2, null);
    }

    public static FieldMetadata reverseReference(String model, String name, String target, String inverseName) {
        return new FieldMetadata(model, name, FieldCategory.REVERSE_MULTI_REFERENCE, target, true, false,
                null, null, null, inverseName);
    }

    public static FieldMetadata polymorphicReference(String model, String name) {
        return new FieldMetadata(model, name, FieldCategory.POLYMORPHIC_REFERENCE, null, true, false,
                null, null, null, null);
    }

    public FieldMetadata asComputed() {
        return new FieldMetadata(model, name, category, relation, stored, true,
                relationTable, column1, column2, inverseName);
    }

    public FieldMetadata asNotStored() {
        return new FieldMetadata(model, name, category, relation, false, computed,
                relationTable, column1, column2, inverseName);
    }

    /**
     * Only stored, non-computed fields take part in a merge.
     */
    public boolean isMergeable() {
        return stored && !computed;
    }

    public boolean targets(String entityType) {
        return relation != null && relation.equals(entityType);
    }

    public boolean isSelfReferential() {
        return category == FieldCategory.SINGLE_REFERENCE && targets(model);
    }
}
