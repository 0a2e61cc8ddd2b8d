package com.mergeql.core;

import com.fasterxml.jackson.annotation.JsonCreator;

import java.util.Arrays;
import java.util.Locale;
import java.util.Set;

/**
 * Closed set of field categories known to the metadata catalog.
 * The relational categories describe how a field points at another entity type.
 */
public enum FieldCategory {
    SHORT_TEXT("short_text", false, "char", "string"),
    LONG_TEXT("long_text", false, "text", "html", "rich_text"),
    INTEGER("integer", false, "int", "bigint"),
    FLOAT("float", false, "monetary", "currency", "decimal", "numeric"),
    BOOLEAN("boolean", false, "bool"),
    DATE("date", false),
    DATETIME("datetime", false, "timestamp"),
    BINARY("binary", false, "blob"),
    STRUCTURED("structured", false, "serialized", "json"),
    SELECTION("selection", false, "enum"),
    SINGLE_REFERENCE("single_reference", true, "many2one"),
    MULTI_REFERENCE("multi_reference", true, "many2many"),
    REVERSE_MULTI_REFERENCE("reverse_reference", true, "one2many"),
    // "reference" names a "type,id" text column, not a foreign key
    POLYMORPHIC_REFERENCE("polymorphic_reference", true, "reference", "generic_reference");

    private final String typeName;
    private final boolean relational;
    private final Set<String> aliases;

    FieldCategory(String typeName, boolean relational, String... aliases) {
        this.typeName = typeName;
        this.relational = relational;
        this.aliases = Set.of(aliases);
    }

    public String typeName() {
        return typeName;
    }

    public boolean isRelational() {
        return relational;
    }

    /**
     * True for categories whose value lives in a column of the owning table.
     */
    public boolean isColumnBacked() {
        return this != MULTI_REFERENCE && this != REVERSE_MULTI_REFERENCE;
    }

    /**
     * Accepts the constant name as well as any type name or alias.
     */
    @JsonCreator
    public static FieldCategory fromJson(String value) {
        if (value != null) {
            for (FieldCategory category : values()) {
                if (category.name().equalsIgnoreCase(value.trim())) {
                    return category;
                }
            }
        }
        return fromTypeName(value);
    }

    public static FieldCategory fromTypeName(String name) {
        if (name == null) {
            throw new IllegalArgumentException("Field type name is required");
        }
        String normalized = name.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(c -> c.typeName.equals(normalized) || c.aliases.contains(normalized))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown field type: " + name));
    }
}
