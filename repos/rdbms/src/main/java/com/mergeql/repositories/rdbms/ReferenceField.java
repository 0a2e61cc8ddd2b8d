package com.mergeql.repositories.rdbms;

import com.mergeql.core.FieldMetadata;

/**
 * A relational field together with the table its owning entity type lives in.
 */
public record ReferenceField(FieldMetadata field, String table) {

    public String model() {
        return field.model();
    }

    public String column() {
        return field.name();
    }

    /**
     * Table holding the value: the junction table for multi references.
     */
    public String storageTable() {
        return field.relationTable() != null ? field.relationTable() : table;
    }
}
