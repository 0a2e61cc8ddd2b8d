package com.mergeql.core;

import java.util.Objects;

/**
 * A named entity type and the table that backs it.
 */
public record EntityType(String name, String table) {

    public EntityType {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(table, "table");
    }

    /**
     * Entity type whose table follows the naming rule, for types the live
     * registry no longer knows about.
     */
    public static EntityType derived(String name) {
        return new EntityType(name, deriveTableName(name));
    }

    /**
     * {@code sale.order.line} becomes {@code sale_order_line}.
     */
    public static String deriveTableName(String name) {
        return name.trim().replace('.', '_').replace('-', '_');
    }
}
