package com.mergeql.core;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

/**
 * Named value reconciliation operations a field policy may request.
 * Which operations apply to which {@link FieldCategory} is decided by
 * {@link com.mergeql.core.reconcile.ReconciliationTable}.
 */
public enum MergeOperation {
    /** Keep the survivor's current value. */
    KEEP("keep"),
    /**
     * Category specific combination: concatenation for text, union for multi
     * references, reparenting for child rows, fill-if-empty for single
     * references and binaries, key union for structured values.
     */
    MERGE("merge"),
    SUM("sum"),
    AVG("avg"),
    MAX("max"),
    MIN("min"),
    AND("and"),
    OR("or"),
    FIRST_NOT_NULL("first_not_null"),
    /** The value held by the first duplicate in request order. */
    FIRST("first");

    private final String key;

    MergeOperation(String key) {
        this.key = key;
    }

    public String key() {
        return key;
    }

    public static Optional<MergeOperation> fromKey(String key) {
        if (key == null) {
            return Optional.empty();
        }
        String normalized = key.trim().toLowerCase(Locale.ROOT).replace('-', '_');
        return Arrays.stream(values())
                .filter(op -> op.key.equals(normalized) || op.name().equalsIgnoreCase(normalized))
                .findFirst();
    }
}
