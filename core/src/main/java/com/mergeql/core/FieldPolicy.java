package com.mergeql.core;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Caller overrides of the default reconciliation algebra.
 * <p>
 * The operations map is copied on construction; the caller's map is never
 * read again nor modified. Whether unlisted fields are reconciled is an
 * explicit flag, so every key of the map is always a field name.
 */
public final class FieldPolicy {
    private static final FieldPolicy DEFAULTS = new FieldPolicy(Map.of(), false, ValueOrder.SURVIVOR_FIRST);

    private final Map<String, MergeOperation> operations;
    private final boolean preserveUnlisted;
    private final ValueOrder order;

    private FieldPolicy(Map<String, MergeOperation> operations, boolean preserveUnlisted, ValueOrder order) {
        this.operations = Collections.unmodifiableMap(new LinkedHashMap<>(operations));
        this.preserveUnlisted = preserveUnlisted;
        this.order = order;
    }

    public static FieldPolicy defaults() {
        return DEFAULTS;
    }

    /**
     * Builds a policy from string keyed operations, e.g. {@code {"amount": "sum"}}.
     */
    public static FieldPolicy of(Map<String, String> operations) {
        Builder builder = builder();
        operations.forEach(builder::field);
        return builder.build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Optional<MergeOperation> operationFor(String field) {
        return Optional.ofNullable(operations.get(field));
    }

    /**
     * Fields not named in the policy keep the survivor's value.
     */
    public boolean preserveUnlisted() {
        return preserveUnlisted;
    }

    public boolean isListed(String field) {
        return operations.containsKey(field);
    }

    public ValueOrder order() {
        return order;
    }

    public Map<String, MergeOperation> operations() {
        return operations;
    }

    @Override
    public String toString() {
        return "FieldPolicy" + operations + (preserveUnlisted ? " preserveUnlisted" : "") + " " + order;
    }

    public static class Builder {
        private final Map<String, MergeOperation> operations = new LinkedHashMap<>();
        private boolean preserveUnlisted = false;
        private ValueOrder order = ValueOrder.SURVIVOR_FIRST;

        public Builder field(String field, MergeOperation operation) {
            operations.put(field, operation);
            return this;
        }

        public Builder field(String field, String operation) {
            MergeOperation op = MergeOperation.fromKey(operation)
                    .orElseThrow(() -> new InvalidMergeRequestException(
                            "Unknown operation '" + operation + "' for field " + field));
            return field(field, op);
        }

        public Builder preserveUnlisted(boolean preserveUnlisted) {
            this.preserveUnlisted = preserveUnlisted;
            return this;
        }

        public Builder order(ValueOrder order) {
            this.order = order;
            return this;
        }

        public FieldPolicy build() {
            return new FieldPolicy(operations, preserveUnlisted, order);
        }
    }
}
