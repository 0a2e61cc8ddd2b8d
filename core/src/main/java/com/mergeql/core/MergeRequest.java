package com.mergeql.core;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * One merge: fold {@code duplicateIds} of {@code entityType} into {@code survivorId}.
 *
 * @param entityType      entity type name as known to the metadata catalog
 * @param duplicateIds    ids to merge away, in caller order, without repeats
 * @param survivorId      id that remains
 * @param policy          value reconciliation overrides
 * @param mode            ORM facade or direct statements
 * @param delete          whether the duplicates are deleted at the end
 * @param excludedColumns referencing {@code (table, column)} pairs left untouched
 * @param tableName       explicit backing table, overriding registry lookup
 * @param renameTypeTo    new type tag written on polymorphic rows, or null
 */
public record MergeRequest(
        String entityType,
        List<Long> duplicateIds,
        long survivorId,
        FieldPolicy policy,
        MergeMode mode,
        boolean delete,
        Set<ColumnRef> excludedColumns,
        String tableName,
        String renameTypeTo
) {
    public MergeRequest {
        if (entityType == null || entityType.isBlank()) {
            throw new InvalidMergeRequestException("Entity type is required");
        }
        if (duplicateIds == null || duplicateIds.isEmpty()) {
            throw new InvalidMergeRequestException("At least one duplicate id is required");
        }
        List<Long> distinct = new ArrayList<>(new LinkedHashSet<>(duplicateIds));
        for (Long id : distinct) {
            if (id == null || id <= 0) {
                throw new InvalidMergeRequestException("Invalid duplicate id: " + id);
            }
        }
        if (survivorId <= 0) {
            throw new InvalidMergeRequestException("Invalid survivor id: " + survivorId);
        }
        if (distinct.contains(survivorId)) {
            throw new InvalidMergeRequestException(
                    "Survivor " + survivorId + " is among the duplicates " + distinct);
        }
        duplicateIds = List.copyOf(distinct);
        policy = policy != null ? policy : FieldPolicy.defaults();
        mode = mode != null ? mode : MergeMode.ORM;
        excludedColumns = excludedColumns != null ? Set.copyOf(excludedColumns) : Set.of();
    }

    public static Builder builder(String entityType) {
        return new Builder(entityType);
    }

    public boolean isExcluded(String table, String column) {
        return excludedColumns.contains(new ColumnRef(table, column));
    }

    /**
     * Duplicates followed by the survivor.
     */
    public List<Long> allIds() {
        List<Long> ids = new ArrayList<>(duplicateIds);
        ids.add(survivorId);
        return ids;
    }

    public static class Builder {
        private final String entityType;
        private final List<Long> duplicateIds = new ArrayList<>();
        private long survivorId;
        private FieldPolicy policy = FieldPolicy.defaults();
        private MergeMode mode = MergeMode.ORM;
        private boolean delete = true;
        private final Set<ColumnRef> excludedColumns = new LinkedHashSet<>();
        private String tableName;
        private String renameTypeTo;

        private Builder(String entityType) {
            this.entityType = entityType;
        }

        public Builder duplicates(Collection<Long> ids) {
            this.duplicateIds.addAll(ids);
            return this;
        }

        public Builder duplicates(Long... ids) {
            return duplicates(List.of(ids));
        }

        public Builder survivor(long survivorId) {
            this.survivorId = survivorId;
            return this;
        }

        public Builder policy(FieldPolicy policy) {
            this.policy = policy;
            return this;
        }

        public Builder mode(MergeMode mode) {
            this.mode = mode;
            return this;
        }

        public Builder delete(boolean delete) {
            this.delete = delete;
            return this;
        }

        public Builder exclude(String table, String column) {
            this.excludedColumns.add(new ColumnRef(table, column));
            return this;
        }

        public Builder exclude(ColumnRef column) {
            this.excludedColumns.add(column);
            return this;
        }

        public Builder tableName(String tableName) {
            this.tableName = tableName;
            return this;
        }

        public Builder renameTypeTo(String renameTypeTo) {
            this.renameTypeTo = renameTypeTo;
            return this;
        }

        public MergeRequest build() {
            return new MergeRequest(entityType, duplicateIds, survivorId, policy, mode, delete,
                    excludedColumns, tableName, renameTypeTo);
        }
    }
}
