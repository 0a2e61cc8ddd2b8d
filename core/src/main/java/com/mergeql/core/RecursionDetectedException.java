package com.mergeql.core;

import java.util.List;

/**
 * Merging would make the survivor its own ancestor through a self referential field.
 */
public class RecursionDetectedException extends MergeException {
    private final String entityType;
    private final String column;
    private final long survivorId;
    private final long ancestorId;

    public RecursionDetectedException(String entityType, String column, long survivorId,
                                      long ancestorId, List<Long> duplicateIds) {
        super(String.format("Merging %s %s into %d would make it its own ancestor: %s.%s reaches duplicate %d",
                entityType, duplicateIds, survivorId, entityType, column, ancestorId));
        this.entityType = entityType;
        this.column = column;
        this.survivorId = survivorId;
        this.ancestorId = ancestorId;
    }

    public String getEntityType() {
        return entityType;
    }

    public String getColumn() {
        return column;
    }

    public long getSurvivorId() {
        return survivorId;
    }

    public long getAncestorId() {
        return ancestorId;
    }
}
