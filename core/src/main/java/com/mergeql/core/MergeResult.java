package com.mergeql.core;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Outcome of one merge call.
 */
public record MergeResult(
        @JsonProperty("status") MergeStatus status,
        @JsonProperty("entityType") String entityType,
        @JsonProperty("survivorId") long survivorId,
        @JsonProperty("duplicateIds") List<Long> duplicateIds,
        @JsonProperty("referencesRelinked") int referencesRelinked,
        @JsonProperty("conflictsDropped") int conflictsDropped,
        @JsonProperty("fieldsWritten") List<String> fieldsWritten,
        @JsonProperty("recordsDeleted") int recordsDeleted,
        @JsonProperty("message") String message
) {
    public MergeResult {
        duplicateIds = duplicateIds != null ? List.copyOf(duplicateIds) : List.of();
        fieldsWritten = fieldsWritten != null ? List.copyOf(fieldsWritten) : List.of();
    }

    public static MergeResult completed(MergeRequest request, int referencesRelinked, int conflictsDropped,
                                        List<String> fieldsWritten, int recordsDeleted) {
        return new MergeResult(MergeStatus.COMPLETED, request.entityType(), request.survivorId(),
                request.duplicateIds(), referencesRelinked, conflictsDropped, fieldsWritten, recordsDeleted, null);
    }

    public static MergeResult refused(MergeRequest request, int referencesRelinked, int conflictsDropped,
                                      RecursionDetectedException cause) {
        return new MergeResult(MergeStatus.RECURSION_DETECTED, request.entityType(), request.survivorId(),
                request.duplicateIds(), referencesRelinked, conflictsDropped, List.of(), 0, cause.getMessage());
    }

    public boolean isCompleted() {
        return status == MergeStatus.COMPLETED;
    }
}
