package com.mergeql.core;

/**
 * Entry point for merging duplicate entity instances into a survivor.
 */
public interface MergeEngine {

    /**
     * Runs the merge in its own transaction.
     *
     * @throws InvalidMergeRequestException never reached here: requests are validated on construction
     * @throws RecursionDetectedException   when configured to raise on recursion
     * @throws MergeStoreException          on any unanticipated store error, after rollback
     */
    MergeResult merge(MergeRequest request);
}
