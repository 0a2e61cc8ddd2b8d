package com.mergeql.core.config;

/**
 * What the engine does when a merge would create a hierarchy cycle.
 */
public enum RecursionPolicy {
    /** Log the refusal and report it in the merge result. */
    LOG,
    /** Propagate the {@link com.mergeql.core.RecursionDetectedException}. */
    RAISE
}
