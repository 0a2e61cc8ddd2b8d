package com.mergeql.core;

/**
 * Base class of every error the merge engine raises.
 */
public class MergeException extends RuntimeException {
    public MergeException(String message) {
        super(message);
    }

    public MergeException(String message, Throwable cause) {
        super(message, cause);
    }
}
