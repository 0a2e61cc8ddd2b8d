package com.mergeql.core;

/**
 * An unanticipated store failure. Always fatal for the merge call.
 */
public class MergeStoreException extends MergeException {
    public MergeStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
