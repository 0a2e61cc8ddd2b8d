package com.mergeql.core;

/**
 * A malformed merge request. Raised before any statement is executed.
 */
public class InvalidMergeRequestException extends MergeException {
    public InvalidMergeRequestException(String message) {
        super(message);
    }
}
