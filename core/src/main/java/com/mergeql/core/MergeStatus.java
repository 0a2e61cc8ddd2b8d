package com.mergeql.core;

public enum MergeStatus {
    COMPLETED,
    RECURSION_DETECTED
}
