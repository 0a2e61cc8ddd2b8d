package com.mergeql.core;

/**
 * Order in which the survivor's and the duplicates' values are presented to
 * order sensitive operations (concatenation, first-non-null).
 */
public enum ValueOrder {
    SURVIVOR_FIRST,
    DUPLICATES_FIRST
}
