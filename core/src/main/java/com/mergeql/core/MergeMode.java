package com.mergeql.core;

import java.util.Locale;

/**
 * How references are rewritten: through the typed entity facade or with
 * set based statements against the discovered foreign keys.
 */
public enum MergeMode {
    ORM,
    DIRECT;

    public static MergeMode fromString(String value) {
        if (value == null) {
            return ORM;
        }
        switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "orm":
                return ORM;
            case "direct":
            case "sql":
                return DIRECT;
            default:
                throw new InvalidMergeRequestException("Unknown merge mode: " + value);
        }
    }
}
