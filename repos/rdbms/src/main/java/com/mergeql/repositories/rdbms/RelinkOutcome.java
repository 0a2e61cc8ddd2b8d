package com.mergeql.repositories.rdbms;

/**
 * Rows repointed at the survivor and rows dropped because they collided.
 */
public record RelinkOutcome(int relinked, int dropped) {
    public static final RelinkOutcome NONE = new RelinkOutcome(0, 0);

    public RelinkOutcome plus(RelinkOutcome other) {
        return new RelinkOutcome(relinked + other.relinked, dropped + other.dropped);
    }
}
