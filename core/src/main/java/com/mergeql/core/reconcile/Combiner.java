package com.mergeql.core.reconcile;

/**
 * Computes the candidate value of one field from its inputs.
 */
@FunctionalInterface
public interface Combiner {
    Object combine(FieldInputs inputs);
}
