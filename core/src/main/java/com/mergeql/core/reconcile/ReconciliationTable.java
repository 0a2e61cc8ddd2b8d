package com.mergeql.core.reconcile;

import com.mergeql.core.FieldCategory;
import com.mergeql.core.MergeOperation;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Set;

import static com.mergeql.core.MergeOperation.*;

/**
 * Default operation and supported combiners per field category.
 * Every category has an entry and {@link MergeOperation#KEEP} is supported everywhere.
 */
public final class ReconciliationTable {

    private static final class Rules {
        private final MergeOperation defaultOperation;
        private final Map<MergeOperation, Combiner> combiners = new EnumMap<>(MergeOperation.class);

        private Rules(MergeOperation defaultOperation) {
            this.defaultOperation = defaultOperation;
            combiners.put(KEEP, Combiners::keep);
        }

        private Rules with(MergeOperation operation, Combiner combiner) {
            combiners.put(operation, combiner);
            return this;
        }
    }

    private static final Map<FieldCategory, Rules> RULES = new EnumMap<>(FieldCategory.class);

    static {
        RULES.put(FieldCategory.SHORT_TEXT, new Rules(KEEP)
                .with(MERGE, Combiners::concatenate)
                .with(FIRST_NOT_NULL, Combiners::firstNotNull)
                .with(FIRST, Combiners::firstDuplicate));
        RULES.put(FieldCategory.LONG_TEXT, new Rules(MERGE)
                .with(MERGE, Combiners::concatenate)
                .with(FIRST_NOT_NULL, Combiners::firstNotNull)
                .with(FIRST, Combiners::firstDuplicate));
        RULES.put(FieldCategory.INTEGER, new Rules(KEEP)
                .with(SUM, Combiners::sumLong)
                .with(AVG, Combiners::avgLong)
                .with(MAX, Combiners::maxLong)
                .with(MIN, Combiners::minLong)
                .with(FIRST_NOT_NULL, Combiners::firstNotNull));
        RULES.put(FieldCategory.FLOAT, new Rules(SUM)
                .with(SUM, Combiners::sumDouble)
                .with(AVG, Combiners::avgDouble)
                .with(MAX, Combiners::maxDouble)
                .with(MIN, Combiners::minDouble)
                .with(FIRST_NOT_NULL, Combiners::firstNotNull));
        RULES.put(FieldCategory.BOOLEAN, new Rules(KEEP)
                .with(AND, Combiners::and)
                .with(OR, Combiners::or)
                .with(FIRST, Combiners::firstDuplicate));
        for (FieldCategory temporal : new FieldCategory[]{FieldCategory.DATE, FieldCategory.DATETIME}) {
            RULES.put(temporal, new Rules(KEEP)
                    .with(MAX, Combiners::maxTemporal)
                    .with(MIN, Combiners::minTemporal)
                    .with(FIRST_NOT_NULL, Combiners::firstNotNull)
                    .with(FIRST, Combiners::firstDuplicate));
        }
        RULES.put(FieldCategory.SINGLE_REFERENCE, new Rules(MERGE)
                .with(MERGE, Combiners::fillIfEmpty)
                .with(FIRST, Combiners::firstDuplicate));
        RULES.put(FieldCategory.MULTI_REFERENCE, new Rules(MERGE)
                .with(MERGE, Combiners::union)
                .with(FIRST, Combiners::firstDuplicate));
        // merging a reverse reference means reparenting the duplicates' children
        RULES.put(FieldCategory.REVERSE_MULTI_REFERENCE, new Rules(MERGE)
                .with(MERGE, Combiners::union));
        RULES.put(FieldCategory.BINARY, new Rules(MERGE)
                .with(MERGE, Combiners::fillIfEmpty)
                .with(FIRST, Combiners::firstDuplicate));
        RULES.put(FieldCategory.STRUCTURED, new Rules(MERGE)
                .with(MERGE, Combiners::structuredUnion)
                .with(FIRST, Combiners::firstDuplicate));
        RULES.put(FieldCategory.SELECTION, new Rules(KEEP)
                .with(FIRST_NOT_NULL, Combiners::firstNotNull)
                .with(FIRST, Combiners::firstDuplicate));
        RULES.put(FieldCategory.POLYMORPHIC_REFERENCE, new Rules(KEEP)
                .with(FIRST_NOT_NULL, Combiners::firstNotNull));
    }

    private ReconciliationTable() {}

    public static MergeOperation defaultOperation(FieldCategory category) {
        return RULES.get(category).defaultOperation;
    }

    public static boolean supports(FieldCategory category, MergeOperation operation) {
        return RULES.get(category).combiners.containsKey(operation);
    }

    public static Set<MergeOperation> supportedOperations(FieldCategory category) {
        return Collections.unmodifiableSet(RULES.get(category).combiners.keySet());
    }

    /**
     * The combiner for {@code operation}, or null when the category does not support it.
     */
    public static Combiner combiner(FieldCategory category, MergeOperation operation) {
        return RULES.get(category).combiners.get(operation);
    }
}
