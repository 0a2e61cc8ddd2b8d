package com.mergeql.core.reconcile;

import com.mergeql.core.FieldCategory;
import com.mergeql.core.FieldMetadata;
import com.mergeql.core.MergeOperation;
import com.mergeql.core.MergeRequest;
import com.tailoredshapes.stash.Stash;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Computes the survivor's final field values from its own and the duplicates'
 * current values, diffing the result against what is already stored.
 */
public class ValueReconciler {
    private static final Logger logger = LoggerFactory.getLogger(ValueReconciler.class);

    private final String separator;
    private final String idColumn;

    public ValueReconciler(String separator, String idColumn) {
        this.separator = separator;
        this.idColumn = idColumn;
    }

    /**
     * Whether the field policy gives {@code field} a combiner that can change the
     * survivor's value. Fields that are kept, unlisted under
     * {@link com.mergeql.core.FieldPolicy#preserveUnlisted()}, or asked for an
     * unsupported operation are left as they are.
     */
    public static boolean reconciles(MergeRequest request, FieldMetadata field) {
        if (!field.isMergeable()) {
            return false;
        }
        if (request.policy().preserveUnlisted() && !request.policy().isListed(field.name())) {
            return false;
        }
        MergeOperation operation = operation(request, field);
        return operation != MergeOperation.KEEP && ReconciliationTable.supports(field.category(), operation);
    }

    /**
     * @param fields          candidate fields of the merged entity type
     * @param survivorValues  the survivor's current values, normalised
     * @param duplicateValues the duplicates' values, in the request's duplicate order
     */
    public ReconciliationPlan plan(MergeRequest request, List<FieldMetadata> fields,
                                   Stash survivorValues, List<Stash> duplicateValues) {
        Map<String, Object> values = new LinkedHashMap<>();
        Map<String, List<Long>> linksToAdd = new HashMap<>();
        Map<String, List<Long>> linksToRemove = new HashMap<>();
        Map<String, List<Long>> children = new HashMap<>();

        for (FieldMetadata field : fields) {
            if (!field.isMergeable() || field.name().equals(idColumn)) {
                continue;
            }
            if (request.policy().preserveUnlisted() && !request.policy().isListed(field.name())) {
                continue;
            }
            FieldCategory category = field.category();
            MergeOperation operation = operation(request, field);
            Combiner combiner = ReconciliationTable.combiner(category, operation);
            if (combiner == null) {
                logger.warn("Operation {} is not supported for {} field {}.{}, keeping the survivor's value",
                        operation.key(), category.typeName(), field.model(), field.name());
                continue;
            }
            if (operation == MergeOperation.KEEP) {
                continue;
            }

            Object current = survivorValues.get(field.name());
            FieldInputs inputs = inputs(request, field, current, duplicateValues);
            Object candidate = combiner.combine(inputs);

            switch (category) {
                case MULTI_REFERENCE: {
                    List<Long> before = idList(current);
                    List<Long> after = idList(candidate);
                    List<Long> added = minus(after, before);
                    List<Long> removed = minus(before, after);
                    if (!added.isEmpty()) {
                        linksToAdd.put(field.name(), added);
                    }
                    if (!removed.isEmpty()) {
                        linksToRemove.put(field.name(), removed);
                    }
                    break;
                }
                case REVERSE_MULTI_REFERENCE: {
                    List<Long> adopted = minus(idList(candidate), idList(current));
                    if (field.targets(field.model())) {
                        // a record never becomes its own child
                        adopted.removeAll(request.allIds());
                    }
                    if (!adopted.isEmpty()) {
                        children.put(field.name(), adopted);
                    }
                    break;
                }
                default:
                    if (!FieldValues.sameValue(candidate, current)) {
                        values.put(field.name(), candidate);
                    }
            }
        }
        ReconciliationPlan plan = new ReconciliationPlan(values, linksToAdd, linksToRemove, children);
        logger.debug("Reconciled {} #{}: changed {}", request.entityType(), request.survivorId(),
                plan.changedFields());
        return plan;
    }

    private static MergeOperation operation(MergeRequest request, FieldMetadata field) {
        return request.policy().operationFor(field.name())
                .orElse(ReconciliationTable.defaultOperation(field.category()));
    }

    private FieldInputs inputs(MergeRequest request, FieldMetadata field, Object current,
                               List<Stash> duplicateValues) {
        List<Object> duplicates = new ArrayList<>(duplicateValues.size());
        for (Stash row : duplicateValues) {
            duplicates.add(row == null ? null : row.get(field.name()));
        }
        Object survivor = current;
        if (field.isSelfReferential()) {
            // a record may not end up pointing at itself or at a record being merged away
            Set<Long> forbidden = new LinkedHashSet<>(request.allIds());
            survivor = forbidden.contains(asLong(current)) ? null : current;
            duplicates.replaceAll(v -> forbidden.contains(asLong(v)) ? null : v);
        }
        return new FieldInputs(field, survivor, duplicates, request.policy().order(), separator);
    }

    private static Long asLong(Object value) {
        return value instanceof Number ? ((Number) value).longValue() : null;
    }

    private static List<Long> idList(Object value) {
        return value == null ? List.of() : FieldValues.toIdList(value);
    }

    private static List<Long> minus(List<Long> a, List<Long> b) {
        Set<Long> result = new LinkedHashSet<>(a);
        result.removeAll(b);
        return new ArrayList<>(result);
    }
}
