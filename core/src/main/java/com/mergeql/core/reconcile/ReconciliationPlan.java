package com.mergeql.core.reconcile;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * The writes needed to bring the survivor to its reconciled state.
 * Only fields whose value actually changes appear here.
 *
 * @param values             new values of column backed fields
 * @param linksToAdd         per multi reference field, targets to link to the survivor
 * @param linksToRemove      per multi reference field, targets to unlink from the survivor
 * @param childrenToReparent per reverse reference field, child ids to point at the survivor
 */
public record ReconciliationPlan(
        Map<String, Object> values,
        Map<String, List<Long>> linksToAdd,
        Map<String, List<Long>> linksToRemove,
        Map<String, List<Long>> childrenToReparent
) {
    public ReconciliationPlan {
        // column values may legitimately be null, so no Map.copyOf here
        values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
        linksToAdd = Map.copyOf(linksToAdd);
        linksToRemove = Map.copyOf(linksToRemove);
        childrenToReparent = Map.copyOf(childrenToReparent);
    }

    public boolean isEmpty() {
        return values.isEmpty() && linksToAdd.isEmpty() && linksToRemove.isEmpty() && childrenToReparent.isEmpty();
    }

    public List<String> changedFields() {
        List<String> fields = new ArrayList<>(values.keySet());
        for (Map<String, List<Long>> m : List.of(linksToAdd, linksToRemove, childrenToReparent)) {
            m.keySet().stream().filter(f -> !fields.contains(f)).sorted().forEach(fields::add);
        }
        return fields;
    }
}
