package com.mergeql.core.reconcile;

import com.mergeql.core.FieldMetadata;
import com.mergeql.core.ValueOrder;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Everything one combiner sees for one field: the survivor's current value
 * and the duplicates' values in request order.
 */
public record FieldInputs(
        FieldMetadata field,
        Object survivor,
        List<Object> duplicates,
        ValueOrder order,
        String separator
) {
    public FieldInputs {
        duplicates = Collections.unmodifiableList(new ArrayList<>(duplicates));
    }

    /**
     * All values in the order the policy asks for.
     */
    public List<Object> ordered() {
        List<Object> values = new ArrayList<>(duplicates.size() + 1);
        if (order == ValueOrder.SURVIVOR_FIRST) {
            values.add(survivor);
            values.addAll(duplicates);
        } else {
            values.addAll(duplicates);
            values.add(survivor);
        }
        return values;
    }
}
