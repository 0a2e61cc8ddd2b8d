package com.mergeql.core.reconcile;

import com.tailoredshapes.stash.Stash;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * The combiners referenced by {@link ReconciliationTable}.
 * Numeric and boolean combiners treat missing values as 0 and false;
 * temporal ones leave them out.
 */
final class Combiners {
    private Combiners() {}

    static Object keep(FieldInputs in) {
        return in.survivor();
    }

    /**
     * Joins the non-empty values; with none of them the survivor's value stays.
     */
    static Object concatenate(FieldInputs in) {
        List<String> parts = in.ordered().stream()
                .filter(v -> !FieldValues.isEmpty(v))
                .map(Object::toString)
                .collect(Collectors.toList());
        return parts.isEmpty() ? in.survivor() : String.join(in.separator(), parts);
    }

    static Object firstNotNull(FieldInputs in) {
        return in.ordered().stream()
                .filter(v -> !FieldValues.isEmpty(v))
                .findFirst()
                .orElse(null);
    }

    static Object firstDuplicate(FieldInputs in) {
        return in.duplicates().isEmpty() ? in.survivor() : in.duplicates().get(0);
    }

    /**
     * Survivor keeps a non-empty value; otherwise the first non-empty one is adopted.
     */
    static Object fillIfEmpty(FieldInputs in) {
        if (!FieldValues.isEmpty(in.survivor())) {
            return in.survivor();
        }
        return firstNotNull(in);
    }

    static Object sumLong(FieldInputs in) {
        return longs(in).stream().mapToLong(Long::longValue).sum();
    }

    static Object avgLong(FieldInputs in) {
        List<Long> values = longs(in);
        return Math.round(values.stream().mapToLong(Long::longValue).sum() / (double) values.size());
    }

    static Object maxLong(FieldInputs in) {
        return longs(in).stream().mapToLong(Long::longValue).max().orElse(0L);
    }

    static Object minLong(FieldInputs in) {
        return longs(in).stream().mapToLong(Long::longValue).min().orElse(0L);
    }

    static Object sumDouble(FieldInputs in) {
        return doubles(in).stream().mapToDouble(Double::doubleValue).sum();
    }

    static Object avgDouble(FieldInputs in) {
        return doubles(in).stream().mapToDouble(Double::doubleValue).average().orElse(0d);
    }

    static Object maxDouble(FieldInputs in) {
        return doubles(in).stream().mapToDouble(Double::doubleValue).max().orElse(0d);
    }

    static Object minDouble(FieldInputs in) {
        return doubles(in).stream().mapToDouble(Double::doubleValue).min().orElse(0d);
    }

    static Object and(FieldInputs in) {
        return booleans(in).stream().reduce(Boolean.TRUE, Boolean::logicalAnd);
    }

    static Object or(FieldInputs in) {
        return booleans(in).stream().reduce(Boolean.FALSE, Boolean::logicalOr);
    }

    static Object maxTemporal(FieldInputs in) {
        return in.ordered().stream()
                .filter(Objects::nonNull)
                .max(Comparator.comparing(FieldValues::toDateTime))
                .orElse(null);
    }

    static Object minTemporal(FieldInputs in) {
        return in.ordered().stream()
                .filter(Objects::nonNull)
                .min(Comparator.comparing(FieldValues::toDateTime))
                .orElse(null);
    }

    /**
     * Union of all id lists, survivor's ids first.
     */
    static Object union(FieldInputs in) {
        Set<Long> ids = new LinkedHashSet<>(ids(in.survivor()));
        for (Object value : in.duplicates()) {
            ids.addAll(ids(value));
        }
        return new ArrayList<>(ids);
    }

    /**
     * Per key union; on shared keys the first duplicate wins, then the next
     * duplicate, then the survivor.
     */
    static Object structuredUnion(FieldInputs in) {
        Stash merged = new Stash();
        putAll(merged, in.survivor());
        List<Object> duplicates = in.duplicates();
        for (int i = duplicates.size() - 1; i >= 0; i--) {
            putAll(merged, duplicates.get(i));
        }
        return merged.isEmpty() ? in.survivor() : merged;
    }

    private static void putAll(Stash target, Object value) {
        if (value instanceof Stash) {
            Stash source = (Stash) value;
            source.keySet().forEach(key -> target.put(key, source.get(key)));
        }
    }

    private static List<Long> longs(FieldInputs in) {
        return in.ordered().stream()
                .map(v -> v == null ? 0L : ((Number) v).longValue())
                .collect(Collectors.toList());
    }

    private static List<Double> doubles(FieldInputs in) {
        return in.ordered().stream()
                .map(v -> v == null ? 0d : ((Number) v).doubleValue())
                .collect(Collectors.toList());
    }

    private static List<Boolean> booleans(FieldInputs in) {
        return in.ordered().stream()
                .map(v -> v != null && (Boolean) v)
                .collect(Collectors.toList());
    }

    private static List<Long> ids(Object value) {
        if (value instanceof Collection) {
            return FieldValues.toIdList(value);
        }
        return value == null ? List.of() : List.of(FieldValues.toLong(value));
    }
}
