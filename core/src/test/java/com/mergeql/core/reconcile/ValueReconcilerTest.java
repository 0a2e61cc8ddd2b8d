package com.mergeql.core.reconcile;

import com.mergeql.core.FieldCategory;
import com.mergeql.core.FieldMetadata;
import com.mergeql.core.FieldPolicy;
import com.mergeql.core.MergeOperation;
import com.mergeql.core.MergeRequest;
import com.mergeql.core.ValueOrder;
import com.tailoredshapes.stash.Stash;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Stream;

import static com.tailoredshapes.stash.Stash.stash;
import static org.junit.jupiter.api.Assertions.*;

class ValueReconcilerTest {
    private static final String MODEL = "partner";

    private final ValueReconciler reconciler = new ValueReconciler(" | ", "id");

    private static MergeRequest request(FieldPolicy policy) {
        return MergeRequest.builder(MODEL)
                .duplicates(3L, 4L, 5L)
                .survivor(2L)
                .policy(policy)
                .build();
    }

    private static Stash row(String field, Object value) {
        Stash row = new Stash();
        if (value != null) {
            row.put(field, value);
        }
        return row;
    }

    private ReconciliationPlan planFor(FieldMetadata field, FieldPolicy policy, Object survivor, Object... duplicates) {
        List<Stash> rows = new ArrayList<>();
        for (Object d : duplicates) {
            rows.add(row(field.name(), d));
        }
        return reconciler.plan(request(policy), List.of(field), row(field.name(), survivor), rows);
    }

    static Stream<Arguments> integerPolicies() {
        return Stream.of(
                Arguments.of("sum", ValueOrder.SURVIVOR_FIRST, 10L),
                Arguments.of("max", ValueOrder.SURVIVOR_FIRST, 5L),
                Arguments.of("min", ValueOrder.SURVIVOR_FIRST, 0L),
                Arguments.of("avg", ValueOrder.SURVIVOR_FIRST, 3L),
                Arguments.of("first_not_null", ValueOrder.DUPLICATES_FIRST, 3L)
        );
    }

    @ParameterizedTest
    @MethodSource("integerPolicies")
    void integerOperations(String operation, ValueOrder order, long expected) {
        FieldMetadata visits = FieldMetadata.scalar(MODEL, "visits", FieldCategory.INTEGER);
        FieldPolicy policy = FieldPolicy.builder().field("visits", operation).order(order).build();

        ReconciliationPlan plan = planFor(visits, policy, 2L, 3L, 5L, null);

        assertEquals(expected, plan.values().get("visits"));
    }

    @Test
    void firstNotNullSurvivorFirstKeepsSurvivorAndWritesNothing() {
        FieldMetadata visits = FieldMetadata.scalar(MODEL, "visits", FieldCategory.INTEGER);
        FieldPolicy policy = FieldPolicy.of(Map.of("visits", "first_not_null"));

        ReconciliationPlan plan = planFor(visits, policy, 2L, 3L, 5L, null);

        assertTrue(plan.isEmpty());
    }

    @Test
    void integerDefaultsToKeep() {
        FieldMetadata visits = FieldMetadata.scalar(MODEL, "visits", FieldCategory.INTEGER);

        assertTrue(planFor(visits, FieldPolicy.defaults(), 2L, 3L, 5L, null).isEmpty());
    }

    @Test
    void floatDefaultsToSum() {
        FieldMetadata credit = FieldMetadata.scalar(MODEL, "credit", FieldCategory.FLOAT);

        ReconciliationPlan plan = planFor(credit, FieldPolicy.defaults(), 1.5, 2.0, null, 0.25);

        assertEquals(3.75, (Double) plan.values().get("credit"), 1e-9);
    }

    @Test
    void longTextDefaultsToConcatenationSkippingEmpty() {
        FieldMetadata comment = FieldMetadata.scalar(MODEL, "comment", FieldCategory.LONG_TEXT);

        ReconciliationPlan plan = planFor(comment, FieldPolicy.defaults(), "a", "", "b", null);

        assertEquals("a | b", plan.values().get("comment"));
    }

    @Test
    void concatenationOfNothingLeavesAnEmptySurvivorUntouched() {
        FieldMetadata comment = FieldMetadata.scalar(MODEL, "comment", FieldCategory.LONG_TEXT);

        assertTrue(planFor(comment, FieldPolicy.defaults(), null, null, " ", null).isEmpty());
        assertTrue(planFor(comment, FieldPolicy.defaults(), "", null).isEmpty());
    }

    @Test
    void shortTextFirstTakesFirstDuplicateEvenWhenEmpty() {
        FieldMetadata ref = FieldMetadata.scalar(MODEL, "ref", FieldCategory.SHORT_TEXT);
        FieldPolicy policy = FieldPolicy.of(Map.of("ref", "first"));

        ReconciliationPlan plan = planFor(ref, policy, "S", null, "B", "C");

        assertTrue(plan.values().containsKey("ref"));
        assertNull(plan.values().get("ref"));
    }

    @Test
    void booleanAndTreatsMissingAsFalse() {
        FieldMetadata active = FieldMetadata.scalar(MODEL, "active", FieldCategory.BOOLEAN);

        ReconciliationPlan and = planFor(active, FieldPolicy.of(Map.of("active", "and")), true, true, null, true);
        ReconciliationPlan or = planFor(active, FieldPolicy.of(Map.of("active", "or")), false, null, true, false);

        assertEquals(false, and.values().get("active"));
        assertEquals(true, or.values().get("active"));
    }

    @Test
    void dateMaxIgnoresMissingValues() {
        FieldMetadata seen = FieldMetadata.scalar(MODEL, "last_seen", FieldCategory.DATE);
        FieldPolicy policy = FieldPolicy.of(Map.of("last_seen", "max"));

        ReconciliationPlan plan = planFor(seen, policy, LocalDate.of(2020, 1, 1),
                null, LocalDate.of(2021, 6, 1), LocalDate.of(2019, 3, 3));

        assertEquals(LocalDate.of(2021, 6, 1), plan.values().get("last_seen"));
    }

    @Test
    void datetimeMinTakesTheEarliestTimestamp() {
        FieldMetadata created = FieldMetadata.scalar(MODEL, "created", FieldCategory.DATETIME);
        FieldPolicy policy = FieldPolicy.of(Map.of("created", "min"));

        ReconciliationPlan plan = planFor(created, policy, LocalDateTime.of(2020, 1, 1, 12, 0),
                LocalDateTime.of(2020, 1, 1, 8, 30), null, LocalDateTime.of(2021, 1, 1, 0, 0));

        assertEquals(LocalDateTime.of(2020, 1, 1, 8, 30), plan.values().get("created"));
    }

    @Test
    void singleReferenceFillsOnlyWhenEmpty() {
        FieldMetadata country = FieldMetadata.reference(MODEL, "country_id", "country");

        assertEquals(7L, planFor(country, FieldPolicy.defaults(), null, null, 7L, 8L)
                .values().get("country_id"));
        assertTrue(planFor(country, FieldPolicy.defaults(), 9L, null, 7L, 8L).isEmpty());
    }

    @Test
    void selfReferenceNeverPointsAtMergedRecords() {
        FieldMetadata parent = FieldMetadata.reference(MODEL, "parent_id", MODEL);

        ReconciliationPlan plan = planFor(parent, FieldPolicy.defaults(), null, 2L, 4L, 11L);

        assertEquals(11L, plan.values().get("parent_id"));
    }

    @Test
    void binaryFillsIfEmpty() {
        FieldMetadata image = FieldMetadata.scalar(MODEL, "image", FieldCategory.BINARY);

        ReconciliationPlan plan = planFor(image, FieldPolicy.defaults(), new byte[0], null, new byte[]{1, 2});

        assertArrayEquals(new byte[]{1, 2}, (byte[]) plan.values().get("image"));
    }

    @Test
    void structuredUnionLetsTheFirstDuplicateWin() {
        FieldMetadata props = FieldMetadata.scalar(MODEL, "props", FieldCategory.STRUCTURED);
        Stash survivor = stash("a", 1, "b", 1);
        Stash first = stash("b", 2, "c", 2);
        Stash second = stash("c", 3, "d", 3);

        ReconciliationPlan plan = planFor(props, FieldPolicy.defaults(), survivor, first, second);

        Stash merged = (Stash) plan.values().get("props");
        assertEquals(Set.of("a", "b", "c", "d"), merged.keySet());
        assertEquals(1, merged.get("a"));
        assertEquals(2, merged.get("b"));
        assertEquals(2, merged.get("c"));
        assertEquals(3, merged.get("d"));
    }

    @Test
    void structuredUnionWithNothingNewWritesNothing() {
        FieldMetadata props = FieldMetadata.scalar(MODEL, "props", FieldCategory.STRUCTURED);

        ReconciliationPlan plan = planFor(props, FieldPolicy.defaults(), stash("a", 1, "b", 2), stash("a", 1), null);

        assertTrue(plan.isEmpty());
    }

    @Test
    void multiReferenceUnionOnlyAddsMissingLinks() {
        FieldMetadata tags = FieldMetadata.multiReference(MODEL, "tag_ids", "tag", "partner_tag_rel",
                "partner_id", "tag_id");

        ReconciliationPlan plan = planFor(tags, FieldPolicy.defaults(), List.of(1L, 2L), List.of(2L, 3L), List.of(4L));

        assertEquals(List.of(3L, 4L), plan.linksToAdd().get("tag_ids"));
        assertTrue(plan.linksToRemove().isEmpty());
        assertTrue(plan.values().isEmpty());
    }

    @Test
    void reverseReferenceReparentsChildren() {
        FieldMetadata children = FieldMetadata.reverseReference(MODEL, "child_ids", "contact", "partner_id");

        ReconciliationPlan plan = planFor(children, FieldPolicy.defaults(), List.of(10L), List.of(11L, 12L));

        assertEquals(List.of(11L, 12L), plan.childrenToReparent().get("child_ids"));
    }

    @Test
    void reverseSelfReferenceNeverAdoptsMergedRecords() {
        FieldMetadata children = FieldMetadata.reverseReference(MODEL, "child_ids", MODEL, "parent_id");

        ReconciliationPlan plan = planFor(children, FieldPolicy.defaults(), List.of(), List.of(2L, 20L), List.of(5L));

        assertEquals(List.of(20L), plan.childrenToReparent().get("child_ids"));
    }

    @Test
    void keepAndFirstOnMultiReferenceWorkFromTheStoredLinks() {
        FieldMetadata tags = FieldMetadata.multiReference(MODEL, "tag_ids", "tag", "partner_tag_rel",
                "partner_id", "tag_id");

        ReconciliationPlan keep = planFor(tags, FieldPolicy.of(Map.of("tag_ids", "keep")),
                List.of(1L), List.of(1L, 2L), List.of(3L));
        ReconciliationPlan first = planFor(tags, FieldPolicy.of(Map.of("tag_ids", "first")),
                List.of(1L), List.of(1L, 2L), List.of(3L));

        assertTrue(keep.isEmpty());
        assertEquals(List.of(2L), first.linksToAdd().get("tag_ids"));
        assertTrue(first.linksToRemove().isEmpty());
    }

    @Test
    void reconcilesOnlyFieldsThePolicyCanChange() {
        FieldMetadata tags = FieldMetadata.multiReference(MODEL, "tag_ids", "tag", "partner_tag_rel",
                "partner_id", "tag_id");
        FieldMetadata children = FieldMetadata.reverseReference(MODEL, "child_ids", "contact", "partner_id");

        assertTrue(ValueReconciler.reconciles(request(FieldPolicy.defaults()), children));
        assertTrue(ValueReconciler.reconciles(request(FieldPolicy.of(Map.of("tag_ids", "first"))), tags));
        assertFalse(ValueReconciler.reconciles(request(FieldPolicy.of(Map.of("child_ids", "keep"))), children));
        assertFalse(ValueReconciler.reconciles(request(FieldPolicy.of(Map.of("child_ids", "first"))), children));
        assertFalse(ValueReconciler.reconciles(request(FieldPolicy.builder().field("tag_ids", "first")
                .preserveUnlisted(true).build()), children));
        assertFalse(ValueReconciler.reconciles(request(FieldPolicy.defaults()), children.asNotStored()));
    }

    @Test
    void unsupportedOperationKeepsSurvivorValue() {
        FieldMetadata name = FieldMetadata.scalar(MODEL, "name", FieldCategory.SHORT_TEXT);

        ReconciliationPlan plan = planFor(name, FieldPolicy.of(Map.of("name", "sum")), "x", "y");

        assertTrue(plan.isEmpty());
    }

    @Test
    void preserveUnlistedOnlyReconcilesListedFields() {
        FieldMetadata comment = FieldMetadata.scalar(MODEL, "comment", FieldCategory.LONG_TEXT);
        FieldMetadata visits = FieldMetadata.scalar(MODEL, "visits", FieldCategory.INTEGER);
        FieldPolicy policy = FieldPolicy.builder().field("visits", MergeOperation.SUM).preserveUnlisted(true).build();
        Stash survivor = stash("comment", "a", "visits", 1L);
        List<Stash> duplicates = List.of(stash("comment", "b", "visits", 2L));

        ReconciliationPlan plan = reconciler.plan(request(policy), List.of(comment, visits), survivor, duplicates);

        assertEquals(Map.of("visits", 3L), plan.values());
    }

    @Test
    void computedAndUnstoredFieldsAreIgnored() {
        FieldMetadata total = FieldMetadata.scalar(MODEL, "total", FieldCategory.FLOAT).asComputed();
        FieldMetadata label = FieldMetadata.scalar(MODEL, "label", FieldCategory.LONG_TEXT).asNotStored();
        Stash survivor = stash("total", 1.0, "label", "a");
        List<Stash> duplicates = List.of(stash("total", 2.0, "label", "b"));

        ReconciliationPlan plan = reconciler.plan(request(FieldPolicy.defaults()), List.of(total, label),
                survivor, duplicates);

        assertTrue(plan.isEmpty());
    }

    @Test
    void reconcilingAnAlreadyReconciledRecordWritesNothing() {
        FieldMetadata comment = FieldMetadata.scalar(MODEL, "comment", FieldCategory.LONG_TEXT);
        FieldMetadata country = FieldMetadata.reference(MODEL, "country_id", "country");
        List<FieldMetadata> fields = List.of(comment, country);
        List<Stash> duplicates = Arrays.asList(new Stash(), null);

        Stash survivor = stash("comment", "a");
        List<Stash> first = List.of(stash("country_id", 7L), new Stash());
        ReconciliationPlan plan = reconciler.plan(request(FieldPolicy.defaults()), fields, survivor, first);
        assertEquals(Map.of("country_id", 7L), plan.values());

        plan.values().forEach(survivor::put);
        ReconciliationPlan second = reconciler.plan(request(FieldPolicy.defaults()), fields, survivor, duplicates);
        assertTrue(second.isEmpty());
    }
}
