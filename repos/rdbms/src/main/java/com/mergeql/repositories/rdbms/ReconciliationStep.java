package com.mergeql.repositories.rdbms;

import com.mergeql.core.EntityStore;
import com.mergeql.core.FieldMetadata;
import com.mergeql.core.MergeRequest;
import com.mergeql.core.reconcile.ReconciliationPlan;
import com.mergeql.core.reconcile.ValueReconciler;
import com.tailoredshapes.stash.Stash;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Reads the current values, asks the {@link ValueReconciler} for a plan and
 * writes it through the {@link EntityStore}. Nothing is written when the plan is empty.
 */
public class ReconciliationStep {
    private static final Logger logger = LoggerFactory.getLogger(ReconciliationStep.class);

    private final EntityStore store;
    private final ValueReconciler reconciler;

    public ReconciliationStep(EntityStore store, ValueReconciler reconciler) {
        this.store = store;
        this.reconciler = reconciler;
    }

    /**
     * @return names of the fields written
     */
    public List<String> apply(RelationGraph graph, MergeRequest request) {
        String model = graph.entityType().name();
        List<FieldMetadata> fields = graph.ownFields().stream().filter(FieldMetadata::isMergeable).toList();
        if (fields.isEmpty()) {
            return List.of();
        }
        Map<Long, Stash> current = store.read(model, request.allIds(), fields);
        Stash survivor = current.getOrDefault(request.survivorId(), new Stash());
        List<Stash> duplicates = new ArrayList<>();
        for (Long id : request.duplicateIds()) {
            duplicates.add(current.get(id));
        }

        ReconciliationPlan plan = reconciler.plan(request, fields, survivor, duplicates);
        if (plan.isEmpty()) {
            return List.of();
        }
        List<Long> target = List.of(request.survivorId());
        if (!plan.values().isEmpty()) {
            store.write(model, target, plan.values());
        }
        plan.linksToRemove().forEach((field, targets) -> store.removeLinks(model, field, target, targets));
        plan.linksToAdd().forEach((field, targets) -> store.addLinks(model, field, target, targets));
        plan.childrenToReparent().forEach((field, children) -> {
            Optional<FieldMetadata> meta = fields.stream().filter(f -> f.name().equals(field)).findFirst();
            meta.ifPresent(f -> store.write(f.relation(), children, Map.of(f.inverseName(), request.survivorId())));
        });
        logger.debug("Write {} value(s) in target record #{} of {}", plan.changedFields().size(),
                request.survivorId(), model);
        return plan.changedFields();
    }
}
