package com.mergeql.repositories.rdbms;

import com.mergeql.core.EntityStore;
import com.mergeql.core.FieldCategory;
import com.mergeql.core.MergeRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Repoints reference fields declared in the metadata catalog through the
 * {@link EntityStore} facade: search the referencing records, then write them.
 */
public class OrmReferenceRelinker {
    private static final Logger logger = LoggerFactory.getLogger(OrmReferenceRelinker.class);

    private final EntityStore store;

    public OrmReferenceRelinker(EntityStore store) {
        this.store = store;
    }

    public RelinkOutcome relink(RelationGraph graph, MergeRequest request) {
        int relinked = 0;
        for (ReferenceField reference : graph.referenceFields()) {
            if (request.isExcluded(reference.table(), reference.column())) {
                continue;
            }
            boolean multi = reference.field().category() == FieldCategory.MULTI_REFERENCE;
            if (graph.isReconciled(request, reference.storageTable(),
                    multi ? reference.field().column2() : reference.column())) {
                logger.debug("Leaving '{}' of '{}' to the field policy", reference.column(), reference.model());
                continue;
            }
            List<Long> records = new ArrayList<>(
                    store.search(reference.model(), reference.column(), request.duplicateIds()));
            if (!multi) {
                if (reference.model().equals(graph.entityType().name())) {
                    records.remove(Long.valueOf(request.survivorId()));
                }
                if (records.isEmpty()) {
                    continue;
                }
                store.write(reference.model(), records, Map.of(reference.column(), request.survivorId()));
            } else {
                if (records.isEmpty()) {
                    continue;
                }
                store.removeLinks(reference.model(), reference.column(), records, request.duplicateIds());
                store.addLinks(reference.model(), reference.column(), records, List.of(request.survivorId()));
            }
            relinked += records.size();
            logger.debug("Changed {} record(s) in {} field '{}' of '{}'", records.size(),
                    reference.field().category().typeName(), reference.column(), reference.model());
        }
        return new RelinkOutcome(relinked, 0);
    }
}
