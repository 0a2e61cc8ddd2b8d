package com.mergeql.repositories.rdbms;

import com.mergeql.core.ColumnRef;
import com.mergeql.core.EntityType;
import com.mergeql.core.FieldCategory;
import com.mergeql.core.FieldMetadata;
import com.mergeql.core.ForeignKeyEdge;
import com.mergeql.core.MergeRequest;
import com.mergeql.core.reconcile.ValueReconciler;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Everything that points at one entity type, discovered once per merge.
 *
 * @param entityType         the merged entity type
 * @param foreignKeys        structural foreign keys referencing its id column
 * @param referenceFields    stored single and multi reference fields targeting it
 * @param polymorphicColumns {@code "type,id"} columns that may reference it
 * @param ownFields          the entity type's own fields
 * @param collectionColumns  by field name, the column holding the owner id of each
 *                           of its own multi and reverse references
 */
public record RelationGraph(
        EntityType entityType,
        List<ForeignKeyEdge> foreignKeys,
        List<ReferenceField> referenceFields,
        List<ColumnRef> polymorphicColumns,
        List<FieldMetadata> ownFields,
        Map<String, ColumnRef> collectionColumns
) {
    public RelationGraph {
        foreignKeys = List.copyOf(foreignKeys);
        referenceFields = List.copyOf(referenceFields);
        polymorphicColumns = List.copyOf(polymorphicColumns);
        ownFields = List.copyOf(ownFields);
        collectionColumns = Map.copyOf(collectionColumns);
    }

    public RelationGraph(EntityType entityType, List<ForeignKeyEdge> foreignKeys,
                         List<ReferenceField> referenceFields, List<ColumnRef> polymorphicColumns,
                         List<FieldMetadata> ownFields) {
        this(entityType, foreignKeys, referenceFields, polymorphicColumns, ownFields, Map.of());
    }

    /**
     * Whether a foreign key already covers {@code table.column}.
     */
    public boolean hasForeignKey(String table, String column) {
        return foreignKeys.stream()
                .anyMatch(fk -> fk.table().equalsIgnoreCase(table) && fk.column().equalsIgnoreCase(column));
    }

    /**
     * Columns of the entity's own table that point back at the same table.
     */
    public List<String> hierarchyColumns() {
        Set<String> columns = new LinkedHashSet<>();
        foreignKeys.stream()
                .filter(fk -> fk.table().equalsIgnoreCase(entityType.table()))
                .forEach(fk -> columns.add(fk.column()));
        ownFields.stream()
                .filter(f -> f.isMergeable() && f.isSelfReferential())
                .forEach(f -> columns.add(f.name()));
        return List.copyOf(columns);
    }

    /**
     * Whether {@code table.column} holds the owner id of one of the entity's own
     * collection fields that the reconciliation step takes care of. The links of a
     * multi reference always belong to it; a reverse reference only when the
     * field policy reconciles it, otherwise its children are relinked like any
     * other reference.
     */
    public boolean isReconciled(MergeRequest request, String table, String column) {
        for (FieldMetadata field : ownFields) {
            ColumnRef ref = collectionColumns.get(field.name());
            if (ref == null || !ref.table().equalsIgnoreCase(table) || !ref.column().equalsIgnoreCase(column)) {
                continue;
            }
            if (field.category() == FieldCategory.MULTI_REFERENCE || ValueReconciler.reconciles(request, field)) {
                return true;
            }
        }
        return false;
    }

    public List<ReferenceField> referenceFields(FieldCategory category) {
        return referenceFields.stream()
                .filter(r -> r.field().category() == category)
                .toList();
    }

    public int size() {
        return foreignKeys.size() + referenceFields.size() + polymorphicColumns.size();
    }
}
