package com.mergeql.repositories.rdbms;

import com.mergeql.core.ColumnRef;
import com.mergeql.core.EntityType;
import com.mergeql.core.FieldCategory;
import com.mergeql.core.FieldMetadata;
import com.mergeql.core.FieldRegistry;
import com.mergeql.core.ForeignKeyEdge;
import com.mergeql.core.config.MergeSettings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.SQLException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Read only discovery of what references an entity type: the store's foreign keys
 * and the metadata catalog's relational fields.
 */
public class CatalogIntrospector {
    private static final Logger logger = LoggerFactory.getLogger(CatalogIntrospector.class);

    private final SqlSession session;
    private final FieldRegistry registry;
    private final MergeSettings settings;

    public CatalogIntrospector(SqlSession session, FieldRegistry registry, MergeSettings settings) {
        this.session = session;
        this.registry = registry;
        this.settings = settings;
    }

    /**
     * The entity type to merge. An explicit table wins; otherwise the registry is
     * asked and, for types it no longer knows, the table name is derived.
     */
    public EntityType resolve(String entityType, String tableName) {
        if (tableName != null && !tableName.isBlank()) {
            return new EntityType(entityType, tableName);
        }
        return registry.resolve(entityType);
    }

    public RelationGraph discover(EntityType entityType) throws SQLException {
        List<ForeignKeyEdge> foreignKeys = session.dialect()
                .foreignKeysTo(session.connection(), entityType.table(), settings.idColumn());

        Map<String, Boolean> tableCache = new HashMap<>();
        List<ReferenceField> referenceFields = new ArrayList<>();
        for (FieldMetadata field : registry.fieldsTargeting(entityType.name())) {
            if (!field.isMergeable()) {
                continue;
            }
            if (field.category() != FieldCategory.SINGLE_REFERENCE
                    && field.category() != FieldCategory.MULTI_REFERENCE) {
                continue;
            }
            String table = registry.resolve(field.model()).table();
            if (!exists(field.category() == FieldCategory.MULTI_REFERENCE ? field.relationTable() : table,
                    tableCache)) {
                logger.debug("Skipping {}.{}: table {} does not exist", field.model(), field.name(), table);
                continue;
            }
            referenceFields.add(new ReferenceField(field, table));
        }

        Set<ColumnRef> polymorphic = new LinkedHashSet<>();
        for (FieldMetadata field : registry.fieldsOfCategory(FieldCategory.POLYMORPHIC_REFERENCE)) {
            if (!field.isMergeable()) {
                continue;
            }
            String table = registry.resolve(field.model()).table();
            if (exists(table, tableCache)) {
                polymorphic.add(new ColumnRef(table, field.name()));
            }
        }
        polymorphic.addAll(settings.extraReferenceColumns());

        List<FieldMetadata> ownFields = registry.fields(entityType.name());
        Map<String, ColumnRef> collectionColumns = new HashMap<>();
        for (FieldMetadata field : ownFields) {
            if (!field.isMergeable()) {
                continue;
            }
            if (field.category() == FieldCategory.MULTI_REFERENCE
                    && field.relationTable() != null && field.column1() != null) {
                collectionColumns.put(field.name(), new ColumnRef(field.relationTable(), field.column1()));
            } else if (field.category() == FieldCategory.REVERSE_MULTI_REFERENCE
                    && field.relation() != null && field.inverseName() != null) {
                collectionColumns.put(field.name(),
                        new ColumnRef(registry.resolve(field.relation()).table(), field.inverseName()));
            }
        }

        RelationGraph graph = new RelationGraph(entityType, foreignKeys, referenceFields,
                new ArrayList<>(polymorphic), ownFields, collectionColumns);
        logger.info("Discovered for {} ({}): {} foreign keys, {} reference fields, {} polymorphic columns",
                entityType.name(), entityType.table(), foreignKeys.size(), referenceFields.size(), polymorphic.size());
        return graph;
    }

    private boolean exists(String table, Map<String, Boolean> cache) throws SQLException {
        if (table == null) {
            return false;
        }
        Boolean known = cache.get(table);
        if (known == null) {
            known = session.dialect().tableExists(session.connection(), table);
            cache.put(table, known);
        }
        return known;
    }
}
