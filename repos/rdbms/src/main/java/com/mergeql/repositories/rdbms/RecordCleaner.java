package com.mergeql.repositories.rdbms;

import com.mergeql.core.EntityType;
import com.mergeql.core.FieldCategory;
import com.mergeql.core.FieldMetadata;
import com.mergeql.core.config.MergeSettings;
import com.mergeql.core.config.RegistryTable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.SQLException;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static com.mergeql.repositories.rdbms.SqlSession.placeholders;
import static com.mergeql.repositories.rdbms.SqlTemplates.render;

/**
 * Removes merged away rows: their own junction links, external identifiers,
 * attachments and finally the rows themselves.
 */
public class RecordCleaner {
    private static final Logger logger = LoggerFactory.getLogger(RecordCleaner.class);

    private final SqlSession session;
    private final SqlTemplates templates;
    private final MergeSettings settings;

    public RecordCleaner(SqlSession session, SqlTemplates templates, MergeSettings settings) {
        this.session = session;
        this.templates = templates;
        this.settings = settings;
    }

    /**
     * @param ownFields fields of the entity type; the junction rows of its multi references are removed first
     * @return entity rows deleted
     */
    public int deleteDirect(EntityType entityType, Collection<Long> ids, List<FieldMetadata> ownFields)
            throws SQLException {
        if (ids.isEmpty()) {
            return 0;
        }
        for (FieldMetadata field : ownFields) {
            if (field.category() == FieldCategory.MULTI_REFERENCE && field.relationTable() != null
                    && field.column1() != null) {
                deleteLinks(field, ids);
            }
        }
        deleteRegistryEntries(settings.externalIds(), entityType, ids);
        deleteRegistryEntries(settings.attachments(), entityType, ids);

        Map<String, Object> context = new HashMap<>();
        context.put("table", session.quote(entityType.table()));
        context.put("column", session.quote(settings.idColumn()));
        context.put("placeholders", placeholders(ids.size()));
        int deleted = session.execute(render(templates.deleteIn(), context), List.copyOf(ids));
        logger.debug("Deleted {} source record(s) of {}", deleted, entityType.name());
        return deleted;
    }

    private void deleteLinks(FieldMetadata field, Collection<Long> ids) throws SQLException {
        if (!session.dialect().tableExists(session.connection(), field.relationTable())) {
            return;
        }
        Map<String, Object> context = new HashMap<>();
        context.put("table", session.quote(field.relationTable()));
        context.put("column", session.quote(field.column1()));
        context.put("placeholders", placeholders(ids.size()));
        int removed = session.execute(render(templates.deleteIn(), context), List.copyOf(ids), true);
        if (removed > 0) {
            logger.debug("Removed {} link(s) of {}.{}", removed, field.model(), field.name());
        }
    }

    private void deleteRegistryEntries(RegistryTable registry, EntityType entityType, Collection<Long> ids)
            throws SQLException {
        if (!session.dialect().tableExists(session.connection(), registry.table())) {
            logger.debug("No {} table, nothing to clean", registry.table());
            return;
        }
        Map<String, Object> context = new HashMap<>();
        context.put("table", session.quote(registry.table()));
        context.put("scopeColumn", session.quote(registry.typeColumn()));
        context.put("column", session.quote(registry.resIdColumn()));
        context.put("placeholders", placeholders(ids.size()));
        session.execute(render(templates.deleteIn(), context), SqlSession.params(entityType.name(), ids), true);
    }
}
