package com.mergeql.repositories.rdbms;

import com.mergeql.core.EntityStore;
import com.mergeql.core.EntityType;
import com.mergeql.core.FieldCategory;
import com.mergeql.core.FieldMetadata;
import com.mergeql.core.FieldRegistry;
import com.mergeql.core.MergeException;
import com.mergeql.core.MergeStoreException;
import com.mergeql.core.config.MergeSettings;
import com.mergeql.core.reconcile.FieldValues;
import com.tailoredshapes.stash.Stash;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.SQLException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

import static com.mergeql.repositories.rdbms.SqlSession.placeholders;
import static com.mergeql.repositories.rdbms.SqlTemplates.render;

/**
 * {@link EntityStore} over plain tables described by a {@link FieldRegistry}.
 * Multi references live in junction tables, reverse references are the
 * inverse column on the related table.
 */
public class JdbcEntityStore implements EntityStore {
    private static final Logger logger = LoggerFactory.getLogger(JdbcEntityStore.class);

    private final SqlSession session;
    private final SqlTemplates templates;
    private final FieldRegistry registry;
    private final RecordCleaner cleaner;
    private final String idColumn;
    private final Map<String, EntityType> overrides = new HashMap<>();

    public JdbcEntityStore(SqlSession session, SqlTemplates templates, FieldRegistry registry,
                           MergeSettings settings) {
        this.session = session;
        this.templates = templates;
        this.registry = registry;
        this.cleaner = new RecordCleaner(session, templates, settings);
        this.idColumn = settings.idColumn();
    }

    /**
     * Uses {@code entityType}'s table for its name instead of the registry's.
     */
    public JdbcEntityStore withEntityType(EntityType entityType) {
        overrides.put(entityType.name(), entityType);
        return this;
    }

    @Override
    public List<Long> search(String entityType, String field, Collection<?> values) {
        if (values.isEmpty()) {
            return List.of();
        }
        FieldMetadata meta = field(entityType, field);
        Map<String, Object> context = new HashMap<>();
        context.put("placeholders", placeholders(values.size()));
        if (meta.category() == FieldCategory.MULTI_REFERENCE) {
            context.put("table", session.quote(meta.relationTable()));
            context.put("columns", session.quote(meta.column1()));
            context.put("column", session.quote(meta.column2()));
        } else {
            context.put("table", session.quote(table(entityType)));
            context.put("columns", session.quote(idColumn));
            context.put("column", session.quote(field));
        }
        return distinct(queryIds(render(templates.select(), context), new ArrayList<>(values)));
    }

    @Override
    public List<Long> exists(String entityType, Collection<Long> ids) {
        if (ids.isEmpty()) {
            return List.of();
        }
        Map<String, Object> context = new HashMap<>();
        context.put("table", session.quote(table(entityType)));
        context.put("columns", session.quote(idColumn));
        context.put("column", session.quote(idColumn));
        context.put("placeholders", placeholders(ids.size()));
        Set<Long> found = new LinkedHashSet<>(queryIds(render(templates.select(), context), new ArrayList<>(ids)));
        return ids.stream().filter(found::contains).distinct().collect(Collectors.toList());
    }

    @Override
    public Map<Long, Stash> read(String entityType, Collection<Long> ids, Collection<FieldMetadata> fields) {
        Map<Long, Stash> records = new LinkedHashMap<>();
        if (ids.isEmpty()) {
            return records;
        }
        try {
            String table = table(entityType);
            Set<String> existing = session.dialect().columns(session.connection(), table);
            List<FieldMetadata> columnFields = fields.stream()
                    .filter(f -> f.category().isColumnBacked() && existing.contains(f.name().toLowerCase()))
                    .toList();

            List<String> selected = new ArrayList<>();
            selected.add(idColumn);
            columnFields.forEach(f -> selected.add(f.name()));
            Map<String, Object> context = new HashMap<>();
            context.put("table", session.quote(table));
            context.put("columns", selected.stream().map(session::quote).collect(Collectors.joining(", ")));
            context.put("column", session.quote(idColumn));
            context.put("placeholders", placeholders(ids.size()));
            for (Stash row : session.query(render(templates.select(), context), new ArrayList<>(ids))) {
                Stash values = new Stash();
                for (FieldMetadata f : columnFields) {
                    Object value = FieldValues.normalize(f.category(), row.get(f.name().toLowerCase()));
                    if (value != null) {
                        values.put(f.name(), value);
                    }
                }
                records.put(((Number) row.get(idColumn.toLowerCase())).longValue(), values);
            }

            for (FieldMetadata f : fields) {
                if (f.category() == FieldCategory.MULTI_REFERENCE && f.relationTable() != null) {
                    readLinks(records, f, f.relationTable(), f.column1(), f.column2());
                } else if (f.category() == FieldCategory.REVERSE_MULTI_REFERENCE && f.inverseName() != null) {
                    readLinks(records, f, table(f.relation()), f.inverseName(), idColumn);
                }
            }
        } catch (SQLException e) {
            throw new MergeStoreException("Failed to read " + entityType + " " + ids, e);
        }
        return records;
    }

    private void readLinks(Map<Long, Stash> records, FieldMetadata field, String table,
                           String ownerColumn, String targetColumn) throws SQLException {
        Map<Long, List<Long>> links = new HashMap<>();
        records.keySet().forEach(owner -> links.put(owner, new ArrayList<>()));
        if (!records.isEmpty() && session.dialect().tableExists(session.connection(), table)) {
            Map<String, Object> context = new HashMap<>();
            context.put("table", session.quote(table));
            context.put("columns", session.quote(ownerColumn) + ", " + session.quote(targetColumn));
            context.put("column", session.quote(ownerColumn));
            context.put("placeholders", placeholders(records.size()));
            context.put("orderBy", session.quote(targetColumn));
            for (Stash row : session.query(render(templates.select(), context),
                    new ArrayList<>(records.keySet()))) {
                long owner = ((Number) row.get(ownerColumn.toLowerCase())).longValue();
                Object target = row.get(targetColumn.toLowerCase());
                if (target != null) {
                    links.get(owner).add(((Number) target).longValue());
                }
            }
        }
        links.forEach((owner, targets) -> records.get(owner).put(field.name(), targets));
    }

    @Override
    public int write(String entityType, Collection<Long> ids, Map<String, Object> values) {
        if (ids.isEmpty() || values.isEmpty()) {
            return 0;
        }
        Map<String, FieldMetadata> known = registry.fields(entityType).stream()
                .collect(Collectors.toMap(FieldMetadata::name, f -> f, (a, b) -> a));
        List<String> columns = new ArrayList<>();
        List<Object> params = new ArrayList<>();
        values.forEach((column, value) -> {
            FieldMetadata meta = known.get(column);
            if (meta != null && !meta.category().isColumnBacked()) {
                throw new MergeException("Field " + entityType + "." + column + " is not stored in a column");
            }
            columns.add(session.quote(column));
            params.add(meta != null ? FieldValues.toStorage(meta.category(), value) : value);
        });
        params.addAll(ids);

        Map<String, Object> context = new HashMap<>();
        context.put("table", session.quote(table(entityType)));
        context.put("columns", columns);
        context.put("idColumn", session.quote(idColumn));
        context.put("placeholders", placeholders(ids.size()));
        try {
            return session.execute(render(templates.updateRecord(), context), params);
        } catch (SQLException e) {
            throw new MergeStoreException("Failed to write " + values.keySet() + " of " + entityType + " " + ids, e);
        }
    }

    @Override
    public int addLinks(String entityType, String field, Collection<Long> ids, Collection<Long> targets) {
        FieldMetadata meta = junction(entityType, field);
        Map<String, Object> context = new HashMap<>();
        context.put("table", session.quote(meta.relationTable()));
        context.put("column1", session.quote(meta.column1()));
        context.put("column2", session.quote(meta.column2()));
        String sql = render(templates.insertLink(), context);
        int added = 0;
        try {
            for (Long id : ids) {
                for (Long target : targets) {
                    added += session.execute(sql, List.of(id, target, id, target), true);
                }
            }
        } catch (SQLException e) {
            throw new MergeStoreException("Failed to link " + entityType + "." + field, e);
        }
        return added;
    }

    @Override
    public int removeLinks(String entityType, String field, Collection<Long> ids, Collection<Long> targets) {
        if (targets.isEmpty()) {
            return 0;
        }
        FieldMetadata meta = junction(entityType, field);
        Map<String, Object> context = new HashMap<>();
        context.put("table", session.quote(meta.relationTable()));
        context.put("scopeColumn", session.quote(meta.column1()));
        context.put("column", session.quote(meta.column2()));
        context.put("placeholders", placeholders(targets.size()));
        String sql = render(templates.deleteIn(), context);
        int removed = 0;
        try {
            for (Long id : ids) {
                removed += session.execute(sql, SqlSession.params(id, targets), true);
            }
        } catch (SQLException e) {
            throw new MergeStoreException("Failed to unlink " + entityType + "." + field, e);
        }
        return removed;
    }

    @Override
    public int unlink(String entityType, Collection<Long> ids) {
        List<Long> existing = exists(entityType, ids);
        if (existing.isEmpty()) {
            return 0;
        }
        try {
            int deleted = cleaner.deleteDirect(entityTypeOf(entityType), existing, registry.fields(entityType));
            logger.debug("Deleted {} source record(s) of {}", deleted, entityType);
            return deleted;
        } catch (SQLException e) {
            throw new MergeStoreException("Failed to delete " + entityType + " " + existing, e);
        }
    }

    private EntityType entityTypeOf(String entityType) {
        EntityType override = overrides.get(entityType);
        return override != null ? override : registry.resolve(entityType);
    }

    private String table(String entityType) {
        return entityTypeOf(entityType).table();
    }

    private FieldMetadata field(String entityType, String field) {
        return registry.fields(entityType).stream()
                .filter(f -> f.name().equals(field))
                .findFirst()
                .orElseThrow(() -> new MergeException("Unknown field " + entityType + "." + field));
    }

    private FieldMetadata junction(String entityType, String field) {
        FieldMetadata meta = field(entityType, field);
        if (meta.category() != FieldCategory.MULTI_REFERENCE || meta.relationTable() == null) {
            throw new MergeException("Field " + entityType + "." + field + " is not a multi reference");
        }
        return meta;
    }

    private List<Long> queryIds(String sql, List<Object> params) {
        try {
            return session.queryIds(sql, params);
        } catch (SQLException e) {
            throw new MergeStoreException("Query failed: " + sql, e);
        }
    }

    private static List<Long> distinct(List<Long> ids) {
        return new ArrayList<>(new LinkedHashSet<>(ids));
    }
}
