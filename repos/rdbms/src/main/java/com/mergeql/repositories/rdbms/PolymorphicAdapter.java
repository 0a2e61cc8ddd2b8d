package com.mergeql.repositories.rdbms;

import com.mergeql.core.EntityType;
import com.mergeql.core.MergeRequest;
import com.mergeql.core.config.PolymorphicSubsystem;
import com.tailoredshapes.stash.Stash;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.SQLException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

import static com.mergeql.repositories.rdbms.SqlSession.placeholders;
import static com.mergeql.repositories.rdbms.SqlTemplates.render;

/**
 * Repoints rows of side tables that reference entities through a
 * {@code (type tag, id)} pair. One generic routine driven by the configured
 * {@link PolymorphicSubsystem} list.
 */
public class PolymorphicAdapter {
    private static final Logger logger = LoggerFactory.getLogger(PolymorphicAdapter.class);

    private final SqlSession session;
    private final SqlTemplates templates;
    private final List<PolymorphicSubsystem> subsystems;

    public PolymorphicAdapter(SqlSession session, SqlTemplates templates, List<PolymorphicSubsystem> subsystems) {
        this.session = session;
        this.templates = templates;
        this.subsystems = List.copyOf(subsystems);
    }

    public RelinkOutcome relink(EntityType entityType, MergeRequest request) throws SQLException {
        RelinkOutcome outcome = RelinkOutcome.NONE;
        for (PolymorphicSubsystem subsystem : subsystems) {
            if (request.isExcluded(subsystem.table(), subsystem.resIdColumn())) {
                continue;
            }
            Set<String> columns = session.dialect().columns(session.connection(), subsystem.table());
            if (!columns.contains(subsystem.typeColumn().toLowerCase())
                    || !columns.contains(subsystem.resIdColumn().toLowerCase())) {
                logger.debug("Skipping subsystem {}: table or columns missing", subsystem.table());
                continue;
            }
            try {
                outcome = outcome.plus(session.inSavepoint("subsystem", () -> relink(subsystem, columns,
                        entityType, request)));
            } catch (SQLException e) {
                if (!session.dialect().isUndefinedColumn(e)) {
                    throw e;
                }
                logger.warn("Skipping subsystem {}: {}", subsystem.table(), e.getMessage());
            }
        }
        return outcome;
    }

    private RelinkOutcome relink(PolymorphicSubsystem subsystem, Set<String> columns, EntityType entityType,
                                 MergeRequest request) throws SQLException {
        int dropped = 0;
        if (subsystem.isCorrelated()
                && columns.containsAll(subsystem.correlatingColumns().stream()
                .map(String::toLowerCase).collect(Collectors.toList()))) {
            dropped = dropCorrelatedRepeats(subsystem, entityType, request);
        }

        boolean rename = request.renameTypeTo() != null;
        // when renaming, the survivor's own rows are retagged as well
        List<Long> ids = rename ? request.allIds() : request.duplicateIds();
        Map<String, Object> context = new HashMap<>();
        context.put("table", session.quote(subsystem.table()));
        context.put("resIdColumn", session.quote(subsystem.resIdColumn()));
        context.put("typeColumn", session.quote(subsystem.typeColumn()));
        context.put("rename", rename);
        context.put("placeholders", placeholders(ids.size()));

        List<Object> params = new ArrayList<>();
        params.add(request.survivorId());
        if (rename) {
            params.add(request.renameTypeTo());
        }
        params.add(entityType.name());
        params.addAll(ids);
        int relinked = session.execute(render(templates.relinkPolymorphic(), context), params, true);
        if (relinked > 0 || dropped > 0) {
            logger.debug("Changed {} and dropped {} record(s) of {}", relinked, dropped, subsystem.table());
        }
        return new RelinkOutcome(relinked, dropped);
    }

    /**
     * Deletes side rows whose correlating values an earlier owner already holds.
     * Owners are visited survivor first, then the duplicates in request order.
     * When the type tag is renamed, rows already filed under the new tag for the
     * survivor count as held before any of them.
     */
    private int dropCorrelatedRepeats(PolymorphicSubsystem subsystem, EntityType entityType,
                                      MergeRequest request) throws SQLException {
        Map<Long, List<Stash>> byOwner = new HashMap<>();
        for (Stash row : rowsOf(subsystem, entityType.name(), request.allIds())) {
            byOwner.computeIfAbsent(owner(subsystem, row), k -> new ArrayList<>()).add(row);
        }

        Set<List<Object>> taken = new HashSet<>();
        String renameTo = request.renameTypeTo();
        if (renameTo != null && !renameTo.equals(entityType.name())) {
            rowsOf(subsystem, renameTo, List.of(request.survivorId()))
                    .forEach(row -> taken.add(key(subsystem, row)));
        }

        Map<String, Object> deleteContext = new HashMap<>();
        deleteContext.put("table", session.quote(subsystem.table()));
        deleteContext.put("keys", List.of(session.quote(subsystem.idColumn())));
        String delete = render(templates.deleteRow(), deleteContext);

        List<Long> owners = new ArrayList<>();
        owners.add(request.survivorId());
        owners.addAll(request.duplicateIds());
        int dropped = 0;
        for (Long owner : owners) {
            for (Stash row : byOwner.getOrDefault(owner, List.of())) {
                if (!taken.add(key(subsystem, row))) {
                    dropped += session.execute(delete, List.of(row.get(subsystem.idColumn().toLowerCase())));
                }
            }
        }
        return dropped;
    }

    private List<Stash> rowsOf(PolymorphicSubsystem subsystem, String type, List<Long> ids) throws SQLException {
        List<String> selected = new ArrayList<>();
        selected.add(subsystem.idColumn());
        selected.add(subsystem.resIdColumn());
        selected.addAll(subsystem.correlatingColumns());

        Map<String, Object> context = new HashMap<>();
        context.put("table", session.quote(subsystem.table()));
        context.put("columns", selected.stream().map(session::quote).collect(Collectors.joining(", ")));
        context.put("scopeColumn", session.quote(subsystem.typeColumn()));
        context.put("column", session.quote(subsystem.resIdColumn()));
        context.put("placeholders", placeholders(ids.size()));
        context.put("orderBy", session.quote(subsystem.idColumn()));
        return session.query(render(templates.select(), context), SqlSession.params(type, ids));
    }

    private static long owner(PolymorphicSubsystem subsystem, Stash row) {
        return ((Number) row.get(subsystem.resIdColumn().toLowerCase())).longValue();
    }

    private static List<Object> key(PolymorphicSubsystem subsystem, Stash row) {
        List<Object> key = new ArrayList<>();
        for (String column : subsystem.correlatingColumns()) {
            Object value = row.get(column.toLowerCase());
            key.add(value instanceof Number ? ((Number) value).longValue() : value);
        }
        return key;
    }
}
