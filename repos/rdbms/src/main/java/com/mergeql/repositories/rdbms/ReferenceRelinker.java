package com.mergeql.repositories.rdbms;

import com.mergeql.core.ColumnRef;
import com.mergeql.core.FieldCategory;
import com.mergeql.core.ForeignKeyEdge;
import com.mergeql.core.MergeRequest;
import com.tailoredshapes.stash.Stash;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.SQLException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.Collectors;

import static com.mergeql.repositories.rdbms.SqlSession.placeholders;
import static com.mergeql.repositories.rdbms.SqlTemplates.render;

/**
 * Repoints referencing rows from the duplicates to the survivor with set based
 * statements. Each column is first updated in one statement; when that hits a
 * unique constraint the column is redone row by row.
 */
public class ReferenceRelinker {
    private static final Logger logger = LoggerFactory.getLogger(ReferenceRelinker.class);

    private final SqlSession session;
    private final SqlTemplates templates;
    private final String idColumn;

    public ReferenceRelinker(SqlSession session, SqlTemplates templates, String idColumn) {
        this.session = session;
        this.templates = templates;
        this.idColumn = idColumn;
    }

    public RelinkOutcome relinkForeignKeys(RelationGraph graph, MergeRequest request) throws SQLException {
        RelinkOutcome outcome = RelinkOutcome.NONE;
        for (ForeignKeyEdge edge : graph.foreignKeys()) {
            if (request.isExcluded(edge.table(), edge.column())) {
                logger.debug("Skipping excluded column {}.{}", edge.table(), edge.column());
                continue;
            }
            if (graph.isReconciled(request, edge.table(), edge.column())) {
                logger.debug("Leaving {}.{} to the field policy", edge.table(), edge.column());
                continue;
            }
            outcome = outcome.plus(relinkColumn(graph, request, edge.table(), edge.column()));
        }
        return outcome;
    }

    /**
     * Reference fields declared in the metadata catalog but not backed by a foreign key.
     */
    public RelinkOutcome relinkReferenceFields(RelationGraph graph, MergeRequest request) throws SQLException {
        RelinkOutcome outcome = RelinkOutcome.NONE;
        for (ReferenceField reference : graph.referenceFields()) {
            String table;
            String column;
            if (reference.field().category() == FieldCategory.MULTI_REFERENCE) {
                table = reference.field().relationTable();
                column = reference.field().column2();
            } else {
                table = reference.table();
                column = reference.column();
            }
            if (table == null || column == null || graph.hasForeignKey(table, column)
                    || request.isExcluded(reference.table(), reference.column())
                    || request.isExcluded(table, column)
                    || graph.isReconciled(request, table, column)) {
                continue;
            }
            outcome = outcome.plus(relinkColumn(graph, request, table, column));
        }
        return outcome;
    }

    /**
     * Rewrites {@code "type,id"} values pointing at a duplicate. Tables or columns
     * that do not exist are skipped.
     */
    public RelinkOutcome relinkReferenceColumns(RelationGraph graph, MergeRequest request) throws SQLException {
        String type = graph.entityType().name();
        List<Object> params = new ArrayList<>();
        params.add(type + "," + request.survivorId());
        request.duplicateIds().forEach(id -> params.add(type + "," + id));

        int relinked = 0;
        for (ColumnRef ref : graph.polymorphicColumns()) {
            if (request.isExcluded(ref.table(), ref.column())) {
                continue;
            }
            Map<String, Object> context = new HashMap<>();
            context.put("table", session.quote(ref.table()));
            context.put("column", session.quote(ref.column()));
            context.put("placeholders", placeholders(request.duplicateIds().size()));
            String sql = render(templates.relink(), context);
            try {
                relinked += session.inSavepoint("reference", () -> session.execute(sql, params, true));
            } catch (SQLException e) {
                if (!session.dialect().isUndefinedColumn(e) && !session.dialect().isUndefinedTable(e)) {
                    throw e;
                }
                logger.debug("Skipping reference column {}: {}", ref, e.getMessage());
            }
        }
        return new RelinkOutcome(relinked, 0);
    }

    RelinkOutcome relinkColumn(RelationGraph graph, MergeRequest request, String table, String column)
            throws SQLException {
        boolean selfReferential = table.equalsIgnoreCase(graph.entityType().table());
        Map<String, Object> context = new HashMap<>();
        context.put("table", session.quote(table));
        context.put("column", session.quote(column));
        context.put("placeholders", placeholders(request.duplicateIds().size()));
        context.put("excludeId", selfReferential);
        context.put("idColumn", session.quote(idColumn));
        String sql = render(templates.relink(), context);

        List<Object> params = SqlSession.params(request.survivorId(), request.duplicateIds());
        if (selfReferential) {
            params.add(request.survivorId());
        }
        try {
            int rows = session.inSavepoint("relink", () -> session.execute(sql, params, true));
            return new RelinkOutcome(rows, 0);
        } catch (SQLException e) {
            if (!session.dialect().isUniqueViolation(e)) {
                throw e;
            }
            logger.info("Unique conflict relinking {}.{}, retrying row by row", table, column);
            return relinkRowByRow(request, table, column, selfReferential);
        }
    }

    private RelinkOutcome relinkRowByRow(MergeRequest request, String table, String column,
                                         boolean selfReferential) throws SQLException {
        Set<String> columns = session.dialect().columns(session.connection(), table);
        boolean hasId = columns.contains(idColumn.toLowerCase());
        // junction rows are identified by their own column values
        List<String> keyColumns = hasId ? List.of(idColumn) : new ArrayList<>(new TreeSet<>(columns));

        Map<String, Object> selectContext = new HashMap<>();
        selectContext.put("table", session.quote(table));
        selectContext.put("column", session.quote(column));
        selectContext.put("columns", keyColumns.stream().map(session::quote).collect(Collectors.joining(", ")));
        selectContext.put("placeholders", placeholders(request.duplicateIds().size()));
        List<Stash> rows = session.query(render(templates.select(), selectContext),
                request.duplicateIds());

        int relinked = 0;
        int dropped = 0;
        for (Stash row : rows) {
            if (selfReferential && hasId && toLong(row.get(idColumn.toLowerCase())) == request.survivorId()) {
                continue;
            }
            List<String> keys = new ArrayList<>();
            List<Object> keyValues = new ArrayList<>();
            for (String key : keyColumns) {
                Object value = row.get(key.toLowerCase());
                if (value != null) {
                    keys.add(session.quote(key));
                    keyValues.add(value);
                }
            }
            Map<String, Object> context = new HashMap<>();
            context.put("table", session.quote(table));
            context.put("column", session.quote(column));
            context.put("keys", keys);
            String update = render(templates.relinkRow(), context);
            List<Object> params = SqlSession.params(request.survivorId(), keyValues);
            try {
                relinked += session.inSavepoint("relink_row", () -> session.execute(update, params));
            } catch (SQLException e) {
                if (!session.dialect().isUniqueViolation(e)) {
                    throw e;
                }
                if (hasId) {
                    logger.warn("Row {}={} of {} still conflicts after relinking, leaving it",
                            idColumn, keyValues.get(0), table);
                    continue;
                }
                // the survivor already holds the same link
                dropped += session.execute(render(templates.deleteRow(), context), keyValues);
                logger.debug("Dropped conflicting row {} of {}", keyValues, table);
            }
        }
        logger.info("Relinked {}.{} row by row: {} updated, {} dropped", table, column, relinked, dropped);
        return new RelinkOutcome(relinked, dropped);
    }

    private static long toLong(Object value) {
        return value == null ? -1 : ((Number) value).longValue();
    }
}
