package com.mergeql.repositories.rdbms;

import com.mergeql.core.MergeRequest;
import com.mergeql.core.RecursionDetectedException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.SQLException;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static com.mergeql.repositories.rdbms.SqlTemplates.render;

/**
 * Walks the survivor's ancestors through every self referential column after
 * relinking. Reaching a duplicate, or the survivor itself, means the merge
 * would make the survivor its own ancestor.
 */
public class RecursionGuard {
    private static final Logger logger = LoggerFactory.getLogger(RecursionGuard.class);

    private final SqlSession session;
    private final SqlTemplates templates;
    private final String idColumn;

    public RecursionGuard(SqlSession session, SqlTemplates templates, String idColumn) {
        this.session = session;
        this.templates = templates;
        this.idColumn = idColumn;
    }

    public void check(RelationGraph graph, MergeRequest request) throws SQLException {
        String table = graph.entityType().table();
        Set<Long> duplicates = new HashSet<>(request.duplicateIds());
        for (String column : graph.hierarchyColumns()) {
            if (!session.dialect().columnExists(session.connection(), table, column)) {
                continue;
            }
            Map<String, Object> context = new HashMap<>();
            context.put("table", session.quote(table));
            context.put("column", session.quote(column));
            context.put("idColumn", session.quote(idColumn));
            String sql = render(templates.parentOf(), context);

            Set<Long> visited = new HashSet<>();
            long current = request.survivorId();
            while (true) {
                List<Long> parents = session.queryIds(sql, List.of(current));
                if (parents.isEmpty()) {
                    break;
                }
                long parent = parents.get(0);
                if (duplicates.contains(parent) || parent == request.survivorId()) {
                    throw new RecursionDetectedException(graph.entityType().name(), column,
                            request.survivorId(), parent, request.duplicateIds());
                }
                if (!visited.add(parent)) {
                    logger.warn("Existing cycle in {}.{} through #{}", table, column, parent);
                    break;
                }
                current = parent;
            }
        }
    }
}
