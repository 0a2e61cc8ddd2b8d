package com.mergeql.repositories.rdbms;

import com.mergeql.core.EntityType;
import com.mergeql.core.MergeRequest;
import com.mergeql.core.config.TranslationTable;
import com.tailoredshapes.stash.Stash;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.SQLException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import static com.mergeql.repositories.rdbms.SqlSession.placeholders;
import static com.mergeql.repositories.rdbms.SqlTemplates.render;

/**
 * Keeps one translation per {@code (field, locale)} for the survivor. The
 * survivor's own row wins; otherwise the row of the earliest duplicate in
 * request order. Losing rows are deleted.
 */
public class TranslationMerger {
    private static final Logger logger = LoggerFactory.getLogger(TranslationMerger.class);

    private final SqlSession session;
    private final SqlTemplates templates;
    private final TranslationTable table;

    public TranslationMerger(SqlSession session, SqlTemplates templates, TranslationTable table) {
        this.session = session;
        this.templates = templates;
        this.table = table;
    }

    public RelinkOutcome merge(EntityType entityType, MergeRequest request) throws SQLException {
        if (request.isExcluded(table.table(), table.resIdColumn())) {
            return RelinkOutcome.NONE;
        }
        Set<String> columns = session.dialect().columns(session.connection(), table.table());
        if (!columns.containsAll(Stream.of(table.idColumn(), table.typeColumn(), table.fieldColumn(),
                table.resIdColumn(), table.langColumn()).map(String::toLowerCase).collect(Collectors.toList()))) {
            logger.debug("No translation table {}, skipping", table.table());
            return RelinkOutcome.NONE;
        }

        Map<String, Object> context = new HashMap<>();
        context.put("table", session.quote(table.table()));
        context.put("columns", Stream.of(table.idColumn(), table.fieldColumn(), table.langColumn(),
                table.resIdColumn()).map(session::quote).collect(Collectors.joining(", ")));
        context.put("scopeColumn", session.quote(table.typeColumn()));
        context.put("column", session.quote(table.resIdColumn()));
        context.put("placeholders", placeholders(request.allIds().size()));
        context.put("orderBy", session.quote(table.idColumn()));
        List<Stash> rows = session.query(render(templates.select(), context),
                SqlSession.params(entityType.name(), request.allIds()));

        Map<List<Object>, List<Stash>> groups = new LinkedHashMap<>();
        for (Stash row : rows) {
            List<Object> key = List.of(String.valueOf(row.get(table.fieldColumn().toLowerCase())),
                    String.valueOf(row.get(table.langColumn().toLowerCase())));
            groups.computeIfAbsent(key, k -> new ArrayList<>()).add(row);
        }

        List<Long> survivorIdOrder = new ArrayList<>();
        survivorIdOrder.add(request.survivorId());
        survivorIdOrder.addAll(request.duplicateIds());
        Comparator<Stash> precedence = Comparator
                .comparingInt((Stash row) -> survivorIdOrder.indexOf(owner(row)))
                .thenComparingLong(this::id);

        List<Object> losers = new ArrayList<>();
        List<Object> winners = new ArrayList<>();
        for (List<Stash> group : groups.values()) {
            group.sort(precedence);
            Stash winner = group.get(0);
            if (owner(winner) != request.survivorId()) {
                winners.add(id(winner));
            }
            group.stream().skip(1).forEach(row -> losers.add(id(row)));
        }

        int dropped = 0;
        if (!losers.isEmpty()) {
            Map<String, Object> deleteContext = new HashMap<>();
            deleteContext.put("table", session.quote(table.table()));
            deleteContext.put("column", session.quote(table.idColumn()));
            deleteContext.put("placeholders", placeholders(losers.size()));
            dropped = session.execute(render(templates.deleteIn(), deleteContext), losers);
        }
        int relinked = 0;
        if (!winners.isEmpty()) {
            Map<String, Object> updateContext = new HashMap<>();
            updateContext.put("table", session.quote(table.table()));
            updateContext.put("column", session.quote(table.resIdColumn()));
            updateContext.put("idColumn", session.quote(table.idColumn()));
            updateContext.put("placeholders", placeholders(winners.size()));
            relinked = session.execute(render(templates.updateIn(), updateContext),
                    SqlSession.params(request.survivorId(), winners));
        }
        if (relinked > 0 || dropped > 0) {
            logger.debug("Translations of {} #{}: {} moved, {} discarded", entityType.name(),
                    request.survivorId(), relinked, dropped);
        }
        return new RelinkOutcome(relinked, dropped);
    }

    private long owner(Stash row) {
        return ((Number) row.get(table.resIdColumn().toLowerCase())).longValue();
    }

    private long id(Stash row) {
        return ((Number) row.get(table.idColumn().toLowerCase())).longValue();
    }
}
