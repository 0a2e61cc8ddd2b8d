package com.mergeql.repositories.rdbms;

import com.mergeql.core.EntityType;
import com.mergeql.core.FieldRegistry;
import com.mergeql.core.MergeEngine;
import com.mergeql.core.MergeMode;
import com.mergeql.core.MergeRequest;
import com.mergeql.core.MergeResult;
import com.mergeql.core.MergeStoreException;
import com.mergeql.core.RecursionDetectedException;
import com.mergeql.core.config.MergeSettings;
import com.mergeql.core.config.RecursionPolicy;
import com.mergeql.core.reconcile.ValueReconciler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.List;

/**
 * Merge engine for JDBC stores. Runs every step on one connection; when that
 * connection is in auto commit mode the whole merge runs in its own transaction.
 */
public class RdbmsMergeEngine implements MergeEngine {
    private static final Logger logger = LoggerFactory.getLogger(RdbmsMergeEngine.class);

    private final DataSource dataSource;
    private final SqlDialect dialect;
    private final MergeSettings settings;
    private final FieldRegistry registry;
    private final SqlTemplates templates;

    /**
     * @param registry metadata catalog; when null it is read from the store's own catalog tables
     */
    public RdbmsMergeEngine(DataSource dataSource, SqlDialect dialect, MergeSettings settings, FieldRegistry registry) {
        this.dataSource = dataSource;
        this.dialect = dialect;
        this.settings = settings;
        this.registry = registry;
        this.templates = SqlTemplates.load();
    }

    public RdbmsMergeEngine(DataSource dataSource, SqlDialect dialect, MergeSettings settings) {
        this(dataSource, dialect, settings, null);
    }

    @Override
    public MergeResult merge(MergeRequest request) {
        if (dataSource == null) {
            throw new IllegalStateException("No data source configured, use merge(Connection, MergeRequest)");
        }
        try (Connection connection = dataSource.getConnection()) {
            return merge(connection, request);
        } catch (SQLException e) {
            throw new MergeStoreException("Failed to obtain a connection", e);
        }
    }

    public MergeResult merge(Connection connection, MergeRequest request) {
        boolean ownTransaction;
        try {
            ownTransaction = connection.getAutoCommit();
            if (ownTransaction) {
                connection.setAutoCommit(false);
            }
        } catch (SQLException e) {
            throw new MergeStoreException("Failed to start a transaction", e);
        }
        try {
            MergeResult result = run(new SqlSession(connection, dialect), request);
            if (ownTransaction) {
                connection.commit();
            }
            return result;
        } catch (SQLException | RuntimeException e) {
            if (ownTransaction) {
                rollback(connection);
            }
            if (e instanceof RuntimeException) {
                throw (RuntimeException) e;
            }
            throw new MergeStoreException("Merging " + request.entityType() + " " + request.duplicateIds()
                    + " into " + request.survivorId() + " failed", e);
        } finally {
            if (ownTransaction) {
                try {
                    connection.setAutoCommit(true);
                } catch (SQLException e) {
                    logger.error("Failed to restore auto commit", e);
                }
            }
        }
    }

    private MergeResult run(SqlSession session, MergeRequest request) throws SQLException {
        logger.info("merge.starting type={} duplicates={} survivor={} mode={}",
                request.entityType(), request.duplicateIds(), request.survivorId(), request.mode());

        FieldRegistry fields = registry != null ? registry : new JdbcFieldRegistry(session, settings.metadata());
        CatalogIntrospector introspector = new CatalogIntrospector(session, fields, settings);
        EntityType entityType = introspector.resolve(request.entityType(), request.tableName());
        RelationGraph graph = introspector.discover(entityType);
        JdbcEntityStore store = new JdbcEntityStore(session, templates, fields, settings).withEntityType(entityType);
        ReferenceRelinker relinker = new ReferenceRelinker(session, templates, settings.idColumn());

        RelinkOutcome outcome = new PolymorphicAdapter(session, templates, settings.subsystems())
                .relink(entityType, request);
        if (request.mode() == MergeMode.ORM) {
            outcome = outcome.plus(new OrmReferenceRelinker(store).relink(graph, request));
        } else {
            outcome = outcome.plus(relinker.relinkReferenceFields(graph, request));
        }
        // foreign keys the catalog knows nothing about are relinked in both modes;
        // those backing the entity's own collections are left to the reconciliation
        outcome = outcome.plus(relinker.relinkForeignKeys(graph, request));
        outcome = outcome.plus(relinker.relinkReferenceColumns(graph, request));
        outcome = outcome.plus(new TranslationMerger(session, templates, settings.translations())
                .merge(entityType, request));
        logger.info("Relinked {} reference(s) to {} #{}, dropped {} conflicting row(s)",
                outcome.relinked(), entityType.name(), request.survivorId(), outcome.dropped());

        try {
            new RecursionGuard(session, templates, settings.idColumn()).check(graph, request);
        } catch (RecursionDetectedException e) {
            if (settings.onRecursion() == RecursionPolicy.RAISE) {
                throw e;
            }
            logger.error("merge.refused {}", e.getMessage());
            return MergeResult.refused(request, outcome.relinked(), outcome.dropped(), e);
        }

        List<String> written = new ReconciliationStep(store,
                new ValueReconciler(settings.separator(), settings.idColumn())).apply(graph, request);

        int deleted = 0;
        if (request.delete()) {
            deleted = request.mode() == MergeMode.ORM
                    ? store.unlink(entityType.name(), request.duplicateIds())
                    : new RecordCleaner(session, templates, settings)
                    .deleteDirect(entityType, request.duplicateIds(), graph.ownFields());
        }
        logger.info("merge.completed type={} survivor={} relinked={} dropped={} written={} deleted={}",
                entityType.name(), request.survivorId(), outcome.relinked(), outcome.dropped(), written, deleted);
        return MergeResult.completed(request, outcome.relinked(), outcome.dropped(), written, deleted);
    }

    private static void rollback(Connection connection) {
        try {
            connection.rollback();
        } catch (SQLException e) {
            logger.error("Failed to rollback transaction", e);
        }
    }
}
