package com.mergeql.repositories.rdbms;

import com.tailoredshapes.stash.Stash;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.sql.Savepoint;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Locale;

/**
 * One connection plus the dialect that speaks to it. Every statement the
 * merge issues goes through here so it is logged the same way.
 */
public class SqlSession {
    private static final Logger logger = LoggerFactory.getLogger(SqlSession.class);

    private final Connection connection;
    private final SqlDialect dialect;
    private int savepointCounter = 0;

    public SqlSession(Connection connection, SqlDialect dialect) {
        this.connection = connection;
        this.dialect = dialect;
    }

    public Connection connection() {
        return connection;
    }

    public SqlDialect dialect() {
        return dialect;
    }

    public String quote(String identifier) {
        return dialect.quote(identifier);
    }

    public int execute(String sql, List<?> params) throws SQLException {
        return execute(sql, params, false);
    }

    /**
     * Runs a data changing statement.
     *
     * @param skipNoResult only log when at least one row was affected
     * @return rows affected
     */
    public int execute(String sql, List<?> params, boolean skipNoResult) throws SQLException {
        long start = System.nanoTime();
        try (PreparedStatement stmt = connection.prepareStatement(sql)) {
            bind(stmt, params);
            int rows = stmt.executeUpdate();
            if (rows > 0 || !skipNoResult) {
                logger.debug("{} rows affected in {} ms: {} {}", rows,
                        (System.nanoTime() - start) / 1_000_000, sql, params);
            }
            return rows;
        } catch (SQLException e) {
            if (dialect.isAnticipated(e)) {
                logger.debug("Statement failed: {} {} ({})", sql, params, e.getMessage());
            } else {
                logger.error("Statement failed: {} {}", sql, params, e);
            }
            throw e;
        }
    }

    /**
     * Rows keyed by lower cased column label, in result order. SQL nulls are
     * left out, so a missing key reads as null.
     */
    public List<Stash> query(String sql, List<?> params) throws SQLException {
        try (PreparedStatement stmt = connection.prepareStatement(sql)) {
            bind(stmt, params);
            try (ResultSet rs = stmt.executeQuery()) {
                ResultSetMetaData meta = rs.getMetaData();
                List<Stash> rows = new ArrayList<>();
                while (rs.next()) {
                    Stash row = new Stash();
                    for (int i = 1; i <= meta.getColumnCount(); i++) {
                        Object value = rs.getObject(i);
                        if (value != null) {
                            row.put(meta.getColumnLabel(i).toLowerCase(Locale.ROOT), value);
                        }
                    }
                    rows.add(row);
                }
                return rows;
            }
        }
    }

    /**
     * First column of every row as a long, skipping nulls.
     */
    public List<Long> queryIds(String sql, List<?> params) throws SQLException {
        try (PreparedStatement stmt = connection.prepareStatement(sql)) {
            bind(stmt, params);
            try (ResultSet rs = stmt.executeQuery()) {
                List<Long> ids = new ArrayList<>();
                while (rs.next()) {
                    long id = rs.getLong(1);
                    if (!rs.wasNull()) {
                        ids.add(id);
                    }
                }
                return ids;
            }
        }
    }

    /**
     * Runs {@code work} inside a savepoint. The savepoint is released on success
     * and rolled back on any failure, which is then rethrown.
     */
    public <T> T inSavepoint(String label, SqlWork<T> work) throws SQLException {
        Savepoint savepoint = connection.setSavepoint("merge_" + label + "_" + (++savepointCounter));
        T result;
        try {
            result = work.run();
        } catch (SQLException | RuntimeException e) {
            connection.rollback(savepoint);
            throw e;
        }
        connection.releaseSavepoint(savepoint);
        return result;
    }

    public static String placeholders(int count) {
        return String.join(", ", Collections.nCopies(count, "?"));
    }

    public static List<Object> params(Object first, Collection<?> rest) {
        List<Object> params = new ArrayList<>(rest.size() + 1);
        params.add(first);
        params.addAll(rest);
        return params;
    }

    private void bind(PreparedStatement stmt, List<?> params) throws SQLException {
        for (int i = 0; i < params.size(); i++) {
            stmt.setObject(i + 1, dialect.bind(params.get(i)));
        }
    }
}
