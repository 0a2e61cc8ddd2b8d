package com.mergeql.repositories.postgres;

import com.mergeql.core.ForeignKeyEdge;
import com.mergeql.repositories.rdbms.SqlDialect;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * PostgreSQL catalog access through {@code information_schema}; errors are
 * classified by SQLSTATE.
 */
public class PostgresDialect extends SqlDialect {
    static final String UNIQUE_VIOLATION = "23505";
    static final String UNDEFINED_COLUMN = "42703";
    static final String UNDEFINED_TABLE = "42P01";

    @Override
    public String name() {
        return "postgres";
    }

    @Override
    public List<ForeignKeyEdge> foreignKeysTo(Connection connection, String table, String column)
            throws SQLException {
        List<ForeignKeyEdge> edges = new ArrayList<>();
        try (PreparedStatement stmt = connection.prepareStatement(PostgresQueries.FOREIGN_KEYS_TO)) {
            stmt.setString(1, table);
            stmt.setString(2, column);
            try (ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    edges.add(new ForeignKeyEdge(
                            rs.getString("child_table"),
                            rs.getString("child_column"),
                            rs.getString("parent_table"),
                            rs.getString("parent_column")));
                }
            }
        }
        return edges;
    }

    @Override
    public Set<String> columns(Connection connection, String table) throws SQLException {
        Set<String> columns = new LinkedHashSet<>();
        try (PreparedStatement stmt = connection.prepareStatement(PostgresQueries.COLUMNS)) {
            stmt.setString(1, table);
            try (ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    columns.add(rs.getString("column_name").toLowerCase());
                }
            }
        }
        return columns;
    }

    @Override
    public boolean isUniqueViolation(SQLException e) {
        return UNIQUE_VIOLATION.equals(e.getSQLState());
    }

    @Override
    public boolean isUndefinedColumn(SQLException e) {
        return UNDEFINED_COLUMN.equals(e.getSQLState());
    }

    @Override
    public boolean isUndefinedTable(SQLException e) {
        return UNDEFINED_TABLE.equals(e.getSQLState());
    }
}
