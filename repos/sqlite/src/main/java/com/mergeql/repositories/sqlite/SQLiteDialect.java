package com.mergeql.repositories.sqlite;

import com.mergeql.core.ForeignKeyEdge;
import com.mergeql.repositories.rdbms.SqlDialect;

import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * SQLite has no information schema: foreign keys and columns come from pragmas.
 * Dates are stored as ISO text and booleans as 0/1.
 */
public class SQLiteDialect extends SqlDialect {
    private static final String TABLES =
            "SELECT name FROM sqlite_master WHERE type = 'table' AND name NOT LIKE 'sqlite_%' ORDER BY name";

    @Override
    public String name() {
        return "sqlite";
    }

    @Override
    public List<ForeignKeyEdge> foreignKeysTo(Connection connection, String table, String column)
            throws SQLException {
        List<String> tables = new ArrayList<>();
        try (Statement stmt = connection.createStatement();
             ResultSet rs = stmt.executeQuery(TABLES)) {
            while (rs.next()) {
                tables.add(rs.getString("name"));
            }
        }

        List<ForeignKeyEdge> edges = new ArrayList<>();
        for (String child : tables) {
            try (Statement stmt = connection.createStatement();
                 ResultSet rs = stmt.executeQuery("PRAGMA foreign_key_list(" + quote(child) + ")")) {
                while (rs.next()) {
                    String parent = rs.getString("table");
                    // a missing target column means the parent's primary key
                    String to = rs.getString("to");
                    String referenced = to != null ? to : column;
                    if (parent.equalsIgnoreCase(table) && referenced.equalsIgnoreCase(column)) {
                        edges.add(new ForeignKeyEdge(child, rs.getString("from"), parent, referenced));
                    }
                }
            }
        }
        return edges;
    }

    @Override
    public Set<String> columns(Connection connection, String table) throws SQLException {
        Set<String> columns = new LinkedHashSet<>();
        try (Statement stmt = connection.createStatement();
             ResultSet rs = stmt.executeQuery("PRAGMA table_info(" + quote(table) + ")")) {
            while (rs.next()) {
                columns.add(rs.getString("name").toLowerCase());
            }
        }
        return columns;
    }

    @Override
    public boolean isUniqueViolation(SQLException e) {
        return messageContains(e, "UNIQUE constraint failed");
    }

    @Override
    public boolean isUndefinedColumn(SQLException e) {
        return messageContains(e, "no such column");
    }

    @Override
    public boolean isUndefinedTable(SQLException e) {
        return messageContains(e, "no such table");
    }

    @Override
    public Object bind(Object value) {
        if (value instanceof LocalDate || value instanceof LocalDateTime) {
            return value.toString();
        }
        if (value instanceof Boolean) {
            return (Boolean) value ? 1 : 0;
        }
        return value;
    }

    private static boolean messageContains(SQLException e, String fragment) {
        return e.getMessage() != null && e.getMessage().contains(fragment);
    }
}
