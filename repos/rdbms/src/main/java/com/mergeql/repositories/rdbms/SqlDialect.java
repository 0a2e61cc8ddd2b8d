package com.mergeql.repositories.rdbms;

import com.mergeql.core.ForeignKeyEdge;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.List;
import java.util.Set;

/**
 * What differs between stores: catalog queries, error classification and value binding.
 */
public abstract class SqlDialect {

    public abstract String name();

    /**
     * Every foreign key whose referenced side is {@code table.column}.
     */
    public abstract List<ForeignKeyEdge> foreignKeysTo(Connection connection, String table, String column)
            throws SQLException;

    /**
     * Column names of {@code table}, lower cased; empty when the table does not exist.
     */
    public abstract Set<String> columns(Connection connection, String table) throws SQLException;

    public boolean tableExists(Connection connection, String table) throws SQLException {
        return !columns(connection, table).isEmpty();
    }

    public boolean columnExists(Connection connection, String table, String column) throws SQLException {
        return columns(connection, table).contains(column.toLowerCase());
    }

    public abstract boolean isUniqueViolation(SQLException e);

    public abstract boolean isUndefinedColumn(SQLException e);

    public abstract boolean isUndefinedTable(SQLException e);

    /**
     * Anticipated failures are logged quietly by {@link SqlSession}.
     */
    public boolean isAnticipated(SQLException e) {
        return isUniqueViolation(e) || isUndefinedColumn(e) || isUndefinedTable(e);
    }

    public String quote(String identifier) {
        return "\"" + identifier.replace("\"", "\"\"") + "\"";
    }

    /**
     * Converts a normalised value into something the driver accepts as a parameter.
     */
    public Object bind(Object value) {
        return value;
    }
}
