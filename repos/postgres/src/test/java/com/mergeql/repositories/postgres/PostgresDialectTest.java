package com.mergeql.repositories.postgres;

import org.junit.jupiter.api.Test;

import java.sql.SQLException;
import java.time.LocalDate;

import static org.junit.jupiter.api.Assertions.*;

public class PostgresDialectTest {
    private final PostgresDialect dialect = new PostgresDialect();

    @Test
    public void errorsAreClassifiedBySqlState() {
        SQLException unique = new SQLException("duplicate key value violates unique constraint", "23505");
        SQLException column = new SQLException("column \"missing\" does not exist", "42703");
        SQLException table = new SQLException("relation \"missing\" does not exist", "42P01");
        SQLException foreignKey = new SQLException("violates foreign key constraint", "23503");

        assertTrue(dialect.isUniqueViolation(unique));
        assertFalse(dialect.isUniqueViolation(column));
        assertTrue(dialect.isUndefinedColumn(column));
        assertTrue(dialect.isUndefinedTable(table));
        assertTrue(dialect.isAnticipated(table));
        assertFalse(dialect.isAnticipated(foreignKey));
        assertFalse(dialect.isAnticipated(new SQLException("no state")));
    }

    @Test
    public void valuesAreBoundUnchanged() {
        LocalDate date = LocalDate.of(2024, 1, 31);

        assertSame(date, dialect.bind(date));
        assertEquals(Boolean.TRUE, dialect.bind(true));
    }
}
