package com.mergeql.repositories.postgres;

/**
 * Catalog queries against {@code information_schema}, limited to the
 * connection's current schema.
 */
public final class PostgresQueries {
    private PostgresQueries() {}

    /**
     * Foreign keys whose referenced side is {@code (table, column)}. Parameters: table, column.
     */
    public static final String FOREIGN_KEYS_TO = """
            SELECT tc.table_name AS child_table,
                   kcu.column_name AS child_column,
                   pku.table_name AS parent_table,
                   pku.column_name AS parent_column
            FROM information_schema.table_constraints tc
            JOIN information_schema.key_column_usage kcu
              ON tc.constraint_name = kcu.constraint_name
             AND tc.table_schema = kcu.table_schema
            JOIN information_schema.referential_constraints rc
              ON rc.constraint_name = tc.constraint_name
             AND rc.constraint_schema = tc.table_schema
            JOIN information_schema.key_column_usage pku
              ON pku.constraint_name = rc.unique_constraint_name
             AND pku.constraint_schema = rc.unique_constraint_schema
             AND pku.ordinal_position = kcu.position_in_unique_constraint
            WHERE tc.constraint_type = 'FOREIGN KEY'
              AND tc.table_schema = current_schema()
              AND pku.table_name = ?
              AND pku.column_name = ?
            ORDER BY tc.table_name, kcu.column_name
            """;

    /**
     * Column names of one table. Parameter: table.
     */
    public static final String COLUMNS = """
            SELECT column_name
            FROM information_schema.columns
            WHERE table_schema = current_schema()
              AND table_name = ?
            ORDER BY ordinal_position
            """;
}
