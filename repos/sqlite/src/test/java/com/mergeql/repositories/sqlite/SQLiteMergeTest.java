package com.mergeql.repositories.sqlite;

import com.mergeql.repositories.certification.MergeCertification;
import org.junit.jupiter.api.TestInstance;
import org.sqlite.SQLiteDataSource;

import java.sql.SQLException;

@TestInstance(TestInstance.Lifecycle.PER_CLASS)
public class SQLiteMergeTest extends MergeCertification {

    @Override
    public void init() throws SQLException {
        // every in memory connection is its own empty database
        SQLiteDataSource dataSource = new SQLiteDataSource();
        dataSource.setUrl("jdbc:sqlite::memory:");
        dataSource.setEnforceForeignKeys(true);
        connection = dataSource.getConnection();
        dialect = new SQLiteDialect();
    }
}
