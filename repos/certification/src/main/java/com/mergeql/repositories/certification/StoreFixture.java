package com.mergeql.repositories.certification;

import com.mergeql.core.MergeRequest;
import com.mergeql.core.MergeResult;
import com.mergeql.core.config.MergeSettings;
import com.mergeql.repositories.rdbms.RdbmsMergeEngine;
import com.mergeql.repositories.rdbms.SqlDialect;
import com.mergeql.repositories.rdbms.SqlSession;
import com.tailoredshapes.stash.Stash;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;

import java.io.BufferedReader;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

/**
 * A small partner/invoice/tag database loaded before every test.
 * <p>
 * Partners 1, 2 and 3 are the usual merge candidates; 4 is the parent of 3 and
 * 5 is a child of 2. Invoices reference partners through a foreign key, contacts
 * only through the metadata catalog, properties through {@code "type,id"} text.
 */
public abstract class StoreFixture {
    protected Connection connection;
    protected SqlDialect dialect;

    /**
     * Opens {@link #connection} in auto commit mode and sets {@link #dialect}.
     */
    public abstract void init() throws SQLException;

    @BeforeEach
    public void setUp() throws Exception {
        init();
        runScript("fixture/drop.sql");
        runScript("fixture/schema.sql");
        runScript("fixture/data.sql");
    }

    @AfterEach
    public void tearDown() throws Exception {
        try {
            runScript("fixture/drop.sql");
        } finally {
            connection.close();
        }
    }

    protected MergeResult merge(MergeRequest request) {
        return merge(request, MergeSettings.defaults());
    }

    protected MergeResult merge(MergeRequest request, MergeSettings settings) {
        return new RdbmsMergeEngine(null, dialect, settings).merge(connection, request);
    }

    protected SqlSession session() {
        return new SqlSession(connection, dialect);
    }

    protected List<Stash> query(String sql, Object... params) throws SQLException {
        return session().query(sql, Arrays.asList(params));
    }

    protected List<Long> ids(String sql, Object... params) throws SQLException {
        return session().queryIds(sql, Arrays.asList(params));
    }

    protected long count(String sql, Object... params) throws SQLException {
        return ids(sql, params).get(0);
    }

    /**
     * First column of the first row; null when there is no row or the value is SQL null.
     */
    protected Object value(String sql, Object... params) throws SQLException {
        List<Stash> rows = query(sql, params);
        if (rows.isEmpty() || rows.get(0).isEmpty()) {
            return null;
        }
        Stash row = rows.get(0);
        return row.get(row.keySet().iterator().next());
    }

    protected void runScript(String path) throws IOException, SQLException {
        try (Statement stmt = connection.createStatement()) {
            for (String sql : loadScript(path).split(";")) {
                if (!sql.isBlank()) {
                    stmt.execute(sql.trim());
                }
            }
        }
    }

    private static String loadScript(String path) throws IOException {
        try (InputStream is = StoreFixture.class.getClassLoader().getResourceAsStream(path)) {
            if (is == null) {
                throw new FileNotFoundException("Fixture not found: " + path);
            }
            try (InputStreamReader reader = new InputStreamReader(is, StandardCharsets.UTF_8)) {
                return new BufferedReader(reader).lines().collect(Collectors.joining("\n"));
            }
        }
    }
}
