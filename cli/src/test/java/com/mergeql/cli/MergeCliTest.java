package com.mergeql.cli;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;

import static org.junit.jupiter.api.Assertions.*;

public class MergeCliTest {
    private final ObjectMapper mapper = new ObjectMapper();
    private final StringWriter out = new StringWriter();
    private final StringWriter err = new StringWriter();

    @TempDir
    Path dir;

    private String url;

    @BeforeEach
    public void createStore() throws SQLException {
        url = "jdbc:sqlite:" + dir.resolve("crm.db");
        try (Connection c = DriverManager.getConnection(url);
             Statement stmt = c.createStatement()) {
            stmt.execute("CREATE TABLE customer (id INTEGER PRIMARY KEY, name TEXT, visits INTEGER)");
            stmt.execute("CREATE TABLE invoice (id INTEGER PRIMARY KEY, customer_id INTEGER REFERENCES customer (id))");
            stmt.execute("CREATE TABLE ticket (id INTEGER PRIMARY KEY, owner_id INTEGER)");
            stmt.execute("INSERT INTO customer (id, name, visits) VALUES (1, 'Acme', 2), (2, 'ACME', 3)");
            stmt.execute("INSERT INTO invoice (id, customer_id) VALUES (10, 2), (11, 1)");
            stmt.execute("INSERT INTO ticket (id, owner_id) VALUES (20, 2)");
        }
    }

    private int run(String... args) {
        CommandLine cli = MergeCli.commandLine();
        cli.setOut(new PrintWriter(out));
        cli.setErr(new PrintWriter(err));
        return cli.execute(args);
    }

    private long scalar(String sql) throws SQLException {
        try (Connection c = DriverManager.getConnection(url);
             Statement stmt = c.createStatement();
             ResultSet rs = stmt.executeQuery(sql)) {
            assertTrue(rs.next());
            return rs.getLong(1);
        }
    }

    @Test
    public void mergePrintsTheResult() throws Exception {
        int exitCode = run("merge", "--jdbc-url", url, "--type", "customer",
                "--survivor", "1", "--duplicates", "2", "--mode", "direct");

        assertEquals(0, exitCode, err.toString());
        JsonNode result = mapper.readTree(out.toString());
        assertEquals("COMPLETED", result.get("status").asText());
        assertEquals(1, result.get("referencesRelinked").asInt());
        assertEquals(1, result.get("recordsDeleted").asInt());
        assertEquals(0, scalar("SELECT COUNT(*) FROM invoice WHERE customer_id = 2"));
        // without a catalog the ticket owner is not known to be a reference
        assertEquals(2, scalar("SELECT owner_id FROM ticket WHERE id = 20"));
    }

    @Test
    public void catalogFileAddsReferencesWithoutForeignKeys() throws Exception {
        Path catalog = dir.resolve("catalog.json");
        Files.writeString(catalog, "{"
                + "\"entityTypes\": {\"crm.customer\": {\"name\": \"crm.customer\", \"table\": \"customer\"},"
                + "                 \"crm.ticket\": {\"name\": \"crm.ticket\", \"table\": \"ticket\"}},"
                + "\"fields\": [{\"model\": \"crm.ticket\", \"name\": \"owner_id\","
                + "              \"category\": \"many2one\", \"relation\": \"crm.customer\"},"
                + "           {\"model\": \"crm.customer\", \"name\": \"visits\", \"category\": \"integer\"}]"
                + "}");

        int exitCode = run("merge", "--jdbc-url", url, "--catalog", catalog.toString(),
                "--type", "crm.customer", "--survivor", "1", "--duplicates", "2", "--mode", "direct",
                "--policy", "visits=sum");

        assertEquals(0, exitCode, err.toString());
        assertEquals(1, scalar("SELECT owner_id FROM ticket WHERE id = 20"));
        assertEquals(5, scalar("SELECT visits FROM customer WHERE id = 1"));
        assertEquals(1, scalar("SELECT COUNT(*) FROM customer"));
    }

    @Test
    public void keepDuplicatesLeavesTheRowsInPlace() throws Exception {
        int exitCode = run("merge", "--jdbc-url", url, "--type", "customer",
                "--survivor", "1", "--duplicates", "2", "--mode", "direct", "--keep-duplicates");

        assertEquals(0, exitCode, err.toString());
        assertEquals(2, scalar("SELECT COUNT(*) FROM customer"));
        assertEquals(0, scalar("SELECT COUNT(*) FROM invoice WHERE customer_id = 2"));
    }

    @Test
    public void introspectWritesTheRelationGraph() throws IOException {
        Path output = dir.resolve("graph.json");

        int exitCode = run("introspect", "--jdbc-url", url, "--type", "customer", "-o", output.toString());

        assertEquals(0, exitCode, err.toString());
        JsonNode graph = mapper.readTree(output.toFile());
        assertEquals("customer", graph.get("entityType").get("table").asText());
        assertEquals(1, graph.get("foreignKeys").size());
        assertEquals("invoice", graph.get("foreignKeys").get(0).get("table").asText().toLowerCase());
        assertTrue(out.toString().contains("Introspection written to"));
    }

    @Test
    public void survivorAmongDuplicatesFails() {
        int exitCode = run("merge", "--jdbc-url", url, "--type", "customer",
                "--survivor", "1", "--duplicates", "1,2");

        assertEquals(1, exitCode);
        assertTrue(err.toString().startsWith("Error: "), err.toString());
        assertEquals(2, assertDoesNotThrow(() -> scalar("SELECT COUNT(*) FROM customer")));
    }

    @Test
    public void unsupportedUrlsFail() {
        int exitCode = run("introspect", "--jdbc-url", "jdbc:h2:mem:x", "--type", "customer");

        assertEquals(1, exitCode);
        assertTrue(err.toString().contains("Unsupported JDBC url"), err.toString());
    }

    @Test
    public void missingRequiredOptionsAreUsageErrors() {
        int exitCode = run("merge", "--jdbc-url", url);

        assertEquals(2, exitCode);
        assertTrue(err.toString().contains("--type"));
    }
}
