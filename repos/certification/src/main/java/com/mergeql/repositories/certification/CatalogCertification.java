package com.mergeql.repositories.certification;

import com.mergeql.core.ColumnRef;
import com.mergeql.core.EntityType;
import com.mergeql.core.FieldCategory;
import com.mergeql.core.FieldMetadata;
import com.mergeql.core.FieldPolicy;
import com.mergeql.core.ForeignKeyEdge;
import com.mergeql.core.MergeRequest;
import com.mergeql.core.config.MergeSettings;
import com.mergeql.repositories.rdbms.CatalogIntrospector;
import com.mergeql.repositories.rdbms.JdbcFieldRegistry;
import com.mergeql.repositories.rdbms.ReferenceField;
import com.mergeql.repositories.rdbms.RelationGraph;
import com.mergeql.repositories.rdbms.SqlSession;
import org.junit.jupiter.api.Test;

import java.sql.SQLException;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Catalog discovery, error classification and savepoints against a real store.
 */
public abstract class CatalogCertification extends StoreFixture {

    private RelationGraph discoverPartner() throws SQLException {
        SqlSession session = session();
        MergeSettings settings = MergeSettings.defaults();
        JdbcFieldRegistry registry = new JdbcFieldRegistry(session, settings.metadata());
        CatalogIntrospector introspector = new CatalogIntrospector(session, registry, settings);
        return introspector.discover(introspector.resolve("res.partner", null));
    }

    @Test
    public void foreignKeysToTheIdColumnAreDiscovered() throws SQLException {
        List<ForeignKeyEdge> edges = dialect.foreignKeysTo(connection, "partner", "id");

        Set<String> found = edges.stream()
                .map(e -> (e.table() + "." + e.column()).toLowerCase())
                .collect(Collectors.toSet());
        assertEquals(Set.of("invoice.partner_id", "partner.parent_id", "partner_tag_rel.partner_id"), found);
        assertTrue(edges.stream().allMatch(e -> e.referencedTable().equalsIgnoreCase("partner")));
    }

    @Test
    public void columnsAreListedLowerCased() throws SQLException {
        assertTrue(dialect.columns(connection, "partner").containsAll(Set.of("id", "parent_id", "properties")));
        assertTrue(dialect.columns(connection, "no_such_table").isEmpty());
        assertTrue(dialect.columnExists(connection, "follower", "RES_ID"));
        assertFalse(dialect.tableExists(connection, "no_such_table"));
    }

    @Test
    public void registryIsReadFromTheMetadataTables() {
        JdbcFieldRegistry registry = new JdbcFieldRegistry(session(), MergeSettings.defaults().metadata());

        assertEquals(new EntityType("res.partner", "partner"), registry.entityType("res.partner").orElseThrow());
        assertEquals("res_company", registry.resolve("res.company").table());

        FieldMetadata amount = registry.fields("account.invoice").stream()
                .filter(f -> f.name().equals("amount"))
                .findFirst()
                .orElseThrow();
        assertEquals(FieldCategory.FLOAT, amount.category());

        FieldMetadata tags = registry.fields("res.partner").stream()
                .filter(f -> f.name().equals("tag_ids"))
                .findFirst()
                .orElseThrow();
        assertEquals("partner_tag_rel", tags.relationTable());
        assertEquals("partner_id", tags.column1());
        assertEquals("tag_id", tags.column2());

        FieldMetadata displayName = registry.fields("res.partner").stream()
                .filter(f -> f.name().equals("display_name"))
                .findFirst()
                .orElseThrow();
        assertFalse(displayName.isMergeable());
    }

    @Test
    public void graphCombinesForeignKeysAndCatalogFields() throws SQLException {
        RelationGraph graph = discoverPartner();

        assertEquals("partner", graph.entityType().table());
        assertEquals(3, graph.foreignKeys().size());
        Set<String> references = graph.referenceFields().stream()
                .map(r -> r.model() + "." + r.column())
                .collect(Collectors.toSet());
        // the non stored field and the field of a type without a table are left out
        assertEquals(Set.of("res.partner.parent_id", "res.partner.tag.partner_ids",
                "account.invoice.partner_id", "res.contact.company_id"), references);
        assertEquals(List.of(new ColumnRef("property", "value_reference")), graph.polymorphicColumns());
        assertEquals(List.of("parent_id"), graph.hierarchyColumns());
        assertTrue(graph.hasForeignKey("INVOICE", "partner_id"));
        assertFalse(graph.hasForeignKey("contact", "company_id"));
    }

    @Test
    public void multiReferencesResolveToTheirJunctionTable() throws SQLException {
        RelationGraph graph = discoverPartner();

        List<ReferenceField> multi = graph.referenceFields(FieldCategory.MULTI_REFERENCE);
        assertEquals(1, multi.size());
        assertEquals("partner_tag_rel", multi.get(0).storageTable());
        assertEquals("tag", multi.get(0).table());
    }

    @Test
    public void ownCollectionColumnsAreLeftToTheFieldPolicy() throws SQLException {
        RelationGraph graph = discoverPartner();
        MergeRequest defaults = MergeRequest.builder("res.partner").duplicates(2L).survivor(1L).build();
        MergeRequest keepContacts = MergeRequest.builder("res.partner").duplicates(2L).survivor(1L)
                .policy(FieldPolicy.of(Map.of("contact_ids", "keep", "tag_ids", "keep")))
                .build();

        assertEquals(new ColumnRef("partner_tag_rel", "partner_id"), graph.collectionColumns().get("tag_ids"));
        assertEquals(new ColumnRef("contact", "company_id"), graph.collectionColumns().get("contact_ids"));
        assertTrue(graph.isReconciled(defaults, "PARTNER_TAG_REL", "partner_id"));
        assertTrue(graph.isReconciled(defaults, "contact", "company_id"));
        assertTrue(graph.isReconciled(keepContacts, "partner_tag_rel", "partner_id"));
        assertFalse(graph.isReconciled(keepContacts, "contact", "company_id"));
        assertFalse(graph.isReconciled(defaults, "partner_tag_rel", "tag_id"));
        assertFalse(graph.isReconciled(defaults, "invoice", "partner_id"));
    }

    @Test
    public void extraReferenceColumnsAreAdded() throws SQLException {
        SqlSession session = session();
        MergeSettings settings = MergeSettings.builder()
                .extraReferenceColumn(new ColumnRef("attachment", "name"))
                .build();
        JdbcFieldRegistry registry = new JdbcFieldRegistry(session, settings.metadata());
        RelationGraph graph = new CatalogIntrospector(session, registry, settings)
                .discover(new EntityType("res.partner", "partner"));

        assertTrue(graph.polymorphicColumns().contains(new ColumnRef("attachment", "name")));
    }

    @Test
    public void uniqueViolationsAreRecognised() {
        SQLException e = assertThrows(SQLException.class,
                () -> session().execute("INSERT INTO tag (id, name) VALUES (?, ?)", List.of(10L, "again")));

        assertTrue(dialect.isUniqueViolation(e));
        assertTrue(dialect.isAnticipated(e));
        assertFalse(dialect.isUndefinedColumn(e));
    }

    @Test
    public void undefinedColumnsAndTablesAreRecognised() {
        SQLException column = assertThrows(SQLException.class,
                () -> session().execute("UPDATE tag SET missing = ? WHERE id = ?", List.of(1L, 10L)));
        assertTrue(dialect.isUndefinedColumn(column));

        SQLException table = assertThrows(SQLException.class,
                () -> session().execute("UPDATE missing SET name = ? WHERE id = ?", List.of("x", 10L)));
        assertTrue(dialect.isUndefinedTable(table));
        assertFalse(dialect.isUniqueViolation(table));
    }

    @Test
    public void failedSavepointKeepsEarlierWork() throws SQLException {
        SqlSession session = session();
        connection.setAutoCommit(false);
        try {
            session.inSavepoint("ok", () -> session.execute("INSERT INTO tag (id, name) VALUES (?, ?)",
                    List.of(13L, "partner")));
            assertThrows(SQLException.class, () -> session.inSavepoint("conflict", () -> {
                session.execute("INSERT INTO tag (id, name) VALUES (?, ?)", List.of(14L, "supplier"));
                return session.execute("INSERT INTO tag (id, name) VALUES (?, ?)", List.of(10L, "again"));
            }));
            connection.commit();
        } finally {
            connection.setAutoCommit(true);
        }

        assertEquals(List.of(13L), ids("SELECT id FROM tag WHERE id > ? ORDER BY id", 12L));
    }
}
