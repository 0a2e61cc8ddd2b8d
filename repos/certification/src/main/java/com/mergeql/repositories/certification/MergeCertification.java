package com.mergeql.repositories.certification;

import com.mergeql.core.ColumnRef;
import com.mergeql.core.FieldCategory;
import com.mergeql.core.FieldPolicy;
import com.mergeql.core.MergeMode;
import com.mergeql.core.MergeRequest;
import com.mergeql.core.MergeResult;
import com.mergeql.core.MergeStatus;
import com.mergeql.core.MergeStoreException;
import com.mergeql.core.RecursionDetectedException;
import com.mergeql.core.ValueOrder;
import com.mergeql.core.config.MergeSettings;
import com.mergeql.core.config.RecursionPolicy;
import com.mergeql.core.reconcile.FieldValues;
import com.tailoredshapes.stash.Stash;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.EnumSource;

import java.sql.SQLException;
import java.sql.Statement;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Behaviour every store must show when merging partners of the fixture database.
 */
public abstract class MergeCertification extends StoreFixture {

    private static MergeRequest partners(MergeMode mode) {
        return MergeRequest.builder("res.partner")
                .duplicates(2L, 3L)
                .survivor(1L)
                .mode(mode)
                .build();
    }

    @ParameterizedTest
    @EnumSource(MergeMode.class)
    public void noReferenceToADuplicateSurvives(MergeMode mode) throws SQLException {
        MergeResult result = merge(partners(mode));

        assertEquals(MergeStatus.COMPLETED, result.status());
        assertTrue(result.referencesRelinked() > 0);
        assertEquals(0, count("SELECT COUNT(*) FROM invoice WHERE partner_id IN (2, 3)"));
        assertEquals(0, count("SELECT COUNT(*) FROM contact WHERE company_id IN (2, 3)"));
        assertEquals(0, count("SELECT COUNT(*) FROM partner WHERE parent_id IN (2, 3)"));
        assertEquals(0, count("SELECT COUNT(*) FROM partner_tag_rel WHERE partner_id IN (2, 3)"));
        assertEquals(0, count("SELECT COUNT(*) FROM follower WHERE res_model = 'res.partner' AND res_id IN (2, 3)"));
        assertEquals(0, count("SELECT COUNT(*) FROM attachment WHERE res_model = 'res.partner' AND res_id IN (2, 3)"));
        assertEquals(0, count("SELECT COUNT(*) FROM translation WHERE res_model = 'res.partner' AND res_id IN (2, 3)"));

        assertEquals(List.of(100L, 101L, 102L), ids("SELECT id FROM invoice WHERE partner_id = ? ORDER BY id", 1L));
        assertEquals(List.of(40L, 41L), ids("SELECT id FROM contact WHERE company_id = ? ORDER BY id", 1L));
        assertEquals(1L, ((Number) value("SELECT parent_id FROM partner WHERE id = ?", 5L)).longValue());
    }

    @ParameterizedTest
    @EnumSource(MergeMode.class)
    public void sharedTagIsLinkedOnce(MergeMode mode) throws SQLException {
        merge(partners(mode));

        assertEquals(List.of(10L, 11L, 12L),
                ids("SELECT tag_id FROM partner_tag_rel WHERE partner_id = ? ORDER BY tag_id", 1L));
        assertEquals(1, count("SELECT COUNT(*) FROM partner_tag_rel WHERE partner_id = 1 AND tag_id = 10"));
    }

    @ParameterizedTest
    @EnumSource(MergeMode.class)
    public void registriesAreCleanedBeforeDuplicatesAreDeleted(MergeMode mode) throws SQLException {
        MergeResult result = merge(partners(mode));

        assertEquals(2, result.recordsDeleted());
        assertEquals(0, count("SELECT COUNT(*) FROM partner WHERE id IN (2, 3)"));
        assertEquals(0, count("SELECT COUNT(*) FROM external_id WHERE model = 'res.partner' AND res_id IN (2, 3)"));
        assertEquals(List.of(400L), ids("SELECT id FROM external_id WHERE model = 'res.partner' ORDER BY id"));
        // same ids under another type are not touched
        assertEquals(1, count("SELECT COUNT(*) FROM external_id WHERE id = 402"));
        assertEquals(1, count("SELECT COUNT(*) FROM attachment WHERE id = 301 AND res_id = 3"));
        assertEquals(List.of(300L), ids("SELECT id FROM attachment WHERE res_model = 'res.partner' AND res_id = 1"));
    }

    @ParameterizedTest
    @EnumSource(MergeMode.class)
    public void followerAlreadyHeldBySurvivorIsDropped(MergeMode mode) throws SQLException {
        MergeResult result = merge(partners(mode));

        assertTrue(result.conflictsDropped() > 0);
        assertEquals(List.of(90L, 91L), ids(
                "SELECT partner_id FROM follower WHERE res_model = 'res.partner' AND res_id = 1 ORDER BY partner_id"));
        assertEquals(0, count("SELECT COUNT(*) FROM follower WHERE id = 201"));
        assertEquals(1, count("SELECT COUNT(*) FROM follower WHERE id = 203 AND res_id = 2"));
    }

    @ParameterizedTest
    @EnumSource(MergeMode.class)
    public void oneTranslationPerLocaleSurvives(MergeMode mode) throws SQLException {
        merge(partners(mode));

        List<Stash> rows = query("SELECT lang, value FROM translation "
                + "WHERE res_model = 'res.partner' AND res_id = 1 AND field_name = 'name' ORDER BY lang");
        assertEquals(2, rows.size());
        assertEquals("de", rows.get(0).get("lang"));
        assertEquals("Acme DE", rows.get(0).get("value"));
        assertEquals("fr", rows.get(1).get("lang"));
        assertEquals("Acme FR", rows.get(1).get("value"));
    }

    @ParameterizedTest
    @EnumSource(MergeMode.class)
    public void typedReferenceTextIsRewritten(MergeMode mode) throws SQLException {
        merge(partners(mode));

        assertEquals("res.partner,1", value("SELECT value_reference FROM property WHERE id = ?", 600L));
        assertEquals("res.partner,22", value("SELECT value_reference FROM property WHERE id = ?", 601L));
    }

    @ParameterizedTest
    @EnumSource(MergeMode.class)
    public void defaultAlgebraReconcilesSurvivorValues(MergeMode mode) throws SQLException {
        MergeResult result = merge(partners(mode));

        assertEquals(Set.of("notes", "credit", "parent_id", "properties", "tag_ids", "contact_ids"),
                Set.copyOf(result.fieldsWritten()));
        assertEquals("Acme", partner(1, "name"));
        assertEquals("first customer | met at fair", partner(1, "notes"));
        assertEquals(5L, FieldValues.normalize(FieldCategory.INTEGER, partner(1, "visits")));
        assertEquals(15.0, (Double) FieldValues.normalize(FieldCategory.FLOAT, partner(1, "credit")), 0.0001);
        assertEquals(Boolean.TRUE, FieldValues.normalize(FieldCategory.BOOLEAN, partner(1, "active")));
        assertEquals(LocalDate.of(2020, 1, 1), FieldValues.normalize(FieldCategory.DATE, partner(1, "since")));
        assertEquals(4L, FieldValues.normalize(FieldCategory.SINGLE_REFERENCE, partner(1, "parent_id")));
        Stash properties = (Stash) FieldValues.normalize(FieldCategory.STRUCTURED, partner(1, "properties"));
        assertEquals(Set.of("tier", "region"), properties.keySet());
        assertEquals("gold", properties.get("tier"));
        assertEquals("north", properties.get("region"));
    }

    @ParameterizedTest
    @EnumSource(MergeMode.class)
    public void concatenatingOnlyEmptyTextWritesNothing(MergeMode mode) throws SQLException {
        MergeRequest request = MergeRequest.builder("res.partner")
                .duplicates(5L)
                .survivor(4L)
                .mode(mode)
                .build();

        MergeResult result = merge(request);

        assertTrue(result.isCompleted());
        assertFalse(result.fieldsWritten().contains("notes"));
        assertNull(partner(4, "notes"));
    }

    @ParameterizedTest
    @EnumSource(MergeMode.class)
    public void keptTagsAreOnlyTheSurvivorsOwn(MergeMode mode) throws SQLException {
        MergeRequest request = MergeRequest.builder("res.partner")
                .duplicates(2L, 3L)
                .survivor(1L)
                .mode(mode)
                .policy(FieldPolicy.of(Map.of("tag_ids", "keep")))
                .build();

        MergeResult result = merge(request);

        assertFalse(result.fieldsWritten().contains("tag_ids"));
        assertEquals(List.of(10L), ids("SELECT tag_id FROM partner_tag_rel WHERE partner_id = ? ORDER BY tag_id", 1L));
        assertEquals(0, count("SELECT COUNT(*) FROM partner_tag_rel WHERE partner_id IN (2, 3)"));
    }

    @ParameterizedTest
    @EnumSource(MergeMode.class)
    public void firstTagsAreTakenFromTheFirstDuplicate(MergeMode mode) throws SQLException {
        MergeRequest request = MergeRequest.builder("res.partner")
                .duplicates(2L, 3L)
                .survivor(1L)
                .mode(mode)
                .policy(FieldPolicy.of(Map.of("tag_ids", "first")))
                .build();

        MergeResult result = merge(request);

        assertTrue(result.fieldsWritten().contains("tag_ids"));
        assertEquals(List.of(10L, 11L),
                ids("SELECT tag_id FROM partner_tag_rel WHERE partner_id = ? ORDER BY tag_id", 1L));
        assertEquals(0, count("SELECT COUNT(*) FROM partner_tag_rel WHERE partner_id IN (2, 3)"));
    }

    @ParameterizedTest
    @EnumSource(MergeMode.class)
    public void keptContactsAreStillRepointed(MergeMode mode) throws SQLException {
        MergeRequest request = MergeRequest.builder("res.partner")
                .duplicates(2L, 3L)
                .survivor(1L)
                .mode(mode)
                .policy(FieldPolicy.of(Map.of("contact_ids", "keep")))
                .build();

        MergeResult result = merge(request);

        assertFalse(result.fieldsWritten().contains("contact_ids"));
        assertEquals(List.of(40L, 41L), ids("SELECT id FROM contact WHERE company_id = ? ORDER BY id", 1L));
    }

    @ParameterizedTest
    @EnumSource(MergeMode.class)
    public void missingReferenceColumnDoesNotStopTheMerge(MergeMode mode) throws SQLException {
        MergeSettings settings = MergeSettings.builder()
                .extraReferenceColumn(new ColumnRef("no_such_table", "ref"))
                .extraReferenceColumn(new ColumnRef("attachment", "missing"))
                .build();

        MergeResult result = merge(partners(mode), settings);

        assertEquals(MergeStatus.COMPLETED, result.status());
        assertEquals("res.partner,1", value("SELECT value_reference FROM property WHERE id = ?", 600L));
        assertEquals(0, count("SELECT COUNT(*) FROM partner WHERE id IN (2, 3)"));
    }

    @ParameterizedTest
    @CsvSource({"sum, 10", "max, 5", "min, 0", "avg, 3"})
    public void numericPolicyCombinesSurvivorAndDuplicates(String operation, long expected) throws SQLException {
        givenVisits();
        MergeRequest request = MergeRequest.builder("res.partner")
                .duplicates(2L, 3L, 5L)
                .survivor(1L)
                .policy(FieldPolicy.of(Map.of("visits", operation)))
                .build();

        merge(request);

        assertEquals(expected, FieldValues.normalize(FieldCategory.INTEGER, partner(1, "visits")));
    }

    @Test
    public void firstNotNullTakesTheEarliestDuplicate() throws SQLException {
        givenVisits();
        MergeRequest request = MergeRequest.builder("res.partner")
                .duplicates(2L, 3L, 5L)
                .survivor(1L)
                .policy(FieldPolicy.builder().field("visits", "first_not_null").order(ValueOrder.DUPLICATES_FIRST).build())
                .mode(MergeMode.DIRECT)
                .build();

        merge(request);

        assertEquals(3L, FieldValues.normalize(FieldCategory.INTEGER, partner(1, "visits")));
    }

    @Test
    public void preserveUnlistedOnlyTouchesListedFields() throws SQLException {
        MergeRequest request = MergeRequest.builder("res.partner")
                .duplicates(2L, 3L)
                .survivor(1L)
                .policy(FieldPolicy.builder().field("visits", "sum").preserveUnlisted(true).build())
                .build();

        MergeResult result = merge(request);

        assertEquals(List.of("visits"), result.fieldsWritten());
        assertEquals(12L, FieldValues.normalize(FieldCategory.INTEGER, partner(1, "visits")));
        assertEquals("first customer", partner(1, "notes"));
        assertNull(partner(1, "parent_id"));
    }

    @ParameterizedTest
    @EnumSource(MergeMode.class)
    public void secondRunWritesNothing(MergeMode mode) {
        merge(partners(mode));

        MergeResult again = merge(partners(mode));

        assertTrue(again.isCompleted());
        assertEquals(List.of(), again.fieldsWritten());
        assertEquals(0, again.referencesRelinked());
        assertEquals(0, again.recordsDeleted());
    }

    @ParameterizedTest
    @EnumSource(MergeMode.class)
    public void duplicatesStayWhenDeleteIsOff(MergeMode mode) throws SQLException {
        MergeRequest request = MergeRequest.builder("res.partner")
                .duplicates(2L, 3L)
                .survivor(1L)
                .mode(mode)
                .delete(false)
                .build();

        MergeResult result = merge(request);

        assertEquals(0, result.recordsDeleted());
        assertEquals(2, count("SELECT COUNT(*) FROM partner WHERE id IN (2, 3)"));
        assertEquals(1, count("SELECT COUNT(*) FROM external_id WHERE id = 401"));
        assertEquals(0, count("SELECT COUNT(*) FROM invoice WHERE partner_id IN (2, 3)"));
    }

    @ParameterizedTest
    @EnumSource(MergeMode.class)
    public void excludedColumnIsLeftAlone(MergeMode mode) throws SQLException {
        MergeRequest request = MergeRequest.builder("res.partner")
                .duplicates(2L, 3L)
                .survivor(1L)
                .mode(mode)
                .delete(false)
                .exclude("invoice", "partner_id")
                .build();

        merge(request);

        assertEquals(List.of(100L), ids("SELECT id FROM invoice WHERE partner_id = ?", 2L));
        assertEquals(List.of(101L), ids("SELECT id FROM invoice WHERE partner_id = ?", 3L));
        assertEquals(List.of(40L, 41L), ids("SELECT id FROM contact WHERE company_id = ? ORDER BY id", 1L));
    }

    @ParameterizedTest
    @EnumSource(MergeMode.class)
    public void storeErrorRollsBackTheWholeMerge(MergeMode mode) throws SQLException {
        // invoices still point at the duplicates, so deleting them violates the foreign key
        MergeRequest request = MergeRequest.builder("res.partner")
                .duplicates(2L, 3L)
                .survivor(1L)
                .mode(mode)
                .exclude("invoice", "partner_id")
                .build();

        assertThrows(MergeStoreException.class, () -> merge(request));

        assertEquals(2, count("SELECT COUNT(*) FROM partner WHERE id IN (2, 3)"));
        assertEquals(List.of(40L), ids("SELECT id FROM contact WHERE company_id = ?", 2L));
        assertEquals(1, count("SELECT COUNT(*) FROM follower WHERE id = 201"));
        assertEquals("first customer", partner(1, "notes"));
    }

    @ParameterizedTest
    @EnumSource(MergeMode.class)
    public void mergingAParentIntoItsChildIsRefused(MergeMode mode) throws SQLException {
        MergeRequest request = MergeRequest.builder("res.partner")
                .duplicates(4L)
                .survivor(3L)
                .mode(mode)
                .build();

        MergeResult result = merge(request);

        assertEquals(MergeStatus.RECURSION_DETECTED, result.status());
        assertNotNull(result.message());
        assertEquals(4L, FieldValues.normalize(FieldCategory.SINGLE_REFERENCE, partner(3, "parent_id")));
        assertEquals(1, count("SELECT COUNT(*) FROM partner WHERE id = 4"));
    }

    @Test
    public void recursionIsRaisedWhenConfigured() throws SQLException {
        MergeRequest request = MergeRequest.builder("res.partner")
                .duplicates(4L)
                .survivor(3L)
                .build();
        MergeSettings settings = MergeSettings.builder().onRecursion(RecursionPolicy.RAISE).build();

        RecursionDetectedException e = assertThrows(RecursionDetectedException.class,
                () -> merge(request, settings));

        assertEquals(4L, e.getAncestorId());
        assertEquals("parent_id", e.getColumn());
        assertEquals(4L, FieldValues.normalize(FieldCategory.SINGLE_REFERENCE, partner(3, "parent_id")));
    }

    @Test
    public void typeTagIsRenamedOnSideTables() throws SQLException {
        MergeRequest request = MergeRequest.builder("res.partner")
                .duplicates(2L)
                .survivor(1L)
                .mode(MergeMode.DIRECT)
                .renameTypeTo("res.company")
                .build();

        merge(request);

        assertEquals("res.company", value("SELECT res_model FROM attachment WHERE id = ?", 300L));
        assertEquals(1L, ((Number) value("SELECT res_id FROM attachment WHERE id = ?", 300L)).longValue());
        assertEquals(List.of(200L), ids("SELECT id FROM follower WHERE res_model = 'res.company' ORDER BY id"));
        assertEquals("account.invoice", value("SELECT res_model FROM attachment WHERE id = ?", 301L));
    }

    @Test
    public void renamedTagDoesNotRepeatAFollowerAlreadyFiledUnderIt() throws SQLException {
        try (Statement stmt = connection.createStatement()) {
            stmt.executeUpdate("INSERT INTO follower (id, res_model, res_id, partner_id) "
                    + "VALUES (204, 'res.company', 1, 90)");
        }
        MergeRequest request = MergeRequest.builder("res.partner")
                .duplicates(2L)
                .survivor(1L)
                .mode(MergeMode.DIRECT)
                .renameTypeTo("res.company")
                .build();

        MergeResult result = merge(request);

        assertTrue(result.isCompleted());
        assertTrue(result.conflictsDropped() >= 2);
        assertEquals(List.of(204L), ids("SELECT id FROM follower WHERE res_model = 'res.company' ORDER BY id"));
        assertEquals(0, count("SELECT COUNT(*) FROM follower WHERE res_model = 'res.partner' AND res_id IN (1, 2)"));
    }

    @Test
    public void junctionConflictIsDroppedForAnExplicitTable() throws SQLException {
        MergeRequest request = MergeRequest.builder("legacy.tag")
                .duplicates(11L)
                .survivor(10L)
                .mode(MergeMode.DIRECT)
                .tableName("tag")
                .build();

        MergeResult result = merge(request);

        assertEquals(1, result.conflictsDropped());
        assertEquals(1, result.recordsDeleted());
        assertEquals(List.of(10L), ids("SELECT tag_id FROM partner_tag_rel WHERE partner_id = ?", 2L));
        assertEquals(0, count("SELECT COUNT(*) FROM tag WHERE id = 11"));
    }

    private Object partner(long id, String column) throws SQLException {
        return value("SELECT " + column + " FROM partner WHERE id = ?", id);
    }

    private void givenVisits() throws SQLException {
        try (Statement stmt = connection.createStatement()) {
            stmt.executeUpdate("UPDATE partner SET visits = 2 WHERE id = 1");
            stmt.executeUpdate("UPDATE partner SET visits = 3 WHERE id = 2");
            stmt.executeUpdate("UPDATE partner SET visits = 5 WHERE id = 3");
            stmt.executeUpdate("UPDATE partner SET visits = NULL WHERE id = 5");
        }
    }
}
