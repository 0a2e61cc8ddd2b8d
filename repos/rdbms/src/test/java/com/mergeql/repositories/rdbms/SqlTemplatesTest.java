package com.mergeql.repositories.rdbms;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class SqlTemplatesTest {
    private final SqlTemplates templates = SqlTemplates.load();

    @Test
    void relinkExcludesTheSurvivorOnSelfReferences() {
        String plain = SqlTemplates.render(templates.relink(), Map.of(
                "table", "\"invoice\"", "column", "\"partner_id\"", "placeholders", "?, ?"));
        String self = SqlTemplates.render(templates.relink(), Map.of(
                "table", "\"partner\"", "column", "\"parent_id\"", "placeholders", "?",
                "excludeId", true, "idColumn", "\"id\""));

        assertEquals("UPDATE \"invoice\" SET \"partner_id\" = ? WHERE \"partner_id\" IN (?, ?)", plain);
        assertEquals("UPDATE \"partner\" SET \"parent_id\" = ? WHERE \"parent_id\" IN (?) AND \"id\" <> ?", self);
    }

    @Test
    void rowStatementsJoinKeys() {
        String sql = SqlTemplates.render(templates.deleteRow(), Map.of(
                "table", "\"partner_tag_rel\"", "keys", List.of("\"partner_id\"", "\"tag_id\"")));

        assertEquals("DELETE FROM \"partner_tag_rel\" WHERE \"partner_id\" = ? AND \"tag_id\" = ?", sql);
    }

    @Test
    void scopedSelect() {
        String sql = SqlTemplates.render(templates.select(), Map.of(
                "table", "\"follower\"", "columns", "\"id\", \"partner_id\"", "scopeColumn", "\"res_model\"",
                "column", "\"res_id\"", "placeholders", "?, ?", "orderBy", "\"id\""));

        assertEquals("SELECT \"id\", \"partner_id\" FROM \"follower\" WHERE \"res_model\" = ? "
                + "AND \"res_id\" IN (?, ?) ORDER BY \"id\"", sql);
    }

    @Test
    void updateRecordListsColumns() {
        String sql = SqlTemplates.render(templates.updateRecord(), Map.of(
                "table", "\"partner\"", "columns", List.of("\"name\"", "\"credit\""),
                "idColumn", "\"id\"", "placeholders", "?"));

        assertEquals("UPDATE \"partner\" SET \"name\" = ?, \"credit\" = ? WHERE \"id\" IN (?)", sql);
    }
}
