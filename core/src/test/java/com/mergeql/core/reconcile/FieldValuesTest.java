package com.mergeql.core.reconcile;

import com.mergeql.core.FieldCategory;
import com.mergeql.core.MergeException;
import com.tailoredshapes.stash.Stash;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static com.tailoredshapes.stash.Stash.stash;
import static org.junit.jupiter.api.Assertions.*;

class FieldValuesTest {

    @Test
    void normalizesDriverValues() {
        assertEquals(5L, FieldValues.normalize(FieldCategory.INTEGER, 5));
        assertEquals(true, FieldValues.normalize(FieldCategory.BOOLEAN, 1));
        assertEquals(false, FieldValues.normalize(FieldCategory.BOOLEAN, "f"));
        assertEquals(LocalDate.of(2024, 2, 29), FieldValues.normalize(FieldCategory.DATE, "2024-02-29"));
        assertEquals(LocalDateTime.of(2024, 2, 29, 10, 15),
                FieldValues.normalize(FieldCategory.DATETIME, "2024-02-29 10:15:00"));
        assertEquals(List.of(1L, 2L), FieldValues.normalize(FieldCategory.MULTI_REFERENCE, List.of(1, 2)));
    }

    @Test
    void structuredTextBecomesAStash() {
        Stash value = (Stash) FieldValues.normalize(FieldCategory.STRUCTURED, "{\"k\":\"v\"}");

        assertEquals(Set.of("k"), value.keySet());
        assertEquals("v", value.get("k"));
        assertNull(FieldValues.normalize(FieldCategory.STRUCTURED, "  "));
        assertThrows(MergeException.class, () -> FieldValues.normalize(FieldCategory.STRUCTURED, "[1, 2]"));
    }

    @Test
    void structuredValuesAreStoredAsJson() {
        Object stored = FieldValues.toStorage(FieldCategory.STRUCTURED, stash("k", "v"));

        assertEquals("v", Stash.parseJSON((String) stored).get("k"));
        assertEquals("{\"k\":1}", FieldValues.toStorage(FieldCategory.STRUCTURED, Map.of("k", 1)));
        assertEquals("text", FieldValues.toStorage(FieldCategory.SHORT_TEXT, "text"));
    }

    @Test
    void emptiness() {
        assertTrue(FieldValues.isEmpty(null));
        assertTrue(FieldValues.isEmpty("  "));
        assertTrue(FieldValues.isEmpty(List.of()));
        assertTrue(FieldValues.isEmpty(new byte[0]));
        assertTrue(FieldValues.isEmpty(new Stash()));
        assertFalse(FieldValues.isEmpty(stash("k", "v")));
        assertFalse(FieldValues.isEmpty(0L));
        assertFalse(FieldValues.isEmpty(false));
    }

    @Test
    void sameValueComparesNumbersByValueAndListsAsSets() {
        assertTrue(FieldValues.sameValue(3L, 3));
        assertTrue(FieldValues.sameValue(2.50, 2.5));
        assertTrue(FieldValues.sameValue(List.of(1L, 2L), List.of(2L, 1L)));
        assertFalse(FieldValues.sameValue(null, 0L));
        assertTrue(FieldValues.sameValue(new byte[]{1}, new byte[]{1}));
    }

    @Test
    void sameValueComparesStashesKeyByKey() {
        assertTrue(FieldValues.sameValue(stash("a", 1L, "b", "x"), stash("b", "x", "a", 1)));
        assertFalse(FieldValues.sameValue(stash("a", 1L), stash("a", 1L, "b", "x")));
        assertFalse(FieldValues.sameValue(stash("a", 1L), stash("a", 2L)));
    }
}
