package com.mergeql.core;

import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class FieldPolicyTest {

    @Test
    void parsesOperationKeys() {
        FieldPolicy policy = FieldPolicy.of(Map.of("amount", "sum", "note", "first-not-null", "flag", "OR"));

        assertEquals(Optional.of(MergeOperation.SUM), policy.operationFor("amount"));
        assertEquals(Optional.of(MergeOperation.FIRST_NOT_NULL), policy.operationFor("note"));
        assertEquals(Optional.of(MergeOperation.OR), policy.operationFor("flag"));
        assertEquals(Optional.empty(), policy.operationFor("other"));
    }

    @Test
    void unknownOperationIsRejected() {
        assertThrows(InvalidMergeRequestException.class, () -> FieldPolicy.of(Map.of("amount", "median")));
    }

    @Test
    void callerMapIsNeitherKeptNorModified() {
        Map<String, String> callerMap = new HashMap<>(Map.of("amount", "sum"));

        FieldPolicy policy = FieldPolicy.of(callerMap);
        callerMap.put("note", "keep");

        assertEquals("sum", callerMap.get("amount"));
        assertFalse(policy.isListed("note"));
        assertEquals(2, callerMap.size());
    }

    @Test
    void aFieldMayBeNamedLikeAControlKey() {
        FieldPolicy policy = FieldPolicy.builder()
                .field("preserve_unlisted", MergeOperation.KEEP)
                .build();

        assertTrue(policy.isListed("preserve_unlisted"));
        assertFalse(policy.preserveUnlisted());
    }

    @Test
    void defaultsAreEmpty() {
        assertTrue(FieldPolicy.defaults().operations().isEmpty());
        assertEquals(ValueOrder.SURVIVOR_FIRST, FieldPolicy.defaults().order());
    }
}
