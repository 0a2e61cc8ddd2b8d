package com.mergeql.core.reconcile;

import com.mergeql.core.FieldCategory;
import com.mergeql.core.MergeOperation;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import static org.junit.jupiter.api.Assertions.*;

class ReconciliationTableTest {

    @ParameterizedTest
    @EnumSource(FieldCategory.class)
    void everyCategoryHasASupportedDefault(FieldCategory category) {
        MergeOperation defaultOperation = ReconciliationTable.defaultOperation(category);

        assertNotNull(defaultOperation);
        assertTrue(ReconciliationTable.supports(category, defaultOperation));
        assertTrue(ReconciliationTable.supports(category, MergeOperation.KEEP));
    }

    @Test
    void defaults() {
        assertEquals(MergeOperation.KEEP, ReconciliationTable.defaultOperation(FieldCategory.SHORT_TEXT));
        assertEquals(MergeOperation.MERGE, ReconciliationTable.defaultOperation(FieldCategory.LONG_TEXT));
        assertEquals(MergeOperation.SUM, ReconciliationTable.defaultOperation(FieldCategory.FLOAT));
        assertEquals(MergeOperation.MERGE, ReconciliationTable.defaultOperation(FieldCategory.MULTI_REFERENCE));
        assertEquals(MergeOperation.KEEP, ReconciliationTable.defaultOperation(FieldCategory.SELECTION));
    }

    @Test
    void numericOperationsOnlyForNumbers() {
        assertTrue(ReconciliationTable.supports(FieldCategory.INTEGER, MergeOperation.AVG));
        assertFalse(ReconciliationTable.supports(FieldCategory.SHORT_TEXT, MergeOperation.SUM));
        assertFalse(ReconciliationTable.supports(FieldCategory.BOOLEAN, MergeOperation.MAX));
        assertNull(ReconciliationTable.combiner(FieldCategory.DATE, MergeOperation.SUM));
    }
}
