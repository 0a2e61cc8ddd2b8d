package com.mergeql.core;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.junit.jupiter.api.Assertions.*;

class FieldCategoryTest {

    @ParameterizedTest
    @CsvSource({
            "many2one, SINGLE_REFERENCE",
            "single_reference, SINGLE_REFERENCE",
            "many2many, MULTI_REFERENCE",
            "one2many, REVERSE_MULTI_REFERENCE",
            "reference, POLYMORPHIC_REFERENCE",
            "generic_reference, POLYMORPHIC_REFERENCE",
            "monetary, FLOAT",
            "html, LONG_TEXT",
            "char, SHORT_TEXT",
            "Reference , POLYMORPHIC_REFERENCE"
    })
    void typeNamesAndAliases(String name, FieldCategory expected) {
        assertEquals(expected, FieldCategory.fromTypeName(name));
    }

    @Test
    void typeNamesDoNotCollide() {
        for (FieldCategory category : FieldCategory.values()) {
            assertEquals(category, FieldCategory.fromTypeName(category.typeName()));
        }
    }

    @Test
    void constantNamesAreAcceptedFromJson() {
        assertEquals(FieldCategory.SINGLE_REFERENCE, FieldCategory.fromJson("single_reference"));
        assertEquals(FieldCategory.POLYMORPHIC_REFERENCE, FieldCategory.fromJson("POLYMORPHIC_REFERENCE"));
    }

    @Test
    void unknownTypeNameIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> FieldCategory.fromTypeName("many2everything"));
    }
}
