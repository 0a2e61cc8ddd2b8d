package com.mergeql.core;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class InMemoryFieldRegistryTest {

    private final InMemoryFieldRegistry registry = InMemoryFieldRegistry.builder()
            .entityType("res.partner", "partner")
            .field(FieldMetadata.scalar("res.partner", "name", FieldCategory.SHORT_TEXT))
            .field(FieldMetadata.reference("res.partner", "parent_id", "res.partner"))
            .field(FieldMetadata.reference("account.invoice", "partner_id", "res.partner"))
            .field(FieldMetadata.multiReference("res.partner", "tag_ids", "res.partner.tag",
                    "partner_tag_rel", "partner_id", "tag_id"))
            .build();

    @Test
    void fieldsTargetingOnlyReturnRelationalFields() {
        List<String> targeting = registry.fieldsTargeting("res.partner").stream()
                .map(f -> f.model() + "." + f.name())
                .toList();

        assertEquals(List.of("res.partner.parent_id", "account.invoice.partner_id"), targeting);
        assertTrue(registry.fieldsTargeting("res.partner").stream().allMatch(FieldMetadata::isMergeable));
    }

    @Test
    void unknownTypesDeriveTheirTable() {
        assertEquals("partner", registry.resolve("res.partner").table());
        assertEquals("sale_order_line", registry.resolve("sale.order.line").table());
        assertTrue(registry.entityType("sale.order.line").isEmpty());
    }

    @Test
    void selfReferencesAreRecognised() {
        assertTrue(registry.fields("res.partner").stream()
                .filter(f -> f.name().equals("parent_id"))
                .allMatch(FieldMetadata::isSelfReferential));
        assertEquals(1, registry.fieldsOfCategory(FieldCategory.MULTI_REFERENCE).size());
    }

    @Test
    void catalogFileIsReadWithStoreTypeNames() throws Exception {
        String json = """
                {
                  "entityTypes": {"crm.customer": {"name": "crm.customer", "table": "customer"}},
                  "fields": [
                    {"model": "crm.ticket", "name": "owner_id", "category": "many2one", "relation": "crm.customer"},
                    {"model": "crm.customer", "name": "revenue", "category": "monetary", "computed": true},
                    {"model": "crm.customer", "name": "tags", "category": "MULTI_REFERENCE", "stored": false}
                  ]
                }
                """;

        InMemoryFieldRegistry loaded = new ObjectMapper().readValue(json, InMemoryFieldRegistry.class);

        assertEquals(new EntityType("crm.customer", "customer"), loaded.entityType("crm.customer").orElseThrow());
        FieldMetadata owner = loaded.fieldsTargeting("crm.customer").get(0);
        assertEquals(FieldCategory.SINGLE_REFERENCE, owner.category());
        assertTrue(owner.stored());
        assertFalse(owner.computed());

        List<FieldMetadata> customer = loaded.fields("crm.customer");
        assertEquals(FieldCategory.FLOAT, customer.get(0).category());
        assertFalse(customer.get(0).isMergeable());
        assertEquals(FieldCategory.MULTI_REFERENCE, customer.get(1).category());
        assertFalse(customer.get(1).stored());
    }

    @Test
    void emptyCatalogFileIsAnEmptyRegistry() throws Exception {
        InMemoryFieldRegistry loaded = new ObjectMapper().readValue("{}", InMemoryFieldRegistry.class);

        assertTrue(loaded.allFields().isEmpty());
        assertTrue(loaded.entityType("crm.customer").isEmpty());
    }
}
