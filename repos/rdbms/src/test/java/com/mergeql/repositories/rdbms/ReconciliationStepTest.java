package com.mergeql.repositories.rdbms;

import com.mergeql.core.EntityStore;
import com.mergeql.core.EntityType;
import com.mergeql.core.FieldCategory;
import com.mergeql.core.FieldMetadata;
import com.mergeql.core.FieldPolicy;
import com.mergeql.core.MergeRequest;
import com.mergeql.core.reconcile.ValueReconciler;
import com.tailoredshapes.stash.Stash;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Map;

import static com.tailoredshapes.stash.Stash.stash;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class ReconciliationStepTest {
    private static final FieldMetadata NOTES = FieldMetadata.scalar("partner", "notes", FieldCategory.LONG_TEXT);
    private static final FieldMetadata CREDIT = FieldMetadata.scalar("partner", "credit", FieldCategory.FLOAT);
    private static final FieldMetadata TAGS = FieldMetadata.multiReference("partner", "tag_ids", "tag",
            "partner_tag_rel", "partner_id", "tag_id");
    private static final FieldMetadata CONTACTS = FieldMetadata.reverseReference("partner", "contact_ids",
            "contact", "partner_id");

    @Mock
    private EntityStore store;

    private ReconciliationStep step;
    private RelationGraph graph;
    private MergeRequest request;

    @BeforeEach
    void setUp() {
        step = new ReconciliationStep(store, new ValueReconciler(" | ", "id"));
        graph = new RelationGraph(new EntityType("partner", "partner"), List.of(), List.of(), List.of(),
                List.of(NOTES, CREDIT, TAGS, CONTACTS));
        request = MergeRequest.builder("partner").duplicates(3L).survivor(2L).policy(FieldPolicy.defaults()).build();
    }

    private static Stash values(String notes, double credit, List<Long> tags, List<Long> contacts) {
        Stash values = stash("credit", credit, "tag_ids", tags, "contact_ids", contacts);
        if (notes != null) {
            values.put("notes", notes);
        }
        return values;
    }

    @Test
    void writesOnlyWhatChanged() {
        when(store.read(eq("partner"), eq(List.of(3L, 2L)), anyCollection())).thenReturn(Map.of(
                2L, values("a", 1.0, List.of(7L), List.of()),
                3L, values(null, 0.0, List.of(7L, 8L), List.of(40L))));

        List<String> written = step.apply(graph, request);

        verify(store).addLinks("partner", "tag_ids", List.of(2L), List.of(8L));
        verify(store).write("contact", List.of(40L), Map.of("partner_id", 2L));
        verify(store, never()).write(eq("partner"), anyCollection(), anyMap());
        verify(store, never()).removeLinks(anyString(), anyString(), anyCollection(), anyCollection());
        assertEquals(List.of("tag_ids", "contact_ids"), written);
    }

    @Test
    void secondRunWritesNothing() {
        when(store.read(eq("partner"), anyCollection(), anyCollection())).thenReturn(Map.of(
                2L, values("a | b", 3.0, List.of(7L, 8L), List.of(40L)),
                3L, values(null, 0.0, List.of(), List.of())));

        List<String> written = step.apply(graph, request);

        assertTrue(written.isEmpty());
        verify(store, never()).write(anyString(), anyCollection(), anyMap());
        verify(store, never()).addLinks(anyString(), anyString(), anyCollection(), anyCollection());
    }

    @Test
    void scalarChangesAreWrittenInOneCall() {
        when(store.read(eq("partner"), anyCollection(), anyCollection())).thenReturn(Map.of(
                2L, values("a", 1.0, List.of(), List.of()),
                3L, values("b", 2.5, List.of(), List.of())));

        step.apply(graph, request);

        verify(store, times(1)).write("partner", List.of(2L), Map.of("notes", "a | b", "credit", 3.5));
    }

    @Test
    void missingDuplicateRowIsTolerated() {
        when(store.read(eq("partner"), anyCollection(), anyCollection())).thenReturn(Map.of(
                2L, values("a", 1.0, List.of(), List.of())));

        assertTrue(step.apply(graph, request).isEmpty());
    }
}
