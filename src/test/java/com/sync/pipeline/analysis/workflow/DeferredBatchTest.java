package com.sync.pipeline.analysis.workflow;

import com.sync.pipeline.GraphRecords;
import com.sync.pipeline.alert.AlertCandidate;
import com.sync.pipeline.alert.AlertSeverity;
import com.sync.pipeline.core.model.Entity;
import com.sync.pipeline.core.model.EntityState;
import com.sync.pipeline.core.model.EntityType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class DeferredBatchTest {

    private static AlertCandidate candidate(String type, String entityId) {
        return new AlertCandidate(type, entityId, EntityType.IDENTITIES, AlertSeverity.HIGH, "msg", Map.of());
    }

    @Test
    @DisplayName("Empty batch has no mutations")
    void testEmpty() {
        DeferredBatch batch = DeferredBatch.empty();
        assertTrue(batch.isEmpty());
        assertEquals(0, batch.size());
        assertTrue(batch.getTouchedEntityIds().isEmpty());
    }

    @Test
    @DisplayName("Builder does not mutate the batch it came from")
    void testImmutable() {
        DeferredBatch first = DeferredBatch.empty().toBuilder().addTag("e1", "Admin").build();
        DeferredBatch second = first.toBuilder().addTag("e2", "Admin").build();

        assertEquals(Set.of("e1"), first.getTouchedEntityIds());
        assertEquals(Set.of("e1", "e2"), second.getTouchedEntityIds());
    }

    @Nested
    @DisplayName("Tags")
    class TagTests {

        @Test
        @DisplayName("Effective tags apply additions and removals to stored tags")
        void testEffectiveTags() {
            Entity entity = GraphRecords.entity("t", "ds", EntityType.IDENTITIES, "u1")
                    .tags(Set.of("Guest", "Disabled")).build();
            DeferredBatch batch = DeferredBatch.empty().toBuilder()
                    .addTag(entity.getId(), "Admin")
                    .removeTag(entity.getId(), "Disabled")
                    .build();

            assertEquals(Set.of("Guest", "Admin"), batch.effectiveTags(entity));
            assertTrue(batch.hasTag(entity, "Admin"));
            assertFalse(batch.hasTag(entity, "Disabled"));
        }

        @Test
        @DisplayName("Removing a tag after adding it cancels the addition")
        void testRemoveCancelsAdd() {
            DeferredBatch batch = DeferredBatch.empty().toBuilder()
                    .addTag("e1", "Admin")
                    .removeTag("e1", "Admin")
                    .build();

            assertFalse(batch.getTagsAdded().containsKey("e1"));
            assertEquals(Set.of("Admin"), batch.getTagsRemoved().get("e1"));
            assertEquals(1, batch.size());
        }

        @Test
        @DisplayName("Adding a tag after removing it cancels the removal")
        void testAddCancelsRemove() {
            DeferredBatch batch = DeferredBatch.empty().toBuilder()
                    .removeTag("e1", "Admin")
                    .addTag("e1", "Admin")
                    .build();

            assertEquals(Set.of("Admin"), batch.getTagsAdded().get("e1"));
            assertFalse(batch.getTagsRemoved().containsKey("e1"));
        }

        @Test
        @DisplayName("Untouched entities keep their stored tags")
        void testUntouched() {
            Entity entity = GraphRecords.entity("t", "ds", EntityType.IDENTITIES, "u1")
                    .tags(Set.of("Guest")).build();
            assertEquals(Set.of("Guest"), DeferredBatch.empty().effectiveTags(entity));
        }
    }

    @Nested
    @DisplayName("Alerts")
    class AlertTests {

        @Test
        @DisplayName("Resolving after raising drops the candidate")
        void testResolveAfterRaise() {
            DeferredBatch batch = DeferredBatch.empty().toBuilder()
                    .raise(candidate("mfa_not_enforced", "e1"))
                    .resolve("mfa_not_enforced", "e1")
                    .build();

            assertTrue(batch.getAlert("mfa_not_enforced", "e1").isEmpty());
            assertEquals(Set.of("mfa_not_enforced:e1"), batch.getResolvedFingerprints());
            assertEquals(Set.of("mfa_not_enforced"), batch.getEvaluatedAlertTypes());
        }

        @Test
        @DisplayName("Raising after resolving keeps the candidate")
        void testRaiseAfterResolve() {
            DeferredBatch batch = DeferredBatch.empty().toBuilder()
                    .resolve("mfa_not_enforced", "e1")
                    .raise(candidate("mfa_not_enforced", "e1"))
                    .build();

            assertTrue(batch.getAlert("mfa_not_enforced", "e1").isPresent());
            assertTrue(batch.getResolvedFingerprints().isEmpty());
        }

        @Test
        @DisplayName("A later raise for the same fingerprint replaces the earlier one")
        void testRaiseReplaces() {
            AlertCandidate critical = new AlertCandidate("mfa_not_enforced", "e1", EntityType.IDENTITIES,
                    AlertSeverity.CRITICAL, "admin", Map.of());
            DeferredBatch batch = DeferredBatch.empty().toBuilder()
                    .raise(candidate("mfa_not_enforced", "e1"))
                    .raise(critical)
                    .build();

            assertEquals(1, batch.getAlerts().size());
            assertEquals(AlertSeverity.CRITICAL, batch.getAlert("mfa_not_enforced", "e1").orElseThrow().severity());
        }

        @Test
        @DisplayName("An evaluated rule type alone makes the batch non-empty")
        void testEvaluatedOnly() {
            DeferredBatch batch = DeferredBatch.empty().toBuilder().evaluated("mfa_not_enforced").build();
            assertEquals(0, batch.size());
            assertFalse(batch.isEmpty());
        }
    }

    @Test
    @DisplayName("State changes count as touched entities")
    void testStates() {
        DeferredBatch batch = DeferredBatch.empty().toBuilder()
                .setState("e1", EntityState.WARN)
                .setState("e1", EntityState.CRITICAL)
                .build();

        assertEquals(EntityState.CRITICAL, batch.stateOf("e1").orElseThrow());
        assertEquals(Set.of("e1"), batch.getTouchedEntityIds());
        assertTrue(batch.stateOf("e2").isEmpty());
    }
}
