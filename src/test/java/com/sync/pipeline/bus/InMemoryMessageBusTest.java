package com.sync.pipeline.bus;

import com.sync.pipeline.core.model.EntityType;
import com.sync.pipeline.core.model.Stage;
import com.sync.pipeline.history.JobMetrics;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class InMemoryMessageBusTest {

    private static EventEnvelope syncEvent(String jobId) {
        SyncMetadata sync = new SyncMetadata("sync-1", 1, false, null, Instant.parse("2026-10-16T10:00:00Z"), jobId);
        return EventEnvelope.root(jobId, "tenant-a", "microsoft-365", EntityType.IDENTITIES, "ds-1",
                Stage.SYNC, new SyncPayload(jobId, "sync.identities", sync, Map.of("cursor", "50")));
    }

    @Nested
    @DisplayName("Synchronous delivery")
    class SynchronousTests {

        private final InMemoryMessageBus bus = InMemoryMessageBus.synchronous();

        @AfterEach
        void tearDown() {
            bus.close();
        }

        @Test
        @DisplayName("Should deliver to every matching subscription")
        void testFanOut() {
            List<String> received = new CopyOnWriteArrayList<>();
            bus.subscribe("microsoft-365.sync.*", e -> received.add("fetch:" + e.getTopic()));
            bus.subscribe("microsoft-365.sync.identities", e -> received.add("exact:" + e.getTopic()));
            bus.subscribe("halopsa.sync.*", e -> received.add("other"));

            bus.publish(syncEvent("job-1"));

            assertEquals(List.of("fetch:microsoft-365.sync.identities", "exact:microsoft-365.sync.identities"),
                    received);
            assertEquals(1, bus.getPublishedCount());
        }

        @Test
        @DisplayName("Should decode the payload to its concrete type")
        void testPayloadRoundTrip() {
            List<EventEnvelope> received = new CopyOnWriteArrayList<>();
            bus.subscribe("microsoft-365.sync.*", received::add);

            EventEnvelope published = syncEvent("job-7");
            bus.publish(published);

            EventEnvelope delivered = received.get(0);
            SyncPayload payload = delivered.payloadAs(SyncPayload.class);
            assertEquals("job-7", payload.jobId());
            assertEquals("sync-1", payload.syncMetadata().syncId());
            assertEquals("50", payload.metadata().get("cursor"));
            assertEquals(published.getEventId(), delivered.getEventId());
            assertEquals("tenant-a", delivered.getTenantId());
            assertEquals(EntityType.IDENTITIES, delivered.getEntityType());
        }

        @Test
        @DisplayName("A failing handler should not affect other subscribers")
        void testHandlerIsolation() {
            List<String> received = new CopyOnWriteArrayList<>();
            bus.subscribe("microsoft-365.sync.*", e -> {
                throw new IllegalStateException("boom");
            });
            bus.subscribe("microsoft-365.sync.*", e -> received.add(e.getEventId()));

            bus.publish(syncEvent("job-1"));

            assertEquals(1, received.size());
            assertEquals(1, bus.getHandlerFailureCount());
        }

        @Test
        @DisplayName("Closed subscriptions should stop receiving")
        void testUnsubscribe() {
            List<String> received = new CopyOnWriteArrayList<>();
            Subscription subscription = bus.subscribe("microsoft-365.sync.*", e -> received.add(e.getEventId()));
            subscription.close();

            bus.publish(syncEvent("job-1"));

            assertTrue(received.isEmpty());
        }

        @Test
        @DisplayName("Publishing on a closed bus should fail")
        void testClosedBus() {
            bus.close();
            assertThrows(IllegalStateException.class, () -> bus.publish(syncEvent("job-1")));
        }
    }

    @Nested
    @DisplayName("Event lineage")
    class LineageTests {

        @Test
        @DisplayName("Next event should keep the trace and point at its parent")
        void testNextKeepsTrace() {
            EventEnvelope root = syncEvent("job-1");
            SyncMetadata sync = root.payloadAs(SyncPayload.class).syncMetadata();
            EventEnvelope fetched = root.next(Stage.FETCHED,
                    new FetchedPayload(List.of(), 0, false, null, sync.withFinalBatch(true), new JobMetrics()));

            assertEquals("job-1", root.getParentEventId());
            assertEquals(root.getTraceId(), fetched.getTraceId());
            assertEquals(root.getEventId(), fetched.getParentEventId());
            assertNotEquals(root.getEventId(), fetched.getEventId());
            assertEquals("fetched.identities", fetched.getTopic());
            assertEquals("ds-1", fetched.getDataSourceId());
        }

        @Test
        @DisplayName("payloadAs should reject the wrong payload type")
        void testPayloadTypeMismatch() {
            EventEnvelope root = syncEvent("job-1");
            assertThrows(IllegalStateException.class, () -> root.payloadAs(FetchedPayload.class));
        }
    }

    @Nested
    @DisplayName("Pooled delivery")
    class PooledTests {

        @Test
        @DisplayName("awaitIdle should return once all deliveries finished")
        void testAwaitIdle() throws Exception {
            try (InMemoryMessageBus bus = new InMemoryMessageBus(4)) {
                List<String> received = new CopyOnWriteArrayList<>();
                bus.subscribe("microsoft-365.sync.*", e -> received.add(e.getEventId()));

                for (int i = 0; i < 20; i++) {
                    bus.publish(syncEvent("job-" + i));
                }

                assertTrue(bus.awaitIdle(5, TimeUnit.SECONDS));
                assertEquals(20, received.size());
            }
        }
    }
}
