package com.sync.pipeline.fetch;

import com.sync.pipeline.GraphRecords;
import com.sync.pipeline.bus.EventEnvelope;
import com.sync.pipeline.bus.FetchedPayload;
import com.sync.pipeline.bus.InMemoryMessageBus;
import com.sync.pipeline.bus.SyncMetadata;
import com.sync.pipeline.bus.SyncPayload;
import com.sync.pipeline.bus.Topic;
import com.sync.pipeline.connector.ConnectorException;
import com.sync.pipeline.connector.ConnectorHealth;
import com.sync.pipeline.connector.ConnectorRegistry;
import com.sync.pipeline.connector.InMemoryConnector;
import com.sync.pipeline.core.model.DataSource;
import com.sync.pipeline.core.model.EntityType;
import com.sync.pipeline.core.model.Stage;
import com.sync.pipeline.hash.DataHasher;
import com.sync.pipeline.history.JobMetrics;
import com.sync.pipeline.metrics.NoOpMetricsService;
import com.sync.pipeline.queue.JobQueue;
import com.sync.pipeline.queue.JobRequest;
import com.sync.pipeline.store.InMemoryDocumentStore;
import com.sync.pipeline.tracing.NoOpTracingService;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.time.Instant;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

class FetchStageTest {

    private static final String TENANT = "tenant-a";

    private InMemoryMessageBus bus;
    private JobQueue queue;
    private InMemoryConnector connector;
    private FetchStage stage;
    private final List<EventEnvelope> fetched = new CopyOnWriteArrayList<>();

    @BeforeEach
    void setUp() {
        bus = InMemoryMessageBus.synchronous();
        bus.subscribe(Topic.allOf(Stage.FETCHED), fetched::add);
        queue = mock(JobQueue.class);
        when(queue.getJob(anyString())).thenReturn(Optional.empty());
        when(queue.schedule(any(JobRequest.class))).thenReturn("job-next");

        connector = new InMemoryConnector(GraphRecords.INTEGRATION, EnumSet.of(EntityType.IDENTITIES, EntityType.GROUPS))
                .withRecords("ds-1", EntityType.IDENTITIES, List.of(
                        GraphRecords.user("u1", "alice@contoso.com"),
                        GraphRecords.user("u2", "bob@contoso.com"),
                        GraphRecords.user("u3", "carol@contoso.com")));

        InMemoryDocumentStore<DataSource> dataSources = new InMemoryDocumentStore<>("data_sources");
        dataSources.insert(List.of(DataSource.builder()
                .id("ds-1")
                .tenantId(TENANT)
                .integrationType(GraphRecords.INTEGRATION)
                .config(Map.of("domainMappings", List.of(Map.of("domain", "contoso.com", "siteId", "site-hq"))))
                .build()));

        stage = new FetchStage(GraphRecords.INTEGRATION, new ConnectorRegistry(List.of(connector)), dataSources,
                queue, bus, new DataHasher(), new DomainSiteResolver(), 2,
                new NoOpMetricsService(), new NoOpTracingService());
    }

    @AfterEach
    void tearDown() {
        bus.close();
    }

    private static EventEnvelope syncEvent(String jobId, EntityType type, String dataSourceId, String cursor, int batch) {
        SyncMetadata sync = new SyncMetadata("sync-1", batch, false, cursor, Instant.now(), jobId);
        return EventEnvelope.root(jobId, TENANT, GraphRecords.INTEGRATION, type, dataSourceId, Stage.SYNC,
                new SyncPayload(jobId, "sync." + type.getWireName(), sync, Map.of()));
    }

    @Nested
    @DisplayName("Paging")
    class PagingTests {

        @Test
        @DisplayName("First page should complete the job, publish records and enqueue the next page")
        void testFirstPage() {
            stage.handle(syncEvent("job-1", EntityType.IDENTITIES, "ds-1", null, 1));

            verify(queue).completeJob("job-1");
            assertEquals(1, fetched.size());
            FetchedPayload payload = fetched.get(0).payloadAs(FetchedPayload.class);
            assertEquals(2, payload.data().size());
            assertTrue(payload.hasMore());
            assertEquals("2", payload.nextPageToken());
            assertFalse(payload.syncMetadata().finalBatch());
            assertEquals("fetched.identities", fetched.get(0).getTopic());

            ArgumentCaptor<JobRequest> next = ArgumentCaptor.forClass(JobRequest.class);
            verify(queue).schedule(next.capture());
            assertEquals("sync-1", next.getValue().syncId());
            assertEquals("2", next.getValue().metadata().get(JobRequest.META_CURSOR));
            assertEquals(2, next.getValue().metadata().get(JobRequest.META_BATCH_NUMBER));
            assertEquals(EntityType.IDENTITIES, next.getValue().entityType());
        }

        @Test
        @DisplayName("A pipeline retry of a middle page should not enqueue the following page again")
        void testRetryDoesNotRescheduleNextPage() {
            SyncMetadata sync = new SyncMetadata("sync-1", 1, false, null, Instant.now(), "job-retry");
            stage.handle(EventEnvelope.root("job-retry", TENANT, GraphRecords.INTEGRATION, EntityType.IDENTITIES,
                    "ds-1", Stage.SYNC, new SyncPayload("job-retry", "sync.identities", sync,
                            Map.of(JobRequest.META_RETRY_OF, "job-1", JobRequest.META_PIPELINE_RETRIES, 1))));

            verify(queue).completeJob("job-retry");
            verify(queue, never()).schedule(any(JobRequest.class));
            FetchedPayload payload = fetched.get(0).payloadAs(FetchedPayload.class);
            assertEquals(2, payload.data().size());
            assertTrue(payload.hasMore());
            assertFalse(payload.syncMetadata().finalBatch());
        }

        @Test
        @DisplayName("Last page should be marked final and enqueue nothing")
        void testLastPage() {
            stage.handle(syncEvent("job-2", EntityType.IDENTITIES, "ds-1", "2", 2));

            verify(queue).completeJob("job-2");
            verify(queue, never()).schedule(any(JobRequest.class));
            FetchedPayload payload = fetched.get(0).payloadAs(FetchedPayload.class);
            assertEquals(1, payload.data().size());
            assertFalse(payload.hasMore());
            assertTrue(payload.syncMetadata().finalBatch());
            assertEquals(2, payload.syncMetadata().batchNumber());
        }

        @Test
        @DisplayName("Records should carry their content hash and resolved site")
        void testRecordsHashedAndSited() {
            stage.handle(syncEvent("job-1", EntityType.IDENTITIES, "ds-1", null, 1));

            DataFetchRecord first = fetched.get(0).payloadAs(FetchedPayload.class).data().get(0);
            assertEquals("u1", first.externalId());
            assertEquals("site-hq", first.siteId());
            assertEquals(new DataHasher().hash(EntityType.IDENTITIES, GraphRecords.user("u1", "alice@contoso.com").data()),
                    first.dataHash());
        }

        @Test
        @DisplayName("Empty result should publish an empty final batch")
        void testEmptyResult() {
            stage.handle(syncEvent("job-1", EntityType.GROUPS, "ds-1", null, 1));

            FetchedPayload payload = fetched.get(0).payloadAs(FetchedPayload.class);
            assertTrue(payload.data().isEmpty());
            assertTrue(payload.syncMetadata().finalBatch());
        }

        @Test
        @DisplayName("Fetch phase timing and external calls should be recorded")
        void testMetrics() {
            stage.handle(syncEvent("job-1", EntityType.IDENTITIES, "ds-1", null, 1));

            JobMetrics metrics = fetched.get(0).payloadAs(FetchedPayload.class).metrics();
            assertEquals(2, metrics.getExternalCallCount());
            assertEquals(1, metrics.getQueryCount());
            assertTrue(metrics.getStageTimesMs().containsKey(JobMetrics.Phase.FETCH));
        }
    }

    @Nested
    @DisplayName("Failures")
    class FailureTests {

        @Test
        @DisplayName("Transient connector failure should fail the job as retryable")
        void testTransientFailure() {
            connector.failNext(ConnectorException.transientFailure("429 Too Many Requests", null));

            stage.handle(syncEvent("job-1", EntityType.IDENTITIES, "ds-1", null, 1));

            verify(queue).failJob("job-1", "429 Too Many Requests", true);
            verify(queue, never()).completeJob(anyString());
            assertTrue(fetched.isEmpty());
        }

        @Test
        @DisplayName("Authentication failure should not be retried")
        void testAuthenticationFailure() {
            connector.failNext(ConnectorException.authentication("invalid client secret"));

            stage.handle(syncEvent("job-1", EntityType.IDENTITIES, "ds-1", null, 1));

            verify(queue).failJob("job-1", "invalid client secret", false);
            assertTrue(fetched.isEmpty());
        }

        @Test
        @DisplayName("Unsupported entity type should not be retried")
        void testUnsupportedType() {
            stage.handle(syncEvent("job-1", EntityType.POLICIES, "ds-1", null, 1));

            verify(queue).failJob(eq("job-1"), anyString(), eq(false));
            assertEquals(0, connector.getFetchCount());
        }

        @Test
        @DisplayName("Unknown data source should fail as a configuration error")
        void testMissingDataSource() {
            stage.handle(syncEvent("job-1", EntityType.IDENTITIES, "ds-gone", null, 1));

            verify(queue).failJob(eq("job-1"), contains("ds-gone"), eq(false));
        }

        @Test
        @DisplayName("Failed health check should fail the job before fetching")
        void testUnhealthyConnector() {
            connector.withHealth(ConnectorHealth.unhealthy("consent revoked"));
            stage.handle(syncEvent("job-1", EntityType.IDENTITIES, "ds-1", null, 1));
            verify(queue).failJob(eq("job-1"), contains("consent revoked"), eq(false));

            connector.withHealth(ConnectorHealth.unavailable("graph unreachable"));
            stage.handle(syncEvent("job-2", EntityType.IDENTITIES, "ds-1", null, 1));
            verify(queue).failJob(eq("job-2"), contains("graph unreachable"), eq(true));

            assertEquals(0, connector.getFetchCount());
        }

        @Test
        @DisplayName("Unexpected errors should be treated as retryable")
        void testUnexpectedError() {
            connector.failNext(new IllegalStateException("socket reset"));

            stage.handle(syncEvent("job-1", EntityType.IDENTITIES, "ds-1", null, 1));

            verify(queue).failJob("job-1", "socket reset", true);
        }

        @Test
        @DisplayName("A job already closed elsewhere should publish nothing")
        void testSupersededJob() {
            doThrow(new IllegalStateException("Job job-1 is FAILED, expected PROCESSING"))
                    .when(queue).completeJob("job-1");

            stage.handle(syncEvent("job-1", EntityType.IDENTITIES, "ds-1", null, 1));

            assertTrue(fetched.isEmpty());
            verify(queue, never()).schedule(any(JobRequest.class));
            verify(queue, never()).failJob(anyString(), anyString(), anyBoolean());
        }
    }
}
