package com.sync.pipeline;

import com.sync.pipeline.alert.Alert;
import com.sync.pipeline.alert.AlertService;
import com.sync.pipeline.analysis.context.ContextLoader;
import com.sync.pipeline.analysis.nodes.Microsoft365LicenseWorker;
import com.sync.pipeline.analysis.nodes.Microsoft365PolicyWorker;
import com.sync.pipeline.analysis.nodes.Microsoft365SecurityWorker;
import com.sync.pipeline.analysis.nodes.Microsoft365StaleUserWorker;
import com.sync.pipeline.analysis.workflow.AnalysisStage;
import com.sync.pipeline.analysis.workflow.AnalysisWorker;
import com.sync.pipeline.analysis.workflow.BatchFlusher;
import com.sync.pipeline.analysis.workflow.WorkflowEngine;
import com.sync.pipeline.audit.AuditRepository;
import com.sync.pipeline.audit.AuditService;
import com.sync.pipeline.audit.InMemoryAuditRepository;
import com.sync.pipeline.bus.InMemoryMessageBus;
import com.sync.pipeline.bus.MessageBus;
import com.sync.pipeline.cleanup.CleanupStage;
import com.sync.pipeline.config.PipelineOptions;
import com.sync.pipeline.connector.Connector;
import com.sync.pipeline.connector.ConnectorHealthCheck;
import com.sync.pipeline.connector.ConnectorRegistry;
import com.sync.pipeline.core.model.DataSource;
import com.sync.pipeline.core.model.Entity;
import com.sync.pipeline.core.model.EntityType;
import com.sync.pipeline.core.model.Relationship;
import com.sync.pipeline.fetch.DomainSiteResolver;
import com.sync.pipeline.fetch.FetchStage;
import com.sync.pipeline.fetch.SiteResolver;
import com.sync.pipeline.hash.DataHasher;
import com.sync.pipeline.hash.HashPolicies;
import com.sync.pipeline.health.HealthCheckRegistry;
import com.sync.pipeline.health.HealthStatus;
import com.sync.pipeline.health.JobQueueHealthCheck;
import com.sync.pipeline.history.JobHistory;
import com.sync.pipeline.history.JobHistoryRecorder;
import com.sync.pipeline.history.JobHistoryService;
import com.sync.pipeline.link.LinkRules;
import com.sync.pipeline.link.LinkStage;
import com.sync.pipeline.lock.DistributedLock;
import com.sync.pipeline.lock.LocalDistributedLock;
import com.sync.pipeline.metrics.MetricsService;
import com.sync.pipeline.metrics.NoOpMetricsService;
import com.sync.pipeline.normalize.NormalizeStage;
import com.sync.pipeline.normalize.NormalizerRegistry;
import com.sync.pipeline.normalize.halopsa.HaloPsaNormalizers;
import com.sync.pipeline.normalize.microsoft365.Microsoft365Normalizers;
import com.sync.pipeline.queue.BusJobDispatcher;
import com.sync.pipeline.queue.InMemoryJobQueue;
import com.sync.pipeline.queue.JobQueue;
import com.sync.pipeline.queue.JobRequest;
import com.sync.pipeline.queue.PipelineFailureHandler;
import com.sync.pipeline.schedule.SchedulingConfiguration;
import com.sync.pipeline.schedule.SyncScheduler;
import com.sync.pipeline.store.DocumentStore;
import com.sync.pipeline.store.EntityRepository;
import com.sync.pipeline.store.InMemoryDocumentStore;
import com.sync.pipeline.store.RelationshipRepository;
import com.sync.pipeline.tenant.TenantContext;
import com.sync.pipeline.tracing.NoOpTracingService;
import com.sync.pipeline.tracing.TracingService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

/**
 * The assembled sync pipeline.
 *
 * <p>Every component receives its bus, queue, stores and services at construction; nothing is
 * looked up globally. {@link #start()} subscribes the stages and starts the queue.</p>
 *
 * <pre>
 * SyncPipeline pipeline = SyncPipeline.builder()
 *         .connector(graphConnector)
 *         .options(PipelineOptions.builder().concurrency(10).build())
 *         .build();
 * pipeline.start();
 * pipeline.registerDataSource(dataSource);
 * String jobId = pipeline.triggerSync(dataSource, EntityType.IDENTITIES);
 * </pre>
 */
public class SyncPipeline implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(SyncPipeline.class);

    private final PipelineOptions options;
    private final MessageBus bus;
    private final JobQueue queue;
    private final DocumentStore<DataSource> dataSourceStore;
    private final EntityRepository entityRepository;
    private final RelationshipRepository relationshipRepository;
    private final AlertService alertService;
    private final AuditService auditService;
    private final JobHistoryService jobHistoryService;
    private final ConnectorRegistry connectors;
    private final SyncScheduler scheduler;
    private final HealthCheckRegistry healthCheckRegistry;
    private final ExecutorService contextExecutor;
    private final Map<String, DataSource> dataSources = new ConcurrentHashMap<>();

    private final List<FetchStage> fetchStages = new ArrayList<>();
    private final List<NormalizeStage> normalizeStages = new ArrayList<>();
    private final LinkStage linkStage;
    private final CleanupStage cleanupStage;
    private final AnalysisStage analysisStage;
    private final JobHistoryRecorder historyRecorder;
    private final PipelineFailureHandler failureHandler;
    private volatile boolean started = false;

    private SyncPipeline(Builder builder) {
        this.options = builder.options;
        Clock clock = builder.clock;
        MetricsService metricsService = builder.metricsService != null
                ? builder.metricsService : new NoOpMetricsService();
        TracingService tracingService = builder.tracingService != null
                ? builder.tracingService : new NoOpTracingService();

        this.bus = builder.bus != null ? builder.bus : new InMemoryMessageBus(options.getConcurrency());
        this.queue = builder.queue != null
                ? builder.queue
                : new InMemoryJobQueue(options.toQueueConfig(), new BusJobDispatcher(bus), metricsService, clock);
        DistributedLock lock = builder.lock != null ? builder.lock : new LocalDistributedLock(options.toLockConfig());

        // Stores
        this.dataSourceStore = builder.dataSourceStore != null
                ? builder.dataSourceStore : new InMemoryDocumentStore<>("data_sources");
        this.entityRepository = new EntityRepository(builder.entityStore != null
                ? builder.entityStore : EntityRepository.inMemoryStore());
        this.relationshipRepository = new RelationshipRepository(builder.relationshipStore != null
                ? builder.relationshipStore : RelationshipRepository.inMemoryStore());
        AuditRepository auditRepository = builder.auditRepository != null
                ? builder.auditRepository : new InMemoryAuditRepository();
        this.auditService = new AuditService(auditRepository, clock);
        this.alertService = new AlertService(builder.alertStore != null
                ? builder.alertStore : AlertService.inMemoryStore(), auditService, lock, clock);
        this.jobHistoryService = new JobHistoryService(builder.historyStore != null
                ? builder.historyStore : JobHistoryService.inMemoryStore());

        // Registries
        this.connectors = new ConnectorRegistry(builder.connectors);
        NormalizerRegistry normalizers = new NormalizerRegistry()
                .registerAll(Microsoft365Normalizers.all())
                .registerAll(HaloPsaNormalizers.all());
        LinkRules linkRules = new LinkRules().register(Microsoft365Normalizers.INTEGRATION_TYPE, LinkRules.microsoft365());
        List<AnalysisWorker> workers = new ArrayList<>();
        workers.add(new Microsoft365StaleUserWorker(alertService, clock));
        workers.add(new Microsoft365SecurityWorker(alertService));
        workers.add(new Microsoft365LicenseWorker(alertService, clock));
        workers.add(new Microsoft365PolicyWorker(alertService));
        workers.addAll(builder.workers);

        // Stages
        DataHasher hasher = new DataHasher(HashPolicies.current());
        for (Connector connector : connectors.all()) {
            fetchStages.add(new FetchStage(connector.integrationType(), connectors, dataSourceStore, queue, bus,
                    hasher, builder.siteResolver, options.getFetchPageSize(), metricsService, tracingService));
        }
        for (EntityType entityType : normalizers.entityTypes()) {
            normalizeStages.add(new NormalizeStage(entityType, normalizers, entityRepository, lock, bus,
                    metricsService, tracingService, clock));
        }
        this.linkStage = new LinkStage(linkRules, entityRepository, relationshipRepository, lock, bus,
                metricsService, tracingService, clock);
        this.cleanupStage = new CleanupStage(entityRepository, relationshipRepository, lock, bus,
                metricsService, options.getAggregationTtl(), clock);

        this.contextExecutor = Executors.newFixedThreadPool(EntityType.values().length + 1, r -> {
            Thread t = new Thread(r, "context-loader");
            t.setDaemon(true);
            return t;
        });
        ContextLoader contextLoader = new ContextLoader(entityRepository, relationshipRepository, contextExecutor,
                options.getSlowQueryThresholdMs(), options.getContextLoadTimeoutMs(), metricsService);
        WorkflowEngine engine = new WorkflowEngine(contextLoader,
                new BatchFlusher(entityRepository, alertService, lock, clock), metricsService);
        this.analysisStage = new AnalysisStage(workers, engine, bus, options.getAggregationTtl(),
                metricsService, tracingService, clock);

        this.historyRecorder = new JobHistoryRecorder(jobHistoryService, clock);
        this.failureHandler = new PipelineFailureHandler(queue, options.getMaxAttempts());
        this.scheduler = new SyncScheduler(queue, builder.schedulingConfiguration != null
                ? builder.schedulingConfiguration : SchedulingConfiguration.load());

        // Health
        this.healthCheckRegistry = new HealthCheckRegistry();
        healthCheckRegistry.register(new JobQueueHealthCheck(queue));
        healthCheckRegistry.register(new ConnectorHealthCheck(connectors, dataSources::values));

        log.info("SyncPipeline initialized: connectors={} normalizeStages={} workers={} options={}",
                fetchStages.size(), normalizeStages.size(), workers.size(), options);
    }

    /**
     * Subscribes every stage and starts the queue.
     */
    public synchronized void start() {
        if (started) {
            return;
        }
        fetchStages.forEach(FetchStage::subscribe);
        normalizeStages.forEach(NormalizeStage::subscribe);
        linkStage.subscribe();
        cleanupStage.subscribe();
        analysisStage.subscribe();
        historyRecorder.subscribe(bus);
        queue.addListener(historyRecorder);
        failureHandler.subscribe(bus);
        queue.start();
        started = true;
        log.info("pipeline.started");
    }

    /**
     * Stores a data source so fetches can resolve it.
     */
    public void registerDataSource(DataSource dataSource) {
        try (TenantContext.TenantScope scope = TenantContext.scoped(dataSource.getTenantId())) {
            if (dataSourceStore.get(dataSource.getTenantId(), dataSource.getId()).isPresent()) {
                dataSourceStore.update(List.of(dataSource));
            } else {
                dataSourceStore.insert(List.of(dataSource));
            }
        }
        dataSources.put(dataSource.getId(), dataSource);
    }

    /**
     * Registers the recurring syncs of every registered data source.
     */
    public List<String> scheduleAll(boolean runImmediately) {
        return scheduler.scheduleAll(new ArrayList<>(dataSources.values()), runImmediately);
    }

    /**
     * Enqueues one sync of an entity type for a data source.
     *
     * @return the job id
     */
    public String triggerSync(DataSource dataSource, EntityType entityType) {
        return queue.schedule(JobRequest.builder()
                .tenantId(dataSource.getTenantId())
                .integrationType(dataSource.getIntegrationType())
                .entityType(entityType)
                .dataSourceId(dataSource.getId())
                .build());
    }

    public HealthStatus health() {
        return healthCheckRegistry.checkAll();
    }

    public PipelineOptions getOptions() {
        return options;
    }

    public MessageBus getBus() {
        return bus;
    }

    public JobQueue getQueue() {
        return queue;
    }

    public EntityRepository getEntityRepository() {
        return entityRepository;
    }

    public RelationshipRepository getRelationshipRepository() {
        return relationshipRepository;
    }

    public AlertService getAlertService() {
        return alertService;
    }

    public AuditService getAuditService() {
        return auditService;
    }

    public JobHistoryService getJobHistoryService() {
        return jobHistoryService;
    }

    public ConnectorRegistry getConnectors() {
        return connectors;
    }

    public SyncScheduler getScheduler() {
        return scheduler;
    }

    public HealthCheckRegistry getHealthCheckRegistry() {
        return healthCheckRegistry;
    }

    @Override
    public void close() {
        log.info("pipeline.closing");
        queue.close();
        failureHandler.close();
        historyRecorder.close();
        analysisStage.close();
        cleanupStage.close();
        linkStage.close();
        normalizeStages.forEach(NormalizeStage::close);
        fetchStages.forEach(FetchStage::close);
        bus.close();
        contextExecutor.shutdown();
        try {
            if (!contextExecutor.awaitTermination(5, TimeUnit.SECONDS)) {
                contextExecutor.shutdownNow();
            }
        } catch (InterruptedException e) {
            contextExecutor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private PipelineOptions options = PipelineOptions.defaults();
        private Clock clock = Clock.systemUTC();
        private MessageBus bus;
        private JobQueue queue;
        private DistributedLock lock;
        private MetricsService metricsService;
        private TracingService tracingService;
        private DocumentStore<DataSource> dataSourceStore;
        private DocumentStore<Entity> entityStore;
        private DocumentStore<Relationship> relationshipStore;
        private DocumentStore<Alert> alertStore;
        private DocumentStore<JobHistory> historyStore;
        private AuditRepository auditRepository;
        private SchedulingConfiguration schedulingConfiguration;
        private SiteResolver siteResolver = new DomainSiteResolver();
        private final List<Connector> connectors = new ArrayList<>();
        private final List<AnalysisWorker> workers = new ArrayList<>();

        public Builder options(PipelineOptions options) {
            this.options = options;
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        /**
         * Sets the bus. Defaults to an {@link InMemoryMessageBus} with one delivery thread per worker.
         */
        public Builder bus(MessageBus bus) {
            this.bus = bus;
            return this;
        }

        /**
         * Sets the job queue. Its dispatcher must publish to the same bus.
         */
        public Builder queue(JobQueue queue) {
            this.queue = queue;
            return this;
        }

        public Builder distributedLock(DistributedLock lock) {
            this.lock = lock;
            return this;
        }

        /**
         * Defaults to {@link NoOpMetricsService} if not set.
         */
        public Builder metricsService(MetricsService metricsService) {
            this.metricsService = metricsService;
            return this;
        }

        /**
         * Defaults to {@link NoOpTracingService} if not set.
         */
        public Builder tracingService(TracingService tracingService) {
            this.tracingService = tracingService;
            return this;
        }

        public Builder dataSourceStore(DocumentStore<DataSource> store) {
            this.dataSourceStore = store;
            return this;
        }

        public Builder entityStore(DocumentStore<Entity> store) {
            this.entityStore = store;
            return this;
        }

        public Builder relationshipStore(DocumentStore<Relationship> store) {
            this.relationshipStore = store;
            return this;
        }

        public Builder alertStore(DocumentStore<Alert> store) {
            this.alertStore = store;
            return this;
        }

        public Builder historyStore(DocumentStore<JobHistory> store) {
            this.historyStore = store;
            return this;
        }

        public Builder auditRepository(AuditRepository auditRepository) {
            this.auditRepository = auditRepository;
            return this;
        }

        /**
         * Defaults to the bundled {@code scheduling-config.json}.
         */
        public Builder schedulingConfiguration(SchedulingConfiguration configuration) {
            this.schedulingConfiguration = configuration;
            return this;
        }

        public Builder siteResolver(SiteResolver siteResolver) {
            this.siteResolver = siteResolver;
            return this;
        }

        /**
         * Adds a connector; one fetch stage is created per connector.
         */
        public Builder connector(Connector connector) {
            this.connectors.add(connector);
            return this;
        }

        /**
         * Adds an analysis worker next to the built-in Microsoft 365 security worker.
         */
        public Builder worker(AnalysisWorker worker) {
            this.workers.add(worker);
            return this;
        }

        public SyncPipeline build() {
            if (options == null) {
                throw new IllegalStateException("PipelineOptions are required");
            }
            return new SyncPipeline(this);
        }
    }
}
