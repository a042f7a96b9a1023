package com.sync.pipeline.history;

import com.sync.pipeline.queue.JobStatus;
import com.sync.pipeline.store.DocumentStore;
import com.sync.pipeline.store.InMemoryDocumentStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Stores job history and answers aggregate questions about it.
 */
public class JobHistoryService {
    private static final Logger log = LoggerFactory.getLogger(JobHistoryService.class);

    private final DocumentStore<JobHistory> store;

    public JobHistoryService(DocumentStore<JobHistory> store) {
        this.store = store;
    }

    public static InMemoryDocumentStore<JobHistory> inMemoryStore() {
        return new InMemoryDocumentStore<>("job_history");
    }

    /**
     * Stores the record unless the job already has one.
     *
     * @return true if stored
     */
    public synchronized boolean record(JobHistory history) {
        if (store.get(history.tenantId(), history.jobId()).isPresent()) {
            log.debug("history.duplicate jobId={}", history.jobId());
            return false;
        }
        store.insert(List.of(history));
        log.info("history.recorded jobId={} status={} durationMs={}",
                history.jobId(), history.status(), history.durationMs());
        return true;
    }

    public Optional<JobHistory> find(String tenantId, String jobId) {
        return store.get(tenantId, jobId);
    }

    public List<JobHistory> findBySync(String tenantId, String syncId) {
        return store.find(tenantId, h -> Objects.equals(syncId, h.syncId())).stream()
                .sorted(Comparator.comparingInt(JobHistory::batchNumber))
                .toList();
    }

    /**
     * Most recent records of a data source, newest first.
     */
    public List<JobHistory> recent(String tenantId, String dataSourceId, int limit) {
        return forDataSource(tenantId, dataSourceId).stream()
                .sorted(Comparator.comparing(JobHistory::completedAt,
                        Comparator.nullsLast(Comparator.reverseOrder())))
                .limit(limit)
                .toList();
    }

    public JobHistorySummary summarize(String tenantId, String dataSourceId) {
        List<JobHistory> records = forDataSource(tenantId, dataSourceId);
        int completed = 0;
        int failed = 0;
        long totalDuration = 0;
        for (JobHistory record : records) {
            if (record.status() == JobStatus.COMPLETED) {
                completed++;
            } else {
                failed++;
            }
            totalDuration += record.durationMs();
        }
        long avg = records.isEmpty() ? 0 : totalDuration / records.size();
        return new JobHistorySummary(records.size(), completed, failed, avg);
    }

    /**
     * Average time per phase over the data source's history, slowest phase first.
     * Phases never recorded are omitted.
     */
    public List<StageBottleneck> analyzeBottlenecks(String tenantId, String dataSourceId) {
        Map<JobMetrics.Phase, long[]> totals = new EnumMap<>(JobMetrics.Phase.class);
        for (JobHistory record : forDataSource(tenantId, dataSourceId)) {
            record.metrics().getStageTimesMs().forEach((phase, ms) -> {
                long[] acc = totals.computeIfAbsent(phase, p -> new long[3]);
                acc[0] += ms;
                acc[1] = Math.max(acc[1], ms);
                acc[2]++;
            });
        }
        List<StageBottleneck> result = new ArrayList<>();
        totals.forEach((phase, acc) -> result.add(new StageBottleneck(phase, acc[0] / acc[2], acc[1], (int) acc[2])));
        result.sort(Comparator.comparingLong(StageBottleneck::avgMs).reversed());
        return result;
    }

    private List<JobHistory> forDataSource(String tenantId, String dataSourceId) {
        return store.find(tenantId, h -> Objects.equals(dataSourceId, h.dataSourceId()));
    }
}
