package com.sync.pipeline.history;

import com.fasterxml.jackson.annotation.JsonAutoDetect;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sync.pipeline.bus.EventCodec;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.util.EnumMap;
import java.util.Map;

/**
 * Per-job measurements accumulated as a batch moves through the stages.
 *
 * <p>Each stage records into its own instance and merges it into the metrics carried by
 * the incoming event, so the terminal event holds the totals for the whole job. Not
 * thread-safe; an instance belongs to one handler invocation.</p>
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonAutoDetect(fieldVisibility = JsonAutoDetect.Visibility.ANY,
        getterVisibility = JsonAutoDetect.Visibility.NONE,
        isGetterVisibility = JsonAutoDetect.Visibility.NONE,
        setterVisibility = JsonAutoDetect.Visibility.NONE)
public class JobMetrics {

    private static final ObjectMapper MAPPER = EventCodec.defaultMapper();
    private static final int MAX_STACK_LENGTH = 4000;

    /**
     * Timed phases of a job.
     */
    public enum Phase { FETCH, NORMALIZE, LINK, ANALYZE }

    private EnumMap<Phase, Long> stageTimesMs = new EnumMap<>(Phase.class);
    private long queryCount;
    private long mutationCount;
    private long externalCallCount;
    private long entitiesCreated;
    private long entitiesUpdated;
    private long entitiesDeleted;
    private long entitiesUnchanged;
    private long entitiesSkipped;
    private long relationshipsChanged;
    private String errorMessage;
    private String errorStack;
    private int retryCount;

    public JobMetrics recordStageTime(Phase phase, long millis) {
        stageTimesMs.merge(phase, millis, Long::sum);
        return this;
    }

    public JobMetrics addQueries(long count) {
        queryCount += count;
        return this;
    }

    public JobMetrics addMutations(long count) {
        mutationCount += count;
        return this;
    }

    public JobMetrics addExternalCalls(long count) {
        externalCallCount += count;
        return this;
    }

    public JobMetrics addEntitiesCreated(long count) {
        entitiesCreated += count;
        return this;
    }

    public JobMetrics addEntitiesUpdated(long count) {
        entitiesUpdated += count;
        return this;
    }

    public JobMetrics addEntitiesDeleted(long count) {
        entitiesDeleted += count;
        return this;
    }

    public JobMetrics addEntitiesUnchanged(long count) {
        entitiesUnchanged += count;
        return this;
    }

    public JobMetrics addEntitiesSkipped(long count) {
        entitiesSkipped += count;
        return this;
    }

    public JobMetrics addRelationshipsChanged(long count) {
        relationshipsChanged += count;
        return this;
    }

    public JobMetrics setRetryCount(int retryCount) {
        this.retryCount = retryCount;
        return this;
    }

    /**
     * Records an error. Only the first error of a job is kept.
     */
    public JobMetrics recordError(String message, Throwable cause) {
        if (errorMessage == null) {
            errorMessage = message;
            if (cause != null) {
                StringWriter writer = new StringWriter();
                cause.printStackTrace(new PrintWriter(writer));
                String stack = writer.toString();
                errorStack = stack.length() > MAX_STACK_LENGTH ? stack.substring(0, MAX_STACK_LENGTH) : stack;
            }
        }
        return this;
    }

    /**
     * Adds every counter and stage time of {@code other} into this instance.
     * The first recorded error wins; the retry count is the maximum of both.
     */
    public JobMetrics merge(JobMetrics other) {
        if (other == null) {
            return this;
        }
        other.stageTimesMs.forEach((phase, ms) -> stageTimesMs.merge(phase, ms, Long::sum));
        queryCount += other.queryCount;
        mutationCount += other.mutationCount;
        externalCallCount += other.externalCallCount;
        entitiesCreated += other.entitiesCreated;
        entitiesUpdated += other.entitiesUpdated;
        entitiesDeleted += other.entitiesDeleted;
        entitiesUnchanged += other.entitiesUnchanged;
        entitiesSkipped += other.entitiesSkipped;
        relationshipsChanged += other.relationshipsChanged;
        if (errorMessage == null && other.errorMessage != null) {
            errorMessage = other.errorMessage;
            errorStack = other.errorStack;
        }
        retryCount = Math.max(retryCount, other.retryCount);
        return this;
    }

    public JobMetrics copy() {
        return new JobMetrics().merge(this);
    }

    public long getStageTimeMs(Phase phase) {
        return stageTimesMs.getOrDefault(phase, 0L);
    }

    public Map<Phase, Long> getStageTimesMs() {
        return Map.copyOf(stageTimesMs);
    }

    public long getTotalStageTimeMs() {
        return stageTimesMs.values().stream().mapToLong(Long::longValue).sum();
    }

    public long getQueryCount() {
        return queryCount;
    }

    public long getMutationCount() {
        return mutationCount;
    }

    public long getExternalCallCount() {
        return externalCallCount;
    }

    public long getEntitiesCreated() {
        return entitiesCreated;
    }

    public long getEntitiesUpdated() {
        return entitiesUpdated;
    }

    public long getEntitiesDeleted() {
        return entitiesDeleted;
    }

    public long getEntitiesUnchanged() {
        return entitiesUnchanged;
    }

    public long getEntitiesSkipped() {
        return entitiesSkipped;
    }

    public long getRelationshipsChanged() {
        return relationshipsChanged;
    }

    public String getErrorMessage() {
        return errorMessage;
    }

    public String getErrorStack() {
        return errorStack;
    }

    public int getRetryCount() {
        return retryCount;
    }

    public String toJson() {
        try {
            return MAPPER.writeValueAsString(this);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize job metrics", e);
        }
    }

    public static JobMetrics fromJson(String json) {
        try {
            return MAPPER.readValue(json, JobMetrics.class);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Invalid job metrics JSON", e);
        }
    }

    @Override
    public String toString() {
        return "JobMetrics{" +
                "stageTimesMs=" + stageTimesMs +
                ", queries=" + queryCount +
                ", mutations=" + mutationCount +
                ", created=" + entitiesCreated +
                ", updated=" + entitiesUpdated +
                ", unchanged=" + entitiesUnchanged +
                ", skipped=" + entitiesSkipped +
                ", error='" + errorMessage + '\'' +
                '}';
    }
}
