package com.sync.pipeline.logging;

import com.sync.pipeline.bus.EventEnvelope;
import org.slf4j.MDC;

import java.util.ArrayList;
import java.util.List;

/**
 * AutoCloseable MDC wrapper for structured pipeline logging.
 * Adds key-value pairs to the SLF4J MDC and removes them on close.
 *
 * <pre>
 * try (LogContext ctx = LogContext.forEvent(envelope)) {
 *     log.info("batch.processed created={} updated={}", created, updated);
 * }
 * </pre>
 */
public class LogContext implements AutoCloseable {

    private final List<String> keys = new ArrayList<>();

    private LogContext() {
    }

    /**
     * Log context for handling one bus event.
     */
    public static LogContext forEvent(EventEnvelope envelope) {
        LogContext ctx = new LogContext();
        ctx.put("traceId", envelope.getTraceId());
        ctx.put("eventId", envelope.getEventId());
        ctx.put("tenantId", envelope.getTenantId());
        ctx.put("stage", envelope.getStage().getWireName());
        ctx.put("entityType", envelope.getEntityType().getWireName());
        return ctx;
    }

    /**
     * Log context for queue operations on one job.
     */
    public static LogContext forJob(String jobId, String tenantId) {
        LogContext ctx = new LogContext();
        ctx.put("jobId", jobId);
        ctx.put("tenantId", tenantId);
        return ctx;
    }

    /**
     * Log context for one analysis workflow run.
     */
    public static LogContext forWorkflow(String workflowId, String tenantId, String dataSourceId) {
        LogContext ctx = new LogContext();
        ctx.put("workflowId", workflowId);
        ctx.put("tenantId", tenantId);
        ctx.put("dataSourceId", dataSourceId);
        return ctx;
    }

    /**
     * Adds an additional key-value pair to this log context.
     */
    public LogContext with(String key, String value) {
        put(key, value);
        return this;
    }

    private void put(String key, String value) {
        if (value == null) {
            return;
        }
        keys.add(key);
        MDC.put(key, value);
    }

    @Override
    public void close() {
        for (String key : keys) {
            MDC.remove(key);
        }
        keys.clear();
    }
}
