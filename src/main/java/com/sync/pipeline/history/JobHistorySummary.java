package com.sync.pipeline.history;

/**
 * Aggregate over the job history of one data source.
 */
public record JobHistorySummary(int total, int completed, int failed, long avgDurationMs) {

    public double failureRate() {
        return total == 0 ? 0.0 : (double) failed / total;
    }
}
