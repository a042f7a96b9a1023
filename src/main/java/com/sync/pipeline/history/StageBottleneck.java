package com.sync.pipeline.history;

/**
 * Time spent in one phase across the sampled jobs.
 */
public record StageBottleneck(JobMetrics.Phase phase, long avgMs, long maxMs, int samples) {
}
