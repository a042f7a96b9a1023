package com.sync.pipeline.queue;

/**
 * Status query result of a job.
 *
 * @param status  current status
 * @param attempt number of attempts started so far
 * @param error   last failure message, or null
 */
public record JobStatusView(JobStatus status, int attempt, String error) {
}
