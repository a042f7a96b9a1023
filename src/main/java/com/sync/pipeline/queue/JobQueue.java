package com.sync.pipeline.queue;

import com.sync.pipeline.health.HealthStatus;

import java.time.Duration;
import java.util.Optional;
import java.util.Set;

/**
 * Durable-style job queue with priorities, delays, retries with exponential backoff,
 * recurring schedules and bounded concurrency.
 *
 * <p>Lower priority values run first; jobs of equal priority run in submission order.
 * A job moves {@code PENDING -> PROCESSING -> COMPLETED | FAILED}; a retryable failure
 * with attempts left moves it back to PENDING after a backoff delay.</p>
 */
public interface JobQueue extends AutoCloseable {

    /**
     * Enqueues a job to run as soon as a slot is free.
     *
     * @return the job id
     */
    String schedule(JobRequest request);

    /**
     * Enqueues a job that becomes eligible after {@code delay}.
     */
    String schedule(JobRequest request, Duration delay);

    /**
     * Registers (or replaces) a named recurring job. Each occurrence enqueues a copy of
     * {@code template} with a fresh sync id.
     *
     * @param cron 5- or 6-field cron expression
     * @throws IllegalArgumentException when the expression does not parse
     */
    void scheduleRecurring(String name, String cron, JobRequest template);

    boolean cancelRecurring(String name);

    Set<String> getRecurringNames();

    /**
     * @throws IllegalArgumentException when no job with this id is known
     */
    JobStatusView getStatus(String jobId);

    Optional<Job> getJob(String jobId);

    QueueStats getStats();

    HealthStatus healthCheck();

    /**
     * @throws IllegalArgumentException when no job with this id is known
     * @throws IllegalStateException    when the job is not in PROCESSING
     */
    void completeJob(String jobId);

    /**
     * Fails the current attempt. Retryable failures with attempts left are re-queued
     * with backoff; everything else is terminal.
     *
     * @throws IllegalArgumentException when no job with this id is known
     * @throws IllegalStateException    when the job is not in PROCESSING
     */
    void failJob(String jobId, String error, boolean retryable);

    /**
     * Drops every pending job, ready or delayed.
     *
     * @return number of jobs dropped
     */
    int clearWaiting();

    void addListener(JobListener listener);

    void start();

    boolean isRunning();

    @Override
    void close();
}
