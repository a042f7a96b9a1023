package com.sync.pipeline.queue;

/**
 * Point-in-time job counts.
 *
 * @param waiting   pending jobs ready to run
 * @param delayed   pending jobs waiting for their run time (backoff or scheduled delay)
 * @param active    jobs in processing
 * @param completed retained completed jobs
 * @param failed    retained terminally failed jobs
 * @param recurring registered recurring schedules
 */
public record QueueStats(long waiting, long delayed, long active, long completed, long failed, int recurring) {
}
