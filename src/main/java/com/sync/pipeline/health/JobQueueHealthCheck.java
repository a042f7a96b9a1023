package com.sync.pipeline.health;

import com.sync.pipeline.queue.JobQueue;

/**
 * Exposes {@link JobQueue#healthCheck()} to the {@link HealthCheckRegistry}.
 */
public class JobQueueHealthCheck implements HealthCheck {

    private final JobQueue queue;

    public JobQueueHealthCheck(JobQueue queue) {
        this.queue = queue;
    }

    @Override
    public String getName() {
        return "job-queue";
    }

    @Override
    public HealthStatus check() {
        return queue.healthCheck();
    }
}
