package com.sync.pipeline.queue;

/**
 * Hands a job that entered PROCESSING to whatever does the work. The job stays in
 * PROCESSING until {@link JobQueue#completeJob} or {@link JobQueue#failJob} is called for it;
 * an exception thrown here fails the attempt as retryable.
 */
@FunctionalInterface
public interface JobDispatcher {

    void dispatch(Job job);
}
