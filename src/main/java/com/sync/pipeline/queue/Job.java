package com.sync.pipeline.queue;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.UUID;

/**
 * A job tracked by the {@link JobQueue}.
 *
 * <p>The request part is immutable; status fields change only through the transition
 * methods, which enforce {@code PENDING -> PROCESSING -> COMPLETED | FAILED} and the
 * retry edge {@code FAILED -> PENDING}.</p>
 */
public class Job {

    private final String id;
    private final JobRequest request;
    private final int maxAttempts;
    private final long sequence;
    private final Instant createdAt;
    private final String recurringName;
    private final List<JobStatus> statusHistory = new ArrayList<>();
    private JobStatus status;
    private int attempt;
    private String error;
    private Instant runAt;
    private Instant startedAt;
    private Instant completedAt;

    Job(JobRequest request, int maxAttempts, long sequence, Instant now, Instant runAt, String recurringName) {
        this.id = UUID.randomUUID().toString();
        this.request = Objects.requireNonNull(request, "request is required");
        this.maxAttempts = maxAttempts;
        this.sequence = sequence;
        this.createdAt = now;
        this.runAt = runAt;
        this.recurringName = recurringName;
        this.status = JobStatus.PENDING;
        this.statusHistory.add(JobStatus.PENDING);
    }

    synchronized void markProcessing(Instant now) {
        requireStatus(JobStatus.PENDING);
        status = JobStatus.PROCESSING;
        attempt++;
        startedAt = now;
        statusHistory.add(status);
    }

    synchronized void markCompleted(Instant now) {
        requireStatus(JobStatus.PROCESSING);
        status = JobStatus.COMPLETED;
        completedAt = now;
        error = null;
        statusHistory.add(status);
    }

    synchronized void markFailed(String errorMessage, Instant now) {
        requireStatus(JobStatus.PROCESSING);
        status = JobStatus.FAILED;
        error = errorMessage;
        completedAt = now;
        statusHistory.add(status);
    }

    synchronized void markRetrying(Instant nextRunAt) {
        requireStatus(JobStatus.FAILED);
        if (!hasAttemptsLeft()) {
            throw new IllegalStateException("Job " + id + " has exhausted " + maxAttempts + " attempts");
        }
        status = JobStatus.PENDING;
        runAt = nextRunAt;
        completedAt = null;
        statusHistory.add(status);
    }

    private void requireStatus(JobStatus expected) {
        if (status != expected) {
            throw new IllegalStateException("Job " + id + " is " + status + ", expected " + expected);
        }
    }

    public String getId() {
        return id;
    }

    public JobRequest getRequest() {
        return request;
    }

    public String getTenantId() {
        return request.tenantId();
    }

    public int getPriority() {
        return request.priority();
    }

    public String getSyncId() {
        return request.syncId();
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    long getSequence() {
        return sequence;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public String getRecurringName() {
        return recurringName;
    }

    public synchronized JobStatus getStatus() {
        return status;
    }

    public synchronized int getAttempt() {
        return attempt;
    }

    public synchronized String getError() {
        return error;
    }

    public synchronized Instant getRunAt() {
        return runAt;
    }

    public synchronized Instant getStartedAt() {
        return startedAt;
    }

    public synchronized Instant getCompletedAt() {
        return completedAt;
    }

    public synchronized boolean hasAttemptsLeft() {
        return attempt < maxAttempts;
    }

    public synchronized boolean isTerminal() {
        return status == JobStatus.COMPLETED || (status == JobStatus.FAILED && !hasAttemptsLeft());
    }

    /**
     * Every status the job has been in, in order.
     */
    public synchronized List<JobStatus> getStatusHistory() {
        return List.copyOf(statusHistory);
    }

    public synchronized JobStatusView toStatusView() {
        return new JobStatusView(status, attempt, error);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Job job = (Job) o;
        return Objects.equals(id, job.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Override
    public String toString() {
        return "Job{" +
                "id='" + id + '\'' +
                ", action='" + request.action() + '\'' +
                ", tenantId='" + request.tenantId() + '\'' +
                ", status=" + getStatus() +
                ", attempt=" + getAttempt() +
                '}';
    }
}
