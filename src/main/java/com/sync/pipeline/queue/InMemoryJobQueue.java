package com.sync.pipeline.queue;

import com.sync.pipeline.health.HealthStatus;
import com.sync.pipeline.logging.LogContext;
import com.sync.pipeline.metrics.MetricsService;
import com.sync.pipeline.metrics.NoOpMetricsService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.support.CronExpression;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZonedDateTime;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.PriorityBlockingQueue;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.Semaphore;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;

/**
 * In-process {@link JobQueue}.
 *
 * <p>Ready jobs wait in a priority queue. A pump thread takes one concurrency permit,
 * then the next ready job, and hands the job to the {@link JobDispatcher} on a worker pool.
 * The permit is returned when the job leaves PROCESSING, so at most
 * {@link QueueConfig#concurrency()} jobs are ever in processing. Delayed jobs, retries,
 * recurring occurrences and the stalled-job sweep run on a scheduler.</p>
 */
public class InMemoryJobQueue implements JobQueue {
    private static final Logger log = LoggerFactory.getLogger(InMemoryJobQueue.class);

    private static final Comparator<Job> READY_ORDER = Comparator
            .comparingInt(Job::getPriority)
            .thenComparing(Job::getRunAt)
            .thenComparingLong(Job::getSequence);

    private final QueueConfig config;
    private final JobDispatcher dispatcher;
    private final MetricsService metricsService;
    private final Clock clock;

    private final Map<String, Job> jobs = new ConcurrentHashMap<>();
    private final PriorityBlockingQueue<Job> ready = new PriorityBlockingQueue<>(64, READY_ORDER);
    private final Map<String, ScheduledFuture<?>> delayed = new ConcurrentHashMap<>();
    private final Map<String, RecurringJob> recurring = new ConcurrentHashMap<>();
    private final Deque<String> completedIds = new ArrayDeque<>();
    private final Deque<String> failedIds = new ArrayDeque<>();
    private final List<JobListener> listeners = new CopyOnWriteArrayList<>();
    private final AtomicLong sequence = new AtomicLong();
    private final Semaphore permits;

    private final ScheduledExecutorService scheduler;
    private final ExecutorService workers;
    private final AtomicReference<Thread> pump = new AtomicReference<>();
    private volatile boolean running = false;
    private volatile boolean closed = false;

    public InMemoryJobQueue(QueueConfig config, JobDispatcher dispatcher) {
        this(config, dispatcher, new NoOpMetricsService(), Clock.systemUTC());
    }

    public InMemoryJobQueue(QueueConfig config, JobDispatcher dispatcher,
                            MetricsService metricsService, Clock clock) {
        this.config = config;
        this.dispatcher = dispatcher;
        this.metricsService = metricsService;
        this.clock = clock;
        this.permits = new Semaphore(config.concurrency());
        this.scheduler = Executors.newSingleThreadScheduledExecutor(daemon("job-queue-scheduler"));
        this.workers = Executors.newFixedThreadPool(config.concurrency(), daemon("job-queue-worker"));
    }

    private static ThreadFactory daemon(String name) {
        return r -> {
            Thread t = new Thread(r, name);
            t.setDaemon(true);
            return t;
        };
    }

    // ── Scheduling ──────────────────────────────────────────────

    @Override
    public String schedule(JobRequest request) {
        return schedule(request, Duration.ZERO);
    }

    @Override
    public String schedule(JobRequest request, Duration delay) {
        return enqueue(request, delay, null).getId();
    }

    private Job enqueue(JobRequest request, Duration delay, String recurringName) {
        if (closed) {
            throw new IllegalStateException("Job queue is closed");
        }
        Instant now = clock.instant();
        Duration effectiveDelay = delay == null || delay.isNegative() ? Duration.ZERO : delay;
        Job job = new Job(request, config.maxAttempts(), sequence.incrementAndGet(), now,
                now.plus(effectiveDelay), recurringName);
        jobs.put(job.getId(), job);
        try (LogContext ctx = LogContext.forJob(job.getId(), request.tenantId())) {
            log.debug("job.scheduled action={} priority={} delayMs={} syncId={}",
                    request.action(), request.priority(), effectiveDelay.toMillis(), request.syncId());
        }
        makeEligible(job, effectiveDelay.toMillis());
        return job;
    }

    private void makeEligible(Job job, long delayMs) {
        if (delayMs <= 0) {
            ready.add(job);
            return;
        }
        // cleared jobs are removed from the job map before their timer is cancelled
        synchronized (delayed) {
            ScheduledFuture<?> future = scheduler.schedule(() -> {
                synchronized (delayed) {
                    delayed.remove(job.getId());
                }
                if (jobs.containsKey(job.getId())) {
                    ready.add(job);
                }
            }, delayMs, TimeUnit.MILLISECONDS);
            delayed.put(job.getId(), future);
        }
    }

    @Override
    public void scheduleRecurring(String name, String cron, JobRequest template) {
        CronExpression expression = CronSchedules.parse(cron);
        RecurringJob job = new RecurringJob(name, cron, expression, template);
        RecurringJob previous = recurring.put(name, job);
        if (previous != null) {
            previous.cancel();
        }
        log.info("job.recurring.registered name={} cron='{}' action={}", name, cron, template.action());
        arm(job);
    }

    private void arm(RecurringJob job) {
        if (closed || recurring.get(job.name) != job) {
            return;
        }
        ZonedDateTime now = ZonedDateTime.now(clock);
        ZonedDateTime next = job.expression.next(now);
        if (next == null) {
            log.warn("job.recurring.exhausted name={} cron='{}'", job.name, job.cron);
            return;
        }
        long delayMs = Math.max(0, Duration.between(now, next).toMillis());
        job.future = scheduler.schedule(() -> fire(job), delayMs, TimeUnit.MILLISECONDS);
    }

    private void fire(RecurringJob job) {
        try {
            Job occurrence = enqueue(job.template.withNewSyncId(), Duration.ZERO, job.name);
            log.debug("job.recurring.fired name={} jobId={}", job.name, occurrence.getId());
        } catch (RuntimeException e) {
            log.error("job.recurring.failed name={} error={}", job.name, e.getMessage(), e);
        } finally {
            arm(job);
        }
    }

    @Override
    public boolean cancelRecurring(String name) {
        RecurringJob removed = recurring.remove(name);
        if (removed == null) {
            return false;
        }
        removed.cancel();
        log.info("job.recurring.cancelled name={}", name);
        return true;
    }

    @Override
    public Set<String> getRecurringNames() {
        return Set.copyOf(recurring.keySet());
    }

    // ── Processing ──────────────────────────────────────────────

    @Override
    public synchronized void start() {
        if (closed) {
            throw new IllegalStateException("Job queue is closed");
        }
        if (running) {
            return;
        }
        running = true;
        Thread thread = new Thread(this::pumpLoop, "job-queue-pump");
        thread.setDaemon(true);
        pump.set(thread);
        thread.start();
        scheduler.scheduleAtFixedRate(this::sweepStalled, config.stalledCheckIntervalMs(),
                config.stalledCheckIntervalMs(), TimeUnit.MILLISECONDS);
        log.info("job.queue.started concurrency={} maxAttempts={}", config.concurrency(), config.maxAttempts());
    }

    private void pumpLoop() {
        while (running) {
            try {
                permits.acquire();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return;
            }
            Job job;
            try {
                job = ready.take();
            } catch (InterruptedException e) {
                permits.release();
                Thread.currentThread().interrupt();
                return;
            }
            try {
                job.markProcessing(clock.instant());
            } catch (IllegalStateException e) {
                // dropped between enqueue and take
                log.debug("job.skipped jobId={} status={}", job.getId(), job.getStatus());
                permits.release();
                continue;
            }
            workers.execute(() -> dispatch(job));
        }
    }

    private void dispatch(Job job) {
        try (LogContext ctx = LogContext.forJob(job.getId(), job.getTenantId())) {
            log.debug("job.dispatching action={} attempt={}", job.getRequest().action(), job.getAttempt());
            try {
                dispatcher.dispatch(job);
            } catch (RuntimeException e) {
                log.warn("job.dispatch.failed action={} error={}", job.getRequest().action(), e.getMessage(), e);
                failJob(job.getId(), "Dispatch failed: " + e.getMessage(), true);
            }
        }
    }

    @Override
    public void completeJob(String jobId) {
        Job job = require(jobId);
        job.markCompleted(clock.instant());
        permits.release();
        retain(completedIds, jobId, config.keepCompleted());
        metricsService.incrementJobs(MetricsService.JobOutcome.COMPLETED);
        try (LogContext ctx = LogContext.forJob(jobId, job.getTenantId())) {
            log.info("job.completed action={} attempt={}", job.getRequest().action(), job.getAttempt());
        }
        notifyListeners(l -> l.onCompleted(job));
    }

    @Override
    public void failJob(String jobId, String error, boolean retryable) {
        Job job = require(jobId);
        Instant now = clock.instant();
        job.markFailed(error, now);
        permits.release();

        try (LogContext ctx = LogContext.forJob(jobId, job.getTenantId())) {
            if (retryable && job.hasAttemptsLeft() && !closed) {
                long delayMs = config.backoffDelayMs(job.getAttempt());
                job.markRetrying(now.plusMillis(delayMs));
                metricsService.incrementJobs(MetricsService.JobOutcome.RETRIED);
                log.warn("job.retrying action={} attempt={}/{} delayMs={} error={}",
                        job.getRequest().action(), job.getAttempt(), job.getMaxAttempts(), delayMs, error);
                makeEligible(job, delayMs);
                notifyListeners(l -> l.onRetry(job, delayMs));
                return;
            }
            retain(failedIds, jobId, config.keepFailed());
            metricsService.incrementJobs(MetricsService.JobOutcome.FAILED);
            log.error("job.failed action={} attempt={}/{} retryable={} error={}",
                    job.getRequest().action(), job.getAttempt(), job.getMaxAttempts(), retryable, error);
        }
        notifyListeners(l -> l.onFailed(job));
    }

    /**
     * Fails every job that has been processing longer than the stall timeout.
     *
     * @return number of jobs failed as stalled
     */
    public int sweepStalled() {
        Instant cutoff = clock.instant().minusMillis(config.stalledTimeoutMs());
        int stalled = 0;
        for (Job job : jobs.values()) {
            if (job.getStatus() != JobStatus.PROCESSING || job.getStartedAt() == null
                    || !job.getStartedAt().isBefore(cutoff)) {
                continue;
            }
            try {
                failJob(job.getId(), "Job stalled after " + config.stalledTimeoutMs() + "ms", true);
                stalled++;
            } catch (IllegalStateException e) {
                // finished concurrently
                log.debug("job.stall.skipped jobId={} reason={}", job.getId(), e.getMessage());
            }
        }
        if (stalled > 0) {
            log.warn("job.stalled count={}", stalled);
        }
        return stalled;
    }

    private void retain(Deque<String> ids, String jobId, int keep) {
        synchronized (ids) {
            ids.addLast(jobId);
            while (ids.size() > keep) {
                String evicted = ids.removeFirst();
                jobs.remove(evicted);
            }
        }
    }

    private void notifyListeners(Consumer<JobListener> callback) {
        for (JobListener listener : listeners) {
            try {
                callback.accept(listener);
            } catch (RuntimeException e) {
                log.warn("job.listener.failed listener={} error={}",
                        listener.getClass().getSimpleName(), e.getMessage(), e);
            }
        }
    }

    // ── Queries ─────────────────────────────────────────────────

    private Job require(String jobId) {
        Job job = jobs.get(jobId);
        if (job == null) {
            throw new IllegalArgumentException("Job not found: " + jobId);
        }
        return job;
    }

    @Override
    public JobStatusView getStatus(String jobId) {
        return require(jobId).toStatusView();
    }

    @Override
    public Optional<Job> getJob(String jobId) {
        return Optional.ofNullable(jobs.get(jobId));
    }

    @Override
    public QueueStats getStats() {
        long waiting = ready.size();
        long delayedCount = delayed.size();
        long active = 0;
        long completed = 0;
        long failed = 0;
        for (Job job : jobs.values()) {
            JobStatus status = job.getStatus();
            if (status == JobStatus.PROCESSING) {
                active++;
            } else if (status == JobStatus.COMPLETED) {
                completed++;
            } else if (status == JobStatus.FAILED) {
                failed++;
            }
        }
        return new QueueStats(waiting, delayedCount, active, completed, failed, recurring.size());
    }

    @Override
    public HealthStatus healthCheck() {
        QueueStats stats = getStats();
        Map<String, Object> details = Map.of(
                "waiting", stats.waiting(),
                "delayed", stats.delayed(),
                "active", stats.active(),
                "failed", stats.failed(),
                "recurring", stats.recurring());
        if (!running) {
            return HealthStatus.down("Job queue is not running").withDetails(details);
        }
        if (stats.waiting() > config.backlogDegradedThreshold()) {
            return HealthStatus.degraded("Backlog of " + stats.waiting() + " waiting jobs exceeds "
                    + config.backlogDegradedThreshold()).withDetails(details);
        }
        return HealthStatus.up("Job queue running").withDetails(details);
    }

    @Override
    public int clearWaiting() {
        List<Job> drained = new ArrayList<>();
        ready.drainTo(drained);
        int cleared = drained.size();
        for (Job job : drained) {
            jobs.remove(job.getId());
        }
        synchronized (delayed) {
            for (Map.Entry<String, ScheduledFuture<?>> entry : delayed.entrySet()) {
                jobs.remove(entry.getKey());
                entry.getValue().cancel(false);
                cleared++;
            }
            delayed.clear();
        }
        log.info("job.queue.cleared count={}", cleared);
        return cleared;
    }

    @Override
    public void addListener(JobListener listener) {
        listeners.add(listener);
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    public QueueConfig getConfig() {
        return config;
    }

    @Override
    public synchronized void close() {
        if (closed) {
            return;
        }
        closed = true;
        running = false;
        recurring.values().forEach(RecurringJob::cancel);
        recurring.clear();
        Thread thread = pump.getAndSet(null);
        if (thread != null) {
            thread.interrupt();
        }
        scheduler.shutdownNow();
        workers.shutdown();
        try {
            if (!workers.awaitTermination(5, TimeUnit.SECONDS)) {
                workers.shutdownNow();
            }
        } catch (InterruptedException e) {
            workers.shutdownNow();
            Thread.currentThread().interrupt();
        }
        log.info("job.queue.closed");
    }

    private static final class RecurringJob {
        private final String name;
        private final String cron;
        private final CronExpression expression;
        private final JobRequest template;
        private volatile ScheduledFuture<?> future;

        private RecurringJob(String name, String cron, CronExpression expression, JobRequest template) {
            this.name = name;
            this.cron = cron;
            this.expression = expression;
            this.template = template;
        }

        private void cancel() {
            ScheduledFuture<?> f = future;
            if (f != null) {
                f.cancel(false);
            }
        }
    }
}
