package com.sync.pipeline.schedule;

import com.sync.pipeline.core.model.DataSource;
import com.sync.pipeline.queue.CronSchedules;
import com.sync.pipeline.queue.JobQueue;
import com.sync.pipeline.queue.JobRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Registers the recurring sync jobs of every data source from the {@link SchedulingConfiguration}.
 *
 * <p>Each supported entity type of a data source gets one recurring registration named
 * {@code sync:{integrationType}:{entityType}:{dataSourceId}} and, optionally, an immediate
 * first run. Global entity types are registered for only one data source per tenant and
 * integration.</p>
 */
public class SyncScheduler {
    private static final Logger log = LoggerFactory.getLogger(SyncScheduler.class);

    private final JobQueue queue;
    private final SchedulingConfiguration configuration;

    public SyncScheduler(JobQueue queue, SchedulingConfiguration configuration) {
        this.queue = queue;
        this.configuration = configuration;
    }

    /**
     * Drops stale waiting jobs and registers every data source.
     *
     * @param runImmediately also enqueue one sync per entity type right away
     * @return names of the recurring registrations created
     */
    public List<String> scheduleAll(List<DataSource> dataSources, boolean runImmediately) {
        int cleared = queue.clearWaiting();
        log.info("scheduler.start dataSources={} clearedStaleJobs={}", dataSources.size(), cleared);

        Set<String> globalScopes = new HashSet<>();
        List<String> names = new ArrayList<>();
        for (DataSource dataSource : dataSources) {
            names.addAll(scheduleDataSource(dataSource, globalScopes, runImmediately));
        }
        log.info("scheduler.done registrations={}", names.size());
        return names;
    }

    public List<String> scheduleDataSource(DataSource dataSource, boolean runImmediately) {
        return scheduleDataSource(dataSource, new HashSet<>(), runImmediately);
    }

    private List<String> scheduleDataSource(DataSource dataSource, Set<String> globalScopes, boolean runImmediately) {
        List<EntitySchedule> schedules = configuration.forIntegration(dataSource.getIntegrationType());
        if (schedules.isEmpty()) {
            log.warn("scheduler.unknown-integration integrationType={} dataSourceId={}",
                    dataSource.getIntegrationType(), dataSource.getId());
            return List.of();
        }

        List<String> names = new ArrayList<>();
        for (EntitySchedule schedule : schedules) {
            if (schedule.global()) {
                String scope = dataSource.getTenantId() + "|" + dataSource.getIntegrationType()
                        + "|" + schedule.type().getWireName();
                if (!globalScopes.add(scope)) {
                    log.debug("scheduler.global.skipped scope={} dataSourceId={}", scope, dataSource.getId());
                    continue;
                }
            }
            JobRequest template = JobRequest.builder()
                    .tenantId(dataSource.getTenantId())
                    .integrationType(dataSource.getIntegrationType())
                    .entityType(schedule.type())
                    .dataSourceId(dataSource.getId())
                    .priority(schedule.priority())
                    .build();
            String name = recurringName(dataSource, schedule);
            queue.scheduleRecurring(name, CronSchedules.everyMinutes(schedule.rateMinutes()), template);
            if (runImmediately) {
                queue.schedule(template.withNewSyncId());
            }
            names.add(name);
            log.debug("scheduler.registered name={} priority={} rateMinutes={}",
                    name, schedule.priority(), schedule.rateMinutes());
        }
        return names;
    }

    /**
     * Cancels every recurring registration of a data source.
     *
     * @return number of registrations cancelled
     */
    public int unscheduleDataSource(DataSource dataSource) {
        int cancelled = 0;
        for (EntitySchedule schedule : configuration.forIntegration(dataSource.getIntegrationType())) {
            if (queue.cancelRecurring(recurringName(dataSource, schedule))) {
                cancelled++;
            }
        }
        log.info("scheduler.unscheduled dataSourceId={} cancelled={}", dataSource.getId(), cancelled);
        return cancelled;
    }

    static String recurringName(DataSource dataSource, EntitySchedule schedule) {
        return "sync:" + dataSource.getIntegrationType() + ":" + schedule.type().getWireName()
                + ":" + dataSource.getId();
    }
}
