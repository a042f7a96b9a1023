package com.sync.pipeline.connector;

import com.sync.pipeline.core.UnsupportedEntityTypeException;
import com.sync.pipeline.core.model.DataSource;
import com.sync.pipeline.core.model.EntityType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Deque;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedDeque;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Connector serving records held in memory, for local runs and tests.
 *
 * <p>Records are kept per data source and entity type and paged with an offset cursor.
 * Failures can be queued with {@link #failNext} and are thrown by the following fetches.</p>
 */
public class InMemoryConnector implements Connector {
    private static final Logger log = LoggerFactory.getLogger(InMemoryConnector.class);

    private final String integrationType;
    private final Set<EntityType> supportedTypes;
    private final Map<String, List<VendorRecord>> records = new ConcurrentHashMap<>();
    private final Deque<RuntimeException> pendingFailures = new ConcurrentLinkedDeque<>();
    private final AtomicLong fetchCount = new AtomicLong();
    private volatile ConnectorHealth health = ConnectorHealth.healthy();

    public InMemoryConnector(String integrationType, Set<EntityType> supportedTypes) {
        this.integrationType = integrationType;
        this.supportedTypes = supportedTypes.isEmpty()
                ? EnumSet.noneOf(EntityType.class)
                : EnumSet.copyOf(supportedTypes);
    }

    /**
     * Replaces the records served for a data source and entity type.
     */
    public InMemoryConnector withRecords(String dataSourceId, EntityType entityType, List<VendorRecord> data) {
        records.put(key(dataSourceId, entityType), List.copyOf(data));
        return this;
    }

    public InMemoryConnector withHealth(ConnectorHealth health) {
        this.health = health;
        return this;
    }

    /**
     * Makes the next fetch throw {@code failure}. Calls accumulate.
     */
    public InMemoryConnector failNext(RuntimeException failure) {
        pendingFailures.addLast(failure);
        return this;
    }

    @Override
    public String integrationType() {
        return integrationType;
    }

    @Override
    public Set<EntityType> supportedEntityTypes() {
        return Set.copyOf(supportedTypes);
    }

    @Override
    public ConnectorHealth checkHealth(DataSource dataSource) {
        return health;
    }

    @Override
    public FetchPage fetch(EntityType entityType, FetchRequest request) {
        fetchCount.incrementAndGet();
        if (!supports(entityType)) {
            throw new UnsupportedEntityTypeException(
                    "Integration " + integrationType + " does not support " + entityType.getWireName());
        }
        RuntimeException failure = pendingFailures.pollFirst();
        if (failure != null) {
            throw failure;
        }

        String dataSourceId = request.dataSource() != null ? request.dataSource().getId() : null;
        List<VendorRecord> all = records.getOrDefault(key(dataSourceId, entityType), List.of());
        int offset = parseCursor(request.cursor());
        int end = Math.min(all.size(), offset + request.pageSize());
        List<VendorRecord> page = offset >= all.size() ? List.of() : new ArrayList<>(all.subList(offset, end));
        boolean hasMore = end < all.size();
        log.debug("connector.fetch integrationType={} entityType={} offset={} returned={} hasMore={}",
                integrationType, entityType.getWireName(), offset, page.size(), hasMore);
        return new FetchPage(page, hasMore ? String.valueOf(end) : null, hasMore);
    }

    public long getFetchCount() {
        return fetchCount.get();
    }

    private static int parseCursor(String cursor) {
        if (cursor == null || cursor.isBlank()) {
            return 0;
        }
        try {
            return Math.max(0, Integer.parseInt(cursor));
        } catch (NumberFormatException e) {
            throw ConnectorException.configuration("Invalid cursor: " + cursor);
        }
    }

    private static String key(String dataSourceId, EntityType entityType) {
        return dataSourceId + "|" + entityType.getWireName();
    }
}
