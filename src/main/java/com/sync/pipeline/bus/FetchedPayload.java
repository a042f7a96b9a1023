package com.sync.pipeline.bus;

import com.sync.pipeline.fetch.DataFetchRecord;
import com.sync.pipeline.history.JobMetrics;

import java.util.List;

/**
 * Raw vendor records of one fetched page.
 */
public record FetchedPayload(List<DataFetchRecord> data, int total, boolean hasMore, String nextPageToken,
                             SyncMetadata syncMetadata, JobMetrics metrics) implements EventPayload {

    public FetchedPayload {
        data = data != null ? List.copyOf(data) : List.of();
        metrics = metrics != null ? metrics : new JobMetrics();
    }
}
