package com.sync.pipeline.connector;

import java.util.List;

/**
 * One page of vendor records.
 *
 * @param records    the records of this page
 * @param nextCursor cursor of the following page, null when {@code hasMore} is false
 * @param hasMore    whether another page follows
 */
public record FetchPage(List<VendorRecord> records, String nextCursor, boolean hasMore) {

    public FetchPage {
        records = records != null ? List.copyOf(records) : List.of();
        if (hasMore && nextCursor == null) {
            throw new IllegalArgumentException("nextCursor is required when hasMore is true");
        }
    }

    public static FetchPage last(List<VendorRecord> records) {
        return new FetchPage(records, null, false);
    }
}
