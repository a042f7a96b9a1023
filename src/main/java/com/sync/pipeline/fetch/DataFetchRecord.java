package com.sync.pipeline.fetch;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;
import java.util.Objects;

/**
 * One fetched vendor record with its content hash and site association.
 *
 * @param externalId vendor id of the record
 * @param siteId     site the record belongs to, null when unassigned
 * @param dataHash   content hash over the stable fields of {@code rawData}
 * @param rawData    the vendor payload as received
 */
public record DataFetchRecord(
        @JsonProperty("externalID") String externalId,
        @JsonProperty("siteID") String siteId,
        @JsonProperty("dataHash") String dataHash,
        @JsonProperty("rawData") Map<String, Object> rawData
) {
    public DataFetchRecord {
        Objects.requireNonNull(externalId, "externalId is required");
        Objects.requireNonNull(dataHash, "dataHash is required");
        rawData = rawData != null ? rawData : Map.of();
    }
}
