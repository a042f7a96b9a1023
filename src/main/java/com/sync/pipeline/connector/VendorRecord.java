package com.sync.pipeline.connector;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * One raw record as returned by a vendor API.
 */
public record VendorRecord(String externalId, Map<String, Object> data) {

    public VendorRecord {
        Objects.requireNonNull(externalId, "externalId is required");
        data = data != null ? Collections.unmodifiableMap(new LinkedHashMap<>(data)) : Map.of();
    }
}
