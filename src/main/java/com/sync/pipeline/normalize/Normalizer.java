package com.sync.pipeline.normalize;

import com.sync.pipeline.core.model.EntityType;
import com.sync.pipeline.fetch.DataFetchRecord;

import java.util.Set;

/**
 * Maps raw records of one integration and entity type to the canonical shape.
 */
public interface Normalizer {

    String integrationType();

    EntityType entityType();

    /**
     * @throws NormalizationException when the record is malformed
     */
    NormalizedRecord normalize(DataFetchRecord record);

    /**
     * Tags this normalizer owns. On update they are recomputed from the raw data, while
     * every other tag of the stored entity (set by analysis) is kept.
     */
    default Set<String> managedTags() {
        return Set.of();
    }
}
