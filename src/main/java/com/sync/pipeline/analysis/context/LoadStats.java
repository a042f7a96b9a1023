package com.sync.pipeline.analysis.context;

/**
 * Statistics of one context load.
 *
 * @param queryCount         bulk reads issued; depends on the entity types loaded, never on row count
 * @param loadTimeMs         wall time of the load
 * @param totalEntities      entities loaded
 * @param totalRelationships relationships loaded
 */
public record LoadStats(int queryCount, long loadTimeMs, int totalEntities, int totalRelationships) {
}
