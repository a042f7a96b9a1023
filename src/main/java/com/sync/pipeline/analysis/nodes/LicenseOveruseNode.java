package com.sync.pipeline.analysis.nodes;

import com.sync.pipeline.alert.AlertCandidate;
import com.sync.pipeline.alert.AlertSeverity;
import com.sync.pipeline.analysis.context.AnalysisContext;
import com.sync.pipeline.analysis.workflow.AnalysisScope;
import com.sync.pipeline.analysis.workflow.DeferredBatch;
import com.sync.pipeline.analysis.workflow.Node;
import com.sync.pipeline.core.model.Entity;
import com.sync.pipeline.core.model.EntityType;

import java.util.Map;
import java.util.Set;

/**
 * Raises a high {@value #ALERT_TYPE} on each license consuming more seats than it has.
 * Licenses without a seat count are skipped.
 */
public class LicenseOveruseNode implements Node {

    public static final String ALERT_TYPE = "license_overuse";
    public static final String PROVIDES_ALERTS = "alerts:" + ALERT_TYPE;

    @Override
    public String name() {
        return "license-overuse";
    }

    @Override
    public Set<String> requires() {
        return Set.of();
    }

    @Override
    public Set<String> provides() {
        return Set.of(PROVIDES_ALERTS);
    }

    @Override
    public DeferredBatch execute(AnalysisContext context, AnalysisScope scope, DeferredBatch batch) {
        DeferredBatch.Builder next = batch.toBuilder().evaluated(ALERT_TYPE);

        for (Entity license : context.entities(EntityType.LICENSES)) {
            long total = units(license, "totalUnits");
            long consumed = units(license, "consumedUnits");
            if (total <= 0 || consumed <= total) {
                next.resolve(ALERT_TYPE, license.getId());
                continue;
            }
            next.raise(new AlertCandidate(ALERT_TYPE, license.getId(), EntityType.LICENSES, AlertSeverity.HIGH,
                    "License " + license.getString("name") + " is overused: " + consumed + " consumed / "
                            + total + " available",
                    Map.of("totalUnits", total, "consumedUnits", consumed, "overage", consumed - total)));
        }
        return next.build();
    }

    private static long units(Entity license, String field) {
        Object value = license.getNormalizedData().get(field);
        return value instanceof Number n ? n.longValue() : 0L;
    }
}
