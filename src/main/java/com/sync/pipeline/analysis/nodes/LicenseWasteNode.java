package com.sync.pipeline.analysis.nodes;

import com.sync.pipeline.alert.AlertCandidate;
import com.sync.pipeline.alert.AlertSeverity;
import com.sync.pipeline.analysis.context.AnalysisContext;
import com.sync.pipeline.analysis.helpers.AnalysisHelpers;
import com.sync.pipeline.analysis.workflow.AnalysisScope;
import com.sync.pipeline.analysis.workflow.DeferredBatch;
import com.sync.pipeline.analysis.workflow.Node;
import com.sync.pipeline.core.model.Entity;
import com.sync.pipeline.core.model.EntityType;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Raises {@value #ALERT_TYPE} for licenses held by disabled or stale identities. A disabled
 * holder is medium, a stale one low.
 */
public class LicenseWasteNode implements Node {

    public static final String ALERT_TYPE = "license_waste";
    public static final String PROVIDES_ALERTS = "alerts:" + ALERT_TYPE;

    @Override
    public String name() {
        return "license-waste";
    }

    @Override
    public Set<String> requires() {
        return Set.of(StaleUserNode.PROVIDES_TAG);
    }

    @Override
    public Set<String> provides() {
        return Set.of(PROVIDES_ALERTS);
    }

    @Override
    public DeferredBatch execute(AnalysisContext context, AnalysisScope scope, DeferredBatch batch) {
        DeferredBatch.Builder next = batch.toBuilder().evaluated(ALERT_TYPE);

        for (Entity identity : context.entities(EntityType.IDENTITIES)) {
            boolean disabled = !AnalysisHelpers.isEnabled(identity);
            boolean stale = batch.hasTag(identity, AnalysisHelpers.TAG_STALE);
            List<Map<String, Object>> wasted = licenses(context, identity);
            if ((!disabled && !stale) || wasted.isEmpty()) {
                next.resolve(ALERT_TYPE, identity.getId());
                continue;
            }
            String reason = disabled ? "disabled" : "stale";
            Map<String, Object> details = new LinkedHashMap<>();
            details.put("externalId", identity.getExternalId());
            details.put("reason", reason);
            details.put("wastedLicenses", wasted);
            next.raise(new AlertCandidate(ALERT_TYPE, identity.getId(), EntityType.IDENTITIES,
                    disabled ? AlertSeverity.MEDIUM : AlertSeverity.LOW,
                    wasted.size() + " license(s) assigned to " + reason + " user " + identity.getString("name"),
                    details));
        }
        return next.build();
    }

    private static List<Map<String, Object>> licenses(AnalysisContext context, Entity identity) {
        List<Map<String, Object>> wasted = new ArrayList<>();
        for (String licenseId : context.licensesOf(identity.getId())) {
            Optional<Entity> license = context.getEntity(licenseId);
            license.ifPresent(l -> wasted.add(Map.of(
                    "skuId", l.getExternalId(),
                    "name", l.getString("name") != null ? l.getString("name") : l.getExternalId())));
        }
        return wasted;
    }
}
