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
import com.sync.pipeline.normalize.microsoft365.Microsoft365PolicyNormalizer;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Raises {@value #ALERT_TYPE} for enabled identities no security policy covers, high for
 * administrators and medium otherwise.
 */
public class PolicyGapNode implements Node {

    public static final String ALERT_TYPE = "policy_gap";
    public static final String PROVIDES_ALERTS = "alerts:" + ALERT_TYPE;

    @Override
    public String name() {
        return "policy-gap";
    }

    @Override
    public Set<String> requires() {
        return Set.of(TagAdminNode.PROVIDES);
    }

    @Override
    public Set<String> provides() {
        return Set.of(PROVIDES_ALERTS);
    }

    @Override
    public DeferredBatch execute(AnalysisContext context, AnalysisScope scope, DeferredBatch batch) {
        DeferredBatch.Builder next = batch.toBuilder().evaluated(ALERT_TYPE);
        boolean securityDefaults = AnalysisHelpers.isSecurityDefaultsEnabled(context);
        long enabledPolicies = context.entities(EntityType.POLICIES).stream()
                .filter(p -> Microsoft365PolicyNormalizer.TYPE_CONDITIONAL_ACCESS.equals(p.getString("policyType")))
                .filter(p -> Microsoft365PolicyNormalizer.STATUS_ENABLED.equals(p.getString("status")))
                .count();

        for (Entity identity : context.entities(EntityType.IDENTITIES)) {
            if (!AnalysisHelpers.isEnabled(identity) || AnalysisHelpers.isCoveredByPolicy(context, identity)) {
                next.resolve(ALERT_TYPE, identity.getId());
                continue;
            }
            boolean admin = AnalysisHelpers.isAdmin(batch, identity);
            Map<String, Object> details = new LinkedHashMap<>();
            details.put("externalId", identity.getExternalId());
            if (identity.getString("email") != null) {
                details.put("email", identity.getString("email"));
            }
            details.put("admin", admin);
            details.put("securityDefaultsEnabled", securityDefaults);
            details.put("enabledPolicyCount", enabledPolicies);
            next.raise(new AlertCandidate(ALERT_TYPE, identity.getId(), EntityType.IDENTITIES,
                    admin ? AlertSeverity.HIGH : AlertSeverity.MEDIUM,
                    "User " + identity.getString("name") + " is not covered by any security policy",
                    details));
        }
        return next.build();
    }
}
