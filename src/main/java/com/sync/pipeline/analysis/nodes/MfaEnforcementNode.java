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

import java.util.Map;
import java.util.Set;

/**
 * Evaluates MFA coverage of every identity.
 *
 * <p>Covered identities are tagged {@value AnalysisHelpers#TAG_MFA}. Enabled identities without
 * coverage raise {@value #ALERT_TYPE}, critical for administrators and high otherwise, which is
 * why the node requires the admin tag. Disabled identities resolve the alert.</p>
 */
public class MfaEnforcementNode implements Node {

    public static final String ALERT_TYPE = "mfa_not_enforced";
    public static final String PROVIDES_TAG = "tag:" + AnalysisHelpers.TAG_MFA;
    public static final String PROVIDES_ALERTS = "alerts:" + ALERT_TYPE;

    @Override
    public String name() {
        return "mfa-enforcement";
    }

    @Override
    public Set<String> requires() {
        return Set.of(TagAdminNode.PROVIDES);
    }

    @Override
    public Set<String> provides() {
        return Set.of(PROVIDES_TAG, PROVIDES_ALERTS);
    }

    @Override
    public DeferredBatch execute(AnalysisContext context, AnalysisScope scope, DeferredBatch batch) {
        DeferredBatch.Builder next = batch.toBuilder().evaluated(ALERT_TYPE);
        boolean securityDefaults = AnalysisHelpers.isSecurityDefaultsEnabled(context);

        for (Entity identity : context.entities(EntityType.IDENTITIES)) {
            boolean enforced = securityDefaults || AnalysisHelpers.isMfaEnforced(context, identity);
            boolean tagged = batch.hasTag(identity, AnalysisHelpers.TAG_MFA);
            if (enforced && !tagged) {
                next.addTag(identity.getId(), AnalysisHelpers.TAG_MFA);
            } else if (!enforced && tagged) {
                next.removeTag(identity.getId(), AnalysisHelpers.TAG_MFA);
            }

            if (enforced || !AnalysisHelpers.isEnabled(identity)) {
                next.resolve(ALERT_TYPE, identity.getId());
                continue;
            }
            boolean admin = AnalysisHelpers.isAdmin(batch, identity);
            next.raise(new AlertCandidate(ALERT_TYPE, identity.getId(), EntityType.IDENTITIES,
                    admin ? AlertSeverity.CRITICAL : AlertSeverity.HIGH,
                    "MFA is not enforced for " + (admin ? "administrator " : "") + identity.getString("name"),
                    Map.of("externalId", identity.getExternalId(), "admin", admin)));
        }
        return next.build();
    }
}
