package com.sync.pipeline.analysis.nodes;

import com.sync.pipeline.alert.Alert;
import com.sync.pipeline.alert.AlertCandidate;
import com.sync.pipeline.alert.AlertService;
import com.sync.pipeline.alert.AlertSeverity;
import com.sync.pipeline.alert.AlertStatus;
import com.sync.pipeline.analysis.context.AnalysisContext;
import com.sync.pipeline.analysis.workflow.AnalysisScope;
import com.sync.pipeline.analysis.workflow.DeferredBatch;
import com.sync.pipeline.analysis.workflow.Node;
import com.sync.pipeline.core.model.Entity;
import com.sync.pipeline.core.model.EntityState;
import com.sync.pipeline.core.model.EntityType;

import java.util.HashMap;
import java.util.Map;
import java.util.Set;

/**
 * Derives each identity's state from its highest-severity active alert, counting the alerts
 * raised earlier in the run in place of stored alerts of the evaluated types. Suppressed
 * alerts do not count.
 *
 * <p>The node closes a workflow, so it requires whatever alert capabilities the workflow's
 * earlier nodes provide.</p>
 */
public class IdentityStateNode implements Node {

    private final AlertService alertService;
    private final Set<String> requires;

    public IdentityStateNode(AlertService alertService) {
        this(alertService, Set.of(MfaEnforcementNode.PROVIDES_ALERTS));
    }

    public IdentityStateNode(AlertService alertService, Set<String> requires) {
        this.alertService = alertService;
        this.requires = Set.copyOf(requires);
    }

    @Override
    public String name() {
        return "identity-state";
    }

    @Override
    public Set<String> requires() {
        return requires;
    }

    @Override
    public Set<String> provides() {
        return Set.of("state:" + EntityType.IDENTITIES.getWireName());
    }

    @Override
    public DeferredBatch execute(AnalysisContext context, AnalysisScope scope, DeferredBatch batch) {
        Map<String, AlertSeverity> highest = new HashMap<>();
        Map<String, AlertStatus> storedStatus = new HashMap<>();
        for (Alert alert : alertService.findUnresolved(context.getTenantId(), context.getDataSourceId())) {
            storedStatus.put(alert.getFingerprint(), alert.getStatus());
            if (alert.getStatus() == AlertStatus.ACTIVE
                    && !batch.getEvaluatedAlertTypes().contains(alert.getAlertType())) {
                highest.merge(alert.getEntityId(), alert.getSeverity(), IdentityStateNode::max);
            }
        }
        for (AlertCandidate candidate : batch.getAlerts()) {
            if (storedStatus.get(candidate.fingerprint()) != AlertStatus.SUPPRESSED) {
                highest.merge(candidate.entityId(), candidate.severity(), IdentityStateNode::max);
            }
        }

        DeferredBatch.Builder next = batch.toBuilder();
        for (Entity identity : context.entities(EntityType.IDENTITIES)) {
            AlertSeverity severity = highest.get(identity.getId());
            EntityState state = severity != null ? severity.toEntityState() : EntityState.NORMAL;
            if (state != identity.getState()) {
                next.setState(identity.getId(), state);
            }
        }
        return next.build();
    }

    private static AlertSeverity max(AlertSeverity a, AlertSeverity b) {
        return a.compareTo(b) >= 0 ? a : b;
    }
}
