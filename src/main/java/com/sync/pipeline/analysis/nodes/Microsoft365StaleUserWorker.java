package com.sync.pipeline.analysis.nodes;

import com.sync.pipeline.alert.AlertService;
import com.sync.pipeline.analysis.workflow.AnalysisScope;
import com.sync.pipeline.analysis.workflow.AnalysisWorker;
import com.sync.pipeline.analysis.workflow.Node;
import com.sync.pipeline.core.model.EntityType;
import com.sync.pipeline.normalize.microsoft365.Microsoft365Normalizers;

import java.time.Clock;
import java.util.List;
import java.util.Set;

/**
 * Sign-in staleness of Microsoft 365 identities. Runs after every identity batch, since it only
 * reads the identities themselves.
 */
public class Microsoft365StaleUserWorker implements AnalysisWorker {

    private final List<Node> nodes;

    public Microsoft365StaleUserWorker(AlertService alertService, Clock clock) {
        this.nodes = List.of(new StaleUserNode(clock),
                new IdentityStateNode(alertService, Set.of(StaleUserNode.PROVIDES_ALERTS)));
    }

    @Override
    public String name() {
        return "microsoft-365-stale-users";
    }

    @Override
    public List<Node> nodes(AnalysisScope scope) {
        if (!Microsoft365Normalizers.INTEGRATION_TYPE.equals(scope.integrationType())
                || !scope.changedTypes().contains(EntityType.IDENTITIES)) {
            return List.of();
        }
        return nodes;
    }
}
