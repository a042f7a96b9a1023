package com.sync.pipeline.analysis.nodes;

import com.sync.pipeline.alert.AlertService;
import com.sync.pipeline.analysis.workflow.AnalysisScope;
import com.sync.pipeline.analysis.workflow.AnalysisWorker;
import com.sync.pipeline.analysis.workflow.Node;
import com.sync.pipeline.core.model.EntityType;
import com.sync.pipeline.normalize.microsoft365.Microsoft365Normalizers;

import java.time.Clock;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * License usage of a Microsoft 365 data source: seats held by disabled or stale identities and
 * licenses consumed beyond their seat count.
 *
 * <p>Staleness is evaluated again here so license waste sees the tags of the same run.</p>
 */
public class Microsoft365LicenseWorker implements AnalysisWorker {

    private static final Set<EntityType> RELEVANT_TYPES = EnumSet.of(EntityType.IDENTITIES, EntityType.LICENSES);

    private final List<Node> nodes;

    public Microsoft365LicenseWorker(AlertService alertService, Clock clock) {
        this.nodes = List.of(new StaleUserNode(clock), new LicenseWasteNode(), new LicenseOveruseNode(),
                new IdentityStateNode(alertService,
                        Set.of(StaleUserNode.PROVIDES_ALERTS, LicenseWasteNode.PROVIDES_ALERTS)));
    }

    @Override
    public String name() {
        return "microsoft-365-licenses";
    }

    @Override
    public List<Node> nodes(AnalysisScope scope) {
        if (!Microsoft365Normalizers.INTEGRATION_TYPE.equals(scope.integrationType())
                || scope.changedTypes().stream().noneMatch(RELEVANT_TYPES::contains)) {
            return List.of();
        }
        return nodes;
    }

    @Override
    public boolean requiresFullContext() {
        return true;
    }
}
