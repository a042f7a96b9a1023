package com.sync.pipeline.analysis.nodes;

import com.sync.pipeline.alert.AlertService;
import com.sync.pipeline.analysis.workflow.AnalysisScope;
import com.sync.pipeline.analysis.workflow.AnalysisWorker;
import com.sync.pipeline.analysis.workflow.Node;
import com.sync.pipeline.core.model.EntityType;
import com.sync.pipeline.normalize.microsoft365.Microsoft365Normalizers;

import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Conditional access coverage of Microsoft 365 identities.
 */
public class Microsoft365PolicyWorker implements AnalysisWorker {

    private static final Set<EntityType> RELEVANT_TYPES =
            EnumSet.of(EntityType.IDENTITIES, EntityType.GROUPS, EntityType.ROLES, EntityType.POLICIES);

    private final List<Node> nodes;

    public Microsoft365PolicyWorker(AlertService alertService) {
        this.nodes = List.of(new TagAdminNode(), new PolicyGapNode(),
                new IdentityStateNode(alertService, Set.of(PolicyGapNode.PROVIDES_ALERTS)));
    }

    @Override
    public String name() {
        return "microsoft-365-policies";
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
