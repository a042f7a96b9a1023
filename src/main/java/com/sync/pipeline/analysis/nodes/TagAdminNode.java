package com.sync.pipeline.analysis.nodes;

import com.sync.pipeline.analysis.context.AnalysisContext;
import com.sync.pipeline.analysis.helpers.AnalysisHelpers;
import com.sync.pipeline.analysis.workflow.AnalysisScope;
import com.sync.pipeline.analysis.workflow.DeferredBatch;
import com.sync.pipeline.analysis.workflow.Node;
import com.sync.pipeline.core.model.Entity;
import com.sync.pipeline.core.model.EntityType;

import java.util.Set;

/**
 * Tags identities holding an administrative role with {@value AnalysisHelpers#TAG_ADMIN}
 * and removes the tag from identities that no longer hold one.
 */
public class TagAdminNode implements Node {

    public static final String PROVIDES = "tag:" + AnalysisHelpers.TAG_ADMIN;

    @Override
    public String name() {
        return "tag-admin";
    }

    @Override
    public Set<String> provides() {
        return Set.of(PROVIDES);
    }

    @Override
    public DeferredBatch execute(AnalysisContext context, AnalysisScope scope, DeferredBatch batch) {
        DeferredBatch.Builder next = batch.toBuilder();
        for (Entity identity : context.entities(EntityType.IDENTITIES)) {
            boolean admin = AnalysisHelpers.holdsAdminRole(context, identity.getId());
            boolean tagged = batch.hasTag(identity, AnalysisHelpers.TAG_ADMIN);
            if (admin && !tagged) {
                next.addTag(identity.getId(), AnalysisHelpers.TAG_ADMIN);
            } else if (!admin && tagged) {
                next.removeTag(identity.getId(), AnalysisHelpers.TAG_ADMIN);
            }
        }
        return next.build();
    }
}
