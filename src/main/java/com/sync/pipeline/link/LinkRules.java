package com.sync.pipeline.link;

import com.sync.pipeline.core.model.EntityType;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Link rules by integration type.
 */
public class LinkRules {

    private final Map<String, List<LinkRule>> rules = new ConcurrentHashMap<>();

    public LinkRules register(String integrationType, List<LinkRule> integrationRules) {
        rules.merge(integrationType, List.copyOf(integrationRules), (a, b) -> {
            List<LinkRule> merged = new ArrayList<>(a);
            merged.addAll(b);
            return List.copyOf(merged);
        });
        return this;
    }

    public List<LinkRule> forIntegration(String integrationType) {
        return rules.getOrDefault(integrationType, List.of());
    }

    /**
     * Rules whose holder is the given type.
     */
    public List<LinkRule> heldBy(String integrationType, EntityType entityType) {
        return forIntegration(integrationType).stream().filter(r -> r.holderType() == entityType).toList();
    }

    /**
     * Rules referencing the given type.
     */
    public List<LinkRule> referencing(String integrationType, EntityType entityType) {
        return forIntegration(integrationType).stream().filter(r -> r.otherType() == entityType).toList();
    }

    /**
     * Microsoft 365: identity memberships, role assignments and licenses, and policy targets.
     */
    public static List<LinkRule> microsoft365() {
        return List.of(
                LinkRule.outgoing(EntityType.IDENTITIES, "groupIds", EntityType.GROUPS, RelationshipTypes.MEMBER_OF),
                LinkRule.outgoing(EntityType.IDENTITIES, "roleIds", EntityType.ROLES, RelationshipTypes.ASSIGNED_ROLE),
                LinkRule.incoming(EntityType.IDENTITIES, "licenseIds", EntityType.LICENSES, RelationshipTypes.HAS_LICENSE),
                LinkRule.outgoing(EntityType.POLICIES, "includeUsers", EntityType.IDENTITIES, RelationshipTypes.APPLIES_TO)
                        .ignoring("All", "None"),
                LinkRule.outgoing(EntityType.POLICIES, "includeGroups", EntityType.GROUPS, RelationshipTypes.APPLIES_TO)
                        .ignoring("All", "None"));
    }
}
