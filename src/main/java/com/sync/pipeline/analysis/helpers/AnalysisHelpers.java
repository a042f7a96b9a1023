package com.sync.pipeline.analysis.helpers;

import com.sync.pipeline.analysis.context.AnalysisContext;
import com.sync.pipeline.analysis.workflow.DeferredBatch;
import com.sync.pipeline.core.model.Entity;
import com.sync.pipeline.core.model.EntityType;
import com.sync.pipeline.normalize.microsoft365.Microsoft365PolicyNormalizer;

import java.time.Duration;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.OptionalLong;

/**
 * Pure lookups over a loaded {@link AnalysisContext}. No method performs I/O.
 */
public final class AnalysisHelpers {

    public static final String TAG_ADMIN = "Admin";
    public static final String TAG_MFA = "MFA";
    public static final String TAG_STALE = "Stale";

    private static final String ALL_USERS = "All";

    private AnalysisHelpers() {
    }

    public static boolean isInGroup(AnalysisContext context, String identityId, String groupId) {
        return context.groupsOf(identityId).contains(groupId);
    }

    /**
     * True if the identity holds a role whose name contains {@code fragment}, ignoring case.
     */
    public static boolean hasRole(AnalysisContext context, String identityId, String fragment) {
        String needle = fragment.toLowerCase(Locale.ROOT);
        for (String roleId : context.rolesOf(identityId)) {
            Optional<Entity> role = context.getEntity(roleId);
            if (role.isPresent() && nameContains(role.get(), needle)) {
                return true;
            }
        }
        return false;
    }

    /**
     * True if the identity holds any administrative role.
     */
    public static boolean holdsAdminRole(AnalysisContext context, String identityId) {
        return hasRole(context, identityId, "admin");
    }

    /**
     * True if the identity carries the {@value #TAG_ADMIN} tag, including tags queued earlier in the run.
     */
    public static boolean isAdmin(DeferredBatch batch, Entity identity) {
        return batch.hasTag(identity, TAG_ADMIN);
    }

    public static boolean isEnabled(Entity identity) {
        return !Boolean.FALSE.equals(identity.getNormalizedData().get("enabled"));
    }

    /**
     * True if an enabled policy targets the identity: all users, the identity itself or a group
     * it belongs to, and neither the identity nor one of its groups is excluded.
     */
    public static boolean doesPolicyApply(AnalysisContext context, Entity policy, Entity identity) {
        if (!Microsoft365PolicyNormalizer.STATUS_ENABLED.equals(policy.getString("status"))) {
            return false;
        }
        String externalId = identity.getExternalId();
        if (strings(policy, "excludeUsers").contains(externalId)
                || inAnyGroup(context, identity, strings(policy, "excludeGroups"))) {
            return false;
        }
        List<String> includeUsers = strings(policy, "includeUsers");
        return includeUsers.contains(ALL_USERS)
                || includeUsers.contains(externalId)
                || inAnyGroup(context, identity, strings(policy, "includeGroups"));
    }

    public static boolean isSecurityDefaultsEnabled(AnalysisContext context) {
        return context.entities(EntityType.POLICIES).stream()
                .anyMatch(p -> Microsoft365PolicyNormalizer.TYPE_SECURITY_DEFAULTS.equals(p.getString("policyType"))
                        && Microsoft365PolicyNormalizer.STATUS_ENABLED.equals(p.getString("status")));
    }

    /**
     * True if security defaults are on, or an enabled conditional access policy requiring MFA applies.
     */
    public static boolean isMfaEnforced(AnalysisContext context, Entity identity) {
        if (isSecurityDefaultsEnabled(context)) {
            return true;
        }
        for (Entity policy : context.entities(EntityType.POLICIES)) {
            if (Microsoft365PolicyNormalizer.TYPE_CONDITIONAL_ACCESS.equals(policy.getString("policyType"))
                    && Boolean.TRUE.equals(policy.getNormalizedData().get("requiresMfa"))
                    && doesPolicyApply(context, policy, identity)) {
                return true;
            }
        }
        return false;
    }

    /**
     * True if security defaults are on, or any enabled conditional access policy applies to the
     * identity, whatever its grant controls.
     */
    public static boolean isCoveredByPolicy(AnalysisContext context, Entity identity) {
        if (isSecurityDefaultsEnabled(context)) {
            return true;
        }
        for (Entity policy : context.entities(EntityType.POLICIES)) {
            if (Microsoft365PolicyNormalizer.TYPE_CONDITIONAL_ACCESS.equals(policy.getString("policyType"))
                    && doesPolicyApply(context, policy, identity)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Whole days between the identity's last sign-in and {@code now}. Empty when the sign-in time
     * is missing or not an ISO-8601 timestamp.
     */
    public static OptionalLong daysSinceLastLogin(Entity identity, Instant now) {
        String lastLogin = identity.getString("lastLoginAt");
        if (lastLogin == null || lastLogin.isBlank()) {
            return OptionalLong.empty();
        }
        try {
            Instant at = OffsetDateTime.parse(lastLogin).toInstant();
            return OptionalLong.of(Math.max(0, Duration.between(at, now).toDays()));
        } catch (DateTimeParseException e) {
            return OptionalLong.empty();
        }
    }

    public static boolean hasLicenses(Entity identity) {
        return !strings(identity, "licenseIds").isEmpty();
    }

    private static boolean inAnyGroup(AnalysisContext context, Entity identity, List<String> groupExternalIds) {
        for (String groupExternalId : groupExternalIds) {
            Optional<Entity> group = context.getByExternalId(EntityType.GROUPS, groupExternalId);
            if (group.isPresent() && isInGroup(context, identity.getId(), group.get().getId())) {
                return true;
            }
        }
        return false;
    }

    private static boolean nameContains(Entity entity, String needle) {
        String name = entity.getString("name");
        return name != null && name.toLowerCase(Locale.ROOT).contains(needle);
    }

    private static List<String> strings(Entity entity, String field) {
        Object value = entity.getNormalizedData().get(field);
        if (value instanceof Collection<?> values) {
            return values.stream().map(String::valueOf).toList();
        }
        return List.of();
    }
}
