package com.sync.pipeline.analysis.helpers;

import com.sync.pipeline.GraphRecords;
import com.sync.pipeline.analysis.context.AnalysisContext;
import com.sync.pipeline.analysis.context.ContextLoader;
import com.sync.pipeline.core.model.Entity;
import com.sync.pipeline.core.model.EntityType;
import com.sync.pipeline.core.model.Relationship;
import com.sync.pipeline.link.RelationshipTypes;
import com.sync.pipeline.metrics.NoOpMetricsService;
import com.sync.pipeline.store.EntityRepository;
import com.sync.pipeline.store.RelationshipRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.OptionalLong;

import static org.junit.jupiter.api.Assertions.*;

class AnalysisHelpersTest {

    private static final String TENANT = "tenant-a";
    private static final String DS = "ds-1";

    private EntityRepository entities;
    private RelationshipRepository relationships;
    private Entity alice;
    private Entity bob;
    private Entity engineering;

    @BeforeEach
    void setUp() {
        entities = new EntityRepository(EntityRepository.inMemoryStore());
        relationships = new RelationshipRepository(RelationshipRepository.inMemoryStore());
        alice = GraphRecords.identity(TENANT, DS, "u1", true);
        bob = GraphRecords.identity(TENANT, DS, "u2", false);
        engineering = GraphRecords.named(TENANT, DS, EntityType.GROUPS, "g1", "Engineering");
        Entity admins = GraphRecords.named(TENANT, DS, EntityType.ROLES, "r1", "Exchange Administrator");
        entities.insert(List.of(alice, bob, engineering, admins));
        relationships.insert(List.of(
                link(alice, engineering, RelationshipTypes.MEMBER_OF),
                link(alice, admins, RelationshipTypes.ASSIGNED_ROLE)));
    }

    private static Relationship link(Entity source, Entity target, String type) {
        return Relationship.builder()
                .tenantId(TENANT)
                .dataSourceId(DS)
                .sourceEntityType(source.getEntityType())
                .sourceEntityId(source.getId())
                .targetEntityType(target.getEntityType())
                .targetEntityId(target.getId())
                .relationshipType(type)
                .build();
    }

    private AnalysisContext load() {
        return new ContextLoader(entities, relationships, Runnable::run, 1000, 5000, new NoOpMetricsService())
                .load(TENANT, DS);
    }

    private Entity policy(String externalId, String status, List<String> includeUsers, List<String> excludeUsers,
                          List<String> includeGroups, List<String> excludeGroups) {
        Entity base = GraphRecords.mfaPolicy(TENANT, DS, externalId, includeUsers, includeGroups);
        Map<String, Object> normalized = new LinkedHashMap<>(base.getNormalizedData());
        normalized.put("status", status);
        normalized.put("excludeUsers", new ArrayList<>(excludeUsers));
        normalized.put("excludeGroups", new ArrayList<>(excludeGroups));
        return GraphRecords.entity(TENANT, DS, EntityType.POLICIES, externalId).normalizedData(normalized).build();
    }

    @Test
    @DisplayName("Roles should match by name fragment, ignoring case")
    void testRoles() {
        AnalysisContext context = load();

        assertTrue(AnalysisHelpers.hasRole(context, alice.getId(), "EXCHANGE"));
        assertTrue(AnalysisHelpers.holdsAdminRole(context, alice.getId()));
        assertFalse(AnalysisHelpers.holdsAdminRole(context, bob.getId()));
        assertTrue(AnalysisHelpers.isInGroup(context, alice.getId(), engineering.getId()));
        assertFalse(AnalysisHelpers.isInGroup(context, bob.getId(), engineering.getId()));
    }

    @Test
    void testEnabled() {
        assertTrue(AnalysisHelpers.isEnabled(alice));
        assertFalse(AnalysisHelpers.isEnabled(bob));
        assertTrue(AnalysisHelpers.isEnabled(GraphRecords.named(TENANT, DS, EntityType.IDENTITIES, "u9", "No flag")));
    }

    @Test
    @DisplayName("Policies should apply through users, groups and All, and honor exclusions")
    void testPolicyTargets() {
        AnalysisContext context = load();

        Entity byUser = policy("p1", "enabled", List.of("u1"), List.of(), List.of(), List.of());
        Entity byGroup = policy("p2", "enabled", List.of(), List.of(), List.of("g1"), List.of());
        Entity everyone = policy("p3", "enabled", List.of("All"), List.of(), List.of(), List.of());
        Entity excludedUser = policy("p4", "enabled", List.of("All"), List.of("u1"), List.of(), List.of());
        Entity excludedGroup = policy("p5", "enabled", List.of("All"), List.of(), List.of(), List.of("g1"));
        Entity disabled = policy("p6", "disabled", List.of("All"), List.of(), List.of(), List.of());

        assertTrue(AnalysisHelpers.doesPolicyApply(context, byUser, alice));
        assertFalse(AnalysisHelpers.doesPolicyApply(context, byUser, bob));
        assertTrue(AnalysisHelpers.doesPolicyApply(context, byGroup, alice));
        assertFalse(AnalysisHelpers.doesPolicyApply(context, byGroup, bob));
        assertTrue(AnalysisHelpers.doesPolicyApply(context, everyone, bob));
        assertFalse(AnalysisHelpers.doesPolicyApply(context, excludedUser, alice));
        assertTrue(AnalysisHelpers.doesPolicyApply(context, excludedUser, bob));
        assertFalse(AnalysisHelpers.doesPolicyApply(context, excludedGroup, alice));
        assertFalse(AnalysisHelpers.doesPolicyApply(context, disabled, alice));
    }

    @Test
    @DisplayName("MFA should be enforced by a matching policy or by security defaults")
    void testMfaEnforced() {
        entities.insert(List.of(GraphRecords.mfaPolicy(TENANT, DS, "p1", List.of(), List.of("g1"))));
        AnalysisContext context = load();

        assertFalse(AnalysisHelpers.isSecurityDefaultsEnabled(context));
        assertTrue(AnalysisHelpers.isMfaEnforced(context, alice));
        assertFalse(AnalysisHelpers.isMfaEnforced(context, bob));

        Map<String, Object> defaults = Map.of("externalId", "security-defaults", "name", "Security defaults",
                "policyType", "security_defaults", "status", "enabled");
        entities.insert(List.of(GraphRecords.entity(TENANT, DS, EntityType.POLICIES, "security-defaults")
                .normalizedData(defaults).build()));
        AnalysisContext withDefaults = load();

        assertTrue(AnalysisHelpers.isSecurityDefaultsEnabled(withDefaults));
        assertTrue(AnalysisHelpers.isMfaEnforced(withDefaults, bob));
    }

    @Test
    @DisplayName("Days since sign-in should be empty when unknown or malformed")
    void testDaysSinceLastLogin() {
        Instant now = Instant.parse("2026-10-16T12:00:00Z");

        assertEquals(OptionalLong.of(15), AnalysisHelpers.daysSinceLastLogin(
                GraphRecords.signedIn(TENANT, DS, "u5", true, "2026-10-01T08:00:00Z", List.of()).build(), now));
        assertEquals(OptionalLong.of(0), AnalysisHelpers.daysSinceLastLogin(
                GraphRecords.signedIn(TENANT, DS, "u5", true, "2026-10-16T09:00:00+02:00", List.of()).build(), now));
        assertTrue(AnalysisHelpers.daysSinceLastLogin(alice, now).isEmpty());
        assertTrue(AnalysisHelpers.daysSinceLastLogin(
                GraphRecords.signedIn(TENANT, DS, "u5", true, "yesterday", List.of()).build(), now).isEmpty());
    }

    @Test
    @DisplayName("Any applying conditional access policy should count as coverage")
    void testCoveredByPolicy() {
        Entity blockOnly = policy("p9", "enabled", List.of(), List.of(), List.of("g1"), List.of());
        Map<String, Object> normalized = new LinkedHashMap<>(blockOnly.getNormalizedData());
        normalized.put("requiresMfa", false);
        entities.insert(List.of(blockOnly.toBuilder().normalizedData(normalized).build()));
        AnalysisContext context = load();

        assertTrue(AnalysisHelpers.isCoveredByPolicy(context, alice));
        assertFalse(AnalysisHelpers.isMfaEnforced(context, alice));
        assertFalse(AnalysisHelpers.isCoveredByPolicy(context, bob));
    }
}
