package com.sync.pipeline.normalize.microsoft365;

import com.sync.pipeline.GraphRecords;
import com.sync.pipeline.connector.VendorRecord;
import com.sync.pipeline.core.model.EntityType;
import com.sync.pipeline.fetch.DataFetchRecord;
import com.sync.pipeline.normalize.NormalizationException;
import com.sync.pipeline.normalize.NormalizedRecord;
import com.sync.pipeline.normalize.NormalizerRegistry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class Microsoft365NormalizersTest {

    private static DataFetchRecord record(VendorRecord vendor) {
        return new DataFetchRecord(vendor.externalId(), null, "hash", vendor.data());
    }

    private static DataFetchRecord record(String id, Map<String, Object> data) {
        return new DataFetchRecord(id, null, "hash", data);
    }

    @Test
    @DisplayName("Registry should expose every Microsoft 365 entity type")
    void testRegistry() {
        NormalizerRegistry registry = new NormalizerRegistry().registerAll(Microsoft365Normalizers.all());
        assertEquals(Set.of(EntityType.IDENTITIES, EntityType.GROUPS, EntityType.ROLES,
                EntityType.LICENSES, EntityType.POLICIES), registry.entityTypes());
        assertTrue(registry.find(Microsoft365Normalizers.INTEGRATION_TYPE, EntityType.GROUPS).isPresent());
        assertTrue(registry.find("halopsa", EntityType.GROUPS).isEmpty());
    }

    @Nested
    @DisplayName("Identities")
    class IdentityTests {

        private final Microsoft365IdentityNormalizer normalizer = new Microsoft365IdentityNormalizer();

        @Test
        @DisplayName("Should split memberOf into group and role ids")
        void testMemberships() {
            NormalizedRecord result = normalizer.normalize(record(GraphRecords.user("u1", "alice@contoso.com",
                    GraphRecords.groupRef("g1"), GraphRecords.roleRef("r1"), GraphRecords.groupRef("g2"))));

            assertEquals(List.of("g1", "g2"), result.normalizedData().get("groupIds"));
            assertEquals(List.of("r1"), result.normalizedData().get("roleIds"));
            assertEquals("alice@contoso.com", result.normalizedData().get("email"));
            assertEquals("alice", result.normalizedData().get("name"));
            assertEquals("2026-10-01T08:00:00Z", result.normalizedData().get("lastLoginAt"));
            assertTrue(result.tags().isEmpty());
        }

        @Test
        @DisplayName("Should tag guests, disabled accounts and service accounts")
        void testTags() {
            Map<String, Object> guest = new LinkedHashMap<>(GraphRecords.user("u2", "ext_bob@contoso.com").data());
            guest.put("userType", "Guest");
            assertEquals(Set.of("Guest"), normalizer.normalize(record("u2", guest)).tags());

            assertEquals(Set.of("Disabled"),
                    normalizer.normalize(record(GraphRecords.user("u3", "carol@contoso.com", false))).tags());
            assertEquals(Set.of("Service"),
                    normalizer.normalize(record(GraphRecords.user("u4", "svc-backup@contoso.com"))).tags());
        }

        @Test
        @DisplayName("Should collect proxy addresses other than the principal as aliases")
        void testAliases() {
            Map<String, Object> data = new LinkedHashMap<>(GraphRecords.user("u1", "alice@contoso.com").data());
            data.put("proxyAddresses", List.of("SMTP:alice@contoso.com", "smtp:a.smith@contoso.com"));
            data.put("assignedLicenses", List.of(Map.of("skuId", "sku-e5")));

            NormalizedRecord result = normalizer.normalize(record("u1", data));

            assertEquals(List.of("a.smith@contoso.com"), result.normalizedData().get("aliases"));
            assertEquals(List.of("sku-e5"), result.normalizedData().get("licenseIds"));
        }

        @Test
        @DisplayName("Should reject records without a principal name")
        void testMissingPrincipal() {
            assertThrows(NormalizationException.class,
                    () -> normalizer.normalize(record("u1", Map.of("id", "u1", "displayName", "Nobody"))));
        }
    }

    @Nested
    @DisplayName("Directory objects")
    class DirectoryObjectTests {

        @Test
        @DisplayName("Should classify group types")
        void testGroupTypes() {
            Microsoft365GroupNormalizer normalizer = new Microsoft365GroupNormalizer();
            assertEquals("security", normalizer.normalize(record(GraphRecords.group("g1", "Finance")))
                    .normalizedData().get("type"));
            assertEquals("modern", normalizer.normalize(record("g2",
                    Map.of("displayName", "Team", "groupTypes", List.of("Unified")))).normalizedData().get("type"));
            assertEquals("distribution", normalizer.normalize(record("g3",
                    Map.of("displayName", "All Staff"))).normalizedData().get("type"));
        }

        @Test
        @DisplayName("Should normalize roles")
        void testRole() {
            NormalizedRecord role = new Microsoft365RoleNormalizer()
                    .normalize(record(GraphRecords.role("r1", "Global Administrator")));
            assertEquals("Global Administrator", role.normalizedData().get("name"));
            assertEquals("template-r1", role.normalizedData().get("roleTemplateId"));
        }

        @Test
        @DisplayName("Should read license unit counts")
        void testLicense() {
            NormalizedRecord license = new Microsoft365LicenseNormalizer().normalize(record("sku-e5", Map.of(
                    "skuPartNumber", "SPE_E5",
                    "consumedUnits", 42,
                    "prepaidUnits", Map.of("enabled", "50"))));
            assertEquals("SPE_E5", license.normalizedData().get("name"));
            assertEquals(50L, license.normalizedData().get("totalUnits"));
            assertEquals(42L, license.normalizedData().get("consumedUnits"));
        }
    }

    @Nested
    @DisplayName("Policies")
    class PolicyTests {

        private final Microsoft365PolicyNormalizer normalizer = new Microsoft365PolicyNormalizer();

        @Test
        @DisplayName("Should normalize conditional access policies")
        void testConditionalAccess() {
            NormalizedRecord policy = normalizer.normalize(record("p1", Map.of(
                    "displayName", "Require MFA for admins",
                    "state", "enabled",
                    "conditions", Map.of("users", Map.of(
                            "includeUsers", List.of("u1"),
                            "includeGroups", List.of("g1"),
                            "excludeUsers", List.of("u9"))),
                    "grantControls", Map.of("builtInControls", List.of("mfa")))));

            Map<String, Object> data = policy.normalizedData();
            assertEquals(Microsoft365PolicyNormalizer.TYPE_CONDITIONAL_ACCESS, data.get("policyType"));
            assertEquals(Microsoft365PolicyNormalizer.STATUS_ENABLED, data.get("status"));
            assertEquals(true, data.get("requiresMfa"));
            assertEquals(List.of("u1"), data.get("includeUsers"));
            assertEquals(List.of("g1"), data.get("includeGroups"));
            assertEquals(List.of("u9"), data.get("excludeUsers"));
            assertEquals("Targets 1 users and 1 groups, Requires MFA", data.get("description"));
        }

        @Test
        @DisplayName("Report-only policies should not count as enabled")
        void testReportOnly() {
            NormalizedRecord policy = normalizer.normalize(record("p2", Map.of(
                    "displayName", "Pilot", "state", "enabledForReportingButNotEnforced")));
            assertEquals("report-only", policy.normalizedData().get("status"));
            assertEquals(false, policy.normalizedData().get("requiresMfa"));
        }

        @Test
        @DisplayName("Security defaults should map to an MFA policy when enabled")
        void testSecurityDefaults() {
            NormalizedRecord policy = normalizer.normalize(record(Microsoft365PolicyNormalizer.SECURITY_DEFAULTS_ID,
                    Map.of("isEnabled", true)));
            assertEquals(Microsoft365PolicyNormalizer.TYPE_SECURITY_DEFAULTS, policy.normalizedData().get("policyType"));
            assertEquals(Microsoft365PolicyNormalizer.STATUS_ENABLED, policy.normalizedData().get("status"));
            assertEquals(true, policy.normalizedData().get("requiresMfa"));
        }
    }
}
