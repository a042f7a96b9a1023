package com.sync.pipeline.normalize.microsoft365;

import com.sync.pipeline.core.model.EntityType;
import com.sync.pipeline.fetch.DataFetchRecord;
import com.sync.pipeline.normalize.NormalizedRecord;
import com.sync.pipeline.normalize.Normalizer;
import com.sync.pipeline.normalize.RawFields;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Conditional access policies and the security defaults switch to policy.
 *
 * <p>Security defaults arrive as a single record with external id {@value #SECURITY_DEFAULTS_ID}
 * and raw data {@code {"isEnabled": bool}}.</p>
 */
public class Microsoft365PolicyNormalizer implements Normalizer {

    public static final String SECURITY_DEFAULTS_ID = "security-defaults";
    public static final String TYPE_SECURITY_DEFAULTS = "security_defaults";
    public static final String TYPE_CONDITIONAL_ACCESS = "conditional_access";
    public static final String STATUS_ENABLED = "enabled";

    @Override
    public String integrationType() {
        return Microsoft365Normalizers.INTEGRATION_TYPE;
    }

    @Override
    public EntityType entityType() {
        return EntityType.POLICIES;
    }

    @Override
    public NormalizedRecord normalize(DataFetchRecord record) {
        Map<String, Object> raw = record.rawData();
        Map<String, Object> normalized = new LinkedHashMap<>();
        normalized.put("externalId", record.externalId());

        if (SECURITY_DEFAULTS_ID.equals(record.externalId())) {
            boolean enabled = RawFields.bool(raw, "isEnabled", false);
            normalized.put("name", "Security Defaults");
            normalized.put("description", "Baseline security policies enforced by the directory");
            normalized.put("policyType", TYPE_SECURITY_DEFAULTS);
            normalized.put("status", enabled ? STATUS_ENABLED : "disabled");
            normalized.put("requiresMfa", enabled);
            return NormalizedRecord.of(normalized);
        }

        String state = RawFields.string(raw, "state");
        String status;
        if ("enabled".equals(state)) {
            status = STATUS_ENABLED;
        } else if ("enabledForReportingButNotEnforced".equals(state)) {
            status = "report-only";
        } else {
            status = "disabled";
        }

        Map<String, Object> users = RawFields.object(RawFields.object(raw, "conditions"), "users");
        List<String> includeUsers = RawFields.strings(users, "includeUsers");
        List<String> includeGroups = RawFields.strings(users, "includeGroups");
        List<String> controls = RawFields.strings(RawFields.object(raw, "grantControls"), "builtInControls");

        normalized.put("name", RawFields.requireString(raw, "displayName"));
        normalized.put("description", describe(includeUsers, includeGroups, controls));
        normalized.put("policyType", TYPE_CONDITIONAL_ACCESS);
        normalized.put("status", status);
        normalized.put("requiresMfa", controls.contains("mfa"));
        normalized.put("includeUsers", includeUsers);
        normalized.put("excludeUsers", RawFields.strings(users, "excludeUsers"));
        normalized.put("includeGroups", includeGroups);
        normalized.put("excludeGroups", RawFields.strings(users, "excludeGroups"));
        return NormalizedRecord.of(normalized);
    }

    private static String describe(List<String> includeUsers, List<String> includeGroups, List<String> controls) {
        List<String> parts = new ArrayList<>();
        if (includeUsers.contains("All")) {
            parts.add("Applies to all users");
        } else if (!includeUsers.isEmpty() || !includeGroups.isEmpty()) {
            parts.add("Targets " + includeUsers.size() + " users and " + includeGroups.size() + " groups");
        }
        if (controls.contains("mfa")) {
            parts.add("Requires MFA");
        }
        if (controls.contains("compliantDevice")) {
            parts.add("Requires compliant device");
        }
        return parts.isEmpty() ? "Conditional access policy" : String.join(", ", parts);
    }
}
