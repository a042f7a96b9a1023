package com.sync.pipeline.normalize.microsoft365;

import com.sync.pipeline.core.model.EntityType;
import com.sync.pipeline.fetch.DataFetchRecord;
import com.sync.pipeline.normalize.NormalizedRecord;
import com.sync.pipeline.normalize.Normalizer;
import com.sync.pipeline.normalize.RawFields;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Graph {@code user} to identity.
 *
 * <p>Group and directory role memberships are read from {@code memberOf} and kept as
 * {@code groupIds} / {@code roleIds} for linking; assigned licenses become {@code licenseIds}.</p>
 */
public class Microsoft365IdentityNormalizer implements Normalizer {

    public static final String TAG_GUEST = "Guest";
    public static final String TAG_DISABLED = "Disabled";
    public static final String TAG_SERVICE = "Service";

    private static final List<String> SERVICE_MARKERS = List.of("service", "svc", "no-reply", "noreply");
    private static final String GROUP_TYPE = "#microsoft.graph.group";
    private static final String ROLE_TYPE = "#microsoft.graph.directoryRole";

    @Override
    public String integrationType() {
        return Microsoft365Normalizers.INTEGRATION_TYPE;
    }

    @Override
    public EntityType entityType() {
        return EntityType.IDENTITIES;
    }

    @Override
    public Set<String> managedTags() {
        return Set.of(TAG_GUEST, TAG_DISABLED, TAG_SERVICE);
    }

    @Override
    public NormalizedRecord normalize(DataFetchRecord record) {
        Map<String, Object> raw = record.rawData();
        String principal = RawFields.requireString(raw, "userPrincipalName");
        String userType = RawFields.string(raw, "userType");
        userType = userType != null ? userType.toLowerCase(Locale.ROOT) : "member";
        boolean enabled = RawFields.bool(raw, "accountEnabled", true);

        Set<String> tags = new TreeSet<>();
        if ("guest".equals(userType)) {
            tags.add(TAG_GUEST);
        }
        if (!enabled) {
            tags.add(TAG_DISABLED);
        }
        String lowerPrincipal = principal.toLowerCase(Locale.ROOT);
        if (lowerPrincipal.startsWith("system") || SERVICE_MARKERS.stream().anyMatch(lowerPrincipal::contains)) {
            tags.add(TAG_SERVICE);
        }

        List<String> groupIds = new ArrayList<>();
        List<String> roleIds = new ArrayList<>();
        for (Object member : RawFields.list(raw, "memberOf")) {
            if (!(member instanceof Map<?, ?> map) || map.get("id") == null) {
                continue;
            }
            String id = map.get("id").toString();
            Object odataType = map.get("@odata.type");
            if (ROLE_TYPE.equals(odataType)) {
                roleIds.add(id);
            } else if (GROUP_TYPE.equals(odataType)) {
                groupIds.add(id);
            }
        }

        Map<String, Object> normalized = new LinkedHashMap<>();
        normalized.put("externalId", record.externalId());
        normalized.put("name", RawFields.string(raw, "displayName"));
        normalized.put("email", principal);
        normalized.put("aliases", aliases(raw, lowerPrincipal));
        normalized.put("type", userType);
        normalized.put("enabled", enabled);
        normalized.put("licenseIds", RawFields.pluck(raw, "assignedLicenses", "skuId"));
        normalized.put("groupIds", groupIds);
        normalized.put("roleIds", roleIds);
        normalized.put("lastLoginAt", RawFields.string(RawFields.object(raw, "signInActivity"), "lastSignInDateTime"));
        return new NormalizedRecord(normalized, tags);
    }

    private static List<String> aliases(Map<String, Object> raw, String lowerPrincipal) {
        List<String> aliases = new ArrayList<>();
        for (String proxy : RawFields.strings(raw, "proxyAddresses")) {
            int colon = proxy.indexOf(':');
            String address = colon >= 0 ? proxy.substring(colon + 1) : proxy;
            if (!address.toLowerCase(Locale.ROOT).equals(lowerPrincipal)) {
                aliases.add(address);
            }
        }
        return aliases;
    }
}
