package com.sync.pipeline.hash;

import com.sync.pipeline.core.model.EntityType;

import java.util.Map;
import java.util.Set;

/**
 * Registered hash policies.
 */
public final class HashPolicies {

    /**
     * Sign-in and last-seen timestamps, agent check-ins, uptime counters and OData etags.
     */
    public static final HashPolicy V1 = new HashPolicy(
            "v1",
            Set.of("@odata.etag", "lastSeenAt", "lastActivityAt"),
            Map.of(
                    EntityType.IDENTITIES, Set.of("signInActivity", "lastSignInDateTime",
                            "lastNonInteractiveSignInDateTime"),
                    EntityType.ENDPOINTS, Set.of("lastSeen", "lastCheckIn", "lastAuditDate", "uptime"),
                    EntityType.FIREWALLS, Set.of("stateChangedAt", "uptimeSeconds")
            ));

    private HashPolicies() {
    }

    public static HashPolicy current() {
        return V1;
    }
}
