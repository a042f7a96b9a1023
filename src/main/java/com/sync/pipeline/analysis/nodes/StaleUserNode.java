package com.sync.pipeline.analysis.nodes;

import com.sync.pipeline.alert.AlertCandidate;
import com.sync.pipeline.alert.AlertSeverity;
import com.sync.pipeline.analysis.context.AnalysisContext;
import com.sync.pipeline.analysis.helpers.AnalysisHelpers;
import com.sync.pipeline.analysis.workflow.AnalysisScope;
import com.sync.pipeline.analysis.workflow.DeferredBatch;
import com.sync.pipeline.analysis.workflow.Node;
import com.sync.pipeline.core.model.Entity;
import com.sync.pipeline.core.model.EntityType;

import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.OptionalLong;
import java.util.Set;

/**
 * Tags identities that have not signed in for {@value #STALE_AFTER_DAYS} days or more as
 * {@value AnalysisHelpers#TAG_STALE}.
 *
 * <p>Enabled stale identities raise {@value #ALERT_TYPE}: high for administrators, low without
 * licenses and medium otherwise, one level higher once the gap reaches
 * {@value #LONG_STALE_AFTER_DAYS} days. An identity with no recorded sign-in is never stale.</p>
 */
public class StaleUserNode implements Node {

    public static final String ALERT_TYPE = "stale_user";
    public static final String PROVIDES_TAG = "tag:" + AnalysisHelpers.TAG_STALE;
    public static final String PROVIDES_ALERTS = "alerts:" + ALERT_TYPE;

    static final long STALE_AFTER_DAYS = 90;
    static final long LONG_STALE_AFTER_DAYS = 180;

    private final Clock clock;

    public StaleUserNode(Clock clock) {
        this.clock = clock;
    }

    @Override
    public String name() {
        return "stale-user";
    }

    @Override
    public Set<String> requires() {
        return Set.of();
    }

    @Override
    public Set<String> provides() {
        return Set.of(PROVIDES_TAG, PROVIDES_ALERTS);
    }

    @Override
    public DeferredBatch execute(AnalysisContext context, AnalysisScope scope, DeferredBatch batch) {
        DeferredBatch.Builder next = batch.toBuilder().evaluated(ALERT_TYPE);
        Instant now = clock.instant();

        for (Entity identity : context.entities(EntityType.IDENTITIES)) {
            OptionalLong days = AnalysisHelpers.daysSinceLastLogin(identity, now);
            boolean stale = days.isPresent() && days.getAsLong() >= STALE_AFTER_DAYS;
            boolean tagged = batch.hasTag(identity, AnalysisHelpers.TAG_STALE);
            if (stale && !tagged) {
                next.addTag(identity.getId(), AnalysisHelpers.TAG_STALE);
            } else if (!stale && tagged) {
                next.removeTag(identity.getId(), AnalysisHelpers.TAG_STALE);
            }

            if (!stale || !AnalysisHelpers.isEnabled(identity)) {
                next.resolve(ALERT_TYPE, identity.getId());
                continue;
            }
            boolean admin = AnalysisHelpers.isAdmin(batch, identity);
            boolean licensed = AnalysisHelpers.hasLicenses(identity);
            Map<String, Object> details = new LinkedHashMap<>();
            details.put("externalId", identity.getExternalId());
            details.put("daysSinceLogin", days.getAsLong());
            details.put("lastLoginAt", identity.getString("lastLoginAt"));
            details.put("hasLicenses", licensed);
            details.put("admin", admin);
            next.raise(new AlertCandidate(ALERT_TYPE, identity.getId(), EntityType.IDENTITIES,
                    severity(admin, licensed, days.getAsLong()),
                    identity.getString("name") + " has not signed in for " + days.getAsLong() + " days",
                    details));
        }
        return next.build();
    }

    static AlertSeverity severity(boolean admin, boolean licensed, long days) {
        AlertSeverity base = admin ? AlertSeverity.HIGH : licensed ? AlertSeverity.MEDIUM : AlertSeverity.LOW;
        if (days < LONG_STALE_AFTER_DAYS) {
            return base;
        }
        return AlertSeverity.values()[base.ordinal() + 1];
    }
}
