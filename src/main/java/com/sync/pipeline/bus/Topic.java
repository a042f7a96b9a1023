package com.sync.pipeline.bus;

import com.sync.pipeline.core.model.EntityType;
import com.sync.pipeline.core.model.Stage;

/**
 * Topic naming and matching for the message bus.
 *
 * <p>Topics are {@code {stage}.{entityType}} or {@code {integrationType}.sync.{entityType}}.
 * Patterns use {@code *} to match exactly one segment.</p>
 */
public final class Topic {

    public static final String WILDCARD = "*";

    private Topic() {
    }

    public static String of(Stage stage, EntityType entityType) {
        return stage.getWireName() + "." + entityType.getWireName();
    }

    public static String sync(String integrationType, EntityType entityType) {
        return integrationType + "." + Stage.SYNC.getWireName() + "." + entityType.getWireName();
    }

    /**
     * Pattern matching every entity type of one stage, e.g. {@code fetched.*}.
     */
    public static String allOf(Stage stage) {
        return stage.getWireName() + "." + WILDCARD;
    }

    /**
     * Pattern matching every sync request of one integration, e.g. {@code microsoft-365.sync.*}.
     */
    public static String allSyncsOf(String integrationType) {
        return integrationType + "." + Stage.SYNC.getWireName() + "." + WILDCARD;
    }

    /**
     * Returns true if the topic matches the pattern segment by segment.
     */
    public static boolean matches(String pattern, String topic) {
        String[] patternParts = pattern.split("\\.", -1);
        String[] topicParts = topic.split("\\.", -1);
        if (patternParts.length != topicParts.length) {
            return false;
        }
        for (int i = 0; i < patternParts.length; i++) {
            if (!WILDCARD.equals(patternParts[i]) && !patternParts[i].equals(topicParts[i])) {
                return false;
            }
        }
        return true;
    }
}
