package com.sync.pipeline.bus;

import com.sync.pipeline.core.model.EntityType;
import com.sync.pipeline.core.model.Stage;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class TopicTest {

    @Test
    @DisplayName("Should build stage topics from wire names")
    void testStageTopics() {
        assertEquals("fetched.identities", Topic.of(Stage.FETCHED, EntityType.IDENTITIES));
        assertEquals("linked.groups", Topic.of(Stage.LINKED, EntityType.GROUPS));
        assertEquals("failed.*", Topic.allOf(Stage.FAILED));
    }

    @Test
    @DisplayName("Should build sync topics per integration")
    void testSyncTopics() {
        assertEquals("microsoft-365.sync.roles", Topic.sync("microsoft-365", EntityType.ROLES));
        assertEquals("microsoft-365.sync.*", Topic.allSyncsOf("microsoft-365"));
    }

    @Test
    @DisplayName("Wildcard should match exactly one segment")
    void testWildcardMatching() {
        assertTrue(Topic.matches("fetched.*", "fetched.identities"));
        assertTrue(Topic.matches("microsoft-365.sync.*", "microsoft-365.sync.policies"));
        assertFalse(Topic.matches("fetched.*", "processed.identities"));
        assertFalse(Topic.matches("fetched.*", "fetched"));
        assertFalse(Topic.matches("microsoft-365.sync.*", "halopsa.sync.companies"));
    }

    @Test
    @DisplayName("Literal patterns should match only the same topic")
    void testLiteralMatching() {
        assertTrue(Topic.matches("completed.licenses", "completed.licenses"));
        assertFalse(Topic.matches("completed.licenses", "completed.identities"));
    }
}
