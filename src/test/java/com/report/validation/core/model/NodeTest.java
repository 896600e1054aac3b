package com.report.validation.core.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.report.validation.support.TestReports;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class NodeTest {

    private static final NodeMetadata METADATA =
            new NodeMetadata("general_assessment", Set.of(), 5, 5, "test");

    @Nested
    @DisplayName("Content hash")
    class ContentHashTests {

        @Test
        @DisplayName("Should hash logically equal content identically regardless of key order")
        void testKeyOrderIndependent() {
            JsonNode first = TestReports.json("{\"a\": 1, \"b\": {\"x\": \"y\", \"z\": [1, 2]}}");
            JsonNode second = TestReports.json("{\"b\": {\"z\": [1, 2], \"x\": \"y\"}, \"a\": 1}");

            Node one = Node.of("n1", NodeType.INSIGHT, first, METADATA);
            Node two = Node.of("n1", NodeType.INSIGHT, second, METADATA);

            assertEquals(one.contentHash(), two.contentHash());
        }

        @Test
        @DisplayName("Should produce a different hash when content changes")
        void testContentChangeChangesHash() {
            Node one = TestReports.node("n1", NodeType.INSIGHT, "Stable wording.");
            Node two = TestReports.node("n1", NodeType.INSIGHT, "Revised wording.");

            assertNotEquals(one.contentHash(), two.contentHash());
        }

        @Test
        @DisplayName("Should not be affected by later mutation of the source content")
        void testDefensiveCopy() {
            ObjectNode source = TestReports.text("Original");
            Node node = Node.of("n1", NodeType.INSIGHT, source, METADATA);
            String hash = node.contentHash();

            source.put("text", "Mutated");

            assertEquals("Original", node.content().get("text").asText());
            assertEquals(hash, ContentHasher.hash(node.content()));
        }

        @Test
        @DisplayName("Should keep the hash when only metadata changes")
        void testWithMetadataKeepsHash() {
            Node node = TestReports.node("n1", NodeType.INSIGHT, "Text");
            Node updated = node.withMetadata(new NodeMetadata("other", Set.of("x"), 9, 2, "other"));

            assertEquals(node.contentHash(), updated.contentHash());
            assertTrue(updated.dependsOn("x"));
        }
    }

    @Nested
    @DisplayName("Validation")
    class ValidationTests {

        @Test
        @DisplayName("Should reject blank id")
        void testBlankId() {
            assertThrows(IllegalArgumentException.class,
                    () -> Node.of(" ", NodeType.INSIGHT, TestReports.text("x"), METADATA));
        }

        @Test
        @DisplayName("Should reject importance outside 1-10")
        void testImportanceRange() {
            assertThrows(IllegalArgumentException.class,
                    () -> new NodeMetadata("ctx", Set.of(), 0, 5, "src"));
            assertThrows(IllegalArgumentException.class,
                    () -> new NodeMetadata("ctx", Set.of(), 5, 11, "src"));
        }

        @Test
        @DisplayName("Should treat null dependencies as empty")
        void testNullDependencies() {
            NodeMetadata metadata = new NodeMetadata("ctx", null, 5, 5, "src");
            assertTrue(metadata.dependencies().isEmpty());
        }
    }

    @Test
    @DisplayName("Should flatten textual and numeric values in document order")
    void testText() {
        Node node = Node.of("n1", NodeType.SCORING,
                TestReports.json("{\"trait\": \"openness\", \"score\": 72, \"notes\": [\"high\", \"\"]}"),
                METADATA);

        assertEquals("openness 72 high", node.text());
    }
}
