package com.report.validation.core.model;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * A discrete, independently validatable unit of a report.
 * Immutable within an iteration; cache identity is {@code (id, contentHash)}.
 */
public record Node(
        String id,
        NodeType type,
        JsonNode content,
        NodeMetadata metadata,
        String contentHash
) {
    public Node {
        Objects.requireNonNull(id, "id is required");
        Objects.requireNonNull(type, "type is required");
        Objects.requireNonNull(content, "content is required");
        Objects.requireNonNull(metadata, "metadata is required");
        if (id.isBlank()) {
            throw new IllegalArgumentException("id must not be blank");
        }
        content = content.deepCopy();
        if (contentHash == null) {
            contentHash = ContentHasher.hash(content);
        }
    }

    public static Node of(String id, NodeType type, JsonNode content, NodeMetadata metadata) {
        return new Node(id, type, content, metadata, null);
    }

    public int importance() {
        return metadata.importance();
    }

    public boolean dependsOn(String nodeId) {
        return metadata.dependencies().contains(nodeId);
    }

    public Node withMetadata(NodeMetadata newMetadata) {
        return new Node(id, type, content, newMetadata, contentHash);
    }

    /**
     * Flattens every textual and numeric value of the content into one string,
     * in document order. Used for pattern checks and judge prompts.
     */
    public String text() {
        List<String> parts = new ArrayList<>();
        collectText(content, parts);
        return String.join(" ", parts);
    }

    private static void collectText(JsonNode value, List<String> parts) {
        if (value == null || value.isNull() || value.isMissingNode()) {
            return;
        }
        if (value.isValueNode()) {
            String text = value.asText();
            if (!text.isBlank()) {
                parts.add(text);
            }
            return;
        }
        value.forEach(child -> collectText(child, parts));
    }
}
