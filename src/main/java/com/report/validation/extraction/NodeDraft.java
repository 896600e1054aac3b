package com.report.validation.extraction;

import com.report.validation.core.model.NodeType;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * A node as found in a region, before metadata annotation.
 */
public record NodeDraft(String id, NodeType type, JsonNode content) {
}
