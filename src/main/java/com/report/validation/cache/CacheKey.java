package com.report.validation.cache;

import com.report.validation.core.model.Node;

import java.util.Objects;

/**
 * Identity of a cached validation result.
 */
public record CacheKey(String nodeId, String contentHash, String judgeVersion) {

    public CacheKey {
        Objects.requireNonNull(nodeId, "nodeId is required");
        Objects.requireNonNull(contentHash, "contentHash is required");
        Objects.requireNonNull(judgeVersion, "judgeVersion is required");
    }

    public static CacheKey of(Node node, String judgeVersion) {
        return new CacheKey(node.id(), node.contentHash(), judgeVersion);
    }
}
