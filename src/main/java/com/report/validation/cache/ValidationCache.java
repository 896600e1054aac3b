package com.report.validation.cache;

import com.report.validation.core.model.ValidationResult;

import java.util.Optional;

/**
 * Memoizes node validation results by {@code (nodeId, contentHash, judgeVersion)}.
 *
 * <p>Shared read-mostly across workflows. Writes are idempotent for a given key, so
 * concurrent writers racing on one key are harmless.</p>
 */
public interface ValidationCache {

    Optional<ValidationResult> get(CacheKey key);

    void put(CacheKey key, ValidationResult result);

    /**
     * Drops every cached result of the node, across content hashes and judge versions.
     */
    void invalidateNode(String nodeId);

    void invalidateAll();

    CacheStats getStats();
}
