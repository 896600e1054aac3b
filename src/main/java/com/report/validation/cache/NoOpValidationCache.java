package com.report.validation.cache;

import com.report.validation.core.model.ValidationResult;

import java.util.Optional;

/**
 * Cache that stores nothing. Every lookup misses.
 */
public class NoOpValidationCache implements ValidationCache {

    @Override
    public Optional<ValidationResult> get(CacheKey key) {
        return Optional.empty();
    }

    @Override
    public void put(CacheKey key, ValidationResult result) {
    }

    @Override
    public void invalidateNode(String nodeId) {
    }

    @Override
    public void invalidateAll() {
    }

    @Override
    public CacheStats getStats() {
        return CacheStats.empty();
    }
}
