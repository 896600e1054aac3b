package com.report.validation.cache;

import com.report.validation.core.model.ValidationResult;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.RemovalCause;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.Executor;
import java.util.concurrent.ForkJoinPool;

/**
 * Caffeine-backed validation cache with a node id index for per-node invalidation.
 */
public class CaffeineValidationCache implements ValidationCache {
    private static final Logger log = LoggerFactory.getLogger(CaffeineValidationCache.class);

    private final Cache<CacheKey, ValidationResult> cache;
    private final ConcurrentMap<String, Set<CacheKey>> nodeIndex = new ConcurrentHashMap<>();

    public CaffeineValidationCache(CacheConfig config) {
        this(config, ForkJoinPool.commonPool());
    }

    CaffeineValidationCache(CacheConfig config, Executor maintenanceExecutor) {
        this.cache = Caffeine.newBuilder()
                .executor(maintenanceExecutor)
                .maximumSize(config.maxSize())
                .expireAfterWrite(config.ttl())
                .recordStats()
                .removalListener((CacheKey key, ValidationResult value, RemovalCause cause) -> {
                    if (key != null && cause.wasEvicted()) {
                        unindex(key);
                    }
                })
                .build();
        log.info("CaffeineValidationCache initialized: maxSize={}, ttl={}", config.maxSize(), config.ttl());
    }

    @Override
    public Optional<ValidationResult> get(CacheKey key) {
        return Optional.ofNullable(cache.getIfPresent(key));
    }

    @Override
    public void put(CacheKey key, ValidationResult result) {
        // indexed first so an eviction of this very entry can unindex it
        nodeIndex.compute(key.nodeId(), (nodeId, keys) -> {
            Set<CacheKey> indexed = keys != null ? keys : ConcurrentHashMap.newKeySet();
            indexed.add(key);
            return indexed;
        });
        cache.put(key, result);
    }

    @Override
    public void invalidateNode(String nodeId) {
        Set<CacheKey> keys = nodeIndex.remove(nodeId);
        if (keys != null) {
            cache.invalidateAll(keys);
            log.debug("Invalidated {} cached result(s) for node {}", keys.size(), nodeId);
        }
    }

    @Override
    public void invalidateAll() {
        cache.invalidateAll();
        nodeIndex.clear();
        log.debug("Invalidated all cached validation results");
    }

    @Override
    public CacheStats getStats() {
        com.github.benmanes.caffeine.cache.stats.CacheStats stats = cache.stats();
        return new CacheStats(stats.hitCount(), stats.missCount(), stats.evictionCount(), cache.estimatedSize());
    }

    int indexedNodeCount() {
        return nodeIndex.size();
    }

    void cleanUp() {
        cache.cleanUp();
    }

    private void unindex(CacheKey key) {
        nodeIndex.computeIfPresent(key.nodeId(), (nodeId, keys) -> {
            keys.remove(key);
            return keys.isEmpty() ? null : keys;
        });
    }
}
