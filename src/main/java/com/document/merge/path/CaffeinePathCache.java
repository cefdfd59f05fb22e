package com.document.merge.path;

import com.document.merge.core.model.Document;
import com.document.merge.core.model.Node;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Caffeine-backed path cache with a per-document key index for targeted invalidation.
 */
public class CaffeinePathCache implements PathCache {
    private static final Logger log = LoggerFactory.getLogger(CaffeinePathCache.class);

    private final Cache<CacheKey, String> cache;
    // Secondary index: document -> keys of that document
    private final Map<Document, Set<CacheKey>> documentIndex = new ConcurrentHashMap<>();
    private final AtomicLong invalidations = new AtomicLong();

    public CaffeinePathCache(CacheConfig config) {
        this.cache = Caffeine.newBuilder()
                .maximumSize(config.maxSize())
                .recordStats()
                .removalListener((key, value, cause) -> {
                    if (key instanceof CacheKey ck && cause.wasEvicted()) {
                        // drop the document once its last entry is gone
                        documentIndex.computeIfPresent(ck.document(), (doc, keys) -> {
                            keys.remove(ck);
                            return keys.isEmpty() ? null : keys;
                        });
                    }
                })
                .build();
        log.info("CaffeinePathCache initialized: maxSize={}", config.maxSize());
    }

    @Override
    public Optional<String> get(Document document, Node node) {
        return Optional.ofNullable(cache.getIfPresent(new CacheKey(document, node)));
    }

    @Override
    public void put(Document document, Node node, String path) {
        CacheKey key = new CacheKey(document, node);
        cache.put(key, path);
        documentIndex.computeIfAbsent(document, d -> ConcurrentHashMap.newKeySet()).add(key);
    }

    @Override
    public void invalidate(Document document) {
        Set<CacheKey> keys = documentIndex.remove(document);
        if (keys != null) {
            invalidations.incrementAndGet();
            cache.invalidateAll(keys);
            log.debug("Invalidated {} cached paths for document {}", keys.size(), document.getName());
        }
    }

    @Override
    public void invalidateAll() {
        cache.invalidateAll();
        documentIndex.clear();
        log.debug("Invalidated all cached paths");
    }

    @Override
    public CacheStats getStats() {
        com.github.benmanes.caffeine.cache.stats.CacheStats caffeineStats = cache.stats();
        return new CacheStats(
                caffeineStats.hitCount(),
                caffeineStats.missCount(),
                caffeineStats.evictionCount(),
                cache.estimatedSize(),
                invalidations.get(),
                documentIndex.size()
        );
    }

    /**
     * Document and node both compare by identity.
     */
    record CacheKey(Document document, Node node) {}
}
