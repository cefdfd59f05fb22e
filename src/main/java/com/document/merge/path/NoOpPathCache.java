package com.document.merge.path;

import com.document.merge.core.model.Document;
import com.document.merge.core.model.Node;

import java.util.Optional;

/**
 * Cache that never holds anything. The default.
 */
public class NoOpPathCache implements PathCache {

    @Override
    public Optional<String> get(Document document, Node node) {
        return Optional.empty();
    }

    @Override
    public void put(Document document, Node node, String path) {
        // no-op
    }

    @Override
    public void invalidate(Document document) {
        // no-op
    }

    @Override
    public void invalidateAll() {
        // no-op
    }

    @Override
    public CacheStats getStats() {
        return CacheStats.empty();
    }
}
