package com.document.merge.path;

import com.document.merge.core.model.Document;
import com.document.merge.core.model.Node;

import java.util.Optional;

/**
 * Cache of resolved absolute paths, keyed by document and node identity.
 * Entries of a document must be invalidated whenever its structure or any
 * local name in it changes.
 */
public interface PathCache {

    Optional<String> get(Document document, Node node);

    void put(Document document, Node node, String path);

    /**
     * Drops every cached path of the document.
     */
    void invalidate(Document document);

    void invalidateAll();

    CacheStats getStats();
}
