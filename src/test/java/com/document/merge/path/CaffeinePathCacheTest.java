package com.document.merge.path;

import com.document.merge.core.model.Document;
import com.document.merge.core.model.Node;
import com.document.merge.structure.StructureEnforcer;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static com.document.merge.support.TestDocuments.*;
import static org.junit.jupiter.api.Assertions.*;

@DisplayName("CaffeinePathCache Tests")
class CaffeinePathCacheTest {

    @Test
    @DisplayName("Second resolution is served from the cache")
    void cachesResolvedPaths() {
        CaffeinePathCache cache = new CaffeinePathCache(CacheConfig.defaults());
        PathResolver resolver = new PathResolver(cache);
        Node pdu = element("I-SIGNAL-I-PDU", "Pdu");
        Document doc = document("Com.arxml", pkg("Communication", pdu));

        resolver.absolutePath(pdu, doc);
        resolver.absolutePath(pdu, doc);

        CacheStats stats = resolver.getCacheStats();
        assertEquals(1, stats.hitCount());
        assertEquals(1, stats.missCount());
        assertEquals(0.5, stats.hitRate(), 0.0001);
    }

    @Test
    @DisplayName("Structural changes drop cached paths of the changed document only")
    void invalidatesPerDocument() {
        CaffeinePathCache cache = new CaffeinePathCache(CacheConfig.defaults());
        PathResolver resolver = new PathResolver(cache);
        StructureEnforcer enforcer = new StructureEnforcer(resolver);

        Node signal = element("I-SIGNAL", "Speed");
        Node oldHome = element("I-SIGNAL-I-PDU", "Old", signal);
        Node newHome = element("I-SIGNAL-I-PDU", "New");
        Document doc = document("Com.arxml", pkg("Communication", oldHome, newHome));
        Node other = element("I-SIGNAL", "Other");
        Document otherDoc = document("Other.arxml", pkg("Pkg", other));

        assertEquals("/Communication/Old/Speed", resolver.absolutePath(signal, doc));
        resolver.absolutePath(other, otherDoc);

        enforcer.attach(newHome, signal, doc);

        assertTrue(cache.get(doc, signal).isEmpty());
        assertTrue(cache.get(otherDoc, other).isPresent());
        assertEquals("/Communication/New/Speed", resolver.absolutePath(signal, doc));
        assertEquals(1, cache.getStats().invalidations());
        assertEquals(2, cache.getStats().documents());
    }

    @Test
    @DisplayName("invalidateAll empties the cache")
    void invalidateAll() {
        CaffeinePathCache cache = new CaffeinePathCache(CacheConfig.defaults());
        Document doc = document("d");
        cache.put(doc, doc.getRoot(), "/");

        cache.invalidateAll();

        assertTrue(cache.get(doc, doc.getRoot()).isEmpty());
    }

    @Test
    @DisplayName("NoOpPathCache never returns anything")
    void noOpCache() {
        NoOpPathCache cache = new NoOpPathCache();
        Document doc = document("d");
        cache.put(doc, doc.getRoot(), "/");
        assertTrue(cache.get(doc, doc.getRoot()).isEmpty());
        assertEquals(CacheStats.empty(), cache.getStats());
    }
}
