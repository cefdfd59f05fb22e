package com.document.merge.path;

import com.document.merge.core.model.Document;
import com.document.merge.core.model.Node;
import com.document.merge.merge.MergeListener;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Objects;
import java.util.Optional;

/**
 * Computes absolute paths by walking a document's parent index from a node up
 * to the root, collecting the local names of named nodes on the way.
 *
 * <p>Anonymous nodes (transparent containers, wrappers such as
 * {@code AR-PACKAGES}) contribute no segment. An anonymous node therefore
 * resolves to the path of its nearest named ancestor, which does not identify
 * it; use {@link #referencePath(Node, Document)} when the path is meant to be
 * written into a reference field.</p>
 */
public class PathResolver implements MergeListener {

    private final PathCache cache;

    public PathResolver() {
        this(new NoOpPathCache());
    }

    public PathResolver(PathCache cache) {
        this.cache = Objects.requireNonNull(cache, "cache is required");
    }

    /**
     * Returns the absolute path of the node in the document.
     *
     * @throws PathResolutionException if the node or an ancestor has no parent entry
     */
    public String absolutePath(Node node, Document doc) {
        Objects.requireNonNull(node, "node is required");
        Objects.requireNonNull(doc, "document is required");

        Optional<String> cached = cache.get(doc, node);
        if (cached.isPresent()) {
            return cached.get();
        }

        Deque<String> segments = new ArrayDeque<>();
        Node current = node;
        while (true) {
            current.localName().ifPresent(segments::addFirst);
            if (doc.isRoot(current)) {
                break;
            }
            Node parent = doc.parentOf(current).orElse(null);
            if (parent == null) {
                throw new PathResolutionException("The absolute path of " + node + " can't be found in "
                        + doc.getName() + ": " + current + " has no parent entry");
            }
            current = parent;
        }

        String path = "/" + String.join("/", segments);
        cache.put(doc, node, path);
        return path;
    }

    /**
     * Path usable as a reference target: empty for anonymous nodes.
     */
    public Optional<String> referencePath(Node node, Document doc) {
        if (!node.isNamed()) {
            return Optional.empty();
        }
        return Optional.of(absolutePath(node, doc));
    }

    /**
     * Last segment of an absolute path, including the leading slash.
     */
    public static String trailingSegment(String path) {
        return path.substring(path.lastIndexOf('/'));
    }

    /**
     * Path with its last segment removed; "/" for top-level paths.
     */
    public static String parentPath(String path) {
        int cut = path.lastIndexOf('/');
        return cut <= 0 ? "/" : path.substring(0, cut);
    }

    @Override
    public void onStructureChanged(Document document) {
        cache.invalidate(document);
    }

    public CacheStats getCacheStats() {
        return cache.getStats();
    }
}
