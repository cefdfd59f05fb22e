package com.document.merge.path;

import com.document.merge.core.model.Document;
import com.document.merge.core.model.Node;

import java.util.ArrayDeque;
import java.util.Arrays;
import java.util.Deque;
import java.util.List;
import java.util.Optional;

/**
 * Resolves an absolute path back to the node it names.
 *
 * <p>Each path segment is looked up among the named nodes reachable from the
 * current node through anonymous containers only, breadth first.</p>
 */
public final class PathLookup {

    private PathLookup() {
        // utility class
    }

    public static Optional<Node> findByPath(Document doc, String path) {
        if (path == null || !path.startsWith("/")) {
            return Optional.empty();
        }
        List<String> segments = Arrays.stream(path.substring(1).split("/"))
                .filter(s -> !s.isEmpty())
                .toList();

        Node current = doc.getRoot();
        int start = 0;
        if (current.isNamed() && !segments.isEmpty()
                && current.localName().get().equals(segments.get(0))) {
            start = 1;
        }
        for (int i = start; i < segments.size(); i++) {
            Optional<Node> next = findNamed(current, segments.get(i));
            if (next.isEmpty()) {
                return Optional.empty();
            }
            current = next.get();
        }
        return Optional.of(current);
    }

    /**
     * Same as {@link #findByPath(Document, String)} but fails on a miss.
     */
    public static Node requireByPath(Document doc, String path) {
        return findByPath(doc, path)
                .orElseThrow(() -> new PathResolutionException(
                        "Could not traverse path " + path + " in " + doc.getName()));
    }

    private static Optional<Node> findNamed(Node parent, String name) {
        Deque<Node> queue = new ArrayDeque<>(parent.getChildren());
        while (!queue.isEmpty()) {
            Node candidate = queue.poll();
            Optional<String> localName = candidate.localName();
            if (localName.isPresent()) {
                if (localName.get().equals(name)) {
                    return Optional.of(candidate);
                }
            } else {
                queue.addAll(candidate.getChildren());
            }
        }
        return Optional.empty();
    }
}
