package com.document.merge.core.model;

import java.util.function.Function;

/**
 * Key functions used to match source nodes against destination children.
 * A key function returns {@code null} for nodes that have no key.
 */
public final class NodeKeys {

    private NodeKeys() {
        // utility class
    }

    /**
     * Matches by local name (the default).
     */
    public static Function<Node, String> localName() {
        return node -> node.localName().orElse(null);
    }

    /**
     * Matches by the text of the first child with the given tag,
     * e.g. {@code HEADER-ID} or {@code PORT-NUMBER}.
     */
    public static Function<Node, String> childText(String tag) {
        return node -> node.childText(tag).orElse(null);
    }

    public static Function<Node, String> attribute(String name) {
        return node -> node.getAttribute(name);
    }
}
