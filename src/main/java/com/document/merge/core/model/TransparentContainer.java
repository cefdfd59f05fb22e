package com.document.merge.core.model;

import java.util.Arrays;
import java.util.Optional;

/**
 * Tags of pseudo-containers that are spliced rather than nested on attach:
 * attaching one of these attaches its children directly to the target parent.
 * Adding a transparent tag means adding a constant here.
 */
public enum TransparentContainer {
    ELEMENTS("ELEMENTS"),
    SOCKET_ADDRESSES("SOCKET-ADDRESSS"),
    DATA_TRANSFORMATIONS("DATA-TRANSFORMATIONS"),
    TRANSFORMATION_TECHNOLOGIES("TRANSFORMATION-TECHNOLOGYS"),
    CONNECTION_BUNDLES("CONNECTION-BUNDLES");

    private final String tag;

    TransparentContainer(String tag) {
        this.tag = tag;
    }

    public String tag() {
        return tag;
    }

    public static Optional<TransparentContainer> fromTag(String tag) {
        return Arrays.stream(values())
                .filter(c -> c.tag.equals(tag))
                .findFirst();
    }

    public static boolean isTransparent(Node node) {
        return node != null && fromTag(node.getTag()).isPresent();
    }
}
