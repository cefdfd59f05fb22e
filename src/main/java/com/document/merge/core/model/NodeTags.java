package com.document.merge.core.model;

/**
 * Well-known tags and attributes of the network description format.
 */
public final class NodeTags {

    /** Tag of the child that carries a node's local name. */
    public static final String NAME = "SHORT-NAME";

    /** Attribute holding a node's document-wide unique identity. */
    public static final String IDENTITY_ATTRIBUTE = "UUID";

    public static final String PACKAGE = "AR-PACKAGE";
    public static final String PACKAGES = "AR-PACKAGES";
    public static final String ELEMENTS = "ELEMENTS";

    /** Suffixes of tags whose text is an absolute path to another node. */
    public static final String REFERENCE_SUFFIX = "-REF";
    public static final String TYPE_REFERENCE_SUFFIX = "-TREF";

    private NodeTags() {
        // constants
    }

    /**
     * Returns whether the tag names a reference field.
     */
    public static boolean isReferenceTag(String tag) {
        return tag != null && (tag.endsWith(REFERENCE_SUFFIX) || tag.endsWith(TYPE_REFERENCE_SUFFIX));
    }
}
