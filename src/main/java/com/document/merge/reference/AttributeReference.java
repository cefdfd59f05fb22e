package com.document.merge.reference;

import com.document.merge.core.model.Node;

import java.util.Objects;

/**
 * Reference held in a path-valued attribute of a node.
 */
public final class AttributeReference implements ReferenceField {
    private final Node node;
    private final String attribute;

    public AttributeReference(Node node, String attribute) {
        this.node = Objects.requireNonNull(node, "node is required");
        this.attribute = Objects.requireNonNull(attribute, "attribute is required");
    }

    public Node getNode() {
        return node;
    }

    public String getAttribute() {
        return attribute;
    }

    @Override
    public String getPath() {
        return node.getAttribute(attribute);
    }

    @Override
    public void setPath(String path) {
        node.setAttribute(attribute, path);
    }

    @Override
    public String describe() {
        return node.getTag() + "@" + attribute + "=" + getPath();
    }

    @Override
    public String toString() {
        return "AttributeReference{" + describe() + '}';
    }
}
