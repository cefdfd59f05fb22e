package com.document.merge.reference;

import com.document.merge.core.model.Node;

import java.util.Objects;

/**
 * Reference held in the text of a leaf node, e.g. {@code <PDU-REF DEST="I-PDU">/Com/Pdu/P1</PDU-REF>}.
 */
public final class NodeReference implements ReferenceField {
    private final Node node;

    public NodeReference(Node node) {
        this.node = Objects.requireNonNull(node, "node is required");
    }

    public static NodeReference of(Node node) {
        return new NodeReference(node);
    }

    public Node getNode() {
        return node;
    }

    @Override
    public String getPath() {
        return node.getText();
    }

    @Override
    public void setPath(String path) {
        node.setText(path);
    }

    @Override
    public String describe() {
        return node.getTag() + "=" + node.getText();
    }

    @Override
    public String toString() {
        return "NodeReference{" + describe() + '}';
    }
}
