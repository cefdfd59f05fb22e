package com.document.merge.core.model;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.IdentityHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * An in-memory configuration document: a root node plus a parent index.
 *
 * <p>The parent index is built once when a parsed tree is wrapped
 * ({@link #of(String, Node)}) and afterwards only changes through
 * {@link #link(Node, Node, int)} and {@link #unlink(Node)}, which are driven by
 * the structure primitives. Nodes added with raw {@link Node#addChild(Node)}
 * after wrapping are not indexed.</p>
 *
 * <p>Not thread-safe. A document must be exclusively owned for the duration
 * of any merge call that touches it.</p>
 */
public class Document {
    private final String name;
    private final Node root;
    private final Map<Node, Node> parentIndex = new IdentityHashMap<>();

    private Document(String name, Node root) {
        this.name = Objects.requireNonNull(name, "name is required");
        this.root = Objects.requireNonNull(root, "root is required");
    }

    /**
     * Wraps a fully materialized tree and indexes every node in it.
     *
     * @param name document name used in logs and failure reports
     * @param root the root node of the parsed tree
     */
    public static Document of(String name, Node root) {
        Document document = new Document(name, root);
        document.indexSubtree(root);
        return document;
    }

    public String getName() {
        return name;
    }

    public Node getRoot() {
        return root;
    }

    public boolean isRoot(Node node) {
        return node == root;
    }

    public Optional<Node> parentOf(Node node) {
        return Optional.ofNullable(parentIndex.get(node));
    }

    /**
     * Whether the node is the root or has a parent entry in this document.
     */
    public boolean contains(Node node) {
        return node == root || parentIndex.containsKey(node);
    }

    public int indexedNodeCount() {
        return parentIndex.size();
    }

    /**
     * Inserts a child under a parent of this document and indexes the child's subtree.
     * If the child already has a parent in this document it is moved; a move within
     * the same parent lands at {@code index} of the original sibling order.
     *
     * @param index insert position, or a negative value to append
     */
    public void link(Node parent, Node child, int index) {
        Objects.requireNonNull(parent, "parent is required");
        Objects.requireNonNull(child, "child is required");
        if (!contains(parent)) {
            throw new IllegalArgumentException("Parent " + parent + " is not part of document " + name);
        }
        if (child == root) {
            throw new IllegalArgumentException("Cannot attach the root of document " + name);
        }
        for (Node ancestor = parent; ancestor != null; ancestor = parentIndex.get(ancestor)) {
            if (ancestor == child) {
                throw new IllegalArgumentException("Cannot attach " + child + " under itself or its own descendant "
                        + parent + " in document " + name);
            }
        }
        Node previous = parentIndex.get(child);
        if (previous != null) {
            int oldIndex = previous.indexOf(child);
            previous.removeChild(child);
            if (previous == parent && oldIndex >= 0 && oldIndex < index) {
                index--;
            }
        }
        if (index < 0 || index > parent.childCount()) {
            parent.insertChild(parent.childCount(), child);
        } else {
            parent.insertChild(index, child);
        }
        parentIndex.put(child, parent);
        indexSubtree(child);
    }

    /**
     * Removes a node from its parent and drops it and its subtree from the index.
     *
     * @return true if the node was attached in this document
     */
    public boolean unlink(Node node) {
        Node parent = parentIndex.remove(node);
        if (parent == null) {
            return false;
        }
        parent.removeChild(node);
        Deque<Node> stack = new ArrayDeque<>(node.getChildren());
        while (!stack.isEmpty()) {
            Node current = stack.pop();
            parentIndex.remove(current);
            stack.addAll(current.getChildren());
        }
        return true;
    }

    private void indexSubtree(Node top) {
        Deque<Node> stack = new ArrayDeque<>();
        stack.push(top);
        while (!stack.isEmpty()) {
            Node current = stack.pop();
            for (Node child : current.getChildren()) {
                parentIndex.put(child, current);
                stack.push(child);
            }
        }
    }

    @Override
    public String toString() {
        return "Document{" +
                "name='" + name + '\'' +
                ", root=" + root.getTag() +
                ", indexed=" + parentIndex.size() +
                '}';
    }
}
