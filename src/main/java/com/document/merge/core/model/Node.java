package com.document.merge.core.model;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Predicate;

/**
 * A tagged tree element with optional text, an ordered attribute map and an
 * ordered child list.
 *
 * <p>Nodes carry no parent pointer. Parent links live in the
 * {@link Document} parent index, which is maintained by the structure
 * primitives. {@link #addChild(Node)} is meant for building a tree before it
 * is wrapped by {@link Document#of(String, Node)}; once wrapped, attach nodes
 * through {@code StructureEnforcer} so the index stays consistent.</p>
 *
 * <p>Equality is identity: two structurally equal nodes are still two
 * distinct tree positions.</p>
 */
public class Node {
    private final String tag;
    private String text;
    private final Map<String, String> attributes = new LinkedHashMap<>();
    private final List<Node> children = new ArrayList<>();

    public Node(String tag) {
        if (tag == null || tag.isBlank()) {
            throw new IllegalArgumentException("Node tag must not be null or blank");
        }
        this.tag = tag;
    }

    public static Node of(String tag) {
        return new Node(tag);
    }

    /**
     * Creates a leaf node holding text, e.g. a name holder or a reference field.
     */
    public static Node leaf(String tag, String text) {
        Node node = new Node(tag);
        node.text = text;
        return node;
    }

    /**
     * Creates a node whose first child is a name holder with the given name.
     */
    public static Node named(String tag, String name) {
        return new Node(tag).addChild(leaf(NodeTags.NAME, name));
    }

    public String getTag() {
        return tag;
    }

    public String getText() {
        return text;
    }

    public void setText(String text) {
        this.text = text;
    }

    public boolean hasTag(String candidate) {
        return tag.equals(candidate);
    }

    // Attributes

    public String getAttribute(String name) {
        return attributes.get(name);
    }

    public boolean hasAttribute(String name) {
        return attributes.containsKey(name);
    }

    public Node setAttribute(String name, String value) {
        Objects.requireNonNull(name, "attribute name is required");
        attributes.put(name, value);
        return this;
    }

    public String removeAttribute(String name) {
        return attributes.remove(name);
    }

    public Map<String, String> getAttributes() {
        return Collections.unmodifiableMap(attributes);
    }

    // Children

    public List<Node> getChildren() {
        return Collections.unmodifiableList(children);
    }

    public int childCount() {
        return children.size();
    }

    /**
     * Appends a child while building a tree. Not tracked by any parent index.
     */
    public Node addChild(Node child) {
        Objects.requireNonNull(child, "child is required");
        children.add(child);
        return this;
    }

    /**
     * Returns the position of the given child (by identity), or -1.
     */
    public int indexOf(Node child) {
        for (int i = 0; i < children.size(); i++) {
            if (children.get(i) == child) {
                return i;
            }
        }
        return -1;
    }

    void insertChild(int index, Node child) {
        children.add(index, child);
    }

    boolean removeChild(Node child) {
        int index = indexOf(child);
        if (index < 0) {
            return false;
        }
        children.remove(index);
        return true;
    }

    // Naming

    /**
     * Local name: the text of the first child tagged as name holder.
     */
    public Optional<String> localName() {
        for (Node child : children) {
            if (child.hasTag(NodeTags.NAME)) {
                return Optional.ofNullable(child.text);
            }
        }
        return Optional.empty();
    }

    public boolean isNamed() {
        return localName().isPresent();
    }

    /**
     * Replaces the local name. Fails if the node is anonymous.
     */
    public void rename(String newName) {
        Node holder = findChild(NodeTags.NAME)
                .orElseThrow(() -> new IllegalStateException("Node " + tag + " has no " + NodeTags.NAME));
        holder.text = newName;
    }

    // Queries

    public Optional<Node> findChild(String childTag) {
        for (Node child : children) {
            if (child.hasTag(childTag)) {
                return Optional.of(child);
            }
        }
        return Optional.empty();
    }

    public List<Node> findChildren(String childTag) {
        List<Node> result = new ArrayList<>();
        for (Node child : children) {
            if (child.hasTag(childTag)) {
                result.add(child);
            }
        }
        return result;
    }

    public Optional<String> childText(String childTag) {
        return findChild(childTag).map(Node::getText);
    }

    /**
     * All descendants (excluding this node) in document order that match the predicate.
     */
    public List<Node> findDescendants(Predicate<Node> predicate) {
        List<Node> result = new ArrayList<>();
        Deque<Node> stack = new ArrayDeque<>();
        for (int i = children.size() - 1; i >= 0; i--) {
            stack.push(children.get(i));
        }
        while (!stack.isEmpty()) {
            Node current = stack.pop();
            if (predicate.test(current)) {
                result.add(current);
            }
            List<Node> next = current.children;
            for (int i = next.size() - 1; i >= 0; i--) {
                stack.push(next.get(i));
            }
        }
        return result;
    }

    public List<Node> findDescendants(String descendantTag) {
        return findDescendants(n -> n.hasTag(descendantTag));
    }

    public Optional<Node> findDescendant(String descendantTag) {
        List<Node> all = findDescendants(descendantTag);
        return all.isEmpty() ? Optional.empty() : Optional.of(all.get(0));
    }

    /**
     * First descendant with the given tag and local name.
     */
    public Optional<Node> findNamedDescendant(String descendantTag, String name) {
        return findDescendants(n -> n.hasTag(descendantTag) && n.localName().filter(name::equals).isPresent())
                .stream()
                .findFirst();
    }

    /**
     * Detached structural copy of this subtree.
     */
    public Node deepCopy() {
        Node copy = new Node(tag);
        copy.text = text;
        copy.attributes.putAll(attributes);
        for (Node child : children) {
            copy.children.add(child.deepCopy());
        }
        return copy;
    }

    @Override
    public String toString() {
        return "Node{" +
                "tag='" + tag + '\'' +
                localName().map(n -> ", name='" + n + '\'').orElse("") +
                (text != null ? ", text='" + text + '\'' : "") +
                ", children=" + children.size() +
                '}';
    }
}
