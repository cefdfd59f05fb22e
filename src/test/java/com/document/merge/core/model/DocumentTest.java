package com.document.merge.core.model;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class DocumentTest {

    @Test
    void of_indexesWholeTree() {
        Node leaf = Node.leaf("LENGTH", "8");
        Node signal = Node.named("I-SIGNAL", "Speed").addChild(leaf);
        Node root = Node.of("AUTOSAR").addChild(signal);

        Document doc = Document.of("Com.arxml", root);

        assertSame(root, doc.parentOf(signal).orElseThrow());
        assertSame(signal, doc.parentOf(leaf).orElseThrow());
        assertTrue(doc.parentOf(root).isEmpty());
        assertTrue(doc.contains(root));
        assertEquals(3, doc.indexedNodeCount());
    }

    @Test
    void link_movesNodeAlreadyInDocument() {
        Node from = Node.named("PKG", "From");
        Node to = Node.named("PKG", "To");
        Node moved = Node.named("I-SIGNAL", "Speed");
        from.addChild(moved);
        Document doc = Document.of("d", Node.of("AUTOSAR").addChild(from).addChild(to));

        doc.link(to, moved, -1);

        assertEquals(-1, from.indexOf(moved));
        assertEquals(1, to.indexOf(moved));
        assertSame(to, doc.parentOf(moved).orElseThrow());
    }

    @Test
    void link_outOfRangeIndexAppends() {
        Node parent = Node.of("P").addChild(Node.leaf("A", "a"));
        Document doc = Document.of("d", parent);
        Node child = Node.leaf("B", "b");

        doc.link(parent, child, 42);

        assertEquals(1, parent.indexOf(child));
    }

    @Test
    void link_rejectsParentOutsideDocument() {
        Document doc = Document.of("d", Node.of("AUTOSAR"));
        assertThrows(IllegalArgumentException.class, () -> doc.link(Node.of("X"), Node.of("Y"), -1));
    }

    @Test
    void link_rejectsRoot() {
        Node root = Node.of("AUTOSAR");
        Document doc = Document.of("d", root);
        assertThrows(IllegalArgumentException.class, () -> doc.link(root, root, -1));
    }

    @Test
    void link_rejectsAttachUnderOwnDescendant() {
        Node inner = Node.named("PKG", "Inner");
        Node outer = Node.named("PKG", "Outer").addChild(inner);
        Node root = Node.of("AUTOSAR").addChild(outer);
        Document doc = Document.of("d", root);

        assertThrows(IllegalArgumentException.class, () -> doc.link(inner, outer, -1));

        assertSame(root, doc.parentOf(outer).orElseThrow());
        assertSame(outer, doc.parentOf(inner).orElseThrow());
        assertEquals(-1, inner.indexOf(outer));
    }

    @Test
    void link_rejectsAttachUnderItself() {
        Node signal = Node.named("I-SIGNAL", "Speed");
        Document doc = Document.of("d", Node.of("AUTOSAR").addChild(signal));

        assertThrows(IllegalArgumentException.class, () -> doc.link(signal, signal, 0));
    }

    @Test
    void link_moveToLaterSlotOfSameParent() {
        Node a = Node.leaf("A", "a");
        Node b = Node.leaf("B", "b");
        Node c = Node.leaf("C", "c");
        Node parent = Node.of("P").addChild(a).addChild(b).addChild(c);
        Document doc = Document.of("d", parent);

        doc.link(parent, a, 2);

        assertEquals(List.of(b, a, c), parent.getChildren());
        assertSame(parent, doc.parentOf(a).orElseThrow());
    }

    @Test
    void link_moveToEarlierSlotOfSameParent() {
        Node a = Node.leaf("A", "a");
        Node b = Node.leaf("B", "b");
        Node c = Node.leaf("C", "c");
        Node parent = Node.of("P").addChild(a).addChild(b).addChild(c);
        Document doc = Document.of("d", parent);

        doc.link(parent, c, 0);

        assertEquals(List.of(c, a, b), parent.getChildren());
    }

    @Test
    void unlink_dropsSubtreeFromIndex() {
        Node leaf = Node.leaf("LENGTH", "8");
        Node signal = Node.named("I-SIGNAL", "Speed").addChild(leaf);
        Node root = Node.of("AUTOSAR").addChild(signal);
        Document doc = Document.of("d", root);

        assertTrue(doc.unlink(signal));

        assertFalse(doc.contains(signal));
        assertFalse(doc.contains(leaf));
        assertEquals(0, root.childCount());
        assertFalse(doc.unlink(signal));
    }
}
