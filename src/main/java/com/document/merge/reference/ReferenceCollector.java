package com.document.merge.reference;

import com.document.merge.core.model.Node;
import com.document.merge.core.model.NodeTags;

import java.util.List;
import java.util.Set;

/**
 * Collects reference fields below a node, in document order.
 */
public final class ReferenceCollector {

    private ReferenceCollector() {
    }

    public static List<ReferenceField> byTag(Node scope, String referenceTag) {
        return scope.findDescendants(referenceTag).stream()
                .<ReferenceField>map(NodeReference::new)
                .toList();
    }

    public static List<ReferenceField> byTags(Node scope, Set<String> referenceTags) {
        return scope.findDescendants(n -> referenceTags.contains(n.getTag())).stream()
                .<ReferenceField>map(NodeReference::new)
                .toList();
    }

    /**
     * Every {@code *-REF} and {@code *-TREF} leaf below the scope.
     */
    public static List<ReferenceField> allReferences(Node scope) {
        return scope.findDescendants(n -> NodeTags.isReferenceTag(n.getTag()) && n.getText() != null).stream()
                .<ReferenceField>map(NodeReference::new)
                .toList();
    }

    public static List<ReferenceField> attributes(Node scope, String attribute) {
        return scope.findDescendants(n -> n.hasAttribute(attribute)).stream()
                .<ReferenceField>map(n -> new AttributeReference(n, attribute))
                .toList();
    }
}
