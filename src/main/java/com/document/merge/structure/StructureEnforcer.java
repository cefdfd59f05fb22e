package com.document.merge.structure;

import com.document.merge.audit.AuditAction;
import com.document.merge.audit.AuditService;
import com.document.merge.core.model.Document;
import com.document.merge.core.model.Node;
import com.document.merge.core.model.TransparentContainer;
import com.document.merge.merge.MergeListener;
import com.document.merge.metrics.MetricsService;
import com.document.merge.metrics.NoOpMetricsService;
import com.document.merge.path.PathResolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Supplier;

/**
 * The only sanctioned way to change the structure of an indexed document.
 *
 * <p>Every primitive keeps the document's parent index consistent and
 * notifies {@link MergeListener}s so cached paths are dropped.</p>
 *
 * <ul>
 *   <li>{@link #attach(Node, Node, Document)} appends a node, splicing the
 *       children of {@link TransparentContainer transparent containers}</li>
 *   <li>{@link #insertAt(Node, Node, int, Document)} inserts a single node at a position</li>
 *   <li>{@link #ensureContainers(Node, ContainerSchema, Document)} synthesizes
 *       missing containers at their schema position</li>
 * </ul>
 */
public class StructureEnforcer {
    private static final Logger log = LoggerFactory.getLogger(StructureEnforcer.class);

    private final PathResolver pathResolver;
    private final MetricsService metricsService;
    private final AuditService auditService;
    private final List<MergeListener> listeners = new CopyOnWriteArrayList<>();

    public StructureEnforcer(PathResolver pathResolver) {
        this(pathResolver, new NoOpMetricsService(), new AuditService());
    }

    public StructureEnforcer(PathResolver pathResolver, MetricsService metricsService, AuditService auditService) {
        this.pathResolver = Objects.requireNonNull(pathResolver, "pathResolver is required");
        this.metricsService = Objects.requireNonNull(metricsService, "metricsService is required");
        this.auditService = Objects.requireNonNull(auditService, "auditService is required");
        listeners.add(pathResolver);
    }

    /**
     * Appends a child under the parent. A transparent container is not
     * attached itself: each of its children is appended to the parent instead.
     *
     * @return the nodes that became children of the parent
     */
    public List<Node> attach(Node parent, Node child, Document doc) {
        Objects.requireNonNull(child, "child is required");
        List<Node> attached = new ArrayList<>();
        if (TransparentContainer.isTransparent(child)) {
            // copy first: linking moves nodes that already live in this document
            for (Node grandChild : List.copyOf(child.getChildren())) {
                doc.link(parent, grandChild, -1);
                attached.add(grandChild);
            }
        } else {
            doc.link(parent, child, -1);
            attached.add(child);
        }
        notifyStructureChanged(doc);
        return attached;
    }

    /**
     * Appends each node of the list in order, with the same splicing rule.
     */
    public List<Node> attach(Node parent, List<Node> children, Document doc) {
        List<Node> attached = new ArrayList<>();
        for (Node child : List.copyOf(children)) {
            if (TransparentContainer.isTransparent(child)) {
                for (Node grandChild : List.copyOf(child.getChildren())) {
                    doc.link(parent, grandChild, -1);
                    attached.add(grandChild);
                }
            } else {
                doc.link(parent, child, -1);
                attached.add(child);
            }
        }
        if (!attached.isEmpty()) {
            notifyStructureChanged(doc);
        }
        return attached;
    }

    /**
     * Inserts a single node at the given position.
     *
     * @throws IllegalArgumentException if the node is a transparent container
     */
    public void insertAt(Node parent, Node child, int index, Document doc) {
        if (TransparentContainer.isTransparent(child)) {
            throw new IllegalArgumentException("Cannot insert transparent container "
                    + child.getTag() + " at an index");
        }
        doc.link(parent, child, index);
        notifyStructureChanged(doc);
    }

    /**
     * Removes a node and its subtree from the document.
     */
    public boolean detach(Node node, Document doc) {
        String path = doc.contains(node) ? pathResolver.absolutePath(node, doc) : null;
        boolean removed = doc.unlink(node);
        if (removed) {
            auditService.record(AuditAction.NODE_DETACHED, doc.getName(), path, Map.of("tag", node.getTag()));
            notifyStructureChanged(doc);
        }
        return removed;
    }

    /**
     * Returns the first child with the tag, appending one made by the factory when absent.
     */
    public Node getOrCreate(Node parent, String tag, Supplier<Node> factory, Document doc) {
        return parent.findChild(tag).orElseGet(() -> {
            Node container = factory.get();
            log.info("Creating missing container '{}' in '{}'", tag, parent.getTag());
            doc.link(parent, container, -1);
            recordSynthesized(container, parent, doc);
            notifyStructureChanged(doc);
            return container;
        });
    }

    /**
     * Ensures the parent holds every container of the schema, in schema order.
     *
     * <p>Slots are walked in order, keeping the last present sibling as
     * anchor. A missing synthesizable container is inserted right after the
     * anchor (first position when there is none). If the anchor is no longer
     * a child of the parent the container is appended instead.</p>
     *
     * @return the containers that were synthesized, in creation order
     * @throws MissingRequiredContainerException if a required slot is absent
     */
    public List<Node> ensureContainers(Node parent, ContainerSchema schema, Document doc) {
        List<Node> synthesized = new ArrayList<>();
        Node anchor = null;

        for (ContainerSchema.Slot slot : schema.slots()) {
            Node found = parent.findChild(slot.tag()).orElse(null);
            if (found != null) {
                anchor = found;
                continue;
            }
            if (!slot.isSynthesizable()) {
                throw new MissingRequiredContainerException(slot.tag(),
                        parent.getTag() + " at " + pathResolver.absolutePath(parent, doc)
                                + " in " + doc.getName());
            }

            log.info("Creating missing element '{}' in {}", slot.tag(), parent.getTag());
            Node created = slot.factory().get();
            if (anchor == null) {
                doc.link(parent, created, 0);
            } else {
                int anchorIndex = parent.indexOf(anchor);
                if (anchorIndex < 0) {
                    log.warn("structure.anchor.missing container={} anchor={} parent={}; appending at end",
                            slot.tag(), anchor.getTag(), parent.getTag());
                    doc.link(parent, created, -1);
                } else {
                    doc.link(parent, created, anchorIndex + 1);
                }
            }
            anchor = created;
            synthesized.add(created);
            recordSynthesized(created, parent, doc);
            notifyStructureChanged(doc);
        }
        return synthesized;
    }

    public void addListener(MergeListener listener) {
        if (listener != null) {
            listeners.add(listener);
        }
    }

    public void notifyStructureChanged(Document doc) {
        for (MergeListener listener : listeners) {
            listener.onStructureChanged(doc);
        }
    }

    public PathResolver getPathResolver() {
        return pathResolver;
    }

    private void recordSynthesized(Node container, Node parent, Document doc) {
        metricsService.incrementContainersSynthesized(container.getTag());
        auditService.record(AuditAction.CONTAINER_SYNTHESIZED, doc.getName(),
                pathResolver.absolutePath(parent, doc), Map.of("tag", container.getTag()));
    }
}
