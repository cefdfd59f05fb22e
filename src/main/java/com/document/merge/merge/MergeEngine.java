package com.document.merge.merge;

import com.document.merge.audit.AuditAction;
import com.document.merge.audit.AuditService;
import com.document.merge.audit.MergeLedger;
import com.document.merge.audit.MergeRecord;
import com.document.merge.core.model.Document;
import com.document.merge.core.model.Node;
import com.document.merge.core.model.NodeKeys;
import com.document.merge.core.model.PathMap;
import com.document.merge.logging.LogContext;
import com.document.merge.metrics.MetricsService;
import com.document.merge.metrics.NoOpMetricsService;
import com.document.merge.path.PathResolver;
import com.document.merge.structure.StructureEnforcer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Function;

/**
 * Merges lists of source nodes into destination containers ("extend").
 *
 * <p>Extend process:</p>
 * <ol>
 *   <li>Key and pre-merge path of every source node</li>
 *   <li>Path mapping: onto an existing destination child with the same key,
 *       or onto the destination container path plus the node's own name</li>
 *   <li>Clash detection: intersection of source and destination key sets</li>
 *   <li>Admission: strict clashes attach nothing, graceful clashes attach the
 *       non-clashing nodes, no clash attaches everything</li>
 *   <li>Registration in the ledger, the clash set and the listeners</li>
 * </ol>
 *
 * <p>Calls against one destination document must be strictly sequential:
 * each call reads the destination structure left by the previous one.</p>
 */
public class MergeEngine {
    private static final Logger log = LoggerFactory.getLogger(MergeEngine.class);

    private final PathResolver pathResolver;
    private final StructureEnforcer structureEnforcer;
    private final NameClashSet nameClashes;
    private final MergeLedger mergeLedger;
    private final AuditService auditService;
    private final MetricsService metricsService;
    private final MergeMode defaultMode;
    private final List<MergeListener> mergeListeners = new CopyOnWriteArrayList<>();

    public MergeEngine(StructureEnforcer structureEnforcer, NameClashSet nameClashes) {
        this(structureEnforcer, nameClashes, new MergeLedger(), new AuditService(),
                new NoOpMetricsService(), MergeMode.STRICT);
    }

    public MergeEngine(StructureEnforcer structureEnforcer,
                       NameClashSet nameClashes,
                       MergeLedger mergeLedger,
                       AuditService auditService,
                       MetricsService metricsService,
                       MergeMode defaultMode) {
        this.structureEnforcer = Objects.requireNonNull(structureEnforcer, "structureEnforcer is required");
        this.pathResolver = structureEnforcer.getPathResolver();
        this.nameClashes = Objects.requireNonNull(nameClashes, "nameClashes is required");
        this.mergeLedger = Objects.requireNonNull(mergeLedger, "mergeLedger is required");
        this.auditService = Objects.requireNonNull(auditService, "auditService is required");
        this.metricsService = Objects.requireNonNull(metricsService, "metricsService is required");
        this.defaultMode = Objects.requireNonNull(defaultMode, "defaultMode is required");
    }

    /**
     * Extends the destination container with the source nodes, matching by local name
     * in the default mode.
     */
    public PathMap extend(List<Node> srcNodes, Node dstContainer, Document srcDoc, Document dstDoc) {
        return extend(srcNodes, dstContainer, srcDoc, dstDoc, NodeKeys.localName(), NodeKeys.localName(), defaultMode);
    }

    public PathMap extend(List<Node> srcNodes, Node dstContainer, Document srcDoc, Document dstDoc, MergeMode mode) {
        return extend(srcNodes, dstContainer, srcDoc, dstDoc, NodeKeys.localName(), NodeKeys.localName(), mode);
    }

    /**
     * Extends the destination container with the source nodes.
     *
     * @param srcNodes     nodes of {@code srcDoc} to merge; must have distinct keys
     * @param dstContainer destination parent, part of {@code dstDoc}
     * @param keyOfSrc     key of a source node; must not return null
     * @param keyOfDst     key of an existing destination child; null never matches
     * @param mode         reaction to clashing keys
     * @return old source path to new destination path, for named source nodes
     * @throws DuplicateSourceKeyException if two source nodes share a key
     */
    public PathMap extend(List<Node> srcNodes, Node dstContainer, Document srcDoc, Document dstDoc,
                          Function<Node, String> keyOfSrc, Function<Node, String> keyOfDst,
                          MergeMode mode) {
        return doExtend(srcNodes, dstContainer, srcDoc, dstDoc, keyOfSrc, keyOfDst, mode, false);
    }

    /**
     * Same as {@link #extend(List, Node, Document, Document, Function, Function, MergeMode)}
     * but attaches deep copies, leaving the source tree untouched. Paths are
     * computed on the originals.
     */
    public PathMap extendCopies(List<Node> srcNodes, Node dstContainer, Document srcDoc, Document dstDoc,
                                Function<Node, String> keyOfSrc, Function<Node, String> keyOfDst,
                                MergeMode mode) {
        return doExtend(srcNodes, dstContainer, srcDoc, dstDoc, keyOfSrc, keyOfDst, mode, true);
    }

    /**
     * Extends the destination container with the children of a source container.
     */
    public PathMap extendChildren(Node srcContainer, Node dstContainer, Document srcDoc, Document dstDoc,
                                  MergeMode mode) {
        return extend(srcContainer.getChildren(), dstContainer, srcDoc, dstDoc, mode);
    }

    private PathMap doExtend(List<Node> srcNodes, Node dstContainer, Document srcDoc, Document dstDoc,
                             Function<Node, String> keyOfSrc, Function<Node, String> keyOfDst,
                             MergeMode mode, boolean copy) {
        Objects.requireNonNull(srcNodes, "srcNodes is required");
        Objects.requireNonNull(dstContainer, "dstContainer is required");
        Objects.requireNonNull(srcDoc, "srcDoc is required");
        Objects.requireNonNull(dstDoc, "dstDoc is required");
        Objects.requireNonNull(keyOfSrc, "keyOfSrc is required");
        Objects.requireNonNull(keyOfDst, "keyOfDst is required");
        Objects.requireNonNull(mode, "mode is required");

        PathMap pathMap = PathMap.empty();
        if (srcNodes.isEmpty()) {
            log.debug("merge.extend.skipped reason=empty-source container={}", dstContainer.getTag());
            return pathMap;
        }

        long startNanos = System.nanoTime();
        List<Node> sources = List.copyOf(srcNodes);
        List<Node> existing = List.copyOf(dstContainer.getChildren());
        String dstPath = pathResolver.absolutePath(dstContainer, dstDoc);
        String srcContainerPath = srcDoc.parentOf(sources.get(0))
                .map(parent -> pathResolver.absolutePath(parent, srcDoc))
                .orElse("/");

        try (LogContext logCtx = LogContext.forMerge(LogContext.generateCorrelationId(),
                srcDoc.getName(), dstDoc.getName(), dstPath)) {

            List<String> srcKeys = sourceKeys(sources, keyOfSrc, srcDoc);
            Map<String, Node> dstByKey = new LinkedHashMap<>();
            for (Node child : existing) {
                String key = keyOfDst.apply(child);
                if (key != null) {
                    dstByKey.putIfAbsent(key, child);
                }
            }

            int duplicates = 0;
            for (int i = 0; i < sources.size(); i++) {
                Node source = sources.get(i);
                Node duplicate = dstByKey.get(srcKeys.get(i));
                if (duplicate != null) {
                    duplicates++;
                }
                Optional<String> srcPath = pathResolver.referencePath(source, srcDoc);
                if (srcPath.isEmpty()) {
                    // anonymous nodes have no referenceable path
                    continue;
                }
                String mapped = duplicate != null
                        ? pathResolver.absolutePath(duplicate, dstDoc)
                        : childPath(dstPath, PathResolver.trailingSegment(srcPath.get()));
                pathMap.put(srcPath.get(), mapped);
            }

            Set<String> clashes = new TreeSet<>(srcKeys);
            clashes.retainAll(dstByKey.keySet());

            List<Node> admitted;
            if (clashes.isEmpty()) {
                admitted = sources;
            } else {
                log.warn("merge.clash.detected count={} source={}:{} destination={} mode={}",
                        clashes.size(), srcDoc.getName(), srcContainerPath, dstPath, mode);
                log.warn("Conflicting elements: {}", clashes);
                nameClashes.record(new NameClash(srcDoc.getName(), srcContainerPath, dstPath,
                        mode, new ArrayList<>(clashes)));
                metricsService.incrementNameClash(mode);
                if (mode == MergeMode.GRACEFUL) {
                    admitted = new ArrayList<>();
                    for (int i = 0; i < sources.size(); i++) {
                        if (!clashes.contains(srcKeys.get(i))) {
                            admitted.add(sources.get(i));
                        }
                    }
                } else {
                    admitted = List.of();
                }
            }

            List<Node> attached = List.of();
            if (!admitted.isEmpty()) {
                List<Node> toAttach = copy ? admitted.stream().map(Node::deepCopy).toList() : admitted;
                attached = structureEnforcer.attach(dstContainer, toAttach, dstDoc);
                auditService.record(AuditAction.NODES_ATTACHED, dstDoc.getName(), dstPath, Map.of(
                        "sourceDocument", srcDoc.getName(),
                        "count", attached.size()
                ));
            }
            metricsService.incrementNodesAttached(attached.size());

            MergeRecord mergeRecord = mergeLedger.record(MergeRecord.builder()
                    .sourceDocument(srcDoc.getName())
                    .destinationDocument(dstDoc.getName())
                    .sourceContainerPath(srcContainerPath)
                    .destinationContainerPath(dstPath)
                    .mode(mode)
                    .sourceCount(sources.size())
                    .attachedCount(attached.size())
                    .duplicateCount(duplicates)
                    .clashingKeys(new ArrayList<>(clashes))
                    .build());

            metricsService.recordExtendDuration(mode, Duration.ofNanos(System.nanoTime() - startNanos));
            log.info("merge.extend.completed source={}:{} destination={} offered={} attached={} clashes={}",
                    srcDoc.getName(), srcContainerPath, dstPath, sources.size(), attached.size(), clashes.size());

            notifyMergeListeners(mergeRecord);
            return pathMap;
        }
    }

    private List<String> sourceKeys(List<Node> sources, Function<Node, String> keyOfSrc, Document srcDoc) {
        List<String> keys = new ArrayList<>(sources.size());
        Set<String> seen = new LinkedHashSet<>();
        Set<String> repeated = new TreeSet<>();
        for (Node source : sources) {
            String key = keyOfSrc.apply(source);
            if (key == null) {
                throw new IllegalArgumentException("Source node " + source + " of " + srcDoc.getName()
                        + " has no key; supply a key function");
            }
            if (!seen.add(key)) {
                repeated.add(key);
            }
            keys.add(key);
        }
        if (!repeated.isEmpty()) {
            throw new DuplicateSourceKeyException(srcDoc.getName(), new ArrayList<>(repeated));
        }
        return keys;
    }

    private static String childPath(String containerPath, String trailingSegment) {
        return "/".equals(containerPath) ? trailingSegment : containerPath + trailingSegment;
    }

    /**
     * Adds a listener notified after every extend call.
     */
    public void addMergeListener(MergeListener listener) {
        if (listener != null) {
            mergeListeners.add(listener);
        }
    }

    private void notifyMergeListeners(MergeRecord mergeRecord) {
        for (MergeListener listener : mergeListeners) {
            try {
                listener.onMerge(mergeRecord);
            } catch (RuntimeException e) {
                log.warn("Merge listener notification failed: {}", e.getMessage());
            }
        }
    }

    public NameClashSet getNameClashes() {
        return nameClashes;
    }

    public MergeLedger getMergeLedger() {
        return mergeLedger;
    }

    public MergeMode getDefaultMode() {
        return defaultMode;
    }
}
