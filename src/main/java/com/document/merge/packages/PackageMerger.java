package com.document.merge.packages;

import com.document.merge.audit.AuditAction;
import com.document.merge.audit.AuditService;
import com.document.merge.audit.MergeLedger;
import com.document.merge.core.model.Document;
import com.document.merge.core.model.Node;
import com.document.merge.core.model.NodeTags;
import com.document.merge.core.model.PathMap;
import com.document.merge.identity.IdentityGenerator;
import com.document.merge.merge.MergeEngine;
import com.document.merge.merge.MergeTransaction;
import com.document.merge.path.PathResolver;
import com.document.merge.structure.StructureEnforcer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.Collection;
import java.util.Collections;
import java.util.Deque;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Copies package trees from a source document into a destination document.
 *
 * <p>Destination packages are matched by name among the direct children of
 * the destination parent and created when missing. The elements of each
 * package are merged with {@link MergeEngine#extend} in the mode the
 * {@link ClashPolicy} gives for that package; sub-packages are copied
 * recursively. The whole source tree is validated before anything changes;
 * a copy that fails afterwards removes the packages, containers and elements
 * it added and drops its ledger records.</p>
 */
public class PackageMerger {
    private static final Logger log = LoggerFactory.getLogger(PackageMerger.class);

    private final MergeEngine mergeEngine;
    private final StructureEnforcer structureEnforcer;
    private final IdentityGenerator identityGenerator;
    private final MissingPackages missingPackages;
    private final AuditService auditService;

    public PackageMerger(MergeEngine mergeEngine,
                         StructureEnforcer structureEnforcer,
                         IdentityGenerator identityGenerator,
                         MissingPackages missingPackages,
                         AuditService auditService) {
        this.mergeEngine = Objects.requireNonNull(mergeEngine, "mergeEngine is required");
        this.structureEnforcer = Objects.requireNonNull(structureEnforcer, "structureEnforcer is required");
        this.identityGenerator = Objects.requireNonNull(identityGenerator, "identityGenerator is required");
        this.missingPackages = Objects.requireNonNull(missingPackages, "missingPackages is required");
        this.auditService = Objects.requireNonNull(auditService, "auditService is required");
    }

    /**
     * Copies {@code src} and its sub-packages under {@code dstParent}.
     *
     * @param dstParent node holding the destination packages, usually an {@code AR-PACKAGES}
     * @return old to new path of every named element and package merged
     * @throws InvalidPackageStructureException if a source package is malformed
     */
    public PathMap copyPackage(Node src, Node dstParent, Document srcDoc, Document dstDoc, ClashPolicy policy) {
        Objects.requireNonNull(policy, "policy is required");
        validateTree(src);
        MergeLedger ledger = mergeEngine.getMergeLedger();
        PathMap pathMap = PathMap.empty();
        try (MergeTransaction tx = new MergeTransaction()) {
            tx.execute("mark merge ledger", ledger::size, ledger::truncate);
            copyPackage(src, dstParent, srcDoc, dstDoc, policy, pathMap, tx);
            tx.markSuccess();
        }
        return pathMap;
    }

    private void copyPackage(Node src, Node dstParent, Document srcDoc, Document dstDoc,
                             ClashPolicy policy, PathMap pathMap, MergeTransaction tx) {
        boolean hasSubPackages = PackageNodes.validate(src);
        String name = src.localName().orElseThrow();
        PathResolver resolver = structureEnforcer.getPathResolver();
        String srcPath = resolver.absolutePath(src, srcDoc);

        Node dst = PackageNodes.find(dstParent, name).orElse(null);
        if (dst == null) {
            Node created = PackageNodes.create(name, identityGenerator.next() + srcPath.replace('/', '-'));
            if (hasSubPackages) {
                created.addChild(Node.of(NodeTags.PACKAGES));
            }
            dst = tx.execute("create package " + srcPath,
                    () -> {
                        structureEnforcer.attach(dstParent, created, dstDoc);
                        return created;
                    },
                    pkg -> structureEnforcer.detach(pkg, dstDoc));
            auditService.record(AuditAction.PACKAGE_CREATED, dstDoc.getName(),
                    resolver.absolutePath(dst, dstDoc), Map.of("sourceDocument", srcDoc.getName()));
            log.info("packages.created name={} source={}:{}", name, srcDoc.getName(), srcPath);
        } else {
            Node existing = dst;
            tx.execute("complete package " + srcPath,
                    () -> structureEnforcer.ensureContainers(existing,
                            hasSubPackages ? PackageNodes.NESTED : PackageNodes.FLAT, dstDoc),
                    added -> added.forEach(container -> structureEnforcer.detach(container, dstDoc)));
        }
        pathMap.put(srcPath, resolver.absolutePath(dst, dstDoc));

        Node srcElements = src.findChild(NodeTags.ELEMENTS).orElseThrow();
        Node dstElements = dst.findChild(NodeTags.ELEMENTS).orElseThrow();
        Set<Node> present = Collections.newSetFromMap(new IdentityHashMap<>());
        present.addAll(dstElements.getChildren());
        pathMap.putAll(tx.execute("extend elements of " + srcPath,
                () -> mergeEngine.extend(srcElements.getChildren(), dstElements, srcDoc, dstDoc,
                        policy.modeFor(name)),
                extended -> detachAddedSince(dstElements, present, dstDoc)));

        if (hasSubPackages) {
            Node dstPackages = dst.findChild(NodeTags.PACKAGES).orElseThrow();
            for (Node subPackage : PackageNodes.subPackages(src)) {
                copyPackage(subPackage, dstPackages, srcDoc, dstDoc, policy, pathMap, tx);
            }
        }
    }

    private void validateTree(Node src) {
        Deque<Node> pending = new ArrayDeque<>();
        pending.push(src);
        while (!pending.isEmpty()) {
            Node pkg = pending.pop();
            if (PackageNodes.validate(pkg)) {
                PackageNodes.subPackages(pkg).forEach(pending::push);
            }
        }
    }

    private void detachAddedSince(Node container, Set<Node> present, Document doc) {
        for (Node child : List.copyOf(container.getChildren())) {
            if (!present.contains(child)) {
                structureEnforcer.detach(child, doc);
            }
        }
    }

    /**
     * Copies the named top-level packages of {@code srcDoc} into the package
     * container of the destination root.
     *
     * @param toleratedMissing package names whose absence is not an error
     * @return accumulated path map of all copies
     */
    public PathMap copyRootPackages(Document srcDoc, Document dstDoc, List<RootPackageSpec> specs,
                                    Collection<String> toleratedMissing) {
        Set<String> tolerated = Set.copyOf(toleratedMissing);
        Node dstParent = structureEnforcer.getOrCreate(dstDoc.getRoot(), NodeTags.PACKAGES,
                () -> Node.of(NodeTags.PACKAGES), dstDoc);

        PathMap pathMap = PathMap.empty();
        for (RootPackageSpec spec : specs) {
            log.info("Copying package {} from {}", spec.name(), srcDoc.getName());
            Node src = srcDoc.getRoot().findNamedDescendant(NodeTags.PACKAGE, spec.name()).orElse(null);
            if (src == null) {
                if (!tolerated.contains(spec.name())) {
                    log.warn("Package {} is missing in {}", spec.name(), srcDoc.getName());
                    missingPackages.recordMissing(srcDoc.getName(), spec.name());
                    auditService.record(AuditAction.SOURCE_PACKAGE_MISSING, srcDoc.getName(), spec.name());
                } else {
                    log.debug("Package {} is missing in {} (tolerated)", spec.name(), srcDoc.getName());
                }
                continue;
            }
            pathMap.putAll(copyPackage(src, dstParent, srcDoc, dstDoc, spec.policy()));
        }
        return pathMap;
    }

    public MissingPackages getMissingPackages() {
        return missingPackages;
    }
}
