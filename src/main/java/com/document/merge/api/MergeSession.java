package com.document.merge.api;

import com.document.merge.audit.AuditService;
import com.document.merge.audit.MergeLedger;
import com.document.merge.core.model.Document;
import com.document.merge.core.model.Node;
import com.document.merge.core.model.PathMap;
import com.document.merge.identity.IdentityGenerator;
import com.document.merge.identity.IdentityUniqueifier;
import com.document.merge.identity.UuidIdentityGenerator;
import com.document.merge.logging.LogContext;
import com.document.merge.merge.MergeEngine;
import com.document.merge.merge.MergeListener;
import com.document.merge.merge.MergeMode;
import com.document.merge.merge.NameClash;
import com.document.merge.merge.NameClashSet;
import com.document.merge.metrics.MetricsService;
import com.document.merge.metrics.NoOpMetricsService;
import com.document.merge.packages.ClashPolicy;
import com.document.merge.packages.MissingPackages;
import com.document.merge.packages.PackageMerger;
import com.document.merge.packages.RootPackageSpec;
import com.document.merge.path.CacheConfig;
import com.document.merge.path.CacheStats;
import com.document.merge.path.CaffeinePathCache;
import com.document.merge.path.NoOpPathCache;
import com.document.merge.path.PathCache;
import com.document.merge.path.PathLookup;
import com.document.merge.path.PathResolver;
import com.document.merge.reference.PrefixRenamer;
import com.document.merge.reference.ReferenceField;
import com.document.merge.reference.ReferenceRelocator;
import com.document.merge.structure.ContainerSchema;
import com.document.merge.structure.StructureEnforcer;
import com.document.merge.tracing.NoOpTracingService;
import com.document.merge.tracing.Span;
import com.document.merge.tracing.TracingService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Entry point for one merge run into a destination document.
 *
 * <p>A session owns the run-scoped state (name clashes, missing packages,
 * ledger and audit trail) and wires the path, structure, merge, reference,
 * identity and package components around it. Use one session per
 * destination; calls on a session must be sequential.</p>
 *
 * <pre>
 * MergeSession session = MergeSession.builder()
 *     .options(MergeOptions.defaults())
 *     .cacheConfig(CacheConfig.defaults())
 *     .build();
 *
 * try (SourceScope scope = session.beginSource(ethDp)) {
 *     PathMap pdus = scope.step("I-PDU", () -&gt; session.extend(srcPdus, dstPdus, ethDp, com));
 *     scope.step("PDU-REF", () -&gt; session.relocate(ReferenceCollector.byTag(dstRoot, "PDU-REF"), pdus));
 * }
 * session.ensureUniqueIdentities(com);
 * session.verify();   // throws MergeAbortedException on strict clashes or missing packages
 * </pre>
 */
public class MergeSession {
    private static final Logger log = LoggerFactory.getLogger(MergeSession.class);

    private final String sessionId;
    private final MergeOptions options;
    private final TracingService tracingService;
    private final PathCache pathCache;
    private final PathResolver pathResolver;
    private final StructureEnforcer structureEnforcer;
    private final NameClashSet nameClashes;
    private final MergeLedger mergeLedger;
    private final AuditService auditService;
    private final MissingPackages missingPackages;
    private final MergeEngine mergeEngine;
    private final ReferenceRelocator referenceRelocator;
    private final IdentityUniqueifier identityUniqueifier;
    private final PrefixRenamer prefixRenamer;
    private final PackageMerger packageMerger;

    private MergeSession(Builder builder) {
        this.sessionId = LogContext.generateCorrelationId();
        this.options = builder.options;
        MetricsService metricsService = builder.metricsService != null
                ? builder.metricsService : new NoOpMetricsService();
        this.tracingService = builder.tracingService != null
                ? builder.tracingService : new NoOpTracingService();

        if (builder.pathCache != null) {
            this.pathCache = builder.pathCache;
        } else if (builder.cacheConfig != null && builder.cacheConfig.enabled()) {
            this.pathCache = new CaffeinePathCache(builder.cacheConfig);
        } else {
            this.pathCache = new NoOpPathCache();
        }

        this.auditService = builder.auditService != null ? builder.auditService : new AuditService();
        this.mergeLedger = builder.mergeLedger != null ? builder.mergeLedger : new MergeLedger();
        this.nameClashes = new NameClashSet();
        this.missingPackages = new MissingPackages();

        IdentityGenerator identityGenerator = builder.identityGenerator != null
                ? builder.identityGenerator : new UuidIdentityGenerator();

        this.pathResolver = new PathResolver(pathCache);
        this.structureEnforcer = new StructureEnforcer(pathResolver, metricsService, auditService);
        this.mergeEngine = new MergeEngine(structureEnforcer, nameClashes, mergeLedger, auditService,
                metricsService, options.getDefaultMode());
        this.referenceRelocator = new ReferenceRelocator(metricsService, auditService);
        this.identityUniqueifier = new IdentityUniqueifier(options.getIdentityAttribute(), identityGenerator,
                metricsService, auditService);
        this.prefixRenamer = new PrefixRenamer(structureEnforcer, identityUniqueifier, auditService);
        this.packageMerger = new PackageMerger(mergeEngine, structureEnforcer, identityGenerator,
                missingPackages, auditService);

        for (MergeListener listener : builder.listeners) {
            structureEnforcer.addListener(listener);
            mergeEngine.addMergeListener(listener);
        }

        log.info("MergeSession {} initialized (defaultMode={}, cache={})",
                sessionId, options.getDefaultMode(), pathCache.getClass().getSimpleName());
    }

    // ========== Source scopes ==========

    /**
     * Opens a scope for the work done on behalf of one source document.
     */
    public SourceScope beginSource(Document source) {
        Span span = tracingService.startSpan("merge.source",
                Map.of("sessionId", sessionId, "sourceDocument", source.getName()));
        return new SourceScope(source, span);
    }

    // ========== Paths ==========

    public String absolutePath(Node node, Document doc) {
        return pathResolver.absolutePath(node, doc);
    }

    public Optional<Node> findByPath(Document doc, String path) {
        return PathLookup.findByPath(doc, path);
    }

    // ========== Merging ==========

    public PathMap extend(List<Node> srcNodes, Node dstContainer, Document srcDoc, Document dstDoc) {
        return extend(srcNodes, dstContainer, srcDoc, dstDoc, options.getDefaultMode());
    }

    public PathMap extend(List<Node> srcNodes, Node dstContainer, Document srcDoc, Document dstDoc,
                          MergeMode mode) {
        return traced("merge.extend", dstDoc, () -> mergeEngine.extend(srcNodes, dstContainer, srcDoc, dstDoc, mode));
    }

    public PathMap extend(List<Node> srcNodes, Node dstContainer, Document srcDoc, Document dstDoc,
                          Function<Node, String> keyOfSrc, Function<Node, String> keyOfDst, MergeMode mode) {
        return traced("merge.extend", dstDoc,
                () -> mergeEngine.extend(srcNodes, dstContainer, srcDoc, dstDoc, keyOfSrc, keyOfDst, mode));
    }

    public PathMap extendCopies(List<Node> srcNodes, Node dstContainer, Document srcDoc, Document dstDoc,
                                Function<Node, String> keyOfSrc, Function<Node, String> keyOfDst,
                                MergeMode mode) {
        return traced("merge.extend", dstDoc,
                () -> mergeEngine.extendCopies(srcNodes, dstContainer, srcDoc, dstDoc, keyOfSrc, keyOfDst, mode));
    }

    public PathMap copyPackage(Node src, Node dstParent, Document srcDoc, Document dstDoc, ClashPolicy policy) {
        return traced("merge.package", dstDoc, () -> packageMerger.copyPackage(src, dstParent, srcDoc, dstDoc, policy));
    }

    public PathMap copyRootPackages(Document srcDoc, Document dstDoc, List<RootPackageSpec> specs,
                                    Collection<String> toleratedMissing) {
        return traced("merge.packages", dstDoc,
                () -> packageMerger.copyRootPackages(srcDoc, dstDoc, specs, toleratedMissing));
    }

    // ========== References ==========

    /**
     * Relocates references with the session's reference strictness.
     */
    public int relocate(List<? extends ReferenceField> refs, PathMap pathMap) {
        return relocate(refs, pathMap, options.isStrictReferences());
    }

    public int relocate(List<? extends ReferenceField> refs, PathMap pathMap, boolean strict) {
        return referenceRelocator.relocate(refs, pathMap, strict);
    }

    public int relocatePrefix(List<? extends ReferenceField> refs, String oldPrefix, String newPrefix) {
        return referenceRelocator.relocatePrefix(refs, oldPrefix, newPrefix);
    }

    public PathMap prefixNamesOfType(Node scope, String prefix, String tag, Document doc) {
        return prefixRenamer.prefixNamesOfType(scope, prefix, tag, doc);
    }

    public int prefixReferencesOfType(Node scope, String prefix, String referenceTag) {
        return prefixRenamer.prefixReferencesOfType(scope, prefix, referenceTag);
    }

    // ========== Structure ==========

    public List<Node> attach(Node parent, Node child, Document doc) {
        return structureEnforcer.attach(parent, child, doc);
    }

    public List<Node> attach(Node parent, List<Node> children, Document doc) {
        return structureEnforcer.attach(parent, children, doc);
    }

    public void insertAt(Node parent, Node child, int index, Document doc) {
        structureEnforcer.insertAt(parent, child, index, doc);
    }

    public boolean detach(Node node, Document doc) {
        return structureEnforcer.detach(node, doc);
    }

    public List<Node> ensureContainers(Node parent, ContainerSchema schema, Document doc) {
        return structureEnforcer.ensureContainers(parent, schema, doc);
    }

    public Node getOrCreate(Node parent, String tag, Supplier<Node> factory, Document doc) {
        return structureEnforcer.getOrCreate(parent, tag, factory, doc);
    }

    // ========== Identities ==========

    public int ensureUniqueIdentities(Document doc) {
        return traced("merge.identities", doc, () -> identityUniqueifier.ensureUniqueIdentities(doc));
    }

    // ========== Run state ==========

    public boolean anyStrictClash() {
        return nameClashes.anyStrictClash();
    }

    public boolean anyGracefulClash() {
        return nameClashes.anyGracefulClash();
    }

    public boolean anyMissingSourcePackage() {
        return missingPackages.any();
    }

    /**
     * Checks whether the destination may be serialized.
     *
     * @throws MergeAbortedException listing every strict clash and missing package
     */
    public void verify() {
        List<String> reasons = new ArrayList<>();
        for (NameClash clash : nameClashes.getStrictClashes()) {
            reasons.add(clash.describe());
        }
        for (MissingPackages.MissingPackage missing : missingPackages.list()) {
            reasons.add(missing.describe());
        }
        if (!reasons.isEmpty()) {
            log.error("merge.aborted session={} reasons={}", sessionId, reasons.size());
            throw new MergeAbortedException(reasons);
        }
        log.info("merge.verified session={} merges={}", sessionId, mergeLedger.size());
    }

    public MergeReport report() {
        return new MergeReport(
                sessionId,
                nameClashes.getStrictClashes(),
                nameClashes.getGracefulClashes(),
                missingPackages.list(),
                mergeLedger.getAllRecords(),
                auditService.size(),
                Instant.now());
    }

    /**
     * Clears all run state so the session can be reused for another run.
     */
    public void reset() {
        nameClashes.reset();
        missingPackages.reset();
        mergeLedger.clear();
        auditService.clear();
        pathCache.invalidateAll();
        log.info("MergeSession {} reset", sessionId);
    }

    private <T> T traced(String operation, Document doc, Supplier<T> work) {
        try (LogContext logCtx = LogContext.forRun(sessionId, doc.getName());
             Span span = tracingService.startSpan(operation, Map.of("document", doc.getName()))) {
            try {
                T result = work.get();
                span.setStatus(Span.SpanStatus.OK);
                return result;
            } catch (RuntimeException e) {
                span.recordException(e);
                span.setStatus(Span.SpanStatus.ERROR);
                throw e;
            }
        }
    }

    // ========== Accessors ==========

    public String getSessionId() {
        return sessionId;
    }

    public MergeOptions getOptions() {
        return options;
    }

    public NameClashSet getNameClashes() {
        return nameClashes;
    }

    public MergeLedger getMergeLedger() {
        return mergeLedger;
    }

    public AuditService getAuditService() {
        return auditService;
    }

    public MissingPackages getMissingPackages() {
        return missingPackages;
    }

    public CacheStats getCacheStats() {
        return pathResolver.getCacheStats();
    }

    public StructureEnforcer getStructureEnforcer() {
        return structureEnforcer;
    }

    public MergeEngine getMergeEngine() {
        return mergeEngine;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private MergeOptions options = MergeOptions.defaults();
        private MetricsService metricsService;
        private TracingService tracingService;
        private PathCache pathCache;
        private CacheConfig cacheConfig;
        private IdentityGenerator identityGenerator;
        private MergeLedger mergeLedger;
        private AuditService auditService;
        private final List<MergeListener> listeners = new ArrayList<>();

        public Builder options(MergeOptions options) {
            this.options = options;
            return this;
        }

        public Builder metricsService(MetricsService metricsService) {
            this.metricsService = metricsService;
            return this;
        }

        public Builder tracingService(TracingService tracingService) {
            this.tracingService = tracingService;
            return this;
        }

        /**
         * Uses the given cache; takes precedence over {@link #cacheConfig(CacheConfig)}.
         */
        public Builder pathCache(PathCache pathCache) {
            this.pathCache = pathCache;
            return this;
        }

        /**
         * Enables a Caffeine path cache with this configuration.
         */
        public Builder cacheConfig(CacheConfig cacheConfig) {
            this.cacheConfig = cacheConfig;
            return this;
        }

        public Builder identityGenerator(IdentityGenerator identityGenerator) {
            this.identityGenerator = identityGenerator;
            return this;
        }

        public Builder mergeLedger(MergeLedger mergeLedger) {
            this.mergeLedger = mergeLedger;
            return this;
        }

        public Builder auditService(AuditService auditService) {
            this.auditService = auditService;
            return this;
        }

        public Builder listener(MergeListener listener) {
            if (listener != null) {
                listeners.add(listener);
            }
            return this;
        }

        public MergeSession build() {
            if (options == null) {
                throw new IllegalStateException("MergeOptions are required");
            }
            return new MergeSession(this);
        }
    }
}
