package com.document.merge.reference;

import com.document.merge.audit.AuditAction;
import com.document.merge.audit.AuditService;
import com.document.merge.core.model.Document;
import com.document.merge.core.model.Node;
import com.document.merge.core.model.NodeTags;
import com.document.merge.core.model.PathMap;
import com.document.merge.identity.IdentityUniqueifier;
import com.document.merge.path.PathResolver;
import com.document.merge.structure.StructureEnforcer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Predicate;

/**
 * Renames elements with a prefix so they can live next to same-named
 * elements of another source, and rewrites references accordingly.
 *
 * <pre>
 * SYSTEM-SIGNAL "X"                  -&gt;  SYSTEM-SIGNAL "ABC_X"
 * SYSTEM-SIGNAL-REF /Sig/X           -&gt;  SYSTEM-SIGNAL-REF /Sig/ABC_X
 * DATA-ELEMENT-REF /Port/If/Data     -&gt;  DATA-ELEMENT-REF /Port/If/ABC_Data
 * </pre>
 */
public class PrefixRenamer {
    private static final Logger log = LoggerFactory.getLogger(PrefixRenamer.class);

    /**
     * Segment to prefix when none is given: the last one.
     */
    public static final int LAST_SEGMENT = -1;

    private final StructureEnforcer structureEnforcer;
    private final IdentityUniqueifier identityUniqueifier;
    private final AuditService auditService;

    public PrefixRenamer(StructureEnforcer structureEnforcer,
                         IdentityUniqueifier identityUniqueifier,
                         AuditService auditService) {
        this.structureEnforcer = Objects.requireNonNull(structureEnforcer, "structureEnforcer is required");
        this.identityUniqueifier = Objects.requireNonNull(identityUniqueifier, "identityUniqueifier is required");
        this.auditService = Objects.requireNonNull(auditService, "auditService is required");
    }

    /**
     * Prefixes the local name of every named descendant of {@code scope}
     * with the given tag. Renamed elements become new elements and receive a
     * new identity.
     *
     * @return old path to new path of every renamed element
     */
    public PathMap prefixNamesOfType(Node scope, String prefix, String tag, Document doc) {
        Objects.requireNonNull(prefix, "prefix is required");
        PathResolver resolver = structureEnforcer.getPathResolver();

        List<Node> targets = scope.findDescendants(n -> n.hasTag(tag) && n.isNamed());
        List<String> oldPaths = new ArrayList<>(targets.size());
        for (Node target : targets) {
            oldPaths.add(resolver.absolutePath(target, doc));
        }

        for (Node target : targets) {
            identityUniqueifier.replaceIdentity(target);
            target.rename(prefix + target.localName().orElseThrow());
        }
        structureEnforcer.notifyStructureChanged(doc);

        PathMap renamed = PathMap.empty();
        for (int i = 0; i < targets.size(); i++) {
            renamed.put(oldPaths.get(i), resolver.absolutePath(targets.get(i), doc));
        }

        if (!targets.isEmpty()) {
            auditService.record(AuditAction.NODES_RENAMED, doc.getName(),
                    resolver.absolutePath(scope, doc), Map.of("tag", tag, "prefix", prefix, "count", targets.size()));
        }
        log.info("reference.names.prefixed tag={} prefix={} count={}", tag, prefix, targets.size());
        return renamed;
    }

    /**
     * Prefixes one segment of every reference of the given tag below {@code scope}.
     * The segment is chosen by {@link #defaultSegment(String)}.
     *
     * @return number of rewritten references
     */
    public int prefixReferencesOfType(Node scope, String prefix, String referenceTag) {
        return prefixReferencesOfType(scope, prefix, referenceTag, defaultSegment(referenceTag), ref -> true);
    }

    /**
     * Prefixes segment {@code segmentIndex} (0-based, {@link #LAST_SEGMENT}
     * for the last) of every matching reference below {@code scope}.
     *
     * @throws IllegalArgumentException if the tag is not a reference tag, or a
     *                                  reference has fewer segments than required
     */
    public int prefixReferencesOfType(Node scope, String prefix, String referenceTag,
                                      int segmentIndex, Predicate<Node> filter) {
        if (!NodeTags.isReferenceTag(referenceTag)) {
            throw new IllegalArgumentException("Prefixing applies to reference tags (*"
                    + NodeTags.REFERENCE_SUFFIX + ", *" + NodeTags.TYPE_REFERENCE_SUFFIX + ") only, got "
                    + referenceTag);
        }

        List<Node> refs = scope.findDescendants(n -> n.hasTag(referenceTag) && n.getText() != null && filter.test(n));
        List<String> rewritten = new ArrayList<>(refs.size());
        for (Node ref : refs) {
            rewritten.add(prefixSegment(ref.getText(), prefix, segmentIndex));
        }
        for (int i = 0; i < refs.size(); i++) {
            refs.get(i).setText(rewritten.get(i));
        }
        log.debug("Prefixed {} {} references with {}", refs.size(), referenceTag, prefix);
        return refs.size();
    }

    /**
     * Segment that carries the element name for known reference kinds:
     * data element references point to {@code /Port/Interface/Data},
     * interface type references to {@code /Port/Interface}.
     */
    public static int defaultSegment(String referenceTag) {
        return switch (referenceTag) {
            case "ROOT-DATA-PROTOTYPE-REF", "DATA-ELEMENT-REF" -> 2;
            case "REQUIRED-INTERFACE-TREF", "PROVIDED-INTERFACE-TREF" -> 1;
            default -> LAST_SEGMENT;
        };
    }

    static String prefixSegment(String path, String prefix, int segmentIndex) {
        boolean absolute = path.startsWith("/");
        String[] segments = (absolute ? path.substring(1) : path).split("/", -1);
        int index = segmentIndex == LAST_SEGMENT ? segments.length - 1 : segmentIndex;
        if (index < 0 || index >= segments.length) {
            throw new IllegalArgumentException("Reference " + path + " has no segment " + segmentIndex);
        }
        segments[index] = prefix + segments[index];
        return (absolute ? "/" : "") + String.join("/", segments);
    }
}
