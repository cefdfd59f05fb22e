package com.document.merge.reference;

import com.document.merge.audit.AuditAction;
import com.document.merge.audit.AuditService;
import com.document.merge.core.model.PathMap;
import com.document.merge.metrics.MetricsService;
import com.document.merge.metrics.NoOpMetricsService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Rewrites reference texts after their targets moved.
 *
 * <p>Both operations validate every reference before writing any, so a
 * failing call leaves all texts as they were.</p>
 */
public class ReferenceRelocator {
    private static final Logger log = LoggerFactory.getLogger(ReferenceRelocator.class);

    private final MetricsService metricsService;
    private final AuditService auditService;

    public ReferenceRelocator() {
        this(new NoOpMetricsService(), new AuditService());
    }

    public ReferenceRelocator(MetricsService metricsService, AuditService auditService) {
        this.metricsService = Objects.requireNonNull(metricsService, "metricsService is required");
        this.auditService = Objects.requireNonNull(auditService, "auditService is required");
    }

    /**
     * Replaces each reference whose path is a key of the map with the mapped path.
     *
     * @param strict when true, a reference missing from the map is an error;
     *               otherwise it is left untouched
     * @return number of rewritten references
     * @throws UnmappedReferenceException in strict mode, listing every unmapped path
     */
    public int relocate(List<? extends ReferenceField> refs, PathMap pathMap, boolean strict) {
        Objects.requireNonNull(refs, "refs is required");
        Objects.requireNonNull(pathMap, "pathMap is required");

        if (strict) {
            List<String> unmapped = new ArrayList<>();
            for (ReferenceField ref : refs) {
                if (ref.getPath() == null || !pathMap.containsKey(ref.getPath())) {
                    unmapped.add(ref.describe());
                }
            }
            if (!unmapped.isEmpty()) {
                throw new UnmappedReferenceException(unmapped);
            }
        }

        int rewritten = 0;
        for (ReferenceField ref : refs) {
            String path = ref.getPath();
            if (path == null) {
                continue;
            }
            Optional<String> target = pathMap.lookup(path);
            if (target.isPresent()) {
                ref.setPath(target.get());
                rewritten++;
            } else {
                log.debug("Reference {} not in path map; left unchanged", path);
            }
        }

        record(rewritten, Map.of("strategy", "exact", "offered", refs.size()));
        return rewritten;
    }

    /**
     * Replaces the first occurrence of {@code oldPrefix} in every reference
     * with {@code newPrefix}.
     *
     * @return number of rewritten references
     * @throws PrefixNotFoundException if any reference does not contain the prefix
     */
    public int relocatePrefix(List<? extends ReferenceField> refs, String oldPrefix, String newPrefix) {
        Objects.requireNonNull(refs, "refs is required");
        Objects.requireNonNull(oldPrefix, "oldPrefix is required");
        Objects.requireNonNull(newPrefix, "newPrefix is required");
        if (oldPrefix.isEmpty()) {
            throw new IllegalArgumentException("oldPrefix must not be empty");
        }

        for (ReferenceField ref : refs) {
            String path = ref.getPath();
            if (path == null || !path.contains(oldPrefix)) {
                throw new PrefixNotFoundException(String.valueOf(path), oldPrefix);
            }
        }

        for (ReferenceField ref : refs) {
            String path = ref.getPath();
            int at = path.indexOf(oldPrefix);
            ref.setPath(path.substring(0, at) + newPrefix + path.substring(at + oldPrefix.length()));
        }

        record(refs.size(), Map.of("strategy", "prefix", "oldPrefix", oldPrefix, "newPrefix", newPrefix));
        return refs.size();
    }

    private void record(int rewritten, Map<String, Object> details) {
        if (rewritten == 0) {
            return;
        }
        metricsService.incrementReferencesRelocated(rewritten);
        auditService.record(AuditAction.REFERENCES_RELOCATED, null, null, details);
        log.info("reference.relocated count={} strategy={}", rewritten, details.get("strategy"));
    }
}
