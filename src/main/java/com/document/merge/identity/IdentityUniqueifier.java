package com.document.merge.identity;

import com.document.merge.audit.AuditAction;
import com.document.merge.audit.AuditService;
import com.document.merge.core.model.Document;
import com.document.merge.core.model.Node;
import com.document.merge.core.model.NodeTags;
import com.document.merge.metrics.MetricsService;
import com.document.merge.metrics.NoOpMetricsService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Keeps identity attribute values unique within a document.
 *
 * <p>Merged documents routinely contain the same element twice (one copy per
 * source); downstream tools reject duplicate identities. Duplicates are
 * replaced rather than removed so every element keeps an identity.</p>
 */
public class IdentityUniqueifier {
    private static final Logger log = LoggerFactory.getLogger(IdentityUniqueifier.class);

    private final String attribute;
    private final IdentityGenerator generator;
    private final MetricsService metricsService;
    private final AuditService auditService;

    public IdentityUniqueifier() {
        this(NodeTags.IDENTITY_ATTRIBUTE, new UuidIdentityGenerator(), new NoOpMetricsService(), new AuditService());
    }

    public IdentityUniqueifier(String attribute,
                               IdentityGenerator generator,
                               MetricsService metricsService,
                               AuditService auditService) {
        this.attribute = Objects.requireNonNull(attribute, "attribute is required");
        this.generator = Objects.requireNonNull(generator, "generator is required");
        this.metricsService = Objects.requireNonNull(metricsService, "metricsService is required");
        this.auditService = Objects.requireNonNull(auditService, "auditService is required");
    }

    /**
     * Walks the document in pre-order and gives every repeated identity a
     * fresh value. The first occurrence keeps its value.
     *
     * @return number of replaced identities
     */
    public int ensureUniqueIdentities(Document doc) {
        Objects.requireNonNull(doc, "document is required");
        Set<String> seen = new HashSet<>();
        int replaced = 0;

        Deque<Node> stack = new ArrayDeque<>();
        stack.push(doc.getRoot());
        while (!stack.isEmpty()) {
            Node node = stack.pop();
            String current = node.getAttribute(attribute);
            if (current != null) {
                log.trace("Checking identity {}", current);
                if (!seen.add(current)) {
                    String fresh = generator.next();
                    while (seen.contains(fresh)) {
                        fresh = generator.next();
                    }
                    node.setAttribute(attribute, fresh);
                    seen.add(fresh);
                    replaced++;
                    log.debug("Replacing duplicate identity {} of {} with {}", current, node, fresh);
                }
            }
            List<Node> children = node.getChildren();
            for (int i = children.size() - 1; i >= 0; i--) {
                stack.push(children.get(i));
            }
        }

        if (replaced > 0) {
            metricsService.incrementIdentitiesReplaced(replaced);
            auditService.record(AuditAction.IDENTITY_REPLACED, doc.getName(), null, Map.of("count", replaced));
            log.info("identity.duplicates.replaced document={} count={}", doc.getName(), replaced);
        }
        return replaced;
    }

    /**
     * Gives a single node a fresh identity, e.g. after renaming it.
     *
     * @return the new value, or empty when the node carries no identity
     */
    public Optional<String> replaceIdentity(Node node) {
        if (!node.hasAttribute(attribute)) {
            log.warn("Trying to replace {} of {} which has none", attribute, node);
            return Optional.empty();
        }
        String fresh = generator.next();
        log.debug("Replacing {} of {} with {}", attribute, node, fresh);
        node.setAttribute(attribute, fresh);
        metricsService.incrementIdentitiesReplaced(1);
        return Optional.of(fresh);
    }

    public String getAttribute() {
        return attribute;
    }

    public IdentityGenerator getGenerator() {
        return generator;
    }
}
