package com.document.merge.audit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.stream.Collectors;

/**
 * Append-only trail of the mutations made while merging.
 */
public class AuditService {
    private static final Logger log = LoggerFactory.getLogger(AuditService.class);

    private final List<AuditEntry> entries = new CopyOnWriteArrayList<>();

    public AuditEntry record(AuditEntry entry) {
        entries.add(entry);
        log.debug("Audit entry recorded: {} in {} at {}", entry.action(), entry.document(), entry.target());
        return entry;
    }

    public AuditEntry record(AuditAction action, String document, String target, Map<String, Object> details) {
        return record(AuditEntry.builder()
                .action(action)
                .document(document)
                .target(target)
                .details(details)
                .build());
    }

    public AuditEntry record(AuditAction action, String document, String target) {
        return record(action, document, target, null);
    }

    public List<AuditEntry> getAllEntries() {
        return Collections.unmodifiableList(new ArrayList<>(entries));
    }

    public List<AuditEntry> getEntriesForDocument(String document) {
        return entries.stream()
                .filter(e -> document.equals(e.document()))
                .collect(Collectors.toList());
    }

    public List<AuditEntry> getEntriesByAction(AuditAction action) {
        return entries.stream()
                .filter(e -> e.action() == action)
                .collect(Collectors.toList());
    }

    public int size() {
        return entries.size();
    }

    /**
     * Drops every entry. Called when a run is reset.
     */
    public void clear() {
        entries.clear();
    }
}
