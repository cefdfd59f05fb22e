package com.document.merge.audit;

import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * Immutable record of an auditable mutation.
 *
 * @param document the document that was changed
 * @param target   path or tag of the changed node, when known
 */
public record AuditEntry(
        String id,
        AuditAction action,
        String document,
        String target,
        Map<String, Object> details,
        Instant timestamp
) {
    public AuditEntry {
        Objects.requireNonNull(id, "id is required");
        Objects.requireNonNull(action, "action is required");
        Objects.requireNonNull(timestamp, "timestamp is required");
        details = details != null ? Map.copyOf(details) : Map.of();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String id = UUID.randomUUID().toString();
        private AuditAction action;
        private String document;
        private String target;
        private Map<String, Object> details;
        private Instant timestamp = Instant.now();

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder action(AuditAction action) {
            this.action = action;
            return this;
        }

        public Builder document(String document) {
            this.document = document;
            return this;
        }

        public Builder target(String target) {
            this.target = target;
            return this;
        }

        public Builder details(Map<String, Object> details) {
            this.details = details;
            return this;
        }

        public Builder timestamp(Instant timestamp) {
            this.timestamp = timestamp;
            return this;
        }

        public AuditEntry build() {
            return new AuditEntry(id, action, document, target, details, timestamp);
        }
    }
}
