package com.document.merge.audit;

import com.document.merge.merge.MergeMode;

import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.UUID;

/**
 * Immutable record of one extend call.
 *
 * @param sourceCount     number of source nodes offered
 * @param attachedCount   number of nodes actually attached
 * @param duplicateCount  number of source nodes mapped onto existing destination nodes
 * @param clashingKeys    keys present on both sides, sorted
 */
public record MergeRecord(
        String id,
        String sourceDocument,
        String destinationDocument,
        String sourceContainerPath,
        String destinationContainerPath,
        MergeMode mode,
        int sourceCount,
        int attachedCount,
        int duplicateCount,
        List<String> clashingKeys,
        Instant timestamp
) {
    public MergeRecord {
        Objects.requireNonNull(id, "id is required");
        Objects.requireNonNull(destinationDocument, "destinationDocument is required");
        Objects.requireNonNull(mode, "mode is required");
        Objects.requireNonNull(timestamp, "timestamp is required");
        clashingKeys = clashingKeys != null ? List.copyOf(clashingKeys) : List.of();
    }

    public boolean hasClashes() {
        return !clashingKeys.isEmpty();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String id = UUID.randomUUID().toString();
        private String sourceDocument;
        private String destinationDocument;
        private String sourceContainerPath;
        private String destinationContainerPath;
        private MergeMode mode;
        private int sourceCount;
        private int attachedCount;
        private int duplicateCount;
        private List<String> clashingKeys;
        private Instant timestamp = Instant.now();

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder sourceDocument(String sourceDocument) {
            this.sourceDocument = sourceDocument;
            return this;
        }

        public Builder destinationDocument(String destinationDocument) {
            this.destinationDocument = destinationDocument;
            return this;
        }

        public Builder sourceContainerPath(String sourceContainerPath) {
            this.sourceContainerPath = sourceContainerPath;
            return this;
        }

        public Builder destinationContainerPath(String destinationContainerPath) {
            this.destinationContainerPath = destinationContainerPath;
            return this;
        }

        public Builder mode(MergeMode mode) {
            this.mode = mode;
            return this;
        }

        public Builder sourceCount(int sourceCount) {
            this.sourceCount = sourceCount;
            return this;
        }

        public Builder attachedCount(int attachedCount) {
            this.attachedCount = attachedCount;
            return this;
        }

        public Builder duplicateCount(int duplicateCount) {
            this.duplicateCount = duplicateCount;
            return this;
        }

        public Builder clashingKeys(List<String> clashingKeys) {
            this.clashingKeys = clashingKeys;
            return this;
        }

        public Builder timestamp(Instant timestamp) {
            this.timestamp = timestamp;
            return this;
        }

        public MergeRecord build() {
            return new MergeRecord(id, sourceDocument, destinationDocument, sourceContainerPath,
                    destinationContainerPath, mode, sourceCount, attachedCount, duplicateCount,
                    clashingKeys, timestamp);
        }
    }
}
