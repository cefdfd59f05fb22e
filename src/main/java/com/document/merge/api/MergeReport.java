package com.document.merge.api;

import com.document.merge.audit.MergeRecord;
import com.document.merge.merge.NameClash;
import com.document.merge.packages.MissingPackages.MissingPackage;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Snapshot of a merge run: clashes, missing packages and every extend call.
 */
public record MergeReport(
        String sessionId,
        List<NameClash> strictClashes,
        List<NameClash> gracefulClashes,
        List<MissingPackage> missingPackages,
        List<MergeRecord> merges,
        int auditEntryCount,
        Instant createdAt
) {
    private static final Logger log = LoggerFactory.getLogger(MergeReport.class);
    private static final ObjectMapper MAPPER = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);

    public MergeReport {
        strictClashes = List.copyOf(strictClashes);
        gracefulClashes = List.copyOf(gracefulClashes);
        missingPackages = List.copyOf(missingPackages);
        merges = List.copyOf(merges);
    }

    /**
     * Whether the run must be aborted before the destination is serialized.
     */
    public boolean isAbortRequired() {
        return !strictClashes.isEmpty() || !missingPackages.isEmpty();
    }

    public int totalAttached() {
        return merges.stream().mapToInt(MergeRecord::attachedCount).sum();
    }

    public String toJson() {
        Map<String, Object> json = new LinkedHashMap<>();
        json.put("sessionId", sessionId);
        json.put("createdAt", createdAt.toString());
        json.put("abortRequired", isAbortRequired());
        json.put("totalAttached", totalAttached());
        json.put("auditEntryCount", auditEntryCount);
        json.put("strictClashes", strictClashes.stream().map(MergeReport::clashToMap).toList());
        json.put("gracefulClashes", gracefulClashes.stream().map(MergeReport::clashToMap).toList());
        json.put("missingPackages", missingPackages.stream()
                .map(m -> Map.of("sourceDocument", m.sourceDocument(), "package", m.packageName()))
                .toList());
        json.put("merges", merges.stream().map(MergeReport::recordToMap).toList());
        try {
            return MAPPER.writeValueAsString(json);
        } catch (JsonProcessingException e) {
            log.warn("Failed to serialize merge report {}: {}", sessionId, e.getMessage());
            return "{}";
        }
    }

    private static Map<String, Object> clashToMap(NameClash clash) {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("sourceDocument", clash.sourceDocument());
        map.put("sourceContainer", clash.sourceContainerPath());
        map.put("destinationContainer", clash.destinationContainerPath());
        map.put("mode", clash.mode().name());
        map.put("keys", clash.clashingKeys());
        return map;
    }

    private static Map<String, Object> recordToMap(MergeRecord record) {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("id", record.id());
        map.put("sourceDocument", record.sourceDocument());
        map.put("destinationDocument", record.destinationDocument());
        map.put("sourceContainer", record.sourceContainerPath());
        map.put("destinationContainer", record.destinationContainerPath());
        map.put("mode", record.mode().name());
        map.put("offered", record.sourceCount());
        map.put("attached", record.attachedCount());
        map.put("duplicates", record.duplicateCount());
        map.put("clashingKeys", record.clashingKeys());
        map.put("timestamp", record.timestamp().toString());
        return map;
    }
}
