package com.document.merge.audit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.stream.Collectors;

/**
 * Ledger of every extend call made during a run, used to report which source
 * document and container each merge touched. Records are only appended, or
 * truncated when a package copy rolls back.
 */
public class MergeLedger {
    private static final Logger log = LoggerFactory.getLogger(MergeLedger.class);

    private final List<MergeRecord> records = new CopyOnWriteArrayList<>();

    public MergeRecord record(MergeRecord mergeRecord) {
        records.add(mergeRecord);
        log.debug("Merge recorded: {}:{} -> {}:{} (attached: {}, clashes: {})",
                mergeRecord.sourceDocument(), mergeRecord.sourceContainerPath(),
                mergeRecord.destinationDocument(), mergeRecord.destinationContainerPath(),
                mergeRecord.attachedCount(), mergeRecord.clashingKeys());
        return mergeRecord;
    }

    public List<MergeRecord> getAllRecords() {
        return Collections.unmodifiableList(new ArrayList<>(records));
    }

    public List<MergeRecord> getRecordsForSource(String sourceDocument) {
        return records.stream()
                .filter(r -> sourceDocument.equals(r.sourceDocument()))
                .collect(Collectors.toList());
    }

    public List<MergeRecord> getRecordsForContainer(String destinationContainerPath) {
        return records.stream()
                .filter(r -> destinationContainerPath.equals(r.destinationContainerPath()))
                .collect(Collectors.toList());
    }

    public List<MergeRecord> getRecordsWithClashes() {
        return records.stream()
                .filter(MergeRecord::hasClashes)
                .collect(Collectors.toList());
    }

    /**
     * Total number of nodes attached across all recorded merges.
     */
    public int totalAttached() {
        return records.stream().mapToInt(MergeRecord::attachedCount).sum();
    }

    public int size() {
        return records.size();
    }

    /**
     * Drops the records written after the ledger held {@code size} records.
     * Used to undo the bookkeeping of a copy that was rolled back.
     */
    public void truncate(int size) {
        if (size < 0) {
            throw new IllegalArgumentException("size must not be negative: " + size);
        }
        int dropped = 0;
        while (records.size() > size) {
            records.remove(records.size() - 1);
            dropped++;
        }
        if (dropped > 0) {
            log.debug("Merge ledger truncated to {} records ({} dropped)", size, dropped);
        }
    }

    public void clear() {
        records.clear();
    }
}
