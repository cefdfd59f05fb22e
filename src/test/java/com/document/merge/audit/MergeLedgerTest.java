package com.document.merge.audit;

import com.document.merge.merge.MergeMode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("MergeLedger Tests")
class MergeLedgerTest {

    private MergeLedger ledger;

    @BeforeEach
    void setUp() {
        ledger = new MergeLedger();
    }

    private MergeRecord merge(String source, String container, int attached, List<String> clashes) {
        return MergeRecord.builder()
                .sourceDocument(source)
                .destinationDocument("Com.arxml")
                .sourceContainerPath("/Src")
                .destinationContainerPath(container)
                .mode(MergeMode.GRACEFUL)
                .sourceCount(attached + clashes.size())
                .attachedCount(attached)
                .duplicateCount(clashes.size())
                .clashingKeys(clashes)
                .build();
    }

    @Test
    @DisplayName("Should record and query merges")
    void recordAndQuery() {
        ledger.record(merge("EthDp.arxml", "/Com/Pdus", 3, List.of()));
        ledger.record(merge("EthDp.arxml", "/Com/Signals", 1, List.of("S1")));
        ledger.record(merge("Can.arxml", "/Com/Pdus", 2, List.of()));

        assertEquals(3, ledger.size());
        assertEquals(2, ledger.getRecordsForSource("EthDp.arxml").size());
        assertEquals(2, ledger.getRecordsForContainer("/Com/Pdus").size());
        assertEquals(List.of("S1"), ledger.getRecordsWithClashes().get(0).clashingKeys());
        assertEquals(6, ledger.totalAttached());
    }

    @Test
    @DisplayName("Builder should fill id and timestamp, and require the mode")
    void builderDefaults() {
        MergeRecord record = merge("EthDp.arxml", "/Com", 0, List.of());
        assertNotNull(record.id());
        assertNotNull(record.timestamp());
        assertFalse(record.hasClashes());

        assertThrows(NullPointerException.class, () -> MergeRecord.builder()
                .destinationDocument("Com.arxml").build());
    }

    @Test
    @DisplayName("clear should empty the ledger")
    void clear() {
        ledger.record(merge("EthDp.arxml", "/Com", 1, List.of()));
        ledger.clear();
        assertEquals(0, ledger.size());
        assertTrue(ledger.getAllRecords().isEmpty());
    }

    @Test
    @DisplayName("truncate should drop only the records written after the mark")
    void truncate() {
        ledger.record(merge("EthDp.arxml", "/Com", 1, List.of()));
        int mark = ledger.size();
        ledger.record(merge("EthDp.arxml", "/Com/Pdus", 2, List.of()));
        ledger.record(merge("EthDp.arxml", "/Com/Signals", 3, List.of()));

        ledger.truncate(mark);

        assertEquals(1, ledger.size());
        assertEquals("/Com", ledger.getAllRecords().get(0).destinationContainerPath());
        ledger.truncate(5);
        assertEquals(1, ledger.size());
        assertThrows(IllegalArgumentException.class, () -> ledger.truncate(-1));
    }
}
