package com.document.merge.merge;

import com.document.merge.core.model.Document;
import com.document.merge.core.model.Node;
import com.document.merge.path.PathResolver;
import com.document.merge.structure.StructureEnforcer;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the compensating merge transaction.
 */
class MergeTransactionTest {

    @Test
    void successfulTransaction_noCompensationsRun() {
        List<String> log = new ArrayList<>();

        try (MergeTransaction tx = new MergeTransaction()) {
            tx.execute("step1", () -> log.add("op1"), r -> log.add("comp1"));
            tx.execute("step2", () -> log.add("op2"), r -> log.add("comp2"));
            tx.markSuccess();
        }

        assertEquals(List.of("op1", "op2"), log);
    }

    @Test
    void failedStep_runsCompensationsInReverse() {
        List<String> log = new ArrayList<>();

        assertThrows(IllegalStateException.class, () -> {
            try (MergeTransaction tx = new MergeTransaction()) {
                tx.execute("step1", () -> log.add("op1"), r -> log.add("comp1"));
                tx.execute("step2", () -> log.add("op2"), r -> log.add("comp2"));
                tx.execute("step3", () -> {
                    throw new IllegalStateException("step3 failed");
                }, r -> log.add("comp3"));
            }
        });

        assertEquals(List.of("op1", "op2", "comp2", "comp1"), log);
    }

    @Test
    void closedWithoutSuccess_runsAllCompensations() {
        List<String> log = new ArrayList<>();

        MergeTransaction tx = new MergeTransaction();
        tx.execute("step1", () -> log.add("op1"), r -> log.add("comp1"));
        tx.execute("step2", () -> log.add("op2"), r -> log.add("comp2"));
        tx.close();

        assertEquals(List.of("op1", "op2", "comp2", "comp1"), log);
    }

    @Test
    void run_registersNoCompensation() {
        List<String> log = new ArrayList<>();

        try (MergeTransaction tx = new MergeTransaction()) {
            tx.execute("step1", () -> log.add("op1"), r -> log.add("comp1"));
            tx.run("step2", () -> log.add("op2"));
        }

        assertEquals(List.of("op1", "op2", "comp1"), log);
    }

    @Test
    void compensationReceivesStepResult() {
        Node parent = Node.of("AR-PACKAGES");
        Document doc = Document.of("d", Node.of("AUTOSAR").addChild(parent));
        StructureEnforcer enforcer = new StructureEnforcer(new PathResolver());

        try (MergeTransaction tx = new MergeTransaction()) {
            tx.execute("create package",
                    () -> enforcer.attach(parent, Node.named("AR-PACKAGE", "New"), doc).get(0),
                    created -> enforcer.detach(created, doc));
        }

        assertEquals(0, parent.childCount());
    }

    @Test
    void compensationFailure_continuesRemainingCompensations() {
        List<String> log = new ArrayList<>();

        MergeTransaction tx = new MergeTransaction();
        tx.execute("step1", () -> log.add("op1"), r -> log.add("comp1"));
        tx.execute("step2", () -> log.add("op2"), r -> {
            throw new RuntimeException("compensation failed");
        });
        tx.execute("step3", () -> log.add("op3"), r -> log.add("comp3"));
        tx.close();

        assertEquals(List.of("op1", "op2", "op3", "comp3", "comp1"), log);
    }

    @Test
    void isSuccess_reflectsState() {
        MergeTransaction tx = new MergeTransaction();
        assertFalse(tx.isSuccess());
        tx.markSuccess();
        assertTrue(tx.isSuccess());
        tx.close();
    }

    @Test
    void executeAfterClose_throwsIllegalState() {
        MergeTransaction tx = new MergeTransaction();
        tx.markSuccess();
        tx.close();

        assertThrows(IllegalStateException.class, () -> tx.run("step", () -> 1));
    }
}
