package com.document.merge.merge;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.function.Consumer;
import java.util.function.Supplier;

/**
 * Compensating transaction for multi-step structural merges.
 * Undo actions run in reverse order if a step fails or the transaction
 * closes without {@link #markSuccess()}.
 *
 * <pre>
 * try (MergeTransaction tx = new MergeTransaction()) {
 *     Node pkg = tx.execute("create package Pdu",
 *             () -> createPackage(...),
 *             created -> enforcer.detach(created, dstDoc));
 *     tx.execute("extend Pdu elements",
 *             () -> engine.extend(...),
 *             map -> detachAdded(...));
 *     tx.markSuccess();
 * }
 * </pre>
 */
public class MergeTransaction implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(MergeTransaction.class);

    private final Deque<CompensatingAction> compensationStack = new ArrayDeque<>();
    private boolean success = false;
    private boolean closed = false;

    /**
     * Runs a step that produces a value and registers its undo action.
     * On failure, earlier undo actions run and the exception is rethrown.
     */
    public <T> T execute(String description, Supplier<T> operation, Consumer<T> compensation) {
        ensureOpen();
        try {
            log.debug("Executing merge step: {}", description);
            T result = operation.get();
            compensationStack.push(new CompensatingAction(description, () -> compensation.accept(result)));
            return result;
        } catch (RuntimeException e) {
            log.warn("Merge step '{}' failed: {}. Running compensations.", description, e.getMessage());
            runCompensations();
            throw e;
        }
    }

    /**
     * Runs a step without undo action, e.g. one whose effects are recorded
     * elsewhere and cannot be taken back.
     */
    public <T> T run(String description, Supplier<T> operation) {
        ensureOpen();
        try {
            log.debug("Executing merge step (no compensation): {}", description);
            return operation.get();
        } catch (RuntimeException e) {
            log.warn("Merge step '{}' failed: {}. Running compensations.", description, e.getMessage());
            runCompensations();
            throw e;
        }
    }

    public void markSuccess() {
        this.success = true;
    }

    public boolean isSuccess() {
        return success;
    }

    @Override
    public void close() {
        if (!closed && !success) {
            log.warn("MergeTransaction closed without success - running compensations");
            runCompensations();
        }
        closed = true;
    }

    private void ensureOpen() {
        if (closed) {
            throw new IllegalStateException("Transaction is already closed");
        }
    }

    private void runCompensations() {
        while (!compensationStack.isEmpty()) {
            CompensatingAction action = compensationStack.pop();
            try {
                log.debug("Running compensation: {}", action.description());
                action.compensation().run();
            } catch (RuntimeException e) {
                // remaining compensations still run
                log.error("Compensation '{}' failed (best-effort): {}", action.description(), e.getMessage());
            }
        }
    }

    private record CompensatingAction(String description, Runnable compensation) {}
}
