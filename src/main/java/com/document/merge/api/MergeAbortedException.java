package com.document.merge.api;

import com.document.merge.core.MergeException;

import java.util.List;

/**
 * Run-level abort: the destination must not be serialized.
 */
public class MergeAbortedException extends MergeException {

    private final List<String> reasons;

    public MergeAbortedException(List<String> reasons) {
        super("Merge aborted: " + String.join("; ", reasons));
        this.reasons = List.copyOf(reasons);
    }

    public List<String> getReasons() {
        return reasons;
    }
}
