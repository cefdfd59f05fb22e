package com.document.merge.merge;

/**
 * How an extend call reacts to keys present on both sides.
 */
public enum MergeMode {
    /**
     * Attach nothing from the call and record a run-aborting clash.
     */
    STRICT,

    /**
     * Attach only the non-clashing source nodes and record a warning-level clash.
     */
    GRACEFUL
}
