package com.document.merge.merge;

import com.document.merge.audit.MergeRecord;
import com.document.merge.core.model.Document;

/**
 * Listener for document mutations. Implementations react to merges,
 * e.g. by invalidating cached paths.
 */
public interface MergeListener {

    /**
     * Called after nodes were attached, inserted, detached or renamed in the document.
     */
    void onStructureChanged(Document document);

    /**
     * Called after an extend call completed.
     */
    default void onMerge(MergeRecord mergeRecord) {
    }
}
