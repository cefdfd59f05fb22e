package com.document.merge.merge;

import com.document.merge.core.MergeException;

import java.util.List;

/**
 * Thrown when two source nodes of one extend call share a key.
 */
public class DuplicateSourceKeyException extends MergeException {

    private final List<String> duplicateKeys;

    public DuplicateSourceKeyException(String sourceDocument, List<String> duplicateKeys) {
        super("Source nodes of " + sourceDocument + " share keys " + duplicateKeys);
        this.duplicateKeys = List.copyOf(duplicateKeys);
    }

    public List<String> getDuplicateKeys() {
        return duplicateKeys;
    }
}
