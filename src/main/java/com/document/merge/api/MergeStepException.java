package com.document.merge.api;

import com.document.merge.core.MergeException;

/**
 * Wraps a fatal failure with the source document and the logical step that
 * was being merged when it happened.
 */
public class MergeStepException extends MergeException {

    private final String sourceDocument;
    private final String step;

    public MergeStepException(String sourceDocument, String step, Throwable cause) {
        super("Merging " + step + " from " + sourceDocument + " failed: " + cause.getMessage(), cause);
        this.sourceDocument = sourceDocument;
        this.step = step;
    }

    public String getSourceDocument() {
        return sourceDocument;
    }

    public String getStep() {
        return step;
    }
}
