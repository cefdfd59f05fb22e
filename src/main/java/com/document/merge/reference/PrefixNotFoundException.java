package com.document.merge.reference;

import com.document.merge.core.MergeException;

/**
 * Thrown when a prefix substitution targets a reference that does not
 * contain the expected prefix.
 */
public class PrefixNotFoundException extends MergeException {

    private final String referenceText;
    private final String prefix;

    public PrefixNotFoundException(String referenceText, String prefix) {
        super("The path " + referenceText + " does not contain subpath " + prefix);
        this.referenceText = referenceText;
        this.prefix = prefix;
    }

    public String getReferenceText() {
        return referenceText;
    }

    public String getPrefix() {
        return prefix;
    }
}
