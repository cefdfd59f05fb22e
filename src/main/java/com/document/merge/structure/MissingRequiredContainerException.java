package com.document.merge.structure;

import com.document.merge.core.MergeException;

/**
 * Thrown when a container the destination must already have is absent and
 * cannot be synthesized.
 */
public class MissingRequiredContainerException extends MergeException {

    private final String containerTag;

    public MissingRequiredContainerException(String containerTag, String parentDescription) {
        super("Required container " + containerTag + " is missing in " + parentDescription);
        this.containerTag = containerTag;
    }

    public String getContainerTag() {
        return containerTag;
    }
}
