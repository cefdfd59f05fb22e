package com.document.merge.packages;

import com.document.merge.core.MergeException;

/**
 * Thrown when a package node does not have the
 * {@code SHORT-NAME, ELEMENTS[, AR-PACKAGES]} shape.
 */
public class InvalidPackageStructureException extends MergeException {

    public InvalidPackageStructureException(String message) {
        super(message);
    }
}
