package com.document.merge.path;

import com.document.merge.core.MergeException;

/**
 * Thrown when a node's ancestor chain is broken in a document's parent index,
 * or when a path does not name any node. Always a usage error: the node or
 * one of its ancestors was attached outside the structure primitives.
 */
public class PathResolutionException extends MergeException {

    public PathResolutionException(String message) {
        super(message);
    }
}
