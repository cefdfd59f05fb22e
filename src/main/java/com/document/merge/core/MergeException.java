package com.document.merge.core;

/**
 * Base class of every failure raised by the merge engine.
 * All failures are deterministic functions of the input and are never retried.
 */
public class MergeException extends RuntimeException {

    public MergeException(String message) {
        super(message);
    }

    public MergeException(String message, Throwable cause) {
        super(message, cause);
    }
}
