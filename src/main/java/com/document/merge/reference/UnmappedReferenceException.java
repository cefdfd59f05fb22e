package com.document.merge.reference;

import com.document.merge.core.MergeException;

import java.util.List;

/**
 * Thrown by a strict exact relocation when references are not keys of the path map.
 */
public class UnmappedReferenceException extends MergeException {

    private final List<String> unmappedPaths;

    public UnmappedReferenceException(List<String> unmappedPaths) {
        super("Paths not found in the provided path map: " + unmappedPaths);
        this.unmappedPaths = List.copyOf(unmappedPaths);
    }

    public List<String> getUnmappedPaths() {
        return unmappedPaths;
    }
}
