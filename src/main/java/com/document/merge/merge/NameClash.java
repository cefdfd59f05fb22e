package com.document.merge.merge;

import java.util.List;
import java.util.Objects;

/**
 * One extend call in which source and destination keys collided.
 */
public record NameClash(
        String sourceDocument,
        String sourceContainerPath,
        String destinationContainerPath,
        MergeMode mode,
        List<String> clashingKeys
) {
    public NameClash {
        Objects.requireNonNull(mode, "mode is required");
        clashingKeys = clashingKeys != null ? List.copyOf(clashingKeys) : List.of();
    }

    public String describe() {
        return clashingKeys.size() + " name clashes between " + sourceDocument + ":" + sourceContainerPath
                + " and " + destinationContainerPath + " " + clashingKeys;
    }
}
