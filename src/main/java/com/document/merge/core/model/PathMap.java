package com.document.merge.core.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Mapping from pre-merge absolute paths to post-merge absolute paths.
 * Insertion ordered. Produced by every extend call; callers running several
 * related merges accumulate maps with {@link #putAll(PathMap)}.
 */
public final class PathMap {
    private final Map<String, String> mappings = new LinkedHashMap<>();

    public static PathMap empty() {
        return new PathMap();
    }

    public static PathMap of(Map<String, String> mappings) {
        PathMap map = new PathMap();
        mappings.forEach(map::put);
        return map;
    }

    public PathMap put(String oldPath, String newPath) {
        Objects.requireNonNull(oldPath, "oldPath is required");
        Objects.requireNonNull(newPath, "newPath is required");
        mappings.put(oldPath, newPath);
        return this;
    }

    public PathMap putAll(PathMap other) {
        mappings.putAll(other.mappings);
        return this;
    }

    public Optional<String> lookup(String oldPath) {
        return Optional.ofNullable(mappings.get(oldPath));
    }

    public boolean containsKey(String oldPath) {
        return mappings.containsKey(oldPath);
    }

    public int size() {
        return mappings.size();
    }

    public boolean isEmpty() {
        return mappings.isEmpty();
    }

    public Map<String, String> asMap() {
        return Collections.unmodifiableMap(mappings);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return mappings.equals(((PathMap) o).mappings);
    }

    @Override
    public int hashCode() {
        return mappings.hashCode();
    }

    @Override
    public String toString() {
        return "PathMap" + mappings;
    }
}
