package com.document.merge.packages;

import java.util.Objects;

/**
 * A top-level package to copy from a source document, with the clash policy
 * that applies to it and its sub-packages.
 */
public record RootPackageSpec(String name, ClashPolicy policy) {

    public RootPackageSpec {
        Objects.requireNonNull(name, "name is required");
        Objects.requireNonNull(policy, "policy is required");
    }

    public static RootPackageSpec of(String name) {
        return new RootPackageSpec(name, ClashPolicy.graceful());
    }

    public static RootPackageSpec of(String name, ClashPolicy policy) {
        return new RootPackageSpec(name, policy);
    }
}
