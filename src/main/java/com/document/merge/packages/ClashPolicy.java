package com.document.merge.packages;

import com.document.merge.merge.MergeMode;

import java.util.Arrays;
import java.util.Set;

/**
 * Chooses the merge mode for the elements of each copied package.
 */
public final class ClashPolicy {
    private final boolean allGraceful;
    private final Set<String> gracefulPackages;

    private ClashPolicy(boolean allGraceful, Set<String> gracefulPackages) {
        this.allGraceful = allGraceful;
        this.gracefulPackages = Set.copyOf(gracefulPackages);
    }

    /**
     * Every package graceful. Used when no package list is given.
     */
    public static ClashPolicy graceful() {
        return new ClashPolicy(true, Set.of());
    }

    public static ClashPolicy strict() {
        return new ClashPolicy(false, Set.of());
    }

    /**
     * Graceful for the named packages, strict for all others. An empty list
     * means no restriction and yields {@link #graceful()}.
     */
    public static ClashPolicy gracefulFor(String... packageNames) {
        if (packageNames.length == 0) {
            return graceful();
        }
        return new ClashPolicy(false, Set.copyOf(Arrays.asList(packageNames)));
    }

    public MergeMode modeFor(String packageName) {
        return allGraceful || gracefulPackages.contains(packageName) ? MergeMode.GRACEFUL : MergeMode.STRICT;
    }

    @Override
    public String toString() {
        if (allGraceful) {
            return "ClashPolicy{graceful}";
        }
        return gracefulPackages.isEmpty() ? "ClashPolicy{strict}" : "ClashPolicy{gracefulFor=" + gracefulPackages + '}';
    }
}
