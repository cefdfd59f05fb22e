package com.document.merge.metrics;

import com.document.merge.merge.MergeMode;

import java.time.Duration;

/**
 * No-op implementation of {@link MetricsService}.
 */
public class NoOpMetricsService implements MetricsService {

    @Override
    public void recordExtendDuration(MergeMode mode, Duration duration) {
    }

    @Override
    public void incrementNodesAttached(int count) {
    }

    @Override
    public void incrementNameClash(MergeMode mode) {
    }

    @Override
    public void incrementReferencesRelocated(int count) {
    }

    @Override
    public void incrementContainersSynthesized(String tag) {
    }

    @Override
    public void incrementIdentitiesReplaced(int count) {
    }
}
