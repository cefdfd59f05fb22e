package com.document.merge.metrics;

import com.document.merge.merge.MergeMode;

import java.time.Duration;

/**
 * Interface for recording merge metrics.
 * The default {@link NoOpMetricsService} does nothing, so the engine works
 * without any metrics backend on the classpath.
 */
public interface MetricsService {

    void recordExtendDuration(MergeMode mode, Duration duration);

    void incrementNodesAttached(int count);

    void incrementNameClash(MergeMode mode);

    void incrementReferencesRelocated(int count);

    void incrementContainersSynthesized(String tag);

    void incrementIdentitiesReplaced(int count);
}
