package com.document.merge.metrics;

import com.document.merge.merge.MergeMode;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Micrometer-based implementation of {@link MetricsService}.
 *
 * <p>Recorded metrics:</p>
 * <ul>
 *   <li>{@code merge.extend.duration} Timer (tag: mode)</li>
 *   <li>{@code merge.nodes.attached} Counter</li>
 *   <li>{@code merge.clashes} Counter (tag: mode)</li>
 *   <li>{@code merge.references.relocated} Counter</li>
 *   <li>{@code merge.containers.synthesized} Counter (tag: container)</li>
 *   <li>{@code merge.identities.replaced} Counter</li>
 * </ul>
 */
public class MicrometerMetricsService implements MetricsService {

    private final MeterRegistry registry;
    private final Map<String, Timer> timerCache = new ConcurrentHashMap<>();
    private final Map<String, Counter> counterCache = new ConcurrentHashMap<>();
    private final Counter nodesAttachedCounter;
    private final Counter referencesRelocatedCounter;
    private final Counter identitiesReplacedCounter;

    public MicrometerMetricsService(MeterRegistry registry) {
        this.registry = registry;
        this.nodesAttachedCounter = Counter.builder("merge.nodes.attached")
                .description("Number of nodes attached to destination documents")
                .register(registry);
        this.referencesRelocatedCounter = Counter.builder("merge.references.relocated")
                .description("Number of reference fields rewritten")
                .register(registry);
        this.identitiesReplacedCounter = Counter.builder("merge.identities.replaced")
                .description("Number of duplicate identities replaced")
                .register(registry);
    }

    @Override
    public void recordExtendDuration(MergeMode mode, Duration duration) {
        Timer timer = timerCache.computeIfAbsent(mode.name(), k ->
                Timer.builder("merge.extend.duration")
                        .description("Duration of extend operations")
                        .tag("mode", mode.name())
                        .register(registry));
        timer.record(duration);
    }

    @Override
    public void incrementNodesAttached(int count) {
        nodesAttachedCounter.increment(count);
    }

    @Override
    public void incrementNameClash(MergeMode mode) {
        counter("clash:" + mode.name(), "merge.clashes", "Number of extend calls with name clashes",
                "mode", mode.name()).increment();
    }

    @Override
    public void incrementReferencesRelocated(int count) {
        referencesRelocatedCounter.increment(count);
    }

    @Override
    public void incrementContainersSynthesized(String tag) {
        counter("synthesized:" + tag, "merge.containers.synthesized", "Number of containers synthesized",
                "container", tag).increment();
    }

    @Override
    public void incrementIdentitiesReplaced(int count) {
        identitiesReplacedCounter.increment(count);
    }

    private Counter counter(String key, String name, String description, String tagKey, String tagValue) {
        return counterCache.computeIfAbsent(key, k ->
                Counter.builder(name)
                        .description(description)
                        .tag(tagKey, tagValue)
                        .register(registry));
    }
}
