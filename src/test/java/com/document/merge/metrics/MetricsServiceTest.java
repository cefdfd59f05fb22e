package com.document.merge.metrics;

import com.document.merge.merge.MergeMode;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("MetricsService Tests")
class MetricsServiceTest {

    @Nested
    @DisplayName("NoOpMetricsService")
    class NoOpTests {

        @Test
        @DisplayName("All methods should be callable without error")
        void allMethodsCallableWithoutError() {
            NoOpMetricsService noOp = new NoOpMetricsService();

            assertDoesNotThrow(() -> {
                noOp.recordExtendDuration(MergeMode.STRICT, Duration.ofMillis(5));
                noOp.incrementNodesAttached(3);
                noOp.incrementNameClash(MergeMode.GRACEFUL);
                noOp.incrementReferencesRelocated(2);
                noOp.incrementContainersSynthesized("ELEMENTS");
                noOp.incrementIdentitiesReplaced(1);
            });
        }
    }

    @Nested
    @DisplayName("MicrometerMetricsService")
    class MicrometerTests {

        private final SimpleMeterRegistry registry = new SimpleMeterRegistry();
        private final MicrometerMetricsService metrics = new MicrometerMetricsService(registry);

        @Test
        @DisplayName("Should record extend duration per mode")
        void recordExtendDuration() {
            metrics.recordExtendDuration(MergeMode.STRICT, Duration.ofMillis(10));
            metrics.recordExtendDuration(MergeMode.STRICT, Duration.ofMillis(30));
            metrics.recordExtendDuration(MergeMode.GRACEFUL, Duration.ofMillis(5));

            Timer strict = registry.find("merge.extend.duration").tag("mode", "STRICT").timer();
            assertNotNull(strict);
            assertEquals(2, strict.count());
            assertEquals(40.0, strict.totalTime(TimeUnit.MILLISECONDS), 0.001);
            assertEquals(1, registry.find("merge.extend.duration").tag("mode", "GRACEFUL").timer().count());
        }

        @Test
        @DisplayName("Should count attached nodes, relocated references, and replaced identities")
        void plainCounters() {
            metrics.incrementNodesAttached(4);
            metrics.incrementNodesAttached(1);
            metrics.incrementReferencesRelocated(7);
            metrics.incrementIdentitiesReplaced(2);

            assertEquals(5.0, registry.find("merge.nodes.attached").counter().count());
            assertEquals(7.0, registry.find("merge.references.relocated").counter().count());
            assertEquals(2.0, registry.find("merge.identities.replaced").counter().count());
        }

        @Test
        @DisplayName("Should tag clash and synthesis counters")
        void taggedCounters() {
            metrics.incrementNameClash(MergeMode.STRICT);
            metrics.incrementNameClash(MergeMode.STRICT);
            metrics.incrementContainersSynthesized("ELEMENTS");

            Counter clashes = registry.find("merge.clashes").tag("mode", "STRICT").counter();
            assertNotNull(clashes);
            assertEquals(2.0, clashes.count());
            assertNull(registry.find("merge.clashes").tag("mode", "GRACEFUL").counter());
            assertEquals(1.0, registry.find("merge.containers.synthesized")
                    .tag("container", "ELEMENTS").counter().count());
        }
    }
}
