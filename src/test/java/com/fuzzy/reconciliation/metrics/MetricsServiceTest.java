package com.fuzzy.reconciliation.metrics;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class MetricsServiceTest {

    @Nested
    @DisplayName("NoOpMetricsService")
    class NoOpTests {

        @Test
        @DisplayName("Should accept every call without side effects")
        void testNoOp() {
            NoOpMetricsService metrics = new NoOpMetricsService();
            assertDoesNotThrow(() -> {
                metrics.recordBatchDuration(Duration.ofMillis(5), true);
                metrics.recordBatchSize(3);
                metrics.recordRegionSize(4);
                metrics.incrementPairsAdded(1);
                metrics.incrementPairsRemoved(1);
                metrics.recordMatchConfidence(0.9);
                metrics.incrementFanOutExceeded();
                metrics.incrementMalformedPair();
                metrics.incrementBatchRejected();
                metrics.recordCacheHit();
                metrics.recordCacheMiss();
            });
        }
    }

    @Nested
    @DisplayName("MicrometerMetricsService")
    class MicrometerTests {

        private SimpleMeterRegistry registry;
        private MicrometerMetricsService metrics;

        @BeforeEach
        void setUp() {
            registry = new SimpleMeterRegistry();
            metrics = new MicrometerMetricsService(registry);
        }

        @Test
        @DisplayName("Should time batches by outcome")
        void testBatchDuration() {
            metrics.recordBatchDuration(Duration.ofMillis(10), true);
            metrics.recordBatchDuration(Duration.ofMillis(20), true);
            metrics.recordBatchDuration(Duration.ofMillis(5), false);

            assertEquals(2, registry.get("reconciliation.batch.duration").tag("outcome", "applied").timer().count());
            assertEquals(1, registry.get("reconciliation.batch.duration").tag("outcome", "rejected").timer().count());
        }

        @Test
        @DisplayName("Should record batch and region sizes")
        void testSizes() {
            metrics.recordBatchSize(12);
            metrics.recordRegionSize(4);
            metrics.recordMatchConfidence(0.75);

            assertEquals(12.0, registry.get("reconciliation.batch.size").summary().totalAmount());
            assertEquals(4.0, registry.get("reconciliation.region.size").summary().totalAmount());
            assertEquals(0.75, registry.get("reconciliation.match.confidence").summary().max());
        }

        @Test
        @DisplayName("Should count pair and batch events")
        void testCounters() {
            metrics.incrementPairsAdded(3);
            metrics.incrementPairsRemoved(2);
            metrics.incrementFanOutExceeded();
            metrics.incrementMalformedPair();
            metrics.incrementMalformedPair();
            metrics.incrementBatchRejected();
            metrics.recordCacheHit();
            metrics.recordCacheMiss();

            assertEquals(3.0, registry.get("reconciliation.pairs.added").counter().count());
            assertEquals(2.0, registry.get("reconciliation.pairs.removed").counter().count());
            assertEquals(1.0, registry.get("reconciliation.fanout.exceeded").counter().count());
            assertEquals(2.0, registry.get("reconciliation.pairs.malformed").counter().count());
            assertEquals(1.0, registry.get("reconciliation.batch.rejected").counter().count());
            assertEquals(1.0, registry.get("reconciliation.cache.hit").counter().count());
            assertEquals(1.0, registry.get("reconciliation.cache.miss").counter().count());
        }
    }
}
