package com.causal.summary.metrics;

import com.causal.summary.core.model.MergePhase;
import com.causal.summary.reduce.ReductionStatus;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;

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
                noOp.recordReductionDuration(ReductionStatus.STALLED, Duration.ofMillis(10));
                noOp.incrementMerge(MergePhase.GREEDY);
                noOp.recordMergeCost(4);
                noOp.recordGrounding(12);
            });
        }
    }

    @Nested
    @DisplayName("MicrometerMetricsService")
    class MicrometerTests {

        private final SimpleMeterRegistry registry = new SimpleMeterRegistry();
        private final MicrometerMetricsService metrics = new MicrometerMetricsService(registry);

        @Test
        @DisplayName("Should record reduction duration per status")
        void recordReductionDuration() {
            metrics.recordReductionDuration(ReductionStatus.TARGET_REACHED, Duration.ofMillis(15));
            metrics.recordReductionDuration(ReductionStatus.TARGET_REACHED, Duration.ofMillis(25));
            metrics.recordReductionDuration(ReductionStatus.STALLED, Duration.ofMillis(5));

            Timer reached = registry.find("causal.reduction.duration").tag("status", "TARGET_REACHED").timer();
            Timer stalled = registry.find("causal.reduction.duration").tag("status", "STALLED").timer();

            assertNotNull(reached);
            assertEquals(2, reached.count());
            assertNotNull(stalled);
            assertEquals(1, stalled.count());
        }

        @Test
        @DisplayName("Should count merges per phase")
        void incrementMerge() {
            metrics.incrementMerge(MergePhase.LOW_COST);
            metrics.incrementMerge(MergePhase.LOW_COST);
            metrics.incrementMerge(MergePhase.GREEDY);

            Counter lowCost = registry.find("causal.merges").tag("phase", "LOW_COST").counter();
            Counter greedy = registry.find("causal.merges").tag("phase", "GREEDY").counter();

            assertNotNull(lowCost);
            assertEquals(2.0, lowCost.count());
            assertNotNull(greedy);
            assertEquals(1.0, greedy.count());
        }

        @Test
        @DisplayName("Should record merge costs")
        void recordMergeCost() {
            metrics.recordMergeCost(0);
            metrics.recordMergeCost(3);

            DistributionSummary summary = registry.find("causal.merge.cost").summary();

            assertNotNull(summary);
            assertEquals(2, summary.count());
            assertEquals(3.0, summary.totalAmount());
        }

        @Test
        @DisplayName("Should count groundings and their edge counts")
        void recordGrounding() {
            metrics.recordGrounding(6);
            metrics.recordGrounding(4);

            Counter counter = registry.find("causal.grounding").counter();
            DistributionSummary edges = registry.find("causal.grounding.edges").summary();

            assertNotNull(counter);
            assertEquals(2.0, counter.count());
            assertNotNull(edges);
            assertEquals(10.0, edges.totalAmount());
        }
    }
}
