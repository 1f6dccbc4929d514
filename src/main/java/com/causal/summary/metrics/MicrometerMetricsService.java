package com.causal.summary.metrics;

import com.causal.summary.core.model.MergePhase;
import com.causal.summary.reduce.ReductionStatus;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
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
 *   <li>{@code causal.reduction.duration} — Timer (tag: status)</li>
 *   <li>{@code causal.merges} — Counter (tag: phase)</li>
 *   <li>{@code causal.merge.cost} — DistributionSummary</li>
 *   <li>{@code causal.grounding} — Counter</li>
 *   <li>{@code causal.grounding.edges} — DistributionSummary</li>
 * </ul>
 */
public class MicrometerMetricsService implements MetricsService {

    private final MeterRegistry registry;
    private final Map<ReductionStatus, Timer> timerCache = new ConcurrentHashMap<>();
    private final Map<MergePhase, Counter> mergeCounters = new ConcurrentHashMap<>();
    private final DistributionSummary mergeCostSummary;
    private final Counter groundingCounter;
    private final DistributionSummary groundingEdgesSummary;

    public MicrometerMetricsService(MeterRegistry registry) {
        this.registry = registry;
        this.mergeCostSummary = DistributionSummary.builder("causal.merge.cost")
                .description("Structural cost of accepted merges")
                .register(registry);
        this.groundingCounter = Counter.builder("causal.grounding")
                .description("Number of summary graphs grounded")
                .register(registry);
        this.groundingEdgesSummary = DistributionSummary.builder("causal.grounding.edges")
                .description("Edge count of grounded graphs")
                .register(registry);
    }

    @Override
    public void recordReductionDuration(ReductionStatus status, Duration duration) {
        Timer timer = timerCache.computeIfAbsent(status, s ->
                Timer.builder("causal.reduction.duration")
                        .description("Duration of DAG reductions")
                        .tag("status", s.name())
                        .register(registry));
        timer.record(duration);
    }

    @Override
    public void incrementMerge(MergePhase phase) {
        Counter counter = mergeCounters.computeIfAbsent(phase, p ->
                Counter.builder("causal.merges")
                        .description("Number of accepted node merges")
                        .tag("phase", p.name())
                        .register(registry));
        counter.increment();
    }

    @Override
    public void recordMergeCost(long cost) {
        mergeCostSummary.record(cost);
    }

    @Override
    public void recordGrounding(int groundedEdgeCount) {
        groundingCounter.increment();
        groundingEdgesSummary.record(groundedEdgeCount);
    }
}
