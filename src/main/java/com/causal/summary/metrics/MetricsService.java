package com.causal.summary.metrics;

import com.causal.summary.core.model.MergePhase;
import com.causal.summary.reduce.ReductionStatus;

import java.time.Duration;

/**
 * Interface for recording summarization metrics.
 * Implementations can integrate with Micrometer, Prometheus, or other metrics systems.
 * The default {@link NoOpMetricsService} does nothing, so the library works
 * without any metrics backend configured.
 */
public interface MetricsService {

    void recordReductionDuration(ReductionStatus status, Duration duration);

    void incrementMerge(MergePhase phase);

    void recordMergeCost(long cost);

    void recordGrounding(int groundedEdgeCount);
}
