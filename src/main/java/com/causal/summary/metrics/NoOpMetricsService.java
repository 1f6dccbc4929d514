package com.causal.summary.metrics;

import com.causal.summary.core.model.MergePhase;
import com.causal.summary.reduce.ReductionStatus;

import java.time.Duration;

/**
 * No-op implementation of {@link MetricsService}.
 */
public class NoOpMetricsService implements MetricsService {

    @Override
    public void recordReductionDuration(ReductionStatus status, Duration duration) {
    }

    @Override
    public void incrementMerge(MergePhase phase) {
    }

    @Override
    public void recordMergeCost(long cost) {
    }

    @Override
    public void recordGrounding(int groundedEdgeCount) {
    }
}
