package com.causal.summary.core.model;

import java.util.Objects;

/**
 * Immutable record of one accepted merge during a reduction.
 *
 * @param first       node whose members come first in the merged cluster
 * @param second      node whose members follow
 * @param merged      resulting cluster node
 * @param cost        structural cost of the merge against the graph it was applied to
 * @param phase       phase that accepted the merge
 * @param nodesAfter  node count of the graph after the merge
 */
public record MergeRecord(
        Cluster first,
        Cluster second,
        Cluster merged,
        long cost,
        MergePhase phase,
        int nodesAfter
) {
    public MergeRecord {
        Objects.requireNonNull(first, "first is required");
        Objects.requireNonNull(second, "second is required");
        Objects.requireNonNull(merged, "merged is required");
        Objects.requireNonNull(phase, "phase is required");
        if (cost < 0) {
            throw new IllegalArgumentException("cost must be non-negative");
        }
    }
}
