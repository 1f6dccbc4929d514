package com.causal.summary.reduce;

import com.causal.summary.core.model.CausalDag;
import com.causal.summary.core.model.MergePhase;
import com.causal.summary.core.model.MergeRecord;

import java.util.List;
import java.util.Objects;

/**
 * Result of a reduction: the summary graph plus the merges that produced it.
 */
public record ReductionResult(
        CausalDag summary,
        List<MergeRecord> merges,
        ReductionStatus status,
        int targetSize,
        int inputNodeCount
) {
    public ReductionResult {
        Objects.requireNonNull(summary, "summary is required");
        Objects.requireNonNull(status, "status is required");
        merges = merges != null ? List.copyOf(merges) : List.of();
    }

    public boolean isTargetReached() {
        return status == ReductionStatus.TARGET_REACHED;
    }

    public boolean isStalled() {
        return status == ReductionStatus.STALLED;
    }

    public int mergeCount() {
        return merges.size();
    }

    /**
     * Number of merges accepted in the given phase.
     */
    public long mergeCount(MergePhase phase) {
        return merges.stream().filter(m -> m.phase() == phase).count();
    }

    public long totalCost() {
        return merges.stream().mapToLong(MergeRecord::cost).sum();
    }

    @Override
    public String toString() {
        return "ReductionResult{" +
                "status=" + status +
                ", nodes=" + inputNodeCount + "->" + summary.nodeCount() +
                ", target=" + targetSize +
                ", merges=" + merges.size() +
                ", totalCost=" + totalCost() +
                '}';
    }
}
