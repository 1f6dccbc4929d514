package com.causal.summary.reduce;

import com.causal.summary.core.model.Cluster;

import java.util.Objects;

/**
 * A valid pair selected for merging together with its cost.
 */
public record MergeCandidate(Cluster first, Cluster second, long cost) {

    public MergeCandidate {
        Objects.requireNonNull(first, "first is required");
        Objects.requireNonNull(second, "second is required");
    }
}
