package com.causal.summary.core.model;

import java.util.Objects;

/**
 * Unweighted directed edge between two DAG nodes.
 */
public record Edge(Cluster source, Cluster target) {

    public Edge {
        Objects.requireNonNull(source, "source is required");
        Objects.requireNonNull(target, "target is required");
    }

    @Override
    public String toString() {
        return source.label() + " -> " + target.label();
    }
}
