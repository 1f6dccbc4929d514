package com.causal.summary.merge;

/**
 * How the acyclicity check treats a direct edge between the two nodes of a candidate pair.
 */
public enum AdjacencyPolicy {
    /**
     * A direct edge becomes internal to the merged cluster and is dropped.
     * Only a path through some third node makes the pair invalid.
     */
    ALLOW_ADJACENT,

    /**
     * A direct edge would become a self-loop on the merged node, which counts as a
     * cycle, so adjacent nodes are never merged.
     */
    REJECT_ADJACENT
}
