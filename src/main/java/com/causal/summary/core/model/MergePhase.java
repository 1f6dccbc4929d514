package com.causal.summary.core.model;

/**
 * Reduction phase in which a merge was accepted.
 */
public enum MergePhase {
    /**
     * Pre-reduction pass that collapses pairs whose cost does not exceed the low-cost threshold.
     */
    LOW_COST,

    /**
     * Main greedy loop that merges the minimum-cost valid pair.
     */
    GREEDY
}
