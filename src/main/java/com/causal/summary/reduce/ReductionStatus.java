package com.causal.summary.reduce;

/**
 * Outcome of a reduction run.
 */
public enum ReductionStatus {
    /**
     * The summary has exactly the requested number of nodes.
     */
    TARGET_REACHED,

    /**
     * No valid pair remained before the target was reached; the summary has more nodes than requested.
     */
    STALLED
}
