package com.causal.summary.reduce;

import com.causal.summary.core.model.MergeRecord;

/**
 * Listener for merges accepted during a reduction.
 */
@FunctionalInterface
public interface MergeListener {

    /**
     * Called after a merge has been applied to the working graph.
     */
    void onMerge(MergeRecord record);
}
