package com.causal.summary.reduce;

import com.causal.summary.core.model.CausalDag;
import com.causal.summary.core.model.Cluster;
import com.causal.summary.core.model.MergePhase;
import com.causal.summary.core.model.MergeRecord;
import com.causal.summary.merge.MergeCostModel;
import com.causal.summary.merge.NodeMerger;
import com.causal.summary.merge.PairValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Pre-reduction pass that collapses cheap merges before the greedy loop.
 *
 * Pairs are scanned in enumeration order. The first valid pair whose cost does not
 * exceed the threshold is merged immediately and the scan restarts on the new graph.
 * The pass ends when a full scan finds nothing to merge, or when the graph has shrunk
 * to the floor. Applying the pass to its own output changes nothing.
 */
public class LowCostMerger {
    private static final Logger log = LoggerFactory.getLogger(LowCostMerger.class);

    private final PairValidator validator;
    private final MergeCostModel costModel;
    private final NodeMerger merger;
    private final long threshold;

    public LowCostMerger(PairValidator validator, MergeCostModel costModel, NodeMerger merger, long threshold) {
        this.validator = Objects.requireNonNull(validator, "validator is required");
        this.costModel = Objects.requireNonNull(costModel, "costModel is required");
        this.merger = Objects.requireNonNull(merger, "merger is required");
        if (threshold < 0) {
            throw new IllegalArgumentException("threshold must be non-negative");
        }
        this.threshold = threshold;
    }

    /**
     * Runs the pass until no cheap pair remains.
     */
    public CausalDag apply(CausalDag graph) {
        return apply(graph, 1, record -> { });
    }

    /**
     * Runs the pass without shrinking the graph below {@code floor} nodes.
     *
     * @param listener notified of every accepted merge, in order
     */
    public CausalDag apply(CausalDag graph, int floor, MergeListener listener) {
        Objects.requireNonNull(graph, "graph is required");
        Objects.requireNonNull(listener, "listener is required");

        CausalDag current = graph;
        boolean merged = true;
        while (merged && current.nodeCount() > floor) {
            merged = false;
            List<Cluster> nodes = new ArrayList<>(current.nodes());
            scan:
            for (int i = 0; i < nodes.size(); i++) {
                for (int j = i + 1; j < nodes.size(); j++) {
                    Cluster first = nodes.get(i);
                    Cluster second = nodes.get(j);
                    if (!validator.isValidPair(first, second, current)) {
                        continue;
                    }
                    long cost = costModel.cost(first, second, current);
                    if (cost <= threshold) {
                        current = merger.merge(current, first, second);
                        MergeRecord record = new MergeRecord(first, second, first.concat(second),
                                cost, MergePhase.LOW_COST, current.nodeCount());
                        log.debug("merge.lowCost first={} second={} cost={} nodes={}",
                                first.label(), second.label(), cost, current.nodeCount());
                        listener.onMerge(record);
                        merged = true;
                        break scan;
                    }
                }
            }
        }
        return current;
    }
}
