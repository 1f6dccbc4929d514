package com.causal.summary.merge;

import com.causal.summary.core.model.CausalDag;
import com.causal.summary.core.model.Cluster;

import java.util.HashSet;
import java.util.Set;

/**
 * Structural cost of merging two nodes, measured in edges the summary implies
 * between atomic members but the current graph does not carry.
 *
 * <pre>
 * cost = (no edge U->V ? |U|*|V| : 0)
 *      + |parents(U) - parents(V)| * |V| + |parents(V) - parents(U)| * |U|
 *      + |children(U) - children(V)| * |V| + |children(V) - children(U)| * |U|
 * </pre>
 *
 * Computed from scratch against the given graph on every call.
 */
public class MergeCostModel {

    public long cost(Cluster u, Cluster v, CausalDag graph) {
        long sizeU = u.size();
        long sizeV = v.size();

        long cost = 0;
        if (!graph.hasEdge(u, v)) {
            cost += sizeU * sizeV;
        }
        cost += divergence(graph.predecessors(u), graph.predecessors(v), sizeU, sizeV);
        cost += divergence(graph.successors(u), graph.successors(v), sizeU, sizeV);
        return cost;
    }

    private static long divergence(Set<Cluster> ofU, Set<Cluster> ofV, long sizeU, long sizeV) {
        Set<Cluster> onlyU = new HashSet<>(ofU);
        onlyU.removeAll(ofV);
        Set<Cluster> onlyV = new HashSet<>(ofV);
        onlyV.removeAll(ofU);
        return onlyU.size() * sizeV + onlyV.size() * sizeU;
    }
}
