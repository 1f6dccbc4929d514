package com.causal.summary.merge;

import com.causal.summary.core.model.CausalDag;
import com.causal.summary.core.model.Cluster;
import com.causal.summary.core.model.Edge;

import java.util.Objects;

/**
 * Contracts two nodes of a {@link CausalDag} into one cluster node.
 *
 * The merged node's members are the first node's members followed by the second's,
 * and it takes the first node's position in enumeration order. Every edge incident to
 * either node is redirected to the merged node; parallel edges collapse into one.
 * The input graph is never modified.
 */
public class NodeMerger {

    /**
     * Merges {@code first} and {@code second}, dropping any edge between them.
     */
    public CausalDag merge(CausalDag graph, Cluster first, Cluster second) {
        return merge(graph, first, second, false);
    }

    /**
     * Merges {@code first} and {@code second}.
     *
     * @param allowSelfLoops if true an edge between the two nodes is kept as a self-loop
     *                       on the merged node, otherwise it is dropped
     */
    public CausalDag merge(CausalDag graph, Cluster first, Cluster second, boolean allowSelfLoops) {
        Objects.requireNonNull(graph, "graph is required");
        if (!graph.containsNode(first)) {
            throw new IllegalArgumentException("Node not in graph: " + first);
        }
        if (!graph.containsNode(second)) {
            throw new IllegalArgumentException("Node not in graph: " + second);
        }
        if (first.equals(second)) {
            throw new IllegalArgumentException("Cannot merge a node with itself: " + first);
        }

        Cluster merged = first.concat(second);
        CausalDag.Builder builder = CausalDag.builder();
        for (Cluster node : graph.nodes()) {
            if (node.equals(first)) {
                builder.addNode(merged);
            } else if (!node.equals(second)) {
                builder.addNode(node);
            }
        }
        for (Edge edge : graph.edges()) {
            Cluster source = redirect(edge.source(), first, second, merged);
            Cluster target = redirect(edge.target(), first, second, merged);
            if (source.equals(target) && !allowSelfLoops) {
                continue;
            }
            builder.addEdge(source, target);
        }
        return builder.build();
    }

    private static Cluster redirect(Cluster node, Cluster first, Cluster second, Cluster merged) {
        return node.equals(first) || node.equals(second) ? merged : node;
    }
}
