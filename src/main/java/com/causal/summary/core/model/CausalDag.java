package com.causal.summary.core.model;

import org.jgrapht.Graph;
import org.jgrapht.GraphTests;
import org.jgrapht.Graphs;
import org.jgrapht.alg.cycle.CycleDetector;
import org.jgrapht.graph.AsUnmodifiableGraph;
import org.jgrapht.graph.DefaultDirectedGraph;
import org.jgrapht.graph.DefaultEdge;
import org.jgrapht.traverse.DepthFirstIterator;
import org.jgrapht.traverse.TopologicalOrderIterator;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Immutable snapshot of a directed graph over {@link Cluster} nodes, backed by a
 * JGraphT {@link DefaultDirectedGraph}.
 *
 * Nodes are enumerated in insertion order, which gives every pair scan a stable
 * order. Acyclicity is not enforced on construction, so hypothetical contractions
 * can be built and checked with {@link #isAcyclic()}.
 *
 * Instances are created through {@link #builder()} or {@link #toBuilder()} and are
 * never modified afterwards.
 */
public final class CausalDag {

    private final Graph<Cluster, DefaultEdge> graph;

    private CausalDag(Graph<Cluster, DefaultEdge> source) {
        Graph<Cluster, DefaultEdge> copy = newGraph();
        Graphs.addGraph(copy, source);
        this.graph = new AsUnmodifiableGraph<>(copy);
    }

    private static Graph<Cluster, DefaultEdge> newGraph() {
        return new DefaultDirectedGraph<>(DefaultEdge.class);
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Returns a builder pre-populated with this graph's nodes and edges.
     */
    public Builder toBuilder() {
        Builder builder = new Builder();
        Graphs.addGraph(builder.graph, graph);
        return builder;
    }

    /**
     * Returns the nodes in enumeration order.
     */
    public Set<Cluster> nodes() {
        return graph.vertexSet();
    }

    public int nodeCount() {
        return graph.vertexSet().size();
    }

    public int edgeCount() {
        return graph.edgeSet().size();
    }

    public boolean containsNode(Cluster node) {
        return graph.containsVertex(node);
    }

    /**
     * Returns all edges, grouped by source in enumeration order.
     */
    public List<Edge> edges() {
        List<Edge> result = new ArrayList<>(edgeCount());
        for (Cluster source : graph.vertexSet()) {
            for (DefaultEdge edge : graph.outgoingEdgesOf(source)) {
                result.add(new Edge(source, graph.getEdgeTarget(edge)));
            }
        }
        return result;
    }

    public Set<Cluster> successors(Cluster node) {
        requireNode(node);
        return Collections.unmodifiableSet(new LinkedHashSet<>(Graphs.successorListOf(graph, node)));
    }

    public Set<Cluster> predecessors(Cluster node) {
        requireNode(node);
        return Collections.unmodifiableSet(new LinkedHashSet<>(Graphs.predecessorListOf(graph, node)));
    }

    public boolean hasEdge(Cluster source, Cluster target) {
        return graph.containsVertex(source) && graph.containsVertex(target)
                && graph.containsEdge(source, target);
    }

    /**
     * Returns true if a directed path of length one or more leads from {@code from} to {@code to}.
     */
    public boolean hasPath(Cluster from, Cluster to) {
        return reaches(successors(from), to);
    }

    /**
     * Returns true if {@code target} is reachable from any of {@code sources},
     * counting a source equal to the target as reached.
     */
    public boolean reaches(Collection<Cluster> sources, Cluster target) {
        if (sources.isEmpty()) {
            return false;
        }
        DepthFirstIterator<Cluster, DefaultEdge> walk = new DepthFirstIterator<>(graph, sources);
        while (walk.hasNext()) {
            if (walk.next().equals(target)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Returns true if the graph has no directed cycle. Self-loops count as cycles.
     */
    public boolean isAcyclic() {
        return !GraphTests.hasSelfLoops(graph) && !new CycleDetector<>(graph).detectCycles();
    }

    /**
     * Returns the nodes in a topological order. Among nodes that are ready at the
     * same time, enumeration order wins.
     *
     * @throws InvalidGraphException if the graph contains a cycle
     */
    public List<Cluster> topologicalOrder() {
        if (!isAcyclic()) {
            throw new InvalidGraphException("Graph contains a cycle; it has no topological order");
        }
        Map<Cluster, Integer> position = new HashMap<>();
        for (Cluster node : graph.vertexSet()) {
            position.put(node, position.size());
        }
        Comparator<Cluster> byPosition = Comparator.comparing(position::get);
        List<Cluster> order = new ArrayList<>(nodeCount());
        new TopologicalOrderIterator<>(graph, byPosition).forEachRemaining(order::add);
        return order;
    }

    /**
     * Returns every atomic identifier across all node members, in enumeration order.
     */
    public Set<String> atomicIdentifiers() {
        Set<String> result = new LinkedHashSet<>();
        for (Cluster node : nodes()) {
            result.addAll(node.members());
        }
        return result;
    }

    private void requireNode(Cluster node) {
        if (!graph.containsVertex(node)) {
            throw new IllegalArgumentException("Node not in graph: " + node);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        CausalDag that = (CausalDag) o;
        return nodes().equals(that.nodes()) && new HashSet<>(edges()).equals(new HashSet<>(that.edges()));
    }

    @Override
    public int hashCode() {
        return Objects.hash(nodes(), new HashSet<>(edges()));
    }

    @Override
    public String toString() {
        return "CausalDag{nodes=" + nodeCount() + ", edges=" + edgeCount() + ", edgeList=" + edges() + "}";
    }

    /**
     * Mutable builder. Adding an edge adds its endpoints; duplicate edges collapse.
     */
    public static class Builder {
        private final Graph<Cluster, DefaultEdge> graph = newGraph();

        public Builder addNode(String identifier) {
            return addNode(Cluster.of(identifier));
        }

        public Builder addNode(Cluster node) {
            Objects.requireNonNull(node, "node is required");
            graph.addVertex(node);
            return this;
        }

        public Builder addEdge(String source, String target) {
            return addEdge(Cluster.of(source), Cluster.of(target));
        }

        public Builder addEdge(Cluster source, Cluster target) {
            addNode(source);
            addNode(target);
            graph.addEdge(source, target);
            return this;
        }

        /**
         * Removes a node together with all of its incident edges.
         */
        public Builder removeNode(Cluster node) {
            graph.removeVertex(node);
            return this;
        }

        /**
         * Returns a snapshot of the node's current predecessors.
         */
        public List<Cluster> predecessors(Cluster node) {
            return graph.containsVertex(node) ? Graphs.predecessorListOf(graph, node) : List.of();
        }

        /**
         * Returns a snapshot of the node's current successors.
         */
        public List<Cluster> successors(Cluster node) {
            return graph.containsVertex(node) ? Graphs.successorListOf(graph, node) : List.of();
        }

        public CausalDag build() {
            return new CausalDag(graph);
        }
    }
}
