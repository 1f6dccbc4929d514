package com.causal.summary.grounding;

import com.causal.summary.core.model.CausalDag;
import com.causal.summary.core.model.Cluster;
import com.causal.summary.core.model.InvalidGraphException;
import com.causal.summary.logging.LogContext;
import com.causal.summary.metrics.MetricsService;
import com.causal.summary.metrics.NoOpMetricsService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Expands a summary DAG back into a DAG over atomic identifiers.
 *
 * For every cluster node, in enumeration order:
 * 1. each predecessor gets an edge to every member, and every member gets an edge
 *    to each successor;
 * 2. members are chained by the supplied order: walking the order, each member
 *    receives an edge from every other member of the same cluster met before it;
 * 3. the cluster node is removed.
 *
 * The result over-approximates the pre-summarization graph: neighbours are wired
 * to all members because the summary does not record which member held which edge.
 */
public class GroundingExpander {
    private static final Logger log = LoggerFactory.getLogger(GroundingExpander.class);

    private final MetricsService metricsService;

    public GroundingExpander() {
        this(new NoOpMetricsService());
    }

    public GroundingExpander(MetricsService metricsService) {
        this.metricsService = Objects.requireNonNull(metricsService, "metricsService is required");
    }

    /**
     * Grounds {@code summary}, ordering cluster members by the summary's topological
     * order with each node's members taken in sequence.
     *
     * @throws InvalidGraphException if {@code summary} contains a cycle
     */
    public CausalDag ground(CausalDag summary) {
        Objects.requireNonNull(summary, "summary is required");
        List<String> order = new ArrayList<>();
        for (Cluster node : summary.topologicalOrder()) {
            order.addAll(node.members());
        }
        return ground(summary, order);
    }

    /**
     * Grounds {@code summary} using a caller-supplied order of atomic identifiers,
     * typically a topological order of the original graph. Identifiers missing from
     * the order receive edges from every ordered member of their cluster.
     */
    public CausalDag ground(CausalDag summary, List<String> order) {
        Objects.requireNonNull(summary, "summary is required");
        Objects.requireNonNull(order, "order is required");

        try (LogContext logCtx = LogContext.forGrounding(LogContext.generateCorrelationId())
                .with("summaryNodes", String.valueOf(summary.nodeCount()))) {
            log.info("ground.starting nodes={} edges={}", summary.nodeCount(), summary.edgeCount());

            CausalDag.Builder working = summary.toBuilder();
            int expanded = 0;
            for (Cluster cluster : summary.nodes()) {
                if (cluster.isAtomic()) {
                    continue;
                }
                expand(working, cluster, order);
                expanded++;
            }

            CausalDag grounded = working.build();
            if (!grounded.isAcyclic()) {
                throw new InvalidGraphException("Grounding produced a cycle; the member order "
                        + "is not consistent with the summary's edges");
            }
            metricsService.recordGrounding(grounded.edgeCount());
            log.info("ground.completed clustersExpanded={} nodes={} edges={}",
                    expanded, grounded.nodeCount(), grounded.edgeCount());
            return grounded;
        }
    }

    private void expand(CausalDag.Builder working, Cluster cluster, List<String> order) {
        List<Cluster> parents = working.predecessors(cluster);
        List<Cluster> children = working.successors(cluster);
        working.removeNode(cluster);

        List<Cluster> atoms = new ArrayList<>(cluster.size());
        for (String member : cluster.members()) {
            Cluster atom = Cluster.of(member);
            atoms.add(atom);
            working.addNode(atom);
        }
        for (Cluster parent : parents) {
            for (Cluster atom : atoms) {
                working.addEdge(parent, atom);
            }
        }
        for (Cluster child : children) {
            for (Cluster atom : atoms) {
                working.addEdge(atom, child);
            }
        }

        for (String member : cluster.members()) {
            for (String before : order) {
                if (!cluster.contains(before)) {
                    continue;
                }
                if (before.equals(member)) {
                    break;
                }
                working.addEdge(Cluster.of(before), Cluster.of(member));
            }
        }
        log.debug("ground.expanded cluster={} members={} parents={} children={}",
                cluster.label(), cluster.size(), parents.size(), children.size());
    }
}
