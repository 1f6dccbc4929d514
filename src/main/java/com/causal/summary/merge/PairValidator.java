package com.causal.summary.merge;

import com.causal.summary.core.model.CausalDag;
import com.causal.summary.core.model.Cluster;
import com.causal.summary.similarity.MissingSimilarityException;
import com.causal.summary.similarity.SimilarityTable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashSet;
import java.util.Objects;
import java.util.OptionalDouble;
import java.util.Set;

/**
 * Decides whether two nodes may be merged.
 *
 * A pair is valid when it passes two gates:
 * <ol>
 *   <li>Semantic gate: with a similarity table present, every cross pair of atomic
 *       members must reach the threshold, taking the higher of the two lookup directions. Both
 *       directions must be present.</li>
 *   <li>Acyclicity gate: contracting the pair must not close a directed cycle.</li>
 * </ol>
 *
 * The acyclicity gate is answered on the graph as it stands: the contraction closes a
 * cycle exactly when one node reaches the other through at least one third node.
 * What a direct edge between the two means is set by the {@link AdjacencyPolicy}.
 */
public class PairValidator {
    private static final Logger log = LoggerFactory.getLogger(PairValidator.class);

    private final SimilarityTable similarityTable;
    private final double semanticThreshold;
    private final AdjacencyPolicy adjacencyPolicy;

    /**
     * Creates a validator with no semantic gate.
     */
    public PairValidator() {
        this(null, 0.0, AdjacencyPolicy.ALLOW_ADJACENT);
    }

    /**
     * @param similarityTable   optional table; {@code null} disables the semantic gate
     * @param semanticThreshold minimum similarity every cross pair must reach
     * @param adjacencyPolicy   treatment of a direct edge between the pair
     */
    public PairValidator(SimilarityTable similarityTable, double semanticThreshold,
                         AdjacencyPolicy adjacencyPolicy) {
        this.similarityTable = similarityTable;
        this.semanticThreshold = semanticThreshold;
        this.adjacencyPolicy = Objects.requireNonNull(adjacencyPolicy, "adjacencyPolicy is required");
    }

    /**
     * @throws MissingSimilarityException if the table lacks an entry for a cross pair
     */
    public boolean isValidPair(Cluster u, Cluster v, CausalDag graph) {
        return isSemanticallyCompatible(u, v) && preservesAcyclicity(u, v, graph);
    }

    /**
     * @throws MissingSimilarityException if the table lacks an entry for a cross pair
     */
    public boolean isSemanticallyCompatible(Cluster u, Cluster v) {
        if (similarityTable == null) {
            return true;
        }
        for (String a : u.members()) {
            for (String b : v.members()) {
                double similarity = similarity(a, b);
                if (similarity < semanticThreshold) {
                    log.debug("pair.rejected reason=semantic first={} second={} similarity={} threshold={}",
                            a, b, similarity, semanticThreshold);
                    return false;
                }
            }
        }
        return true;
    }

    public boolean preservesAcyclicity(Cluster u, Cluster v, CausalDag graph) {
        if (u.equals(v)) {
            throw new IllegalArgumentException("A node cannot be paired with itself: " + u);
        }
        if (adjacencyPolicy == AdjacencyPolicy.REJECT_ADJACENT
                && (graph.hasEdge(u, v) || graph.hasEdge(v, u))) {
            return false;
        }
        return !reachesThroughThirdNode(u, v, graph) && !reachesThroughThirdNode(v, u, graph);
    }

    private double similarity(String a, String b) {
        OptionalDouble forward = similarityTable.lookup(a, b);
        OptionalDouble backward = similarityTable.lookup(b, a);
        if (forward.isEmpty()) {
            throw new MissingSimilarityException(a, b);
        }
        if (backward.isEmpty()) {
            throw new MissingSimilarityException(b, a);
        }
        return Math.max(forward.getAsDouble(), backward.getAsDouble());
    }

    private static boolean reachesThroughThirdNode(Cluster from, Cluster to, CausalDag graph) {
        Set<Cluster> starts = new HashSet<>(graph.successors(from));
        starts.remove(to);
        return graph.reaches(starts, to);
    }
}
