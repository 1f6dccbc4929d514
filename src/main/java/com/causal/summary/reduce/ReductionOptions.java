package com.causal.summary.reduce;

import com.causal.summary.merge.AdjacencyPolicy;
import com.causal.summary.similarity.SimilarityTable;

import java.util.Objects;
import java.util.Random;

/**
 * Options for a DAG reduction run.
 * Configures the target size, the optional semantic gate, tie-breaking and the pre-reduction pass.
 *
 * Adjacent nodes may be merged by default ({@link AdjacencyPolicy#ALLOW_ADJACENT}); this
 * departs from the literal self-loop check, which rejects every pair joined by an edge.
 */
public class ReductionOptions {

    private static final double DEFAULT_SEMANTIC_THRESHOLD = 0.0;
    private static final long DEFAULT_LOW_COST_THRESHOLD = 1;
    private static final double DEFAULT_TIE_TOLERANCE = 1e-9;

    private final int targetSize;
    private final SimilarityTable similarityTable;
    private final double semanticThreshold;
    private final Random random;
    private final long lowCostThreshold;
    private final boolean preReductionEnabled;
    private final double tieTolerance;
    private final AdjacencyPolicy adjacencyPolicy;

    private ReductionOptions(Builder builder) {
        this.targetSize = builder.targetSize;
        this.similarityTable = builder.similarityTable;
        this.semanticThreshold = builder.semanticThreshold;
        this.random = builder.random != null ? builder.random : new Random();
        this.lowCostThreshold = builder.lowCostThreshold;
        this.preReductionEnabled = builder.preReductionEnabled;
        this.tieTolerance = builder.tieTolerance;
        this.adjacencyPolicy = builder.adjacencyPolicy;
    }

    public int getTargetSize() {
        return targetSize;
    }

    /**
     * Returns the similarity table, or {@code null} when the semantic gate is disabled.
     */
    public SimilarityTable getSimilarityTable() {
        return similarityTable;
    }

    public double getSemanticThreshold() {
        return semanticThreshold;
    }

    public Random getRandom() {
        return random;
    }

    public long getLowCostThreshold() {
        return lowCostThreshold;
    }

    public boolean isPreReductionEnabled() {
        return preReductionEnabled;
    }

    public double getTieTolerance() {
        return tieTolerance;
    }

    public AdjacencyPolicy getAdjacencyPolicy() {
        return adjacencyPolicy;
    }

    /**
     * Creates default options for the given target size.
     */
    public static ReductionOptions forTarget(int targetSize) {
        return builder().targetSize(targetSize).build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private int targetSize = 0;
        private SimilarityTable similarityTable;
        private double semanticThreshold = DEFAULT_SEMANTIC_THRESHOLD;
        private Random random;
        private long lowCostThreshold = DEFAULT_LOW_COST_THRESHOLD;
        private boolean preReductionEnabled = true;
        private double tieTolerance = DEFAULT_TIE_TOLERANCE;
        private AdjacencyPolicy adjacencyPolicy = AdjacencyPolicy.ALLOW_ADJACENT;

        public Builder targetSize(int targetSize) {
            if (targetSize <= 0) {
                throw new IllegalArgumentException("targetSize must be positive, got " + targetSize);
            }
            this.targetSize = targetSize;
            return this;
        }

        public Builder similarityTable(SimilarityTable similarityTable) {
            this.similarityTable = similarityTable;
            return this;
        }

        public Builder semanticThreshold(double semanticThreshold) {
            if (Double.isNaN(semanticThreshold) || semanticThreshold < 0.0 || semanticThreshold > 1.0) {
                throw new IllegalArgumentException("semanticThreshold must be between 0.0 and 1.0");
            }
            this.semanticThreshold = semanticThreshold;
            return this;
        }

        /**
         * Random source for tie-breaking. Pass a seeded instance for reproducible runs.
         */
        public Builder random(Random random) {
            this.random = Objects.requireNonNull(random, "random is required");
            return this;
        }

        /**
         * Convenience for {@code random(new Random(seed))}.
         */
        public Builder seed(long seed) {
            return random(new Random(seed));
        }

        public Builder lowCostThreshold(long lowCostThreshold) {
            if (lowCostThreshold < 0) {
                throw new IllegalArgumentException("lowCostThreshold must be non-negative");
            }
            this.lowCostThreshold = lowCostThreshold;
            return this;
        }

        public Builder preReductionEnabled(boolean preReductionEnabled) {
            this.preReductionEnabled = preReductionEnabled;
            return this;
        }

        public Builder tieTolerance(double tieTolerance) {
            if (Double.isNaN(tieTolerance) || tieTolerance < 0.0) {
                throw new IllegalArgumentException("tieTolerance must be non-negative");
            }
            this.tieTolerance = tieTolerance;
            return this;
        }

        /**
         * Sets how a direct edge between a candidate pair is treated. The default,
         * {@link AdjacencyPolicy#ALLOW_ADJACENT}, departs from the literal self-loop check,
         * under which any two adjacent nodes are an invalid pair; use
         * {@link AdjacencyPolicy#REJECT_ADJACENT} to reproduce that behaviour.
         */
        public Builder adjacencyPolicy(AdjacencyPolicy adjacencyPolicy) {
            this.adjacencyPolicy = Objects.requireNonNull(adjacencyPolicy, "adjacencyPolicy is required");
            return this;
        }

        public ReductionOptions build() {
            if (targetSize <= 0) {
                throw new IllegalArgumentException("targetSize is required");
            }
            return new ReductionOptions(this);
        }
    }

    @Override
    public String toString() {
        return "ReductionOptions{" +
                "targetSize=" + targetSize +
                ", semanticGate=" + (similarityTable != null) +
                ", semanticThreshold=" + semanticThreshold +
                ", lowCostThreshold=" + lowCostThreshold +
                ", preReductionEnabled=" + preReductionEnabled +
                ", tieTolerance=" + tieTolerance +
                ", adjacencyPolicy=" + adjacencyPolicy +
                '}';
    }
}
