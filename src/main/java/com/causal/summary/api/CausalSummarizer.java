package com.causal.summary.api;

import com.causal.summary.core.model.CausalDag;
import com.causal.summary.core.model.InvalidGraphException;
import com.causal.summary.grounding.GroundingExpander;
import com.causal.summary.metrics.MetricsService;
import com.causal.summary.metrics.NoOpMetricsService;
import com.causal.summary.reduce.CaGreSReducer;
import com.causal.summary.reduce.ReductionOptions;
import com.causal.summary.reduce.ReductionResult;
import com.causal.summary.similarity.MissingSimilarityException;
import com.causal.summary.similarity.SimilarityTable;

import java.util.List;
import java.util.Objects;

/**
 * Main entry point for causal DAG summarization.
 *
 * <pre>
 * CausalSummarizer summarizer = CausalSummarizer.builder().build();
 * ReductionResult result = summarizer.reduce(dag, 3);
 * CausalDag grounded = summarizer.ground(result.summary());
 * </pre>
 *
 * Every operation returns a new graph; inputs are never modified.
 */
public class CausalSummarizer {

    private final MetricsService metricsService;
    private final GroundingExpander groundingExpander;

    private CausalSummarizer(Builder builder) {
        this.metricsService = builder.metricsService;
        this.groundingExpander = new GroundingExpander(metricsService);
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Reduces {@code dag} to {@code k} nodes with default options.
     *
     * @throws InvalidGraphException    if {@code dag} contains a cycle
     * @throws IllegalArgumentException if {@code k} is not between 1 and the node count
     */
    public ReductionResult reduce(CausalDag dag, int k) {
        return reduce(dag, ReductionOptions.forTarget(k));
    }

    /**
     * Reduces {@code dag} to {@code k} nodes, only merging pairs whose members are
     * pairwise at least {@code threshold} similar.
     *
     * @throws MissingSimilarityException if the table lacks a pair that must be compared
     */
    public ReductionResult reduce(CausalDag dag, int k, SimilarityTable similarityTable, double threshold) {
        return reduce(dag, ReductionOptions.builder()
                .targetSize(k)
                .similarityTable(similarityTable)
                .semanticThreshold(threshold)
                .build());
    }

    public ReductionResult reduce(CausalDag dag, ReductionOptions options) {
        Objects.requireNonNull(options, "options is required");
        return new CaGreSReducer(options, metricsService).reduce(dag);
    }

    /**
     * Expands {@code summary} back into a DAG over atomic identifiers.
     */
    public CausalDag ground(CausalDag summary) {
        return groundingExpander.ground(summary);
    }

    /**
     * Expands {@code summary} using the given order of atomic identifiers for intra-cluster edges.
     */
    public CausalDag ground(CausalDag summary, List<String> order) {
        return groundingExpander.ground(summary, order);
    }

    public static class Builder {
        private MetricsService metricsService = new NoOpMetricsService();

        public Builder metricsService(MetricsService metricsService) {
            this.metricsService = Objects.requireNonNull(metricsService, "metricsService is required");
            return this;
        }

        public CausalSummarizer build() {
            return new CausalSummarizer(this);
        }
    }
}
