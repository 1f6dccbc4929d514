package com.causal.summary.reduce;

import com.causal.summary.core.model.CausalDag;
import com.causal.summary.core.model.Cluster;
import com.causal.summary.core.model.InvalidGraphException;
import com.causal.summary.core.model.MergePhase;
import com.causal.summary.core.model.MergeRecord;
import com.causal.summary.logging.LogContext;
import com.causal.summary.merge.MergeCostModel;
import com.causal.summary.merge.NodeMerger;
import com.causal.summary.merge.PairValidator;
import com.causal.summary.metrics.MetricsService;
import com.causal.summary.metrics.NoOpMetricsService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Random;

/**
 * Greedy causal summarization (CaGreS).
 *
 * Reduction process:
 * 1. Input checks (acyclic graph, target size within range)
 * 2. Low-cost pre-reduction ({@link LowCostMerger})
 * 3. Greedy loop: merge the minimum-cost valid pair until the target size is reached
 *    or no valid pair remains
 *
 * Ties between equal-cost pairs are broken as the scan meets them: each tied pair
 * replaces the current candidate with probability one half, drawn from the
 * configured {@link Random}. Later pairs are therefore favoured; the selection is
 * not uniform over the tied set.
 *
 * Running out of valid pairs is not an error; the result carries
 * {@link ReductionStatus#STALLED}.
 */
public class CaGreSReducer {
    private static final Logger log = LoggerFactory.getLogger(CaGreSReducer.class);

    private final ReductionOptions options;
    private final PairValidator validator;
    private final MergeCostModel costModel;
    private final NodeMerger merger;
    private final LowCostMerger lowCostMerger;
    private final MetricsService metricsService;

    public CaGreSReducer(ReductionOptions options) {
        this(options, new NoOpMetricsService());
    }

    public CaGreSReducer(ReductionOptions options, MetricsService metricsService) {
        this.options = Objects.requireNonNull(options, "options is required");
        this.metricsService = Objects.requireNonNull(metricsService, "metricsService is required");
        this.validator = new PairValidator(options.getSimilarityTable(), options.getSemanticThreshold(),
                options.getAdjacencyPolicy());
        this.costModel = new MergeCostModel();
        this.merger = new NodeMerger();
        this.lowCostMerger = new LowCostMerger(validator, costModel, merger, options.getLowCostThreshold());
    }

    /**
     * Reduces {@code dag} to at most the configured target size.
     *
     * @throws InvalidGraphException    if {@code dag} contains a cycle
     * @throws IllegalArgumentException if the target size exceeds the node count
     */
    public ReductionResult reduce(CausalDag dag) {
        Objects.requireNonNull(dag, "dag is required");
        int target = options.getTargetSize();
        if (target > dag.nodeCount()) {
            throw new IllegalArgumentException("Target size " + target
                    + " exceeds the graph's node count " + dag.nodeCount());
        }
        if (!dag.isAcyclic()) {
            throw new InvalidGraphException("Input graph must be acyclic");
        }

        try (LogContext logCtx = LogContext.forReduction(LogContext.generateCorrelationId(), target)) {
            long started = System.nanoTime();
            log.info("reduce.starting nodes={} edges={} target={}", dag.nodeCount(), dag.edgeCount(), target);

            List<MergeRecord> merges = new ArrayList<>();
            MergeListener recorder = record -> {
                merges.add(record);
                metricsService.incrementMerge(record.phase());
                metricsService.recordMergeCost(record.cost());
            };

            CausalDag current = dag;
            if (options.isPreReductionEnabled() && current.nodeCount() > target) {
                current = lowCostMerger.apply(current, target, recorder);
                log.debug("reduce.preReduction merges={} nodes={}", merges.size(), current.nodeCount());
            }

            ReductionStatus status = ReductionStatus.TARGET_REACHED;
            while (current.nodeCount() > target) {
                Optional<MergeCandidate> best = selectMinimumCostPair(current);
                if (best.isEmpty()) {
                    status = ReductionStatus.STALLED;
                    log.warn("reduce.stalled nodes={} target={} reason=no valid pair remains",
                            current.nodeCount(), target);
                    break;
                }
                MergeCandidate candidate = best.get();
                current = merger.merge(current, candidate.first(), candidate.second());
                MergeRecord record = new MergeRecord(candidate.first(), candidate.second(),
                        candidate.first().concat(candidate.second()), candidate.cost(),
                        MergePhase.GREEDY, current.nodeCount());
                log.debug("merge.greedy first={} second={} cost={} nodes={}",
                        candidate.first().label(), candidate.second().label(), candidate.cost(),
                        current.nodeCount());
                recorder.onMerge(record);
            }

            Duration elapsed = Duration.ofNanos(System.nanoTime() - started);
            metricsService.recordReductionDuration(status, elapsed);
            log.info("reduce.completed status={} nodes={} merges={} elapsedMs={}",
                    status, current.nodeCount(), merges.size(), elapsed.toMillis());
            return new ReductionResult(current, merges, status, target, dag.nodeCount());
        }
    }

    /**
     * Finds the minimum-cost valid pair of {@code graph}, or empty if no pair is valid.
     */
    public Optional<MergeCandidate> selectMinimumCostPair(CausalDag graph) {
        Random random = options.getRandom();
        List<Cluster> nodes = new ArrayList<>(graph.nodes());
        MergeCandidate best = null;
        for (int i = 0; i < nodes.size(); i++) {
            for (int j = i + 1; j < nodes.size(); j++) {
                Cluster first = nodes.get(i);
                Cluster second = nodes.get(j);
                if (!validator.isValidPair(first, second, graph)) {
                    continue;
                }
                long cost = costModel.cost(first, second, graph);
                if (best == null || cost < best.cost()) {
                    best = new MergeCandidate(first, second, cost);
                } else if (isTied(cost, best.cost()) && random.nextBoolean()) {
                    best = new MergeCandidate(first, second, cost);
                }
            }
        }
        return Optional.ofNullable(best);
    }

    private boolean isTied(long cost, long minimum) {
        double difference = Math.abs((double) cost - minimum);
        return difference <= options.getTieTolerance() * Math.max(Math.abs((double) cost), Math.abs((double) minimum));
    }
}
