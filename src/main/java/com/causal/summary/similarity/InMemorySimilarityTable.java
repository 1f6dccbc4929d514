package com.causal.summary.similarity;

import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.OptionalDouble;

/**
 * Map-backed {@link SimilarityTable}. Scores are held per ordered pair and must lie
 * between 0.0 and 1.0. The table is immutable once built.
 */
public final class InMemorySimilarityTable implements SimilarityTable {

    private final Map<String, Map<String, Double>> scores;

    private InMemorySimilarityTable(Builder builder) {
        Map<String, Map<String, Double>> copy = new HashMap<>();
        builder.scores.forEach((key, row) -> copy.put(key, Map.copyOf(row)));
        this.scores = Map.copyOf(copy);
    }

    @Override
    public OptionalDouble lookup(String first, String second) {
        Map<String, Double> row = scores.get(first);
        if (row == null) {
            return OptionalDouble.empty();
        }
        Double score = row.get(second);
        return score == null ? OptionalDouble.empty() : OptionalDouble.of(score);
    }

    /**
     * Number of ordered pairs held.
     */
    public int size() {
        return scores.values().stream().mapToInt(Map::size).sum();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private final Map<String, Map<String, Double>> scores = new HashMap<>();

        /**
         * Records the similarity of {@code first} to {@code second} only.
         */
        public Builder put(String first, String second, double score) {
            Objects.requireNonNull(first, "first is required");
            Objects.requireNonNull(second, "second is required");
            if (score < 0.0 || score > 1.0 || Double.isNaN(score)) {
                throw new IllegalArgumentException("Similarity score must be between 0.0 and 1.0, got " + score);
            }
            scores.computeIfAbsent(first, k -> new HashMap<>()).put(second, score);
            return this;
        }

        /**
         * Records the same similarity in both directions.
         */
        public Builder putSymmetric(String first, String second, double score) {
            put(first, second, score);
            return put(second, first, score);
        }

        public InMemorySimilarityTable build() {
            return new InMemorySimilarityTable(this);
        }
    }
}
