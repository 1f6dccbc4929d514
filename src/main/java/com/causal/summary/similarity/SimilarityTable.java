package com.causal.summary.similarity;

import java.util.OptionalDouble;

/**
 * Read-only lookup of semantic similarity between two atomic variable identifiers.
 * Tables may be asymmetric; callers that need a symmetric view look up both directions.
 */
public interface SimilarityTable {

    /**
     * Looks up the similarity of {@code first} to {@code second}.
     *
     * @return the score, or empty if the table has no entry for this ordered pair
     */
    OptionalDouble lookup(String first, String second);
}
