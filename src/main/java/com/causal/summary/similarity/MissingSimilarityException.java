package com.causal.summary.similarity;

/**
 * Runtime exception thrown when a similarity table lacks the directed entry
 * {@code first -> second} for a pair of atomic identifiers that must be compared.
 * Both directions of every compared pair are required.
 */
public class MissingSimilarityException extends RuntimeException {

    private final String first;
    private final String second;

    public MissingSimilarityException(String first, String second) {
        super("No similarity entry for " + first + " -> " + second);
        this.first = first;
        this.second = second;
    }

    public String getFirst() {
        return first;
    }

    public String getSecond() {
        return second;
    }
}
