package com.causal.summary.core.model;

/**
 * Runtime exception thrown when a graph violates a structural precondition,
 * typically when an operation that requires a DAG is handed a cyclic graph.
 */
public class InvalidGraphException extends RuntimeException {

    public InvalidGraphException(String message) {
        super(message);
    }

    public InvalidGraphException(String message, Throwable cause) {
        super(message, cause);
    }
}
