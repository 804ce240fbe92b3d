package com.smurthy.ai.tutor.retrieval;

/**
 * Failure talking to the vector index. Never escapes {@link RetrievalService}.
 */
public class RetrievalException extends RuntimeException {

    public RetrievalException(String message, Throwable cause) {
        super(message, cause);
    }
}
