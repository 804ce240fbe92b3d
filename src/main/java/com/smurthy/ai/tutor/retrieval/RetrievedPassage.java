package com.smurthy.ai.tutor.retrieval;

/**
 * One grounding passage returned by the vector index.
 */
public record RetrievedPassage(String text, double score, String sourceId) {
}
