package com.smurthy.ai.tutor.model;

/**
 * Routing decision for a single query. Produced once and consumed immediately.
 *
 * @param ambiguous true when no rule matched with enough confidence and the
 *                  intent fell back to {@link Intent#EXPLAIN}
 */
public record ClassificationResult(
        Intent intent,
        double confidence,
        boolean requiresGrounding,
        boolean ambiguous,
        String reasoning
) {
    public static ClassificationResult of(Intent intent, double confidence, String reasoning) {
        return new ClassificationResult(intent, confidence, intent.requiresGrounding(), false, reasoning);
    }

    public static ClassificationResult ambiguous(String reasoning) {
        return new ClassificationResult(Intent.EXPLAIN, 0.0, Intent.EXPLAIN.requiresGrounding(), true, reasoning);
    }
}
