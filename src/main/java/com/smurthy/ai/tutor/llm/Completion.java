package com.smurthy.ai.tutor.llm;

/**
 * Successful completion.
 *
 * @param providerIndex position of the answering provider in the chain (0 = primary)
 * @param attempts      total calls made across all providers, including failed ones
 */
public record Completion(
        String text,
        String provider,
        int providerIndex,
        int attempts,
        long latencyMs
) {
    public boolean fallbackUsed() {
        return providerIndex > 0;
    }
}
