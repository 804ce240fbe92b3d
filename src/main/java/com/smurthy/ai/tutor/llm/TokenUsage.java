package com.smurthy.ai.tutor.llm;

/**
 * Tokens billed for one completion, as reported by the provider.
 */
public record TokenUsage(long inputTokens, long outputTokens) {

    public static final TokenUsage EMPTY = new TokenUsage(0, 0);

    public TokenUsage {
        inputTokens = Math.max(0, inputTokens);
        outputTokens = Math.max(0, outputTokens);
    }

    public long totalTokens() {
        return inputTokens + outputTokens;
    }
}
