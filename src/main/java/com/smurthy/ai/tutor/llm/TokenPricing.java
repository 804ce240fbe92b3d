package com.smurthy.ai.tutor.llm;

/**
 * Price of a provider's tokens in US dollars per thousand tokens.
 */
public record TokenPricing(double inputPer1k, double outputPer1k) {

    public static final TokenPricing FREE = new TokenPricing(0.0, 0.0);

    public TokenPricing {
        if (inputPer1k < 0 || outputPer1k < 0) {
            throw new IllegalArgumentException("Token prices must not be negative");
        }
    }

    public double costUsd(TokenUsage usage) {
        return usage.inputTokens() / 1000.0 * inputPer1k + usage.outputTokens() / 1000.0 * outputPer1k;
    }
}
