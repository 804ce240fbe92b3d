package com.smurthy.ai.tutor.llm;

import java.time.Duration;

/**
 * A provider together with the retry and timeout policy it is called under
 * and the price of its tokens.
 */
public record ProviderBinding(
        LlmProvider provider,
        int maxRetries,
        Duration backoffBase,
        Duration backoffMax,
        Duration timeout,
        TokenPricing pricing
) {
    public ProviderBinding {
        pricing = pricing == null ? TokenPricing.FREE : pricing;
    }

    public ProviderBinding(LlmProvider provider, int maxRetries, Duration backoffBase, Duration backoffMax,
                           Duration timeout) {
        this(provider, maxRetries, backoffBase, backoffMax, timeout, TokenPricing.FREE);
    }

    public String name() {
        return provider.getProviderName();
    }
}
