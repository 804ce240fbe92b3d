package com.smurthy.ai.tutor.llm;

/**
 * Text of one provider call and the tokens it consumed.
 */
public record ProviderReply(String text, TokenUsage usage) {

    public ProviderReply {
        usage = usage == null ? TokenUsage.EMPTY : usage;
    }

    public static ProviderReply of(String text) {
        return new ProviderReply(text, TokenUsage.EMPTY);
    }
}
