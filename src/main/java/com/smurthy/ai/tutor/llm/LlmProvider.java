package com.smurthy.ai.tutor.llm;

/**
 * One language-model completion endpoint. Implementations make a single
 * call and report failures as {@link ProviderException}; retry and fallback
 * belong to {@link LlmClient}.
 */
public interface LlmProvider {

    /**
     * Make one completion call.
     *
     * @return the completion text and the tokens the call consumed
     * @throws ProviderException on any failure, typed by kind
     */
    ProviderReply complete(LlmPrompt prompt, CompletionOptions options);

    /**
     * Get the name of this provider (e.g., "lapa", "openai")
     */
    String getProviderName();
}
