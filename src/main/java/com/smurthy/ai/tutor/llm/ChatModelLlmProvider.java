package com.smurthy.ai.tutor.llm;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.chat.metadata.Usage;
import org.springframework.ai.chat.model.ChatResponse;
import org.springframework.ai.chat.model.ChatModel;
import org.springframework.ai.chat.prompt.ChatOptions;
import org.springframework.util.StringUtils;

/**
 * {@link LlmProvider} backed by a Spring AI {@link ChatModel}: one HTTP(S)
 * completion endpoint with its own base URL, model and credential.
 */
public class ChatModelLlmProvider implements LlmProvider {

    private static final Logger log = LoggerFactory.getLogger(ChatModelLlmProvider.class);

    private final String name;
    private final ChatClient chatClient;

    public ChatModelLlmProvider(String name, ChatModel chatModel) {
        this.name = name;
        // Lightweight client: no memory, no tools
        this.chatClient = ChatClient.builder(chatModel).build();
        log.info("Initialized provider '{}'", name);
    }

    @Override
    public ProviderReply complete(LlmPrompt prompt, CompletionOptions options) {
        try {
            ChatClient.ChatClientRequestSpec request = chatClient.prompt();
            if (StringUtils.hasText(prompt.system())) {
                request = request.system(prompt.system());
            }
            ChatResponse response = request
                    .user(prompt.user())
                    .options(ChatOptions.builder()
                            .temperature(options.temperature())
                            .maxTokens(options.maxTokens())
                            .build())
                    .call()
                    .chatResponse();

            String content = response == null || response.getResult() == null
                    ? null
                    : response.getResult().getOutput().getText();
            if (!StringUtils.hasText(content)) {
                throw new ProviderException(ProviderErrorKind.INVALID_RESPONSE, name,
                        name + " returned an empty completion");
            }
            return new ProviderReply(content, usageOf(response));
        } catch (ProviderException e) {
            throw e;
        } catch (RuntimeException e) {
            throw ProviderException.from(name, e);
        }
    }

    private static TokenUsage usageOf(ChatResponse response) {
        if (response.getMetadata() == null || response.getMetadata().getUsage() == null) {
            return TokenUsage.EMPTY;
        }
        Usage usage = response.getMetadata().getUsage();
        return new TokenUsage(orZero(usage.getPromptTokens()), orZero(usage.getCompletionTokens()));
    }

    private static long orZero(Integer tokens) {
        return tokens == null ? 0 : tokens;
    }

    @Override
    public String getProviderName() {
        return name;
    }
}
