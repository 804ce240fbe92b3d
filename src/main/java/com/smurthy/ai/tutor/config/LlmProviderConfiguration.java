package com.smurthy.ai.tutor.config;

import com.smurthy.ai.tutor.llm.ChatModelLlmProvider;
import com.smurthy.ai.tutor.llm.LlmClient;
import com.smurthy.ai.tutor.llm.ProviderBinding;
import com.smurthy.ai.tutor.llm.ProviderUsageTracker;
import com.smurthy.ai.tutor.llm.TokenPricing;
import com.smurthy.ai.tutor.support.TimeBoundedCall;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.anthropic.AnthropicChatModel;
import org.springframework.ai.anthropic.AnthropicChatOptions;
import org.springframework.ai.anthropic.api.AnthropicApi;
import org.springframework.ai.chat.model.ChatModel;
import org.springframework.ai.document.MetadataMode;
import org.springframework.ai.embedding.EmbeddingModel;
import org.springframework.ai.openai.OpenAiChatModel;
import org.springframework.ai.openai.OpenAiChatOptions;
import org.springframework.ai.openai.OpenAiEmbeddingModel;
import org.springframework.ai.openai.OpenAiEmbeddingOptions;
import org.springframework.ai.openai.api.OpenAiApi;
import org.springframework.ai.vectorstore.SimpleVectorStore;
import org.springframework.ai.vectorstore.VectorStore;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.retry.support.RetryTemplate;
import org.springframework.util.StringUtils;

import java.util.List;
import java.util.Locale;

/**
 * Builds the ordered provider chain, the embedding model and the curriculum
 * vector index from {@code tutor.llm.*}.
 *
 * Every provider is a plain OpenAI-compatible or Anthropic endpoint with its
 * own base URL, model and key, so a self-hosted model and a commercial API can
 * sit in the same chain. Spring AI's own retry is switched off on these models;
 * {@link LlmClient} owns retry and fallback.
 */
@Configuration
public class LlmProviderConfiguration {

    private static final Logger log = LoggerFactory.getLogger(LlmProviderConfiguration.class);

    @Bean
    public LlmClient llmClient(TutorProperties properties,
                               @Qualifier("providerCalls") TimeBoundedCall providerCalls,
                               ProviderUsageTracker usageTracker) {
        List<ProviderBinding> bindings = properties.llm().orderedProviders().stream()
                .map(LlmProviderConfiguration::bind)
                .toList();
        return new LlmClient(bindings, providerCalls, usageTracker);
    }

    @Bean
    public EmbeddingModel embeddingModel(TutorProperties properties) {
        TutorProperties.Llm llm = properties.llm();
        OpenAiApi api = OpenAiApi.builder()
                .baseUrl(llm.embeddingBaseUrl())
                .apiKey(llm.embeddingApiKey())
                .build();
        log.info("Embedding model {} at {}", llm.embeddingModel(), llm.embeddingBaseUrl());
        return new OpenAiEmbeddingModel(api, MetadataMode.EMBED,
                OpenAiEmbeddingOptions.builder().model(llm.embeddingModel()).build(),
                noRetry());
    }

    @Bean
    public VectorStore curriculumVectorStore(EmbeddingModel embeddingModel) {
        return SimpleVectorStore.builder(embeddingModel).build();
    }

    static ProviderBinding bind(TutorProperties.Provider provider) {
        if (!StringUtils.hasText(provider.name())) {
            throw new IllegalStateException("Every tutor.llm.providers entry needs a name");
        }
        ChatModel chatModel = switch (provider.type().toLowerCase(Locale.ROOT)) {
            case "openai" -> openAiChatModel(provider);
            case "anthropic" -> anthropicChatModel(provider);
            default -> throw new IllegalStateException(
                    "Unknown provider type '" + provider.type() + "' for " + provider.name());
        };
        log.info("Provider '{}' ({}) model={} priority={} retries={}",
                provider.name(), provider.type(), provider.model(), provider.priority(), provider.maxRetries());
        return new ProviderBinding(new ChatModelLlmProvider(provider.name(), chatModel),
                provider.maxRetries(), provider.backoffBase(), provider.backoffMax(), provider.timeout(),
                new TokenPricing(provider.inputCostPer1k(), provider.outputCostPer1k()));
    }

    private static ChatModel openAiChatModel(TutorProperties.Provider provider) {
        OpenAiApi.Builder api = OpenAiApi.builder().apiKey(provider.apiKey());
        if (StringUtils.hasText(provider.baseUrl())) {
            api.baseUrl(provider.baseUrl());
        }
        return OpenAiChatModel.builder()
                .openAiApi(api.build())
                .defaultOptions(OpenAiChatOptions.builder().model(provider.model()).build())
                .retryTemplate(noRetry())
                .build();
    }

    private static ChatModel anthropicChatModel(TutorProperties.Provider provider) {
        AnthropicApi.Builder api = AnthropicApi.builder().apiKey(provider.apiKey());
        if (StringUtils.hasText(provider.baseUrl())) {
            api.baseUrl(provider.baseUrl());
        }
        return AnthropicChatModel.builder()
                .anthropicApi(api.build())
                .defaultOptions(AnthropicChatOptions.builder().model(provider.model()).build())
                .retryTemplate(noRetry())
                .build();
    }

    private static RetryTemplate noRetry() {
        return RetryTemplate.builder().maxAttempts(1).build();
    }
}
