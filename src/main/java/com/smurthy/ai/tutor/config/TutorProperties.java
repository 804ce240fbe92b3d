package com.smurthy.ai.tutor.config;

import com.smurthy.ai.tutor.model.Intent;
import com.smurthy.ai.tutor.model.SpecialistKind;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.time.Duration;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.stream.IntStream;

/**
 * Configuration surface of the tutoring core. Thresholds, bounds, provider
 * order and timeouts are injected from here; nothing is hardcoded in the
 * components.
 */
@ConfigurationProperties(prefix = "tutor")
public record TutorProperties(
        @DefaultValue Cache cache,
        @DefaultValue Retrieval retrieval,
        @DefaultValue Llm llm,
        @DefaultValue Supervisor supervisor,
        @DefaultValue Executor executor
) {

    /**
     * Semantic cache bounds.
     */
    public record Cache(
            @DefaultValue("0.92") double similarityThreshold,
            @DefaultValue("1h") Duration ttl,
            @DefaultValue("10000") int maxEntries,
            @DefaultValue("250ms") Duration lookupTimeout,
            @DefaultValue("false") boolean storeDegraded,
            @DefaultValue("60s") Duration purgeInterval
    ) {
    }

    public record Retrieval(
            @DefaultValue("5") int topK,
            @DefaultValue("0.60") double scoreFloor,
            @DefaultValue("2s") Duration timeout
    ) {
    }

    /**
     * Provider chain plus the embedding endpoint used by the cache and the vector index.
     */
    public record Llm(
            List<Provider> providers,
            @DefaultValue("text-embedding-3-small") String embeddingModel,
            @DefaultValue("https://api.openai.com") String embeddingBaseUrl,
            @DefaultValue("unset") String embeddingApiKey
    ) {
        public Llm {
            providers = providers == null ? List.of() : List.copyOf(providers);
        }

        /**
         * Enabled providers in consultation order: ascending priority, declaration order on ties.
         */
        public List<Provider> orderedProviders() {
            return IntStream.range(0, providers.size())
                    .boxed()
                    .filter(i -> providers.get(i).enabled())
                    .sorted(Comparator.<Integer>comparingInt(i -> providers.get(i).priority()).thenComparing(i -> i))
                    .map(providers::get)
                    .toList();
        }
    }

    public record Provider(
            String name,
            @DefaultValue("openai") String type,
            String baseUrl,
            String model,
            @DefaultValue("unset") String apiKey,
            @DefaultValue("2") int maxRetries,
            @DefaultValue("500ms") Duration backoffBase,
            @DefaultValue("8s") Duration backoffMax,
            @DefaultValue("30s") Duration timeout,
            @DefaultValue("true") boolean enabled,
            @DefaultValue("100") int priority,
            @DefaultValue("0") double inputCostPer1k,
            @DefaultValue("0") double outputCostPer1k
    ) {
    }

    /**
     * Optional per-intent override of the specialist chain. Intents without an
     * entry use the built-in routing table.
     */
    public record Supervisor(Map<Intent, List<SpecialistKind>> routing) {
        public Supervisor {
            routing = routing == null ? Map.of() : Map.copyOf(routing);
        }
    }

    /**
     * Thread pools for time-bounded steps. Provider calls, retrieval and cache
     * work run on separate pools so slow model calls never hold up a cache
     * lookup. Zero picks a size from the processor count.
     */
    public record Executor(
            @DefaultValue("0") int providerThreads,
            @DefaultValue("0") int retrievalThreads,
            @DefaultValue("0") int cacheThreads
    ) {
        public int effectiveProviderThreads() {
            return providerThreads > 0 ? providerThreads : Math.max(8, 2 * Runtime.getRuntime().availableProcessors());
        }

        public int effectiveRetrievalThreads() {
            return retrievalThreads > 0 ? retrievalThreads : Math.max(4, Runtime.getRuntime().availableProcessors());
        }

        public int effectiveCacheThreads() {
            return cacheThreads > 0 ? cacheThreads : Math.max(4, Runtime.getRuntime().availableProcessors());
        }
    }
}
