package com.smurthy.ai.tutor.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.smurthy.ai.tutor.agents.AnalystAgent;
import com.smurthy.ai.tutor.agents.ContentAgent;
import com.smurthy.ai.tutor.agents.GraderAgent;
import com.smurthy.ai.tutor.agents.SolverAgent;
import com.smurthy.ai.tutor.agents.SpecialistAgent;
import com.smurthy.ai.tutor.cache.CacheKeyFactory;
import com.smurthy.ai.tutor.cache.InMemorySemanticCache;
import com.smurthy.ai.tutor.cache.SemanticCache;
import com.smurthy.ai.tutor.llm.LlmClient;
import com.smurthy.ai.tutor.observability.RetrievalMetrics;
import com.smurthy.ai.tutor.orchestration.IntentClassifier;
import com.smurthy.ai.tutor.orchestration.ResponseMerger;
import com.smurthy.ai.tutor.orchestration.SpecialistRouter;
import com.smurthy.ai.tutor.orchestration.Supervisor;
import com.smurthy.ai.tutor.retrieval.CurriculumIngestionService;
import com.smurthy.ai.tutor.retrieval.RetrievalService;
import com.smurthy.ai.tutor.support.TimeBoundedCall;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.embedding.EmbeddingModel;
import org.springframework.ai.vectorstore.VectorStore;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Wires the tutoring core: step executors, cache, retrieval, specialists and supervisor.
 */
@Configuration
public class TutorConfiguration {

    private static final Logger log = LoggerFactory.getLogger(TutorConfiguration.class);

    /**
     * Executor for provider calls. Sized for many concurrent requests each
     * holding a thread through a completion and its retries.
     */
    @Bean(destroyMethod = "shutdown")
    public ExecutorService tutorProviderExecutor(TutorProperties properties) {
        int threadPoolSize = properties.executor().effectiveProviderThreads();
        log.info("Creating ExecutorService with {} threads for provider calls", threadPoolSize);
        return Executors.newFixedThreadPool(threadPoolSize);
    }

    @Bean(destroyMethod = "shutdown")
    public ExecutorService tutorRetrievalExecutor(TutorProperties properties) {
        int threadPoolSize = properties.executor().effectiveRetrievalThreads();
        log.info("Creating ExecutorService with {} threads for retrieval", threadPoolSize);
        return Executors.newFixedThreadPool(threadPoolSize);
    }

    /**
     * Cache lookups and detached cache writes.
     */
    @Bean(destroyMethod = "shutdown")
    public ExecutorService tutorCacheExecutor(TutorProperties properties) {
        int threadPoolSize = properties.executor().effectiveCacheThreads();
        log.info("Creating ExecutorService with {} threads for cache lookups and writes", threadPoolSize);
        return Executors.newFixedThreadPool(threadPoolSize);
    }

    @Bean
    public TimeBoundedCall providerCalls(@Qualifier("tutorProviderExecutor") ExecutorService executor) {
        return new TimeBoundedCall(executor);
    }

    @Bean
    public TimeBoundedCall retrievalCalls(@Qualifier("tutorRetrievalExecutor") ExecutorService executor) {
        return new TimeBoundedCall(executor);
    }

    @Bean
    public TimeBoundedCall cacheCalls(@Qualifier("tutorCacheExecutor") ExecutorService executor) {
        return new TimeBoundedCall(executor);
    }

    @Bean
    public RetrievalService retrievalService(VectorStore vectorStore,
                                             @Qualifier("retrievalCalls") TimeBoundedCall retrievalCalls,
                                             TutorProperties properties, RetrievalMetrics metrics) {
        return new RetrievalService(vectorStore, retrievalCalls, properties.retrieval(), metrics);
    }

    @Bean
    public CurriculumIngestionService curriculumIngestionService(VectorStore vectorStore) {
        return new CurriculumIngestionService(vectorStore);
    }

    @Bean
    public SemanticCache semanticCache(TutorProperties properties) {
        TutorProperties.Cache cache = properties.cache();
        log.info("Semantic cache: threshold={} ttl={} maxEntries={}",
                cache.similarityThreshold(), cache.ttl(), cache.maxEntries());
        return new InMemorySemanticCache(cache);
    }

    @Bean
    public CacheKeyFactory cacheKeyFactory(EmbeddingModel embeddingModel) {
        return new CacheKeyFactory(embeddingModel);
    }

    @Bean
    public ContentAgent contentAgent(LlmClient llmClient, ObjectMapper objectMapper) {
        return new ContentAgent(llmClient, objectMapper);
    }

    @Bean
    public SolverAgent solverAgent(LlmClient llmClient) {
        return new SolverAgent(llmClient);
    }

    @Bean
    public GraderAgent graderAgent(LlmClient llmClient, ObjectMapper objectMapper) {
        return new GraderAgent(llmClient, objectMapper);
    }

    @Bean
    public AnalystAgent analystAgent(LlmClient llmClient) {
        return new AnalystAgent(llmClient);
    }

    @Bean
    public Supervisor supervisor(List<SpecialistAgent> specialistAgents,
                                 SemanticCache semanticCache,
                                 CacheKeyFactory cacheKeyFactory,
                                 RetrievalService retrievalService,
                                 @Qualifier("cacheCalls") TimeBoundedCall cacheCalls,
                                 TutorProperties properties) {
        return new Supervisor(
                new IntentClassifier(),
                new SpecialistRouter(properties.supervisor().routing()),
                specialistAgents,
                semanticCache,
                cacheKeyFactory,
                retrievalService,
                new ResponseMerger(),
                cacheCalls,
                properties.cache());
    }
}
