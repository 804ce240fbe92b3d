package com.smurthy.ai.tutor.orchestration;

import com.smurthy.ai.tutor.agents.SpecialistAgent;
import com.smurthy.ai.tutor.agents.SpecialistRequest;
import com.smurthy.ai.tutor.cache.CacheEntry;
import com.smurthy.ai.tutor.cache.CacheKey;
import com.smurthy.ai.tutor.cache.CacheKeyFactory;
import com.smurthy.ai.tutor.cache.SemanticCache;
import com.smurthy.ai.tutor.config.TutorProperties;
import com.smurthy.ai.tutor.llm.ProviderException;
import com.smurthy.ai.tutor.model.AgentResponse;
import com.smurthy.ai.tutor.model.ClassificationResult;
import com.smurthy.ai.tutor.model.Provenance;
import com.smurthy.ai.tutor.model.SpecialistKind;
import com.smurthy.ai.tutor.model.StudentProfile;
import com.smurthy.ai.tutor.model.TutorQuery;
import com.smurthy.ai.tutor.retrieval.RetrievalScope;
import com.smurthy.ai.tutor.retrieval.RetrievalService;
import com.smurthy.ai.tutor.retrieval.RetrievedContext;
import com.smurthy.ai.tutor.support.TimeBoundedCall;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Entry point of the tutoring core: one query in, exactly one response out.
 *
 * classify -> cache lookup -> (on miss) retrieval when the intent needs
 * grounding -> specialist chain -> merge -> asynchronous cache write.
 * Cache and retrieval failures degrade the request; only a chain in which
 * no specialist produced anything fails it, with {@link OrchestrationException}.
 */
public class Supervisor {

    private static final Logger log = LoggerFactory.getLogger(Supervisor.class);

    private final IntentClassifier classifier;
    private final SpecialistRouter router;
    private final Map<SpecialistKind, SpecialistAgent> specialists;
    private final SemanticCache cache;
    private final CacheKeyFactory cacheKeyFactory;
    private final RetrievalService retrievalService;
    private final ResponseMerger merger;
    private final TimeBoundedCall cacheCalls;
    private final TutorProperties.Cache cacheSettings;

    public Supervisor(IntentClassifier classifier,
                      SpecialistRouter router,
                      List<SpecialistAgent> specialistAgents,
                      SemanticCache cache,
                      CacheKeyFactory cacheKeyFactory,
                      RetrievalService retrievalService,
                      ResponseMerger merger,
                      TimeBoundedCall cacheCalls,
                      TutorProperties.Cache cacheSettings) {
        this.classifier = classifier;
        this.router = router;
        this.cache = cache;
        this.cacheKeyFactory = cacheKeyFactory;
        this.retrievalService = retrievalService;
        this.merger = merger;
        this.cacheCalls = cacheCalls;
        this.cacheSettings = cacheSettings;

        this.specialists = new EnumMap<>(SpecialistKind.class);
        for (SpecialistAgent agent : specialistAgents) {
            if (this.specialists.putIfAbsent(agent.kind(), agent) != null) {
                throw new IllegalArgumentException("Duplicate specialist registered for " + agent.kind());
            }
        }
        log.info("Supervisor initialized with specialists {}", this.specialists.keySet());
    }

    /**
     * Handle one query.
     *
     * @throws OrchestrationException when every specialist in the chain exhausted all providers
     * @throws java.util.concurrent.CancellationException when the calling thread is interrupted
     */
    public AgentResponse handle(TutorQuery query, StudentProfile profile) {
        long startTime = System.currentTimeMillis();

        ClassificationResult classification = classifier.classify(query, profile);
        RoutingPlan plan = router.plan(classification, query);
        log.info("[Supervisor] tenant={} intent={} confidence={} plan={} | {}",
                query.tenantId(), classification.intent().label(),
                String.format("%.2f", classification.confidence()), plan.specialists(), classification.reasoning());

        CacheLookup lookup = lookupCache(query, profile, classification);
        if (lookup.hit().isPresent()) {
            CacheEntry entry = lookup.hit().get();
            long elapsed = System.currentTimeMillis() - startTime;
            log.info("[Supervisor] Cache hit for tenant={} intent={} ({} hits) in {}ms",
                    query.tenantId(), classification.intent().label(), entry.hitCount(), elapsed);
            return entry.response().withProvenance(Provenance.CACHE_HIT).withLatency(elapsed);
        }

        RetrievedContext context = classification.requiresGrounding()
                ? retrievalService.retrieve(query.text(), new RetrievalScope(query.tenantId(), profile.subject(), profile.grade()))
                : RetrievedContext.empty();

        SpecialistRequest request = new SpecialistRequest(query, profile, classification, context, List.of());
        AgentResponse merged = runChain(plan, request);
        AgentResponse response = merged.withLatency(System.currentTimeMillis() - startTime);

        log.info("[Supervisor] Answered tenant={} via {} provenance={} in {}ms",
                query.tenantId(), response.specialistsRun(), response.provenance().wireName(), response.latencyMs());

        if (lookup.key() != null && isCacheable(response)) {
            writeBehind(lookup.key(), response);
        }
        return response;
    }

    private AgentResponse runChain(RoutingPlan plan, SpecialistRequest request) {
        List<AgentResponse> results = new ArrayList<>();
        List<ProviderException> failures = new ArrayList<>();
        List<SpecialistKind> failedSpecialists = new ArrayList<>();

        for (SpecialistKind kind : plan.specialists()) {
            SpecialistAgent agent = specialists.get(kind);
            if (agent == null) {
                throw new IllegalStateException("No specialist registered for " + kind);
            }
            try {
                results.add(agent.execute(request.withPriorResults(results)));
            } catch (ProviderException e) {
                log.warn("[Supervisor] Specialist {} failed after providers {}: {}",
                        kind.id(), e.attemptedProviders(), e.getMessage());
                failures.add(e);
                failedSpecialists.add(kind);
            }
        }

        if (results.isEmpty()) {
            ProviderException first = failures.get(0);
            int attempts = failures.stream().mapToInt(ProviderException::attempts).sum();
            OrchestrationError error = new OrchestrationError(
                    plan.primary().id(),
                    plan.intent().label(),
                    first.attemptedProviders(),
                    attempts,
                    "No specialist could produce a response: " + failedSpecialists.get(0).id()
                            + " exhausted providers " + first.attemptedProviders());
            log.error("[Supervisor] {}", error.message());
            throw new OrchestrationException(error, first);
        }

        return merger.merge(plan, results, !failures.isEmpty());
    }

    /**
     * Embedding plus lookup, bounded by the cache lookup timeout. Any failure
     * or timeout is a miss; the key is kept only if it was built.
     */
    private CacheLookup lookupCache(TutorQuery query, StudentProfile profile, ClassificationResult classification) {
        AtomicReference<CacheKey> built = new AtomicReference<>();
        try {
            return cacheCalls.call(() -> {
                CacheKey key = cacheKeyFactory.create(query, profile, classification.intent());
                built.set(key);
                return new CacheLookup(key, cache.lookup(key));
            }, cacheSettings.lookupTimeout());
        } catch (TimeoutException e) {
            log.warn("[Supervisor] Cache lookup exceeded {}ms, treating as miss", cacheSettings.lookupTimeout().toMillis());
            return new CacheLookup(built.get(), Optional.empty());
        } catch (ExecutionException e) {
            log.warn("[Supervisor] Cache lookup failed, treating as miss: {}", e.getCause().getMessage());
            return new CacheLookup(built.get(), Optional.empty());
        }
    }

    private boolean isCacheable(AgentResponse response) {
        return response.provenance() == Provenance.GENERATED
                || (cacheSettings.storeDegraded() && response.provenance() == Provenance.FALLBACK_DEGRADED);
    }

    /**
     * The write is detached from the request: it completes even if the caller goes away.
     */
    private void writeBehind(CacheKey key, AgentResponse response) {
        try {
            cacheCalls.detach(() -> {
                try {
                    cache.store(key, response);
                } catch (RuntimeException e) {
                    log.warn("[Supervisor] Cache write failed for {}: {}", key, e.getMessage());
                }
            });
        } catch (RuntimeException e) {
            log.warn("[Supervisor] Could not schedule cache write for {}: {}", key, e.getMessage());
        }
    }

    private record CacheLookup(CacheKey key, Optional<CacheEntry> hit) {
    }
}
