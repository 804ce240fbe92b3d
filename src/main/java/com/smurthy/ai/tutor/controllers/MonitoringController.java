package com.smurthy.ai.tutor.controllers;

import com.smurthy.ai.tutor.cache.CacheStats;
import com.smurthy.ai.tutor.cache.SemanticCache;
import com.smurthy.ai.tutor.llm.ProviderUsageTracker;
import com.smurthy.ai.tutor.observability.RetrievalMetrics;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * Monitoring endpoint
 */
@RestController
@RequestMapping("/monitoring")
class MonitoringController {

    private final SemanticCache semanticCache;
    private final ProviderUsageTracker usageTracker;
    private final RetrievalMetrics retrievalMetrics;

    public MonitoringController(SemanticCache semanticCache, ProviderUsageTracker usageTracker,
                                RetrievalMetrics retrievalMetrics) {
        this.semanticCache = semanticCache;
        this.usageTracker = usageTracker;
        this.retrievalMetrics = retrievalMetrics;
    }

    @GetMapping("/cache")
    public CacheStatus getCacheStats() {
        CacheStats stats = semanticCache.stats();
        return new CacheStatus(stats.entries(), stats.hits(), stats.misses(), stats.stores(),
                stats.evictions(), stats.expirations(), stats.hitRate());
    }

    @PostMapping("/cache/reset")
    public void resetCache() {
        semanticCache.clear();
    }

    @DeleteMapping("/cache/tenants/{tenantId}")
    public InvalidationResult invalidateTenant(@PathVariable String tenantId) {
        return new InvalidationResult(tenantId, semanticCache.invalidateTenant(tenantId));
    }

    @GetMapping("/providers")
    public List<ProviderUsageTracker.ProviderUsageSnapshot> getProviderUsage() {
        return usageTracker.snapshot();
    }

    @GetMapping("/usage/tenants/{tenantId}")
    public ProviderUsageTracker.TenantUsageSnapshot getTenantUsage(@PathVariable String tenantId) {
        return usageTracker.tenantUsage(tenantId);
    }

    @GetMapping("/retrieval")
    public RetrievalMetrics.MetricsSummary getRetrievalMetrics() {
        return retrievalMetrics.getMetricsSummary();
    }

    @PostMapping("/retrieval/reset")
    public void resetRetrievalMetrics() {
        retrievalMetrics.resetMetrics();
    }

    record CacheStatus(long entries, long hits, long misses, long stores, long evictions, long expirations,
                       double hitRate) {}

    record InvalidationResult(String tenantId, int removed) {}
}
