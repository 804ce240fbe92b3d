package com.smurthy.ai.tutor.llm;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.DoubleAdder;
import java.util.concurrent.atomic.LongAdder;

/**
 * Tracks call outcomes per language-model provider, and the tokens and
 * estimated cost each tenant spends on each provider.
 */
@Service
public class ProviderUsageTracker {

    /**
     * Tenant that completions made outside a tenant's request are billed to.
     */
    public static final String UNSCOPED_TENANT = "_unscoped";

    private static final Logger log = LoggerFactory.getLogger(ProviderUsageTracker.class);

    // Provider name -> Usage stats
    private final Map<String, ProviderUsageStats> usageStats = new ConcurrentHashMap<>();

    // Tenant id -> provider name -> token totals
    private final Map<String, Map<String, TokenTally>> tenantTokens = new ConcurrentHashMap<>();

    public void recordSuccess(String providerName) {
        ProviderUsageStats stats = getOrCreateStats(providerName);
        stats.recordSuccess();
        log.debug("Recorded success for {}: {}", providerName, stats.getSummary());
    }

    public void recordFailure(String providerName, ProviderErrorKind kind, String reason) {
        ProviderUsageStats stats = getOrCreateStats(providerName);
        stats.recordFailure(kind, reason);
        if (kind == ProviderErrorKind.RATE_LIMITED) {
            log.warn("Rate limit hit for {}: {}", providerName, stats.getSummary());
        } else {
            log.debug("Recorded {} failure for {}: {}", kind.wireName(), providerName, stats.getSummary());
        }
    }

    /**
     * Adds the tokens of one successful completion to the tenant's totals.
     */
    public void recordTokens(String tenantId, String providerName, TokenUsage usage, double costUsd) {
        String tenant = tenantId == null || tenantId.isBlank() ? UNSCOPED_TENANT : tenantId;
        tenantTokens.computeIfAbsent(tenant, t -> new ConcurrentHashMap<>())
                .computeIfAbsent(providerName, p -> new TokenTally())
                .add(usage, costUsd);
        log.debug("Recorded {} tokens (${}) for tenant {} on {}",
                usage.totalTokens(), String.format("%.6f", costUsd), tenant, providerName);
    }

    /**
     * Token and cost totals of one tenant, broken down by provider. A tenant
     * with no recorded completions gets zero totals.
     */
    public TenantUsageSnapshot tenantUsage(String tenantId) {
        Map<String, TokenTally> byProvider = tenantTokens.getOrDefault(tenantId, Map.of());
        List<ProviderTokenUsage> providers = byProvider.entrySet().stream()
                .map(e -> e.getValue().toUsage(e.getKey()))
                .sorted((a, b) -> a.provider().compareTo(b.provider()))
                .toList();
        long input = providers.stream().mapToLong(ProviderTokenUsage::inputTokens).sum();
        long output = providers.stream().mapToLong(ProviderTokenUsage::outputTokens).sum();
        double cost = providers.stream().mapToDouble(ProviderTokenUsage::costUsd).sum();
        long calls = providers.stream().mapToLong(ProviderTokenUsage::calls).sum();
        return new TenantUsageSnapshot(tenantId, calls, input, output, input + output, cost, providers);
    }

    public ProviderUsageStats getStats(String providerName) {
        return getOrCreateStats(providerName);
    }

    public List<ProviderUsageSnapshot> snapshot() {
        return usageStats.values().stream()
                .map(ProviderUsageStats::toSnapshot)
                .sorted((a, b) -> a.provider().compareTo(b.provider()))
                .toList();
    }

    /**
     * Resets statistics for all providers (useful for testing).
     */
    public void resetAll() {
        usageStats.clear();
        tenantTokens.clear();
        log.info("Reset all provider usage statistics");
    }

    private ProviderUsageStats getOrCreateStats(String providerName) {
        return usageStats.computeIfAbsent(providerName, ProviderUsageStats::new);
    }

    /**
     * Usage statistics for a single provider.
     */
    public static class ProviderUsageStats {
        private final String providerName;
        private final AtomicInteger successCount = new AtomicInteger(0);
        private final AtomicInteger failureCount = new AtomicInteger(0);
        private final AtomicInteger rateLimitCount = new AtomicInteger(0);
        private final AtomicInteger timeoutCount = new AtomicInteger(0);
        private Instant lastSuccess;
        private Instant lastFailure;
        private String lastFailureReason;

        public ProviderUsageStats(String providerName) {
            this.providerName = providerName;
        }

        public synchronized void recordSuccess() {
            successCount.incrementAndGet();
            lastSuccess = Instant.now();
        }

        public synchronized void recordFailure(ProviderErrorKind kind, String reason) {
            failureCount.incrementAndGet();
            if (kind == ProviderErrorKind.RATE_LIMITED) {
                rateLimitCount.incrementAndGet();
            } else if (kind == ProviderErrorKind.TIMEOUT) {
                timeoutCount.incrementAndGet();
            }
            lastFailure = Instant.now();
            lastFailureReason = reason;
        }

        public double getSuccessRate() {
            int total = successCount.get() + failureCount.get();
            return total == 0 ? 0.0 : (double) successCount.get() / total;
        }

        public String getSummary() {
            return String.format(
                    "Success: %d, Failures: %d, RateLimits: %d, Timeouts: %d, SuccessRate: %.2f%%",
                    successCount.get(),
                    failureCount.get(),
                    rateLimitCount.get(),
                    timeoutCount.get(),
                    getSuccessRate() * 100
            );
        }

        synchronized ProviderUsageSnapshot toSnapshot() {
            return new ProviderUsageSnapshot(providerName, successCount.get(), failureCount.get(),
                    rateLimitCount.get(), timeoutCount.get(), lastSuccess, lastFailure, lastFailureReason);
        }

        public String getProviderName() { return providerName; }
        public int getSuccessCount() { return successCount.get(); }
        public int getFailureCount() { return failureCount.get(); }
        public int getRateLimitCount() { return rateLimitCount.get(); }
        public int getTimeoutCount() { return timeoutCount.get(); }
    }

    public record ProviderUsageSnapshot(
            String provider,
            int successes,
            int failures,
            int rateLimits,
            int timeouts,
            Instant lastSuccess,
            Instant lastFailure,
            String lastFailureReason
    ) {}

    private static final class TokenTally {
        private final LongAdder calls = new LongAdder();
        private final LongAdder inputTokens = new LongAdder();
        private final LongAdder outputTokens = new LongAdder();
        private final DoubleAdder costUsd = new DoubleAdder();

        void add(TokenUsage usage, double cost) {
            calls.increment();
            inputTokens.add(usage.inputTokens());
            outputTokens.add(usage.outputTokens());
            costUsd.add(cost);
        }

        ProviderTokenUsage toUsage(String provider) {
            long input = inputTokens.sum();
            long output = outputTokens.sum();
            return new ProviderTokenUsage(provider, calls.sum(), input, output, input + output, costUsd.sum());
        }
    }

    public record ProviderTokenUsage(
            String provider,
            long calls,
            long inputTokens,
            long outputTokens,
            long totalTokens,
            double costUsd
    ) {}

    public record TenantUsageSnapshot(
            String tenantId,
            long calls,
            long inputTokens,
            long outputTokens,
            long totalTokens,
            double costUsd,
            List<ProviderTokenUsage> byProvider
    ) {}
}
