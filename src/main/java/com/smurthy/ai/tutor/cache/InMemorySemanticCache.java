package com.smurthy.ai.tutor.cache;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.RemovalCause;
import com.github.benmanes.caffeine.cache.Ticker;
import com.github.benmanes.caffeine.cache.stats.ConcurrentStatsCounter;
import com.smurthy.ai.tutor.config.TutorProperties;
import com.smurthy.ai.tutor.model.AgentResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.LongAdder;

/**
 * Process-local {@link SemanticCache} backed by Caffeine.
 *
 * One Caffeine cache holds every entry and owns the capacity bound and the
 * absolute time-to-live. A per-partition key index (tenant, intent, context
 * fingerprint) keeps the similarity scan to the candidates a key may match.
 */
public class InMemorySemanticCache implements SemanticCache {

    private static final Logger log = LoggerFactory.getLogger(InMemorySemanticCache.class);

    private final Cache<CacheKey, CacheEntry> entries;
    private final Map<CacheKey.Partition, Set<CacheKey>> index = new ConcurrentHashMap<>();
    private final ConcurrentStatsCounter statsCounter = new ConcurrentStatsCounter();

    private final TutorProperties.Cache settings;
    private final Clock clock;

    private final LongAdder stores = new LongAdder();
    private final LongAdder evictions = new LongAdder();
    private final LongAdder expirations = new LongAdder();
    private volatile com.github.benmanes.caffeine.cache.stats.CacheStats baseline =
            com.github.benmanes.caffeine.cache.stats.CacheStats.empty();

    public InMemorySemanticCache(TutorProperties.Cache settings) {
        this(settings, Clock.systemUTC());
    }

    public InMemorySemanticCache(TutorProperties.Cache settings, Clock clock) {
        if (settings.maxEntries() < 1) {
            throw new IllegalArgumentException("tutor.cache.max-entries must be positive");
        }
        this.settings = settings;
        this.clock = clock;
        this.entries = Caffeine.newBuilder()
                .maximumSize(settings.maxEntries())
                .expireAfterWrite(settings.ttl())
                .ticker(clockTicker(clock))
                .executor(Runnable::run)
                .recordStats(() -> statsCounter)
                .evictionListener((CacheKey key, CacheEntry entry, RemovalCause cause) -> onEviction(key, cause))
                .build();
    }

    @Override
    public Optional<CacheEntry> lookup(CacheKey key) {
        Set<CacheKey> candidates = index.get(key.partition());
        if (candidates == null) {
            statsCounter.recordMisses(1);
            return Optional.empty();
        }

        CacheEntry best = null;
        double bestSimilarity = Double.NEGATIVE_INFINITY;
        for (CacheKey candidate : candidates) {
            // asMap().get hides expired entries and leaves hit/miss stats alone
            CacheEntry entry = entries.asMap().get(candidate);
            if (entry == null) {
                continue;
            }
            double similarity = VectorMath.cosineSimilarity(key.embedding(), entry.embedding());
            if (similarity > bestSimilarity) {
                bestSimilarity = similarity;
                best = entry;
            }
        }

        if (best == null || bestSimilarity < settings.similarityThreshold()) {
            statsCounter.recordMisses(1);
            log.debug("[SemanticCache] Miss for {} (best similarity {})", key,
                    best == null ? "n/a" : String.format("%.4f", bestSimilarity));
            return Optional.empty();
        }

        // Records the hit and the access for the size policy
        CacheEntry live = entries.getIfPresent(best.key());
        if (live == null) {
            return Optional.empty();
        }
        live.recordHit(clock.instant());
        log.debug("[SemanticCache] Hit for {} with similarity {}", key, String.format("%.4f", bestSimilarity));
        return Optional.of(live);
    }

    @Override
    public void store(CacheKey key, AgentResponse response) {
        Instant now = clock.instant();
        entries.asMap().compute(key, (k, existing) -> {
            if (existing != null) {
                existing.refresh(response, now);
                return existing;
            }
            return new CacheEntry(key, response, now);
        });
        index.compute(key.partition(), (partition, keys) -> {
            Set<CacheKey> target = keys != null ? keys : ConcurrentHashMap.newKeySet();
            target.add(key);
            return target;
        });
        stores.increment();
    }

    @Override
    public int invalidateTenant(String tenantId) {
        int removed = 0;
        for (CacheKey.Partition partition : index.keySet()) {
            if (!partition.tenantId().equals(tenantId)) {
                continue;
            }
            Set<CacheKey> keys = index.remove(partition);
            if (keys == null) {
                continue;
            }
            for (CacheKey key : keys) {
                if (entries.asMap().remove(key) != null) {
                    removed++;
                }
            }
        }
        log.info("[SemanticCache] Invalidated {} entries for tenant {}", removed, tenantId);
        return removed;
    }

    @Override
    public int purgeExpired() {
        long before = expirations.sum();
        entries.cleanUp();
        int removed = (int) (expirations.sum() - before);
        if (removed > 0) {
            log.debug("[SemanticCache] Purged {} expired entries", removed);
        }
        return removed;
    }

    @Override
    public CacheStats stats() {
        entries.cleanUp();
        com.github.benmanes.caffeine.cache.stats.CacheStats snapshot = statsCounter.snapshot().minus(baseline);
        return new CacheStats(entries.estimatedSize(), snapshot.hitCount(), snapshot.missCount(),
                stores.sum(), evictions.sum(), expirations.sum());
    }

    @Override
    public void clear() {
        index.clear();
        entries.invalidateAll();
        baseline = statsCounter.snapshot();
        stores.reset();
        evictions.reset();
        expirations.reset();
        log.info("[SemanticCache] Cleared");
    }

    private void onEviction(CacheKey key, RemovalCause cause) {
        if (cause == RemovalCause.EXPIRED) {
            expirations.increment();
        } else if (cause == RemovalCause.SIZE) {
            evictions.increment();
            log.debug("[SemanticCache] Evicted {} over capacity", key);
        }
        index.computeIfPresent(key.partition(), (partition, keys) -> {
            keys.remove(key);
            return keys.isEmpty() ? null : keys;
        });
    }

    private static Ticker clockTicker(Clock clock) {
        return () -> {
            Instant now = clock.instant();
            return now.getEpochSecond() * 1_000_000_000L + now.getNano();
        };
    }
}
