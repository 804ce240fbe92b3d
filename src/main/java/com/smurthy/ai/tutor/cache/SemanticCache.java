package com.smurthy.ai.tutor.cache;

import com.smurthy.ai.tutor.model.AgentResponse;

import java.util.Optional;

/**
 * Response cache keyed by meaning rather than exact text.
 *
 * A lookup only considers entries with the same tenant, intent and context
 * fingerprint, and accepts the nearest one only if its similarity reaches the
 * configured threshold. Eviction (TTL and capacity) is owned by the cache.
 * Implementations must support concurrent reads and writes.
 */
public interface SemanticCache {

    /**
     * @return the most similar live entry at or above the threshold, if any
     */
    Optional<CacheEntry> lookup(CacheKey key);

    /**
     * Store a response. Storing an existing key updates it rather than adding a duplicate.
     */
    void store(CacheKey key, AgentResponse response);

    /**
     * Drop every entry of a tenant.
     *
     * @return number of entries removed
     */
    int invalidateTenant(String tenantId);

    /**
     * Remove entries past their time-to-live.
     *
     * @return number of entries removed
     */
    int purgeExpired();

    CacheStats stats();

    void clear();
}
