package com.smurthy.ai.tutor.cache;

import com.smurthy.ai.tutor.model.AgentResponse;

import java.time.Instant;
import java.util.concurrent.atomic.AtomicLong;

/**
 * A stored response. Created on a miss after successful generation, its hit
 * count is incremented on every similarity hit. Expiry and eviction are left
 * to the owning cache.
 */
public class CacheEntry {

    private final CacheKey key;
    private final AtomicLong hitCount = new AtomicLong();
    private volatile AgentResponse response;
    private volatile Instant createdAt;
    private volatile Instant lastAccess;

    CacheEntry(CacheKey key, AgentResponse response, Instant now) {
        this.key = key;
        this.response = response;
        this.createdAt = now;
        this.lastAccess = now;
    }

    void recordHit(Instant now) {
        hitCount.incrementAndGet();
        lastAccess = now;
    }

    /**
     * Re-store of an existing key: replaces the response and restarts the TTL.
     */
    void refresh(AgentResponse newResponse, Instant now) {
        this.response = newResponse;
        this.createdAt = now;
        this.lastAccess = now;
    }

    public CacheKey key() {
        return key;
    }

    public float[] embedding() {
        return key.embedding();
    }

    public AgentResponse response() {
        return response;
    }

    public Instant createdAt() {
        return createdAt;
    }

    public Instant lastAccess() {
        return lastAccess;
    }

    public long hitCount() {
        return hitCount.get();
    }
}
