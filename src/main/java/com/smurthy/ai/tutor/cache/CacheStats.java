package com.smurthy.ai.tutor.cache;

public record CacheStats(
        long entries,
        long hits,
        long misses,
        long stores,
        long evictions,
        long expirations
) {
    public double hitRate() {
        long lookups = hits + misses;
        return lookups == 0 ? 0.0 : (double) hits / lookups;
    }
}
