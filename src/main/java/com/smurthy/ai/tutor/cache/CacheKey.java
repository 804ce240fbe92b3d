package com.smurthy.ai.tutor.cache;

import com.smurthy.ai.tutor.model.Intent;

import java.util.Objects;

/**
 * Composite cache key. Identity (for idempotent stores) is tenant, intent,
 * normalized query text and context fingerprint; the embedding is carried
 * along for similarity lookup and excluded from equality.
 *
 * @param contextFingerprint hash of the request context an answer depends on
 *                           besides the query text (subject, grade, submitted answer)
 */
public record CacheKey(
        String tenantId,
        Intent intent,
        String normalizedQuery,
        String contextFingerprint,
        float[] embedding
) {
    public CacheKey {
        Objects.requireNonNull(tenantId, "tenantId");
        Objects.requireNonNull(intent, "intent");
        Objects.requireNonNull(normalizedQuery, "normalizedQuery");
        Objects.requireNonNull(contextFingerprint, "contextFingerprint");
        Objects.requireNonNull(embedding, "embedding");
    }

    /**
     * Entries are only ever compared within one partition.
     */
    public Partition partition() {
        return new Partition(tenantId, intent, contextFingerprint);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof CacheKey other)) return false;
        return tenantId.equals(other.tenantId)
                && intent == other.intent
                && normalizedQuery.equals(other.normalizedQuery)
                && contextFingerprint.equals(other.contextFingerprint);
    }

    @Override
    public int hashCode() {
        return Objects.hash(tenantId, intent, normalizedQuery, contextFingerprint);
    }

    @Override
    public String toString() {
        return "CacheKey[tenant=" + tenantId + ", intent=" + intent.label()
                + ", query='" + normalizedQuery + "', context=" + contextFingerprint.substring(0, Math.min(12, contextFingerprint.length())) + "]";
    }

    public record Partition(String tenantId, Intent intent, String contextFingerprint) {
    }
}
