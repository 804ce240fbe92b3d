package com.smurthy.ai.tutor.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Where a response came from.
 */
public enum Provenance {
    CACHE_HIT("cache-hit"),
    GENERATED("generated"),
    FALLBACK_DEGRADED("fallback-degraded");

    private final String wireName;

    Provenance(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }
}
