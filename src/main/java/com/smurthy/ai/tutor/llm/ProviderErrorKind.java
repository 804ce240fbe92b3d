package com.smurthy.ai.tutor.llm;

import com.fasterxml.jackson.annotation.JsonValue;

public enum ProviderErrorKind {
    TIMEOUT("timeout"),
    RATE_LIMITED("rate-limited"),
    INVALID_RESPONSE("invalid-response"),
    UNAVAILABLE("unavailable");

    private final String wireName;

    ProviderErrorKind(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }
}
