package com.smurthy.ai.tutor.llm;

import org.springframework.ai.retry.NonTransientAiException;

import java.net.SocketTimeoutException;
import java.util.List;

/**
 * A language-model provider failed. When raised by {@link LlmClient} with
 * kind {@link ProviderErrorKind#UNAVAILABLE}, every configured provider has
 * been tried and {@link #attemptedProviders()} lists them in order.
 */
public class ProviderException extends RuntimeException {

    private final ProviderErrorKind kind;
    private final String provider;
    private final List<String> attemptedProviders;
    private final int attempts;

    public ProviderException(ProviderErrorKind kind, String provider, String message) {
        this(kind, provider, message, List.of(provider), 1, null);
    }

    public ProviderException(ProviderErrorKind kind, String provider, String message, Throwable cause) {
        this(kind, provider, message, List.of(provider), 1, cause);
    }

    public ProviderException(ProviderErrorKind kind, String provider, String message,
                             List<String> attemptedProviders, int attempts, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.provider = provider;
        this.attemptedProviders = List.copyOf(attemptedProviders);
        this.attempts = attempts;
    }

    /**
     * Translates a raw client exception into a typed provider failure.
     */
    public static ProviderException from(String provider, Throwable error) {
        if (error instanceof ProviderException providerException) {
            return providerException;
        }
        String message = error.getMessage() == null ? error.getClass().getSimpleName() : error.getMessage();
        return new ProviderException(classify(error), provider, provider + ": " + message, error);
    }

    static ProviderErrorKind classify(Throwable error) {
        for (Throwable t = error; t != null; t = t.getCause()) {
            if (t instanceof SocketTimeoutException || t instanceof java.util.concurrent.TimeoutException) {
                return ProviderErrorKind.TIMEOUT;
            }
            if (isRateLimitError(t.getMessage())) {
                return ProviderErrorKind.RATE_LIMITED;
            }
        }
        if (error instanceof NonTransientAiException || error instanceof IllegalArgumentException
                || error instanceof com.fasterxml.jackson.core.JacksonException) {
            return ProviderErrorKind.INVALID_RESPONSE;
        }
        // TransientAiException, I/O errors and anything unrecognised
        return ProviderErrorKind.UNAVAILABLE;
    }

    /**
     * Detects if an error message indicates a rate limit issue.
     */
    private static boolean isRateLimitError(String errorMessage) {
        if (errorMessage == null) return false;
        String lower = errorMessage.toLowerCase();
        return lower.contains("rate limit")
                || lower.contains("too many requests")
                || lower.contains("429")
                || lower.contains("quota exceeded");
    }

    public ProviderErrorKind kind() {
        return kind;
    }

    public String provider() {
        return provider;
    }

    public List<String> attemptedProviders() {
        return attemptedProviders;
    }

    public int attempts() {
        return attempts;
    }
}
