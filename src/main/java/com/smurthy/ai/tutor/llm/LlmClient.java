package com.smurthy.ai.tutor.llm;

import com.smurthy.ai.tutor.support.TimeBoundedCall;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.retry.backoff.BackOffInterruptedException;
import org.springframework.retry.support.RetryTemplate;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeoutException;

/**
 * Uniform completion interface over an ordered chain of providers.
 *
 * Each provider is retried up to its configured count with exponential
 * backoff; once its retries are spent the client advances to the next
 * provider in order. Per-provider attempts come back as typed
 * {@link ProviderOutcome}s, so the chain itself is a plain loop.
 * Exhausting every provider raises {@link ProviderException} with kind
 * {@link ProviderErrorKind#UNAVAILABLE}. Tokens of every successful call are
 * billed to the prompt's tenant at the answering provider's price.
 */
public class LlmClient {

    private static final Logger log = LoggerFactory.getLogger(LlmClient.class);

    private final List<ProviderBinding> providers;
    private final List<RetryTemplate> retryTemplates;
    private final TimeBoundedCall timeBoundedCall;
    private final ProviderUsageTracker usageTracker;

    public LlmClient(List<ProviderBinding> providers, TimeBoundedCall timeBoundedCall, ProviderUsageTracker usageTracker) {
        if (providers.isEmpty()) {
            throw new IllegalArgumentException("At least one language-model provider must be configured");
        }
        this.providers = List.copyOf(providers);
        this.retryTemplates = this.providers.stream().map(LlmClient::retryTemplateFor).toList();
        this.timeBoundedCall = timeBoundedCall;
        this.usageTracker = usageTracker;
        log.info("Initialized LlmClient with {} providers in order: {}",
                this.providers.size(), this.providers.stream().map(ProviderBinding::name).toList());
    }

    /**
     * Complete a prompt, falling back through the provider chain.
     *
     * @throws ProviderException kind UNAVAILABLE once every provider is exhausted
     */
    public Completion complete(LlmPrompt prompt, CompletionOptions options) {
        long startTime = System.currentTimeMillis();
        List<String> attempted = new ArrayList<>();
        int totalAttempts = 0;
        ProviderOutcome lastFailure = null;

        for (int index = 0; index < providers.size(); index++) {
            ProviderBinding binding = providers.get(index);
            attempted.add(binding.name());

            ProviderOutcome outcome = tryProvider(index, binding, prompt, options);
            totalAttempts += outcome.attempts();

            if (outcome.succeeded()) {
                long elapsed = System.currentTimeMillis() - startTime;
                if (index > 0) {
                    log.warn("[LlmClient] {} answered '{}' after fallback from {}",
                            binding.name(), options.taskType(), attempted.subList(0, index));
                }
                return new Completion(outcome.text(), binding.name(), index, totalAttempts, elapsed);
            }

            lastFailure = outcome;
            log.warn("[LlmClient] {} exhausted after {} attempt(s) for '{}': {} ({})",
                    binding.name(), outcome.attempts(), options.taskType(),
                    outcome.errorKind().wireName(), outcome.errorMessage());
        }

        log.error("[LlmClient] All {} providers failed for '{}': {}", providers.size(), options.taskType(), attempted);
        throw new ProviderException(
                ProviderErrorKind.UNAVAILABLE,
                lastFailure.provider(),
                "All language-model providers failed: " + attempted + " (last error: " + lastFailure.errorMessage() + ")",
                attempted,
                totalAttempts,
                null);
    }

    public List<String> providerNames() {
        return providers.stream().map(ProviderBinding::name).toList();
    }

    /**
     * Runs one provider under its retry policy. Never throws ProviderException;
     * caller cancellation is the only exception that escapes.
     */
    private ProviderOutcome tryProvider(int index, ProviderBinding binding, LlmPrompt prompt, CompletionOptions options) {
        RetryTemplate retryTemplate = retryTemplates.get(index);
        try {
            return retryTemplate.execute(
                    context -> {
                        ProviderReply reply = callOnce(binding, prompt, options);
                        usageTracker.recordSuccess(binding.name());
                        usageTracker.recordTokens(prompt.tenantId(), binding.name(), reply.usage(),
                                binding.pricing().costUsd(reply.usage()));
                        return ProviderOutcome.success(binding.name(), reply.text(), context.getRetryCount() + 1);
                    },
                    context -> {
                        Throwable last = context.getLastThrowable();
                        if (!(last instanceof ProviderException providerException)) {
                            throw asUnchecked(last);
                        }
                        return ProviderOutcome.failure(binding.name(), providerException.kind(),
                                providerException.getMessage(), Math.max(1, context.getRetryCount()));
                    });
        } catch (BackOffInterruptedException e) {
            Thread.currentThread().interrupt();
            CancellationException cancelled = new CancellationException("Request cancelled during provider backoff");
            cancelled.initCause(e);
            throw cancelled;
        }
    }

    private ProviderReply callOnce(ProviderBinding binding, LlmPrompt prompt, CompletionOptions options) {
        String name = binding.name();
        try {
            ProviderReply reply = timeBoundedCall.call(() -> binding.provider().complete(prompt, options), binding.timeout());
            if (reply == null || reply.text() == null || reply.text().isBlank()) {
                throw new ProviderException(ProviderErrorKind.INVALID_RESPONSE, name, name + " returned an empty completion");
            }
            return reply;
        } catch (TimeoutException e) {
            ProviderException timeout = new ProviderException(ProviderErrorKind.TIMEOUT, name,
                    name + " did not answer within " + binding.timeout().toMillis() + "ms", e);
            usageTracker.recordFailure(name, timeout.kind(), timeout.getMessage());
            throw timeout;
        } catch (ExecutionException e) {
            ProviderException failure = ProviderException.from(name, e.getCause());
            usageTracker.recordFailure(name, failure.kind(), failure.getMessage());
            throw failure;
        } catch (ProviderException e) {
            usageTracker.recordFailure(name, e.kind(), e.getMessage());
            throw e;
        }
    }

    private static RetryTemplate retryTemplateFor(ProviderBinding binding) {
        long initial = Math.max(1, binding.backoffBase().toMillis());
        long max = Math.max(initial + 1, binding.backoffMax().toMillis());
        return RetryTemplate.builder()
                .maxAttempts(Math.max(0, binding.maxRetries()) + 1)
                .exponentialBackoff(initial, 2.0, max)
                .retryOn(ProviderException.class)
                .build();
    }

    private static RuntimeException asUnchecked(Throwable error) {
        if (error instanceof RuntimeException runtime) {
            return runtime;
        }
        if (error instanceof Error fatal) {
            throw fatal;
        }
        return new IllegalStateException(error);
    }

    /**
     * Result of running one provider under its retry policy.
     */
    record ProviderOutcome(
            String provider,
            String text,
            ProviderErrorKind errorKind,
            String errorMessage,
            int attempts
    ) {
        static ProviderOutcome success(String provider, String text, int attempts) {
            return new ProviderOutcome(provider, text, null, null, attempts);
        }

        static ProviderOutcome failure(String provider, ProviderErrorKind kind, String message, int attempts) {
            return new ProviderOutcome(provider, null, kind, message, attempts);
        }

        boolean succeeded() {
            return errorKind == null;
        }
    }
}
