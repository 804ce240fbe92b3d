package com.smurthy.ai.tutor.llm;

import com.smurthy.ai.tutor.support.TimeBoundedCall;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;
import static org.awaitility.Awaitility.await;

/**
 * Unit tests for LlmClient retry and provider fallback.
 */
class LlmClientTest {

    private static final LlmPrompt PROMPT = new LlmPrompt("system", "Explain fractions");

    private ExecutorService executor;
    private TimeBoundedCall timeBoundedCall;
    private ProviderUsageTracker usageTracker;

    @BeforeEach
    void setUp() {
        executor = Executors.newCachedThreadPool();
        timeBoundedCall = new TimeBoundedCall(executor);
        usageTracker = new ProviderUsageTracker();
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    @DisplayName("Should answer from the primary provider without touching the fallback")
    void primaryAnswers() {
        // Given
        ScriptedProvider primary = ScriptedProvider.answering("lapa", "Fractions are parts of a whole");
        ScriptedProvider fallback = ScriptedProvider.answering("openai", "unused");
        LlmClient client = client(binding(primary, 2), binding(fallback, 2));

        // When
        Completion completion = client.complete(PROMPT, CompletionOptions.CONTENT_GENERATION);

        // Then
        assertThat(completion.text()).isEqualTo("Fractions are parts of a whole");
        assertThat(completion.provider()).isEqualTo("lapa");
        assertThat(completion.providerIndex()).isZero();
        assertThat(completion.fallbackUsed()).isFalse();
        assertThat(completion.attempts()).isEqualTo(1);
        assertThat(fallback.calls()).isZero();
        assertThat(primary.lastOptions()).isEqualTo(CompletionOptions.CONTENT_GENERATION);
    }

    @Test
    @DisplayName("Should retry a transient failure on the same provider")
    void retriesWithinProvider() {
        // Given
        ScriptedProvider primary = new ScriptedProvider("lapa")
                .thenFail(ProviderErrorKind.RATE_LIMITED)
                .thenAnswer("second try");
        LlmClient client = client(binding(primary, 2));

        // When
        Completion completion = client.complete(PROMPT, CompletionOptions.SOLVING);

        // Then
        assertThat(completion.text()).isEqualTo("second try");
        assertThat(completion.providerIndex()).isZero();
        assertThat(completion.attempts()).isEqualTo(2);
        assertThat(primary.calls()).isEqualTo(2);
        assertThat(usageTracker.getStats("lapa").getRateLimitCount()).isEqualTo(1);
        assertThat(usageTracker.getStats("lapa").getSuccessCount()).isEqualTo(1);
    }

    @Test
    @DisplayName("Should fall back to the next provider once retries are exhausted")
    void fallsBackAfterRetries() {
        // Given
        ScriptedProvider primary = ScriptedProvider.failing("lapa", ProviderErrorKind.UNAVAILABLE);
        ScriptedProvider fallback = ScriptedProvider.answering("openai", "from fallback");
        LlmClient client = client(binding(primary, 2), binding(fallback, 2));

        // When
        Completion completion = client.complete(PROMPT, CompletionOptions.GRADING);

        // Then
        assertThat(primary.calls()).isEqualTo(3);
        assertThat(completion.provider()).isEqualTo("openai");
        assertThat(completion.providerIndex()).isEqualTo(1);
        assertThat(completion.fallbackUsed()).isTrue();
        assertThat(completion.attempts()).isEqualTo(4);
    }

    @Test
    @DisplayName("Should raise unavailable with attempted providers when every provider fails")
    void exhaustsAllProviders() {
        // Given
        ScriptedProvider primary = ScriptedProvider.failing("lapa", ProviderErrorKind.INVALID_RESPONSE);
        ScriptedProvider fallback = ScriptedProvider.failing("openai", ProviderErrorKind.UNAVAILABLE);
        LlmClient client = client(binding(primary, 1), binding(fallback, 0));

        // When / Then
        assertThatThrownBy(() -> client.complete(PROMPT, CompletionOptions.ANALYTICS))
                .isInstanceOfSatisfying(ProviderException.class, e -> {
                    assertThat(e.kind()).isEqualTo(ProviderErrorKind.UNAVAILABLE);
                    assertThat(e.attemptedProviders()).containsExactly("lapa", "openai");
                    assertThat(e.attempts()).isEqualTo(3);
                    assertThat(e.provider()).isEqualTo("openai");
                });
        assertThat(primary.calls()).isEqualTo(2);
        assertThat(fallback.calls()).isEqualTo(1);
    }

    @Test
    @DisplayName("Should treat a slow provider as a timeout and move on")
    void timeoutFallsBack() {
        // Given
        ScriptedProvider slow = new ScriptedProvider("lapa").thenSleep(2_000, "too late");
        ScriptedProvider fallback = ScriptedProvider.answering("openai", "in time");
        LlmClient client = new LlmClient(List.of(
                new ProviderBinding(slow, 0, Duration.ofMillis(1), Duration.ofMillis(5), Duration.ofMillis(50)),
                binding(fallback, 0)), timeBoundedCall, usageTracker);

        // When
        Completion completion = client.complete(PROMPT, CompletionOptions.CONTENT_GENERATION);

        // Then
        assertThat(completion.text()).isEqualTo("in time");
        assertThat(usageTracker.getStats("lapa").getTimeoutCount()).isEqualTo(1);
    }

    @Test
    @DisplayName("Should stop the chain without trying the fallback when interrupted during backoff")
    void interruptDuringBackoffCancels() throws Exception {
        // Given
        ScriptedProvider primary = ScriptedProvider.failing("lapa", ProviderErrorKind.RATE_LIMITED);
        ScriptedProvider fallback = ScriptedProvider.answering("openai", "unused");
        LlmClient client = new LlmClient(List.of(
                new ProviderBinding(primary, 2, Duration.ofSeconds(5), Duration.ofSeconds(10), Duration.ofSeconds(2)),
                binding(fallback, 0)), timeBoundedCall, usageTracker);
        AtomicReference<Throwable> thrown = new AtomicReference<>();
        AtomicBoolean interruptFlag = new AtomicBoolean();
        Thread caller = new Thread(() -> {
            try {
                client.complete(PROMPT, CompletionOptions.CONTENT_GENERATION);
            } catch (Throwable t) {
                thrown.set(t);
                interruptFlag.set(Thread.currentThread().isInterrupted());
            }
        });
        caller.start();
        await().atMost(Duration.ofSeconds(2)).until(() -> primary.calls() == 1);

        // When
        caller.interrupt();
        caller.join(2_000);

        // Then
        assertThat(thrown.get()).isInstanceOf(CancellationException.class);
        assertThat(interruptFlag).isTrue();
        assertThat(primary.calls()).isEqualTo(1);
        assertThat(fallback.calls()).isZero();
    }

    @Test
    @DisplayName("Should reject blank completions as invalid responses")
    void blankCompletionIsInvalid() {
        // Given
        ScriptedProvider blank = ScriptedProvider.answering("lapa", "   ");
        ScriptedProvider fallback = ScriptedProvider.answering("openai", "real answer");
        LlmClient client = client(binding(blank, 0), binding(fallback, 0));

        // When
        Completion completion = client.complete(PROMPT, CompletionOptions.SOLVING);

        // Then
        assertThat(completion.text()).isEqualTo("real answer");
        assertThat(usageTracker.getStats("lapa").getFailureCount()).isEqualTo(1);
    }

    @Test
    @DisplayName("Should refuse an empty provider chain")
    void rejectsEmptyChain() {
        assertThatThrownBy(() -> new LlmClient(List.of(), timeBoundedCall, usageTracker))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("Should bill the answering provider's tokens to the prompt's tenant at that provider's price")
    void billsTokensToTenant() {
        // Given
        ScriptedProvider primary = ScriptedProvider.failing("lapa", ProviderErrorKind.INVALID_RESPONSE);
        ScriptedProvider fallback = new ScriptedProvider("openai").thenAnswer("Fractions are parts", 1000, 500);
        LlmClient client = client(binding(primary, 0),
                new ProviderBinding(fallback, 0, Duration.ofMillis(1), Duration.ofMillis(5), Duration.ofSeconds(2),
                        new TokenPricing(0.5, 1.5)));

        // When
        client.complete(PROMPT.forTenant("school-7"), CompletionOptions.CONTENT_GENERATION);

        // Then
        ProviderUsageTracker.TenantUsageSnapshot usage = usageTracker.tenantUsage("school-7");
        assertThat(usage.calls()).isEqualTo(1);
        assertThat(usage.inputTokens()).isEqualTo(1000);
        assertThat(usage.outputTokens()).isEqualTo(500);
        assertThat(usage.totalTokens()).isEqualTo(1500);
        assertThat(usage.costUsd()).isCloseTo(1.25, within(1e-9));
        assertThat(usage.byProvider()).extracting(ProviderUsageTracker.ProviderTokenUsage::provider)
                .containsExactly("openai");
        assertThat(usageTracker.tenantUsage("school-8").calls()).isZero();
    }

    @Test
    @DisplayName("Should bill prompts without a tenant to the unscoped bucket")
    void billsUnscopedPrompts() {
        // Given
        LlmClient client = client(binding(new ScriptedProvider("lapa").thenAnswer("ok", 10, 5), 0));

        // When
        client.complete(PROMPT, CompletionOptions.GRADING);

        // Then
        assertThat(usageTracker.tenantUsage(ProviderUsageTracker.UNSCOPED_TENANT).totalTokens()).isEqualTo(15);
        assertThat(usageTracker.tenantUsage(ProviderUsageTracker.UNSCOPED_TENANT).costUsd()).isZero();
    }

    private LlmClient client(ProviderBinding... bindings) {
        return new LlmClient(List.of(bindings), timeBoundedCall, usageTracker);
    }

    private static ProviderBinding binding(LlmProvider provider, int maxRetries) {
        return new ProviderBinding(provider, maxRetries, Duration.ofMillis(1), Duration.ofMillis(5), Duration.ofSeconds(2));
    }
}
