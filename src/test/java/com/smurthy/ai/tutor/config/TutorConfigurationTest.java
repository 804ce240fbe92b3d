package com.smurthy.ai.tutor.config;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.ThreadPoolExecutor;

import static org.assertj.core.api.Assertions.assertThat;

class TutorConfigurationTest {

    private final TutorConfiguration configuration = new TutorConfiguration();
    private final List<ExecutorService> created = new ArrayList<>();

    @AfterEach
    void tearDown() {
        created.forEach(ExecutorService::shutdownNow);
    }

    @Test
    @DisplayName("Should give provider calls, retrieval and cache work separate pools sized from configuration")
    void separatePoolsPerStepKind() {
        // Given
        TutorProperties properties = properties(new TutorProperties.Executor(6, 3, 2));

        // When
        ExecutorService provider = track(configuration.tutorProviderExecutor(properties));
        ExecutorService retrieval = track(configuration.tutorRetrievalExecutor(properties));
        ExecutorService cache = track(configuration.tutorCacheExecutor(properties));

        // Then
        assertThat(provider).isNotSameAs(retrieval).isNotSameAs(cache);
        assertThat(retrieval).isNotSameAs(cache);
        assertThat(((ThreadPoolExecutor) provider).getCorePoolSize()).isEqualTo(6);
        assertThat(((ThreadPoolExecutor) retrieval).getCorePoolSize()).isEqualTo(3);
        assertThat(((ThreadPoolExecutor) cache).getCorePoolSize()).isEqualTo(2);
    }

    @Test
    @DisplayName("Should size unset pools from the processor count")
    void defaultsFromProcessors() {
        TutorProperties.Executor executor = new TutorProperties.Executor(0, 0, 0);
        int cpus = Runtime.getRuntime().availableProcessors();

        assertThat(executor.effectiveProviderThreads()).isEqualTo(Math.max(8, 2 * cpus));
        assertThat(executor.effectiveRetrievalThreads()).isEqualTo(Math.max(4, cpus));
        assertThat(executor.effectiveCacheThreads()).isEqualTo(Math.max(4, cpus));
    }

    private ExecutorService track(ExecutorService executor) {
        created.add(executor);
        return executor;
    }

    private static TutorProperties properties(TutorProperties.Executor executor) {
        return new TutorProperties(
                new TutorProperties.Cache(0.92, Duration.ofHours(1), 100, Duration.ofMillis(250), false, Duration.ofSeconds(60)),
                new TutorProperties.Retrieval(5, 0.60, Duration.ofSeconds(2)),
                new TutorProperties.Llm(List.of(), "text-embedding-3-small", "https://api.openai.com", "unset"),
                new TutorProperties.Supervisor(Map.of()),
                executor);
    }
}
