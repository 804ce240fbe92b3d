package com.smurthy.ai.tutor.observability;

import com.smurthy.ai.tutor.retrieval.RetrievedPassage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.DoubleAdder;
import java.util.concurrent.atomic.LongAdder;

/**
 * Retrieval Observability Metrics
 *
 * Tracks grounding retrieval quality and health:
 * - Retrieval latency
 * - Degraded retrievals (backend error or timeout)
 * - Empty results (no passage above the score floor)
 * - Score distribution and most-used curriculum sources
 */
@Component
public class RetrievalMetrics {

    private static final Logger log = LoggerFactory.getLogger(RetrievalMetrics.class);

    // Counters
    private final LongAdder totalRetrievals = new LongAdder();
    private final LongAdder degradedRetrievals = new LongAdder();
    private final LongAdder emptyRetrievals = new LongAdder();
    private final LongAdder totalPassagesRetrieved = new LongAdder();

    // Timing metrics (in milliseconds)
    private final LongAdder totalLatencyMs = new LongAdder();
    private final AtomicLong maxLatencyMs = new AtomicLong(0);

    // Score tracking
    private final DoubleAdder scoreSum = new DoubleAdder();
    private final LongAdder scoredPassages = new LongAdder();

    // Source usage tracking (which curriculum passages get retrieved most?)
    private final Map<String, LongAdder> sourceRetrievalCounts = new ConcurrentHashMap<>();

    /**
     * Record a retrieval operation
     */
    public void recordRetrieval(RetrievalMetricData data) {
        totalRetrievals.increment();
        totalLatencyMs.add(data.latencyMs());
        maxLatencyMs.updateAndGet(current -> Math.max(current, data.latencyMs()));

        if (data.degraded()) {
            degradedRetrievals.increment();
            return;
        }
        if (data.passages().isEmpty()) {
            emptyRetrievals.increment();
        }

        totalPassagesRetrieved.add(data.passages().size());
        for (RetrievedPassage passage : data.passages()) {
            scoreSum.add(passage.score());
            scoredPassages.increment();
            sourceRetrievalCounts.computeIfAbsent(passage.sourceId(), k -> new LongAdder()).increment();
        }

        // Log if retrieval was slow
        if (data.latencyMs() > 500) {
            log.warn("Slow retrieval detected: {}ms for query: {}", data.latencyMs(), data.query());
        }
    }

    /**
     * Get current metrics summary
     */
    public MetricsSummary getMetricsSummary() {
        long retrievals = totalRetrievals.sum();
        long scored = scoredPassages.sum();
        return new MetricsSummary(
                retrievals,
                degradedRetrievals.sum(),
                emptyRetrievals.sum(),
                totalPassagesRetrieved.sum(),
                retrievals > 0 ? totalLatencyMs.sum() / retrievals : 0,
                maxLatencyMs.get(),
                scored > 0 ? scoreSum.sum() / scored : 0.0,
                getMostRetrievedSources(5)
        );
    }

    /**
     * Reset all metrics (useful for hourly/daily resets)
     */
    public void resetMetrics() {
        totalRetrievals.reset();
        degradedRetrievals.reset();
        emptyRetrievals.reset();
        totalPassagesRetrieved.reset();
        totalLatencyMs.reset();
        maxLatencyMs.set(0);
        scoreSum.reset();
        scoredPassages.reset();
        sourceRetrievalCounts.clear();
        log.info("Retrieval metrics reset");
    }

    private List<String> getMostRetrievedSources(int limit) {
        return sourceRetrievalCounts.entrySet().stream()
                .sorted((e1, e2) -> Long.compare(e2.getValue().sum(), e1.getValue().sum()))
                .limit(limit)
                .map(e -> e.getKey() + " (" + e.getValue().sum() + " times)")
                .toList();
    }

    // Data classes

    public record RetrievalMetricData(
            String query,
            long latencyMs,
            List<RetrievedPassage> passages,
            boolean degraded
    ) {}

    public record MetricsSummary(
            long totalRetrievals,
            long degradedRetrievals,
            long emptyRetrievals,
            long totalPassagesRetrieved,
            long averageLatencyMs,
            long maxLatencyMs,
            double averageScore,
            List<String> topRetrievedSources
    ) {}
}
