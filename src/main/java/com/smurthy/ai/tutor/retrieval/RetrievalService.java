package com.smurthy.ai.tutor.retrieval;

import com.smurthy.ai.tutor.config.TutorProperties;
import com.smurthy.ai.tutor.observability.RetrievalMetrics;
import com.smurthy.ai.tutor.support.TimeBoundedCall;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.document.Document;
import org.springframework.ai.vectorstore.SearchRequest;
import org.springframework.ai.vectorstore.VectorStore;
import org.springframework.ai.vectorstore.filter.Filter;
import org.springframework.ai.vectorstore.filter.FilterExpressionBuilder;
import org.springframework.util.StringUtils;

import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeoutException;

/**
 * Grounding retrieval from the curriculum vector index.
 *
 * Results are scoped to the tenant and subject (and grade when known),
 * bounded by top-k, and passages scoring below the floor are dropped rather
 * than padding the result. Fails soft: any backend error or timeout yields
 * an empty context plus a logged warning.
 */
public class RetrievalService {

    private static final Logger log = LoggerFactory.getLogger(RetrievalService.class);

    public static final String TENANT_KEY = "tenant_id";
    public static final String SUBJECT_KEY = "subject";
    public static final String GRADE_KEY = "grade";
    public static final String SOURCE_KEY = "source_id";
    public static final String TOPIC_KEY = "topic";

    /**
     * Grade stored for passages that apply to every grade.
     */
    public static final int ANY_GRADE = 0;

    private final VectorStore vectorStore;
    private final TimeBoundedCall timeBoundedCall;
    private final TutorProperties.Retrieval settings;
    private final RetrievalMetrics metrics;

    public RetrievalService(VectorStore vectorStore,
                            TimeBoundedCall timeBoundedCall,
                            TutorProperties.Retrieval settings,
                            RetrievalMetrics metrics) {
        this.vectorStore = vectorStore;
        this.timeBoundedCall = timeBoundedCall;
        this.settings = settings;
        this.metrics = metrics;
    }

    /**
     * Retrieve ranked grounding passages for a query.
     *
     * @return passages best first, at most top-k, none below the score floor; possibly empty
     */
    public RetrievedContext retrieve(String query, RetrievalScope scope) {
        long startTime = System.currentTimeMillis();
        try {
            List<Document> documents = timeBoundedCall.call(() -> search(query, scope), settings.timeout());
            List<RetrievedPassage> passages = rank(documents);
            long elapsed = System.currentTimeMillis() - startTime;

            log.info("[RetrievalService] {} passages for tenant={} subject={} in {}ms",
                    passages.size(), scope.tenantId(), scope.subject(), elapsed);
            metrics.recordRetrieval(new RetrievalMetrics.RetrievalMetricData(query, elapsed, passages, false));
            return new RetrievedContext(passages);

        } catch (TimeoutException e) {
            return degrade(query, startTime, "timed out after " + settings.timeout().toMillis() + "ms");
        } catch (ExecutionException e) {
            return degrade(query, startTime, e.getCause().getMessage());
        } catch (CancellationException e) {
            throw e;
        } catch (RuntimeException e) {
            return degrade(query, startTime, e.getMessage());
        }
    }

    private List<Document> search(String query, RetrievalScope scope) {
        SearchRequest request = SearchRequest.builder()
                .query(query)
                .topK(settings.topK())
                .similarityThreshold(settings.scoreFloor())
                .filterExpression(scopeFilter(scope))
                .build();
        try {
            return vectorStore.similaritySearch(request);
        } catch (RuntimeException e) {
            throw new RetrievalException("Vector search failed for tenant " + scope.tenantId() + ": " + e.getMessage(), e);
        }
    }

    /**
     * Drops passages under the floor, orders best first and caps at top-k.
     * The index already applies the threshold; this keeps the contract when it does not.
     */
    private List<RetrievedPassage> rank(List<Document> documents) {
        if (documents == null) {
            return List.of();
        }
        return documents.stream()
                .map(doc -> new RetrievedPassage(doc.getText(), scoreOf(doc), sourceIdOf(doc)))
                .filter(passage -> passage.score() >= settings.scoreFloor())
                .sorted(Comparator.comparingDouble(RetrievedPassage::score).reversed())
                .limit(settings.topK())
                .toList();
    }

    private RetrievedContext degrade(String query, long startTime, String reason) {
        long elapsed = System.currentTimeMillis() - startTime;
        log.warn("[RetrievalService] Retrieval failed, continuing without grounding: {}", reason);
        metrics.recordRetrieval(new RetrievalMetrics.RetrievalMetricData(query, elapsed, List.of(), true));
        return RetrievedContext.empty();
    }

    static Filter.Expression scopeFilter(RetrievalScope scope) {
        FilterExpressionBuilder b = new FilterExpressionBuilder();
        FilterExpressionBuilder.Op tenant = b.eq(TENANT_KEY, scope.tenantId());
        if (StringUtils.hasText(scope.subject())) {
            tenant = b.and(tenant, b.eq(SUBJECT_KEY, normalizeSubject(scope.subject())));
        }
        if (scope.grade() != null) {
            tenant = b.and(tenant, b.in(GRADE_KEY, scope.grade(), ANY_GRADE));
        }
        return tenant.build();
    }

    static String normalizeSubject(String subject) {
        return subject.trim().toLowerCase(Locale.ROOT);
    }

    private static double scoreOf(Document doc) {
        if (doc.getScore() != null) {
            return doc.getScore();
        }
        Object distance = doc.getMetadata().get("distance");
        return distance instanceof Number number ? 1.0 - number.doubleValue() : 0.0;
    }

    private static String sourceIdOf(Document doc) {
        Object source = doc.getMetadata().get(SOURCE_KEY);
        return source != null ? source.toString() : doc.getId();
    }
}
