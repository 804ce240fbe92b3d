package com.smurthy.ai.tutor.retrieval;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.document.Document;
import org.springframework.ai.vectorstore.VectorStore;
import org.springframework.util.StringUtils;

import java.nio.charset.StandardCharsets;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * Loads curriculum passages into the vector index with the metadata
 * {@link RetrievalService} scopes on.
 */
public class CurriculumIngestionService {

    private static final Logger log = LoggerFactory.getLogger(CurriculumIngestionService.class);

    private final VectorStore vectorStore;

    public CurriculumIngestionService(VectorStore vectorStore) {
        this.vectorStore = vectorStore;
    }

    /**
     * @return number of passages indexed
     */
    public int ingest(List<CurriculumPassage> passages) {
        List<Document> documents = passages.stream()
                .filter(p -> StringUtils.hasText(p.text()))
                .map(CurriculumIngestionService::toDocument)
                .toList();

        if (documents.isEmpty()) {
            log.warn("No passages with text to ingest");
            return 0;
        }

        vectorStore.add(documents);
        log.info("Ingested {} curriculum passages", documents.size());
        return documents.size();
    }

    static Document toDocument(CurriculumPassage passage) {
        String tenantId = Objects.requireNonNull(passage.tenantId(), "tenantId");
        String sourceId = StringUtils.hasText(passage.sourceId()) ? passage.sourceId() : UUID.randomUUID().toString();

        // Document metadata may not hold null values
        Map<String, Object> metadata = new HashMap<>();
        metadata.put(RetrievalService.SOURCE_KEY, sourceId);
        metadata.put(RetrievalService.TENANT_KEY, tenantId);
        if (StringUtils.hasText(passage.subject())) {
            metadata.put(RetrievalService.SUBJECT_KEY, RetrievalService.normalizeSubject(passage.subject()));
        }
        metadata.put(RetrievalService.GRADE_KEY, passage.grade() != null ? passage.grade() : RetrievalService.ANY_GRADE);
        if (StringUtils.hasText(passage.topic())) {
            metadata.put(RetrievalService.TOPIC_KEY, passage.topic());
        }
        return new Document(documentId(tenantId, sourceId), passage.text(), metadata);
    }

    /**
     * Index ids are per tenant: the same source id ingested by two tenants
     * yields two documents, and re-ingesting replaces the earlier copy.
     */
    static String documentId(String tenantId, String sourceId) {
        return UUID.nameUUIDFromBytes((tenantId + '\0' + sourceId).getBytes(StandardCharsets.UTF_8)).toString();
    }
}
