package com.smurthy.ai.tutor.retrieval;

/**
 * Restricts retrieval to one tenant's curriculum for a subject and, when
 * known, a grade.
 */
public record RetrievalScope(String tenantId, String subject, Integer grade) {
}
