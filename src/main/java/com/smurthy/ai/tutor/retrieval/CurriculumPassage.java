package com.smurthy.ai.tutor.retrieval;

/**
 * A unit of curriculum text (e.g. one textbook page) to be indexed for grounding.
 */
public record CurriculumPassage(
        String sourceId,
        String text,
        String tenantId,
        String subject,
        Integer grade,
        String topic
) {
}
