package com.smurthy.ai.tutor.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.smurthy.ai.tutor.retrieval.CurriculumPassage;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;

import java.util.List;

/**
 * Request body of {@code POST /api/curriculum/passages}.
 */
public record IngestPassagesRequest(@NotEmpty List<@Valid Passage> passages) {

    public List<CurriculumPassage> toPassages() {
        return passages.stream()
                .map(p -> new CurriculumPassage(p.sourceId(), p.text(), p.tenantId(), p.subject(), p.grade(), p.topic()))
                .toList();
    }

    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public record Passage(
            String sourceId,
            @NotBlank String text,
            @NotBlank String tenantId,
            String subject,
            Integer grade,
            String topic
    ) {
    }
}
