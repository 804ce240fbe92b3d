package com.smurthy.ai.tutor.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.util.List;

/**
 * Structured specialist output: free text plus the optional fields a
 * specialist knows how to fill. {@code quiz} is filled only when the student
 * asked for practice questions.
 */
@JsonInclude(JsonInclude.Include.NON_EMPTY)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record ResponsePayload(
        String text,
        Double score,
        Double maxScore,
        Boolean correct,
        List<String> steps,
        List<String> recommendations,
        List<QuizQuestion> quiz
) {
    public ResponsePayload {
        steps = steps == null ? List.of() : List.copyOf(steps);
        recommendations = recommendations == null ? List.of() : List.copyOf(recommendations);
        quiz = quiz == null ? List.of() : List.copyOf(quiz);
    }

    public ResponsePayload(String text, Double score, Double maxScore, Boolean correct,
                           List<String> steps, List<String> recommendations) {
        this(text, score, maxScore, correct, steps, recommendations, List.of());
    }

    public static ResponsePayload text(String text) {
        return new ResponsePayload(text, null, null, null, List.of(), List.of());
    }

    public ResponsePayload withQuiz(List<QuizQuestion> questions) {
        return new ResponsePayload(text, score, maxScore, correct, steps, recommendations, questions);
    }

    public boolean hasScore() {
        return score != null && maxScore != null && maxScore > 0;
    }
}
