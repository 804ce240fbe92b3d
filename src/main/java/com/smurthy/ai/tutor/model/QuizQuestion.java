package com.smurthy.ai.tutor.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.util.List;

/**
 * One practice question generated alongside an explanation.
 *
 * @param type       "multiple_choice", "short_answer" or "text" when the
 *                   model's quiz could not be read as structured questions
 * @param options    answer choices, empty unless multiple choice
 * @param difficulty "easy", "medium" or "hard" when the model gave one
 */
@JsonInclude(JsonInclude.Include.NON_EMPTY)
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record QuizQuestion(
        String question,
        String type,
        List<String> options,
        String correctAnswer,
        String difficulty
) {
    public static final String TEXT_TYPE = "text";

    public QuizQuestion {
        options = options == null ? List.of() : List.copyOf(options);
    }

    /**
     * Raw quiz text kept as a single question when it was not valid JSON.
     */
    public static QuizQuestion rawText(String text) {
        return new QuizQuestion(text, TEXT_TYPE, List.of(), null, null);
    }
}
