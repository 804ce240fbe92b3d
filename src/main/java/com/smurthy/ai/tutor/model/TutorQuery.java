package com.smurthy.ai.tutor.model;

import java.util.List;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * An incoming tutoring request. Immutable once received.
 *
 * @param tenantId        tenant (school / class) the request belongs to
 * @param text            the raw user query
 * @param submittedAnswer the student's answer to be graded, if any
 * @param expectedAnswer  reference answer for grading, if the caller has one
 * @param history         prior conversation turns, oldest first
 */
public record TutorQuery(
        String tenantId,
        String text,
        String submittedAnswer,
        String expectedAnswer,
        List<ConversationTurn> history
) {
    /**
     * How many trailing turns of history are shown to the specialists.
     */
    public static final int RECENT_HISTORY_TURNS = 6;

    private static final Pattern PRACTICE_REQUEST = Pattern.compile(
            "\\bquiz|practice (?:question|problem|exercise)|test me|вікторин|тестові|вправ",
            Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);

    public TutorQuery {
        Objects.requireNonNull(tenantId, "tenantId");
        Objects.requireNonNull(text, "text");
        history = history == null ? List.of() : List.copyOf(history);
    }

    public static TutorQuery of(String tenantId, String text) {
        return new TutorQuery(tenantId, text, null, null, List.of());
    }

    public List<ConversationTurn> recentHistory() {
        return history.subList(Math.max(0, history.size() - RECENT_HISTORY_TURNS), history.size());
    }

    /**
     * Whether the student asked for practice questions along with the explanation.
     */
    public boolean asksForPractice() {
        return PRACTICE_REQUEST.matcher(text).find();
    }

    public boolean hasSubmittedAnswer() {
        return submittedAnswer != null && !submittedAnswer.isBlank();
    }
}
