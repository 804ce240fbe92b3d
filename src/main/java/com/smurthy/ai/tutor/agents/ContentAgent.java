package com.smurthy.ai.tutor.agents;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.smurthy.ai.tutor.llm.CompletionOptions;
import com.smurthy.ai.tutor.llm.LlmClient;
import com.smurthy.ai.tutor.llm.LlmPrompt;
import com.smurthy.ai.tutor.model.QuizQuestion;
import com.smurthy.ai.tutor.model.ResponsePayload;
import com.smurthy.ai.tutor.model.SpecialistKind;
import com.smurthy.ai.tutor.model.StudentProfile;
import com.smurthy.ai.tutor.retrieval.RetrievedContext;

import java.util.List;
import java.util.Optional;

/**
 * Explains a topic at the student's grade level, grounded in up to three
 * curriculum passages which it cites by source id. When the student asks
 * for practice questions, a second completion writes a short quiz on the
 * lesson.
 */
public class ContentAgent extends AbstractSpecialistAgent {

    static final int MAX_PASSAGES = 3;
    static final int QUIZ_QUESTIONS = 5;
    static final int MAX_LESSON_CHARS_FOR_QUIZ = 1000;

    private static final TypeReference<List<QuizQuestion>> QUIZ_LIST = new TypeReference<>() {};

    private static final String SYSTEM_PROMPT = """
            You are a patient school teacher explaining a topic to a student.

            RULES:
            - Match the explanation to the student's grade level
            - Build on the curriculum material provided and cite it as [source-id]
            - If no curriculum material is provided, explain from general knowledge and say so
            - Use a short worked example where it helps
            - Answer in the language of the question
            """;

    private static final String QUIZ_SYSTEM_PROMPT = """
            You write short school quizzes that check understanding of a lesson.

            Respond with a JSON array only. Each element has the fields:
            "question", "type" ("multiple_choice" or "short_answer"),
            "options" (list of choices, multiple choice only), "correct_answer",
            "difficulty" ("easy", "medium" or "hard").
            Write the questions in the language of the lesson.
            """;

    private final ObjectMapper objectMapper;

    public ContentAgent(LlmClient llmClient, ObjectMapper objectMapper) {
        super(llmClient);
        this.objectMapper = objectMapper;
    }

    @Override
    public SpecialistKind kind() {
        return SpecialistKind.CONTENT;
    }

    @Override
    protected LlmPrompt buildPrompt(SpecialistRequest request) {
        StudentProfile profile = request.profile();
        RetrievedContext passages = request.context().top(MAX_PASSAGES);

        String material = passages.isEmpty()
                ? "No curriculum material found."
                : formatPassages(passages);

        String user = String.format("""
                %sSubject: %s, grade %d

                Curriculum material:
                %s

                Question:
                %s
                """, formatHistory(request.query()), profile.subject(), profile.grade(),
                material, request.query().text());
        return new LlmPrompt(SYSTEM_PROMPT, user);
    }

    @Override
    protected CompletionOptions options() {
        return CompletionOptions.CONTENT_GENERATION;
    }

    @Override
    protected ResponsePayload parse(String text, SpecialistRequest request) {
        return ResponsePayload.text(text.trim());
    }

    @Override
    protected Optional<FollowUp> followUp(SpecialistRequest request, ResponsePayload payload) {
        if (!request.query().asksForPractice()) {
            return Optional.empty();
        }
        String lesson = payload.text();
        if (lesson.length() > MAX_LESSON_CHARS_FOR_QUIZ) {
            lesson = lesson.substring(0, MAX_LESSON_CHARS_FOR_QUIZ);
        }
        String user = String.format("""
                Subject: %s, grade %d
                Request: %s

                Lesson:
                %s

                Write %d questions on this lesson.
                """, request.profile().subject(), request.profile().grade(), request.query().text(),
                lesson, QUIZ_QUESTIONS);
        return Optional.of(new FollowUp(new LlmPrompt(QUIZ_SYSTEM_PROMPT, user),
                CompletionOptions.QUIZ_GENERATION,
                (base, text) -> base.withQuiz(parseQuiz(text))));
    }

    @Override
    protected List<String> sourcesUsed(SpecialistRequest request) {
        return request.context().top(MAX_PASSAGES).sourceIds();
    }

    /**
     * Reads the quiz as a JSON array (or a single question object). Anything
     * else is kept whole as one text question.
     */
    List<QuizQuestion> parseQuiz(String text) {
        String candidate = stripCodeFences(text);
        try {
            if (candidate.startsWith("{")) {
                return List.of(objectMapper.readValue(candidate, QuizQuestion.class));
            }
            int start = candidate.indexOf('[');
            int end = candidate.lastIndexOf(']');
            if (start >= 0 && end > start) {
                List<QuizQuestion> questions = objectMapper.readValue(candidate.substring(start, end + 1), QUIZ_LIST)
                        .stream()
                        .filter(q -> q != null && q.question() != null && !q.question().isBlank())
                        .toList();
                if (!questions.isEmpty()) {
                    log.debug("[ContentAgent] Generated {} quiz questions", questions.size());
                    return questions;
                }
            }
        } catch (JsonProcessingException e) {
            log.debug("[ContentAgent] Quiz is not JSON: {}", e.getOriginalMessage());
        }
        return List.of(QuizQuestion.rawText(text.trim()));
    }
}
