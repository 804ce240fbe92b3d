package com.smurthy.ai.tutor.agents;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.smurthy.ai.tutor.llm.CompletionOptions;
import com.smurthy.ai.tutor.llm.LlmClient;
import com.smurthy.ai.tutor.llm.LlmPrompt;
import com.smurthy.ai.tutor.model.ResponsePayload;
import com.smurthy.ai.tutor.model.SpecialistKind;
import com.smurthy.ai.tutor.model.TutorQuery;
import com.smurthy.ai.tutor.retrieval.RetrievedContext;

import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Grades a submitted answer on a 0-10 scale with feedback.
 *
 * The model is asked for JSON; when it answers in prose instead, a
 * "Score: X/10" (or "Оцінка: X/10") line is used. An answer counts as
 * correct at 70% of the maximum score.
 */
public class GraderAgent extends AbstractSpecialistAgent {

    static final double DEFAULT_MAX_SCORE = 10.0;
    static final double UNPARSED_SCORE = 5.0;
    static final double PASS_RATIO = 0.7;
    private static final int MAX_PASSAGES = 2;

    private static final Pattern SCORE_LINE = Pattern.compile(
            "(?:score|grade|оцінка|оцінку)\\s*[:=-]?\\s*(\\d+(?:[.,]\\d+)?)\\s*(?:/|out of|з)\\s*(\\d+(?:[.,]\\d+)?)",
            Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);

    private static final String SYSTEM_PROMPT = """
            You are a teacher grading a student's answer. Be fair and specific.

            Respond ONLY with valid JSON in this exact format:
            {
              "score": 7,
              "max_score": 10,
              "feedback": "What was right, what was wrong, and how to fix it"
            }
            """;

    private final ObjectMapper objectMapper;

    public GraderAgent(LlmClient llmClient, ObjectMapper objectMapper) {
        super(llmClient);
        this.objectMapper = objectMapper;
    }

    @Override
    public SpecialistKind kind() {
        return SpecialistKind.GRADER;
    }

    @Override
    protected LlmPrompt buildPrompt(SpecialistRequest request) {
        TutorQuery query = request.query();
        RetrievedContext passages = request.context().top(MAX_PASSAGES);

        StringBuilder user = new StringBuilder();
        user.append("Subject: ").append(request.profile().subject())
                .append(", grade ").append(request.profile().grade()).append("\n\n");
        user.append("Question:\n").append(query.text()).append("\n\n");
        if (query.expectedAnswer() != null && !query.expectedAnswer().isBlank()) {
            user.append("Reference answer:\n").append(query.expectedAnswer()).append("\n\n");
        }
        if (!passages.isEmpty()) {
            user.append("Curriculum material:\n").append(formatPassages(passages)).append("\n\n");
        }
        user.append("Student answer:\n")
                .append(query.hasSubmittedAnswer() ? query.submittedAnswer() : "(no answer submitted)");
        return new LlmPrompt(SYSTEM_PROMPT, user.toString());
    }

    @Override
    protected CompletionOptions options() {
        return CompletionOptions.GRADING;
    }

    @Override
    protected ResponsePayload parse(String text, SpecialistRequest request) {
        return parseGrade(text).orElseGet(() -> {
            log.warn("[GraderAgent] Could not find a score in grading response, using {}/{}",
                    UNPARSED_SCORE, DEFAULT_MAX_SCORE);
            return graded(text.trim(), UNPARSED_SCORE, DEFAULT_MAX_SCORE, false);
        });
    }

    @Override
    protected List<String> sourcesUsed(SpecialistRequest request) {
        return request.context().top(MAX_PASSAGES).sourceIds();
    }

    Optional<ResponsePayload> parseGrade(String text) {
        Optional<ResponsePayload> json = parseJson(stripCodeFences(text));
        if (json.isPresent()) {
            return json;
        }
        Matcher matcher = SCORE_LINE.matcher(text);
        if (matcher.find()) {
            double max = number(matcher.group(2));
            if (max > 0) {
                double score = Math.max(0.0, Math.min(number(matcher.group(1)), max));
                return Optional.of(graded(text.trim(), score, max, score / max >= PASS_RATIO));
            }
        }
        return Optional.empty();
    }

    private Optional<ResponsePayload> parseJson(String candidate) {
        int start = candidate.indexOf('{');
        int end = candidate.lastIndexOf('}');
        if (start < 0 || end <= start) {
            return Optional.empty();
        }
        try {
            JsonNode node = objectMapper.readTree(candidate.substring(start, end + 1));
            JsonNode score = node.get("score");
            if (score == null || !score.isNumber()) {
                return Optional.empty();
            }
            double max = node.path("max_score").isNumber() ? node.get("max_score").asDouble() : DEFAULT_MAX_SCORE;
            if (max <= 0) {
                return Optional.empty();
            }
            String feedback = node.path("feedback").asText("");
            double value = Math.max(0.0, Math.min(score.asDouble(), max));
            return Optional.of(graded(feedback, value, max, value / max >= PASS_RATIO));
        } catch (JsonProcessingException e) {
            log.debug("[GraderAgent] Grading response is not JSON: {}", e.getOriginalMessage());
            return Optional.empty();
        }
    }

    private static ResponsePayload graded(String feedback, double score, double max, boolean correct) {
        return new ResponsePayload(feedback, score, max, correct, List.of(), List.of());
    }

    private static double number(String raw) {
        return Double.parseDouble(raw.replace(',', '.'));
    }
}
