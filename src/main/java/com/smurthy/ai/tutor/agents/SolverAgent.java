package com.smurthy.ai.tutor.agents;

import com.smurthy.ai.tutor.llm.CompletionOptions;
import com.smurthy.ai.tutor.llm.LlmClient;
import com.smurthy.ai.tutor.llm.LlmPrompt;
import com.smurthy.ai.tutor.model.ResponsePayload;
import com.smurthy.ai.tutor.model.SpecialistKind;
import com.smurthy.ai.tutor.retrieval.RetrievedContext;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Solves a problem step by step. The numbered steps are returned both in the
 * text and as a separate list.
 */
public class SolverAgent extends AbstractSpecialistAgent {

    static final int MAX_PASSAGES = 3;

    private static final Pattern STEP_LINE = Pattern.compile("^(?:step|крок)\\s*(\\d+)\\s*[:.)-]\\s*(.+)$",
            Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);

    private static final String SYSTEM_PROMPT = """
            You are a math and science tutor who solves problems step by step.

            FORMAT:
            Step 1: <first step>
            Step 2: <next step>
            ...
            Answer: <final answer>

            RULES:
            - One operation or idea per step
            - Show intermediate results
            - Use the reference material only when it applies to the problem
            """;

    public SolverAgent(LlmClient llmClient) {
        super(llmClient);
    }

    @Override
    public SpecialistKind kind() {
        return SpecialistKind.SOLVER;
    }

    @Override
    protected LlmPrompt buildPrompt(SpecialistRequest request) {
        RetrievedContext passages = request.context().top(MAX_PASSAGES);
        StringBuilder user = new StringBuilder(formatHistory(request.query()));
        user.append("Subject: ").append(request.profile().subject())
                .append(", grade ").append(request.profile().grade()).append("\n\n");
        if (!passages.isEmpty()) {
            user.append("Reference material:\n").append(formatPassages(passages)).append("\n\n");
        }
        user.append("Problem:\n").append(request.query().text());
        return new LlmPrompt(SYSTEM_PROMPT, user.toString());
    }

    @Override
    protected CompletionOptions options() {
        return CompletionOptions.SOLVING;
    }

    @Override
    protected ResponsePayload parse(String text, SpecialistRequest request) {
        String trimmed = text.trim();
        return new ResponsePayload(trimmed, null, null, null, extractSteps(trimmed), List.of());
    }

    @Override
    protected List<String> sourcesUsed(SpecialistRequest request) {
        return request.context().top(MAX_PASSAGES).sourceIds();
    }

    /**
     * "Step N: ..." lines when present, otherwise any numbered or bulleted list.
     */
    static List<String> extractSteps(String text) {
        List<String> steps = new ArrayList<>();
        for (String line : text.lines().map(String::trim).toList()) {
            Matcher matcher = STEP_LINE.matcher(line);
            if (matcher.matches()) {
                steps.add(matcher.group(2).trim());
            }
        }
        return steps.isEmpty() ? listItems(text) : steps;
    }
}
