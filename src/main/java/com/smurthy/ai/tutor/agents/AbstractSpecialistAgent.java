package com.smurthy.ai.tutor.agents;

import com.smurthy.ai.tutor.llm.Completion;
import com.smurthy.ai.tutor.llm.CompletionOptions;
import com.smurthy.ai.tutor.llm.LlmClient;
import com.smurthy.ai.tutor.llm.LlmPrompt;
import com.smurthy.ai.tutor.llm.ProviderException;
import com.smurthy.ai.tutor.model.AgentResponse;
import com.smurthy.ai.tutor.model.ConversationTurn;
import com.smurthy.ai.tutor.model.Provenance;
import com.smurthy.ai.tutor.model.ResponsePayload;
import com.smurthy.ai.tutor.model.TutorQuery;
import com.smurthy.ai.tutor.retrieval.RetrievedContext;
import com.smurthy.ai.tutor.retrieval.RetrievedPassage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;
import java.util.function.BiFunction;

/**
 * Shared flow of the specialists: build a prompt, complete it through the
 * provider chain, parse the text into a payload, and tag the response.
 * A specialist may ask for one follow-up completion that enriches the
 * payload; if the follow-up fails the first payload is kept. A completion
 * served by a fallback provider, or a failed follow-up, tags the response
 * fallback-degraded. Prompts are billed to the query's tenant.
 */
public abstract class AbstractSpecialistAgent implements SpecialistAgent {

    protected final Logger log = LoggerFactory.getLogger(getClass());
    private final LlmClient llmClient;

    protected AbstractSpecialistAgent(LlmClient llmClient) {
        this.llmClient = llmClient;
    }

    @Override
    public final AgentResponse execute(SpecialistRequest request) {
        String name = getClass().getSimpleName();
        log.debug("[{}] Processing: {}", name, request.query().text());
        long startTime = System.currentTimeMillis();

        String tenantId = request.query().tenantId();
        Completion completion = llmClient.complete(buildPrompt(request).forTenant(tenantId), options());
        ResponsePayload payload = parse(completion.text(), request);
        boolean degraded = completion.fallbackUsed();

        Optional<FollowUp> followUp = followUp(request, payload);
        if (followUp.isPresent()) {
            FollowUp next = followUp.get();
            try {
                Completion extra = llmClient.complete(next.prompt().forTenant(tenantId), next.options());
                payload = next.merge().apply(payload, extra.text());
                degraded |= extra.fallbackUsed();
            } catch (ProviderException e) {
                log.warn("[{}] Follow-up '{}' failed, keeping first answer: {}",
                        name, next.options().taskType(), e.getMessage());
                degraded = true;
            }
        }

        long elapsed = System.currentTimeMillis() - startTime;
        log.info("[{}] Completed in {}ms via {} ({} attempt(s))",
                name, elapsed, completion.provider(), completion.attempts());

        Provenance provenance = degraded ? Provenance.FALLBACK_DEGRADED : Provenance.GENERATED;
        return new AgentResponse(kind(), payload, elapsed, provenance, List.of(kind()), sourcesUsed(request));
    }

    protected abstract LlmPrompt buildPrompt(SpecialistRequest request);

    protected abstract CompletionOptions options();

    protected abstract ResponsePayload parse(String text, SpecialistRequest request);

    /**
     * Second completion to run after the first answer was parsed; none by default.
     */
    protected Optional<FollowUp> followUp(SpecialistRequest request, ResponsePayload payload) {
        return Optional.empty();
    }

    /**
     * Source ids of the passages this specialist put into its prompt.
     */
    protected List<String> sourcesUsed(SpecialistRequest request) {
        return List.of();
    }

    protected static String formatPassages(RetrievedContext context) {
        StringBuilder sb = new StringBuilder();
        for (RetrievedPassage passage : context.passages()) {
            sb.append("[").append(passage.sourceId()).append("] ")
                    .append(passage.text().trim())
                    .append("\n\n");
        }
        return sb.toString().trim();
    }

    protected static String formatHistory(TutorQuery query) {
        List<ConversationTurn> recent = query.recentHistory();
        if (recent.isEmpty()) {
            return "";
        }
        StringBuilder sb = new StringBuilder("Previous conversation:\n");
        for (ConversationTurn turn : recent) {
            sb.append(turn.role()).append(": ").append(turn.text()).append("\n");
        }
        return sb.append("\n").toString();
    }

    /**
     * LLMs sometimes wrap structured output in markdown code fences.
     */
    protected static String stripCodeFences(String text) {
        return text.replaceAll("```json\\s*", "")
                .replaceAll("```\\s*", "")
                .trim();
    }

    /**
     * Lines that look like list items ("- x", "* x", "1. x", "2) x"), with the marker removed.
     */
    protected static List<String> listItems(String text) {
        return text.lines()
                .map(String::trim)
                .filter(line -> line.matches("^([-*•]|\\d+[.)])\\s+.+"))
                .map(line -> line.replaceFirst("^([-*•]|\\d+[.)])\\s+", "").trim())
                .toList();
    }

    /**
     * A follow-up completion and how its text folds into the payload.
     */
    protected record FollowUp(
            LlmPrompt prompt,
            CompletionOptions options,
            BiFunction<ResponsePayload, String, ResponsePayload> merge
    ) {}
}
