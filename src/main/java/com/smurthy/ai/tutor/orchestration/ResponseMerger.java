package com.smurthy.ai.tutor.orchestration;

import com.smurthy.ai.tutor.model.AgentResponse;
import com.smurthy.ai.tutor.model.Provenance;
import com.smurthy.ai.tutor.model.ResponsePayload;
import com.smurthy.ai.tutor.model.SpecialistKind;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Folds the responses of a specialist chain into the single response
 * returned to the caller.
 *
 * The primary specialist's payload is kept, quiz included; recommendations and steps from
 * the other specialists are appended to it. When the primary failed, the
 * first successful specialist in execution order stands in. The result is
 * fallback-degraded if any specialist used a fallback provider or any
 * specialist in the chain failed.
 */
public class ResponseMerger {

    public AgentResponse merge(RoutingPlan plan, List<AgentResponse> results, boolean chainIncomplete) {
        if (results.isEmpty()) {
            throw new IllegalArgumentException("Nothing to merge for intent " + plan.intent().label());
        }

        AgentResponse primary = results.stream()
                .filter(r -> r.specialist() == plan.primary())
                .findFirst()
                .orElse(results.get(0));

        List<String> steps = new ArrayList<>(primary.payload().steps());
        List<String> recommendations = new ArrayList<>(primary.payload().recommendations());
        Set<String> sources = new LinkedHashSet<>();
        List<SpecialistKind> specialistsRun = new ArrayList<>();
        long latency = 0;
        boolean degraded = chainIncomplete;

        for (AgentResponse result : results) {
            specialistsRun.add(result.specialist());
            sources.addAll(result.sources());
            latency += result.latencyMs();
            degraded |= result.provenance() == Provenance.FALLBACK_DEGRADED;
            if (result != primary) {
                steps.addAll(result.payload().steps());
                recommendations.addAll(result.payload().recommendations());
            }
        }

        ResponsePayload base = primary.payload();
        ResponsePayload payload = new ResponsePayload(base.text(), base.score(), base.maxScore(), base.correct(),
                steps, recommendations, base.quiz());

        return new AgentResponse(primary.specialist(), payload, latency,
                degraded ? Provenance.FALLBACK_DEGRADED : Provenance.GENERATED,
                specialistsRun, List.copyOf(sources));
    }
}
