package com.smurthy.ai.tutor.model;

import java.util.List;

/**
 * The single response returned for a query.
 *
 * @param specialist      specialist whose output is the primary answer
 * @param payload         structured answer
 * @param latencyMs       generation latency (end-to-end latency once returned by the supervisor)
 * @param provenance      cache-hit, generated or fallback-degraded
 * @param specialistsRun  every specialist that contributed, in execution order
 * @param sources         source ids of the grounding passages used
 */
public record AgentResponse(
        SpecialistKind specialist,
        ResponsePayload payload,
        long latencyMs,
        Provenance provenance,
        List<SpecialistKind> specialistsRun,
        List<String> sources
) {
    public AgentResponse {
        specialistsRun = specialistsRun == null ? List.of(specialist) : List.copyOf(specialistsRun);
        sources = sources == null ? List.of() : List.copyOf(sources);
    }

    public AgentResponse withProvenance(Provenance newProvenance) {
        return new AgentResponse(specialist, payload, latencyMs, newProvenance, specialistsRun, sources);
    }

    public AgentResponse withLatency(long newLatencyMs) {
        return new AgentResponse(specialist, payload, newLatencyMs, provenance, specialistsRun, sources);
    }
}
