package com.smurthy.ai.tutor.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.smurthy.ai.tutor.model.AgentResponse;
import com.smurthy.ai.tutor.model.ResponsePayload;
import com.smurthy.ai.tutor.model.SpecialistKind;

import java.util.List;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record AskResponse(
        String specialist,
        ResponsePayload payload,
        String provenance,
        long latencyMs,
        List<String> specialistsRun,
        List<String> sources
) {
    public static AskResponse from(AgentResponse response) {
        return new AskResponse(
                response.specialist().id(),
                response.payload(),
                response.provenance().wireName(),
                response.latencyMs(),
                response.specialistsRun().stream().map(SpecialistKind::id).toList(),
                response.sources());
    }
}
