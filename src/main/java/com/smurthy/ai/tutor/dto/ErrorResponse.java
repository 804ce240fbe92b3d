package com.smurthy.ai.tutor.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.smurthy.ai.tutor.orchestration.OrchestrationError;

import java.util.List;

/**
 * Error body. The orchestration fields are only present for provider exhaustion.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record ErrorResponse(
        String error,
        String message,
        String specialist,
        String intent,
        List<String> providersAttempted,
        Integer attempts
) {
    public static ErrorResponse of(String error, String message) {
        return new ErrorResponse(error, message, null, null, null, null);
    }

    public static ErrorResponse orchestration(OrchestrationError failure) {
        return new ErrorResponse("orchestration_failed", failure.message(), failure.specialist(), failure.intent(),
                failure.providersAttempted(), failure.attempts());
    }
}
