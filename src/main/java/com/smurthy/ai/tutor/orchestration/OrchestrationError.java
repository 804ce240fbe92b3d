package com.smurthy.ai.tutor.orchestration;

import java.util.List;

/**
 * Structured failure returned when no specialist could produce a response.
 *
 * @param specialist         primary specialist of the failed plan
 * @param providersAttempted providers tried, in order, for that specialist
 * @param attempts           total provider calls made across all specialists
 */
public record OrchestrationError(
        String specialist,
        String intent,
        List<String> providersAttempted,
        int attempts,
        String message
) {
    public OrchestrationError {
        providersAttempted = providersAttempted == null ? List.of() : List.copyOf(providersAttempted);
    }
}
