package com.smurthy.ai.tutor.orchestration;

public class OrchestrationException extends RuntimeException {

    private final OrchestrationError error;

    public OrchestrationException(OrchestrationError error, Throwable cause) {
        super(error.message(), cause);
        this.error = error;
    }

    public OrchestrationError error() {
        return error;
    }
}
