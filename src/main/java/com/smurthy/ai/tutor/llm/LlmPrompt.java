package com.smurthy.ai.tutor.llm;

/**
 * A fully rendered prompt. Rendering is a pure templating step done by the caller.
 *
 * @param tenantId tenant billed for the completion; {@code null} for calls made
 *                 outside a tenant's request
 */
public record LlmPrompt(String system, String user, String tenantId) {

    public LlmPrompt(String system, String user) {
        this(system, user, null);
    }

    public static LlmPrompt of(String system, String user) {
        return new LlmPrompt(system, user);
    }

    public LlmPrompt forTenant(String tenantId) {
        return new LlmPrompt(system, user, tenantId);
    }
}
