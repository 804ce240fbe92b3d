package com.smurthy.ai.tutor.agents;

import com.smurthy.ai.tutor.llm.ProviderException;
import com.smurthy.ai.tutor.model.AgentResponse;
import com.smurthy.ai.tutor.model.SpecialistKind;

/**
 * A task-specific answer generator. Specialists are stateless between
 * requests and safe to call concurrently.
 */
public interface SpecialistAgent {

    SpecialistKind kind();

    /**
     * @throws ProviderException when every language-model provider failed
     */
    AgentResponse execute(SpecialistRequest request);
}
