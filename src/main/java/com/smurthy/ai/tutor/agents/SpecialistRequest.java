package com.smurthy.ai.tutor.agents;

import com.smurthy.ai.tutor.model.AgentResponse;
import com.smurthy.ai.tutor.model.ClassificationResult;
import com.smurthy.ai.tutor.model.StudentProfile;
import com.smurthy.ai.tutor.model.TutorQuery;
import com.smurthy.ai.tutor.retrieval.RetrievedContext;

import java.util.List;
import java.util.Optional;

/**
 * Everything a specialist sees for one query.
 *
 * @param context        grounding passages; empty when the intent needs none or retrieval failed
 * @param priorResults   responses of specialists that already ran earlier in the chain
 */
public record SpecialistRequest(
        TutorQuery query,
        StudentProfile profile,
        ClassificationResult classification,
        RetrievedContext context,
        List<AgentResponse> priorResults
) {
    public SpecialistRequest {
        context = context == null ? RetrievedContext.empty() : context;
        priorResults = priorResults == null ? List.of() : List.copyOf(priorResults);
    }

    public SpecialistRequest withPriorResults(List<AgentResponse> results) {
        return new SpecialistRequest(query, profile, classification, context, results);
    }

    /**
     * Most recent graded result in the chain, if a grader ran before this specialist.
     */
    public Optional<AgentResponse> latestScored() {
        for (int i = priorResults.size() - 1; i >= 0; i--) {
            if (priorResults.get(i).payload().hasScore()) {
                return Optional.of(priorResults.get(i));
            }
        }
        return Optional.empty();
    }
}
