package com.smurthy.ai.tutor.orchestration;

import com.smurthy.ai.tutor.model.Intent;
import com.smurthy.ai.tutor.model.SpecialistKind;

import java.util.List;

/**
 * Specialists to run for one query, in execution order. The primary
 * specialist's output is the answer; the others enrich it.
 */
public record RoutingPlan(Intent intent, List<SpecialistKind> specialists, SpecialistKind primary) {

    public RoutingPlan {
        specialists = List.copyOf(specialists);
        if (!specialists.contains(primary)) {
            throw new IllegalArgumentException("Primary specialist " + primary + " is not part of " + specialists);
        }
    }

    public boolean isChain() {
        return specialists.size() > 1;
    }
}
