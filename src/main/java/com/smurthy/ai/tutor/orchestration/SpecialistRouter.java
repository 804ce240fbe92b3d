package com.smurthy.ai.tutor.orchestration;

import com.smurthy.ai.tutor.model.ClassificationResult;
import com.smurthy.ai.tutor.model.Intent;
import com.smurthy.ai.tutor.model.SpecialistKind;
import com.smurthy.ai.tutor.model.TutorQuery;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Maps an intent to a {@link RoutingPlan}.
 *
 * explain -> content, solve -> solver, grade -> grader then analyst,
 * analyze -> analyst (grader first when an answer was submitted).
 * Configured overrides replace these lists; an override listing several
 * specialists for a single-specialist intent keeps the first by
 * {@link SpecialistKind} order and logs the ambiguity.
 */
public class SpecialistRouter {

    private static final Logger log = LoggerFactory.getLogger(SpecialistRouter.class);

    private static final Map<Intent, SpecialistKind> PRIMARY = Map.of(
            Intent.EXPLAIN, SpecialistKind.CONTENT,
            Intent.SOLVE, SpecialistKind.SOLVER,
            Intent.GRADE, SpecialistKind.GRADER,
            Intent.ANALYZE, SpecialistKind.ANALYST);

    private final Map<Intent, List<SpecialistKind>> overrides;

    public SpecialistRouter(Map<Intent, List<SpecialistKind>> overrides) {
        this.overrides = new EnumMap<>(Intent.class);
        overrides.forEach((intent, kinds) -> {
            if (kinds != null && !kinds.isEmpty()) {
                this.overrides.put(intent, kinds.stream().distinct().sorted(Comparator.naturalOrder()).toList());
            }
        });
    }

    public RoutingPlan plan(ClassificationResult classification, TutorQuery query) {
        Intent intent = classification.intent();
        List<SpecialistKind> chain = overrides.getOrDefault(intent, defaultChain(intent));

        if (intent == Intent.ANALYZE && !query.hasSubmittedAnswer()) {
            List<SpecialistKind> withoutGrader = chain.stream().filter(k -> k != SpecialistKind.GRADER).toList();
            chain = withoutGrader.isEmpty() ? chain : withoutGrader;
        }

        if (isSingleSpecialist(intent) && chain.size() > 1) {
            SpecialistKind chosen = chain.get(0);
            log.warn("[SpecialistRouter] {} specialists eligible for intent '{}', using {} by priority",
                    chain, intent.label(), chosen.id());
            chain = List.of(chosen);
        }

        SpecialistKind primary = chain.contains(PRIMARY.get(intent)) ? PRIMARY.get(intent) : chain.get(0);
        return new RoutingPlan(intent, chain, primary);
    }

    private static boolean isSingleSpecialist(Intent intent) {
        return intent == Intent.EXPLAIN || intent == Intent.SOLVE;
    }

    private static List<SpecialistKind> defaultChain(Intent intent) {
        return switch (intent) {
            case EXPLAIN -> List.of(SpecialistKind.CONTENT);
            case SOLVE -> List.of(SpecialistKind.SOLVER);
            case GRADE, ANALYZE -> List.of(SpecialistKind.GRADER, SpecialistKind.ANALYST);
        };
    }
}
