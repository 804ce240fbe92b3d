package com.smurthy.ai.tutor.orchestration;

import com.smurthy.ai.tutor.model.ClassificationResult;
import com.smurthy.ai.tutor.model.Intent;
import com.smurthy.ai.tutor.model.StudentProfile;
import com.smurthy.ai.tutor.model.TutorQuery;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Rule-based intent classifier. Deterministic and free of I/O, so a cached
 * answer can be served without any model call.
 *
 * A submitted answer always means grading. Otherwise each intent scores one
 * point per matching cue; the best score wins and a tie or no match at all
 * falls back to {@link Intent#EXPLAIN} marked as ambiguous.
 */
public class IntentClassifier {

    private static final Logger log = LoggerFactory.getLogger(IntentClassifier.class);

    private static final Map<Intent, List<String>> CUES = Map.of(
            Intent.EXPLAIN, List.of("explain", "what is", "what are", "why", "how does", "tell me about",
                    "describe", "meaning of", "difference between", "quiz", "practice question", "test me",
                    "поясни", "що таке", "чому", "розкажи", "вікторин", "тестові", "вправ"),
            Intent.SOLVE, List.of("solve", "calculate", "compute", "evaluate", "simplify", "find the value",
                    "find x", "how many", "how much", "factor", "розв'яж", "розвʼяж", "обчисл", "знайди", "спрости"),
            Intent.GRADE, List.of("grade my", "check my answer", "is my answer", "is this correct", "is this right",
                    "mark my", "перевір", "оціни"),
            Intent.ANALYZE, List.of("my progress", "how am i doing", "weak", "strength", "recommend",
                    "performance", "what should i study", "study plan", "analy", "прогрес", "рекоменд", "аналіз",
                    "успішність"));

    /**
     * Arithmetic with an equals sign, e.g. "2x + 3 = 7" or "x^2 - 4 = 0".
     */
    private static final Pattern EQUATION = Pattern.compile("[0-9a-z)²]\\s*(?:\\^\\s*\\d+\\s*)?[-+*/]\\s*[0-9a-z(].*=|=\\s*\\?");

    public ClassificationResult classify(TutorQuery query, StudentProfile profile) {
        if (query.hasSubmittedAnswer()) {
            return ClassificationResult.of(Intent.GRADE, 1.0, "Query carries a submitted answer");
        }

        String text = query.text().toLowerCase(Locale.ROOT);
        Map<Intent, Integer> scores = new EnumMap<>(Intent.class);
        for (Intent intent : Intent.values()) {
            int score = 0;
            for (String cue : CUES.get(intent)) {
                if (text.contains(cue)) {
                    score++;
                }
            }
            scores.put(intent, score);
        }
        if (EQUATION.matcher(text).find()) {
            scores.merge(Intent.SOLVE, 2, Integer::sum);
        }

        Intent best = null;
        int bestScore = 0;
        int total = 0;
        boolean tie = false;
        for (Map.Entry<Intent, Integer> entry : scores.entrySet()) {
            int score = entry.getValue();
            total += score;
            if (score > bestScore) {
                best = entry.getKey();
                bestScore = score;
                tie = false;
            } else if (score == bestScore && score > 0) {
                tie = true;
            }
        }

        if (best == null || tie) {
            String reason = best == null ? "No intent cue matched" : "Intent cues tied: " + scores;
            log.warn("[IntentClassifier] ClassificationAmbiguous for '{}': {}, defaulting to explain", query.text(), reason);
            return ClassificationResult.ambiguous(reason);
        }

        double confidence = (double) bestScore / total;
        return ClassificationResult.of(best, confidence,
                "Matched " + bestScore + " " + best.label() + " cue(s) for subject '" + profile.subject() + "'");
    }
}
