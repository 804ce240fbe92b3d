package com.smurthy.ai.tutor.agents;

import com.smurthy.ai.tutor.llm.CompletionOptions;
import com.smurthy.ai.tutor.llm.LlmClient;
import com.smurthy.ai.tutor.llm.LlmPrompt;
import com.smurthy.ai.tutor.model.AgentResponse;
import com.smurthy.ai.tutor.model.ResponsePayload;
import com.smurthy.ai.tutor.model.SpecialistKind;
import com.smurthy.ai.tutor.model.StudentProfile;

import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Analyzes the student's performance signals (and the grade just given,
 * when a grader ran first) and produces learning recommendations.
 */
public class AnalystAgent extends AbstractSpecialistAgent {

    private static final String SYSTEM_PROMPT = """
            You are an educational analyst helping a student plan their learning.

            Respond with:
            - A short assessment (2-3 sentences) of where the student stands
            - Then a line "Recommendations:" followed by 3 to 5 concrete recommendations,
              one per line, each starting with "- "
            """;

    private static final Pattern RECOMMENDATIONS_MARKER = Pattern.compile(
            "^[\\s*#]*(?:recommendations|рекомендації)\\s*\\**\\s*:", Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE | Pattern.MULTILINE);

    public AnalystAgent(LlmClient llmClient) {
        super(llmClient);
    }

    @Override
    public SpecialistKind kind() {
        return SpecialistKind.ANALYST;
    }

    @Override
    protected LlmPrompt buildPrompt(SpecialistRequest request) {
        StudentProfile profile = request.profile();
        StringBuilder user = new StringBuilder();
        user.append("Subject: ").append(profile.subject()).append(", grade ").append(profile.grade()).append("\n");

        if (profile.hasPerformanceSignals()) {
            for (Map.Entry<String, Double> score : profile.subjectScores().entrySet()) {
                user.append("Score in ").append(score.getKey()).append(": ").append(score.getValue()).append("\n");
            }
            if (!profile.weakTopics().isEmpty()) {
                user.append("Weak topics: ").append(String.join(", ", profile.weakTopics())).append("\n");
            }
            if (!profile.strongTopics().isEmpty()) {
                user.append("Strong topics: ").append(String.join(", ", profile.strongTopics())).append("\n");
            }
            if (profile.attendanceRate() != null) {
                user.append("Attendance rate: ").append(profile.attendanceRate()).append("\n");
            }
            if (profile.peerPercentile() != null) {
                user.append("Percentile among peers: ").append(profile.peerPercentile()).append("\n");
            }
        } else {
            user.append("No prior performance data is available.\n");
        }

        request.latestScored().ifPresent(graded -> appendGrade(user, graded));

        user.append("\nStudent request:\n").append(request.query().text());
        return new LlmPrompt(SYSTEM_PROMPT, user.toString());
    }

    @Override
    protected CompletionOptions options() {
        return CompletionOptions.ANALYTICS;
    }

    @Override
    protected ResponsePayload parse(String text, SpecialistRequest request) {
        String trimmed = text.trim();
        return new ResponsePayload(trimmed, null, null, null, List.of(), recommendations(trimmed));
    }

    /**
     * List items after the "Recommendations:" marker, or every list item when
     * the model left the marker out.
     */
    static List<String> recommendations(String text) {
        Matcher marker = RECOMMENDATIONS_MARKER.matcher(text);
        if (marker.find()) {
            List<String> afterMarker = listItems(text.substring(marker.end()));
            if (!afterMarker.isEmpty()) {
                return afterMarker;
            }
        }
        return listItems(text);
    }

    private static void appendGrade(StringBuilder user, AgentResponse graded) {
        ResponsePayload payload = graded.payload();
        user.append("\nJust graded: ").append(payload.score()).append("/").append(payload.maxScore())
                .append(Boolean.TRUE.equals(payload.correct()) ? " (correct)" : " (incorrect)").append("\n");
        if (payload.text() != null && !payload.text().isBlank()) {
            user.append("Grader feedback: ").append(payload.text()).append("\n");
        }
    }
}
