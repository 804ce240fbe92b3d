package com.smurthy.ai.tutor.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.smurthy.ai.tutor.model.ConversationTurn;
import com.smurthy.ai.tutor.model.StudentProfile;
import com.smurthy.ai.tutor.model.TutorQuery;
import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

import java.util.List;
import java.util.Map;

/**
 * Request body of {@code POST /api/tutor/ask}.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record AskRequest(
        @NotBlank String tenantId,
        @NotBlank String userQuery,
        @NotNull @Valid Profile studentProfile,
        String submittedAnswer,
        String expectedAnswer,
        List<@Valid Turn> history
) {

    public TutorQuery toQuery() {
        List<ConversationTurn> turns = history == null
                ? List.of()
                : history.stream().map(t -> new ConversationTurn(t.role(), t.text())).toList();
        return new TutorQuery(tenantId, userQuery, submittedAnswer, expectedAnswer, turns);
    }

    public StudentProfile toProfile() {
        return new StudentProfile(studentProfile.grade(), studentProfile.subject(), studentProfile.subjectScores(),
                studentProfile.weakTopics(), studentProfile.strongTopics(),
                studentProfile.attendanceRate(), studentProfile.peerPercentile());
    }

    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public record Profile(
            @NotNull @Min(1) @Max(12) Integer grade,
            @NotBlank String subject,
            Map<String, Double> subjectScores,
            List<String> weakTopics,
            List<String> strongTopics,
            @DecimalMin("0.0") @DecimalMax("1.0") Double attendanceRate,
            @DecimalMin("0.0") @DecimalMax("100.0") Double peerPercentile
    ) {
    }

    public record Turn(@NotBlank String role, @NotBlank String text) {
    }
}
