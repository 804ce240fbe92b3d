package com.smurthy.ai.tutor.model;

import java.util.List;
import java.util.Map;

/**
 * Read-only view of the student the query is answered for.
 * Prior performance signals are optional and default to empty.
 */
public record StudentProfile(
        int grade,
        String subject,
        Map<String, Double> subjectScores,
        List<String> weakTopics,
        List<String> strongTopics,
        Double attendanceRate,
        Double peerPercentile
) {
    public StudentProfile {
        subject = subject == null ? "" : subject;
        subjectScores = subjectScores == null ? Map.of() : Map.copyOf(subjectScores);
        weakTopics = weakTopics == null ? List.of() : List.copyOf(weakTopics);
        strongTopics = strongTopics == null ? List.of() : List.copyOf(strongTopics);
    }

    public static StudentProfile of(int grade, String subject) {
        return new StudentProfile(grade, subject, Map.of(), List.of(), List.of(), null, null);
    }

    public boolean hasPerformanceSignals() {
        return !subjectScores.isEmpty() || !weakTopics.isEmpty() || !strongTopics.isEmpty()
                || attendanceRate != null || peerPercentile != null;
    }
}
