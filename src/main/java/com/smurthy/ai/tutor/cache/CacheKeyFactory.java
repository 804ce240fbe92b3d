package com.smurthy.ai.tutor.cache;

import com.smurthy.ai.tutor.model.ConversationTurn;
import com.smurthy.ai.tutor.model.Intent;
import com.smurthy.ai.tutor.model.StudentProfile;
import com.smurthy.ai.tutor.model.TutorQuery;
import org.springframework.ai.embedding.EmbeddingModel;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Locale;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Builds {@link CacheKey}s: normalizes the query, embeds it and fingerprints
 * the request context the answer depends on.
 */
public class CacheKeyFactory {

    private final EmbeddingModel embeddingModel;

    public CacheKeyFactory(EmbeddingModel embeddingModel) {
        this.embeddingModel = embeddingModel;
    }

    /**
     * @throws CacheException if the query cannot be embedded
     */
    public CacheKey create(TutorQuery query, StudentProfile profile, Intent intent) {
        String normalized = normalize(query.text());
        float[] embedding;
        try {
            embedding = embeddingModel.embed(normalized);
        } catch (RuntimeException e) {
            throw new CacheException("Failed to embed query for cache lookup: " + e.getMessage(), e);
        }
        return new CacheKey(query.tenantId(), intent, normalized, contextFingerprint(query, profile, intent), embedding);
    }

    /**
     * Lowercase, collapse whitespace, drop trailing punctuation.
     */
    static String normalize(String text) {
        String collapsed = text.trim().toLowerCase(Locale.ROOT).replaceAll("\\s+", " ");
        return collapsed.replaceAll("[\\s?!.]+$", "");
    }

    /**
     * Hashes everything besides the query text that the answer depends on:
     * subject, grade and the submitted/expected answers for every intent, the
     * recent conversation and the practice-question request for explanations
     * and solutions, and the student's performance signals for intents whose
     * chain ends in the analyst.
     */
    static String contextFingerprint(TutorQuery query, StudentProfile profile, Intent intent) {
        StringBuilder context = new StringBuilder()
                .append("subject=").append(profile.subject().trim().toLowerCase(Locale.ROOT))
                .append("|grade=").append(profile.grade())
                .append("|answer=").append(Objects.toString(query.submittedAnswer(), "").trim())
                .append("|expected=").append(Objects.toString(query.expectedAnswer(), "").trim());

        switch (intent) {
            case EXPLAIN, SOLVE -> {
                context.append("|practice=").append(query.asksForPractice());
                for (ConversationTurn turn : query.recentHistory()) {
                    context.append("|turn=").append(turn.role()).append(':').append(turn.text());
                }
            }
            case GRADE, ANALYZE -> context
                    .append("|scores=").append(new TreeMap<>(profile.subjectScores()))
                    .append("|weak=").append(profile.weakTopics())
                    .append("|strong=").append(profile.strongTopics())
                    .append("|attendance=").append(profile.attendanceRate())
                    .append("|percentile=").append(profile.peerPercentile());
        }

        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(context.toString().getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
