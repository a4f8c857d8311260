package com.phillippitts.frontdesk.domain;

import java.util.Map;
import java.util.Objects;

/**
 * One retrieved knowledge-base passage.
 *
 * @param text     passage text as indexed
 * @param score    relevance in [0, 1], higher is better
 * @param kind     curated QA pair or free text
 * @param metadata index metadata; curated entries carry {@code question} and {@code answer}
 */
public record Passage(String text, double score, PassageKind kind, Map<String, String> metadata) {

    public static final String ANSWER_KEY = "answer";
    public static final String QUESTION_KEY = "question";

    public Passage {
        Objects.requireNonNull(text, "text must not be null");
        if (score < 0.0 || score > 1.0) {
            throw new IllegalArgumentException("Score must be between 0.0 and 1.0, got: " + score);
        }
        Objects.requireNonNull(kind, "kind must not be null");
        metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
    }

    public boolean isCurated() {
        return kind == PassageKind.CURATED_QA;
    }

    /**
     * Canonical answer of a curated entry, or null for free text and curated entries without one.
     */
    public String storedAnswer() {
        String answer = metadata.get(ANSWER_KEY);
        return answer == null || answer.isBlank() ? null : answer;
    }
}
