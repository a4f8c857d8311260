package com.phillippitts.frontdesk.service.routing;

import java.util.Objects;

/**
 * One curated question/answer pair with its canonical answer.
 */
public record CuratedQa(String question, String answer) {

    public CuratedQa {
        Objects.requireNonNull(question, "question must not be null");
        Objects.requireNonNull(answer, "answer must not be null");
    }

    /**
     * Text embedded in the index.
     */
    public String indexText() {
        return "Question: " + question + "\n\nAnswer: " + answer;
    }
}
