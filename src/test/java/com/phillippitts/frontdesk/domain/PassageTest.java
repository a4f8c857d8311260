package com.phillippitts.frontdesk.domain;

import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PassageTest {

    @Test
    void scoreOutsideUnitRangeIsRejected() {
        assertThatThrownBy(() -> new Passage("x", 1.2, PassageKind.FREE_TEXT, Map.of()))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new Passage("x", -0.1, PassageKind.FREE_TEXT, Map.of()))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void storedAnswerOnlyForNonBlankAnswers() {
        Passage withAnswer = new Passage("t", 0.8, PassageKind.CURATED_QA, Map.of(Passage.ANSWER_KEY, "Yes, we do."));
        Passage blank = new Passage("t", 0.8, PassageKind.CURATED_QA, Map.of(Passage.ANSWER_KEY, "  "));
        Passage free = new Passage("t", 0.8, PassageKind.FREE_TEXT, null);

        assertThat(withAnswer.storedAnswer()).isEqualTo("Yes, we do.");
        assertThat(withAnswer.isCurated()).isTrue();
        assertThat(blank.storedAnswer()).isNull();
        assertThat(free.storedAnswer()).isNull();
        assertThat(free.metadata()).isEmpty();
    }

    @Test
    void metadataIsCopied() {
        Map<String, String> metadata = new HashMap<>();
        metadata.put(Passage.ANSWER_KEY, "original");
        Passage passage = new Passage("t", 0.5, PassageKind.CURATED_QA, metadata);

        metadata.put(Passage.ANSWER_KEY, "changed");

        assertThat(passage.storedAnswer()).isEqualTo("original");
    }
}
