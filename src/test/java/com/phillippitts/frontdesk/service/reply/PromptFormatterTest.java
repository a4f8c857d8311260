package com.phillippitts.frontdesk.service.reply;

import com.phillippitts.frontdesk.domain.ConfidenceTier;
import com.phillippitts.frontdesk.domain.Passage;
import com.phillippitts.frontdesk.domain.PassageKind;
import com.phillippitts.frontdesk.domain.RouteDecision;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class PromptFormatterTest {

    private static final Passage BLUE_CROSS =
            new Passage("We accept Blue Cross.", 0.654, PassageKind.FREE_TEXT, Map.of());
    private static final Passage MEDICARE =
            new Passage("We accept Medicare.", 0.5, PassageKind.FREE_TEXT, Map.of());

    @Test
    void formatsNumberedSourcesWithRoundedRelevance() {
        String context = PromptFormatter.formatContext(List.of(BLUE_CROSS, MEDICARE));

        assertThat(context).isEqualTo("""
                [Source 1] (relevance: 65%):
                We accept Blue Cross.

                [Source 2] (relevance: 50%):
                We accept Medicare.""");
    }

    @Test
    void openRouteSendsQueryUnchanged() {
        String turn = PromptFormatter.userTurn("Tell me a joke", RouteDecision.open(false), "Use the context.");

        assertThat(turn).isEqualTo("Tell me a joke");
    }

    @Test
    void groundedRouteWrapsQueryInContext() {
        RouteDecision decision = RouteDecision.grounded(ConfidenceTier.MEDIUM, List.of(BLUE_CROSS));

        String turn = PromptFormatter.userTurn("Do you take Blue Cross?", decision, "Use the context.");

        assertThat(turn)
                .startsWith("Context from knowledge base:\n[Source 1] (relevance: 65%):\nWe accept Blue Cross.")
                .contains("\n\nUser question: Do you take Blue Cross?\n\n")
                .endsWith("Use the context.");
    }
}
