package com.phillippitts.frontdesk.service.reply;

import com.phillippitts.frontdesk.domain.Passage;
import com.phillippitts.frontdesk.domain.RouteDecision;

import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

/**
 * Builds the user turn sent to the generator, adding retrieved passages for grounded replies.
 */
final class PromptFormatter {

    private PromptFormatter() {}

    /**
     * {@code [Source i] (relevance: NN%):} blocks, best passage first, separated by blank lines.
     */
    static String formatContext(List<Passage> passages) {
        return IntStream.range(0, passages.size())
                .mapToObj(i -> "[Source " + (i + 1) + "] (relevance: "
                        + Math.round(passages.get(i).score() * 100) + "%):\n" + passages.get(i).text())
                .collect(Collectors.joining("\n\n"));
    }

    static String userTurn(String query, RouteDecision decision, String groundingInstruction) {
        if (!decision.isGrounded()) {
            return query;
        }
        return "Context from knowledge base:\n" + formatContext(decision.context())
                + "\n\nUser question: " + query
                + "\n\n" + groundingInstruction;
    }
}
