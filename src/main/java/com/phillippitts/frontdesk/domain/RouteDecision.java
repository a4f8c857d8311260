package com.phillippitts.frontdesk.domain;

import java.util.List;
import java.util.Objects;

/**
 * Answer strategy chosen for one finalized query.
 *
 * @param tier               confidence tier of the top surviving passage
 * @param directAnswer       stored answer to speak as-is (only for {@link ConfidenceTier#HIGH})
 * @param context            passages to ground generation in, best first (empty for open generation)
 * @param retrievalPerformed whether the knowledge base was queried at all
 */
public record RouteDecision(ConfidenceTier tier, String directAnswer, List<Passage> context,
                            boolean retrievalPerformed) {

    public RouteDecision {
        Objects.requireNonNull(tier, "tier must not be null");
        context = context == null ? List.of() : List.copyOf(context);
        if (tier == ConfidenceTier.HIGH && (directAnswer == null || directAnswer.isBlank())) {
            throw new IllegalArgumentException("HIGH tier requires a direct answer");
        }
    }

    public static RouteDecision direct(Passage passage) {
        return new RouteDecision(ConfidenceTier.HIGH, passage.storedAnswer(), List.of(passage), true);
    }

    public static RouteDecision grounded(ConfidenceTier tier, List<Passage> passages) {
        if (tier != ConfidenceTier.MEDIUM && tier != ConfidenceTier.LOW) {
            throw new IllegalArgumentException("Grounded generation needs MEDIUM or LOW tier, got: " + tier);
        }
        return new RouteDecision(tier, null, passages, true);
    }

    /**
     * Open generation without context.
     *
     * @param retrievalPerformed false when the relevance filter skipped the knowledge base
     */
    public static RouteDecision open(boolean retrievalPerformed) {
        return new RouteDecision(ConfidenceTier.NONE, null, List.of(), retrievalPerformed);
    }

    public boolean requiresGeneration() {
        return tier != ConfidenceTier.HIGH;
    }

    public boolean isGrounded() {
        return !context.isEmpty() && requiresGeneration();
    }
}
