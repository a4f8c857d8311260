package com.phillippitts.frontdesk.service.events;

import com.phillippitts.frontdesk.domain.ConfidenceTier;
import com.phillippitts.frontdesk.domain.TurnOutcome;

import java.time.Instant;
import java.util.Objects;

/**
 * Published once per finalized caller query when its turn reaches a terminal outcome.
 *
 * @param sessionId  owning session
 * @param turnId     turn number within the session
 * @param outcome    terminal outcome
 * @param tier       router tier the turn took (NONE when cancelled before routing)
 * @param durationMs time from dequeuing the request to the outcome
 * @param timestamp  when the outcome was reached
 */
public record TurnCompletedEvent(String sessionId, long turnId, TurnOutcome outcome, ConfidenceTier tier,
                                 long durationMs, Instant timestamp) {

    public TurnCompletedEvent {
        Objects.requireNonNull(sessionId, "sessionId must not be null");
        Objects.requireNonNull(outcome, "outcome must not be null");
        Objects.requireNonNull(tier, "tier must not be null");
        Objects.requireNonNull(timestamp, "timestamp must not be null");
    }

    public static TurnCompletedEvent of(String sessionId, long turnId, TurnOutcome outcome, ConfidenceTier tier,
                                        long durationMs) {
        return new TurnCompletedEvent(sessionId, turnId, outcome, tier, durationMs, Instant.now());
    }
}
