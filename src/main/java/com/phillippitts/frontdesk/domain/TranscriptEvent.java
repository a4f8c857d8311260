package com.phillippitts.frontdesk.domain;

import java.time.Instant;
import java.util.Objects;

/**
 * Transcript produced by the speech-to-text provider for one session.
 *
 * <p>Interim events ({@code isFinal == false}) arrive continuously while the caller speaks and feed
 * barge-in detection only. A final event closes the caller's utterance and starts a new turn.
 *
 * @param sessionId owning session
 * @param text      recognized text, may be empty for silence
 * @param isFinal   whether the provider finalized this utterance
 * @param timestamp when the event was received
 */
public record TranscriptEvent(String sessionId, String text, boolean isFinal, Instant timestamp)
        implements SessionMessage {

    public TranscriptEvent {
        Objects.requireNonNull(sessionId, "sessionId must not be null");
        text = text == null ? "" : text;
        Objects.requireNonNull(timestamp, "timestamp must not be null");
    }

    public static TranscriptEvent interim(String sessionId, String text) {
        return new TranscriptEvent(sessionId, text, false, Instant.now());
    }

    public static TranscriptEvent finalized(String sessionId, String text) {
        return new TranscriptEvent(sessionId, text, true, Instant.now());
    }
}
