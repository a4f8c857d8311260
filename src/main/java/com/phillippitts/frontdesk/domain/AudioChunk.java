package com.phillippitts.frontdesk.domain;

import java.util.Objects;

/**
 * Carrier-codec (8kHz mu-law) audio for one session, as produced by synthesis.
 * Chunks of one utterance are strictly ordered and tagged with the turn's token.
 *
 * @param sessionId owning session
 * @param payload   opaque mu-law bytes
 * @param token     cancellation token of the turn that produced the audio
 */
public record AudioChunk(String sessionId, byte[] payload, CancellationToken token) implements SessionMessage {

    public AudioChunk {
        Objects.requireNonNull(sessionId, "sessionId must not be null");
        Objects.requireNonNull(payload, "payload must not be null");
        Objects.requireNonNull(token, "token must not be null");
    }

    public int size() {
        return payload.length;
    }
}
