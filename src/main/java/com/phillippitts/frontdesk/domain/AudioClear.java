package com.phillippitts.frontdesk.domain;

import java.util.Objects;

/**
 * Signal to drop a session's queued playback and flush the carrier's playout buffer.
 *
 * @param sessionId owning session
 * @param reason    short tag for logs and metrics (barge-in, new-turn)
 */
public record AudioClear(String sessionId, String reason) implements SessionMessage {

    public AudioClear {
        Objects.requireNonNull(sessionId, "sessionId must not be null");
        reason = reason == null ? "unspecified" : reason;
    }
}
