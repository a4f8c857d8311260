package com.phillippitts.frontdesk.domain;

import java.util.Objects;

/**
 * Request to synthesize one sentence (or a whole short answer) for a turn.
 *
 * @param sessionId owning session
 * @param text      plain text to speak
 * @param token     cancellation token of the turn
 * @param fallback  true for the apology spoken after a failure; a failed fallback is not retried
 */
public record SynthesisRequest(String sessionId, String text, CancellationToken token, boolean fallback)
        implements SessionMessage {

    public SynthesisRequest {
        Objects.requireNonNull(sessionId, "sessionId must not be null");
        Objects.requireNonNull(text, "text must not be null");
        Objects.requireNonNull(token, "token must not be null");
    }
}
