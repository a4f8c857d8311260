package com.phillippitts.frontdesk.service.events;

import java.time.Instant;
import java.util.Objects;

/**
 * Published when an external provider call fails or times out for a session.
 *
 * @param provider  provider name (deepgram, elevenlabs, openai)
 * @param sessionId affected session, may be null for startup work
 * @param reason    short reason tag (timeout, error, connect)
 * @param timestamp when the failure was observed
 */
public record ProviderFailureEvent(String provider, String sessionId, String reason, Instant timestamp) {

    public ProviderFailureEvent {
        Objects.requireNonNull(provider, "provider must not be null");
        Objects.requireNonNull(reason, "reason must not be null");
        Objects.requireNonNull(timestamp, "timestamp must not be null");
    }

    public static ProviderFailureEvent of(String provider, String sessionId, String reason) {
        return new ProviderFailureEvent(provider, sessionId, reason, Instant.now());
    }
}
