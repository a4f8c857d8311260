package com.phillippitts.frontdesk.domain;

import java.util.Objects;

/**
 * Request to answer one finalized caller query.
 *
 * <p>The router turns {@code query} into a strategy; when generation is needed the reply streamer
 * expands it into the ordered prompt turns (history, optional context, query).
 *
 * @param sessionId owning session
 * @param query     raw finalized transcript
 * @param token     cancellation token of the turn
 */
public record GenerationRequest(String sessionId, String query, CancellationToken token)
        implements SessionMessage {

    public GenerationRequest {
        Objects.requireNonNull(sessionId, "sessionId must not be null");
        Objects.requireNonNull(query, "query must not be null");
        Objects.requireNonNull(token, "token must not be null");
    }
}
