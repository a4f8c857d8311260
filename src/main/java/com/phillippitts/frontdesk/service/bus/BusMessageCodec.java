package com.phillippitts.frontdesk.service.bus;

import com.phillippitts.frontdesk.domain.AudioChunk;
import com.phillippitts.frontdesk.domain.AudioClear;
import com.phillippitts.frontdesk.domain.CancellationToken;
import com.phillippitts.frontdesk.domain.GenerationRequest;
import com.phillippitts.frontdesk.domain.SessionMessage;
import com.phillippitts.frontdesk.domain.SynthesisRequest;
import com.phillippitts.frontdesk.domain.TranscriptEvent;
import com.phillippitts.frontdesk.service.session.SessionRegistry;
import org.json.JSONObject;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.Base64;

/**
 * JSON wire form of pipeline messages on the broker.
 *
 * <p>Turn tokens travel as their turn id. On the way back the id is resolved against the session's
 * current turn: a message of the current turn gets the live token, anything older (or for a session
 * that has ended) gets an already-cancelled one. Audio is base64.
 */
@Component
public class BusMessageCodec {

    private final SessionRegistry sessions;

    public BusMessageCodec(SessionRegistry sessions) {
        this.sessions = sessions;
    }

    public byte[] encode(SessionMessage message) {
        JSONObject json = new JSONObject().put("sessionId", message.sessionId());
        if (message instanceof TranscriptEvent event) {
            json.put("text", event.text())
                    .put("final", event.isFinal())
                    .put("timestamp", event.timestamp().toString());
        } else if (message instanceof GenerationRequest request) {
            json.put("query", request.query())
                    .put("turnId", request.token().turnId());
        } else if (message instanceof SynthesisRequest request) {
            json.put("text", request.text())
                    .put("turnId", request.token().turnId())
                    .put("fallback", request.fallback());
        } else if (message instanceof AudioChunk chunk) {
            json.put("payload", Base64.getEncoder().encodeToString(chunk.payload()))
                    .put("turnId", chunk.token().turnId());
        } else if (message instanceof AudioClear clear) {
            json.put("reason", clear.reason());
        } else {
            throw new IllegalArgumentException("Unsupported message type: " + message.getClass().getName());
        }
        return json.toString().getBytes(StandardCharsets.UTF_8);
    }

    /**
     * @throws org.json.JSONException when the body is not a message of the queue's type
     */
    public <T extends SessionMessage> T decode(BusQueue<T> queue, byte[] body) {
        JSONObject json = new JSONObject(new String(body, StandardCharsets.UTF_8));
        String sessionId = json.getString("sessionId");
        Class<T> type = queue.type();
        SessionMessage message;
        if (type == TranscriptEvent.class) {
            message = new TranscriptEvent(sessionId, json.optString("text", ""), json.getBoolean("final"),
                    Instant.parse(json.getString("timestamp")));
        } else if (type == GenerationRequest.class) {
            message = new GenerationRequest(sessionId, json.getString("query"),
                    token(sessionId, json.getLong("turnId")));
        } else if (type == SynthesisRequest.class) {
            message = new SynthesisRequest(sessionId, json.getString("text"),
                    token(sessionId, json.getLong("turnId")), json.optBoolean("fallback", false));
        } else if (type == AudioChunk.class) {
            message = new AudioChunk(sessionId, Base64.getDecoder().decode(json.getString("payload")),
                    token(sessionId, json.getLong("turnId")));
        } else if (type == AudioClear.class) {
            message = new AudioClear(sessionId, json.optString("reason", null));
        } else {
            throw new IllegalArgumentException("Unsupported message type on " + queue.name() + ": " + type.getName());
        }
        return type.cast(message);
    }

    private CancellationToken token(String sessionId, long turnId) {
        return sessions.find(sessionId)
                .map(session -> session.tokenFor(turnId))
                .orElseGet(() -> CancellationToken.cancelled(turnId));
    }
}
