package com.phillippitts.frontdesk.service.carrier;

import com.phillippitts.frontdesk.exception.InvalidAudioException;
import com.phillippitts.frontdesk.service.orchestration.SessionOrchestrator;
import com.phillippitts.frontdesk.service.session.CallSession;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.ThreadContext;
import org.json.JSONException;
import org.json.JSONObject;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.ConcurrentWebSocketSessionDecorator;
import org.springframework.web.socket.handler.TextWebSocketHandler;

import java.util.Base64;

/**
 * Inbound side of a Twilio-style media stream.
 *
 * <p>{@code start} creates the call session, {@code media} carries base64 mu-law caller audio,
 * {@code stop} or a closed socket ends the session. Malformed frames are logged and dropped.
 */
@Component
public class TwilioMediaStreamHandler extends TextWebSocketHandler {

    private static final Logger LOG = LogManager.getLogger(TwilioMediaStreamHandler.class);

    static final String SESSION_ID_ATTR = "sessionId";
    static final String CALL_SID_ATTR = "callSid";

    private static final int SEND_TIME_LIMIT_MS = 2_000;
    private static final int SEND_BUFFER_LIMIT = 256 * 1024;

    private final SessionOrchestrator orchestrator;

    public TwilioMediaStreamHandler(SessionOrchestrator orchestrator) {
        this.orchestrator = orchestrator;
    }

    @Override
    public void afterConnectionEstablished(WebSocketSession socket) {
        LOG.info("Media stream connected: {}", socket.getId());
    }

    @Override
    protected void handleTextMessage(WebSocketSession socket, TextMessage message) {
        String callSid = (String) socket.getAttributes().get(CALL_SID_ATTR);
        String sessionId = (String) socket.getAttributes().get(SESSION_ID_ATTR);
        putContext(callSid, sessionId);
        try {
            JSONObject event = new JSONObject(message.getPayload());
            switch (event.optString("event")) {
                case "connected" -> LOG.debug("Media stream protocol {}", event.optString("protocol"));
                case "start" -> onStart(socket, event.getJSONObject("start"));
                case "media" -> onMedia(sessionId, event.optJSONObject("media"));
                case "mark" -> LOG.debug("Playback mark reached: {}", event.optJSONObject("mark"));
                case "stop" -> onStop(socket, sessionId);
                default -> LOG.debug("Ignoring media stream event '{}'", event.optString("event"));
            }
        } catch (JSONException e) {
            LOG.warn("Dropping malformed media stream frame: {}", e.getMessage());
        } catch (InvalidAudioException e) {
            LOG.warn("Dropping inbound frame: {}", e.getMessage());
        } finally {
            ThreadContext.remove(SESSION_ID_ATTR);
            ThreadContext.remove(CALL_SID_ATTR);
        }
    }

    private void onStart(WebSocketSession socket, JSONObject start) {
        String callSid = start.getString("callSid");
        String streamSid = start.getString("streamSid");
        CarrierChannel channel = new TwilioMediaChannel(
                new ConcurrentWebSocketSessionDecorator(socket, SEND_TIME_LIMIT_MS, SEND_BUFFER_LIMIT), streamSid);
        CallSession session = orchestrator.startSession(callSid, streamSid, channel);
        socket.getAttributes().put(CALL_SID_ATTR, callSid);
        socket.getAttributes().put(SESSION_ID_ATTR, session.id());
        putContext(callSid, session.id());
        LOG.info("Call started: callSid={}, streamSid={}, sessionId={}", callSid, streamSid, session.id());
    }

    private void onMedia(String sessionId, JSONObject media) {
        if (sessionId == null) {
            LOG.debug("Media before start; dropping");
            return;
        }
        if (media == null || !media.has("payload")) {
            throw new InvalidAudioException("missing payload");
        }
        if ("outbound".equals(media.optString("track"))) {
            return;
        }
        byte[] mulaw;
        try {
            mulaw = Base64.getDecoder().decode(media.getString("payload"));
        } catch (IllegalArgumentException e) {
            throw new InvalidAudioException("payload is not base64");
        }
        if (mulaw.length == 0) {
            throw new InvalidAudioException(0, "empty payload");
        }
        orchestrator.onCarrierAudio(sessionId, mulaw);
    }

    private void onStop(WebSocketSession socket, String sessionId) {
        LOG.info("Call ended by carrier: sessionId={}", sessionId);
        if (sessionId != null) {
            orchestrator.endSession(sessionId);
            socket.getAttributes().remove(SESSION_ID_ATTR);
        }
    }

    @Override
    public void handleTransportError(WebSocketSession socket, Throwable exception) {
        LOG.warn("Media stream transport error on {}: {}", socket.getId(), exception.getMessage());
    }

    @Override
    public void afterConnectionClosed(WebSocketSession socket, CloseStatus status) {
        String sessionId = (String) socket.getAttributes().remove(SESSION_ID_ATTR);
        LOG.info("Media stream disconnected: {} ({})", socket.getId(), status);
        if (sessionId != null) {
            orchestrator.endSession(sessionId);
        }
    }

    private static void putContext(String callSid, String sessionId) {
        if (callSid != null) {
            ThreadContext.put(CALL_SID_ATTR, callSid);
        }
        if (sessionId != null) {
            ThreadContext.put(SESSION_ID_ATTR, sessionId);
        }
    }
}
