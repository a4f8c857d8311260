package com.phillippitts.frontdesk.service.carrier;

import com.phillippitts.frontdesk.service.orchestration.SessionOrchestrator;
import com.phillippitts.frontdesk.service.session.CallSession;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.ThreadContext;
import org.json.JSONException;
import org.json.JSONObject;
import org.springframework.web.socket.BinaryMessage;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.AbstractWebSocketHandler;
import org.springframework.web.socket.handler.ConcurrentWebSocketSessionDecorator;

import java.nio.ByteBuffer;

/**
 * Browser test channel: binary frames are PCM16 audio at the recognizer's rate, text frames are
 * JSON control messages. {@code text_message} injects typed text as a finalized transcript.
 *
 * <p>Registered only when {@code carrier.browser-channel-enabled=true}.
 */
public class BrowserVoiceHandler extends AbstractWebSocketHandler {

    private static final Logger LOG = LogManager.getLogger(BrowserVoiceHandler.class);

    static final String SESSION_ID_ATTR = "sessionId";

    private final SessionOrchestrator orchestrator;

    public BrowserVoiceHandler(SessionOrchestrator orchestrator) {
        this.orchestrator = orchestrator;
    }

    @Override
    public void afterConnectionEstablished(WebSocketSession socket) {
        BrowserChannel channel = new BrowserChannel(
                new ConcurrentWebSocketSessionDecorator(socket, 2_000, 512 * 1024));
        CallSession session = orchestrator.startSession("browser-" + socket.getId(), null, channel);
        socket.getAttributes().put(SESSION_ID_ATTR, session.id());
        channel.sendSessionStarted(session.id());
        LOG.info("Browser session started: sessionId={}", session.id());
    }

    @Override
    protected void handleBinaryMessage(WebSocketSession socket, BinaryMessage message) {
        String sessionId = (String) socket.getAttributes().get(SESSION_ID_ATTR);
        ByteBuffer payload = message.getPayload();
        byte[] pcm = new byte[payload.remaining()];
        payload.get(pcm);
        orchestrator.onPcmAudio(sessionId, pcm);
    }

    @Override
    protected void handleTextMessage(WebSocketSession socket, TextMessage message) {
        String sessionId = (String) socket.getAttributes().get(SESSION_ID_ATTR);
        ThreadContext.put(SESSION_ID_ATTR, sessionId);
        try {
            JSONObject json = new JSONObject(message.getPayload());
            String type = json.optString("type");
            switch (type) {
                case "text_message" -> orchestrator.onTypedQuery(sessionId, json.optString("text"));
                case "start_recording", "stop_recording" -> LOG.debug("Browser {}", type);
                default -> LOG.debug("Ignoring browser message type '{}'", type);
            }
        } catch (JSONException e) {
            LOG.warn("Dropping malformed browser message: {}", e.getMessage());
        } finally {
            ThreadContext.remove(SESSION_ID_ATTR);
        }
    }

    @Override
    public void afterConnectionClosed(WebSocketSession socket, CloseStatus status) {
        String sessionId = (String) socket.getAttributes().remove(SESSION_ID_ATTR);
        LOG.info("Browser session closed: sessionId={}, status={}", sessionId, status);
        if (sessionId != null) {
            orchestrator.endSession(sessionId);
        }
    }
}
