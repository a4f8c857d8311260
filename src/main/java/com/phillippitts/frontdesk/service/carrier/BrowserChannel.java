package com.phillippitts.frontdesk.service.carrier;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONObject;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;

import java.io.IOException;
import java.util.Base64;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Browser test client channel. Speaks JSON messages with a {@code type} field and also mirrors
 * transcripts so the page can show them.
 */
public class BrowserChannel implements CarrierChannel {

    private static final Logger LOG = LogManager.getLogger(BrowserChannel.class);

    private final WebSocketSession socket;
    private final AtomicBoolean closed = new AtomicBoolean();

    public BrowserChannel(WebSocketSession socket) {
        this.socket = socket;
    }

    public void sendSessionStarted(String sessionId) {
        send(new JSONObject().put("type", "session_started").put("sessionId", sessionId));
    }

    @Override
    public boolean sendAudio(byte[] mulaw) {
        return send(new JSONObject()
                .put("type", "audio")
                .put("audio", Base64.getEncoder().encodeToString(mulaw)));
    }

    @Override
    public void sendClear() {
        send(new JSONObject().put("type", "clear_audio"));
    }

    @Override
    public void sendTranscript(String text, boolean isFinal) {
        send(new JSONObject().put("type", "transcript").put("text", text).put("isFinal", isFinal));
    }

    private boolean send(JSONObject message) {
        if (!isOpen()) {
            return false;
        }
        try {
            socket.sendMessage(new TextMessage(message.toString()));
            return true;
        } catch (IOException | IllegalStateException e) {
            LOG.warn("Failed to send {} to browser {}: {}", message.optString("type"), socket.getId(), e.getMessage());
            return false;
        }
    }

    @Override
    public boolean isOpen() {
        return !closed.get() && socket.isOpen();
    }

    @Override
    public void close() {
        if (closed.compareAndSet(false, true) && socket.isOpen()) {
            try {
                socket.close(CloseStatus.NORMAL);
            } catch (IOException e) {
                LOG.debug("Error closing browser socket {}: {}", socket.getId(), e.getMessage());
            }
        }
    }
}
