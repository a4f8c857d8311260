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
 * Outbound half of a Twilio-style media stream: {@code media} and {@code clear} events tagged with
 * the stream id.
 */
public class TwilioMediaChannel implements CarrierChannel {

    private static final Logger LOG = LogManager.getLogger(TwilioMediaChannel.class);

    private final WebSocketSession socket;
    private final String streamSid;
    private final AtomicBoolean closed = new AtomicBoolean();

    /**
     * @param socket    a session safe for concurrent sends
     * @param streamSid carrier stream id echoed on every outbound event
     */
    public TwilioMediaChannel(WebSocketSession socket, String streamSid) {
        this.socket = socket;
        this.streamSid = streamSid;
    }

    @Override
    public boolean sendAudio(byte[] mulaw) {
        JSONObject media = new JSONObject().put("payload", Base64.getEncoder().encodeToString(mulaw));
        return send(new JSONObject()
                .put("event", "media")
                .put("streamSid", streamSid)
                .put("media", media));
    }

    @Override
    public void sendClear() {
        send(new JSONObject().put("event", "clear").put("streamSid", streamSid));
    }

    private boolean send(JSONObject event) {
        if (!isOpen()) {
            return false;
        }
        try {
            socket.sendMessage(new TextMessage(event.toString()));
            return true;
        } catch (IOException | IllegalStateException e) {
            LOG.warn("Failed to send {} event on stream {}: {}", event.optString("event"), streamSid, e.getMessage());
            return false;
        }
    }

    @Override
    public boolean isOpen() {
        return !closed.get() && socket.isOpen();
    }

    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        if (socket.isOpen()) {
            try {
                socket.close(CloseStatus.NORMAL);
            } catch (IOException e) {
                LOG.debug("Error closing media stream {}: {}", streamSid, e.getMessage());
            }
        }
    }
}
