package com.phillippitts.frontdesk.service.stt;

import com.phillippitts.frontdesk.config.properties.DeepgramProperties;
import com.phillippitts.frontdesk.exception.ProviderException;
import com.phillippitts.frontdesk.exception.ProviderTimeoutException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONException;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.BinaryMessage;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketHttpHeaders;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.client.WebSocketClient;
import org.springframework.web.socket.handler.ConcurrentWebSocketSessionDecorator;
import org.springframework.web.socket.handler.TextWebSocketHandler;
import org.springframework.web.util.UriComponentsBuilder;

import java.io.IOException;
import java.net.URI;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Deepgram-compatible streaming recognizer over a WebSocket.
 *
 * <p>Requests {@code linear16} mono audio with interim results, smart formatting and punctuation.
 * The handshake is bounded by {@code stt.deepgram.connect-timeout}. Closing sends
 * {@code CloseStream} so the provider flushes its last result before the socket closes.
 */
@Component
public class DeepgramSpeechToTextProvider implements SpeechToTextProvider {

    private static final Logger LOG = LogManager.getLogger(DeepgramSpeechToTextProvider.class);
    static final String PROVIDER = "deepgram";

    private static final int SEND_TIME_LIMIT_MS = 5_000;
    private static final int SEND_BUFFER_LIMIT = 512 * 1024;

    private final DeepgramProperties properties;
    private final WebSocketClient client;

    public DeepgramSpeechToTextProvider(DeepgramProperties properties,
                                        @Qualifier("providerWebSocketClient") WebSocketClient client) {
        this.properties = properties;
        this.client = client;
    }

    @Override
    public String name() {
        return PROVIDER;
    }

    @Override
    public SttConnection open(String sessionId, int sampleRate, TranscriptListener listener) {
        WebSocketHttpHeaders headers = new WebSocketHttpHeaders();
        headers.add("Authorization", "Token " + properties.apiKey());
        URI uri = listenUri(sampleRate);
        try {
            WebSocketSession session = client.execute(new StreamHandler(sessionId, listener), headers, uri)
                    .get(properties.connectTimeout().toMillis(), TimeUnit.MILLISECONDS);
            LOG.info("Speech-to-text stream open: sessionId={}, model={}, sampleRate={}",
                    sessionId, properties.model(), sampleRate);
            return new Connection(sessionId,
                    new ConcurrentWebSocketSessionDecorator(session, SEND_TIME_LIMIT_MS, SEND_BUFFER_LIMIT));
        } catch (TimeoutException e) {
            throw new ProviderTimeoutException(PROVIDER, properties.connectTimeout());
        } catch (ExecutionException e) {
            throw new ProviderException("Failed to open recognition stream", PROVIDER, e.getCause());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ProviderException("Interrupted while opening recognition stream", PROVIDER, e);
        }
    }

    URI listenUri(int sampleRate) {
        return UriComponentsBuilder.fromUriString(properties.url())
                .queryParam("model", properties.model())
                .queryParam("language", properties.language())
                .queryParam("encoding", "linear16")
                .queryParam("sample_rate", sampleRate)
                .queryParam("channels", 1)
                .queryParam("interim_results", true)
                .queryParam("smart_format", true)
                .queryParam("punctuate", true)
                .build()
                .toUri();
    }

    static final class StreamHandler extends TextWebSocketHandler {

        private final String sessionId;
        private final TranscriptListener listener;

        StreamHandler(String sessionId, TranscriptListener listener) {
            this.sessionId = sessionId;
            this.listener = listener;
        }

        @Override
        protected void handleTextMessage(WebSocketSession session, TextMessage message) {
            try {
                DeepgramResults.parse(message.getPayload())
                        .ifPresent(result -> listener.onTranscript(result.text(), result.isFinal()));
            } catch (JSONException e) {
                LOG.warn("Ignoring malformed recognition message for session {}: {}", sessionId, e.getMessage());
            }
        }

        @Override
        public void handleTransportError(WebSocketSession session, Throwable exception) {
            listener.onError(new ProviderException("Recognition stream transport error", PROVIDER, exception));
        }

        @Override
        public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
            LOG.info("Speech-to-text stream closed: sessionId={}, status={}", sessionId, status);
        }
    }

    static final class Connection implements SttConnection {

        private final String sessionId;
        private final WebSocketSession socket;
        private final AtomicBoolean closed = new AtomicBoolean();

        Connection(String sessionId, WebSocketSession socket) {
            this.sessionId = sessionId;
            this.socket = socket;
        }

        @Override
        public void sendAudio(byte[] pcm) {
            if (!isOpen()) {
                LOG.debug("Dropping audio for closed recognition stream of session {}", sessionId);
                return;
            }
            try {
                socket.sendMessage(new BinaryMessage(pcm));
            } catch (IOException | IllegalStateException e) {
                LOG.warn("Failed to send audio to recognizer for session {}: {}", sessionId, e.getMessage());
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
            try {
                if (socket.isOpen()) {
                    socket.sendMessage(new TextMessage("{\"type\":\"CloseStream\"}"));
                    socket.close(CloseStatus.NORMAL);
                }
            } catch (IOException | IllegalStateException e) {
                LOG.warn("Error closing recognition stream for session {}: {}", sessionId, e.getMessage());
            }
        }

        @Override
        public String toString() {
            return "DeepgramConnection[" + sessionId + ']';
        }
    }
}
