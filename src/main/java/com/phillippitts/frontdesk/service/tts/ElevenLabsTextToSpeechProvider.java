package com.phillippitts.frontdesk.service.tts;

import com.phillippitts.frontdesk.config.properties.ElevenLabsProperties;
import com.phillippitts.frontdesk.exception.ProviderException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONException;
import org.json.JSONObject;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketHttpHeaders;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.client.WebSocketClient;
import org.springframework.web.socket.handler.TextWebSocketHandler;
import org.springframework.web.util.UriComponentsBuilder;

import java.io.IOException;
import java.net.URI;
import java.util.Base64;
import java.util.concurrent.CompletableFuture;
import java.util.function.Consumer;

/**
 * ElevenLabs-compatible {@code stream-input} synthesizer, one WebSocket per utterance.
 *
 * <p>Protocol: an initial message with voice settings and the key, the text with {@code flush},
 * then an empty text as end of input. Replies carry base64 {@code audio} and finally
 * {@code isFinal: true}.
 */
@Component
public class ElevenLabsTextToSpeechProvider implements TextToSpeechProvider {

    private static final Logger LOG = LogManager.getLogger(ElevenLabsTextToSpeechProvider.class);
    static final String PROVIDER = "elevenlabs";

    private final ElevenLabsProperties properties;
    private final WebSocketClient client;

    public ElevenLabsTextToSpeechProvider(ElevenLabsProperties properties,
                                          @Qualifier("providerWebSocketClient") WebSocketClient client) {
        this.properties = properties;
        this.client = client;
    }

    @Override
    public String name() {
        return PROVIDER;
    }

    @Override
    public CompletableFuture<Void> synthesize(String text, Consumer<byte[]> audioSink) {
        CompletableFuture<Void> done = new CompletableFuture<>();
        UtteranceHandler handler = new UtteranceHandler(text, audioSink, done);
        client.execute(handler, new WebSocketHttpHeaders(), streamUri())
                .whenComplete((socket, error) -> {
                    if (error != null) {
                        done.completeExceptionally(new ProviderException("Failed to open synthesis stream", PROVIDER, error));
                    }
                });
        done.whenComplete((r, e) -> handler.closeSocket());
        return done;
    }

    URI streamUri() {
        return UriComponentsBuilder.fromUriString(properties.baseUrl())
                .pathSegment(properties.voiceId(), "stream-input")
                .queryParam("model_id", properties.modelId())
                .queryParam("output_format", properties.outputFormat())
                .build()
                .toUri();
    }

    String initMessage() {
        JSONObject voiceSettings = new JSONObject()
                .put("stability", properties.stability())
                .put("similarity_boost", properties.similarityBoost())
                .put("style", 0)
                .put("use_speaker_boost", true);
        return new JSONObject()
                .put("text", " ")
                .put("voice_settings", voiceSettings)
                .put("xi_api_key", properties.apiKey())
                .toString();
    }

    final class UtteranceHandler extends TextWebSocketHandler {

        private final String text;
        private final Consumer<byte[]> audioSink;
        private final CompletableFuture<Void> done;
        private volatile WebSocketSession socket;

        UtteranceHandler(String text, Consumer<byte[]> audioSink, CompletableFuture<Void> done) {
            this.text = text;
            this.audioSink = audioSink;
            this.done = done;
        }

        @Override
        public void afterConnectionEstablished(WebSocketSession session) throws IOException {
            this.socket = session;
            if (done.isDone()) {
                closeSocket();
                return;
            }
            session.sendMessage(new TextMessage(initMessage()));
            session.sendMessage(new TextMessage(new JSONObject().put("text", text).put("flush", true).toString()));
            session.sendMessage(new TextMessage(new JSONObject().put("text", "").toString()));
        }

        @Override
        protected void handleTextMessage(WebSocketSession session, TextMessage message) {
            if (done.isDone()) {
                return;
            }
            try {
                JSONObject json = new JSONObject(message.getPayload());
                String audio = json.optString("audio", "");
                if (!audio.isEmpty() && !"null".equals(audio)) {
                    audioSink.accept(Base64.getDecoder().decode(audio));
                }
                if (json.optBoolean("isFinal", false)) {
                    done.complete(null);
                }
            } catch (JSONException | IllegalArgumentException e) {
                LOG.warn("Ignoring malformed synthesis message: {}", e.getMessage());
            }
        }

        @Override
        public void handleTransportError(WebSocketSession session, Throwable exception) {
            done.completeExceptionally(new ProviderException("Synthesis stream transport error", PROVIDER, exception));
        }

        @Override
        public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
            if (CloseStatus.NORMAL.equalsCode(status)) {
                done.complete(null);
            } else {
                done.completeExceptionally(new ProviderException("Synthesis stream closed: " + status, PROVIDER));
            }
        }

        void closeSocket() {
            WebSocketSession current = socket;
            if (current != null && current.isOpen()) {
                try {
                    current.close(CloseStatus.NORMAL);
                } catch (IOException e) {
                    LOG.debug("Error closing synthesis stream: {}", e.getMessage());
                }
            }
        }
    }
}
