package com.phillippitts.frontdesk.config.properties;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Streaming speech-to-text provider settings. Binds to "stt.deepgram".
 *
 * @param url            listen endpoint
 * @param apiKey         provider key, sent as a token header
 * @param model          recognition model
 * @param language       recognition language
 * @param connectTimeout bounded wait for the WebSocket handshake
 */
@ConfigurationProperties(prefix = "stt.deepgram")
@Validated
public record DeepgramProperties(
        @NotBlank @DefaultValue("wss://api.deepgram.com/v1/listen") String url,
        @DefaultValue("") String apiKey,
        @NotBlank @DefaultValue("nova-2") String model,
        @NotBlank @DefaultValue("en-US") String language,
        @NotNull @DefaultValue("10s") Duration connectTimeout
) {
}
