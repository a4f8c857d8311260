package com.phillippitts.frontdesk.config.properties;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Streaming text-to-speech provider settings. Binds to "tts.elevenlabs".
 *
 * <p>Output format must stay {@code ulaw_8000}: synthesized audio goes to the carrier untouched.
 */
@ConfigurationProperties(prefix = "tts.elevenlabs")
@Validated
public record ElevenLabsProperties(
        @NotBlank @DefaultValue("wss://api.elevenlabs.io/v1/text-to-speech") String baseUrl,
        @DefaultValue("") String apiKey,
        @NotBlank @DefaultValue("21m00Tcm4TlvDq8ikWAM") String voiceId,
        @NotBlank @DefaultValue("eleven_turbo_v2_5") String modelId,
        @NotBlank @DefaultValue("ulaw_8000") String outputFormat,
        @DecimalMin("0.0") @DecimalMax("1.0") @DefaultValue("0.5") double stability,
        @DecimalMin("0.0") @DecimalMax("1.0") @DefaultValue("0.75") double similarityBoost,
        @NotNull @DefaultValue("30s") Duration responseTimeout
) {
}
