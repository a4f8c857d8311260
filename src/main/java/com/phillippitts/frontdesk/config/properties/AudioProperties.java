package com.phillippitts.frontdesk.config.properties;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

/**
 * Inbound audio handling between the carrier and the speech-to-text provider.
 *
 * <p>Example application.properties:
 * <pre>
 * audio.inbound-gain=4.0
 * audio.stt-sample-rate=8000
 * </pre>
 *
 * @param inboundGain   linear gain applied while expanding caller audio, clamped to 16-bit range
 * @param sttSampleRate sample rate sent to speech-to-text; 16000 upsamples the 8kHz carrier audio
 */
@ConfigurationProperties(prefix = "audio")
@Validated
public record AudioProperties(
        @DecimalMin("0.1") @DecimalMax("16.0")
        @DefaultValue("4.0")
        double inboundGain,

        @DefaultValue("8000")
        int sttSampleRate
) {
    public AudioProperties {
        if (sttSampleRate != 8000 && sttSampleRate != 16000) {
            throw new IllegalArgumentException("audio.stt-sample-rate must be 8000 or 16000, got: " + sttSampleRate);
        }
    }
}
