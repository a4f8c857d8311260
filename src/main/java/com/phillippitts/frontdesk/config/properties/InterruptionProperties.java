package com.phillippitts.frontdesk.config.properties;

import jakarta.validation.constraints.Min;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

/**
 * Barge-in detection thresholds. Any one of the three speech conditions triggers,
 * subject to the cooldown between triggers.
 *
 * @param enabled     turn barge-in detection on or off
 * @param minWords    words in the interim transcript
 * @param minSpeechMs continuous interim speech, strictly longer than this
 * @param minChars    characters in the trimmed interim transcript
 * @param cooldownMs  minimum time between two triggers
 * @param maxGapMs    longest pause between interims that still counts as continuous speech
 */
@ConfigurationProperties(prefix = "interruption")
@Validated
public record InterruptionProperties(
        @DefaultValue("true") boolean enabled,
        @Min(1) @DefaultValue("2") int minWords,
        @Min(0) @DefaultValue("150") long minSpeechMs,
        @Min(1) @DefaultValue("5") int minChars,
        @Min(0) @DefaultValue("500") long cooldownMs,
        @Min(1) @DefaultValue("300") long maxGapMs
) {
    public static InterruptionProperties defaults() {
        return new InterruptionProperties(true, 2, 150, 5, 500, 300);
    }
}
