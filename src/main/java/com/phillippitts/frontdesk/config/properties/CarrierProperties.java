package com.phillippitts.frontdesk.config.properties;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

import java.util.List;

/**
 * Telephony carrier and browser channel settings. Binds to "carrier".
 *
 * @param publicHost            host name the carrier reaches us on; falls back to the webhook's Host header
 * @param mediaStreamPath       WebSocket path of the carrier media stream
 * @param pauseSeconds          TwiML pause keeping the call open while the stream runs
 * @param browserChannelEnabled expose the browser test channel
 * @param browserChannelPath    WebSocket path of the browser test channel
 * @param allowedOrigins        origins accepted on the browser channel
 */
@ConfigurationProperties(prefix = "carrier")
@Validated
public record CarrierProperties(
        String publicHost,
        @NotBlank @DefaultValue("/media-stream") String mediaStreamPath,
        @Min(1) @DefaultValue("600") int pauseSeconds,
        @DefaultValue("false") boolean browserChannelEnabled,
        @NotBlank @DefaultValue("/browser-stream") String browserChannelPath,
        @DefaultValue("*") List<String> allowedOrigins
) {
}
