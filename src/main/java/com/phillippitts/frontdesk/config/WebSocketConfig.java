package com.phillippitts.frontdesk.config;

import com.phillippitts.frontdesk.config.properties.CarrierProperties;
import com.phillippitts.frontdesk.service.carrier.BrowserVoiceHandler;
import com.phillippitts.frontdesk.service.carrier.TwilioMediaStreamHandler;
import com.phillippitts.frontdesk.service.orchestration.SessionOrchestrator;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.socket.config.annotation.EnableWebSocket;
import org.springframework.web.socket.config.annotation.WebSocketConfigurer;
import org.springframework.web.socket.config.annotation.WebSocketHandlerRegistry;

/**
 * Registers the carrier media-stream endpoint and, when enabled, the browser test channel.
 */
@Configuration
@EnableWebSocket
public class WebSocketConfig implements WebSocketConfigurer {

    private static final Logger LOG = LogManager.getLogger(WebSocketConfig.class);

    private final CarrierProperties carrierProperties;
    private final TwilioMediaStreamHandler mediaStreamHandler;
    private final SessionOrchestrator orchestrator;

    public WebSocketConfig(CarrierProperties carrierProperties,
                           TwilioMediaStreamHandler mediaStreamHandler,
                           SessionOrchestrator orchestrator) {
        this.carrierProperties = carrierProperties;
        this.mediaStreamHandler = mediaStreamHandler;
        this.orchestrator = orchestrator;
    }

    @Override
    public void registerWebSocketHandlers(WebSocketHandlerRegistry registry) {
        String[] origins = carrierProperties.allowedOrigins().toArray(String[]::new);
        registry.addHandler(mediaStreamHandler, carrierProperties.mediaStreamPath())
                .setAllowedOriginPatterns(origins);
        LOG.info("Media stream endpoint registered at {}", carrierProperties.mediaStreamPath());

        if (carrierProperties.browserChannelEnabled()) {
            registry.addHandler(new BrowserVoiceHandler(orchestrator), carrierProperties.browserChannelPath())
                    .setAllowedOriginPatterns(origins);
            LOG.info("Browser channel registered at {}", carrierProperties.browserChannelPath());
        }
    }
}
