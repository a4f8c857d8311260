package com.phillippitts.frontdesk.presentation.controller;

import com.phillippitts.frontdesk.config.properties.CarrierProperties;
import com.phillippitts.frontdesk.service.orchestration.SessionOrchestrator;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.util.HtmlUtils;

import java.util.Set;

/**
 * Carrier voice webhooks.
 *
 * <p>{@code POST /voice} answers an incoming call with TwiML that connects a bidirectional media
 * stream to this service and pauses to keep the call up. {@code POST /twilio/status} tears the
 * session down when the carrier reports the call finished.
 */
@RestController
class VoiceWebhookController {

    private static final Logger LOG = LogManager.getLogger(VoiceWebhookController.class);

    private static final Set<String> TERMINAL_STATUSES =
            Set.of("completed", "failed", "busy", "no-answer", "canceled");

    private final CarrierProperties carrierProperties;
    private final SessionOrchestrator orchestrator;

    VoiceWebhookController(CarrierProperties carrierProperties, SessionOrchestrator orchestrator) {
        this.carrierProperties = carrierProperties;
        this.orchestrator = orchestrator;
    }

    @PostMapping(value = "/voice", produces = MediaType.APPLICATION_XML_VALUE)
    ResponseEntity<String> incomingCall(@RequestParam(name = "CallSid", required = false) String callSid,
                                        @RequestHeader(name = "Host", required = false) String hostHeader) {
        String streamUrl = streamUrl(hostHeader);
        LOG.info("Incoming call {}; media stream at {}", callSid, streamUrl);
        String twiml = "<?xml version=\"1.0\" encoding=\"UTF-8\"?>"
                + "<Response>"
                + "<Connect><Stream url=\"" + HtmlUtils.htmlEscape(streamUrl) + "\"/></Connect>"
                + "<Pause length=\"" + carrierProperties.pauseSeconds() + "\"/>"
                + "</Response>";
        return ResponseEntity.ok().contentType(MediaType.APPLICATION_XML).body(twiml);
    }

    @PostMapping("/twilio/status")
    ResponseEntity<String> callStatus(@RequestParam(name = "CallSid", required = false) String callSid,
                                      @RequestParam(name = "CallStatus", required = false) String callStatus) {
        LOG.info("Call status: callSid={}, status={}", callSid, callStatus);
        if (callSid != null && callStatus != null && TERMINAL_STATUSES.contains(callStatus)) {
            boolean ended = orchestrator.endSessionByCallSid(callSid);
            LOG.debug("Status teardown for {}: ended={}", callSid, ended);
        }
        return ResponseEntity.ok("OK");
    }

    String streamUrl(String hostHeader) {
        String configured = carrierProperties.publicHost();
        String host = configured != null && !configured.isBlank() ? configured : hostHeader;
        if (host == null || host.isBlank()) {
            host = "localhost:8080";
        }
        String scheme = host.startsWith("localhost") || host.startsWith("127.0.0.1") ? "ws" : "wss";
        return scheme + "://" + host + carrierProperties.mediaStreamPath();
    }
}
