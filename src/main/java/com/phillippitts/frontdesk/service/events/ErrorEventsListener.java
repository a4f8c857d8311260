package com.phillippitts.frontdesk.service.events;

import com.phillippitts.frontdesk.service.metrics.PipelineMetrics;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Centralized handler for provider failure events. Counts every failure, but logs each
 * provider/reason pair at most once a minute so an outage does not flood the log.
 */
@Component
class ErrorEventsListener {
    private static final Logger LOG = LogManager.getLogger(ErrorEventsListener.class);

    private final Map<String, Instant> lastLog = new ConcurrentHashMap<>();
    private static final Duration THROTTLE = Duration.ofMinutes(1);

    private final PipelineMetrics metrics;

    ErrorEventsListener(PipelineMetrics metrics) {
        this.metrics = metrics;
    }

    @EventListener
    void onProviderFailure(ProviderFailureEvent e) {
        metrics.incrementProviderFailure(e.provider(), e.reason());
        String key = e.provider() + '-' + e.reason();
        if (shouldLog(key)) {
            LOG.warn("Provider failure: provider={}, reason={}, sessionId={}. "
                    + "Check API key, network and provider status.", e.provider(), e.reason(), e.sessionId());
        }
    }

    // Package-private for tests
    boolean shouldLog(String key) {
        Instant now = Instant.now();
        Instant prev = lastLog.get(key);
        if (prev == null || Duration.between(prev, now).compareTo(THROTTLE) > 0) {
            lastLog.put(key, now);
            return true;
        }
        return false;
    }
}
