package com.phillippitts.frontdesk.service.events;

import com.phillippitts.frontdesk.service.metrics.PipelineMetrics;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class ErrorEventsListenerTest {

    private final SimpleMeterRegistry registry = new SimpleMeterRegistry();

    @Test
    void throttlesRepeatLogs() {
        ErrorEventsListener l = new ErrorEventsListener(new PipelineMetrics(registry));
        assertThat(l.shouldLog("deepgram-connect")).isTrue();
        assertThat(l.shouldLog("deepgram-connect")).isFalse();
        // different key is independent
        assertThat(l.shouldLog("elevenlabs-timeout")).isTrue();
    }

    @Test
    void countsEveryFailureEvenWhenLogIsThrottled() {
        ErrorEventsListener l = new ErrorEventsListener(new PipelineMetrics(registry));

        l.onProviderFailure(ProviderFailureEvent.of("elevenlabs", "s-1", "timeout"));
        l.onProviderFailure(ProviderFailureEvent.of("elevenlabs", "s-2", "timeout"));
        l.onProviderFailure(ProviderFailureEvent.of("deepgram", null, "connect"));

        assertThat(registry.find("frontdesk.provider.failures")
                .tag("provider", "elevenlabs").tag("reason", "timeout").counter().count()).isEqualTo(2.0);
        assertThat(registry.find("frontdesk.provider.failures")
                .tag("provider", "deepgram").counter().count()).isEqualTo(1.0);
    }
}
