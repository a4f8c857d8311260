package com.phillippitts.frontdesk.service.interruption;

import com.phillippitts.frontdesk.config.properties.InterruptionProperties;
import com.phillippitts.frontdesk.domain.AudioClear;
import com.phillippitts.frontdesk.domain.CancellationToken;
import com.phillippitts.frontdesk.domain.TranscriptEvent;
import com.phillippitts.frontdesk.service.bus.MessageBus;
import com.phillippitts.frontdesk.service.bus.PipelineQueues;
import com.phillippitts.frontdesk.service.metrics.PipelineMetrics;
import com.phillippitts.frontdesk.service.session.CallSession;
import com.phillippitts.frontdesk.util.LogSanitizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.function.LongSupplier;

/**
 * Detects the caller talking over system playback and stops it.
 *
 * <p>Every transcript of a session passes through here. Interim transcripts drive the session's
 * {@link BargeInStateMachine}; on a trigger the current turn's token is cancelled on the calling
 * thread (stopping generation, synthesis and queued playback at their next check) and an
 * {@link AudioClear} is published so the carrier flushes what it has buffered.
 */
@Component
public class InterruptionController {

    private static final Logger LOG = LogManager.getLogger(InterruptionController.class);

    private final MessageBus bus;
    private final InterruptionProperties properties;
    private final PipelineMetrics metrics;
    private final LongSupplier nanoClock;

    @Autowired
    public InterruptionController(MessageBus bus, InterruptionProperties properties, PipelineMetrics metrics) {
        this(bus, properties, metrics, System::nanoTime);
    }

    InterruptionController(MessageBus bus, InterruptionProperties properties, PipelineMetrics metrics,
                           LongSupplier nanoClock) {
        this.bus = bus;
        this.properties = properties;
        this.metrics = metrics;
        this.nanoClock = nanoClock;
    }

    /**
     * Feeds one transcript event.
     *
     * @return true if the event triggered a barge-in
     */
    public boolean onTranscript(CallSession session, TranscriptEvent event) {
        BargeInStateMachine machine = session.bargeIn();
        if (event.isFinal()) {
            machine.onFinal();
            return false;
        }
        if (!properties.enabled()) {
            return false;
        }
        boolean triggered = machine.onInterim(event.text(), nanoClock.getAsLong(),
                session.hasActiveOutput(), properties);
        if (triggered) {
            LOG.info("Barge-in detected: sessionId={}, interim='{}'",
                    session.id(), LogSanitizer.preview(event.text()));
            interrupt(session, "barge-in");
        }
        return triggered;
    }

    /**
     * Cancels the session's current turn and requests a playback clear.
     */
    public void interrupt(CallSession session, String reason) {
        CancellationToken turn = session.currentTurn();
        boolean cancelled = turn.cancel();
        metrics.incrementBargeIn();
        LOG.debug("Turn {} cancelled={} for session {}", turn.turnId(), cancelled, session.id());
        bus.publish(PipelineQueues.AUDIO_CLEAR, new AudioClear(session.id(), reason));
    }
}
