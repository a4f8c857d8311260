package com.phillippitts.frontdesk.service.tts;

import com.phillippitts.frontdesk.config.properties.ElevenLabsProperties;
import com.phillippitts.frontdesk.config.properties.ReplyProperties;
import com.phillippitts.frontdesk.domain.AudioChunk;
import com.phillippitts.frontdesk.domain.CancellationToken;
import com.phillippitts.frontdesk.domain.SynthesisRequest;
import com.phillippitts.frontdesk.exception.MessageBusException;
import com.phillippitts.frontdesk.exception.ProviderTimeoutException;
import com.phillippitts.frontdesk.service.bus.MessageBus;
import com.phillippitts.frontdesk.service.bus.PipelineQueues;
import com.phillippitts.frontdesk.service.events.ProviderFailureEvent;
import com.phillippitts.frontdesk.service.metrics.PipelineMetrics;
import com.phillippitts.frontdesk.service.session.CallSession;
import com.phillippitts.frontdesk.util.LogSanitizer;
import com.phillippitts.frontdesk.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Turns one sentence into outbound audio chunks.
 *
 * <p>Chunks are published to the outbound-audio queue as the provider streams them, tagged with the
 * request's token; once the token is cancelled nothing more is published and the provider request
 * is aborted. The first failure of a turn marks the token failed and queues the apology, marked as
 * fallback so a failing provider cannot loop; the turn's remaining sentences are skipped.
 */
@Component
public class SynthesisService {

    private static final Logger LOG = LogManager.getLogger(SynthesisService.class);

    private final TextToSpeechProvider provider;
    private final MessageBus bus;
    private final ApplicationEventPublisher events;
    private final PipelineMetrics metrics;
    private final Duration responseTimeout;
    private final String apology;

    public SynthesisService(TextToSpeechProvider provider,
                            MessageBus bus,
                            ApplicationEventPublisher events,
                            PipelineMetrics metrics,
                            ElevenLabsProperties ttsProperties,
                            ReplyProperties replyProperties) {
        this.provider = provider;
        this.bus = bus;
        this.events = events;
        this.metrics = metrics;
        this.responseTimeout = ttsProperties.responseTimeout();
        this.apology = replyProperties.getApology();
    }

    /**
     * Synthesizes one request, blocking until the provider finishes, fails or the turn is cancelled.
     * Always balances the session's {@link CallSession#synthesisQueued()}.
     */
    public void synthesize(CallSession session, SynthesisRequest request) {
        try {
            CancellationToken token = request.token();
            if (token.isCancelled() || session.isClosed()) {
                LOG.debug("Skipping synthesis of cancelled turn {}", token.turnId());
                return;
            }
            if (token.hasFailed() && !request.fallback()) {
                LOG.debug("Skipping synthesis of failed turn {}", token.turnId());
                return;
            }
            long start = System.nanoTime();
            CompletableFuture<Void> done = provider.synthesize(request.text(), audio -> {
                if (!token.isCancelled()) {
                    bus.publish(PipelineQueues.OUTBOUND_AUDIO, new AudioChunk(session.id(), audio, token));
                }
            });
            token.onCancel(() -> done.cancel(false));
            await(session, request, done, start);
        } finally {
            session.synthesisFinished();
        }
    }

    private void await(CallSession session, SynthesisRequest request, CompletableFuture<Void> done, long start) {
        try {
            done.get(responseTimeout.toMillis(), TimeUnit.MILLISECONDS);
            metrics.recordSynthesisLatency(System.nanoTime() - start, true);
            LOG.debug("Synthesized '{}' in {}ms", LogSanitizer.preview(request.text()), TimeUtils.elapsedMillis(start));
        } catch (CancellationException e) {
            LOG.debug("Synthesis cancelled for turn {}", request.token().turnId());
        } catch (TimeoutException e) {
            done.cancel(false);
            fail(session, request, start, "timeout", new ProviderTimeoutException(provider.name(), responseTimeout));
        } catch (ExecutionException e) {
            fail(session, request, start, "error", e.getCause() == null ? e : e.getCause());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            done.cancel(false);
        }
    }

    private void fail(CallSession session, SynthesisRequest request, long start, String reason, Throwable cause) {
        metrics.recordSynthesisLatency(System.nanoTime() - start, false);
        events.publishEvent(ProviderFailureEvent.of(provider.name(), session.id(), reason));
        LOG.warn("Synthesis failed for session {} ({}): {}", session.id(), reason, cause.getMessage());
        if (request.fallback() || request.token().isCancelled() || session.isClosed()) {
            return;
        }
        if (!request.token().markFailed()) {
            return;
        }
        session.synthesisQueued();
        try {
            bus.publish(PipelineQueues.SYNTHESIS_REQUESTS,
                    new SynthesisRequest(session.id(), apology, request.token(), true));
        } catch (MessageBusException e) {
            session.synthesisFinished();
            LOG.warn("Could not queue apology for session {}: {}", session.id(), e.getMessage());
        }
    }
}
