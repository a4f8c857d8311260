package com.phillippitts.frontdesk.service.orchestration;

import com.phillippitts.frontdesk.config.properties.AudioProperties;
import com.phillippitts.frontdesk.config.properties.ReplyProperties;
import com.phillippitts.frontdesk.domain.AudioChunk;
import com.phillippitts.frontdesk.domain.AudioClear;
import com.phillippitts.frontdesk.domain.CancellationToken;
import com.phillippitts.frontdesk.domain.ChatTurn;
import com.phillippitts.frontdesk.domain.ConfidenceTier;
import com.phillippitts.frontdesk.domain.GenerationRequest;
import com.phillippitts.frontdesk.domain.RouteDecision;
import com.phillippitts.frontdesk.domain.SynthesisRequest;
import com.phillippitts.frontdesk.domain.TranscriptEvent;
import com.phillippitts.frontdesk.domain.TurnOutcome;
import com.phillippitts.frontdesk.exception.MessageBusException;
import com.phillippitts.frontdesk.exception.ProviderException;
import com.phillippitts.frontdesk.service.audio.AudioFormat;
import com.phillippitts.frontdesk.service.audio.MulawCodec;
import com.phillippitts.frontdesk.service.bus.MessageBus;
import com.phillippitts.frontdesk.service.bus.PipelineQueues;
import com.phillippitts.frontdesk.service.carrier.CarrierChannel;
import com.phillippitts.frontdesk.service.events.ProviderFailureEvent;
import com.phillippitts.frontdesk.service.events.TurnCompletedEvent;
import com.phillippitts.frontdesk.service.interruption.InterruptionController;
import com.phillippitts.frontdesk.service.playback.PlaybackScheduler;
import com.phillippitts.frontdesk.service.reply.ReplyOutcome;
import com.phillippitts.frontdesk.service.reply.ReplyStreamer;
import com.phillippitts.frontdesk.service.routing.ConfidenceGate;
import com.phillippitts.frontdesk.service.session.CallSession;
import com.phillippitts.frontdesk.service.session.SessionRegistry;
import com.phillippitts.frontdesk.service.stt.SpeechToTextProvider;
import com.phillippitts.frontdesk.service.stt.SttConnection;
import com.phillippitts.frontdesk.service.stt.TranscriptListener;
import com.phillippitts.frontdesk.service.tts.SynthesisService;
import com.phillippitts.frontdesk.util.LogSanitizer;
import com.phillippitts.frontdesk.util.TimeUtils;
import jakarta.annotation.PostConstruct;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.ThreadContext;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Wires one call's pipeline stages together over the {@link MessageBus}.
 *
 * <p>Carrier adapters call in with call start, inbound audio and call end. Everything after the
 * recognizer runs as queue consumers: transcripts feed barge-in detection and, when final, start a
 * new turn; generation requests are routed and answered sentence by sentence; synthesis requests
 * become outbound audio; audio and clear signals go to the playback scheduler.
 *
 * <p>Every finalized query ends in exactly one {@link TurnCompletedEvent}. Provider failures end the
 * turn with a spoken apology and the session continues.
 */
@Component
public class SessionOrchestrator {

    private static final Logger LOG = LogManager.getLogger(SessionOrchestrator.class);

    private final SessionRegistry registry;
    private final MessageBus bus;
    private final SpeechToTextProvider speechToText;
    private final InterruptionController interruption;
    private final ConfidenceGate gate;
    private final ReplyStreamer replyStreamer;
    private final SynthesisService synthesis;
    private final PlaybackScheduler playback;
    private final ApplicationEventPublisher events;
    private final AudioProperties audioProperties;
    private final ReplyProperties replyProperties;

    public SessionOrchestrator(SessionRegistry registry,
                               MessageBus bus,
                               SpeechToTextProvider speechToText,
                               InterruptionController interruption,
                               ConfidenceGate gate,
                               ReplyStreamer replyStreamer,
                               SynthesisService synthesis,
                               PlaybackScheduler playback,
                               ApplicationEventPublisher events,
                               AudioProperties audioProperties,
                               ReplyProperties replyProperties) {
        this.registry = registry;
        this.bus = bus;
        this.speechToText = speechToText;
        this.interruption = interruption;
        this.gate = gate;
        this.replyStreamer = replyStreamer;
        this.synthesis = synthesis;
        this.playback = playback;
        this.events = events;
        this.audioProperties = audioProperties;
        this.replyProperties = replyProperties;
    }

    @PostConstruct
    void subscribe() {
        bus.subscribe(PipelineQueues.TRANSCRIPTS, this::onTranscript);
        bus.subscribe(PipelineQueues.GENERATION_REQUESTS, this::onGenerationRequest);
        bus.subscribe(PipelineQueues.SYNTHESIS_REQUESTS, this::onSynthesisRequest);
        bus.subscribe(PipelineQueues.OUTBOUND_AUDIO, this::onOutboundAudio);
        bus.subscribe(PipelineQueues.AUDIO_CLEAR, this::onAudioClear);
        LOG.info("Pipeline consumers subscribed to {} queues", PipelineQueues.ALL.size());
    }

    /**
     * Handles the carrier's call-start signal: registers the session, opens its recognizer and
     * speaks the greeting.
     */
    public CallSession startSession(String callSid, String streamSid, CarrierChannel channel) {
        CallSession session = registry.create(callSid, streamSid, channel);
        ThreadContext.put("sessionId", session.id());
        try {
            openRecognizer(session);
            CancellationToken token = session.beginTurn();
            String greeting = replyProperties.getGreeting();
            session.history().append(ChatTurn.assistant(greeting));
            speak(session, greeting, token, false);
            return session;
        } finally {
            ThreadContext.remove("sessionId");
        }
    }

    private void openRecognizer(CallSession session) {
        try {
            SttConnection connection = speechToText.open(session.id(), audioProperties.sttSampleRate(),
                    new SessionTranscriptListener(session.id()));
            session.bindRecognizer(connection);
        } catch (ProviderException e) {
            LOG.error("Speech recognition unavailable for session {}: {}", session.id(), e.getMessage());
            events.publishEvent(ProviderFailureEvent.of(speechToText.name(), session.id(), "connect"));
        }
    }

    /**
     * Inbound carrier audio (8 kHz mu-law). Decoded with gain, resampled if the recognizer expects
     * wideband, and streamed to the session's recognizer.
     */
    public void onCarrierAudio(String sessionId, byte[] mulaw) {
        Optional<CallSession> session = registry.find(sessionId);
        if (session.isEmpty()) {
            LOG.warn("Dropping inbound audio for unknown session {}", sessionId);
            return;
        }
        byte[] pcm = MulawCodec.decode(mulaw, audioProperties.inboundGain());
        if (pcm.length == 0) {
            return;
        }
        if (audioProperties.sttSampleRate() == AudioFormat.WIDEBAND_SAMPLE_RATE) {
            pcm = MulawCodec.upsample(pcm);
        }
        forwardToRecognizer(session.get(), pcm);
    }

    /**
     * Inbound PCM16 audio already at the recognizer's sample rate (browser channel).
     */
    public void onPcmAudio(String sessionId, byte[] pcm) {
        Optional<CallSession> session = registry.find(sessionId);
        if (session.isEmpty()) {
            LOG.warn("Dropping inbound audio for unknown session {}", sessionId);
            return;
        }
        if (pcm.length == 0 || pcm.length % AudioFormat.PCM_BYTES_PER_SAMPLE != 0) {
            LOG.warn("Dropping malformed PCM frame of {} bytes for session {}", pcm.length, sessionId);
            return;
        }
        forwardToRecognizer(session.get(), pcm);
    }

    private void forwardToRecognizer(CallSession session, byte[] pcm) {
        session.recognizer().ifPresentOrElse(
                connection -> connection.sendAudio(pcm),
                () -> LOG.debug("No recognizer for session {}; dropping {} bytes", session.id(), pcm.length));
    }

    /**
     * Typed text standing in for a finalized transcript (browser channel).
     */
    public void onTypedQuery(String sessionId, String text) {
        if (text == null || text.isBlank()) {
            return;
        }
        publishTranscript(TranscriptEvent.finalized(sessionId, text.trim()));
    }

    public boolean endSession(String sessionId) {
        return registry.destroy(sessionId);
    }

    public boolean endSessionByCallSid(String callSid) {
        return registry.findByCallSid(callSid).map(session -> registry.destroy(session.id())).orElse(false);
    }

    private void publishTranscript(TranscriptEvent event) {
        try {
            bus.publish(PipelineQueues.TRANSCRIPTS, event);
        } catch (MessageBusException e) {
            LOG.warn("Dropping transcript for session {}: {}", event.sessionId(), e.getMessage());
        }
    }

    void onTranscript(TranscriptEvent event) {
        Optional<CallSession> found = registry.find(event.sessionId());
        if (found.isEmpty()) {
            LOG.warn("Ignoring transcript for unknown or ended session {}", event.sessionId());
            return;
        }
        CallSession session = found.get();
        interruption.onTranscript(session, event);
        session.channel().sendTranscript(event.text(), event.isFinal());
        if (!event.isFinal() || event.text().isBlank()) {
            return;
        }
        LOG.info("Caller said: '{}'", LogSanitizer.preview(event.text()));
        boolean outputActive = session.hasActiveOutput();
        CancellationToken token = session.beginTurn();
        if (outputActive) {
            playback.clear(session, "new-turn");
        }
        bus.publish(PipelineQueues.GENERATION_REQUESTS, new GenerationRequest(session.id(), event.text(), token));
    }

    void onGenerationRequest(GenerationRequest request) {
        Optional<CallSession> found = registry.find(request.sessionId());
        if (found.isEmpty()) {
            LOG.warn("Ignoring generation request for unknown or ended session {}", request.sessionId());
            return;
        }
        CallSession session = found.get();
        CancellationToken token = request.token();
        long start = System.nanoTime();
        if (token.isCancelled()) {
            completeTurn(session, token, TurnOutcome.CANCELLED, ConfidenceTier.NONE, start);
            return;
        }
        if (!session.tryStartGeneration()) {
            LOG.warn("Generation already active for session {}; dropping turn {}", session.id(), token.turnId());
            completeTurn(session, token, TurnOutcome.CANCELLED, ConfidenceTier.NONE, start);
            return;
        }
        RouteDecision decision = null;
        TurnOutcome outcome = TurnOutcome.CANCELLED;
        try {
            decision = gate.route(request.query());
            outcome = answer(session, request, decision);
        } finally {
            session.endGeneration();
            ConfidenceTier tier = decision == null ? ConfidenceTier.NONE : decision.tier();
            TurnOutcome generated = outcome;
            // synthesis of the last sentences may still fail the turn
            session.whenSynthesisDrained(() -> completeTurn(session, token, settle(generated, token), tier, start));
        }
    }

    private static TurnOutcome settle(TurnOutcome generated, CancellationToken token) {
        if (generated == TurnOutcome.CANCELLED || generated == TurnOutcome.FALLBACK) {
            return generated;
        }
        return token.hasFailed() ? TurnOutcome.FALLBACK : generated;
    }

    private TurnOutcome answer(CallSession session, GenerationRequest request, RouteDecision decision) {
        CancellationToken token = request.token();
        if (token.isCancelled()) {
            return TurnOutcome.CANCELLED;
        }
        if (!decision.requiresGeneration()) {
            session.history().recordExchange(request.query(), decision.directAnswer());
            speak(session, decision.directAnswer(), token, false);
            return TurnOutcome.DIRECT_ANSWER;
        }
        ReplyOutcome reply = replyStreamer.stream(session.history(), request.query(), decision, token,
                sentence -> speak(session, sentence, token, false));
        switch (reply.status()) {
            case COMPLETED:
                return decision.isGrounded() ? TurnOutcome.GROUNDED_REPLY : TurnOutcome.OPEN_REPLY;
            case CANCELLED:
                return TurnOutcome.CANCELLED;
            default:
                events.publishEvent(ProviderFailureEvent.of("reply-generator", session.id(),
                        reply.error() == null ? "unknown" : reply.error().getClass().getSimpleName()));
                if (token.isCancelled()) {
                    return TurnOutcome.CANCELLED;
                }
                if (token.markFailed()) {
                    speak(session, replyProperties.getApology(), token, true);
                }
                return TurnOutcome.FALLBACK;
        }
    }

    private void completeTurn(CallSession session, CancellationToken token, TurnOutcome outcome,
                              ConfidenceTier tier, long start) {
        long elapsed = TimeUtils.elapsedMillis(start);
        LOG.info("Turn {} finished: outcome={}, tier={}, {}ms", token.turnId(), outcome, tier, elapsed);
        events.publishEvent(TurnCompletedEvent.of(session.id(), token.turnId(), outcome, tier, elapsed));
    }

    private void speak(CallSession session, String text, CancellationToken token, boolean fallback) {
        if (text == null || text.isBlank() || token.isCancelled() || (token.hasFailed() && !fallback)) {
            return;
        }
        session.synthesisQueued();
        try {
            bus.publish(PipelineQueues.SYNTHESIS_REQUESTS, new SynthesisRequest(session.id(), text, token, fallback));
        } catch (MessageBusException e) {
            session.synthesisFinished();
            throw e;
        }
    }

    void onSynthesisRequest(SynthesisRequest request) {
        Optional<CallSession> session = registry.find(request.sessionId());
        if (session.isEmpty()) {
            LOG.warn("Ignoring synthesis request for unknown or ended session {}", request.sessionId());
            return;
        }
        synthesis.synthesize(session.get(), request);
    }

    void onOutboundAudio(AudioChunk chunk) {
        Optional<CallSession> session = registry.find(chunk.sessionId());
        if (session.isEmpty()) {
            LOG.debug("Dropping outbound audio for ended session {}", chunk.sessionId());
            return;
        }
        playback.enqueue(session.get(), chunk);
    }

    void onAudioClear(AudioClear clear) {
        Optional<CallSession> session = registry.find(clear.sessionId());
        if (session.isEmpty()) {
            LOG.debug("Ignoring clear for ended session {}", clear.sessionId());
            return;
        }
        playback.clear(session.get(), clear.reason());
    }

    private final class SessionTranscriptListener implements TranscriptListener {

        private final String sessionId;

        SessionTranscriptListener(String sessionId) {
            this.sessionId = sessionId;
        }

        @Override
        public void onTranscript(String text, boolean isFinal) {
            publishTranscript(isFinal
                    ? TranscriptEvent.finalized(sessionId, text)
                    : TranscriptEvent.interim(sessionId, text));
        }

        @Override
        public void onError(Throwable error) {
            LOG.error("Speech recognition failed for session {}: {}", sessionId, error.getMessage());
            events.publishEvent(ProviderFailureEvent.of(speechToText.name(), sessionId, "transport"));
        }
    }
}
