package com.phillippitts.frontdesk.service.tts;

import com.phillippitts.frontdesk.config.properties.ElevenLabsProperties;
import com.phillippitts.frontdesk.config.properties.ReplyProperties;
import com.phillippitts.frontdesk.domain.AudioChunk;
import com.phillippitts.frontdesk.domain.CancellationToken;
import com.phillippitts.frontdesk.domain.SynthesisRequest;
import com.phillippitts.frontdesk.service.bus.InProcessMessageBus;
import com.phillippitts.frontdesk.service.bus.PipelineQueues;
import com.phillippitts.frontdesk.service.events.ProviderFailureEvent;
import com.phillippitts.frontdesk.service.metrics.PipelineMetrics;
import com.phillippitts.frontdesk.service.session.CallSession;
import com.phillippitts.frontdesk.service.session.SessionRegistry;
import com.phillippitts.frontdesk.testutil.EventCapturingPublisher;
import com.phillippitts.frontdesk.testutil.FakeTextToSpeechProvider;
import com.phillippitts.frontdesk.testutil.RecordingCarrierChannel;
import com.phillippitts.frontdesk.testutil.SyncExecutor;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;

class SynthesisServiceTest {

    private static final String APOLOGY = "I'm sorry, I encountered an error processing your request.";

    private final SimpleMeterRegistry meterRegistry = new SimpleMeterRegistry();
    private final PipelineMetrics metrics = new PipelineMetrics(meterRegistry);
    private final EventCapturingPublisher events = new EventCapturingPublisher();
    private final List<AudioChunk> outbound = new CopyOnWriteArrayList<>();
    private InProcessMessageBus bus;
    private SessionRegistry registry;
    private CallSession session;

    @BeforeEach
    void setUp() {
        bus = new InProcessMessageBus(new SyncExecutor(), metrics);
        bus.subscribe(PipelineQueues.OUTBOUND_AUDIO, outbound::add);
        registry = new SessionRegistry(new ReplyProperties());
        session = registry.create("CA100", "MZ100", new RecordingCarrierChannel());
    }

    private SynthesisService service(FakeTextToSpeechProvider tts, Duration responseTimeout) {
        SynthesisService service = new SynthesisService(tts, bus, events, metrics,
                new ElevenLabsProperties("wss://api.elevenlabs.io/v1/text-to-speech", "key", "voice1",
                        "eleven_turbo_v2_5", "ulaw_8000", 0.5, 0.75, responseTimeout),
                new ReplyProperties());
        bus.subscribe(PipelineQueues.SYNTHESIS_REQUESTS, request -> service.synthesize(session, request));
        return service;
    }

    private SynthesisRequest queued(String text, CancellationToken token, boolean fallback) {
        session.synthesisQueued();
        return new SynthesisRequest(session.id(), text, token, fallback);
    }

    @Test
    void publishesAudioTaggedWithTheTurnToken() {
        SynthesisService service = service(new FakeTextToSpeechProvider(320), Duration.ofSeconds(5));
        CancellationToken token = session.beginTurn();

        service.synthesize(session, queued("We open at eight.", token, false));

        assertThat(outbound).singleElement().satisfies(chunk -> {
            assertThat(chunk.sessionId()).isEqualTo(session.id());
            assertThat(chunk.size()).isEqualTo(320);
            assertThat(chunk.token()).isSameAs(token);
        });
        assertThat(session.pendingSynthesis()).isZero();
        assertThat(meterRegistry.find("frontdesk.synthesis.latency").tag("success", "true").timer().count())
                .isEqualTo(1);
    }

    @Test
    void failureQueuesTheApologyOnce() {
        FakeTextToSpeechProvider tts = new FakeTextToSpeechProvider(320).failOn("Bad sentence.");
        SynthesisService service = service(tts, Duration.ofSeconds(5));

        service.synthesize(session, queued("Bad sentence.", session.beginTurn(), false));

        assertThat(tts.texts).containsExactly("Bad sentence.", APOLOGY);
        assertThat(outbound).hasSize(1);
        assertThat(events.eventsOfType(ProviderFailureEvent.class))
                .extracting(ProviderFailureEvent::provider, ProviderFailureEvent::reason)
                .containsExactly(tuple("fake-tts", "error"));
        assertThat(session.pendingSynthesis()).isZero();
    }

    @Test
    void failingApologyIsNotRetried() {
        FakeTextToSpeechProvider tts = new FakeTextToSpeechProvider(320).failAll();
        SynthesisService service = service(tts, Duration.ofSeconds(5));

        service.synthesize(session, queued("Anything.", session.beginTurn(), false));

        assertThat(tts.texts).containsExactly("Anything.", APOLOGY);
        assertThat(outbound).isEmpty();
        assertThat(events.eventsOfType(ProviderFailureEvent.class)).hasSize(2);
        assertThat(session.pendingSynthesis()).isZero();
    }

    @Test
    void laterSentencesOfAFailedTurnAreSkipped() {
        FakeTextToSpeechProvider tts = new FakeTextToSpeechProvider(320).failOn("First.", "Second.");
        SynthesisService service = service(tts, Duration.ofSeconds(5));
        CancellationToken token = session.beginTurn();
        SynthesisRequest first = queued("First.", token, false);
        SynthesisRequest second = queued("Second.", token, false);

        service.synthesize(session, first);
        service.synthesize(session, second);

        assertThat(tts.texts).containsExactly("First.", APOLOGY);
        assertThat(token.hasFailed()).isTrue();
        assertThat(events.eventsOfType(ProviderFailureEvent.class)).hasSize(1);
        assertThat(session.pendingSynthesis()).isZero();
    }

    @Test
    void nextTurnSpeaksAgainAfterAFailedTurn() {
        FakeTextToSpeechProvider tts = new FakeTextToSpeechProvider(320).failOn("Broken.");
        SynthesisService service = service(tts, Duration.ofSeconds(5));

        service.synthesize(session, queued("Broken.", session.beginTurn(), false));
        service.synthesize(session, queued("Fine now.", session.beginTurn(), false));

        assertThat(tts.texts).containsExactly("Broken.", APOLOGY, "Fine now.");
        assertThat(outbound).hasSize(2);
    }

    @Test
    void cancelledTurnIsSkipped() {
        FakeTextToSpeechProvider tts = new FakeTextToSpeechProvider(320);
        SynthesisService service = service(tts, Duration.ofSeconds(5));
        CancellationToken token = session.beginTurn();
        session.beginTurn();

        service.synthesize(session, queued("Stale sentence.", token, false));

        assertThat(tts.texts).isEmpty();
        assertThat(outbound).isEmpty();
        assertThat(session.pendingSynthesis()).isZero();
    }

    @Test
    void endedSessionIsSkipped() {
        FakeTextToSpeechProvider tts = new FakeTextToSpeechProvider(320);
        SynthesisService service = service(tts, Duration.ofSeconds(5));
        SynthesisRequest request = queued("Goodbye.", session.beginTurn(), false);
        registry.destroy(session.id());

        service.synthesize(session, request);

        assertThat(tts.texts).isEmpty();
    }

    @Test
    void silentProviderTimesOut() {
        FakeTextToSpeechProvider tts = new FakeTextToSpeechProvider(320).hang();
        SynthesisService service = service(tts, Duration.ofMillis(50));

        service.synthesize(session, queued("Hello.", session.beginTurn(), false));

        assertThat(tts.texts).containsExactly("Hello.", APOLOGY);
        assertThat(events.eventsOfType(ProviderFailureEvent.class))
                .extracting(ProviderFailureEvent::reason)
                .containsExactly("timeout", "timeout");
        assertThat(session.pendingSynthesis()).isZero();
    }

    @Test
    void cancellationResolvesTheWaitWithoutApology() {
        FakeTextToSpeechProvider tts = new FakeTextToSpeechProvider(320).hang();
        SynthesisService service = service(tts, Duration.ofSeconds(10));
        CancellationToken token = session.beginTurn();
        CompletableFuture.delayedExecutor(50, TimeUnit.MILLISECONDS).execute(token::cancel);
        long start = System.nanoTime();

        service.synthesize(session, queued("Hello.", token, false));

        assertThat(Duration.ofNanos(System.nanoTime() - start)).isLessThan(Duration.ofSeconds(5));
        assertThat(tts.texts).containsExactly("Hello.");
        assertThat(events.eventsOfType(ProviderFailureEvent.class)).isEmpty();
        assertThat(session.pendingSynthesis()).isZero();
    }
}
