package com.phillippitts.frontdesk.service.session;

import com.phillippitts.frontdesk.config.properties.PlaybackProperties;
import com.phillippitts.frontdesk.config.properties.ReplyProperties;
import com.phillippitts.frontdesk.domain.AudioChunk;
import com.phillippitts.frontdesk.domain.CancellationToken;
import com.phillippitts.frontdesk.service.metrics.PipelineMetrics;
import com.phillippitts.frontdesk.service.playback.PlaybackScheduler;
import com.phillippitts.frontdesk.testutil.ManualTaskScheduler;
import com.phillippitts.frontdesk.testutil.RecordingCarrierChannel;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class CallSessionTest {

    private SessionRegistry registry;
    private CallSession session;

    @BeforeEach
    void setUp() {
        registry = new SessionRegistry(new ReplyProperties());
        session = registry.create("CA1", "MZ1", new RecordingCarrierChannel());
    }

    @Test
    void beginTurnCancelsPreviousTurn() {
        CancellationToken first = session.beginTurn();
        CancellationToken second = session.beginTurn();

        assertThat(first.isCancelled()).isTrue();
        assertThat(second.isCancelled()).isFalse();
        assertThat(second.turnId()).isGreaterThan(first.turnId());
        assertThat(session.currentTurn()).isSameAs(second);
    }

    @Test
    void tokenForCurrentTurnIsTheLiveOne() {
        CancellationToken old = session.beginTurn();
        CancellationToken current = session.beginTurn();

        assertThat(session.tokenFor(current.turnId())).isSameAs(current);
        assertThat(session.tokenFor(old.turnId()).isCancelled()).isTrue();
        assertThat(session.tokenFor(old.turnId()).turnId()).isEqualTo(old.turnId());
    }

    @Test
    void turnStartedAfterTeardownIsBornCancelled() {
        registry.destroy(session.id());

        assertThat(session.beginTurn().isCancelled()).isTrue();
    }

    @Test
    void onlyOneGenerationAtATime() {
        assertThat(session.tryStartGeneration()).isTrue();
        assertThat(session.tryStartGeneration()).isFalse();
        assertThat(session.isGenerating()).isTrue();

        session.endGeneration();

        assertThat(session.tryStartGeneration()).isTrue();
    }

    @Test
    void pendingSynthesisNeverGoesNegative() {
        session.synthesisFinished();
        assertThat(session.pendingSynthesis()).isZero();

        session.synthesisQueued();
        session.synthesisQueued();
        session.synthesisFinished();

        assertThat(session.pendingSynthesis()).isEqualTo(1);
    }

    @Test
    void drainActionRunsAtOnceWhenNothingIsPending() {
        List<String> ran = new ArrayList<>();

        session.whenSynthesisDrained(() -> ran.add("turn-2"));

        assertThat(ran).containsExactly("turn-2");
    }

    @Test
    void drainActionWaitsForTheLastSynthesis() {
        List<String> ran = new ArrayList<>();
        session.synthesisQueued();
        session.synthesisQueued();

        session.whenSynthesisDrained(() -> ran.add("turn-2"));
        session.synthesisFinished();
        assertThat(ran).isEmpty();

        session.synthesisFinished();
        session.synthesisQueued();
        session.synthesisFinished();
        assertThat(ran).containsExactly("turn-2");
    }

    @Test
    void newerDrainActionReleasesTheWaitingOne() {
        List<String> ran = new ArrayList<>();
        session.synthesisQueued();

        session.whenSynthesisDrained(() -> ran.add("turn-2"));
        session.whenSynthesisDrained(() -> ran.add("turn-3"));
        assertThat(ran).containsExactly("turn-2");

        session.synthesisFinished();
        assertThat(ran).containsExactly("turn-2", "turn-3");
    }

    @Test
    void teardownRunsTheWaitingDrainAction() {
        List<String> ran = new ArrayList<>();
        session.synthesisQueued();
        session.whenSynthesisDrained(() -> ran.add("turn-2"));

        registry.destroy(session.id());

        assertThat(ran).containsExactly("turn-2");
    }

    @Test
    void activeOutputCoversGenerationSynthesisAndPlayback() {
        assertThat(session.hasActiveOutput()).isFalse();

        session.tryStartGeneration();
        assertThat(session.hasActiveOutput()).isTrue();
        session.endGeneration();

        session.synthesisQueued();
        assertThat(session.hasActiveOutput()).isTrue();
        session.synthesisFinished();
        assertThat(session.hasActiveOutput()).isFalse();
    }

    @Test
    void queuedPlaybackCountsAsActiveOutput() {
        CancellationToken turn = session.beginTurn();
        PlaybackScheduler playback = new PlaybackScheduler(new ManualTaskScheduler(), new PlaybackProperties(),
                new PipelineMetrics(new SimpleMeterRegistry()));

        playback.enqueue(session, new AudioChunk(session.id(), new byte[160], turn));

        assertThat(session.hasActiveOutput()).isTrue();
    }
}
