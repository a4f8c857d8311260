package com.phillippitts.frontdesk.service.session;

import com.phillippitts.frontdesk.config.properties.ReplyProperties;
import com.phillippitts.frontdesk.domain.CancellationToken;
import com.phillippitts.frontdesk.exception.UnknownSessionException;
import com.phillippitts.frontdesk.testutil.FakeSpeechToTextProvider;
import com.phillippitts.frontdesk.testutil.RecordingCarrierChannel;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SessionRegistryTest {

    private final SessionRegistry registry = new SessionRegistry(new ReplyProperties());

    @Test
    void createIndexesBySessionAndCallId() {
        CallSession session = registry.create("CA1", "MZ1", new RecordingCarrierChannel());

        assertThat(registry.find(session.id())).containsSame(session);
        assertThat(registry.findByCallSid("CA1")).containsSame(session);
        assertThat(registry.require(session.id())).isSameAs(session);
        assertThat(registry.activeCount()).isEqualTo(1);
        assertThat(session.streamSid()).isEqualTo("MZ1");
    }

    @Test
    void requireUnknownSessionThrows() {
        assertThatThrownBy(() -> registry.require("nope"))
                .isInstanceOf(UnknownSessionException.class)
                .hasMessageContaining("nope");
        assertThat(registry.find(null)).isEmpty();
    }

    @Test
    void historyStartsWithConfiguredPreamble() {
        ReplyProperties props = new ReplyProperties();
        props.setSystemPrompt("Custom preamble");
        CallSession session = new SessionRegistry(props).create("CA1", null, new RecordingCarrierChannel());

        assertThat(session.history().snapshot()).singleElement()
                .satisfies(turn -> assertThat(turn.text()).isEqualTo("Custom preamble"));
    }

    @Test
    void destroyTearsDownExactlyOnce() {
        RecordingCarrierChannel channel = new RecordingCarrierChannel();
        CallSession session = registry.create("CA1", "MZ1", channel);
        CancellationToken turn = session.beginTurn();
        List<String> closed = new ArrayList<>();
        session.attach(() -> closed.add("first"));
        session.attach(() -> closed.add("second"));

        assertThat(registry.destroy(session.id())).isTrue();
        assertThat(registry.destroy(session.id())).isFalse();

        assertThat(turn.isCancelled()).isTrue();
        assertThat(closed).containsExactly("second", "first");
        assertThat(channel.closeCount).hasValue(1);
        assertThat(session.isClosed()).isTrue();
        assertThat(registry.find(session.id())).isEmpty();
        assertThat(registry.findByCallSid("CA1")).isEmpty();
    }

    @Test
    void failingResourceDoesNotBlockTeardown() {
        RecordingCarrierChannel channel = new RecordingCarrierChannel();
        CallSession session = registry.create("CA1", "MZ1", channel);
        session.attach(() -> {
            throw new IllegalStateException("socket already gone");
        });

        assertThat(registry.destroy(session.id())).isTrue();
        assertThat(channel.closeCount).hasValue(1);
    }

    @Test
    void resourceAttachedAfterTeardownIsClosedAtOnce() {
        CallSession session = registry.create("CA1", "MZ1", new RecordingCarrierChannel());
        registry.destroy(session.id());
        FakeSpeechToTextProvider stt = new FakeSpeechToTextProvider();
        FakeSpeechToTextProvider.FakeConnection connection =
                (FakeSpeechToTextProvider.FakeConnection) stt.open(session.id(), 8000, null);

        session.bindRecognizer(connection);

        assertThat(connection.closeCount).isEqualTo(1);
        assertThat(session.recognizer()).isEmpty();
    }

    @Test
    void restartedCallReplacesPreviousSession() {
        RecordingCarrierChannel firstChannel = new RecordingCarrierChannel();
        CallSession first = registry.create("CA1", "MZ1", firstChannel);
        CallSession second = registry.create("CA1", "MZ2", new RecordingCarrierChannel());

        assertThat(first.isClosed()).isTrue();
        assertThat(firstChannel.closeCount).hasValue(1);
        assertThat(registry.findByCallSid("CA1")).containsSame(second);
        assertThat(registry.activeCount()).isEqualTo(1);
    }

    @Test
    void destroyAllEndsEverySession() {
        CallSession a = registry.create("CA1", "MZ1", new RecordingCarrierChannel());
        CallSession b = registry.create("CA2", "MZ2", new RecordingCarrierChannel());

        registry.destroyAll();

        assertThat(a.isClosed()).isTrue();
        assertThat(b.isClosed()).isTrue();
        assertThat(registry.active()).isEmpty();
    }
}
