package com.phillippitts.frontdesk.service.bus;

import com.phillippitts.frontdesk.config.properties.ReplyProperties;
import com.phillippitts.frontdesk.domain.AudioChunk;
import com.phillippitts.frontdesk.domain.CancellationToken;
import com.phillippitts.frontdesk.domain.GenerationRequest;
import com.phillippitts.frontdesk.domain.SynthesisRequest;
import com.phillippitts.frontdesk.domain.TranscriptEvent;
import com.phillippitts.frontdesk.service.session.CallSession;
import com.phillippitts.frontdesk.service.session.SessionRegistry;
import com.phillippitts.frontdesk.testutil.RecordingCarrierChannel;
import org.json.JSONException;
import org.json.JSONObject;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class BusMessageCodecTest {

    private SessionRegistry registry;
    private BusMessageCodec codec;
    private CallSession session;

    @BeforeEach
    void setUp() {
        registry = new SessionRegistry(new ReplyProperties());
        codec = new BusMessageCodec(registry);
        session = registry.create("CA1", "MZ1", new RecordingCarrierChannel());
    }

    @Test
    void currentTurnResolvesToTheLiveToken() {
        CancellationToken turn = session.beginTurn();
        byte[] body = codec.encode(new SynthesisRequest(session.id(), "We open at eight.", turn, true));

        SynthesisRequest decoded = codec.decode(PipelineQueues.SYNTHESIS_REQUESTS, body);

        assertThat(decoded.token()).isSameAs(turn);
        assertThat(decoded.text()).isEqualTo("We open at eight.");
        assertThat(decoded.fallback()).isTrue();

        turn.markFailed();
        assertThat(decoded.token().hasFailed()).isTrue();
    }

    @Test
    void supersededTurnResolvesToACancelledToken() {
        CancellationToken old = session.beginTurn();
        byte[] body = codec.encode(new GenerationRequest(session.id(), "what are your hours", old));
        session.beginTurn();

        GenerationRequest decoded = codec.decode(PipelineQueues.GENERATION_REQUESTS, body);

        assertThat(decoded.token().isCancelled()).isTrue();
        assertThat(decoded.token().turnId()).isEqualTo(old.turnId());
        assertThat(session.currentTurn().isCancelled()).isFalse();
    }

    @Test
    void endedSessionResolvesToACancelledToken() {
        CancellationToken turn = session.beginTurn();
        byte[] body = codec.encode(new AudioChunk(session.id(), new byte[] {1, 2}, turn));
        registry.destroy(session.id());

        AudioChunk decoded = codec.decode(PipelineQueues.OUTBOUND_AUDIO, body);

        assertThat(decoded.token().isCancelled()).isTrue();
    }

    @Test
    void audioTravelsAsBase64() {
        byte[] audio = {(byte) 0xFF, 0x00, 0x7F, (byte) 0x80};
        byte[] body = codec.encode(new AudioChunk(session.id(), audio, session.beginTurn()));

        JSONObject json = new JSONObject(new String(body, StandardCharsets.UTF_8));

        assertThat(json.getString("payload")).isEqualTo("/wB/gA==");
        assertThat(codec.decode(PipelineQueues.OUTBOUND_AUDIO, body).payload()).containsExactly(audio);
    }

    @Test
    void transcriptKeepsItsFlagsAndTimestamp() {
        Instant heard = Instant.parse("2026-03-02T15:42:32.529Z");
        byte[] body = codec.encode(new TranscriptEvent(session.id(), "do you take medicare", true, heard));

        TranscriptEvent decoded = codec.decode(PipelineQueues.TRANSCRIPTS, body);

        assertThat(decoded).isEqualTo(new TranscriptEvent(session.id(), "do you take medicare", true, heard));
    }

    @Test
    void malformedBodyIsRejected() {
        byte[] body = "{\"sessionId\":\"s1\"}".getBytes(StandardCharsets.UTF_8);

        assertThatThrownBy(() -> codec.decode(PipelineQueues.GENERATION_REQUESTS, body))
                .isInstanceOf(JSONException.class);
        assertThatThrownBy(() -> codec.decode(PipelineQueues.TRANSCRIPTS, "not json".getBytes(StandardCharsets.UTF_8)))
                .isInstanceOf(JSONException.class);
    }
}
