package com.phillippitts.frontdesk.service.bus;

import com.phillippitts.frontdesk.domain.AudioChunk;
import com.phillippitts.frontdesk.domain.AudioClear;
import com.phillippitts.frontdesk.domain.GenerationRequest;
import com.phillippitts.frontdesk.domain.SynthesisRequest;
import com.phillippitts.frontdesk.domain.TranscriptEvent;

import java.util.List;

/**
 * The queues wiring one call's pipeline stages, one per stage.
 */
public final class PipelineQueues {

    public static final BusQueue<TranscriptEvent> TRANSCRIPTS =
            new BusQueue<>("transcripts", TranscriptEvent.class);
    public static final BusQueue<GenerationRequest> GENERATION_REQUESTS =
            new BusQueue<>("generation-requests", GenerationRequest.class);
    public static final BusQueue<SynthesisRequest> SYNTHESIS_REQUESTS =
            new BusQueue<>("synthesis-requests", SynthesisRequest.class);
    public static final BusQueue<AudioChunk> OUTBOUND_AUDIO =
            new BusQueue<>("outbound-audio", AudioChunk.class);
    public static final BusQueue<AudioClear> AUDIO_CLEAR =
            new BusQueue<>("audio-clear", AudioClear.class);

    public static final List<BusQueue<?>> ALL =
            List.of(TRANSCRIPTS, GENERATION_REQUESTS, SYNTHESIS_REQUESTS, OUTBOUND_AUDIO, AUDIO_CLEAR);

    private PipelineQueues() {}
}
