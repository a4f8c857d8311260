package com.phillippitts.frontdesk.service.tts;

import java.util.concurrent.CompletableFuture;
import java.util.function.Consumer;

/**
 * Streaming text-to-speech provider producing 8 kHz mu-law audio.
 */
public interface TextToSpeechProvider {

    /**
     * Starts one streaming synthesis request.
     *
     * @param text       plain text to speak
     * @param audioSink  receives audio chunks in order as they arrive
     * @return completes at the provider's end marker, exceptionally on failure; cancelling it
     *         aborts the request
     */
    CompletableFuture<Void> synthesize(String text, Consumer<byte[]> audioSink);

    String name();
}
