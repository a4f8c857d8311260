package com.phillippitts.frontdesk.service.stt;

import com.phillippitts.frontdesk.exception.ProviderException;

/**
 * Streaming speech-to-text provider.
 */
public interface SpeechToTextProvider {

    /**
     * Opens a per-session streaming connection.
     *
     * @param sessionId  owning session, for logs
     * @param sampleRate sample rate of the PCM that will be sent
     * @param listener   receives interim and final transcripts
     * @throws ProviderException if the connection cannot be established within the bounded wait
     */
    SttConnection open(String sessionId, int sampleRate, TranscriptListener listener);

    String name();
}
