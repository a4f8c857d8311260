package com.phillippitts.frontdesk.service.stt;

/**
 * Receives transcripts of one streaming recognition connection.
 */
public interface TranscriptListener {

    void onTranscript(String text, boolean isFinal);

    /**
     * The connection broke; no more transcripts will arrive.
     */
    void onError(Throwable error);
}
