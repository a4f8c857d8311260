package com.phillippitts.frontdesk.service.carrier;

/**
 * Outbound side of one call's media channel.
 *
 * <p>Implementations are safe to call from pipeline and playback threads. Send failures are logged
 * by the implementation and reported through the return value; they never throw.
 */
public interface CarrierChannel {

    /**
     * Sends one chunk of 8 kHz mu-law audio.
     *
     * @return false when the channel is closed or the send failed
     */
    boolean sendAudio(byte[] mulaw);

    /**
     * Asks the carrier to flush audio it buffered but has not played yet.
     */
    void sendClear();

    /**
     * Mirrors a transcript to the caller side. Only the browser test channel shows it.
     */
    default void sendTranscript(String text, boolean isFinal) {
    }

    boolean isOpen();

    /**
     * Closes the channel. Idempotent.
     */
    void close();
}
