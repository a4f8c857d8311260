package com.phillippitts.frontdesk.service.stt;

/**
 * One persistent streaming recognition connection, owned by a call session.
 */
public interface SttConnection extends AutoCloseable {

    /**
     * Sends PCM16 little-endian mono audio. Dropped with a warning if the connection is closed.
     */
    void sendAudio(byte[] pcm);

    boolean isOpen();

    /**
     * Flushes pending audio and closes the connection. Idempotent.
     */
    @Override
    void close();
}
