package com.phillippitts.frontdesk.service.audio;

/**
 * Audio formats on both sides of the pipeline.
 * Carrier: 8 kHz, 8-bit mu-law, mono. Speech-to-text: 16-bit signed PCM, mono, little-endian.
 */
public final class AudioFormat {

    /** Carrier sample rate in Hz. */
    public static final int CARRIER_SAMPLE_RATE = 8_000;
    /** Wideband rate used when the recognizer prefers 16 kHz. */
    public static final int WIDEBAND_SAMPLE_RATE = 16_000;
    /** Bytes per mu-law sample. */
    public static final int MULAW_BYTES_PER_SAMPLE = 1;
    /** Bytes per PCM16 sample. */
    public static final int PCM_BYTES_PER_SAMPLE = 2;

    /** mu-law byte encoding digital silence. */
    public static final byte MULAW_SILENCE = (byte) 0xFF;

    private AudioFormat() {}
}
