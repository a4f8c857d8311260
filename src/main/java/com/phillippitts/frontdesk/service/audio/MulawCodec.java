package com.phillippitts.frontdesk.service.audio;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * G.711 mu-law codec and 8k/16k resampler for carrier audio.
 *
 * <p>PCM buffers are 16-bit signed little-endian. Expansion uses a 256-entry table; compression
 * uses a 256-entry exponent table over the biased magnitude. Resampling duplicates samples going
 * up and averages pairs (rounding toward negative infinity) going down.
 *
 * <p>Malformed input (null, empty, odd-length PCM) is dropped with a warning and an empty array is
 * returned. Nothing here throws on bad audio.
 */
public final class MulawCodec {

    private static final Logger LOG = LogManager.getLogger(MulawCodec.class);

    private static final int BIAS = 0x84;
    private static final int CLIP = 32635;
    private static final byte[] EMPTY = new byte[0];

    private static final short[] DECODE_TABLE = new short[256];
    private static final byte[] EXPONENT_TABLE = new byte[256];

    static {
        for (int i = 0; i < 256; i++) {
            int u = ~i & 0xFF;
            int sign = u & 0x80;
            int exponent = (u >> 4) & 0x07;
            int mantissa = u & 0x0F;
            int magnitude = (((mantissa << 3) + BIAS) << exponent) - BIAS;
            DECODE_TABLE[i] = (short) (sign != 0 ? -magnitude : magnitude);
        }
        // EXPONENT_TABLE[n] = floor(log2(n)), 0 for n == 0
        for (int i = 0; i < 256; i++) {
            int exponent = 0;
            for (int v = i >> 1; v > 0; v >>= 1) {
                exponent++;
            }
            EXPONENT_TABLE[i] = (byte) exponent;
        }
    }

    private MulawCodec() {}

    /**
     * Expands one mu-law byte to a linear sample.
     */
    public static short decodeSample(byte mulaw) {
        return DECODE_TABLE[mulaw & 0xFF];
    }

    /**
     * Compresses one linear sample to mu-law. Input outside the 16-bit range is clamped to it first,
     * then magnitudes above 32635 are clipped.
     */
    public static byte encodeSample(int sample) {
        sample = clamp(sample);
        int sign = (sample >> 8) & 0x80;
        int magnitude = sign != 0 ? -sample : sample;
        if (magnitude > CLIP) {
            magnitude = CLIP;
        }
        magnitude += BIAS;
        int exponent = EXPONENT_TABLE[(magnitude >> 7) & 0xFF];
        int mantissa = (magnitude >> (exponent + 3)) & 0x0F;
        return (byte) (~(sign | (exponent << 4) | mantissa) & 0xFF);
    }

    /**
     * Expands a mu-law frame to PCM16 at unity gain.
     *
     * @param frame mu-law bytes
     * @return PCM16 little-endian, twice the frame length; empty for a malformed frame
     */
    public static byte[] decode(byte[] frame) {
        return decode(frame, 1.0);
    }

    /**
     * Expands a mu-law frame to PCM16, amplifying by {@code gain} and clamping to the 16-bit range.
     */
    public static byte[] decode(byte[] frame, double gain) {
        if (frame == null || frame.length == 0) {
            LOG.warn("Dropping empty mu-law frame");
            return EMPTY;
        }
        byte[] pcm = new byte[frame.length * AudioFormat.PCM_BYTES_PER_SAMPLE];
        for (int i = 0; i < frame.length; i++) {
            int sample = DECODE_TABLE[frame[i] & 0xFF];
            if (gain != 1.0) {
                sample = clamp(Math.round(sample * gain));
            }
            writeSample(pcm, i, sample);
        }
        return pcm;
    }

    /**
     * Compresses a PCM16 little-endian buffer to mu-law.
     *
     * @return one byte per sample; empty for a null, empty or odd-length buffer
     */
    public static byte[] encode(byte[] pcm) {
        if (!isWholePcm(pcm, "encode")) {
            return EMPTY;
        }
        byte[] out = new byte[pcm.length / AudioFormat.PCM_BYTES_PER_SAMPLE];
        for (int i = 0; i < out.length; i++) {
            out[i] = encodeSample(readSample(pcm, i));
        }
        return out;
    }

    /**
     * 8 kHz to 16 kHz by duplicating every sample.
     */
    public static byte[] upsample(byte[] pcm) {
        if (!isWholePcm(pcm, "upsample")) {
            return EMPTY;
        }
        int samples = pcm.length / AudioFormat.PCM_BYTES_PER_SAMPLE;
        byte[] out = new byte[pcm.length * 2];
        for (int i = 0; i < samples; i++) {
            int sample = readSample(pcm, i);
            writeSample(out, 2 * i, sample);
            writeSample(out, 2 * i + 1, sample);
        }
        return out;
    }

    /**
     * 16 kHz to 8 kHz by averaging sample pairs. A trailing unpaired sample is dropped.
     */
    public static byte[] downsample(byte[] pcm) {
        if (!isWholePcm(pcm, "downsample")) {
            return EMPTY;
        }
        int outSamples = pcm.length / (2 * AudioFormat.PCM_BYTES_PER_SAMPLE);
        byte[] out = new byte[outSamples * AudioFormat.PCM_BYTES_PER_SAMPLE];
        for (int i = 0; i < outSamples; i++) {
            int a = readSample(pcm, 2 * i);
            int b = readSample(pcm, 2 * i + 1);
            writeSample(out, i, Math.floorDiv(a + b, 2));
        }
        return out;
    }

    static int readSample(byte[] pcm, int index) {
        int offset = index * AudioFormat.PCM_BYTES_PER_SAMPLE;
        return (short) ((pcm[offset] & 0xFF) | (pcm[offset + 1] << 8));
    }

    static void writeSample(byte[] pcm, int index, int sample) {
        int offset = index * AudioFormat.PCM_BYTES_PER_SAMPLE;
        pcm[offset] = (byte) sample;
        pcm[offset + 1] = (byte) (sample >> 8);
    }

    private static int clamp(long sample) {
        if (sample > Short.MAX_VALUE) {
            return Short.MAX_VALUE;
        }
        if (sample < Short.MIN_VALUE) {
            return Short.MIN_VALUE;
        }
        return (int) sample;
    }

    private static boolean isWholePcm(byte[] pcm, String operation) {
        if (pcm == null || pcm.length == 0) {
            LOG.warn("Dropping empty PCM buffer on {}", operation);
            return false;
        }
        if (pcm.length % AudioFormat.PCM_BYTES_PER_SAMPLE != 0) {
            LOG.warn("Dropping odd-length PCM buffer on {}: {} bytes", operation, pcm.length);
            return false;
        }
        return true;
    }
}
