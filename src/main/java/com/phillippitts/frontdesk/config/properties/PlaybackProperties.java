package com.phillippitts.frontdesk.config.properties;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Pacing of outbound audio to the carrier.
 *
 * <p>Chunk interval is derived from chunk size and sample rate (160 bytes of 8kHz mu-law = 20ms),
 * scaled by {@code pacingRatio} to keep the carrier buffer slightly ahead of playout.
 * When more than {@code highWaterMark} chunks are in flight, each extra chunk adds
 * {@code throttleStep} of the base interval, up to {@code maxDelayMultiplier}.
 */
@Validated
@ConfigurationProperties(prefix = "playback")
public class PlaybackProperties {

    /** Bytes per chunk sent to the carrier. */
    @Min(40)
    @Max(1600)
    private int chunkBytes = 160;

    /** Carrier codec sample rate (one byte per sample). */
    @Min(8000)
    private int sampleRate = 8000;

    /** Fraction of the chunk playout duration to wait between chunks. */
    @DecimalMin("0.5")
    @DecimalMax("1.0")
    private double pacingRatio = 0.9;

    /** Chunks in flight before throttling starts. */
    @Min(1)
    private int highWaterMark = 25;

    /** Added delay per chunk above the high-water mark, as a fraction of the base interval. */
    @DecimalMin("0.0")
    private double throttleStep = 0.1;

    /** Upper bound of the throttled interval, as a multiple of the base interval. */
    @DecimalMin("1.0")
    private double maxDelayMultiplier = 2.5;

    /**
     * Playback that starts from an idle queue with less audio than this waits {@code leadInMs} before
     * its first send, so more of a still-streaming utterance can arrive. Only the chunk that starts
     * playback is measured; the rest of the utterance is not known yet.
     */
    @Min(0)
    private int startBufferBytes = 800;

    /** Lead-in delay when playback starts below {@code startBufferBytes}, in milliseconds. */
    @Min(0)
    @Max(500)
    private int leadInMs = 40;

    /** How long the cleared flag stays set after a clear, in milliseconds. */
    @Min(0)
    private int clearResetMs = 100;

    public int getChunkBytes() {
        return chunkBytes;
    }

    public void setChunkBytes(int chunkBytes) {
        this.chunkBytes = chunkBytes;
    }

    public int getSampleRate() {
        return sampleRate;
    }

    public void setSampleRate(int sampleRate) {
        this.sampleRate = sampleRate;
    }

    public double getPacingRatio() {
        return pacingRatio;
    }

    public void setPacingRatio(double pacingRatio) {
        this.pacingRatio = pacingRatio;
    }

    public int getHighWaterMark() {
        return highWaterMark;
    }

    public void setHighWaterMark(int highWaterMark) {
        this.highWaterMark = highWaterMark;
    }

    public double getThrottleStep() {
        return throttleStep;
    }

    public void setThrottleStep(double throttleStep) {
        this.throttleStep = throttleStep;
    }

    public double getMaxDelayMultiplier() {
        return maxDelayMultiplier;
    }

    public void setMaxDelayMultiplier(double maxDelayMultiplier) {
        this.maxDelayMultiplier = maxDelayMultiplier;
    }

    public int getStartBufferBytes() {
        return startBufferBytes;
    }

    public void setStartBufferBytes(int startBufferBytes) {
        this.startBufferBytes = startBufferBytes;
    }

    public int getLeadInMs() {
        return leadInMs;
    }

    public void setLeadInMs(int leadInMs) {
        this.leadInMs = leadInMs;
    }

    public int getClearResetMs() {
        return clearResetMs;
    }

    public void setClearResetMs(int clearResetMs) {
        this.clearResetMs = clearResetMs;
    }
}
