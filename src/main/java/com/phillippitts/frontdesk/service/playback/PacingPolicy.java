package com.phillippitts.frontdesk.service.playback;

import com.phillippitts.frontdesk.config.properties.PlaybackProperties;
import com.phillippitts.frontdesk.util.TimeUtils;

/**
 * Inter-chunk delay with a simple proportional throttle.
 *
 * <p>The base interval is the playout time of one chunk at the codec sample rate, scaled by the
 * pacing ratio. Above the high-water mark each extra in-flight chunk adds {@code throttleStep} of
 * the base interval, capped at {@code maxDelayMultiplier} times the base.
 */
public final class PacingPolicy {

    private final long chunkPlayoutNanos;
    private final long baseIntervalNanos;
    private final int highWaterMark;
    private final double throttleStep;
    private final double maxDelayMultiplier;

    public PacingPolicy(int chunkBytes, int sampleRate, double pacingRatio, int highWaterMark,
                        double throttleStep, double maxDelayMultiplier) {
        this.chunkPlayoutNanos = TimeUtils.playoutNanos(chunkBytes, sampleRate);
        this.baseIntervalNanos = (long) (chunkPlayoutNanos * pacingRatio);
        this.highWaterMark = highWaterMark;
        this.throttleStep = throttleStep;
        this.maxDelayMultiplier = maxDelayMultiplier;
    }

    public static PacingPolicy from(PlaybackProperties props) {
        return new PacingPolicy(props.getChunkBytes(), props.getSampleRate(), props.getPacingRatio(),
                props.getHighWaterMark(), props.getThrottleStep(), props.getMaxDelayMultiplier());
    }

    /** Playout duration of one full chunk. */
    public long chunkPlayoutNanos() {
        return chunkPlayoutNanos;
    }

    public long baseIntervalNanos() {
        return baseIntervalNanos;
    }

    public boolean isThrottled(int inFlight) {
        return inFlight > highWaterMark;
    }

    /**
     * Delay before the next chunk given the number of chunks in flight.
     */
    public long delayNanos(int inFlight) {
        if (!isThrottled(inFlight)) {
            return baseIntervalNanos;
        }
        double multiplier = Math.min(1.0 + (inFlight - highWaterMark) * throttleStep, maxDelayMultiplier);
        return (long) (baseIntervalNanos * multiplier);
    }
}
