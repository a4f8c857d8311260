package com.phillippitts.frontdesk.service.interruption;

import com.phillippitts.frontdesk.config.properties.InterruptionProperties;
import com.phillippitts.frontdesk.util.TimeUtils;

/**
 * Per-session barge-in state: {@code IDLE -> LISTENING -> TRIGGERED -> IDLE}.
 *
 * <p>LISTENING starts with the first non-empty interim transcript. Speech duration is measured from
 * the start of the current run of interims; a pause longer than {@code maxGapMs} starts a new run.
 * The machine triggers when the
 * caller has said enough (words, characters or duration) while system output is active and the
 * cooldown since the last trigger has passed. TRIGGERED falls back to IDLE once the cooldown
 * expires; a final transcript forces IDLE at any time but keeps the cooldown clock.
 */
public final class BargeInStateMachine {

    public enum State { IDLE, LISTENING, TRIGGERED }

    private State state = State.IDLE;
    private long listeningSinceNanos;
    private long lastInterimNanos;
    private long lastTriggerNanos;
    private boolean triggeredBefore;

    /**
     * Feeds one interim transcript.
     *
     * @param text         interim text
     * @param nowNanos     monotonic time of the event
     * @param outputActive whether the caller is hearing (or about to hear) system output
     * @param props        thresholds
     * @return true if this event triggers a barge-in
     */
    public synchronized boolean onInterim(String text, long nowNanos, boolean outputActive,
                                          InterruptionProperties props) {
        String trimmed = text == null ? "" : text.trim();
        if (trimmed.isEmpty()) {
            return false;
        }
        if (state == State.TRIGGERED) {
            if (inCooldown(nowNanos, props)) {
                return false;
            }
            state = State.IDLE;
        }
        if (state == State.IDLE) {
            state = State.LISTENING;
            listeningSinceNanos = nowNanos;
        } else if (nowNanos - lastInterimNanos > props.maxGapMs() * TimeUtils.NANOS_PER_MILLI) {
            listeningSinceNanos = nowNanos;
        }
        lastInterimNanos = nowNanos;
        if (!outputActive || inCooldown(nowNanos, props)) {
            return false;
        }
        long speechMs = TimeUtils.nanosToMillis(nowNanos - listeningSinceNanos);
        boolean enoughSpeech = wordCount(trimmed) >= props.minWords()
                || trimmed.length() >= props.minChars()
                || speechMs > props.minSpeechMs();
        if (!enoughSpeech) {
            return false;
        }
        state = State.TRIGGERED;
        lastTriggerNanos = nowNanos;
        triggeredBefore = true;
        return true;
    }

    /**
     * A finalized transcript ends the caller's utterance.
     */
    public synchronized void onFinal() {
        state = State.IDLE;
    }

    public synchronized State state() {
        return state;
    }

    private boolean inCooldown(long nowNanos, InterruptionProperties props) {
        return triggeredBefore
                && nowNanos - lastTriggerNanos < props.cooldownMs() * TimeUtils.NANOS_PER_MILLI;
    }

    static int wordCount(String trimmed) {
        return trimmed.isEmpty() ? 0 : trimmed.split("\\s+").length;
    }
}
