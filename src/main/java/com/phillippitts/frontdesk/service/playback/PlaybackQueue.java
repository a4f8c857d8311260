package com.phillippitts.frontdesk.service.playback;

import com.phillippitts.frontdesk.domain.AudioChunk;

import java.util.ArrayDeque;
import java.util.Arrays;
import java.util.Deque;

/**
 * Per-session FIFO of audio waiting to be paced out to the carrier, plus the playback cursor.
 *
 * <p>All state is guarded by this object's monitor. {@link PlaybackScheduler} holds the monitor
 * across check-send-record so a concurrent {@link #clear(long)} can never interleave with a send.
 *
 * <p>The epoch changes on every clear; timer ticks scheduled under an older epoch become no-ops.
 */
public final class PlaybackQueue {

    private final Deque<AudioChunk> pending = new ArrayDeque<>();
    private AudioChunk current;
    private int offset;
    private boolean draining;
    private long epoch;
    private long playoutCursorNanos;

    private volatile boolean cleared;
    private long clearedThroughTurn = -1;

    /**
     * Appends a chunk.
     *
     * @return true if the queue was idle and the caller must start draining
     */
    synchronized boolean offer(AudioChunk chunk) {
        if (cleared && chunk.token().turnId() <= clearedThroughTurn) {
            return false;
        }
        pending.addLast(chunk);
        if (draining) {
            return false;
        }
        draining = true;
        return true;
    }

    synchronized long epoch() {
        return epoch;
    }

    /**
     * Next slice of at most {@code maxBytes} of the current utterance, moving to the next queued
     * one when it is exhausted. Chunks of cancelled turns are skipped.
     *
     * @return null when nothing playable remains
     */
    synchronized byte[] nextSlice(int maxBytes) {
        while (true) {
            if (current == null) {
                current = pending.pollFirst();
                offset = 0;
                if (current == null) {
                    return null;
                }
            }
            byte[] payload = current.payload();
            if (current.token().isCancelled() || offset >= payload.length) {
                current = null;
                continue;
            }
            int end = Math.min(offset + maxBytes, payload.length);
            byte[] slice = Arrays.copyOfRange(payload, offset, end);
            offset = end;
            return slice;
        }
    }

    /**
     * Advances the carrier playout cursor by one sent slice.
     *
     * @return chunks in flight (sent but not yet played out) after this send
     */
    synchronized int recordSent(long nowNanos, long sliceNanos, long chunkNanos) {
        playoutCursorNanos = Math.max(playoutCursorNanos, nowNanos) + sliceNanos;
        return inFlight(nowNanos, chunkNanos);
    }

    synchronized int inFlight(long nowNanos, long chunkNanos) {
        long ahead = playoutCursorNanos - nowNanos;
        if (ahead <= 0) {
            return 0;
        }
        return (int) ((ahead + chunkNanos - 1) / chunkNanos);
    }

    synchronized void markIdle() {
        draining = false;
    }

    /**
     * Drops everything queued, invalidates scheduled ticks and raises the cleared flag.
     * While the flag is up, audio from turns up to {@code throughTurn} is refused.
     *
     * @return number of queued items dropped, counting a partly played one
     */
    synchronized int clear(long throughTurn) {
        int dropped = pending.size() + (current != null ? 1 : 0);
        pending.clear();
        current = null;
        offset = 0;
        draining = false;
        epoch++;
        playoutCursorNanos = 0;
        clearedThroughTurn = Math.max(clearedThroughTurn, throughTurn);
        cleared = true;
        return dropped;
    }

    /**
     * Lowers the cleared flag if no newer clear happened since {@code expectedEpoch}.
     */
    synchronized void resetCleared(long expectedEpoch) {
        if (epoch == expectedEpoch) {
            cleared = false;
        }
    }

    /**
     * Drops everything without raising the cleared flag. Used on session teardown.
     */
    public synchronized void discard() {
        pending.clear();
        current = null;
        draining = false;
        epoch++;
    }

    public boolean isCleared() {
        return cleared;
    }

    /**
     * True while audio is queued or being paced out.
     */
    public synchronized boolean isActive() {
        return draining || current != null || !pending.isEmpty();
    }

    public synchronized int pendingCount() {
        return pending.size();
    }
}
