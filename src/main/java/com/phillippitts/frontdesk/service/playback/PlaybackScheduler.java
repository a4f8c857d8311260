package com.phillippitts.frontdesk.service.playback;

import com.phillippitts.frontdesk.config.properties.PlaybackProperties;
import com.phillippitts.frontdesk.domain.AudioChunk;
import com.phillippitts.frontdesk.domain.CancellationToken;
import com.phillippitts.frontdesk.service.metrics.PipelineMetrics;
import com.phillippitts.frontdesk.service.session.CallSession;
import com.phillippitts.frontdesk.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.ThreadContext;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;

/**
 * Paces synthesized audio out to the carrier in fixed-size chunks.
 *
 * <p>Each session drains its own {@link PlaybackQueue} strictly in order: one utterance finishes
 * (or is cancelled) before the next starts. Chunks are sent from timer ticks on the playback
 * {@link TaskScheduler}; no thread sleeps between chunks.
 *
 * <p>Before every chunk the tick re-checks, under the queue monitor, that no clear happened since
 * it was scheduled and that the chunk's turn is not cancelled. {@link #clear} takes the same monitor,
 * so once it returns no chunk queued before it can reach the carrier.
 */
@Component
public class PlaybackScheduler {

    private static final Logger LOG = LogManager.getLogger(PlaybackScheduler.class);

    private final TaskScheduler taskScheduler;
    private final PlaybackProperties properties;
    private final PacingPolicy pacing;
    private final PipelineMetrics metrics;

    public PlaybackScheduler(@Qualifier("playbackTaskScheduler") TaskScheduler taskScheduler,
                             PlaybackProperties properties,
                             PipelineMetrics metrics) {
        this.taskScheduler = taskScheduler;
        this.properties = properties;
        this.pacing = PacingPolicy.from(properties);
        this.metrics = metrics;
    }

    /**
     * Queues one chunk of an utterance and starts draining if the session was idle. A start on a chunk
     * below {@link PlaybackProperties#getStartBufferBytes()} is delayed by the lead-in.
     */
    public void enqueue(CallSession session, AudioChunk chunk) {
        if (chunk.size() == 0) {
            LOG.debug("Ignoring empty audio chunk for session {}", session.id());
            return;
        }
        if (chunk.token().isCancelled() || session.isClosed()) {
            LOG.debug("Dropping audio of cancelled turn {} for session {}", chunk.token().turnId(), session.id());
            return;
        }
        PlaybackQueue queue = session.playback();
        boolean start;
        long epoch;
        synchronized (queue) {
            start = queue.offer(chunk);
            epoch = queue.epoch();
        }
        if (start) {
            Duration leadIn = chunk.size() < properties.getStartBufferBytes()
                    ? Duration.ofMillis(properties.getLeadInMs())
                    : Duration.ZERO;
            schedule(session, epoch, leadIn);
        }
    }

    /**
     * Drops the session's queued and in-progress audio and tells the carrier to flush its buffer.
     *
     * @param reason tag for logs and metrics
     * @return number of queued items dropped
     */
    public int clear(CallSession session, String reason) {
        PlaybackQueue queue = session.playback();
        CancellationToken turn = session.currentTurn();
        long staleThrough = turn.isCancelled() ? turn.turnId() : turn.turnId() - 1;
        int dropped;
        long epoch;
        synchronized (queue) {
            dropped = queue.clear(staleThrough);
            epoch = queue.epoch();
            if (!session.isClosed()) {
                session.channel().sendClear();
            }
        }
        metrics.recordPlaybackCleared(reason, dropped);
        LOG.info("Playback cleared: sessionId={}, reason={}, droppedItems={}", session.id(), reason, dropped);
        taskScheduler.schedule(() -> queue.resetCleared(epoch),
                Instant.now().plusMillis(properties.getClearResetMs()));
        return dropped;
    }

    PacingPolicy pacing() {
        return pacing;
    }

    private void schedule(CallSession session, long epoch, Duration delay) {
        taskScheduler.schedule(() -> tick(session, epoch), Instant.now().plus(delay));
    }

    void tick(CallSession session, long epoch) {
        PlaybackQueue queue = session.playback();
        long delayNanos;
        boolean throttled;
        ThreadContext.put("sessionId", session.id());
        try {
            synchronized (queue) {
                if (queue.epoch() != epoch) {
                    return;
                }
                if (session.isClosed()) {
                    queue.markIdle();
                    return;
                }
                byte[] slice = queue.nextSlice(properties.getChunkBytes());
                if (slice == null) {
                    queue.markIdle();
                    return;
                }
                if (!session.channel().sendAudio(slice)) {
                    LOG.warn("Carrier channel rejected audio; stopping playback for session {}", session.id());
                    queue.discard();
                    return;
                }
                long now = System.nanoTime();
                long sliceNanos = TimeUtils.playoutNanos(slice.length, properties.getSampleRate());
                int inFlight = queue.recordSent(now, sliceNanos, pacing.chunkPlayoutNanos());
                throttled = pacing.isThrottled(inFlight);
                delayNanos = pacing.delayNanos(inFlight);
            }
            metrics.incrementChunksSent();
            if (throttled) {
                metrics.incrementThrottled();
            }
            schedule(session, epoch, Duration.ofNanos(delayNanos));
        } finally {
            ThreadContext.remove("sessionId");
        }
    }
}
