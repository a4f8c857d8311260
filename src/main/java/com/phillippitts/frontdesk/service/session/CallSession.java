package com.phillippitts.frontdesk.service.session;

import com.phillippitts.frontdesk.domain.CancellationToken;
import com.phillippitts.frontdesk.service.carrier.CarrierChannel;
import com.phillippitts.frontdesk.service.interruption.BargeInStateMachine;
import com.phillippitts.frontdesk.service.playback.PlaybackQueue;
import com.phillippitts.frontdesk.service.stt.SttConnection;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * State of one active call. Owned by {@link SessionRegistry}; every pipeline stage reads and
 * mutates it, nothing is shared with other sessions.
 *
 * <p>Holds the conversation history, the current turn's cancellation token, the
 * active-generation flag, the playback queue, barge-in state and the provider connections
 * to release on teardown. {@link #close()} releases everything exactly once.
 */
public final class CallSession {

    private static final Logger LOG = LogManager.getLogger(CallSession.class);

    private final String id;
    private final String callSid;
    private final String streamSid;
    private final CarrierChannel channel;
    private final Instant startedAt = Instant.now();
    private final ConversationHistory history;
    private final PlaybackQueue playback = new PlaybackQueue();
    private final BargeInStateMachine bargeIn = new BargeInStateMachine();

    private final AtomicLong turnCounter = new AtomicLong();
    private final AtomicReference<CancellationToken> currentTurn;
    private final AtomicBoolean generationActive = new AtomicBoolean();
    private final AtomicInteger pendingSynthesis = new AtomicInteger();
    private final Object synthesisLock = new Object();
    private Runnable onSynthesisDrained;
    private final AtomicBoolean closed = new AtomicBoolean();
    private final List<AutoCloseable> resources = new ArrayList<>();
    private volatile SttConnection recognizer;

    CallSession(String id, String callSid, String streamSid, CarrierChannel channel, ConversationHistory history) {
        this.id = Objects.requireNonNull(id, "id must not be null");
        this.callSid = Objects.requireNonNull(callSid, "callSid must not be null");
        this.streamSid = streamSid;
        this.channel = Objects.requireNonNull(channel, "channel must not be null");
        this.history = Objects.requireNonNull(history, "history must not be null");
        this.currentTurn = new AtomicReference<>(new CancellationToken(0));
    }

    public String id() {
        return id;
    }

    public String callSid() {
        return callSid;
    }

    public String streamSid() {
        return streamSid;
    }

    public CarrierChannel channel() {
        return channel;
    }

    public Instant startedAt() {
        return startedAt;
    }

    public ConversationHistory history() {
        return history;
    }

    public PlaybackQueue playback() {
        return playback;
    }

    public BargeInStateMachine bargeIn() {
        return bargeIn;
    }

    /**
     * Starts a new turn: cancels the previous turn's token and installs a fresh one.
     */
    public CancellationToken beginTurn() {
        CancellationToken next = new CancellationToken(turnCounter.incrementAndGet());
        CancellationToken previous = currentTurn.getAndSet(next);
        previous.cancel();
        if (closed.get()) {
            next.cancel();
        }
        return next;
    }

    public CancellationToken currentTurn() {
        return currentTurn.get();
    }

    /**
     * The live token of {@code turnId} if it is still the current turn, otherwise a cancelled one.
     * Used when a message naming its turn by id comes back from the broker.
     */
    public CancellationToken tokenFor(long turnId) {
        CancellationToken current = currentTurn.get();
        return current.turnId() == turnId ? current : CancellationToken.cancelled(turnId);
    }

    /**
     * Claims the single generation slot of this session.
     *
     * @return false if a generation is already active
     */
    public boolean tryStartGeneration() {
        return generationActive.compareAndSet(false, true);
    }

    public void endGeneration() {
        generationActive.set(false);
    }

    public boolean isGenerating() {
        return generationActive.get();
    }

    public void synthesisQueued() {
        synchronized (synthesisLock) {
            pendingSynthesis.incrementAndGet();
        }
    }

    public void synthesisFinished() {
        Runnable action = null;
        synchronized (synthesisLock) {
            if (pendingSynthesis.updateAndGet(n -> n > 0 ? n - 1 : 0) == 0) {
                action = onSynthesisDrained;
                onSynthesisDrained = null;
            }
        }
        runQuietly(action);
    }

    /**
     * Runs {@code action} once no synthesis request is pending: at once if none is, otherwise on the
     * thread finishing the last one. Registering again runs the previously waiting action first, so
     * a superseded turn still reports; teardown runs whatever is waiting.
     */
    public void whenSynthesisDrained(Runnable action) {
        Runnable superseded;
        boolean runNow;
        synchronized (synthesisLock) {
            superseded = onSynthesisDrained;
            runNow = pendingSynthesis.get() == 0 || closed.get();
            onSynthesisDrained = runNow ? null : action;
        }
        runQuietly(superseded);
        if (runNow) {
            runQuietly(action);
        }
    }

    public int pendingSynthesis() {
        return pendingSynthesis.get();
    }

    /**
     * True while the caller is hearing, or about to hear, system output for this session.
     */
    public boolean hasActiveOutput() {
        return generationActive.get() || pendingSynthesis.get() > 0 || playback.isActive();
    }

    /**
     * Registers a resource to close on teardown. Closes it at once if the session already ended.
     */
    public void attach(AutoCloseable resource) {
        boolean alreadyClosed;
        synchronized (resources) {
            alreadyClosed = closed.get();
            if (!alreadyClosed) {
                resources.add(resource);
            }
        }
        if (alreadyClosed) {
            closeQuietly(resource);
        }
    }

    /**
     * Binds the session's streaming recognizer and registers it for teardown.
     */
    public void bindRecognizer(SttConnection connection) {
        this.recognizer = connection;
        attach(connection);
    }

    public Optional<SttConnection> recognizer() {
        SttConnection current = recognizer;
        return current == null || closed.get() ? Optional.empty() : Optional.of(current);
    }

    public boolean isClosed() {
        return closed.get();
    }

    /**
     * Tears the session down: cancels the current turn, drops queued playback, closes provider
     * connections (newest first) and the carrier channel.
     *
     * @return true on the first call, false on every later call
     */
    boolean close() {
        List<AutoCloseable> toClose;
        synchronized (resources) {
            if (!closed.compareAndSet(false, true)) {
                return false;
            }
            toClose = new ArrayList<>(resources);
            resources.clear();
        }
        currentTurn.get().cancel();
        Runnable waiting;
        synchronized (synthesisLock) {
            waiting = onSynthesisDrained;
            onSynthesisDrained = null;
        }
        runQuietly(waiting);
        playback.discard();
        for (int i = toClose.size() - 1; i >= 0; i--) {
            closeQuietly(toClose.get(i));
        }
        channel.close();
        return true;
    }

    private void runQuietly(Runnable action) {
        if (action == null) {
            return;
        }
        try {
            action.run();
        } catch (RuntimeException e) {
            LOG.warn("Synthesis drain action failed for session {}", id, e);
        }
    }

    private void closeQuietly(AutoCloseable resource) {
        try {
            resource.close();
        } catch (Exception e) {
            LOG.warn("Failed to close session resource {} for session {}", resource, id, e);
        }
    }

    @Override
    public String toString() {
        return "CallSession[id=" + id + ", callSid=" + callSid + ", closed=" + closed.get() + ']';
    }
}
