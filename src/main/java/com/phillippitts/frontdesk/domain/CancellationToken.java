package com.phillippitts.frontdesk.domain;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cancellation token for one conversational turn.
 *
 * <p>Threaded through routing, generation, synthesis and playback. Every stage checks
 * {@link #isCancelled()} at each yield point; blocking waits register an {@link #onCancel(Runnable)}
 * callback so they resolve immediately instead of running into their timeout.
 *
 * <p>Cancellation is one-way and idempotent.
 */
public final class CancellationToken {

    private static final Logger LOG = LogManager.getLogger(CancellationToken.class);

    private final long turnId;
    private volatile boolean cancelled;
    private final AtomicBoolean failed = new AtomicBoolean();
    private final List<Runnable> callbacks = new ArrayList<>();

    public CancellationToken(long turnId) {
        this.turnId = turnId;
    }

    /**
     * A token that is already cancelled, for messages of a turn that is no longer current.
     */
    public static CancellationToken cancelled(long turnId) {
        CancellationToken token = new CancellationToken(turnId);
        token.cancelled = true;
        return token;
    }

    public long turnId() {
        return turnId;
    }

    public boolean isCancelled() {
        return cancelled;
    }

    /**
     * Records that a stage of this turn failed, so the turn ends with the apology instead of the rest
     * of its reply.
     *
     * @return true for the first failure only; that caller owes the apology
     */
    public boolean markFailed() {
        return failed.compareAndSet(false, true);
    }

    public boolean hasFailed() {
        return failed.get();
    }

    /**
     * Cancels the token and runs registered callbacks on the calling thread.
     *
     * @return true if this call cancelled the token, false if it was already cancelled
     */
    public boolean cancel() {
        List<Runnable> toRun;
        synchronized (this) {
            if (cancelled) {
                return false;
            }
            cancelled = true;
            toRun = new ArrayList<>(callbacks);
            callbacks.clear();
        }
        for (Runnable action : toRun) {
            try {
                action.run();
            } catch (RuntimeException e) {
                LOG.warn("Cancellation callback failed for turn {}", turnId, e);
            }
        }
        return true;
    }

    /**
     * Registers an action to run on cancellation. Runs it immediately when already cancelled.
     */
    public void onCancel(Runnable action) {
        boolean runNow;
        synchronized (this) {
            runNow = cancelled;
            if (!runNow) {
                callbacks.add(action);
            }
        }
        if (runNow) {
            action.run();
        }
    }

    @Override
    public String toString() {
        return "CancellationToken[turn=" + turnId + ", cancelled=" + cancelled + ", failed=" + failed.get() + ']';
    }
}
