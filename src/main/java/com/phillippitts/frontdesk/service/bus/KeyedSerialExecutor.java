package com.phillippitts.frontdesk.service.bus;

import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;

/**
 * Runs tasks on a shared executor, one at a time per key, in submission order.
 *
 * <p>Tasks for different keys run concurrently. A failing task does not break the chain of its
 * key; callers are expected to handle their own errors.
 */
public final class KeyedSerialExecutor {

    private final Executor executor;
    private final Map<String, CompletableFuture<Void>> tails = new ConcurrentHashMap<>();

    public KeyedSerialExecutor(Executor executor) {
        this.executor = executor;
    }

    /**
     * Schedules {@code task} after every task previously submitted under {@code key}.
     *
     * @return future completing when the task finished (exceptionally if it threw)
     */
    public CompletableFuture<Void> execute(String key, Runnable task) {
        CompletableFuture<Void> done = new CompletableFuture<>();
        CompletableFuture<Void> previous = tails.put(key, done);
        CompletableFuture<Void> ready = previous == null
                ? CompletableFuture.completedFuture(null)
                : previous.exceptionally(e -> null);
        ready.thenRunAsync(task, executor).whenComplete((r, e) -> {
            tails.remove(key, done);
            if (e == null) {
                done.complete(null);
            } else {
                done.completeExceptionally(e);
            }
        });
        return done;
    }

    /** Keys with queued or running tasks. */
    public int activeKeys() {
        return tails.size();
    }
}
