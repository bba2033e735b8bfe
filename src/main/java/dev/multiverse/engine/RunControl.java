package dev.multiverse.engine;

import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Cancellation handle and progress counter for one multiverse run.
 * Cancelling stops scheduling new universes; universes already running finish normally.
 */
public final class RunControl {

    private final AtomicBoolean cancelled = new AtomicBoolean(false);
    private final AtomicInteger completed = new AtomicInteger();

    public static RunControl create() {
        return new RunControl();
    }

    public void cancel() {
        cancelled.set(true);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    public int completed() {
        return completed.get();
    }

    void markCompleted() {
        completed.incrementAndGet();
    }
}
