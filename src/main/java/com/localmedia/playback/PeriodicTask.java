package com.localmedia.playback;

import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * A repeating job paired with its cancellation token. A tick that starts after {@link #cancel()} sees
 * {@link #isCancelled()} and must return before writing anything.
 */
final class PeriodicTask {
    private final AtomicBoolean cancelled = new AtomicBoolean(false);
    private volatile ScheduledFuture<?> future;

    /**
     * Schedules {@code body} with a fixed delay between runs, so runs never overlap.
     */
    void scheduleOn(ScheduledExecutorService scheduler, long periodMs, Runnable body) {
        if (cancelled.get()) return;
        future = scheduler.scheduleWithFixedDelay(body, periodMs, periodMs, TimeUnit.MILLISECONDS);
    }

    void cancel() {
        cancelled.set(true);
        ScheduledFuture<?> f = future;
        if (f != null) f.cancel(false);
    }

    boolean isCancelled() {
        return cancelled.get();
    }
}
