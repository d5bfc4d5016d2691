package com.localmedia.playback;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;

/**
 * Samples the playing position at a fixed interval and persists it.
 * <p>
 * Workflow, per tick:
 * <ul>
 *   <li>read position and duration through the session and publish them to the state and observers;</li>
 *   <li>write the fast snapshot;</li>
 *   <li>every {@code durableSaveEveryTicks}-th tick, dispatch a durable write to the serial writer;</li>
 *   <li>in audiobook mode, accumulate played time and trigger an auto-save once the interval is reached.</li>
 * </ul>
 * <p>
 * At most one {@link PeriodicTask} is active; {@link #start} cancels the previous one. Ticks run on the
 * single main scheduler and therefore never overlap each other or controller code. The audiobook
 * accumulator is kept across pause/resume and reset only when it fires or audiobook mode is toggled.
 *
 * @author Playback Engine Team
 * @since 1.0
 */
public class PositionTracker {
    private static final Logger logger = LoggerFactory.getLogger(PositionTracker.class);
    private final PlaybackState state;
    private final SnapshotServiceInterface snapshots;
    private final MemoryServiceInterface memory;
    private final Executor writer;
    private final ScheduledExecutorService main;
    private final EngineConfig config;
    private final PlaybackObserver observer;

    private PeriodicTask task;
    private PlaybackSession session;
    private int ticksSinceDurableSave;
    private long tickCount;
    private long audiobookAccumulatedMs;

    public PositionTracker(PlaybackState state, SnapshotServiceInterface snapshots, MemoryServiceInterface memory,
                           Executor writer, ScheduledExecutorService main, EngineConfig config, PlaybackObserver observer) {
        this.state = state;
        this.snapshots = snapshots;
        this.memory = memory;
        this.writer = writer;
        this.main = main;
        this.config = config;
        this.observer = observer;
    }

    /**
     * Starts sampling the given session, replacing any running task.
     */
    public void start(PlaybackSession session) {
        PeriodicTask next = prepare(session);
        next.scheduleOn(main, config.tickIntervalMs(), () -> tick(next));
        logger.debug("Position tracking started every {} ms", config.tickIntervalMs());
    }

    /**
     * Installs a new, not yet scheduled task for the session.
     */
    PeriodicTask prepare(PlaybackSession session) {
        stop();
        this.session = session;
        this.ticksSinceDurableSave = 0;
        this.task = new PeriodicTask();
        return task;
    }

    /**
     * Stops sampling. A tick already queued sees the cancelled token and does nothing.
     */
    public void stop() {
        if (task != null) {
            task.cancel();
            task = null;
            logger.debug("Position tracking stopped after {} ticks", tickCount);
        }
    }

    public boolean isRunning() {
        return task != null && !task.isCancelled();
    }

    void tick(PeriodicTask current) {
        if (current.isCancelled() || current != task) return;
        PlaybackSession s = session;
        if (s == null || s.isReleased()) return;
        MediaRef ref = state.getCurrentRef();
        if (ref == null) return;

        long position = s.currentPosition();
        long duration = s.duration();
        state.setPosition(position, duration);
        observer.onPositionChanged(position, duration);
        tickCount++;

        String folder = state.getFolderIdentity();
        snapshots.put(ref.identity(), position, duration, folder, ref.displayName());

        if (++ticksSinceDurableSave >= config.durableSaveEveryTicks()) {
            ticksSinceDurableSave = 0;
            dispatch(() -> memory.saveMemory(ref.identity(), position, duration, folder, ref.displayName()));
        }

        if (state.isAudiobookMode() && state.isPlaying()) {
            audiobookAccumulatedMs += config.tickIntervalMs();
            if (audiobookAccumulatedMs >= config.audiobookSaveIntervalMs()) {
                audiobookAccumulatedMs = 0L;
                dispatch(() -> memory.autoSave(ref.identity(), position, duration, folder, ref.displayName()));
            }
        }
    }

    /** Restarts the audiobook interval from zero. */
    public void resetAudiobookAccumulator() {
        audiobookAccumulatedMs = 0L;
    }

    long getAudiobookAccumulatedMs() {
        return audiobookAccumulatedMs;
    }

    long getTickCount() {
        return tickCount;
    }

    private void dispatch(Runnable write) {
        try {
            writer.execute(write);
        } catch (RejectedExecutionException e) {
            logger.debug("Durable write rejected, executor shut down: {}", e.getMessage());
        }
    }
}
