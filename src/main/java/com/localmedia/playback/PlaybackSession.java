package com.localmedia.playback;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;
import java.util.function.Supplier;

/**
 * Guarded handle around one {@link MediaEngine} instance.
 * <p>
 * Once {@link #release()} has been called every command is a no-op and every query returns its fallback.
 * Runtime failures raised by the engine (typically calls racing with teardown) are logged at debug level
 * and swallowed.
 *
 * @author Playback Engine Team
 * @since 1.0
 */
public class PlaybackSession {
    private static final Logger logger = LoggerFactory.getLogger(PlaybackSession.class);
    private final MediaEngine engine;
    private final AtomicBoolean released = new AtomicBoolean(false);

    public PlaybackSession(MediaEngine engine) {
        if (engine == null) throw new IllegalArgumentException("MediaEngine cannot be null");
        this.engine = engine;
    }

    public void load(List<EngineMediaItem> items, int startIndex) {
        run("load", () -> engine.load(items, startIndex));
    }

    public void prepare() {
        run("prepare", engine::prepare);
    }

    public void play() {
        run("play", engine::play);
    }

    public void pause() {
        run("pause", engine::pause);
    }

    public void seekTo(int index, long positionMs) {
        run("seekTo", () -> engine.seekTo(index, Math.max(0L, positionMs)));
    }

    public void seekTo(long positionMs) {
        run("seekTo", () -> engine.seekTo(Math.max(0L, positionMs)));
    }

    public void seekToNext() {
        run("seekToNext", engine::seekToNext);
    }

    public void seekToPrevious() {
        run("seekToPrevious", engine::seekToPrevious);
    }

    public boolean hasNext() {
        return query("hasNextMediaItem", engine::hasNextMediaItem, false);
    }

    public boolean hasPrevious() {
        return query("hasPreviousMediaItem", engine::hasPreviousMediaItem, false);
    }

    /** Current position, never negative. */
    public long currentPosition() {
        return Math.max(0L, query("getCurrentPosition", engine::getCurrentPosition, 0L));
    }

    /** Duration, 0 while unknown. */
    public long duration() {
        return Math.max(0L, query("getDuration", engine::getDuration, 0L));
    }

    /**
     * Configures repeat and shuffle together, so the two flags always describe exactly one play mode.
     */
    public void applyPlayMode(PlayMode mode) {
        run("applyPlayMode", () -> {
            engine.setRepeatMode(mode.repeatMode());
            engine.setShuffleModeEnabled(mode.shuffle());
        });
    }

    public void setEventListener(Consumer<EngineEvent> listener) {
        run("setEventListener", () -> engine.setEventListener(listener));
    }

    public boolean isReleased() {
        return released.get();
    }

    /**
     * Releases the engine. Only the first call has an effect.
     */
    public void release() {
        if (!released.compareAndSet(false, true)) return;
        try {
            engine.setEventListener(null);
            engine.release();
            logger.debug("Engine released");
        } catch (RuntimeException e) {
            logger.debug("Engine release failed: {}", e.getMessage());
        }
    }

    private void run(String op, Runnable call) {
        if (released.get()) {
            logger.debug("Ignoring {} on released session", op);
            return;
        }
        try {
            call.run();
        } catch (RuntimeException e) {
            logger.debug("Engine {} failed: {}", op, e.getMessage());
        }
    }

    private <T> T query(String op, Supplier<T> call, T fallback) {
        if (released.get()) return fallback;
        try {
            T value = call.get();
            return value == null ? fallback : value;
        } catch (RuntimeException e) {
            logger.debug("Engine {} failed: {}", op, e.getMessage());
            return fallback;
        }
    }
}
