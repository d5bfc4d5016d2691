package com.localmedia.playback;

import java.util.List;
import java.util.function.Consumer;

/**
 * Audio/video decoding and rendering engine driven by the {@link PlaybackService}.
 * <p>
 * Implementations may throw {@link IllegalStateException} once released; the controller never calls an
 * engine directly but through a {@link PlaybackSession}, which turns such calls into no-ops.
 * Events are delivered through the listener registered with {@link #setEventListener(Consumer)}, in the
 * order the engine produces them, on any thread.
 */
public interface MediaEngine {

    /**
     * Replaces the engine's queue.
     * @param items engine media items, in playlist order
     * @param startIndex item to start from
     */
    void load(List<EngineMediaItem> items, int startIndex);

    void prepare();

    void play();

    void pause();

    /** Seeks to a position within the given queue item. */
    void seekTo(int index, long positionMs);

    /** Seeks within the current item. */
    void seekTo(long positionMs);

    void seekToNext();

    void seekToPrevious();

    boolean hasNextMediaItem();

    boolean hasPreviousMediaItem();

    /** Current position in ms; may be negative while nothing is loaded. */
    long getCurrentPosition();

    /** Duration in ms; may be negative while unknown. */
    long getDuration();

    void setRepeatMode(RepeatMode repeatMode);

    void setShuffleModeEnabled(boolean enabled);

    void setEventListener(Consumer<EngineEvent> listener);

    void release();
}
