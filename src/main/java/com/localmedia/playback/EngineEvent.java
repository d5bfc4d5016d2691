package com.localmedia.playback;

/**
 * Events emitted by a {@link MediaEngine}. The session controller consumes them as a tagged variant
 * ({@code instanceof} matching) instead of through overridden listener callbacks.
 */
public sealed interface EngineEvent permits EngineEvent.IsPlayingChanged, EngineEvent.StateChanged, EngineEvent.Transition {

    /** Engine-level playback state. */
    enum State {
        IDLE,
        BUFFERING,
        READY,
        ENDED
    }

    record IsPlayingChanged(boolean isPlaying) implements EngineEvent {}

    record StateChanged(State state) implements EngineEvent {}

    /**
     * The engine moved to another queue item.
     * @param index new queue index
     * @param mediaId {@link EngineMediaItem#mediaId()} of the new item, may be null
     */
    record Transition(int index, String mediaId) implements EngineEvent {}
}
