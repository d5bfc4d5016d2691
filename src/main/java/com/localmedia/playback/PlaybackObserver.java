package com.localmedia.playback;

/**
 * Receives playback state changes from a {@link PlaybackService}. All callbacks run on the service's main
 * execution context; implementations should return quickly. Every method defaults to a no-op.
 */
public interface PlaybackObserver {

    default void onCurrentRefChanged(MediaRef ref, int index) {}

    default void onPositionChanged(long positionMs, long durationMs) {}

    default void onIsPlayingChanged(boolean isPlaying) {}

    default void onPlaylistChanged(Playlist playlist) {}

    default void onPlayModeChanged(PlayMode playMode) {}

    default void onAudioBookModeChanged(boolean enabled) {}

    default void onMemorySaved(MemorySaveEvent event) {}

    default void onMetadataLoaded(MediaRef ref, TrackMetadata metadata) {}

    /**
     * Result of the resume lookup made when the engine moves to a new item.
     * @param memory stored memory, or null when none exists
     */
    default void onResumeMemoryResolved(MediaRef ref, PlaybackMemory memory) {}
}
