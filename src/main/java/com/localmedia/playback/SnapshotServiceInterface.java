package com.localmedia.playback;

/**
 * Fast key-value store holding the single most recent position snapshot. Written on every tracker tick on the
 * playback main context, so {@link #put} must return quickly, must not wait for file I/O and must never throw.
 */
public interface SnapshotServiceInterface {
    /**
     * Replaces the last snapshot.
     * @param fileIdentity identity of the playing item
     * @param positionMs position at the time of the tick
     * @param durationMs known duration
     * @param folderIdentity source folder
     * @param displayName display name of the item
     */
    void put(String fileIdentity, long positionMs, long durationMs, String folderIdentity, String displayName);

    /**
     * @return the last snapshot, or null if none was ever written
     */
    PlaybackMemory getLast();

    /**
     * Blocks until the last snapshot has been persisted. A no-op for stores without a file.
     */
    void flush();
}
