package com.localmedia.playback;

/**
 * Persisted "where the user left off" record. One durable record per {@code fileIdentity};
 * writes are upserts, the latest one wins.
 *
 * @param fileIdentity absolute path or provider URI of the file
 * @param positionMs last known position
 * @param durationMs duration known at save time
 * @param folderIdentity source folder path or tree URI (used for grouping)
 * @param displayName file name without extension (used for the cross-mode fallback lookup)
 * @param savedAt epoch millis of the write
 */
public record PlaybackMemory(
    String fileIdentity,
    long positionMs,
    long durationMs,
    String folderIdentity,
    String displayName,
    long savedAt
) {}
