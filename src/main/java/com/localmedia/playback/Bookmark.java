package com.localmedia.playback;

/**
 * User-created, named position marker. Any number of bookmarks may exist per file; their lifecycle is
 * independent of {@link PlaybackMemory}.
 *
 * @param id store-assigned id (0 before insertion)
 */
public record Bookmark(
    long id,
    String fileIdentity,
    long positionMs,
    long durationMs,
    String label,
    long createdAt,
    String folderIdentity,
    String displayName
) {}
