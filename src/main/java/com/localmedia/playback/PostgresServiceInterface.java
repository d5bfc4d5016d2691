package com.localmedia.playback;

import java.util.List;

/**
 * Durable structured store for resume memories, bookmarks and registered folder playlists.
 * <p>
 * Implementations serialize their own writes. Failures are reported as "nothing found" values
 * (null, empty list, -1) rather than exceptions.
 */
public interface PostgresServiceInterface {
    /**
     * Creates the playback_memory, bookmarks and music_playlists tables if they don't already exist.
     */
    void createTables();

    /**
     * Inserts or replaces the memory for {@code memory.fileIdentity()}.
     * @param memory record to store
     */
    void upsertMemory(PlaybackMemory memory);

    /**
     * @param fileIdentity absolute path or provider URI
     * @return the memory, or null if none is stored
     */
    PlaybackMemory getMemory(String fileIdentity);

    /**
     * Most recently saved memory whose display name matches, compared case-insensitively.
     * @param normalizedDisplayName display name as produced by {@link Utils#normalizeDisplayName(String)}
     * @return the memory, or null
     */
    PlaybackMemory getMemoryByDisplayName(String normalizedDisplayName);

    /** Most recently saved memory, or null. */
    PlaybackMemory getLatestMemory();

    /** All memories, newest first. */
    List<PlaybackMemory> getAllMemories();

    /** Memories of one folder, newest first. */
    List<PlaybackMemory> getMemoriesByFolder(String folderIdentity);

    void deleteMemory(String fileIdentity);

    void deleteAllMemories();

    /**
     * Inserts a new bookmark; never replaces an existing one.
     * @param bookmark bookmark to insert (its id is ignored)
     * @return generated id, or -1 if failed
     */
    long insertBookmark(Bookmark bookmark);

    void renameBookmark(long id, String label);

    /** Bookmarks of one file ordered by position. */
    List<Bookmark> getBookmarks(String fileIdentity);

    /** Bookmarks of one folder, newest first. */
    List<Bookmark> getBookmarksByFolder(String folderIdentity);

    void deleteBookmark(long id);

    void deleteAllBookmarks();

    /**
     * Registers a folder as a playlist. A folder that is already registered keeps its id, name and resume
     * point; only its track count is refreshed.
     * @return playlist id, or -1 if failed
     */
    long upsertPlaylist(String folderIdentity, String name, int trackCount);

    void updatePlaylistLastPlayed(long playlistId);

    /**
     * Records the file and position last saved inside a registered folder. Does nothing when the folder is
     * not registered.
     */
    void updatePlaylistProgress(String folderIdentity, String fileIdentity, long positionMs, long durationMs, String displayName);

    /** Retitles a playlist. */
    void updatePlaylistInfo(long playlistId, String name, String description);

    /** @return the playlist, or null */
    MusicPlaylist getPlaylist(long playlistId);

    /** Registered playlists, most recently played first. */
    List<MusicPlaylist> getPlaylists();

    void deletePlaylist(long playlistId);
}
