package com.localmedia.playback;

import java.util.List;
import java.util.function.Consumer;

/**
 * Resolves and persists resume memories, bookmarks and registered playlists.
 * <p>
 * All methods may block on the durable store and are called off the playback main context.
 */
public interface MemoryServiceInterface {

    /**
     * Finds where to resume an item: first by exact file identity, then by normalized display name, which
     * lets a memory saved in one addressing mode serve the same file opened in the other.
     * @param ref item about to play
     * @return memory, or null on a miss or store failure
     */
    PlaybackMemory resolveResume(MediaRef ref);

    /**
     * Durable upsert keyed by {@code fileIdentity}. When {@code folderIdentity} is a registered playlist,
     * its resume point moves to this file and position.
     */
    void saveMemory(String fileIdentity, long positionMs, long durationMs, String folderIdentity, String displayName);

    /**
     * Durable upsert raised by the audiobook timer; notifies save-event listeners with {@code isAutoSave = true}.
     */
    void autoSave(String fileIdentity, long positionMs, long durationMs, String folderIdentity, String displayName);

    /**
     * Saves an item immediately and notifies save-event listeners with {@code isAutoSave = false}.
     * The values are the ones captured by the caller; nothing is read from the live playback state.
     * @param ref item to save, null when nothing is loaded
     * @return what was saved, or null when {@code ref} is null
     */
    MemorySaveResult saveMemoryManually(MediaRef ref, long positionMs, long durationMs, String folderIdentity);

    /**
     * Inserts a bookmark. A blank label becomes {@code "Bookmark <position>"}.
     * @return bookmark id, or -1 if it could not be stored
     */
    long addBookmark(MediaRef ref, long positionMs, long durationMs, String label, String folderIdentity, String displayName);

    void renameBookmark(long id, String label);

    List<Bookmark> getBookmarks(String fileIdentity);

    List<Bookmark> getBookmarksByFolder(String folderIdentity);

    void deleteBookmark(long id);

    void deleteMemory(String fileIdentity);

    /** Removes every memory and bookmark. */
    void clearAll();

    PlaybackMemory getLatestMemory();

    List<PlaybackMemory> getMemoriesByFolder(String folderIdentity);

    /** Last fast snapshot, or null. */
    PlaybackMemory getQuickSnapshot();

    /**
     * Registers (or refreshes) a folder as a playlist.
     * @return playlist id, or -1
     */
    long importPlaylist(String folderIdentity, String name, int trackCount);

    void updatePlaylistLastPlayed(long playlistId);

    /** @return the playlist, or null */
    MusicPlaylist getPlaylist(long playlistId);

    List<MusicPlaylist> getPlaylists();

    /**
     * Where playback of a registered folder last stopped.
     * @return memory of the folder's last saved file, or null if the playlist is unknown or was never played
     */
    PlaybackMemory getPlaylistResumePoint(long playlistId);

    /** Retitles a playlist; a blank name is ignored. */
    void renamePlaylist(long playlistId, String name, String description);

    /** Unregisters a folder. Memories and bookmarks of its files are kept. */
    void deletePlaylist(long playlistId);

    /**
     * Registers a listener for {@link MemorySaveEvent}s. Listeners run on the thread that performed the save.
     */
    void addSaveEventListener(Consumer<MemorySaveEvent> listener);

    void removeSaveEventListener(Consumer<MemorySaveEvent> listener);
}
