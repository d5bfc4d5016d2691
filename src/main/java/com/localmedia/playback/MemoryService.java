package com.localmedia.playback;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * Memory resolver on top of the durable store and the fast snapshot store.
 * <p>
 * Workflow:
 * <ul>
 *   <li>Resume lookups try the exact file identity, then fall back to the normalized display name.</li>
 *   <li>Saves are upserts: one memory per file, the latest write wins.</li>
 *   <li>Bookmarks are always inserted; many may exist per file.</li>
 * </ul>
 * <p>
 * The display-name fallback is a heuristic: two different files called {@code chapter01.mp3} in different
 * folders share a resume position when one of them has no memory of its own.
 * <p>
 * Error Handling: store failures are logged and reported as a miss (null, empty list, -1). Exceptions thrown
 * by save-event listeners are logged and do not fail the save.
 *
 * @author Playback Engine Team
 * @since 1.0
 */
public class MemoryService implements MemoryServiceInterface {
    private static final Logger logger = LoggerFactory.getLogger(MemoryService.class);
    private final PostgresServiceInterface store;
    private final SnapshotServiceInterface snapshots;
    private final List<Consumer<MemorySaveEvent>> listeners = new CopyOnWriteArrayList<>();

    public MemoryService(PostgresServiceInterface store, SnapshotServiceInterface snapshots) {
        if (store == null) throw new IllegalArgumentException("Durable store cannot be null");
        if (snapshots == null) throw new IllegalArgumentException("Snapshot store cannot be null");
        this.store = store;
        this.snapshots = snapshots;
    }

    @Override
    public PlaybackMemory resolveResume(MediaRef ref) {
        if (ref == null) return null;
        try {
            PlaybackMemory exact = store.getMemory(ref.identity());
            if (exact != null) {
                logger.debug("Resume {} at {} ms (exact match)", ref.identity(), exact.positionMs());
                return exact;
            }
            String key = Utils.normalizeDisplayName(ref.displayName());
            if (key.isEmpty()) return null;
            PlaybackMemory byName = store.getMemoryByDisplayName(key);
            if (byName != null) {
                logger.debug("Resume {} at {} ms (display name match with {})", ref.identity(), byName.positionMs(), byName.fileIdentity());
            }
            return byName;
        } catch (RuntimeException e) {
            logger.warn("Resume lookup failed for {}: {}", ref.identity(), e.getMessage());
            return null;
        }
    }

    @Override
    public void saveMemory(String fileIdentity, long positionMs, long durationMs, String folderIdentity, String displayName) {
        if (fileIdentity == null || fileIdentity.isBlank()) {
            logger.debug("Skipping memory save without file identity");
            return;
        }
        long position = Math.max(0L, positionMs);
        long duration = Math.max(0L, durationMs);
        try {
            store.upsertMemory(new PlaybackMemory(fileIdentity, position, duration, folderIdentity, displayName,
                System.currentTimeMillis()));
            if (folderIdentity != null && !folderIdentity.isBlank()) {
                store.updatePlaylistProgress(folderIdentity, fileIdentity, position, duration, displayName);
            }
        } catch (RuntimeException e) {
            logger.warn("Failed to save memory for {}: {}", fileIdentity, e.getMessage());
        }
    }

    @Override
    public void autoSave(String fileIdentity, long positionMs, long durationMs, String folderIdentity, String displayName) {
        if (fileIdentity == null || fileIdentity.isBlank()) return;
        saveMemory(fileIdentity, positionMs, durationMs, folderIdentity, displayName);
        logger.info("Audiobook auto-save: {} at {}", displayName, Utils.formatPosition(positionMs));
        publish(new MemorySaveEvent(fileIdentity, positionMs, displayName, true));
    }

    @Override
    public MemorySaveResult saveMemoryManually(MediaRef ref, long positionMs, long durationMs, String folderIdentity) {
        if (ref == null) {
            logger.warn("Manual save requested with nothing loaded");
            return null;
        }
        long position = Math.max(0L, positionMs);
        long duration = Math.max(0L, durationMs);
        saveMemory(ref.identity(), position, duration, folderIdentity, ref.displayName());
        snapshots.put(ref.identity(), position, duration, folderIdentity, ref.displayName());
        logger.info("Saved memory for {} at {}", ref.displayName(), Utils.formatPosition(position));
        publish(new MemorySaveEvent(ref.identity(), position, ref.displayName(), false));
        return new MemorySaveResult(ref.identity(), position, duration, ref.displayName());
    }

    @Override
    public long addBookmark(MediaRef ref, long positionMs, long durationMs, String label, String folderIdentity, String displayName) {
        if (ref == null) {
            logger.warn("Cannot add bookmark without an item");
            return -1;
        }
        String name = label == null || label.isBlank() ? "Bookmark " + Utils.formatPosition(positionMs) : label.trim();
        Bookmark bookmark = new Bookmark(0L, ref.identity(), Math.max(0L, positionMs), Math.max(0L, durationMs), name,
            System.currentTimeMillis(), folderIdentity, displayName == null ? ref.displayName() : displayName);
        try {
            return store.insertBookmark(bookmark);
        } catch (RuntimeException e) {
            logger.warn("Failed to add bookmark for {}: {}", ref.identity(), e.getMessage());
            return -1;
        }
    }

    @Override
    public void renameBookmark(long id, String label) {
        if (label == null || label.isBlank()) {
            logger.warn("Ignoring blank label for bookmark {}", id);
            return;
        }
        store.renameBookmark(id, label.trim());
    }

    @Override
    public List<Bookmark> getBookmarks(String fileIdentity) {
        return fileIdentity == null ? List.of() : store.getBookmarks(fileIdentity);
    }

    @Override
    public List<Bookmark> getBookmarksByFolder(String folderIdentity) {
        return folderIdentity == null ? List.of() : store.getBookmarksByFolder(folderIdentity);
    }

    @Override
    public void deleteBookmark(long id) {
        store.deleteBookmark(id);
    }

    @Override
    public void deleteMemory(String fileIdentity) {
        if (fileIdentity == null) return;
        store.deleteMemory(fileIdentity);
    }

    @Override
    public void clearAll() {
        store.deleteAllMemories();
        store.deleteAllBookmarks();
        logger.info("Cleared all memories and bookmarks");
    }

    @Override
    public PlaybackMemory getLatestMemory() {
        return store.getLatestMemory();
    }

    @Override
    public List<PlaybackMemory> getMemoriesByFolder(String folderIdentity) {
        return folderIdentity == null ? List.of() : store.getMemoriesByFolder(folderIdentity);
    }

    @Override
    public PlaybackMemory getQuickSnapshot() {
        return snapshots.getLast();
    }

    @Override
    public long importPlaylist(String folderIdentity, String name, int trackCount) {
        return store.upsertPlaylist(folderIdentity, name, trackCount);
    }

    @Override
    public void updatePlaylistLastPlayed(long playlistId) {
        if (playlistId <= 0) return;
        store.updatePlaylistLastPlayed(playlistId);
    }

    @Override
    public MusicPlaylist getPlaylist(long playlistId) {
        return playlistId <= 0 ? null : store.getPlaylist(playlistId);
    }

    @Override
    public List<MusicPlaylist> getPlaylists() {
        return store.getPlaylists();
    }

    @Override
    public PlaybackMemory getPlaylistResumePoint(long playlistId) {
        MusicPlaylist playlist = getPlaylist(playlistId);
        if (playlist == null || !playlist.hasResumePoint()) return null;
        return new PlaybackMemory(playlist.lastFileIdentity(), playlist.lastPositionMs(), playlist.lastDurationMs(),
            playlist.folderIdentity(), playlist.lastDisplayName(), playlist.lastPlayedAt());
    }

    @Override
    public void renamePlaylist(long playlistId, String name, String description) {
        if (name == null || name.isBlank()) {
            logger.warn("Ignoring blank name for playlist {}", playlistId);
            return;
        }
        store.updatePlaylistInfo(playlistId, name.trim(), description == null ? "" : description.trim());
    }

    @Override
    public void deletePlaylist(long playlistId) {
        store.deletePlaylist(playlistId);
        logger.info("Deleted playlist {}", playlistId);
    }

    @Override
    public void addSaveEventListener(Consumer<MemorySaveEvent> listener) {
        if (listener != null) listeners.add(listener);
    }

    @Override
    public void removeSaveEventListener(Consumer<MemorySaveEvent> listener) {
        listeners.remove(listener);
    }

    private void publish(MemorySaveEvent event) {
        for (Consumer<MemorySaveEvent> listener : listeners) {
            try {
                listener.accept(event);
            } catch (RuntimeException e) {
                logger.warn("Save event listener failed: {}", e.getMessage());
            }
        }
    }
}
