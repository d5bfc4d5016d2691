package com.localmedia.playback;

import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Collectors;

/**
 * Durable store double with the same semantics as {@link PostgresService}: memories keyed by file identity,
 * bookmarks by generated id, playlists unique per folder.
 */
class InMemoryStore implements PostgresServiceInterface {
    private final Map<String, PlaybackMemory> memories = new LinkedHashMap<>();
    private final Map<Long, Bookmark> bookmarks = new LinkedHashMap<>();
    private final Map<String, MusicPlaylist> playlists = new LinkedHashMap<>();
    private final AtomicLong ids = new AtomicLong();
    final AtomicInteger upserts = new AtomicInteger();

    @Override
    public void createTables() {
    }

    @Override
    public synchronized void upsertMemory(PlaybackMemory memory) {
        upserts.incrementAndGet();
        memories.put(memory.fileIdentity(), memory);
    }

    @Override
    public synchronized PlaybackMemory getMemory(String fileIdentity) {
        return memories.get(fileIdentity);
    }

    @Override
    public synchronized PlaybackMemory getMemoryByDisplayName(String normalizedDisplayName) {
        return memories.values().stream()
            .filter(m -> m.displayName() != null && m.displayName().toLowerCase(Locale.ROOT).equals(normalizedDisplayName))
            .max(Comparator.comparingLong(PlaybackMemory::savedAt))
            .orElse(null);
    }

    @Override
    public synchronized PlaybackMemory getLatestMemory() {
        return memories.values().stream().max(Comparator.comparingLong(PlaybackMemory::savedAt)).orElse(null);
    }

    @Override
    public synchronized List<PlaybackMemory> getAllMemories() {
        return memories.values().stream()
            .sorted(Comparator.comparingLong(PlaybackMemory::savedAt).reversed())
            .collect(Collectors.toList());
    }

    @Override
    public synchronized List<PlaybackMemory> getMemoriesByFolder(String folderIdentity) {
        return getAllMemories().stream()
            .filter(m -> folderIdentity.equals(m.folderIdentity()))
            .collect(Collectors.toList());
    }

    @Override
    public synchronized void deleteMemory(String fileIdentity) {
        memories.remove(fileIdentity);
    }

    @Override
    public synchronized void deleteAllMemories() {
        memories.clear();
    }

    @Override
    public synchronized long insertBookmark(Bookmark bookmark) {
        long id = ids.incrementAndGet();
        bookmarks.put(id, new Bookmark(id, bookmark.fileIdentity(), bookmark.positionMs(), bookmark.durationMs(),
            bookmark.label(), bookmark.createdAt(), bookmark.folderIdentity(), bookmark.displayName()));
        return id;
    }

    @Override
    public synchronized void renameBookmark(long id, String label) {
        Bookmark b = bookmarks.get(id);
        if (b == null) return;
        bookmarks.put(id, new Bookmark(id, b.fileIdentity(), b.positionMs(), b.durationMs(), label, b.createdAt(),
            b.folderIdentity(), b.displayName()));
    }

    @Override
    public synchronized List<Bookmark> getBookmarks(String fileIdentity) {
        return bookmarks.values().stream()
            .filter(b -> b.fileIdentity().equals(fileIdentity))
            .sorted(Comparator.comparingLong(Bookmark::positionMs))
            .collect(Collectors.toList());
    }

    @Override
    public synchronized List<Bookmark> getBookmarksByFolder(String folderIdentity) {
        return bookmarks.values().stream()
            .filter(b -> folderIdentity.equals(b.folderIdentity()))
            .sorted(Comparator.comparingLong(Bookmark::createdAt).thenComparingLong(Bookmark::id).reversed())
            .collect(Collectors.toList());
    }

    @Override
    public synchronized void deleteBookmark(long id) {
        bookmarks.remove(id);
    }

    @Override
    public synchronized void deleteAllBookmarks() {
        bookmarks.clear();
    }

    @Override
    public synchronized long upsertPlaylist(String folderIdentity, String name, int trackCount) {
        MusicPlaylist existing = playlists.get(folderIdentity);
        if (existing != null) {
            playlists.put(folderIdentity, new MusicPlaylist(existing.id(), folderIdentity, existing.name(), existing.description(),
                trackCount, existing.importedAt(), existing.lastPlayedAt(), existing.lastFileIdentity(),
                existing.lastPositionMs(), existing.lastDurationMs(), existing.lastDisplayName()));
            return existing.id();
        }
        long id = ids.incrementAndGet();
        playlists.put(folderIdentity, new MusicPlaylist(id, folderIdentity, name, "", trackCount,
            System.currentTimeMillis(), 0L, null, 0L, 0L, null));
        return id;
    }

    @Override
    public synchronized void updatePlaylistLastPlayed(long playlistId) {
        MusicPlaylist p = getPlaylist(playlistId);
        if (p == null) return;
        playlists.put(p.folderIdentity(), new MusicPlaylist(p.id(), p.folderIdentity(), p.name(), p.description(), p.trackCount(),
            p.importedAt(), System.currentTimeMillis(), p.lastFileIdentity(), p.lastPositionMs(), p.lastDurationMs(),
            p.lastDisplayName()));
    }

    @Override
    public synchronized void updatePlaylistProgress(String folderIdentity, String fileIdentity, long positionMs,
                                                    long durationMs, String displayName) {
        MusicPlaylist p = playlists.get(folderIdentity);
        if (p == null) return;
        playlists.put(folderIdentity, new MusicPlaylist(p.id(), folderIdentity, p.name(), p.description(), p.trackCount(),
            p.importedAt(), System.currentTimeMillis(), fileIdentity, positionMs, durationMs, displayName));
    }

    @Override
    public synchronized void updatePlaylistInfo(long playlistId, String name, String description) {
        MusicPlaylist p = getPlaylist(playlistId);
        if (p == null) return;
        playlists.put(p.folderIdentity(), new MusicPlaylist(p.id(), p.folderIdentity(), name, description, p.trackCount(),
            p.importedAt(), p.lastPlayedAt(), p.lastFileIdentity(), p.lastPositionMs(), p.lastDurationMs(),
            p.lastDisplayName()));
    }

    @Override
    public synchronized MusicPlaylist getPlaylist(long playlistId) {
        for (MusicPlaylist p : playlists.values()) {
            if (p.id() == playlistId) return p;
        }
        return null;
    }

    @Override
    public synchronized List<MusicPlaylist> getPlaylists() {
        return playlists.values().stream()
            .sorted(Comparator.comparingLong(MusicPlaylist::lastPlayedAt).reversed())
            .collect(Collectors.toList());
    }

    @Override
    public synchronized void deletePlaylist(long playlistId) {
        playlists.values().removeIf(p -> p.id() == playlistId);
    }

    synchronized int memoryCount() {
        return memories.size();
    }
}
