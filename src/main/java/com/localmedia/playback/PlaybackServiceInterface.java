package com.localmedia.playback;

import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Playback session controller: owns the engine handle and the active playlist, applies the play-mode
 * policy and turns engine events into state changes.
 * <p>
 * Every command is executed on the controller's single main context and returns a future completed
 * there. Library operations ({@code scan}, {@code listFolder}, ...) run on the I/O executor.
 */
public interface PlaybackServiceInterface extends AutoCloseable {

    /**
     * Replaces the active playlist, resumes the start item from its memory and starts playing.
     * @param playlist playlist to play
     * @param startIndex item to start with (clamped to the playlist)
     * @return completes once playback has been started, or once a newer load superseded this one
     */
    CompletableFuture<Void> load(Playlist playlist, int startIndex);

    /**
     * Scans a filesystem folder and plays it, starting at the given file (or the first one).
     */
    CompletableFuture<Void> loadFolderAndPlay(String folderPath, String startFilePath);

    /**
     * Plays an explicit list of files.
     */
    CompletableFuture<Void> loadFilesAndPlay(List<Path> files, int startIndex);

    /**
     * Scans a document tree and plays it, starting at the given document (or the first one).
     */
    CompletableFuture<Void> loadUrisAndPlay(String treeUri, String startUri);

    /**
     * Jumps to an item of the active playlist, resuming it from its memory.
     */
    CompletableFuture<Void> playAt(int index);

    CompletableFuture<Void> play();

    /**
     * Saves the current position, then pauses.
     */
    CompletableFuture<Void> pause();

    CompletableFuture<Void> seekTo(long positionMs);

    CompletableFuture<Void> next();

    CompletableFuture<Void> previous();

    /**
     * Cycles Sequential, Shuffle, RepeatOne.
     * @return the new mode
     */
    CompletableFuture<PlayMode> toggleMode();

    CompletableFuture<Void> setPlayMode(PlayMode mode);

    CompletableFuture<Void> setAudioBookMode(boolean enabled);

    /**
     * @return what was saved, or null when nothing is loaded
     */
    CompletableFuture<MemorySaveResult> saveMemoryManually();

    /**
     * Bookmarks the current item at the current position.
     * @return bookmark id, or -1
     */
    CompletableFuture<Long> addBookmark(String label);

    CompletableFuture<List<MediaRef>> scan(FolderRef folder);

    CompletableFuture<ScanResult> scanDiagnostic(FolderRef folder);

    CompletableFuture<FolderListing> listFolder(FolderRef folder);

    /**
     * Diagnostic scan of a folder, then registration of the folder as a playlist whose track count is the
     * number of playable files found.
     */
    CompletableFuture<ScanResult> importFolder(FolderRef folder);

    /**
     * Reloads the folder of the last snapshot and continues with the snapshot's file.
     * @return false when there is no snapshot or its folder has nothing playable
     */
    CompletableFuture<Boolean> resumeLastSession();

    /**
     * Re-scans a registered folder and loads it, starting at the file where playback in that folder last
     * stopped; that file resumes through the normal resume lookup.
     * @return true if the folder was loaded, false if the playlist is unknown or nothing is playable
     */
    CompletableFuture<Boolean> resumePlaylist(long playlistId);

    /**
     * Saves the position, stops tracking, cancels pending lookups and releases the engine. A later
     * {@link #load} creates a fresh engine session.
     */
    CompletableFuture<Void> release();

    PlaybackState getState();

    Playlist getPlaylist();

    void addObserver(PlaybackObserver observer);

    void removeObserver(PlaybackObserver observer);

    /**
     * Releases and shuts the executors down.
     */
    @Override
    void close();
}
