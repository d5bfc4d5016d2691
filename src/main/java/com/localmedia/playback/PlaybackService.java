package com.localmedia.playback;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;
import java.util.function.Supplier;

/**
 * Playback session controller.
 * <p>
 * Workflow:
 * <ul>
 *   <li>{@link #load} persists the outgoing position, swaps the single playlist reference, loads the engine,
 *   resolves the start item's memory on the I/O executor and only then seeks and plays.</li>
 *   <li>Engine events are queued onto the main context in arrival order. {@code isPlaying} starts and stops
 *   the {@link PositionTracker}; a track transition publishes the new item, loads its metadata and publishes
 *   its resume memory.</li>
 *   <li>Pause, next, previous, playAt and release persist the current position before acting.</li>
 * </ul>
 * <p>
 * Concurrency: one single-thread scheduler ("playback-main") runs every state mutation, engine call, event
 * handler and tracker tick. Scans, metadata and store lookups run on "playback-io" and marshal their results
 * back. Durable writes go through the single "playback-writer" thread in the order they were issued, so the
 * latest position for a file is also the last one stored. Values written are captured on the main context
 * before dispatch. A newer load or playAt supersedes an older one still waiting for its resume lookup.
 * <p>
 * Error Handling: engine failures are absorbed by {@link PlaybackSession}. Failures of the lifecycle hook,
 * metadata loader and observers are logged and never interrupt playback.
 *
 * @author Playback Engine Team
 * @since 1.0
 */
public class PlaybackService implements PlaybackServiceInterface {
    private static final Logger logger = LoggerFactory.getLogger(PlaybackService.class);
    private static final long SHUTDOWN_TIMEOUT_SECONDS = 5;

    private final ScannerServiceInterface scanner;
    private final MemoryServiceInterface memory;
    private final SnapshotServiceInterface snapshots;
    private final Supplier<MediaEngine> engineFactory;
    private final MetadataLoader metadataLoader;
    private final SessionLifecycleHook lifecycleHook;
    private final PlaylistBuilder builder = new PlaylistBuilder();

    private final ScheduledExecutorService main;
    private final ExecutorService io;
    private final ExecutorService writer;

    private final PlaybackState state = new PlaybackState();
    private final List<PlaybackObserver> observers = new CopyOnWriteArrayList<>();
    private final PlaybackObserver dispatcher = new ObserverDispatcher();
    private final PositionTracker tracker;
    private final Consumer<MemorySaveEvent> saveListener;

    private final Set<CompletableFuture<?>> cancellableTasks = ConcurrentHashMap.newKeySet();
    private final Set<CompletableFuture<?>> pendingWrites = ConcurrentHashMap.newKeySet();

    // main-context only
    private PlaybackSession session;
    private long loadGeneration;
    private boolean endedSaved;
    private volatile Playlist playlist;

    /**
     * Creates a controller with its own main and I/O executors.
     * @param scanner library scanner
     * @param memory memory resolver
     * @param snapshots fast snapshot store written by the position tracker
     * @param engineFactory creates an engine for every new session
     * @param metadataLoader tag reader, or null to publish display names only
     * @param lifecycleHook background session hook, or null
     * @param config tick and save intervals
     */
    public PlaybackService(ScannerServiceInterface scanner, MemoryServiceInterface memory, SnapshotServiceInterface snapshots,
                           Supplier<MediaEngine> engineFactory, MetadataLoader metadataLoader,
                           SessionLifecycleHook lifecycleHook, EngineConfig config) {
        this(scanner, memory, snapshots, engineFactory, metadataLoader, lifecycleHook, config,
            Executors.newSingleThreadScheduledExecutor(named("playback-main")),
            Executors.newCachedThreadPool(named("playback-io-")),
            Executors.newSingleThreadExecutor(named("playback-writer")));
    }

    PlaybackService(ScannerServiceInterface scanner, MemoryServiceInterface memory, SnapshotServiceInterface snapshots,
                    Supplier<MediaEngine> engineFactory, MetadataLoader metadataLoader,
                    SessionLifecycleHook lifecycleHook, EngineConfig config,
                    ScheduledExecutorService main, ExecutorService io, ExecutorService writer) {
        if (scanner == null || memory == null || snapshots == null || engineFactory == null || config == null) {
            throw new IllegalArgumentException("Scanner, memory, snapshot store, engine factory and config are required");
        }
        this.scanner = scanner;
        this.memory = memory;
        this.snapshots = snapshots;
        this.engineFactory = engineFactory;
        this.metadataLoader = metadataLoader == null ? MetadataLoader.fromDisplayName() : metadataLoader;
        this.lifecycleHook = lifecycleHook == null ? SessionLifecycleHook.NONE : lifecycleHook;
        this.main = main;
        this.io = io;
        this.writer = writer;
        this.tracker = new PositionTracker(state, snapshots, memory, writer, main, config, dispatcher);
        this.saveListener = event -> onMain(() -> dispatcher.onMemorySaved(event));
        memory.addSaveEventListener(saveListener);
    }

    // --- loading ---

    @Override
    public CompletableFuture<Void> load(Playlist playlist, int startIndex) {
        if (playlist == null) throw new IllegalArgumentException("Playlist cannot be null");
        CompletableFuture<Void> done = new CompletableFuture<>();
        boolean queued = onMain(() -> {
            if (playlist.isEmpty()) {
                logger.warn("Ignoring load of empty playlist from {}", playlist.folderIdentity());
                done.complete(null);
                return;
            }
            int start = Math.max(0, Math.min(startIndex, playlist.size() - 1));
            if (state.getCurrentRef() != null) saveCurrentPosition();
            tracker.stop();

            long generation = ++loadGeneration;
            this.playlist = playlist;
            MediaRef startRef = playlist.get(start);
            state.setFolderIdentity(playlist.folderIdentity());
            state.setCurrent(start, startRef);
            state.setPosition(0L, 0L);
            state.setPhase(SessionPhase.LOADED);
            endedSaved = false;
            dispatcher.onPlaylistChanged(playlist);
            dispatcher.onCurrentRefChanged(startRef, start);
            logger.info("Loading {} items ({}) from {}, starting at {}", playlist.size(), playlist.mode(),
                playlist.folderIdentity(), startRef.fileName());

            PlaybackSession s = ensureSession();
            s.applyPlayMode(state.getPlayMode());
            s.load(builder.toMediaItems(playlist), start);
            s.prepare();

            Long playlistId = playlist.playlistId();
            if (playlistId != null) {
                write(() -> memory.updatePlaylistLastPlayed(playlistId));
            }
            resumeThenPlay(generation, s, start, startRef, done);
        });
        if (!queued) done.complete(null);
        return done;
    }

    @Override
    public CompletableFuture<Void> loadFolderAndPlay(String folderPath, String startFilePath) {
        if (folderPath == null || folderPath.isBlank()) {
            logger.warn("No folder to play");
            return CompletableFuture.completedFuture(null);
        }
        FolderRef folder;
        String startIdentity;
        try {
            folder = FolderRef.ofPath(folderPath);
            startIdentity = startFilePath == null ? null : Path.of(startFilePath).toAbsolutePath().toString();
        } catch (InvalidPathException e) {
            logger.warn("Cannot play folder '{}': {}", folderPath, e.getMessage());
            return CompletableFuture.completedFuture(null);
        }
        return loadScanned(folder, startIdentity);
    }

    @Override
    public CompletableFuture<Void> loadFilesAndPlay(List<Path> files, int startIndex) {
        if (files == null || files.isEmpty()) {
            logger.warn("No files to play");
            return CompletableFuture.completedFuture(null);
        }
        List<MediaRef> refs = new ArrayList<>();
        for (Path file : files) {
            refs.add(MediaRef.ofPath(file));
        }
        Path parent = files.get(0).toAbsolutePath().getParent();
        return load(builder.build(MediaKind.PATH, refs, parent == null ? "" : parent.toString(), null), startIndex);
    }

    @Override
    public CompletableFuture<Void> loadUrisAndPlay(String treeUri, String startUri) {
        return loadScanned(FolderRef.ofTree(treeUri), startUri);
    }

    private CompletableFuture<Void> loadScanned(FolderRef folder, String startIdentity) {
        return background(() -> scanner.scan(folder)).thenCompose(entries -> {
            if (entries.isEmpty()) {
                logger.warn("Nothing playable in {}", folder.identity());
                return CompletableFuture.completedFuture(null);
            }
            Playlist list = builder.build(folder.kind(), entries, folder.identity(), null);
            int index = Math.max(0, list.indexOf(startIdentity));
            return load(list, index);
        });
    }

    @Override
    public CompletableFuture<Void> playAt(int index) {
        CompletableFuture<Void> done = new CompletableFuture<>();
        boolean queued = onMain(() -> {
            Playlist list = playlist;
            PlaybackSession s = session;
            MediaRef target = list == null ? null : list.get(index);
            if (target == null || s == null || s.isReleased()) {
                logger.warn("Cannot play index {}: nothing loaded or index out of range", index);
                done.complete(null);
                return;
            }
            saveCurrentPosition();
            long generation = ++loadGeneration;
            if (!target.equals(state.getCurrentRef()) || state.getCurrentIndex() != index) {
                state.setCurrent(index, target);
                state.setPosition(0L, 0L);
                dispatcher.onCurrentRefChanged(target, index);
            }
            endedSaved = false;
            seekToMemoryThenPlay(generation, s, index, target, done);
        });
        if (!queued) done.complete(null);
        return done;
    }

    /**
     * Resume lookup for the start item; the seek only happens for a stored position above 0.
     */
    private void resumeThenPlay(long generation, PlaybackSession s, int index, MediaRef ref, CompletableFuture<Void> done) {
        background(() -> memory.resolveResume(ref)).whenComplete((found, error) -> {
            boolean queued = onMain(() -> {
                if (isStale(generation, s)) {
                    logger.debug("Load of {} superseded", ref.fileName());
                    done.complete(null);
                    return;
                }
                if (found != null && found.positionMs() > 0) {
                    logger.info("Resuming {} at {}", ref.fileName(), Utils.formatPosition(found.positionMs()));
                    s.seekTo(index, found.positionMs());
                    state.setPosition(found.positionMs(), Math.max(found.durationMs(), state.getDurationMs()));
                }
                startPlayback(s);
                done.complete(null);
            });
            if (!queued) done.complete(null);
        });
    }

    private void seekToMemoryThenPlay(long generation, PlaybackSession s, int index, MediaRef ref, CompletableFuture<Void> done) {
        background(() -> memory.resolveResume(ref)).whenComplete((found, error) -> {
            boolean queued = onMain(() -> {
                if (isStale(generation, s)) {
                    done.complete(null);
                    return;
                }
                long position = found == null ? 0L : found.positionMs();
                s.seekTo(index, position);
                state.setPosition(position, state.getDurationMs());
                startPlayback(s);
                done.complete(null);
            });
            if (!queued) done.complete(null);
        });
    }

    private boolean isStale(long generation, PlaybackSession s) {
        return generation != loadGeneration || s != session || s.isReleased();
    }

    // --- transport ---

    @Override
    public CompletableFuture<Void> play() {
        return onMainFuture("play", () -> {
            PlaybackSession s = session;
            if (s == null || s.isReleased() || playlist == null) {
                logger.warn("Play ignored: nothing loaded");
                return;
            }
            startPlayback(s);
        });
    }

    @Override
    public CompletableFuture<Void> pause() {
        return onMainFuture("pause", () -> {
            PlaybackSession s = session;
            if (s == null || s.isReleased()) return;
            saveCurrentPosition();
            s.pause();
        });
    }

    @Override
    public CompletableFuture<Void> seekTo(long positionMs) {
        return onMainFuture("seekTo", () -> {
            PlaybackSession s = session;
            if (s == null || s.isReleased()) return;
            s.seekTo(positionMs);
            state.setPosition(positionMs, state.getDurationMs());
            dispatcher.onPositionChanged(state.getPositionMs(), state.getDurationMs());
        });
    }

    @Override
    public CompletableFuture<Void> next() {
        return onMainFuture("next", () -> {
            PlaybackSession s = session;
            if (s == null || s.isReleased()) return;
            saveCurrentPosition();
            if (s.hasNext()) {
                s.seekToNext();
            } else {
                logger.debug("No next item");
            }
        });
    }

    @Override
    public CompletableFuture<Void> previous() {
        return onMainFuture("previous", () -> {
            PlaybackSession s = session;
            if (s == null || s.isReleased()) return;
            saveCurrentPosition();
            if (s.hasPrevious()) {
                s.seekToPrevious();
            } else {
                logger.debug("No previous item");
            }
        });
    }

    private void startPlayback(PlaybackSession s) {
        try {
            lifecycleHook.ensureActive();
        } catch (Exception e) {
            logger.warn("Could not activate background session: {}", e.getMessage());
        }
        s.play();
    }

    // --- modes ---

    @Override
    public CompletableFuture<PlayMode> toggleMode() {
        return callOnMain("toggleMode", () -> {
            PlayMode next = state.getPlayMode().next();
            applyPlayMode(next);
            return next;
        });
    }

    @Override
    public CompletableFuture<Void> setPlayMode(PlayMode mode) {
        if (mode == null) throw new IllegalArgumentException("Play mode cannot be null");
        return onMainFuture("setPlayMode", () -> applyPlayMode(mode));
    }

    private void applyPlayMode(PlayMode mode) {
        state.setPlayMode(mode);
        PlaybackSession s = session;
        if (s != null) s.applyPlayMode(mode);
        logger.info("Play mode: {}", mode);
        dispatcher.onPlayModeChanged(mode);
    }

    @Override
    public CompletableFuture<Void> setAudioBookMode(boolean enabled) {
        return onMainFuture("setAudioBookMode", () -> {
            state.setAudiobookMode(enabled);
            tracker.resetAudiobookAccumulator();
            logger.info("Audiobook mode {}", enabled ? "on" : "off");
            dispatcher.onAudioBookModeChanged(enabled);
        });
    }

    // --- memories and bookmarks ---

    @Override
    public CompletableFuture<MemorySaveResult> saveMemoryManually() {
        return callOnMain("saveMemoryManually", this::captureCurrent).thenCompose(current -> current == null
            ? CompletableFuture.completedFuture(null)
            : durable(() -> memory.saveMemoryManually(current.ref(), current.positionMs(), current.durationMs(),
                current.folderIdentity())));
    }

    @Override
    public CompletableFuture<Long> addBookmark(String label) {
        return callOnMain("addBookmark", this::captureCurrent).thenCompose(current -> {
            if (current == null) {
                logger.warn("Cannot bookmark: nothing loaded");
                return CompletableFuture.completedFuture(-1L);
            }
            MediaRef ref = current.ref();
            return durable(() -> memory.addBookmark(ref, current.positionMs(), current.durationMs(), label,
                current.folderIdentity(), ref.displayName()));
        });
    }

    /**
     * Current item and live position, read together on the main context. Null when nothing is loaded.
     */
    private CurrentItem captureCurrent() {
        refreshPosition();
        MediaRef ref = state.getCurrentRef();
        if (ref == null) return null;
        return new CurrentItem(ref, state.getPositionMs(), state.getDurationMs(), state.getFolderIdentity());
    }

    private record CurrentItem(MediaRef ref, long positionMs, long durationMs, String folderIdentity) {}

    /**
     * Writes the fast snapshot synchronously and dispatches the durable write. Main context only.
     */
    private void saveCurrentPosition() {
        MediaRef ref = state.getCurrentRef();
        if (ref == null) return;
        refreshPosition();
        long position = state.getPositionMs();
        long duration = state.getDurationMs();
        String folder = state.getFolderIdentity();
        snapshots.put(ref.identity(), position, duration, folder, ref.displayName());
        write(() -> memory.saveMemory(ref.identity(), position, duration, folder, ref.displayName()));
    }

    private void refreshPosition() {
        PlaybackSession s = session;
        if (s != null && !s.isReleased() && state.getCurrentRef() != null) {
            state.setPosition(s.currentPosition(), s.duration());
        }
    }

    // --- library ---

    @Override
    public CompletableFuture<List<MediaRef>> scan(FolderRef folder) {
        return background(() -> scanner.scan(folder));
    }

    @Override
    public CompletableFuture<ScanResult> scanDiagnostic(FolderRef folder) {
        return background(() -> scanner.scanDiagnostic(folder));
    }

    @Override
    public CompletableFuture<FolderListing> listFolder(FolderRef folder) {
        return background(() -> scanner.listFolder(folder));
    }

    @Override
    public CompletableFuture<ScanResult> importFolder(FolderRef folder) {
        return background(() -> {
            ScanResult result = scanner.scanDiagnostic(folder);
            String name = Utils.folderName(folder.identity());
            long id = memory.importPlaylist(folder.identity(), name, result.doneCount());
            logger.info("Imported '{}' as playlist {}: {} of {} entries playable", name, id, result.doneCount(), result.totalCount());
            return result;
        });
    }

    @Override
    public CompletableFuture<Boolean> resumeLastSession() {
        return background(() -> {
            PlaybackMemory snapshot = memory.getQuickSnapshot();
            if (snapshot == null || snapshot.folderIdentity() == null || snapshot.folderIdentity().isBlank()) {
                logger.info("No previous session to resume");
                return null;
            }
            logger.info("Resuming last session: {} in {}", snapshot.displayName(), snapshot.folderIdentity());
            return resumeTarget(snapshot.folderIdentity(), snapshot.fileIdentity(), null);
        }).thenCompose(this::loadTarget);
    }

    @Override
    public CompletableFuture<Boolean> resumePlaylist(long playlistId) {
        return background(() -> {
            MusicPlaylist registered = memory.getPlaylist(playlistId);
            if (registered == null) {
                logger.warn("Unknown playlist {}", playlistId);
                return null;
            }
            logger.info("Resuming playlist '{}' at {}", registered.name(),
                registered.hasResumePoint() ? registered.lastDisplayName() : "the first item");
            return resumeTarget(registered.folderIdentity(), registered.lastFileIdentity(), registered.id());
        }).thenCompose(this::loadTarget);
    }

    /**
     * Scans a folder and finds the start index of a file in it. Runs on the I/O pool.
     * @return null when the folder has nothing playable
     */
    private ResumeTarget resumeTarget(String folderIdentity, String fileIdentity, Long playlistId) {
        FolderRef folder;
        try {
            folder = Utils.looksLikeUri(folderIdentity) ? FolderRef.ofTree(folderIdentity) : FolderRef.ofPath(folderIdentity);
        } catch (InvalidPathException e) {
            logger.warn("Cannot resume folder '{}': {}", folderIdentity, e.getMessage());
            return null;
        }
        List<MediaRef> entries = scanner.scan(folder);
        if (entries.isEmpty()) {
            logger.warn("Folder {} has nothing playable", folder.identity());
            return null;
        }
        Playlist list = builder.build(folder.kind(), entries, folder.identity(), playlistId);
        return new ResumeTarget(list, Math.max(0, list.indexOf(fileIdentity)));
    }

    private CompletableFuture<Boolean> loadTarget(ResumeTarget target) {
        return target == null
            ? CompletableFuture.completedFuture(false)
            : load(target.playlist(), target.index()).thenApply(v -> true);
    }

    private record ResumeTarget(Playlist playlist, int index) {}

    // --- engine events ---

    private PlaybackSession ensureSession() {
        if (session == null || session.isReleased()) {
            PlaybackSession s = new PlaybackSession(engineFactory.get());
            s.setEventListener(event -> onMain(() -> handleEvent(s, event)));
            session = s;
            logger.debug("Created new playback session");
        }
        return session;
    }

    private void handleEvent(PlaybackSession source, EngineEvent event) {
        if (source != session || source.isReleased()) {
            logger.debug("Dropping {} from stale session", event);
            return;
        }
        if (event instanceof EngineEvent.IsPlayingChanged changed) {
            onIsPlayingChanged(source, changed.isPlaying());
        } else if (event instanceof EngineEvent.StateChanged changed) {
            onStateChanged(source, changed.state());
        } else if (event instanceof EngineEvent.Transition transition) {
            onTransition(transition.index(), transition.mediaId());
        }
    }

    private void onIsPlayingChanged(PlaybackSession s, boolean playing) {
        state.setPlaying(playing);
        if (playing) {
            state.setPhase(SessionPhase.PLAYING);
            tracker.start(s);
        } else {
            tracker.stop();
            saveCurrentPosition();
            if (state.getPhase() != SessionPhase.ENDED) state.setPhase(SessionPhase.PAUSED);
        }
        dispatcher.onIsPlayingChanged(playing);
    }

    private void onStateChanged(PlaybackSession s, EngineEvent.State engineState) {
        switch (engineState) {
            case READY:
                state.setDurationMs(s.duration());
                dispatcher.onPositionChanged(state.getPositionMs(), state.getDurationMs());
                break;
            case ENDED:
                if (!endedSaved) {
                    endedSaved = true;
                    saveCurrentPosition();
                }
                tracker.stop();
                state.setPhase(SessionPhase.ENDED);
                break;
            default:
                logger.debug("Engine state {}", engineState);
        }
    }

    private void onTransition(int index, String mediaId) {
        Playlist list = playlist;
        if (list == null) return;
        int resolved = list.indexOf(mediaId);
        if (resolved < 0) resolved = index;
        MediaRef ref = list.get(resolved);
        if (ref == null) {
            logger.debug("Transition to unknown item {} ({})", index, mediaId);
            return;
        }
        endedSaved = false;
        if (!ref.equals(state.getCurrentRef()) || state.getCurrentIndex() != resolved) {
            state.setCurrent(resolved, ref);
            state.setPosition(0L, 0L);
            dispatcher.onCurrentRefChanged(ref, resolved);
        }
        state.setPhase(state.isPlaying() ? SessionPhase.PLAYING : SessionPhase.LOADED);
        logger.debug("Now at {} ({})", resolved, ref.fileName());

        background(() -> loadMetadata(ref)).thenAccept(metadata -> onMain(() -> {
            if (ref.equals(state.getCurrentRef())) dispatcher.onMetadataLoaded(ref, metadata);
        }));
        background(() -> memory.resolveResume(ref)).thenAccept(found -> onMain(() -> {
            if (ref.equals(state.getCurrentRef())) dispatcher.onResumeMemoryResolved(ref, found);
        }));
    }

    private TrackMetadata loadMetadata(MediaRef ref) {
        try {
            return metadataLoader.load(ref);
        } catch (Exception e) {
            logger.warn("Failed to read metadata of {}: {}", ref.fileName(), e.getMessage());
            return new TrackMetadata(ref.displayName(), "", "");
        }
    }

    // --- lifecycle ---

    @Override
    public CompletableFuture<Void> release() {
        return onMainFuture("release", () -> {
            PlaybackSession s = session;
            if (s == null) return;
            boolean wasPlaying = state.isPlaying();
            saveCurrentPosition();
            tracker.stop();
            loadGeneration++;
            for (CompletableFuture<?> task : cancellableTasks) {
                task.cancel(true);
            }
            s.release();
            session = null;
            playlist = null;
            state.reset();
            logger.info("Playback session released");
            if (wasPlaying) dispatcher.onIsPlayingChanged(false);
        });
    }

    @Override
    public void close() {
        memory.removeSaveEventListener(saveListener);
        try {
            release().get(SHUTDOWN_TIMEOUT_SECONDS, TimeUnit.SECONDS);
            CompletableFuture.allOf(pendingWrites.toArray(new CompletableFuture[0]))
                .get(SHUTDOWN_TIMEOUT_SECONDS, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } catch (ExecutionException | TimeoutException e) {
            logger.warn("Release during close did not finish cleanly: {}", e.getMessage());
        }
        main.shutdown();
        io.shutdown();
        writer.shutdown();
        try {
            if (!main.awaitTermination(SHUTDOWN_TIMEOUT_SECONDS, TimeUnit.SECONDS)) main.shutdownNow();
            if (!io.awaitTermination(SHUTDOWN_TIMEOUT_SECONDS, TimeUnit.SECONDS)) io.shutdownNow();
            if (!writer.awaitTermination(SHUTDOWN_TIMEOUT_SECONDS, TimeUnit.SECONDS)) writer.shutdownNow();
        } catch (InterruptedException e) {
            main.shutdownNow();
            io.shutdownNow();
            writer.shutdownNow();
            Thread.currentThread().interrupt();
        }
        snapshots.flush();
        logger.info("Playback service closed");
    }

    @Override
    public PlaybackState getState() {
        return state;
    }

    @Override
    public Playlist getPlaylist() {
        return playlist;
    }

    /** Active playlist if it addresses files by path, otherwise null. */
    public Playlist.PathList getPathPlaylist() {
        return playlist instanceof Playlist.PathList paths ? paths : null;
    }

    /** Active playlist if it addresses documents by provider URI, otherwise null. */
    public Playlist.UriList getUriPlaylist() {
        return playlist instanceof Playlist.UriList uris ? uris : null;
    }

    @Override
    public void addObserver(PlaybackObserver observer) {
        if (observer != null) observers.add(observer);
    }

    @Override
    public void removeObserver(PlaybackObserver observer) {
        observers.remove(observer);
    }

    /**
     * Waits until background work started so far, and the main tasks it queued, have finished.
     */
    void flush() throws Exception {
        for (int round = 0; round < 3; round++) {
            List<CompletableFuture<?>> running = new ArrayList<>(cancellableTasks);
            running.addAll(pendingWrites);
            CompletableFuture.allOf(running.toArray(new CompletableFuture[0]))
                .handle((v, e) -> null)
                .get(SHUTDOWN_TIMEOUT_SECONDS, TimeUnit.SECONDS);
            main.submit(() -> { }).get(SHUTDOWN_TIMEOUT_SECONDS, TimeUnit.SECONDS);
        }
    }

    // --- execution helpers ---

    private boolean onMain(Runnable body) {
        try {
            main.execute(() -> {
                try {
                    body.run();
                } catch (RuntimeException e) {
                    logger.error("Playback task failed: {}", e.getMessage(), e);
                }
            });
            return true;
        } catch (RejectedExecutionException e) {
            logger.debug("Main context shut down, dropping task");
            return false;
        }
    }

    private CompletableFuture<Void> onMainFuture(String op, Runnable body) {
        return callOnMain(op, () -> {
            body.run();
            return null;
        });
    }

    private <T> CompletableFuture<T> callOnMain(String op, Supplier<T> body) {
        CompletableFuture<T> result = new CompletableFuture<>();
        try {
            main.execute(() -> {
                try {
                    result.complete(body.get());
                } catch (RuntimeException e) {
                    logger.warn("{} failed: {}", op, e.getMessage());
                    result.completeExceptionally(e);
                }
            });
        } catch (RejectedExecutionException e) {
            logger.debug("{} rejected, service closed", op);
            result.completeExceptionally(e);
        }
        return result;
    }

    /** Scan, lookup or metadata work on the I/O pool; cancelled by {@link #release()}. */
    private <T> CompletableFuture<T> background(Supplier<T> body) {
        return submit(body, io, cancellableTasks);
    }

    /** Durable write on the serial writer; never cancelled. */
    private <T> CompletableFuture<T> durable(Supplier<T> body) {
        return submit(body, writer, pendingWrites);
    }

    private <T> CompletableFuture<T> submit(Supplier<T> body, ExecutorService executor, Set<CompletableFuture<?>> registry) {
        CompletableFuture<T> task;
        try {
            task = CompletableFuture.supplyAsync(body, executor);
        } catch (RejectedExecutionException e) {
            logger.debug("Executor shut down, dropping task");
            return CompletableFuture.failedFuture(e);
        }
        registry.add(task);
        task.whenComplete((v, e) -> registry.remove(task));
        return task;
    }

    private void write(Runnable body) {
        durable(() -> {
            body.run();
            return null;
        });
    }

    private static ThreadFactory named(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            String name = prefix.endsWith("-") ? prefix + counter.incrementAndGet() : prefix;
            Thread thread = new Thread(runnable, name);
            thread.setDaemon(true);
            return thread;
        };
    }

    /**
     * Fans callbacks out to the registered observers; a failing observer does not affect the others.
     */
    private final class ObserverDispatcher implements PlaybackObserver {

        private void each(String callback, Consumer<PlaybackObserver> call) {
            for (PlaybackObserver observer : observers) {
                try {
                    call.accept(observer);
                } catch (RuntimeException e) {
                    logger.warn("Observer {} failed in {}: {}", observer.getClass().getSimpleName(), callback, e.getMessage());
                }
            }
        }

        @Override
        public void onCurrentRefChanged(MediaRef ref, int index) {
            each("onCurrentRefChanged", o -> o.onCurrentRefChanged(ref, index));
        }

        @Override
        public void onPositionChanged(long positionMs, long durationMs) {
            each("onPositionChanged", o -> o.onPositionChanged(positionMs, durationMs));
        }

        @Override
        public void onIsPlayingChanged(boolean isPlaying) {
            each("onIsPlayingChanged", o -> o.onIsPlayingChanged(isPlaying));
        }

        @Override
        public void onPlaylistChanged(Playlist playlist) {
            each("onPlaylistChanged", o -> o.onPlaylistChanged(playlist));
        }

        @Override
        public void onPlayModeChanged(PlayMode playMode) {
            each("onPlayModeChanged", o -> o.onPlayModeChanged(playMode));
        }

        @Override
        public void onAudioBookModeChanged(boolean enabled) {
            each("onAudioBookModeChanged", o -> o.onAudioBookModeChanged(enabled));
        }

        @Override
        public void onMemorySaved(MemorySaveEvent event) {
            each("onMemorySaved", o -> o.onMemorySaved(event));
        }

        @Override
        public void onMetadataLoaded(MediaRef ref, TrackMetadata metadata) {
            each("onMetadataLoaded", o -> o.onMetadataLoaded(ref, metadata));
        }

        @Override
        public void onResumeMemoryResolved(MediaRef ref, PlaybackMemory memory) {
            each("onResumeMemoryResolved", o -> o.onResumeMemoryResolved(ref, memory));
        }
    }
}
