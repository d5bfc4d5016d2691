package com.localmedia.playback;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Fast snapshot store backed by a single JSON file.
 * <p>
 * Workflow:
 * <ul>
 *   <li>{@link #put} replaces the in-memory snapshot at once and hands the file write to a background
 *   "snapshot-writer" thread. Puts that arrive while a write is queued are coalesced: only the newest
 *   snapshot reaches the disk.</li>
 *   <li>The writer serializes the snapshot with Jackson into a sibling temp file which is moved over the
 *   snapshot file, so a reader never sees a half-written snapshot.</li>
 *   <li>{@link #getLast} answers from memory, or reads the file once after a restart.</li>
 * </ul>
 * <p>
 * Error Handling: I/O failures are logged and swallowed; the in-memory copy stays valid.
 * A null file keeps the snapshot in memory only.
 *
 * @author Playback Engine Team
 * @since 1.0
 */
public class SnapshotService implements SnapshotServiceInterface, AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(SnapshotService.class);
    private static final long FLUSH_TIMEOUT_SECONDS = 5;
    private final ObjectMapper mapper = new ObjectMapper();
    private final Path file;
    private final ExecutorService fileWriter;
    private final AtomicReference<PlaybackMemory> pending = new AtomicReference<>();
    private volatile PlaybackMemory last;

    public SnapshotService(Path file) {
        this(file, file == null ? null : Executors.newSingleThreadExecutor(runnable -> {
            Thread thread = new Thread(runnable, "snapshot-writer");
            thread.setDaemon(true);
            return thread;
        }));
    }

    /**
     * @param fileWriter single-threaded executor that owns the file writes
     */
    SnapshotService(Path file, ExecutorService fileWriter) {
        this.file = file;
        this.fileWriter = file == null ? null : fileWriter;
    }

    /** Memory-only store. */
    public SnapshotService() {
        this(null);
    }

    @Override
    public void put(String fileIdentity, long positionMs, long durationMs, String folderIdentity, String displayName) {
        if (fileIdentity == null || fileIdentity.isBlank()) {
            logger.debug("Ignoring snapshot without file identity");
            return;
        }
        PlaybackMemory snapshot = new PlaybackMemory(fileIdentity, Math.max(0L, positionMs), Math.max(0L, durationMs),
            folderIdentity, displayName, System.currentTimeMillis());
        last = snapshot;
        if (file == null) return;
        if (pending.getAndSet(snapshot) != null) return;
        try {
            fileWriter.execute(this::writePending);
        } catch (RejectedExecutionException e) {
            writePending();
        }
    }

    @Override
    public PlaybackMemory getLast() {
        PlaybackMemory cached = last;
        if (cached != null || file == null) return cached;
        synchronized (this) {
            if (last != null) return last;
            if (!Files.isRegularFile(file)) return null;
            try {
                last = mapper.readValue(file.toFile(), PlaybackMemory.class);
                logger.debug("Loaded snapshot {} from {}", last.fileIdentity(), file);
            } catch (IOException e) {
                logger.warn("Failed to read snapshot {}: {}", file, e.getMessage());
            }
            return last;
        }
    }

    /**
     * Blocks until the newest snapshot passed to {@link #put} has been written to the file.
     */
    @Override
    public void flush() {
        if (fileWriter == null) return;
        try {
            fileWriter.submit(() -> { }).get(FLUSH_TIMEOUT_SECONDS, TimeUnit.SECONDS);
        } catch (RejectedExecutionException e) {
            writePending();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } catch (ExecutionException | TimeoutException e) {
            logger.warn("Snapshot flush did not finish: {}", e.getMessage());
        }
    }

    /**
     * Writes any queued snapshot and stops the writer thread.
     */
    @Override
    public void close() {
        if (fileWriter == null) return;
        fileWriter.shutdown();
        try {
            if (!fileWriter.awaitTermination(FLUSH_TIMEOUT_SECONDS, TimeUnit.SECONDS)) fileWriter.shutdownNow();
        } catch (InterruptedException e) {
            fileWriter.shutdownNow();
            Thread.currentThread().interrupt();
        }
        writePending();
    }

    private void writePending() {
        PlaybackMemory snapshot = pending.getAndSet(null);
        if (snapshot == null) return;
        synchronized (this) {
            try {
                Path dir = file.toAbsolutePath().getParent();
                if (dir != null && !Files.exists(dir)) Files.createDirectories(dir);
                Path tmp = file.resolveSibling(file.getFileName() + ".tmp");
                mapper.writeValue(tmp.toFile(), snapshot);
                try {
                    Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
                } catch (AtomicMoveNotSupportedException e) {
                    Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING);
                }
            } catch (IOException e) {
                logger.warn("Failed to write snapshot {}: {}", file, e.getMessage());
            }
        }
    }
}
