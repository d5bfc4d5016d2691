package com.localmedia.playback;

import com.opencsv.CSVWriter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Service for exporting scan reports, memories and bookmarks to CSV files using OpenCSV.
 * <p>
 * Workflow:
 * <ul>
 *   <li>File names are sanitized with {@link Utils#sanitizeFilename(String)} and resolved against the export
 *   directory, which is created on demand.</li>
 *   <li>Every file starts with a header row.</li>
 * </ul>
 *
 * @author Playback Engine Team
 * @since 1.0
 */
public class CsvService implements CsvServiceInterface {
    private static final Logger logger = LoggerFactory.getLogger(CsvService.class);

    private static final String[] SCAN_HEADER = {"Name", "Identity", "Status", "Reason"};
    private static final String[] MEMORY_HEADER = {"FileIdentity", "DisplayName", "Folder", "Position", "PositionMs", "DurationMs", "SavedAt"};
    private static final String[] BOOKMARK_HEADER = {"Id", "FileIdentity", "DisplayName", "Label", "Position", "PositionMs", "DurationMs", "CreatedAt"};

    private final Path outputDir;

    public CsvService(Path outputDir) {
        this.outputDir = outputDir;
    }

    @Override
    public Path writeScanReport(ScanResult result, String filename) throws IOException {
        if (result == null) {
            logger.warn("Attempted to write null scan result to CSV: {}", filename);
            throw new IllegalArgumentException("Scan result cannot be null");
        }
        Path target = resolve(filename);
        try (CSVWriter writer = open(target)) {
            writer.writeNext(SCAN_HEADER);
            for (ScanResultItem item : result.items()) {
                writer.writeNext(new String[]{
                    safe(item.name()),
                    safe(item.identity()),
                    item.status().name(),
                    safe(item.reason())
                });
            }
        }
        logger.info("Wrote scan report of {} entries ({} done, {} pass, {} err) to {}",
            result.totalCount(), result.doneCount(), result.passCount(), result.errCount(), target);
        return target;
    }

    @Override
    public Path writeMemories(List<PlaybackMemory> memories, String filename) throws IOException {
        if (memories == null) {
            logger.warn("Attempted to write null memory list to CSV: {}", filename);
            throw new IllegalArgumentException("Memory list cannot be null");
        }
        Path target = resolve(filename);
        try (CSVWriter writer = open(target)) {
            writer.writeNext(MEMORY_HEADER);
            for (PlaybackMemory m : memories) {
                writer.writeNext(new String[]{
                    safe(m.fileIdentity()),
                    safe(m.displayName()),
                    safe(m.folderIdentity()),
                    Utils.formatPosition(m.positionMs()),
                    Long.toString(m.positionMs()),
                    Long.toString(m.durationMs()),
                    Long.toString(m.savedAt())
                });
            }
        }
        logger.info("Wrote {} memories to CSV file: {}", memories.size(), target);
        return target;
    }

    @Override
    public Path writeBookmarks(List<Bookmark> bookmarks, String filename) throws IOException {
        if (bookmarks == null) {
            logger.warn("Attempted to write null bookmark list to CSV: {}", filename);
            throw new IllegalArgumentException("Bookmark list cannot be null");
        }
        Path target = resolve(filename);
        try (CSVWriter writer = open(target)) {
            writer.writeNext(BOOKMARK_HEADER);
            for (Bookmark b : bookmarks) {
                writer.writeNext(new String[]{
                    Long.toString(b.id()),
                    safe(b.fileIdentity()),
                    safe(b.displayName()),
                    safe(b.label()),
                    Utils.formatPosition(b.positionMs()),
                    Long.toString(b.positionMs()),
                    Long.toString(b.durationMs()),
                    Long.toString(b.createdAt())
                });
            }
        }
        logger.info("Wrote {} bookmarks to CSV file: {}", bookmarks.size(), target);
        return target;
    }

    private Path resolve(String filename) throws IOException {
        if (filename == null || filename.trim().isEmpty()) {
            logger.warn("Attempted to write CSV with invalid filename: {}", filename);
            throw new IllegalArgumentException("Filename cannot be null or empty");
        }
        if (!Files.exists(outputDir)) Files.createDirectories(outputDir);
        return outputDir.resolve(Utils.sanitizeFilename(filename.trim()));
    }

    private static CSVWriter open(Path target) throws IOException {
        Writer out = Files.newBufferedWriter(target, StandardCharsets.UTF_8);
        return new CSVWriter(out);
    }

    /**
     * Collapses line breaks so each record stays on one line.
     */
    private static String safe(String s) {
        return s == null ? "" : s.replaceAll("[\\r\\n]+", " ").trim();
    }
}
