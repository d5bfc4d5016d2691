package com.localmedia.playback;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * Interface for CSV export of scan reports, resume memories and bookmarks.
 */
public interface CsvServiceInterface {
    /**
     * Writes one row per scanned entry: name, identity, status, reason.
     * @param result diagnostic scan result
     * @param filename output file name, placed in the export directory
     * @return path of the written file
     * @throws IOException if file writing fails
     */
    Path writeScanReport(ScanResult result, String filename) throws IOException;

    /**
     * Writes one row per memory.
     * @throws IOException if file writing fails
     */
    Path writeMemories(List<PlaybackMemory> memories, String filename) throws IOException;

    /**
     * Writes one row per bookmark.
     * @throws IOException if file writing fails
     */
    Path writeBookmarks(List<Bookmark> bookmarks, String filename) throws IOException;
}
