package com.localmedia.playback;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class CsvServiceTest {

    @TempDir
    Path tempDir;

    @Test
    void testWriteScanReport() throws Exception {
        CsvService csv = new CsvService(tempDir.resolve("exports"));
        ScanResult result = new ScanResult(FolderRef.ofPath(tempDir), List.of(
            ScanResultItem.done("a.mp3", "/m/a.mp3"),
            ScanResultItem.pass("b.txt", "/m/b.txt", "unsupported format (.txt)")
        ));

        Path file = csv.writeScanReport(result, "My Music:scan.csv");

        assertEquals(tempDir.resolve("exports").resolve("My_Music_scan.csv"), file);
        List<String> lines = Files.readAllLines(file);
        assertEquals(3, lines.size());
        assertEquals("\"Name\",\"Identity\",\"Status\",\"Reason\"", lines.get(0));
        assertEquals("\"a.mp3\",\"/m/a.mp3\",\"DONE\",\"\"", lines.get(1));
        assertTrue(lines.get(2).contains("unsupported format (.txt)"));
    }

    @Test
    void testWriteMemoriesAndBookmarks() throws Exception {
        CsvService csv = new CsvService(tempDir);
        Path memories = csv.writeMemories(List.of(
            new PlaybackMemory("/m/a.mp3", 65_000, 100_000, "/m", "a", 1L)), "memories.csv");
        Path bookmarks = csv.writeBookmarks(List.of(
            new Bookmark(3L, "/m/a.mp3", 5_000, 100_000, "Intro\nline", 2L, "/m", "a")), "bookmarks.csv");

        List<String> memoryLines = Files.readAllLines(memories);
        assertEquals(2, memoryLines.size());
        assertTrue(memoryLines.get(1).contains("\"1:05\""));
        List<String> bookmarkLines = Files.readAllLines(bookmarks);
        assertEquals(2, bookmarkLines.size());
        assertTrue(bookmarkLines.get(1).contains("\"Intro line\""));
    }

    @Test
    void testInvalidArguments() {
        CsvService csv = new CsvService(tempDir);
        assertThrows(IllegalArgumentException.class, () -> csv.writeScanReport(null, "x.csv"));
        assertThrows(IllegalArgumentException.class, () -> csv.writeMemories(List.of(), " "));
        assertThrows(IllegalArgumentException.class, () -> csv.writeBookmarks(null, "b.csv"));
    }
}
