package com.localmedia.playback;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for library discovery: filesystem and document-provider traversal, diagnostics and listings.
 */
public class ScannerServiceTest {
    private static final String TREE = "content://media.tree/primary%3AMusic";

    @TempDir
    Path tempDir;

    @Test
    void testDiagnosticScanReportsEveryEntryInNameOrder() {
        InMemoryDocumentProvider provider = new InMemoryDocumentProvider();
        InMemoryDocumentProvider.Node root = provider.tree(TREE);
        root.file("c.flac");
        root.dir("d").unlistable();
        root.file("b.txt");
        root.file("a.mp3");

        ScanResult result = new ScannerService(provider).scanDiagnostic(FolderRef.ofTree(TREE));

        assertEquals(4, result.totalCount());
        assertEquals(2, result.doneCount());
        assertEquals(1, result.passCount());
        assertEquals(1, result.errCount());
        assertEquals(result.totalCount(), result.doneCount() + result.passCount() + result.errCount());
        List<String> lines = result.items().stream().map(ScanResultItem::describe).collect(Collectors.toList());
        assertEquals(List.of(
            "[done] a.mp3",
            "[pass] b.txt: unsupported format (.txt)",
            "[done] c.flac",
            "[err] d: unreadable"
        ), lines);
    }

    @Test
    void testDiagnosticScanOfMissingFolder() {
        ScanResult result = new ScannerService().scanDiagnostic(FolderRef.ofPath(tempDir.resolve("nope")));
        assertEquals(1, result.totalCount());
        assertEquals(1, result.errCount());
        assertEquals("directory does not exist", result.items().get(0).reason());
    }

    @Test
    void testDiagnosticScanWithoutProvider() {
        ScanResult result = new ScannerService().scanDiagnostic(FolderRef.ofTree(TREE));
        assertEquals(1, result.errCount());
        assertEquals("no document provider", result.items().get(0).reason());
    }

    @Test
    void testDiagnosticScanOfFilesystemFolder() throws IOException {
        Files.createFile(tempDir.resolve("track.m4s"));
        Files.createFile(tempDir.resolve("README"));
        Path sub = Files.createDirectory(tempDir.resolve("extra"));
        Files.createFile(sub.resolve("Song.OPUS"));

        ScanResult result = new ScannerService().scanDiagnostic(FolderRef.ofPath(tempDir));

        List<String> lines = result.items().stream().map(ScanResultItem::describe).collect(Collectors.toList());
        assertEquals(List.of(
            "[done] Song.OPUS",
            "[pass] README: unsupported format (no extension)",
            "[done] track.m4s"
        ), lines);
        assertEquals(2, result.doneCount());
    }

    @Test
    void testScanSortsWholeResultByDisplayName() throws IOException {
        Path sub = Files.createDirectory(tempDir.resolve("sub"));
        Files.createFile(tempDir.resolve("B Song.mp3"));
        Files.createFile(sub.resolve("a song.flac"));
        Files.createFile(tempDir.resolve("Video.MKV"));
        Files.createFile(tempDir.resolve("notes.txt"));

        List<MediaRef> refs = new ScannerService().scan(FolderRef.ofPath(tempDir));

        assertEquals(List.of("a song", "B Song", "Video"),
            refs.stream().map(MediaRef::displayName).collect(Collectors.toList()));
        assertTrue(refs.stream().allMatch(r -> r.kind() == MediaKind.PATH));
        assertEquals(sub.resolve("a song.flac").toAbsolutePath().toString(), refs.get(0).identity());
        assertEquals("mkv", refs.get(2).extension());
    }

    @Test
    void testScanOfMissingFolderIsEmpty() {
        assertTrue(new ScannerService().scan(FolderRef.ofPath(tempDir.resolve("missing"))).isEmpty());
        assertTrue(new ScannerService().scan(null).isEmpty());
    }

    @Test
    void testScanOfProviderTree() {
        InMemoryDocumentProvider provider = new InMemoryDocumentProvider();
        InMemoryDocumentProvider.Node root = provider.tree(TREE);
        root.dir("Disc 2").file("zeta.ogg");
        root.file("Alpha.wav");
        root.file("cover.jpg");
        root.dir("broken").unlistable();

        List<MediaRef> refs = new ScannerService(provider).scan(FolderRef.ofTree(TREE));

        assertEquals(List.of("Alpha", "zeta"), refs.stream().map(MediaRef::displayName).collect(Collectors.toList()));
        assertTrue(refs.stream().allMatch(r -> r.kind() == MediaKind.PROVIDER_URI));
    }

    @Test
    void testListFolderKeepsSubfoldersAndFilesApart() throws IOException {
        Files.createDirectory(tempDir.resolve("Zed"));
        Files.createDirectory(tempDir.resolve("alpha"));
        Files.createFile(tempDir.resolve("b.mp3"));
        Files.createFile(tempDir.resolve("A.flac"));
        Files.createFile(tempDir.resolve("skip.pdf"));

        FolderListing listing = new ScannerService().listFolder(FolderRef.ofPath(tempDir));

        assertEquals(List.of("alpha", "Zed"),
            listing.subfolders().stream().map(f -> Utils.folderName(f.identity())).collect(Collectors.toList()));
        assertEquals(List.of("A.flac", "b.mp3"),
            listing.files().stream().map(MediaRef::fileName).collect(Collectors.toList()));
    }

    @Test
    void testListFolderOfMissingFolderIsEmpty() {
        FolderListing listing = new ScannerService().listFolder(FolderRef.ofPath(tempDir.resolve("gone")));
        assertTrue(listing.subfolders().isEmpty());
        assertTrue(listing.files().isEmpty());
    }

    @Test
    void testMalformedFolderPathDegradesToEmpty() {
        FolderRef malformed = new FolderRef(MediaKind.PATH, "books\u0000broken");
        ScannerService scanner = new ScannerService();

        assertTrue(scanner.scan(malformed).isEmpty());
        FolderListing listing = scanner.listFolder(malformed);
        assertTrue(listing.subfolders().isEmpty());
        assertTrue(listing.files().isEmpty());

        ScanResult result = scanner.scanDiagnostic(malformed);
        assertEquals(1, result.errCount());
        assertEquals("directory does not exist", result.items().get(0).reason());
    }

    @Test
    void testSupportedExtensionsAreCaseInsensitive() {
        assertTrue(ScannerService.isSupportedFile("a.MP3"));
        assertTrue(ScannerService.isSupportedFile("clip.3gp"));
        assertTrue(ScannerService.isSupportedFile("segment.m4s"));
        assertFalse(ScannerService.isSupportedFile("mp3"));
        assertFalse(ScannerService.isSupportedFile("notes.txt"));
    }
}
