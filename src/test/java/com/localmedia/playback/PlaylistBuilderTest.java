package com.localmedia.playback;

import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class PlaylistBuilderTest {
    private final PlaylistBuilder builder = new PlaylistBuilder();

    @Test
    void testBuildChoosesVariantFromEntries() {
        MediaRef a = MediaRef.ofPath(Path.of("/music/a.mp3"));
        MediaRef b = MediaRef.ofUri("content://tree/doc/b", "b.flac");

        Playlist paths = builder.build(List.of(a), "/music");
        Playlist uris = builder.build(List.of(b), "content://tree", 7L);

        assertInstanceOf(Playlist.PathList.class, paths);
        assertEquals(MediaKind.PATH, paths.mode());
        assertNull(paths.playlistId());
        assertInstanceOf(Playlist.UriList.class, uris);
        assertEquals(7L, uris.playlistId());
    }

    @Test
    void testMixedEntriesAreRejected() {
        MediaRef a = MediaRef.ofPath(Path.of("/music/a.mp3"));
        MediaRef b = MediaRef.ofUri("content://tree/doc/b", "b.flac");
        assertThrows(IllegalArgumentException.class, () -> builder.build(List.of(a, b), "/music"));
        assertThrows(IllegalArgumentException.class, () -> builder.build(MediaKind.PROVIDER_URI, List.of(a), "x", null));
    }

    @Test
    void testEmptyPlaylist() {
        assertInstanceOf(Playlist.PathList.class, builder.build(List.of(), "/music"));
        Playlist uris = builder.build(MediaKind.PROVIDER_URI, List.of(), "content://tree", null);
        assertInstanceOf(Playlist.UriList.class, uris);
        assertTrue(uris.isEmpty());
    }

    @Test
    void testResolveMime() {
        assertEquals("audio/mpeg", builder.resolveMime(MediaRef.ofUri("u:1", "x.MP3")));
        assertEquals("audio/mp4", builder.resolveMime(MediaRef.ofUri("u:2", "x.m4a")));
        assertEquals("audio/mp4", builder.resolveMime(MediaRef.ofUri("u:3", "x.m4s")));
        assertEquals("audio/aac", builder.resolveMime(MediaRef.ofUri("u:4", "x.aac")));
        assertEquals("audio/ogg", builder.resolveMime(MediaRef.ofUri("u:5", "x.opus")));
        assertEquals("video/x-matroska", builder.resolveMime(MediaRef.ofUri("u:6", "x.mkv")));
        assertEquals("video/mp2t", builder.resolveMime(MediaRef.ofUri("u:7", "x.ts")));
        assertNull(builder.resolveMime(MediaRef.ofUri("u:8", "x.wma")));
        assertNull(builder.resolveMime(MediaRef.ofUri("u:9", "x.ape")));
        assertNull(builder.resolveMime(MediaRef.ofUri("u:10", "noext")));
    }

    @Test
    void testToMediaItems() {
        Path file = Path.of("/music/a b.flac").toAbsolutePath();
        MediaRef path = MediaRef.ofPath(file);
        MediaRef uri = MediaRef.ofUri("content://tree/doc/b", "b.mp3");

        EngineMediaItem fromPath = builder.toMediaItems(builder.build(List.of(path), "/music")).get(0);
        EngineMediaItem fromUri = builder.toMediaItems(builder.build(List.of(uri), "content://tree")).get(0);

        assertEquals(path.identity(), fromPath.mediaId());
        assertEquals(file.toUri().toString(), fromPath.uri());
        assertEquals("audio/flac", fromPath.mimeType());
        assertEquals("content://tree/doc/b", fromUri.mediaId());
        assertEquals("content://tree/doc/b", fromUri.uri());
    }

    @Test
    void testIndexOf() {
        Playlist list = builder.build(List.of(
            MediaRef.ofUri("content://t/1", "one.mp3"),
            MediaRef.ofUri("content://t/2", "two.mp3")), "content://t");
        assertEquals(1, list.indexOf("content://t/2"));
        assertEquals(-1, list.indexOf("content://t/3"));
        assertEquals(-1, list.indexOf(null));
        assertNull(list.get(5));
    }
}
