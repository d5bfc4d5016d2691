package com.localmedia.playback;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Turns scanned entries into a typed {@link Playlist} and into engine media items.
 * <p>
 * Pure data transformation: no engine or store calls happen here.
 * <p>
 * MIME resolution uses an explicit extension table. MP4-family audio (m4a, the segmented m4s variant and
 * ALAC in MP4) is declared under the container type {@code audio/mp4} so the engine picks the MP4 demuxer;
 * the elementary-stream type is only used for raw ADTS ({@code .aac}) files. Extensions without an entry
 * resolve to null, leaving the decision to the engine's own content sniffing.
 *
 * @author Playback Engine Team
 * @since 1.0
 */
public class PlaylistBuilder {

    private static final Map<String, String> MIME_TYPES = Map.ofEntries(
        Map.entry("mp3", "audio/mpeg"),
        Map.entry("m4a", "audio/mp4"),
        Map.entry("m4s", "audio/mp4"),
        Map.entry("alac", "audio/mp4"),
        Map.entry("aac", "audio/aac"),
        Map.entry("flac", "audio/flac"),
        Map.entry("wav", "audio/wav"),
        Map.entry("ogg", "audio/ogg"),
        Map.entry("opus", "audio/ogg"),
        Map.entry("mp4", "video/mp4"),
        Map.entry("mkv", "video/x-matroska"),
        Map.entry("webm", "video/webm"),
        Map.entry("avi", "video/x-msvideo"),
        Map.entry("mov", "video/quicktime"),
        Map.entry("ts", "video/mp2t"),
        Map.entry("3gp", "video/3gpp")
    );

    /**
     * Builds a playlist whose mode follows the entries' kind.
     * @param entries ordered entries, all of one kind
     * @param folderIdentity source folder path or tree URI
     * @param playlistId registered playlist id, or null
     * @return PathList or UriList; a PathList when {@code entries} is empty
     * @throws IllegalArgumentException if the entries mix kinds
     */
    public Playlist build(List<MediaRef> entries, String folderIdentity, Long playlistId) {
        MediaKind kind = entries == null || entries.isEmpty() ? MediaKind.PATH : entries.get(0).kind();
        return build(kind, entries, folderIdentity, playlistId);
    }

    public Playlist build(List<MediaRef> entries, String folderIdentity) {
        return build(entries, folderIdentity, null);
    }

    /**
     * Builds a playlist of an explicit mode.
     * @throws IllegalArgumentException if an entry does not match {@code kind}
     */
    public Playlist build(MediaKind kind, List<MediaRef> entries, String folderIdentity, Long playlistId) {
        List<MediaRef> list = entries == null ? List.of() : entries;
        if (kind == MediaKind.PROVIDER_URI) {
            return new Playlist.UriList(list, folderIdentity, playlistId);
        }
        return new Playlist.PathList(list, folderIdentity, playlistId);
    }

    /**
     * Declared media type for an entry.
     * @param ref playlist entry
     * @return MIME type, or null when the engine should sniff the content
     */
    public String resolveMime(MediaRef ref) {
        if (ref == null) return null;
        return MIME_TYPES.get(ref.extension());
    }

    /**
     * Engine media items for a playlist, in playlist order. Each item's media id is the entry's identity.
     */
    public List<EngineMediaItem> toMediaItems(Playlist playlist) {
        List<EngineMediaItem> items = new ArrayList<>();
        if (playlist == null) return items;
        for (MediaRef ref : playlist.entries()) {
            items.add(new EngineMediaItem(ref.identity(), engineUri(ref), resolveMime(ref)));
        }
        return items;
    }

    private static String engineUri(MediaRef ref) {
        if (ref.kind() == MediaKind.PATH) {
            return Path.of(ref.identity()).toUri().toString();
        }
        return ref.identity();
    }
}
