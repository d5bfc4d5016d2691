package com.localmedia.playback;

import java.util.List;

/**
 * Immutable, ordered playlist of one addressing mode.
 * <p>
 * A playlist is either a {@link PathList} or a {@link UriList}; every entry of a variant carries the
 * variant's {@link MediaKind}, which is checked at construction. The session controller holds exactly one
 * Playlist reference, so a path playlist and a URI playlist can never be active at the same time.
 * <p>
 * {@code folderIdentity} is the source folder path or tree URI, {@code playlistId} an optional reference to a
 * registered {@link MusicPlaylist} (may be null).
 *
 * @author Playback Engine Team
 * @since 1.0
 */
public sealed interface Playlist permits Playlist.PathList, Playlist.UriList {

    MediaKind mode();

    List<MediaRef> entries();

    String folderIdentity();

    Long playlistId();

    default int size() {
        return entries().size();
    }

    default boolean isEmpty() {
        return entries().isEmpty();
    }

    /**
     * Position of the entry with the given identity, or -1.
     */
    default int indexOf(String identity) {
        if (identity == null) return -1;
        List<MediaRef> list = entries();
        for (int i = 0; i < list.size(); i++) {
            if (list.get(i).identity().equals(identity)) return i;
        }
        return -1;
    }

    default MediaRef get(int index) {
        List<MediaRef> list = entries();
        return index >= 0 && index < list.size() ? list.get(index) : null;
    }

    record PathList(List<MediaRef> entries, String folderIdentity, Long playlistId) implements Playlist {
        public PathList {
            entries = checked(MediaKind.PATH, entries);
            folderIdentity = folderIdentity == null ? "" : folderIdentity;
        }

        @Override
        public MediaKind mode() {
            return MediaKind.PATH;
        }
    }

    record UriList(List<MediaRef> entries, String folderIdentity, Long playlistId) implements Playlist {
        public UriList {
            entries = checked(MediaKind.PROVIDER_URI, entries);
            folderIdentity = folderIdentity == null ? "" : folderIdentity;
        }

        @Override
        public MediaKind mode() {
            return MediaKind.PROVIDER_URI;
        }
    }

    private static List<MediaRef> checked(MediaKind kind, List<MediaRef> entries) {
        if (entries == null) return List.of();
        for (MediaRef ref : entries) {
            if (ref == null || ref.kind() != kind) {
                throw new IllegalArgumentException("Playlist of mode " + kind + " cannot hold entry " + ref);
            }
        }
        return List.copyOf(entries);
    }
}
