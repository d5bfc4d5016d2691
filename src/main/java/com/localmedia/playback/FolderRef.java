package com.localmedia.playback;

import java.nio.file.Path;

/**
 * Source folder of a scan: a filesystem directory or a document-provider tree.
 */
public record FolderRef(MediaKind kind, String identity) {

    public FolderRef {
        if (kind == null) throw new IllegalArgumentException("FolderRef kind cannot be null");
        if (identity == null || identity.isBlank()) throw new IllegalArgumentException("FolderRef identity cannot be blank");
    }

    public static FolderRef ofPath(Path folder) {
        return new FolderRef(MediaKind.PATH, folder.toAbsolutePath().toString());
    }

    public static FolderRef ofPath(String folder) {
        return ofPath(Path.of(folder));
    }

    public static FolderRef ofTree(String treeUri) {
        return new FolderRef(MediaKind.PROVIDER_URI, treeUri);
    }
}
