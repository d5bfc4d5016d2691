package com.localmedia.playback;

import java.util.List;

/**
 * One level of a folder for browsing views: subfolders sorted by name, then supported files sorted by name.
 * The two lists are kept apart and never merged into one ordering.
 */
public record FolderListing(FolderRef folder, List<FolderRef> subfolders, List<MediaRef> files) {

    public FolderListing {
        subfolders = subfolders == null ? List.of() : List.copyOf(subfolders);
        files = files == null ? List.of() : List.copyOf(files);
    }

    public static FolderListing empty(FolderRef folder) {
        return new FolderListing(folder, List.of(), List.of());
    }
}
