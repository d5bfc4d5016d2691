package com.localmedia.playback;

import java.util.List;

/**
 * Discovers playable media under a folder, either through the filesystem or through a document provider.
 */
public interface ScannerServiceInterface {
    /**
     * Recursively collects every supported file under the folder and sorts the whole result once by
     * display name (not per directory). Used to build playable queues.
     * @param folder folder path or tree URI
     * @return ordered entries; empty if the folder is missing or unreadable
     */
    List<MediaRef> scan(FolderRef folder);

    /**
     * Lists one level of the folder for browsing: subfolders sorted by name, then supported files sorted by name.
     * @param folder folder path or tree URI
     * @return listing; empty if the folder is missing or unreadable
     */
    FolderListing listFolder(FolderRef folder);

    /**
     * Walks the folder and reports the outcome for every visited entry. Never throws: failures become
     * {@link ScanStatus#ERR} items with a reason.
     * @param folder folder path or tree URI
     * @return diagnostic result
     */
    ScanResult scanDiagnostic(FolderRef folder);
}
