package com.localmedia.playback;

/**
 * An imported folder registered as a playlist (one folder = one playlist), together with where playback
 * in that folder last stopped.
 *
 * @param folderIdentity folder path or tree URI, unique
 * @param name title shown for the folder, editable
 * @param description free text, editable, never null
 * @param trackCount number of playable files found by the last diagnostic scan
 * @param lastPlayedAt epoch millis, 0 if never played
 * @param lastFileIdentity identity of the file last saved in this folder, or null
 * @param lastPositionMs saved position in that file
 * @param lastDurationMs known duration of that file
 * @param lastDisplayName display name of that file, or null
 */
public record MusicPlaylist(
    long id,
    String folderIdentity,
    String name,
    String description,
    int trackCount,
    long importedAt,
    long lastPlayedAt,
    String lastFileIdentity,
    long lastPositionMs,
    long lastDurationMs,
    String lastDisplayName
) {

    public MusicPlaylist {
        description = description == null ? "" : description;
    }

    /** Whether a file of this folder has been saved since it was imported. */
    public boolean hasResumePoint() {
        return lastFileIdentity != null && !lastFileIdentity.isBlank();
    }
}
