package com.localmedia.playback;

/**
 * Descriptive tags of a track as returned by a {@link MetadataLoader}. Fields may be empty, never null.
 */
public record TrackMetadata(String title, String artist, String album) {

    public TrackMetadata {
        title = title == null ? "" : title;
        artist = artist == null ? "" : artist;
        album = album == null ? "" : album;
    }
}
