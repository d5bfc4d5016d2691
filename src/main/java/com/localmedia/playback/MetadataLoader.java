package com.localmedia.playback;

import java.io.IOException;

/**
 * Extracts title/artist/album tags. Called off the main context by the {@link PlaybackService};
 * the result is marshalled back and published to observers.
 */
@FunctionalInterface
public interface MetadataLoader {

    TrackMetadata load(MediaRef ref) throws IOException;

    /** Loader that only knows the file's display name. */
    static MetadataLoader fromDisplayName() {
        return ref -> new TrackMetadata(ref.displayName(), "", "");
    }
}
