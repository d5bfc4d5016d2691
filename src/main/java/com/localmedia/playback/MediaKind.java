package com.localmedia.playback;

/**
 * How a playable item (or folder) is addressed.
 * <ul>
 *   <li>{@link #PATH} - plain filesystem path, traversed with direct file I/O.</li>
 *   <li>{@link #PROVIDER_URI} - opaque document-provider URI, traversed through {@link DocumentProvider}.</li>
 * </ul>
 */
public enum MediaKind {
    PATH,
    PROVIDER_URI
}
