package com.localmedia.playback;

import java.nio.file.Path;

/**
 * Immutable identity of one playable item.
 * <p>
 * {@code identity} is the absolute path (for {@link MediaKind#PATH}) or the provider URI string
 * (for {@link MediaKind#PROVIDER_URI}); it is unique within a playlist and is used as the engine-facing
 * media id. {@code displayName} is the file name without its extension, {@code extension} is lower case
 * without the dot.
 *
 * @author Playback Engine Team
 * @since 1.0
 */
public record MediaRef(MediaKind kind, String identity, String displayName, String extension) {

    public MediaRef {
        if (kind == null) throw new IllegalArgumentException("MediaRef kind cannot be null");
        if (identity == null || identity.isBlank()) throw new IllegalArgumentException("MediaRef identity cannot be blank");
        displayName = displayName == null ? "" : displayName;
        extension = extension == null ? "" : extension;
    }

    /**
     * Creates a reference for a file on the local filesystem.
     * @param file file path (made absolute)
     * @return MediaRef of kind PATH
     */
    public static MediaRef ofPath(Path file) {
        Path absolute = file.toAbsolutePath();
        String fileName = absolute.getFileName() == null ? absolute.toString() : absolute.getFileName().toString();
        return new MediaRef(MediaKind.PATH, absolute.toString(), Utils.stripExtension(fileName), Utils.extensionOf(fileName));
    }

    /**
     * Creates a reference for a document exposed by a provider.
     * @param uri provider URI of the document
     * @param fileName document display name as reported by the provider (with extension)
     * @return MediaRef of kind PROVIDER_URI
     */
    public static MediaRef ofUri(String uri, String fileName) {
        return new MediaRef(MediaKind.PROVIDER_URI, uri, Utils.stripExtension(fileName), Utils.extensionOf(fileName));
    }

    /**
     * Creates a reference from a provider node.
     */
    public static MediaRef ofNode(DocumentNode node) {
        return ofUri(node.identity(), node.name());
    }

    /** File name as shown in listings: display name plus extension. */
    public String fileName() {
        return extension.isEmpty() ? displayName : displayName + "." + extension;
    }
}
