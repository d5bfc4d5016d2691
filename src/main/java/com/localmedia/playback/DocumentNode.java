package com.localmedia.playback;

import java.util.List;

/**
 * A file or directory exposed by a {@link DocumentProvider}. Nodes carry no filesystem path; they are
 * identified by an opaque URI string.
 */
public interface DocumentNode {

    /** Display name including extension; may be null if the provider does not know it. */
    String name();

    /** Provider URI of this node. */
    String identity();

    boolean isDirectory();

    boolean isFile();

    boolean exists();

    boolean canRead();

    /**
     * Lists the direct children of a directory node.
     * @return children, or null when the provider cannot produce a listing
     */
    List<DocumentNode> listChildren();
}
