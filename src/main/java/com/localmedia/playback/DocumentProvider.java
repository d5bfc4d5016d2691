package com.localmedia.playback;

/**
 * OS document-provider abstraction: resolves granted tree URIs to traversable nodes.
 */
public interface DocumentProvider {

    /**
     * @param treeUri tree URI granted for a folder
     * @return root node of the tree, or null if the URI cannot be resolved
     */
    DocumentNode fromTreeUri(String treeUri);
}
