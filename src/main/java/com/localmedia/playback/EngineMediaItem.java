package com.localmedia.playback;

/**
 * Engine-facing description of one playlist entry.
 *
 * @param mediaId the entry's {@link MediaRef#identity()}, echoed back in transition events
 * @param uri location the engine opens (file URI or provider URI)
 * @param mimeType declared media type, or null to let the engine sniff the content
 */
public record EngineMediaItem(String mediaId, String uri, String mimeType) {}
