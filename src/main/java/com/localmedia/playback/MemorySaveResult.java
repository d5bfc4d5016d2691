package com.localmedia.playback;

/**
 * What a manual save captured.
 */
public record MemorySaveResult(String fileIdentity, long positionMs, long durationMs, String displayName) {}
