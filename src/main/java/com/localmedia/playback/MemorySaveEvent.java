package com.localmedia.playback;

/**
 * Raised to observers whenever a memory is saved on purpose: by the audiobook auto-save
 * ({@code isAutoSave == true}) or by the user ({@code isAutoSave == false}).
 */
public record MemorySaveEvent(String fileIdentity, long positionMs, String displayName, boolean isAutoSave) {}
