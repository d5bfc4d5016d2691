package com.localmedia.playback;

/**
 * Repeat switch understood by the {@link MediaEngine}.
 */
public enum RepeatMode {
    OFF,
    ONE,
    ALL
}
