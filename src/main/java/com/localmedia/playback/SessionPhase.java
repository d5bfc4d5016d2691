package com.localmedia.playback;

/**
 * Phase of the playback session state machine: {@code IDLE -> LOADED -> PLAYING <-> PAUSED -> ENDED},
 * with LOADED re-entered on every track transition.
 */
public enum SessionPhase {
    IDLE,
    LOADED,
    PLAYING,
    PAUSED,
    ENDED
}
