package com.localmedia.playback;

/**
 * User-facing play mode and its mapping onto the engine's repeat/shuffle switches.
 */
public enum PlayMode {
    SEQUENTIAL(RepeatMode.ALL, false),
    SHUFFLE(RepeatMode.ALL, true),
    REPEAT_ONE(RepeatMode.ONE, false);

    private final RepeatMode repeatMode;
    private final boolean shuffle;

    PlayMode(RepeatMode repeatMode, boolean shuffle) {
        this.repeatMode = repeatMode;
        this.shuffle = shuffle;
    }

    public RepeatMode repeatMode() {
        return repeatMode;
    }

    public boolean shuffle() {
        return shuffle;
    }

    /** Sequential -> Shuffle -> RepeatOne -> Sequential. */
    public PlayMode next() {
        switch (this) {
            case SEQUENTIAL:
                return SHUFFLE;
            case SHUFFLE:
                return REPEAT_ONE;
            default:
                return SEQUENTIAL;
        }
    }
}
