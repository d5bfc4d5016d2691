package com.localmedia.playback;

/**
 * Observable playback state of one {@link PlaybackService}.
 * <p>
 * Written only from the service's main execution context (by the session controller and the
 * {@link PositionTracker}); fields are volatile so observers on other threads always see whole values.
 *
 * @author Playback Engine Team
 * @since 1.0
 */
public class PlaybackState {
    private volatile MediaRef currentRef;
    private volatile String folderIdentity = "";
    private volatile long positionMs;
    private volatile long durationMs;
    private volatile boolean playing;
    private volatile PlayMode playMode = PlayMode.SEQUENTIAL;
    private volatile boolean audiobookMode;
    private volatile int currentIndex = -1;
    private volatile SessionPhase phase = SessionPhase.IDLE;

    public MediaRef getCurrentRef() {
        return currentRef;
    }

    public String getFolderIdentity() {
        return folderIdentity;
    }

    public long getPositionMs() {
        return positionMs;
    }

    public long getDurationMs() {
        return durationMs;
    }

    public boolean isPlaying() {
        return playing;
    }

    public PlayMode getPlayMode() {
        return playMode;
    }

    public boolean isAudiobookMode() {
        return audiobookMode;
    }

    public int getCurrentIndex() {
        return currentIndex;
    }

    public SessionPhase getPhase() {
        return phase;
    }

    void setCurrent(int index, MediaRef ref) {
        this.currentIndex = index;
        this.currentRef = ref;
    }

    void setFolderIdentity(String folderIdentity) {
        this.folderIdentity = folderIdentity == null ? "" : folderIdentity;
    }

    void setPosition(long positionMs, long durationMs) {
        this.positionMs = Math.max(0L, positionMs);
        this.durationMs = Math.max(0L, durationMs);
    }

    void setDurationMs(long durationMs) {
        this.durationMs = Math.max(0L, durationMs);
    }

    void setPlaying(boolean playing) {
        this.playing = playing;
    }

    void setPlayMode(PlayMode playMode) {
        this.playMode = playMode == null ? PlayMode.SEQUENTIAL : playMode;
    }

    void setAudiobookMode(boolean audiobookMode) {
        this.audiobookMode = audiobookMode;
    }

    void setPhase(SessionPhase phase) {
        this.phase = phase;
    }

    /** Clears the item-related fields; play mode and audiobook mode are user preferences and survive. */
    void reset() {
        currentRef = null;
        folderIdentity = "";
        positionMs = 0L;
        durationMs = 0L;
        playing = false;
        currentIndex = -1;
        phase = SessionPhase.IDLE;
    }

    @Override
    public String toString() {
        return "PlaybackState{ref=" + (currentRef == null ? null : currentRef.identity())
            + ", index=" + currentIndex + ", pos=" + positionMs + "/" + durationMs
            + ", playing=" + playing + ", mode=" + playMode + ", audiobook=" + audiobookMode + ", phase=" + phase + "}";
    }
}
