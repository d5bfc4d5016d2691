package com.localmedia.playback;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.function.Consumer;

/**
 * Scripted engine: records every command and emits the events a real engine would, synchronously.
 * Throws {@link IllegalStateException} once released.
 */
class FakeMediaEngine implements MediaEngine {
    final List<String> calls = Collections.synchronizedList(new ArrayList<>());
    private List<EngineMediaItem> items = List.of();
    private Consumer<EngineEvent> listener;
    private int index = -1;
    private long position;
    private long duration = 180_000L;
    private boolean playing;
    private boolean released;
    private RepeatMode repeatMode = RepeatMode.OFF;
    private boolean shuffle;

    @Override
    public synchronized void load(List<EngineMediaItem> items, int startIndex) {
        checkAlive();
        calls.add("load:" + startIndex);
        this.items = List.copyOf(items);
        this.index = startIndex;
        this.position = 0L;
        emit(new EngineEvent.Transition(startIndex, items.get(startIndex).mediaId()));
    }

    @Override
    public synchronized void prepare() {
        checkAlive();
        calls.add("prepare");
        emit(new EngineEvent.StateChanged(EngineEvent.State.READY));
    }

    @Override
    public synchronized void play() {
        checkAlive();
        calls.add("play");
        if (!playing) {
            playing = true;
            emit(new EngineEvent.IsPlayingChanged(true));
        }
    }

    @Override
    public synchronized void pause() {
        checkAlive();
        calls.add("pause");
        if (playing) {
            playing = false;
            emit(new EngineEvent.IsPlayingChanged(false));
        }
    }

    @Override
    public synchronized void seekTo(int index, long positionMs) {
        checkAlive();
        calls.add("seek:" + index + ":" + positionMs);
        position = positionMs;
        if (index != this.index) moveTo(index);
    }

    @Override
    public synchronized void seekTo(long positionMs) {
        checkAlive();
        calls.add("seek:" + positionMs);
        position = positionMs;
    }

    @Override
    public synchronized void seekToNext() {
        checkAlive();
        calls.add("next");
        position = 0L;
        moveTo(index + 1);
    }

    @Override
    public synchronized void seekToPrevious() {
        checkAlive();
        calls.add("previous");
        position = 0L;
        moveTo(index - 1);
    }

    @Override
    public synchronized boolean hasNextMediaItem() {
        checkAlive();
        return index + 1 < items.size();
    }

    @Override
    public synchronized boolean hasPreviousMediaItem() {
        checkAlive();
        return index > 0;
    }

    @Override
    public synchronized long getCurrentPosition() {
        checkAlive();
        return position;
    }

    @Override
    public synchronized long getDuration() {
        checkAlive();
        return duration;
    }

    @Override
    public synchronized void setRepeatMode(RepeatMode repeatMode) {
        checkAlive();
        this.repeatMode = repeatMode;
    }

    @Override
    public synchronized void setShuffleModeEnabled(boolean enabled) {
        checkAlive();
        this.shuffle = enabled;
    }

    @Override
    public synchronized void setEventListener(Consumer<EngineEvent> listener) {
        checkAlive();
        this.listener = listener;
    }

    @Override
    public synchronized void release() {
        checkAlive();
        calls.add("release");
        released = true;
    }

    /** Simulates the engine reaching the end of the current item. */
    synchronized void finishTrack() {
        playing = false;
        emit(new EngineEvent.IsPlayingChanged(false));
        emit(new EngineEvent.StateChanged(EngineEvent.State.ENDED));
    }

    synchronized void setPosition(long positionMs) {
        this.position = positionMs;
    }

    synchronized int index() {
        return index;
    }

    synchronized RepeatMode repeatMode() {
        return repeatMode;
    }

    synchronized boolean shuffle() {
        return shuffle;
    }

    synchronized boolean isReleased() {
        return released;
    }

    List<String> callsSnapshot() {
        synchronized (calls) {
            return new ArrayList<>(calls);
        }
    }

    private void moveTo(int next) {
        index = next;
        emit(new EngineEvent.Transition(next, items.get(next).mediaId()));
    }

    private void emit(EngineEvent event) {
        if (listener != null) listener.accept(event);
    }

    private void checkAlive() {
        if (released) throw new IllegalStateException("engine released");
    }
}
