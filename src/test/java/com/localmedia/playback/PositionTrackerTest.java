package com.localmedia.playback;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tick cadence, audiobook auto-save and cancellation of the position tracker. Ticks are driven by hand;
 * durable writes run inline.
 */
public class PositionTrackerTest {
    private final PlaybackState state = new PlaybackState();
    private final InMemoryStore store = new InMemoryStore();
    private final CountingSnapshots snapshots = new CountingSnapshots();
    private final List<MemorySaveEvent> events = new ArrayList<>();
    private final List<Long> published = new ArrayList<>();
    private ScheduledExecutorService main;
    private FakeMediaEngine engine;
    private PlaybackSession session;
    private PositionTracker tracker;

    @BeforeEach
    void setUp() {
        main = Executors.newSingleThreadScheduledExecutor();
        MemoryService memory = new MemoryService(store, snapshots);
        memory.addSaveEventListener(events::add);
        PlaybackObserver observer = new PlaybackObserver() {
            @Override
            public void onPositionChanged(long positionMs, long durationMs) {
                published.add(positionMs);
            }
        };
        tracker = new PositionTracker(state, snapshots, memory, Runnable::run, main, EngineConfig.defaults(), observer);

        engine = new FakeMediaEngine();
        engine.load(List.of(new EngineMediaItem("/books/a.mp3", "file:///books/a.mp3", "audio/mpeg")), 0);
        engine.setPosition(12_000);
        session = new PlaybackSession(engine);
        state.setCurrent(0, MediaRef.ofUri("/books/a.mp3", "a.mp3"));
        state.setFolderIdentity("/books");
        state.setPlaying(true);
    }

    @AfterEach
    void tearDown() {
        tracker.stop();
        main.shutdownNow();
    }

    @Test
    void testTenTicksWriteTenSnapshotsAndOneDurableRecord() {
        PeriodicTask task = tracker.prepare(session);
        for (int i = 0; i < 10; i++) {
            tracker.tick(task);
        }

        assertEquals(10, snapshots.puts.get());
        assertEquals(1, store.upserts.get());
        assertEquals(12_000, store.getMemory("/books/a.mp3").positionMs());
        assertEquals(12_000, state.getPositionMs());
        assertEquals(180_000, state.getDurationMs());
        assertEquals(10, published.size());
        assertTrue(events.isEmpty());
    }

    @Test
    void testAudiobookAutoSaveFiresOncePerInterval() {
        state.setAudiobookMode(true);
        PeriodicTask task = tracker.prepare(session);

        for (int i = 0; i < 999; i++) tracker.tick(task);
        assertTrue(events.isEmpty());
        assertEquals(299_700, tracker.getAudiobookAccumulatedMs());

        tracker.tick(task);
        assertEquals(1, events.size());
        assertTrue(events.get(0).isAutoSave());
        assertEquals(0, tracker.getAudiobookAccumulatedMs());

        for (int i = 0; i < 999; i++) tracker.tick(task);
        assertEquals(1, events.size());

        tracker.tick(task);
        assertEquals(2, events.size());
    }

    @Test
    void testAccumulatorSurvivesPauseAndResetsOnToggle() {
        state.setAudiobookMode(true);
        PeriodicTask task = tracker.prepare(session);
        for (int i = 0; i < 5; i++) tracker.tick(task);
        assertEquals(1_500, tracker.getAudiobookAccumulatedMs());

        state.setPlaying(false);
        tracker.tick(task);
        assertEquals(1_500, tracker.getAudiobookAccumulatedMs());

        state.setPlaying(true);
        PeriodicTask resumed = tracker.prepare(session);
        tracker.tick(resumed);
        assertEquals(1_800, tracker.getAudiobookAccumulatedMs());

        tracker.resetAudiobookAccumulator();
        assertEquals(0, tracker.getAudiobookAccumulatedMs());
    }

    @Test
    void testNoAccumulationOutsideAudiobookMode() {
        PeriodicTask task = tracker.prepare(session);
        for (int i = 0; i < 1_000; i++) tracker.tick(task);
        assertEquals(0, tracker.getAudiobookAccumulatedMs());
        assertTrue(events.isEmpty());
        assertEquals(100, store.upserts.get());
    }

    @Test
    void testCancelledTickWritesNothing() {
        PeriodicTask task = tracker.prepare(session);
        tracker.stop();
        tracker.tick(task);

        assertTrue(task.isCancelled());
        assertEquals(0, snapshots.puts.get());
        assertEquals(0, tracker.getTickCount());
    }

    @Test
    void testStartReplacesPreviousTask() {
        PeriodicTask first = tracker.prepare(session);
        PeriodicTask second = tracker.prepare(session);

        assertTrue(first.isCancelled());
        assertFalse(second.isCancelled());
        tracker.tick(first);
        assertEquals(0, snapshots.puts.get());
        tracker.tick(second);
        assertEquals(1, snapshots.puts.get());
    }

    @Test
    void testReleasedSessionWritesNothing() {
        PeriodicTask task = tracker.prepare(session);
        session.release();
        tracker.tick(task);
        assertEquals(0, snapshots.puts.get());
    }

    @Test
    void testScheduledTicksRunUntilStopped() throws InterruptedException {
        PositionTracker fast = new PositionTracker(state, snapshots, new MemoryService(store, snapshots), Runnable::run, main,
            EngineConfig.defaults().withTickInterval(5), new PlaybackObserver() { });
        snapshots.latch = new CountDownLatch(3);

        main.execute(() -> fast.start(session));

        assertTrue(snapshots.latch.await(5, TimeUnit.SECONDS));
        main.execute(fast::stop);
        assertTrue(snapshots.puts.get() >= 3);
    }

    private static final class CountingSnapshots implements SnapshotServiceInterface {
        final AtomicInteger puts = new AtomicInteger();
        volatile CountDownLatch latch;
        private volatile PlaybackMemory last;

        @Override
        public void put(String fileIdentity, long positionMs, long durationMs, String folderIdentity, String displayName) {
            puts.incrementAndGet();
            last = new PlaybackMemory(fileIdentity, positionMs, durationMs, folderIdentity, displayName, System.currentTimeMillis());
            CountDownLatch l = latch;
            if (l != null) l.countDown();
        }

        @Override
        public PlaybackMemory getLast() {
            return last;
        }

        @Override
        public void flush() {
        }
    }
}
