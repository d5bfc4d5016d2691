package com.localmedia.playback;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;
import static org.junit.jupiter.api.Assumptions.assumeTrue;

public class EngineConfigTest {

    @AfterEach
    void clearProperties() {
        System.clearProperty("PLAYBACK_TICK_INTERVAL_MS");
        System.clearProperty("PLAYBACK_DATA_DIR");
        System.clearProperty("EMBEDDED_PG_PORT");
    }

    @Test
    void testDefaults() {
        EngineConfig config = EngineConfig.defaults();
        assertEquals(300, config.tickIntervalMs());
        assertEquals(10, config.durableSaveEveryTicks());
        assertEquals(300_000, config.audiobookSaveIntervalMs());
        assertEquals(Path.of("playback-data", "last-snapshot.json"), config.snapshotFile());
        assertEquals(Path.of("playback-data", "pgdata"), config.embeddedPgDataDir());
        assertEquals("", config.dbUrl());
        assertEquals(5432, config.embeddedPgPort());
    }

    @Test
    void testSystemPropertiesOverrideDefaults() {
        assumeTrue(System.getenv("PLAYBACK_TICK_INTERVAL_MS") == null);
        assumeTrue(System.getenv("PLAYBACK_DATA_DIR") == null);
        assumeTrue(System.getenv("PLAYBACK_SNAPSHOT_FILE") == null);
        System.setProperty("PLAYBACK_TICK_INTERVAL_MS", "250");
        System.setProperty("PLAYBACK_DATA_DIR", "target/engine-data");

        EngineConfig config = EngineConfig.fromEnvironment();

        assertEquals(250, config.tickIntervalMs());
        assertEquals(Path.of("target/engine-data"), config.dataDir());
        assertEquals(Path.of("target/engine-data").resolve("last-snapshot.json"), config.snapshotFile());
        assertEquals(Path.of("target/engine-data").resolve("exports"), config.exportDir());
    }

    @Test
    void testInvalidValuesFallBack() {
        assumeTrue(System.getenv("EMBEDDED_PG_PORT") == null);
        assumeTrue(System.getenv("PLAYBACK_TICK_INTERVAL_MS") == null);
        System.setProperty("EMBEDDED_PG_PORT", "not-a-port");
        System.setProperty("PLAYBACK_TICK_INTERVAL_MS", "-1");

        EngineConfig config = EngineConfig.fromEnvironment();

        assertEquals(5432, config.embeddedPgPort());
        assertEquals(300, config.tickIntervalMs());
    }

    @Test
    void testValidation() {
        assertThrows(IllegalArgumentException.class, () -> EngineConfig.defaults().withTickInterval(0));
        assertEquals(50, EngineConfig.defaults().withTickInterval(50).tickIntervalMs());
        assertNull(EngineConfig.defaults().withSnapshotFile(null).snapshotFile());
    }
}
