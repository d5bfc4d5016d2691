package com.localmedia.playback;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;

/**
 * Runtime settings of the playback engine.
 * <p>
 * {@link #fromEnvironment()} reads each key from the process environment first, then from Java system
 * properties, then falls back to the default.
 *
 * @param tickIntervalMs position sampling period while playing
 * @param durableSaveEveryTicks every n-th tick also writes the durable store
 * @param audiobookSaveIntervalMs accumulated play time that triggers an audiobook auto-save
 * @param dataDir base directory of local data
 * @param snapshotFile fast snapshot file; null keeps the snapshot in memory only
 * @param dbUrl JDBC URL of the durable store; blank when an embedded server should be started
 * @param dbUser database user
 * @param dbPassword database password
 * @param embeddedPgPort port of the embedded PostgreSQL server
 * @param embeddedPgDataDir data directory of the embedded PostgreSQL server
 *
 * @author Playback Engine Team
 * @since 1.0
 */
public record EngineConfig(
    long tickIntervalMs,
    int durableSaveEveryTicks,
    long audiobookSaveIntervalMs,
    Path dataDir,
    Path snapshotFile,
    String dbUrl,
    String dbUser,
    String dbPassword,
    int embeddedPgPort,
    Path embeddedPgDataDir
) {
    private static final Logger logger = LoggerFactory.getLogger(EngineConfig.class);

    public static final long DEFAULT_TICK_INTERVAL_MS = 300L;
    public static final int DEFAULT_DURABLE_SAVE_EVERY_TICKS = 10;
    public static final long DEFAULT_AUDIOBOOK_SAVE_INTERVAL_MS = 5 * 60 * 1000L;
    public static final String DEFAULT_DATA_DIR = "playback-data";
    public static final int DEFAULT_EMBEDDED_PG_PORT = 5432;

    public EngineConfig {
        if (tickIntervalMs <= 0) throw new IllegalArgumentException("tickIntervalMs must be positive");
        if (durableSaveEveryTicks <= 0) throw new IllegalArgumentException("durableSaveEveryTicks must be positive");
        if (audiobookSaveIntervalMs <= 0) throw new IllegalArgumentException("audiobookSaveIntervalMs must be positive");
        if (dataDir == null) throw new IllegalArgumentException("dataDir cannot be null");
        dbUrl = dbUrl == null ? "" : dbUrl;
    }

    /**
     * Built-in defaults, data under {@code playback-data}.
     */
    public static EngineConfig defaults() {
        return withDataDir(Path.of(DEFAULT_DATA_DIR));
    }

    /**
     * Defaults with every file placed under the given directory.
     */
    public static EngineConfig withDataDir(Path dataDir) {
        return new EngineConfig(DEFAULT_TICK_INTERVAL_MS, DEFAULT_DURABLE_SAVE_EVERY_TICKS, DEFAULT_AUDIOBOOK_SAVE_INTERVAL_MS,
            dataDir, dataDir.resolve("last-snapshot.json"), "", "postgres", "postgres",
            DEFAULT_EMBEDDED_PG_PORT, dataDir.resolve("pgdata"));
    }

    /**
     * Resolves the configuration from environment variables and system properties.
     */
    public static EngineConfig fromEnvironment() {
        Path dataDir = Path.of(envOrProp("PLAYBACK_DATA_DIR", DEFAULT_DATA_DIR));
        String snapshot = envOrProp("PLAYBACK_SNAPSHOT_FILE", "");
        String pgData = envOrProp("EMBEDDED_PG_DATA_DIR", "");
        EngineConfig config = new EngineConfig(
            parseLong("PLAYBACK_TICK_INTERVAL_MS", DEFAULT_TICK_INTERVAL_MS),
            (int) parseLong("PLAYBACK_DURABLE_SAVE_EVERY_TICKS", DEFAULT_DURABLE_SAVE_EVERY_TICKS),
            parseLong("PLAYBACK_AUDIOBOOK_SAVE_INTERVAL_MS", DEFAULT_AUDIOBOOK_SAVE_INTERVAL_MS),
            dataDir,
            snapshot.isBlank() ? dataDir.resolve("last-snapshot.json") : Path.of(snapshot),
            envOrProp("DB_URL", ""),
            envOrProp("DB_USER", "postgres"),
            envOrProp("DB_PASS", "postgres"),
            (int) parseLong("EMBEDDED_PG_PORT", DEFAULT_EMBEDDED_PG_PORT),
            pgData.isBlank() ? dataDir.resolve("pgdata") : Path.of(pgData)
        );
        logger.debug("Resolved {}", config);
        return config;
    }

    /** Same settings with a different tick interval. */
    public EngineConfig withTickInterval(long tickMs) {
        return new EngineConfig(tickMs, durableSaveEveryTicks, audiobookSaveIntervalMs, dataDir, snapshotFile,
            dbUrl, dbUser, dbPassword, embeddedPgPort, embeddedPgDataDir);
    }

    /** Same settings with a different snapshot file (null for memory only). */
    public EngineConfig withSnapshotFile(Path file) {
        return new EngineConfig(tickIntervalMs, durableSaveEveryTicks, audiobookSaveIntervalMs, dataDir, file,
            dbUrl, dbUser, dbPassword, embeddedPgPort, embeddedPgDataDir);
    }

    /** Directory where CSV exports are written. */
    public Path exportDir() {
        return dataDir.resolve("exports");
    }

    static String envOrProp(String key, String defaultValue) {
        String value = System.getenv(key);
        if (value == null || value.isBlank()) {
            value = System.getProperty(key);
        }
        return value == null || value.isBlank() ? defaultValue : value.trim();
    }

    private static long parseLong(String key, long defaultValue) {
        String raw = envOrProp(key, Long.toString(defaultValue));
        try {
            long parsed = Long.parseLong(raw);
            if (parsed > 0) return parsed;
            logger.warn("Ignoring non-positive {}={}, using {}", key, raw, defaultValue);
        } catch (NumberFormatException e) {
            logger.warn("Ignoring invalid {}={}, using {}", key, raw, defaultValue);
        }
        return defaultValue;
    }

    @Override
    public String toString() {
        return "EngineConfig{tick=" + tickIntervalMs + "ms, durableEvery=" + durableSaveEveryTicks
            + ", audiobookInterval=" + audiobookSaveIntervalMs + "ms, dataDir=" + dataDir
            + ", snapshot=" + snapshotFile + ", dbUrl=" + (dbUrl.isBlank() ? "<embedded>" : dbUrl)
            + ", dbUser=" + dbUser + ", pgPort=" + embeddedPgPort + "}";
    }
}
