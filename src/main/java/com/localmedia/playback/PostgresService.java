package com.localmedia.playback;

import io.zonky.test.db.postgres.embedded.EmbeddedPostgres;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Paths;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.List;

/**
 * Service for interacting with the PostgreSQL database holding playback memories, bookmarks and playlists.
 * <p>
 * Workflow:
 * <ul>
 *   <li>{@code playback_memory} is keyed by {@code file_identity}; saves are {@code INSERT ... ON CONFLICT DO UPDATE}
 *   so a file never has more than one memory.</li>
 *   <li>{@code bookmarks} rows always get a new generated id; many may exist per file.</li>
 *   <li>{@code music_playlists} is keyed by {@code folder_identity}; re-importing a folder refreshes its track
 *   count only. Each memory save inside a registered folder also moves the folder's resume point.</li>
 * </ul>
 * <p>
 * Error Handling: every {@link SQLException} is logged and turned into null, an empty list or -1. A lookup
 * miss and a failed lookup look the same to callers: playback then simply starts from 0.
 *
 * @author Playback Engine Team
 * @since 1.0
 */
public class PostgresService implements PostgresServiceInterface {
    private static final Logger logger = LoggerFactory.getLogger(PostgresService.class);
    private final String url;
    private final String user;
    private final String password;

    private static final String MEMORY_COLUMNS = "file_identity, position_ms, duration_ms, folder_identity, display_name, saved_at";
    private static final String BOOKMARK_COLUMNS = "id, file_identity, position_ms, duration_ms, label, created_at, folder_identity, display_name";
    private static final String PLAYLIST_COLUMNS = "id, folder_identity, name, description, track_count, imported_at, last_played_at, " +
            "last_file_identity, last_position_ms, last_duration_ms, last_display_name";

    /**
     * Constructs a PostgresService with the given connection parameters.
     * @param url JDBC URL
     * @param user Database user
     * @param password Database password
     */
    public PostgresService(String url, String user, String password) {
        this.url = url;
        this.user = user;
        this.password = password;
    }

    /**
     * Opens a new database connection.
     * @return Connection
     * @throws SQLException if connection fails
     */
    public Connection connect() throws SQLException {
        return DriverManager.getConnection(url, user, password);
    }

    @Override
    public void createTables() {
        String memoryTable = "CREATE TABLE IF NOT EXISTS playback_memory (" +
                "file_identity TEXT PRIMARY KEY, " +
                "position_ms BIGINT NOT NULL, " +
                "duration_ms BIGINT NOT NULL, " +
                "folder_identity TEXT, " +
                "display_name TEXT, " +
                "saved_at BIGINT NOT NULL" +
                ")";
        String memoryNameIndex = "CREATE INDEX IF NOT EXISTS playback_memory_display_name_idx ON playback_memory (lower(display_name))";
        String bookmarkTable = "CREATE TABLE IF NOT EXISTS bookmarks (" +
                "id BIGSERIAL PRIMARY KEY, " +
                "file_identity TEXT NOT NULL, " +
                "position_ms BIGINT NOT NULL, " +
                "duration_ms BIGINT NOT NULL, " +
                "label TEXT, " +
                "created_at BIGINT NOT NULL, " +
                "folder_identity TEXT, " +
                "display_name TEXT" +
                ")";
        String bookmarkIndex = "CREATE INDEX IF NOT EXISTS bookmarks_file_position_idx ON bookmarks (file_identity, position_ms)";
        String playlistTable = "CREATE TABLE IF NOT EXISTS music_playlists (" +
                "id BIGSERIAL PRIMARY KEY, " +
                "folder_identity TEXT UNIQUE NOT NULL, " +
                "name TEXT, " +
                "track_count INTEGER NOT NULL DEFAULT 0, " +
                "imported_at BIGINT NOT NULL, " +
                "last_played_at BIGINT NOT NULL DEFAULT 0" +
                ")";
        String[] playlistResumeColumns = {
                "ALTER TABLE music_playlists ADD COLUMN IF NOT EXISTS description TEXT NOT NULL DEFAULT ''",
                "ALTER TABLE music_playlists ADD COLUMN IF NOT EXISTS last_file_identity TEXT",
                "ALTER TABLE music_playlists ADD COLUMN IF NOT EXISTS last_position_ms BIGINT NOT NULL DEFAULT 0",
                "ALTER TABLE music_playlists ADD COLUMN IF NOT EXISTS last_duration_ms BIGINT NOT NULL DEFAULT 0",
                "ALTER TABLE music_playlists ADD COLUMN IF NOT EXISTS last_display_name TEXT"
        };
        try (Connection conn = connect(); Statement stmt = conn.createStatement()) {
            stmt.execute(memoryTable);
            stmt.execute(memoryNameIndex);
            stmt.execute(bookmarkTable);
            stmt.execute(bookmarkIndex);
            stmt.execute(playlistTable);
            for (String column : playlistResumeColumns) {
                stmt.execute(column);
            }
            logger.info("Ensured playback_memory, bookmarks and music_playlists tables exist.");
        } catch (SQLException e) {
            logger.error("Error creating tables: {}", e.getMessage());
        }
    }

    // --- playback memory ---

    @Override
    public void upsertMemory(PlaybackMemory memory) {
        if (memory == null || memory.fileIdentity() == null || memory.fileIdentity().isBlank()) {
            logger.warn("Invalid memory for DB upsert: {}", memory);
            return;
        }
        String sql = "INSERT INTO playback_memory (" + MEMORY_COLUMNS + ") VALUES (?, ?, ?, ?, ?, ?) " +
                "ON CONFLICT (file_identity) DO UPDATE SET position_ms = EXCLUDED.position_ms, " +
                "duration_ms = EXCLUDED.duration_ms, folder_identity = EXCLUDED.folder_identity, " +
                "display_name = EXCLUDED.display_name, saved_at = EXCLUDED.saved_at";
        try (Connection conn = connect(); PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setString(1, memory.fileIdentity());
            ps.setLong(2, memory.positionMs());
            ps.setLong(3, memory.durationMs());
            ps.setString(4, memory.folderIdentity());
            ps.setString(5, memory.displayName());
            ps.setLong(6, memory.savedAt());
            ps.executeUpdate();
            logger.debug("Saved memory {} at {} ms", memory.fileIdentity(), memory.positionMs());
        } catch (SQLException e) {
            logger.error("Error saving memory for {}: {}", memory.fileIdentity(), e.getMessage());
        }
    }

    @Override
    public PlaybackMemory getMemory(String fileIdentity) {
        if (fileIdentity == null) return null;
        String sql = "SELECT " + MEMORY_COLUMNS + " FROM playback_memory WHERE file_identity = ?";
        List<PlaybackMemory> found = queryMemories(sql, fileIdentity);
        return found.isEmpty() ? null : found.get(0);
    }

    @Override
    public PlaybackMemory getMemoryByDisplayName(String normalizedDisplayName) {
        if (normalizedDisplayName == null || normalizedDisplayName.isBlank()) return null;
        String sql = "SELECT " + MEMORY_COLUMNS + " FROM playback_memory WHERE lower(display_name) = ? ORDER BY saved_at DESC LIMIT 1";
        List<PlaybackMemory> found = queryMemories(sql, normalizedDisplayName);
        return found.isEmpty() ? null : found.get(0);
    }

    @Override
    public PlaybackMemory getLatestMemory() {
        List<PlaybackMemory> found = queryMemories("SELECT " + MEMORY_COLUMNS + " FROM playback_memory ORDER BY saved_at DESC LIMIT 1");
        return found.isEmpty() ? null : found.get(0);
    }

    @Override
    public List<PlaybackMemory> getAllMemories() {
        return queryMemories("SELECT " + MEMORY_COLUMNS + " FROM playback_memory ORDER BY saved_at DESC");
    }

    @Override
    public List<PlaybackMemory> getMemoriesByFolder(String folderIdentity) {
        return queryMemories("SELECT " + MEMORY_COLUMNS + " FROM playback_memory WHERE folder_identity = ? ORDER BY saved_at DESC", folderIdentity);
    }

    @Override
    public void deleteMemory(String fileIdentity) {
        execute("DELETE FROM playback_memory WHERE file_identity = ?", fileIdentity);
    }

    @Override
    public void deleteAllMemories() {
        execute("DELETE FROM playback_memory");
    }

    private List<PlaybackMemory> queryMemories(String sql, Object... params) {
        List<PlaybackMemory> result = new ArrayList<>();
        try (Connection conn = connect(); PreparedStatement ps = conn.prepareStatement(sql)) {
            bind(ps, params);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    result.add(new PlaybackMemory(
                        rs.getString("file_identity"),
                        rs.getLong("position_ms"),
                        rs.getLong("duration_ms"),
                        rs.getString("folder_identity"),
                        rs.getString("display_name"),
                        rs.getLong("saved_at")
                    ));
                }
            }
        } catch (SQLException e) {
            logger.error("Error reading memories: {}", e.getMessage());
        }
        return result;
    }

    // --- bookmarks ---

    @Override
    public long insertBookmark(Bookmark bookmark) {
        if (bookmark == null || bookmark.fileIdentity() == null || bookmark.fileIdentity().isBlank()) {
            logger.warn("Invalid bookmark for DB insert: {}", bookmark);
            return -1;
        }
        String sql = "INSERT INTO bookmarks (file_identity, position_ms, duration_ms, label, created_at, folder_identity, display_name) " +
                "VALUES (?, ?, ?, ?, ?, ?, ?) RETURNING id";
        try (Connection conn = connect(); PreparedStatement ps = conn.prepareStatement(sql)) {
            bind(ps, bookmark.fileIdentity(), bookmark.positionMs(), bookmark.durationMs(), bookmark.label(),
                bookmark.createdAt(), bookmark.folderIdentity(), bookmark.displayName());
            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) {
                    long id = rs.getLong(1);
                    logger.info("Inserted bookmark '{}' (id={}) for {}", bookmark.label(), id, bookmark.fileIdentity());
                    return id;
                }
            }
        } catch (SQLException e) {
            logger.error("Error inserting bookmark: {}", e.getMessage());
        }
        return -1;
    }

    @Override
    public void renameBookmark(long id, String label) {
        execute("UPDATE bookmarks SET label = ? WHERE id = ?", label, id);
    }

    @Override
    public List<Bookmark> getBookmarks(String fileIdentity) {
        return queryBookmarks("SELECT " + BOOKMARK_COLUMNS + " FROM bookmarks WHERE file_identity = ? ORDER BY position_ms ASC", fileIdentity);
    }

    @Override
    public List<Bookmark> getBookmarksByFolder(String folderIdentity) {
        return queryBookmarks("SELECT " + BOOKMARK_COLUMNS + " FROM bookmarks WHERE folder_identity = ? ORDER BY created_at DESC", folderIdentity);
    }

    @Override
    public void deleteBookmark(long id) {
        execute("DELETE FROM bookmarks WHERE id = ?", id);
    }

    @Override
    public void deleteAllBookmarks() {
        execute("DELETE FROM bookmarks");
    }

    private List<Bookmark> queryBookmarks(String sql, Object... params) {
        List<Bookmark> result = new ArrayList<>();
        try (Connection conn = connect(); PreparedStatement ps = conn.prepareStatement(sql)) {
            bind(ps, params);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    result.add(new Bookmark(
                        rs.getLong("id"),
                        rs.getString("file_identity"),
                        rs.getLong("position_ms"),
                        rs.getLong("duration_ms"),
                        rs.getString("label"),
                        rs.getLong("created_at"),
                        rs.getString("folder_identity"),
                        rs.getString("display_name")
                    ));
                }
            }
        } catch (SQLException e) {
            logger.error("Error reading bookmarks: {}", e.getMessage());
        }
        return result;
    }

    // --- playlists ---

    @Override
    public long upsertPlaylist(String folderIdentity, String name, int trackCount) {
        if (folderIdentity == null || folderIdentity.trim().isEmpty()) {
            logger.warn("Invalid playlist folder for DB insert: name={}, folder={}", name, folderIdentity);
            return -1;
        }
        String sql = "INSERT INTO music_playlists (folder_identity, name, track_count, imported_at) VALUES (?, ?, ?, ?) " +
                "ON CONFLICT (folder_identity) DO UPDATE SET track_count = EXCLUDED.track_count RETURNING id";
        try (Connection conn = connect(); PreparedStatement ps = conn.prepareStatement(sql)) {
            bind(ps, folderIdentity, name, trackCount, System.currentTimeMillis());
            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) {
                    long id = rs.getLong(1);
                    logger.info("Inserted/updated playlist '{}' (id={}, tracks={})", name, id, trackCount);
                    return id;
                }
            }
        } catch (SQLException e) {
            logger.error("Error inserting playlist: {}", e.getMessage());
        }
        return -1;
    }

    @Override
    public void updatePlaylistLastPlayed(long playlistId) {
        execute("UPDATE music_playlists SET last_played_at = ? WHERE id = ?", System.currentTimeMillis(), playlistId);
    }

    @Override
    public void updatePlaylistProgress(String folderIdentity, String fileIdentity, long positionMs, long durationMs, String displayName) {
        if (folderIdentity == null || folderIdentity.isBlank() || fileIdentity == null) return;
        execute("UPDATE music_playlists SET last_file_identity = ?, last_position_ms = ?, last_duration_ms = ?, " +
                "last_display_name = ?, last_played_at = ? WHERE folder_identity = ?",
            fileIdentity, positionMs, durationMs, displayName, System.currentTimeMillis(), folderIdentity);
    }

    @Override
    public void updatePlaylistInfo(long playlistId, String name, String description) {
        execute("UPDATE music_playlists SET name = ?, description = ? WHERE id = ?",
            name, description == null ? "" : description, playlistId);
    }

    @Override
    public MusicPlaylist getPlaylist(long playlistId) {
        List<MusicPlaylist> found = queryPlaylists("SELECT " + PLAYLIST_COLUMNS + " FROM music_playlists WHERE id = ?", playlistId);
        return found.isEmpty() ? null : found.get(0);
    }

    @Override
    public List<MusicPlaylist> getPlaylists() {
        return queryPlaylists("SELECT " + PLAYLIST_COLUMNS + " FROM music_playlists ORDER BY last_played_at DESC, imported_at DESC");
    }

    private List<MusicPlaylist> queryPlaylists(String sql, Object... params) {
        List<MusicPlaylist> result = new ArrayList<>();
        try (Connection conn = connect(); PreparedStatement ps = conn.prepareStatement(sql)) {
            bind(ps, params);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    result.add(new MusicPlaylist(
                        rs.getLong("id"),
                        rs.getString("folder_identity"),
                        rs.getString("name"),
                        rs.getString("description"),
                        rs.getInt("track_count"),
                        rs.getLong("imported_at"),
                        rs.getLong("last_played_at"),
                        rs.getString("last_file_identity"),
                        rs.getLong("last_position_ms"),
                        rs.getLong("last_duration_ms"),
                        rs.getString("last_display_name")
                    ));
                }
            }
        } catch (SQLException e) {
            logger.error("Error reading playlists: {}", e.getMessage());
        }
        return result;
    }

    @Override
    public void deletePlaylist(long playlistId) {
        execute("DELETE FROM music_playlists WHERE id = ?", playlistId);
    }

    // --- helpers ---

    private void execute(String sql, Object... params) {
        try (Connection conn = connect(); PreparedStatement ps = conn.prepareStatement(sql)) {
            bind(ps, params);
            int rows = ps.executeUpdate();
            logger.debug("{} -> {} rows", sql, rows);
        } catch (SQLException e) {
            logger.error("Error executing '{}': {}", sql, e.getMessage());
        }
    }

    private static void bind(PreparedStatement ps, Object... params) throws SQLException {
        for (int i = 0; i < params.length; i++) {
            ps.setObject(i + 1, params[i]);
        }
    }

    /**
     * Starts an embedded PostgreSQL instance on a specific port for local use and returns it.
     * @param dataDir directory under which to store DB data
     * @param port port number for the Postgres server
     * @return EmbeddedPostgres instance
     */
    public static EmbeddedPostgres startEmbedded(String dataDir, int port) {
        try {
            EmbeddedPostgres postgres = EmbeddedPostgres.builder()
                .setDataDirectory(Paths.get(dataDir))
                .setCleanDataDirectory(false)
                .setPort(port)
                .start();
            logger.info("Embedded PostgreSQL started at {} on port {}", dataDir, port);
            return postgres;
        } catch (Exception e) {
            logger.error("Failed to start embedded PostgreSQL on port {}: {}", port, e.getMessage());
            throw new RuntimeException(e);
        }
    }

    /**
     * JDBC URL of an embedded instance's default database.
     */
    public static String jdbcUrl(EmbeddedPostgres postgres) {
        return String.format("jdbc:postgresql://localhost:%d/postgres", postgres.getPort());
    }
}
