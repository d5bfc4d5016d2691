package com.localmedia.playback;

import io.zonky.test.db.postgres.embedded.EmbeddedPostgres;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;

/**
 * Command-line entry point for library diagnostics and the durable store.
 * <p>
 * Modes:
 * <ul>
 *   <li>{@code scan <folder> [report.csv]}: diagnostic scan, written as a CSV report</li>
 *   <li>{@code list <folder>}: one-level folder listing</li>
 *   <li>{@code db}: starts embedded PostgreSQL and keeps it running until Enter is pressed</li>
 *   <li>{@code memories [out.csv]}: exports every stored resume memory</li>
 * </ul>
 *
 * @author Playback Engine Team
 * @since 1.0
 */
public class Main {
    private static final Logger logger = LoggerFactory.getLogger(Main.class);

    static final int EXIT_OK = 0;
    static final int EXIT_FAILURE = 1;
    static final int EXIT_USAGE = 2;

    private final EngineConfig config;
    private final PrintStream out;

    Main(EngineConfig config, PrintStream out) {
        this.config = config;
        this.out = out;
    }

    /**
     * Main application entry point.
     * @param args Command-line arguments
     */
    public static void main(String[] args) {
        int code = new Main(EngineConfig.fromEnvironment(), System.out).run(args);
        if (code != EXIT_OK) System.exit(code);
    }

    /**
     * Runs one mode.
     * @return process exit code
     */
    int run(String[] args) {
        String mode = args != null && args.length > 0 ? args[0].trim().toLowerCase(Locale.ROOT) : "";
        try {
            switch (mode) {
                case "scan":
                    if (args.length < 2) return usage();
                    return scan(args[1], args.length > 2 ? args[2] : null);
                case "list":
                    if (args.length < 2) return usage();
                    return list(args[1]);
                case "db":
                    return db();
                case "memories":
                    return memories(args.length > 1 ? args[1] : "memories.csv");
                default:
                    return usage();
            }
        } catch (InvalidPathException e) {
            logger.error("{} failed, invalid folder: {}", mode, e.getMessage());
            return EXIT_USAGE;
        } catch (IOException e) {
            logger.error("{} failed: {}", mode, e.getMessage());
            return EXIT_FAILURE;
        }
    }

    private int scan(String folderArg, String reportName) throws IOException {
        FolderRef folder = folderOf(folderArg);
        ScanResult result = new ScannerService().scanDiagnostic(folder);
        for (ScanResultItem item : result.items()) {
            out.println(item.describe());
        }
        logger.info("Scanned {}: {} entries, {} done, {} pass, {} err", folder.identity(),
            result.totalCount(), result.doneCount(), result.passCount(), result.errCount());
        String name = reportName == null ? Utils.folderName(folder.identity()) + "-scan.csv" : reportName;
        Path report = new CsvService(config.exportDir()).writeScanReport(result, name);
        out.println("Report: " + report);
        return EXIT_OK;
    }

    private int list(String folderArg) {
        FolderListing listing = new ScannerService().listFolder(folderOf(folderArg));
        for (FolderRef sub : listing.subfolders()) {
            out.println(Utils.folderName(sub.identity()) + "/");
        }
        for (MediaRef file : listing.files()) {
            out.println(file.fileName());
        }
        logger.info("{} subfolders, {} files in {}", listing.subfolders().size(), listing.files().size(), folderArg);
        return EXIT_OK;
    }

    private int db() {
        int port = config.embeddedPgPort();
        String dataDir = config.embeddedPgDataDir().toString();
        try (EmbeddedPostgres postgres = PostgresService.startEmbedded(dataDir, port)) {
            PostgresService store = new PostgresService(PostgresService.jdbcUrl(postgres), "postgres", "postgres");
            store.createTables();
            out.println("Embedded Postgres started.");
            out.println("JDBC URL: " + PostgresService.jdbcUrl(postgres));
            out.println("DB user: postgres");
            out.println("DB password: postgres");
            out.println("Data directory: " + dataDir);
            out.println("Press Enter to stop the embedded DB and exit.");
            System.in.read();
            return EXIT_OK;
        } catch (IOException | RuntimeException e) {
            logger.error("Failed to run embedded Postgres: {}", e.getMessage());
            return EXIT_FAILURE;
        }
    }

    private int memories(String fileName) throws IOException {
        EmbeddedPostgres postgres = null;
        try {
            PostgresService store;
            if (config.dbUrl().isBlank()) {
                postgres = PostgresService.startEmbedded(config.embeddedPgDataDir().toString(), config.embeddedPgPort());
                store = new PostgresService(PostgresService.jdbcUrl(postgres), "postgres", "postgres");
            } else {
                store = new PostgresService(config.dbUrl(), config.dbUser(), config.dbPassword());
            }
            store.createTables();
            List<PlaybackMemory> memories = store.getAllMemories();
            for (PlaybackMemory m : memories) {
                out.println(Utils.formatPosition(m.positionMs()) + "  " + m.displayName() + "  (" + m.fileIdentity() + ")");
            }
            Path file = new CsvService(config.exportDir()).writeMemories(memories, fileName);
            out.println("Exported " + memories.size() + " memories to " + file);
            return EXIT_OK;
        } catch (RuntimeException e) {
            logger.error("Failed to export memories: {}", e.getMessage());
            return EXIT_FAILURE;
        } finally {
            if (postgres != null) {
                try {
                    postgres.close();
                    logger.info("Embedded PostgreSQL stopped.");
                } catch (IOException e) {
                    logger.warn("Failed to stop embedded PostgreSQL: {}", e.getMessage());
                }
            }
        }
    }

    private int usage() {
        out.println("Usage:");
        out.println("  scan <folder|tree-uri> [report.csv]   diagnostic scan with CSV report");
        out.println("  list <folder>                         one-level listing");
        out.println("  db                                    run embedded PostgreSQL until Enter");
        out.println("  memories [out.csv]                    export stored resume positions");
        return EXIT_USAGE;
    }

    private static FolderRef folderOf(String arg) {
        return Utils.looksLikeUri(arg) ? FolderRef.ofTree(arg) : FolderRef.ofPath(arg);
    }
}
