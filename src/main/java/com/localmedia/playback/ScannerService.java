package com.localmedia.playback;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Library scanner for local media folders.
 * <p>
 * Workflow:
 * <ul>
 *   <li>{@link MediaKind#PATH} folders are traversed with {@code java.nio.file}; directories are not followed
 *   through symbolic links.</li>
 *   <li>{@link MediaKind#PROVIDER_URI} folders are resolved through the {@link DocumentProvider} and traversed
 *   with {@link DocumentNode#listChildren()}.</li>
 *   <li>Files are matched against an explicit extension allow-list, case-insensitive, on the extension only.
 *   Video containers are accepted for their audio track.</li>
 * </ul>
 * <p>
 * Ordering differs per operation: {@link #scan} sorts the complete recursive result once by display name,
 * {@link #listFolder} and {@link #scanDiagnostic} order each directory's children by name.
 * <p>
 * Error Handling: missing folders, unreadable directories and provider failures are logged and degrade to
 * empty results ({@code scan}, {@code listFolder}) or {@link ScanStatus#ERR} items ({@code scanDiagnostic}).
 *
 * @author Playback Engine Team
 * @since 1.0
 */
public class ScannerService implements ScannerServiceInterface {
    private static final Logger logger = LoggerFactory.getLogger(ScannerService.class);

    /** Audio containers, including the segmented MP4 audio format (m4s). */
    public static final Set<String> AUDIO_EXTENSIONS = Set.of(
        "mp3", "wav", "m4a", "ogg", "flac", "aac", "wma", "opus", "ape", "alac", "m4s"
    );

    /** Video containers, played for their audio track only. */
    public static final Set<String> VIDEO_EXTENSIONS = Set.of(
        "mp4", "mkv", "webm", "avi", "mov", "ts", "3gp"
    );

    private static final Set<String> SUPPORTED_EXTENSIONS;
    static {
        Set<String> all = new HashSet<>(AUDIO_EXTENSIONS);
        all.addAll(VIDEO_EXTENSIONS);
        SUPPORTED_EXTENSIONS = Set.copyOf(all);
    }

    static final String REASON_MISSING = "directory does not exist";
    static final String REASON_NOT_DIRECTORY = "not a directory";
    static final String REASON_UNREADABLE = "unreadable";
    static final String REASON_NO_PROVIDER = "no document provider";

    private static final Comparator<String> BY_NAME =
        String.CASE_INSENSITIVE_ORDER.thenComparing(Comparator.naturalOrder());
    private static final Comparator<MediaRef> BY_DISPLAY_NAME =
        Comparator.comparing(MediaRef::displayName, BY_NAME).thenComparing(MediaRef::identity);

    private final DocumentProvider documentProvider;

    /**
     * @param documentProvider provider used for tree-URI folders; may be null when only paths are scanned
     */
    public ScannerService(DocumentProvider documentProvider) {
        this.documentProvider = documentProvider;
    }

    public ScannerService() {
        this(null);
    }

    /**
     * @param extension lower- or mixed-case extension without the dot
     * @return true if files with this extension are playable
     */
    public static boolean isSupportedExtension(String extension) {
        return extension != null && SUPPORTED_EXTENSIONS.contains(extension.toLowerCase(Locale.ROOT));
    }

    public static boolean isSupportedFile(String fileName) {
        return isSupportedExtension(Utils.extensionOf(fileName));
    }

    public static Set<String> getSupportedExtensions() {
        return SUPPORTED_EXTENSIONS;
    }

    @Override
    public List<MediaRef> scan(FolderRef folder) {
        if (folder == null) {
            logger.warn("scan called with null folder. Returning empty list.");
            return List.of();
        }
        List<MediaRef> found = new ArrayList<>();
        if (folder.kind() == MediaKind.PATH) {
            Path root = toPath(folder.identity());
            if (root == null || !Files.isDirectory(root)) {
                logger.warn("Folder '{}' does not exist or is not a directory.", root);
                return List.of();
            }
            collectFiles(root, found);
        } else {
            DocumentNode root = resolveTree(folder.identity());
            if (root == null) return List.of();
            collectNodes(root, found);
        }
        found.sort(BY_DISPLAY_NAME);
        logger.info("Scanned '{}': {} playable files.", folder.identity(), found.size());
        return found;
    }

    @Override
    public FolderListing listFolder(FolderRef folder) {
        if (folder == null) {
            logger.warn("listFolder called with null folder.");
            return FolderListing.empty(null);
        }
        List<FolderRef> subfolders = new ArrayList<>();
        List<MediaRef> files = new ArrayList<>();
        if (folder.kind() == MediaKind.PATH) {
            Path root = toPath(folder.identity());
            List<Path> children = root == null ? null : listChildren(root);
            if (children == null) return FolderListing.empty(folder);
            for (Path child : children) {
                if (Files.isDirectory(child, LinkOption.NOFOLLOW_LINKS)) {
                    subfolders.add(FolderRef.ofPath(child));
                } else if (Files.isRegularFile(child) && isSupportedFile(fileName(child))) {
                    files.add(MediaRef.ofPath(child));
                }
            }
        } else {
            DocumentNode root = resolveTree(folder.identity());
            List<DocumentNode> children = root == null ? null : listChildren(root);
            if (children == null) return FolderListing.empty(folder);
            for (DocumentNode child : children) {
                if (child.isDirectory()) {
                    subfolders.add(FolderRef.ofTree(child.identity()));
                } else if (child.isFile() && isSupportedFile(child.name())) {
                    files.add(MediaRef.ofNode(child));
                }
            }
        }
        // children are already name-ordered; subfolders and files stay in separate lists
        return new FolderListing(folder, subfolders, files);
    }

    @Override
    public ScanResult scanDiagnostic(FolderRef folder) {
        List<ScanResultItem> items = new ArrayList<>();
        if (folder == null) {
            items.add(ScanResultItem.err("", "", REASON_MISSING));
            return new ScanResult(null, items);
        }
        try {
            if (folder.kind() == MediaKind.PATH) {
                Path root = toPath(folder.identity());
                if (root == null) {
                    items.add(ScanResultItem.err(folder.identity(), folder.identity(), REASON_MISSING));
                } else {
                    diagnosePathRoot(root, items);
                }
            } else {
                diagnoseTreeRoot(folder.identity(), items);
            }
        } catch (RuntimeException e) {
            logger.warn("Diagnostic scan of '{}' aborted: {}", folder.identity(), e.getMessage());
            items.add(ScanResultItem.err(folder.identity(), folder.identity(), REASON_UNREADABLE));
        }
        ScanResult result = new ScanResult(folder, items);
        logger.info("Diagnostic scan of '{}': total={}, done={}, pass={}, err={}",
            folder.identity(), result.totalCount(), result.doneCount(), result.passCount(), result.errCount());
        return result;
    }

    // --- filesystem traversal ---

    /**
     * Path of a folder identity, or null when the string is not a valid path on this filesystem.
     */
    private static Path toPath(String identity) {
        try {
            return Path.of(identity);
        } catch (InvalidPathException e) {
            logger.warn("Invalid folder path '{}': {}", identity, e.getMessage());
            return null;
        }
    }

    private void collectFiles(Path dir, List<MediaRef> out) {
        List<Path> children = listChildren(dir);
        if (children == null) return;
        for (Path child : children) {
            if (Files.isDirectory(child, LinkOption.NOFOLLOW_LINKS)) {
                collectFiles(child, out);
            } else if (Files.isRegularFile(child) && isSupportedFile(fileName(child))) {
                out.add(MediaRef.ofPath(child));
            }
        }
    }

    private void diagnosePathRoot(Path root, List<ScanResultItem> items) {
        if (!Files.exists(root)) {
            items.add(ScanResultItem.err(fileName(root), root.toString(), REASON_MISSING));
            return;
        }
        if (!Files.isDirectory(root)) {
            items.add(ScanResultItem.err(fileName(root), root.toString(), REASON_NOT_DIRECTORY));
            return;
        }
        diagnoseDirectory(root, items);
    }

    private void diagnoseDirectory(Path dir, List<ScanResultItem> items) {
        List<Path> children = Files.isReadable(dir) ? listChildren(dir) : null;
        if (children == null) {
            items.add(ScanResultItem.err(fileName(dir), dir.toString(), REASON_UNREADABLE));
            return;
        }
        for (Path child : children) {
            String name = fileName(child);
            if (Files.isDirectory(child, LinkOption.NOFOLLOW_LINKS)) {
                diagnoseDirectory(child, items);
            } else if (!isSupportedFile(name)) {
                items.add(ScanResultItem.pass(name, child.toString(), unsupportedReason(name)));
            } else if (!Files.isReadable(child)) {
                items.add(ScanResultItem.err(name, child.toString(), REASON_UNREADABLE));
            } else {
                items.add(ScanResultItem.done(name, child.toString()));
            }
        }
    }

    /**
     * Children of a directory ordered by file name, or null if the directory cannot be listed.
     */
    private List<Path> listChildren(Path dir) {
        try (Stream<Path> stream = Files.list(dir)) {
            return stream
                .sorted(Comparator.comparing(ScannerService::fileName, BY_NAME))
                .collect(Collectors.toList());
        } catch (IOException | UncheckedIOException | SecurityException e) {
            logger.warn("Failed to list directory '{}': {}", dir, e.getMessage());
            return null;
        }
    }

    private static String fileName(Path path) {
        Path name = path.getFileName();
        return name == null ? path.toString() : name.toString();
    }

    // --- document provider traversal ---

    private DocumentNode resolveTree(String treeUri) {
        if (documentProvider == null) {
            logger.warn("No document provider configured; cannot open tree '{}'.", treeUri);
            return null;
        }
        try {
            DocumentNode root = documentProvider.fromTreeUri(treeUri);
            if (root == null || !root.exists()) {
                logger.warn("Tree '{}' could not be resolved by the document provider.", treeUri);
                return null;
            }
            return root;
        } catch (RuntimeException e) {
            logger.warn("Document provider failed to open tree '{}': {}", treeUri, e.getMessage());
            return null;
        }
    }

    private void collectNodes(DocumentNode dir, List<MediaRef> out) {
        List<DocumentNode> children = listChildren(dir);
        if (children == null) return;
        for (DocumentNode child : children) {
            if (child.isDirectory()) {
                collectNodes(child, out);
            } else if (child.isFile() && isSupportedFile(child.name())) {
                out.add(MediaRef.ofNode(child));
            }
        }
    }

    private void diagnoseTreeRoot(String treeUri, List<ScanResultItem> items) {
        if (documentProvider == null) {
            items.add(ScanResultItem.err(treeUri, treeUri, REASON_NO_PROVIDER));
            return;
        }
        DocumentNode root;
        try {
            root = documentProvider.fromTreeUri(treeUri);
        } catch (RuntimeException e) {
            logger.warn("Document provider failed to open tree '{}': {}", treeUri, e.getMessage());
            items.add(ScanResultItem.err(treeUri, treeUri, REASON_UNREADABLE));
            return;
        }
        if (root == null || !root.exists()) {
            items.add(ScanResultItem.err(treeUri, treeUri, REASON_MISSING));
            return;
        }
        diagnoseNode(root, items);
    }

    private void diagnoseNode(DocumentNode dir, List<ScanResultItem> items) {
        List<DocumentNode> children = listChildren(dir);
        if (children == null) {
            items.add(ScanResultItem.err(nodeName(dir), dir.identity(), REASON_UNREADABLE));
            return;
        }
        for (DocumentNode child : children) {
            String name = nodeName(child);
            if (child.isDirectory()) {
                diagnoseNode(child, items);
            } else if (!isSupportedFile(name)) {
                items.add(ScanResultItem.pass(name, child.identity(), unsupportedReason(name)));
            } else if (!child.canRead()) {
                items.add(ScanResultItem.err(name, child.identity(), REASON_UNREADABLE));
            } else {
                items.add(ScanResultItem.done(name, child.identity()));
            }
        }
    }

    /**
     * Children of a provider node ordered by name, or null when the provider gives no listing.
     */
    private List<DocumentNode> listChildren(DocumentNode dir) {
        try {
            List<DocumentNode> children = dir.listChildren();
            if (children == null) {
                logger.warn("Document provider returned no listing for '{}'.", dir.identity());
                return null;
            }
            List<DocumentNode> sorted = new ArrayList<>(children);
            sorted.sort(Comparator.comparing(ScannerService::nodeName, BY_NAME));
            return sorted;
        } catch (RuntimeException e) {
            logger.warn("Document provider failed to list '{}': {}", dir.identity(), e.getMessage());
            return null;
        }
    }

    private static String nodeName(DocumentNode node) {
        String name = node.name();
        return name == null ? node.identity() : name;
    }

    private static String unsupportedReason(String fileName) {
        String ext = Utils.extensionOf(fileName);
        return ext.isEmpty() ? "unsupported format (no extension)" : "unsupported format (." + ext + ")";
    }
}
