package com.localmedia.playback;

import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Helper methods for file names, display names and positions.
 *
 * @author Playback Engine Team
 * @since 1.0
 */
public final class Utils {
    private static final Pattern URI_SCHEME = Pattern.compile("^[a-zA-Z][a-zA-Z0-9+.-]*://.*");

    private Utils() {}

    /**
     * Sanitizes a filename by replacing each special character and whitespace with an underscore.
     * @param name Input filename
     * @return Sanitized filename
     */
    public static String sanitizeFilename(String name) {
        return name == null ? "" : name.replaceAll("[*?\"<>|/:\\\\\\s]", "_");
    }

    /**
     * Lower-case extension of a file name without the dot, or "" when there is none.
     * A leading dot (hidden file such as {@code .nomedia}) does not start an extension.
     */
    public static String extensionOf(String fileName) {
        if (fileName == null) return "";
        int dot = fileName.lastIndexOf('.');
        if (dot <= 0 || dot == fileName.length() - 1) return "";
        return fileName.substring(dot + 1).toLowerCase(Locale.ROOT);
    }

    /**
     * File name without its extension.
     */
    public static String stripExtension(String fileName) {
        if (fileName == null) return "";
        int dot = fileName.lastIndexOf('.');
        if (dot <= 0) return fileName;
        return fileName.substring(0, dot);
    }

    /**
     * Normalized display name used by the cross-mode memory fallback: trimmed, lower case, and without a
     * trailing supported media extension.
     * @param displayName display name or file name
     * @return normalized key, never null
     */
    public static String normalizeDisplayName(String displayName) {
        if (displayName == null) return "";
        String name = displayName.trim();
        if (ScannerService.isSupportedExtension(extensionOf(name))) {
            name = stripExtension(name).trim();
        }
        return name.toLowerCase(Locale.ROOT);
    }

    /**
     * Formats a position as {@code m:ss} or {@code h:mm:ss}.
     */
    public static String formatPosition(long positionMs) {
        long totalSeconds = Math.max(0L, positionMs) / 1000;
        long hours = totalSeconds / 3600;
        long minutes = (totalSeconds % 3600) / 60;
        long seconds = totalSeconds % 60;
        if (hours > 0) return String.format(Locale.ROOT, "%d:%02d:%02d", hours, minutes, seconds);
        return String.format(Locale.ROOT, "%d:%02d", minutes, seconds);
    }

    /**
     * True when the identity carries a URI scheme ({@code content://...}); such identities come from a
     * document provider, everything else is treated as a filesystem path.
     */
    public static boolean looksLikeUri(String identity) {
        return identity != null && URI_SCHEME.matcher(identity).matches();
    }

    /**
     * Human readable name of a folder: the last path segment, or for a tree URI the last segment of its
     * decoded document id ({@code primary:Music/Books} gives {@code Books}).
     */
    public static String folderName(String identity) {
        if (identity == null || identity.isBlank()) return "";
        String value = identity;
        if (looksLikeUri(identity)) {
            value = URLDecoder.decode(identity.replace("+", "%2B"), StandardCharsets.UTF_8);
        }
        while (value.length() > 1 && (value.endsWith("/") || value.endsWith("\\"))) {
            value = value.substring(0, value.length() - 1);
        }
        int cut = Math.max(Math.max(value.lastIndexOf('/'), value.lastIndexOf('\\')), value.lastIndexOf(':'));
        String name = value.substring(cut + 1);
        return name.isEmpty() ? value : name;
    }
}
