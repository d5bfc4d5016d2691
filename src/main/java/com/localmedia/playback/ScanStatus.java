package com.localmedia.playback;

/**
 * Per-entry outcome of a diagnostic scan.
 */
public enum ScanStatus {
    /** Supported and readable. */
    DONE,
    /** Skipped: extension not in the allow-list. */
    PASS,
    /** Could not be read (missing or unreadable directory, unreadable file, provider failure). */
    ERR
}
