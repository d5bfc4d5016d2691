package com.localmedia.playback;

/**
 * One visited entry of a diagnostic scan.
 *
 * @param name file or folder name as listed
 * @param identity path or URI of the entry
 * @param reason human readable reason, null for DONE entries
 */
public record ScanResultItem(String name, String identity, ScanStatus status, String reason) {

    public static ScanResultItem done(String name, String identity) {
        return new ScanResultItem(name, identity, ScanStatus.DONE, null);
    }

    public static ScanResultItem pass(String name, String identity, String reason) {
        return new ScanResultItem(name, identity, ScanStatus.PASS, reason);
    }

    public static ScanResultItem err(String name, String identity, String reason) {
        return new ScanResultItem(name, identity, ScanStatus.ERR, reason);
    }

    /** Formats as {@code [done] a.mp3} / {@code [pass] b.txt: reason}. */
    public String describe() {
        String tag = "[" + status.name().toLowerCase() + "] " + name;
        return reason == null ? tag : tag + ": " + reason;
    }
}
