package com.localmedia.playback;

import java.util.List;

/**
 * Output of one diagnostic scan. Counts are derived from {@code items}, so
 * {@code doneCount() + passCount() + errCount() == totalCount()} always holds.
 */
public record ScanResult(FolderRef folder, List<ScanResultItem> items) {

    public ScanResult {
        items = items == null ? List.of() : List.copyOf(items);
    }

    public int totalCount() {
        return items.size();
    }

    public int doneCount() {
        return count(ScanStatus.DONE);
    }

    public int passCount() {
        return count(ScanStatus.PASS);
    }

    public int errCount() {
        return count(ScanStatus.ERR);
    }

    private int count(ScanStatus status) {
        return (int) items.stream().filter(i -> i.status() == status).count();
    }
}
