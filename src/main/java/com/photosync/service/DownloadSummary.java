package com.photosync.service;

import java.util.List;

/**
 * Outcome of one {@link SyncEngine#downloadPending()} run.
 */
public class DownloadSummary {
    private final int downloaded;
    private final int retried;
    private final List<String> deferredIds;

    public DownloadSummary(int downloaded, int retried, List<String> deferredIds) {
        this.downloaded = downloaded;
        this.retried = retried;
        this.deferredIds = List.copyOf(deferredIds);
    }

    /** Items marked downloaded during this run, first and second pass. */
    public int getDownloaded() { return downloaded; }

    /** Items that entered the retry pool. */
    public int getRetried() { return retried; }

    /** Items still pending after the retry pass; picked up again by the next run. */
    public List<String> getDeferredIds() { return deferredIds; }

    @Override
    public String toString() {
        return "downloaded=" + downloaded + ", retried=" + retried + ", deferred=" + deferredIds.size();
    }
}
