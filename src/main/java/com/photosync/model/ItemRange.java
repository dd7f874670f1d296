package com.photosync.model;

import java.time.Instant;

/**
 * Creation times of the oldest and newest items in the store.
 * On an empty store oldest is "now" and newest is the epoch, so that
 * windowing derived from it covers the whole time line.
 */
public class ItemRange {
    private final Instant oldest;
    private final Instant newest;

    public ItemRange(Instant oldest, Instant newest) {
        this.oldest = oldest;
        this.newest = newest;
    }

    public Instant getOldest() { return oldest; }
    public Instant getNewest() { return newest; }

    public boolean isEmptyStoreSentinel() {
        return Instant.EPOCH.equals(newest);
    }
}
