package com.photosync.model;

import java.time.Instant;

/**
 * One row of the append-only audit trail.
 */
public class TransactionLogEntry {
    private final String itemId;
    private final EventKind event;
    private final Instant timestamp;

    public enum EventKind {
        ADDED,
        DOWNLOADED
    }

    public TransactionLogEntry(String itemId, EventKind event, Instant timestamp) {
        this.itemId = itemId;
        this.event = event;
        this.timestamp = timestamp;
    }

    public String getItemId() { return itemId; }
    public EventKind getEvent() { return event; }
    public Instant getTimestamp() { return timestamp; }
}
