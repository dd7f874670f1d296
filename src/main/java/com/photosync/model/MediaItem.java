package com.photosync.model;

import java.time.Instant;

/**
 * An item known to the local state store.
 * Rows are created on first metadata observation and never deleted; only the status changes.
 */
public class MediaItem {
    private final String id;
    private final Instant creationTime;
    private final String path;     // Directory relative to the sync root
    private final String filename;
    private final String mimeType;
    private final MediaKind mediaKind;
    private final DownloadStatus status;

    public MediaItem(String id, Instant creationTime, String path, String filename,
                     String mimeType, MediaKind mediaKind, DownloadStatus status) {
        this.id = id;
        this.creationTime = creationTime;
        this.path = path;
        this.filename = filename;
        this.mimeType = mimeType;
        this.mediaKind = mediaKind;
        this.status = status;
    }

    public String getId() { return id; }
    public Instant getCreationTime() { return creationTime; }
    public String getPath() { return path; }
    public String getFilename() { return filename; }
    public String getMimeType() { return mimeType; }
    public MediaKind getMediaKind() { return mediaKind; }
    public DownloadStatus getStatus() { return status; }

    @Override
    public String toString() {
        return "MediaItem{" + id + ", " + path + filename + ", " + status + "}";
    }
}
