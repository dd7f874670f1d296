package com.photosync.model;

import java.time.Instant;
import java.time.OffsetDateTime;

/**
 * Metadata of a remote media item as returned by the library listing.
 * The content reference is a short-lived base URL and is never persisted.
 */
public class ItemMetadata {
    private final String id;
    private final String creationTime; // ISO-8601, e.g. 2019-07-14T10:15:30Z
    private final String filename;
    private final String mimeType;
    private final MediaKind mediaKind;
    private final String contentRef;

    public ItemMetadata(String id, String creationTime, String filename, String mimeType,
                        MediaKind mediaKind, String contentRef) {
        this.id = id;
        this.creationTime = creationTime;
        this.filename = filename;
        this.mimeType = mimeType;
        this.mediaKind = mediaKind;
        this.contentRef = contentRef;
    }

    public String getId() { return id; }
    public String getCreationTime() { return creationTime; }
    public String getFilename() { return filename; }
    public String getMimeType() { return mimeType; }
    public MediaKind getMediaKind() { return mediaKind; }
    public String getContentRef() { return contentRef; }

    /**
     * Parses the creation time, keeping the offset the service reported.
     *
     * @throws java.time.format.DateTimeParseException if the timestamp is malformed.
     */
    public OffsetDateTime getCreationDateTime() {
        return OffsetDateTime.parse(creationTime);
    }

    public Instant getCreationInstant() {
        return getCreationDateTime().toInstant();
    }
}
