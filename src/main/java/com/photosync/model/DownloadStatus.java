package com.photosync.model;

/**
 * Local state of an item's content.
 * Only PENDING -> DOWNLOADED (confirmed fetch) and DOWNLOADED -> PENDING (file vanished) happen.
 */
public enum DownloadStatus {
    PENDING,
    DOWNLOADED
}
