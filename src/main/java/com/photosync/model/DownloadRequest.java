package com.photosync.model;

import java.nio.file.Path;

/**
 * Asks the remote client to write one item's content into a local directory.
 */
public class DownloadRequest {
    private final String id;
    private final Path targetDirectory;
    private final String filename;
    private final MediaKind mediaKind;

    public DownloadRequest(String id, Path targetDirectory, String filename, MediaKind mediaKind) {
        this.id = id;
        this.targetDirectory = targetDirectory;
        this.filename = filename;
        this.mediaKind = mediaKind;
    }

    public String getId() { return id; }
    public Path getTargetDirectory() { return targetDirectory; }
    public String getFilename() { return filename; }
    public MediaKind getMediaKind() { return mediaKind; }

    public Path getTargetFile() {
        return targetDirectory.resolve(filename);
    }
}
