package com.photosync.util;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

/**
 * Utility class for file manipulation.
 */
public class FileUtils {

    private static final String PARTIAL_SUFFIX = ".part";

    /**
     * Extracts the file extension from a file name.
     *
     * @param fileName The file name (e.g., "image.jpg").
     * @return The extension (lowercase, without dot), or an empty string if none found.
     */
    public static String getExtension(String fileName) {
        if (fileName == null) {
            return "";
        }
        int i = fileName.lastIndexOf('.');
        // ".gitignore" (i=0) has no extension
        if (i > 0) {
            return fileName.substring(i + 1).toLowerCase();
        }
        return "";
    }

    /**
     * Writes a stream to {@code target} so that the target either does not change or holds the complete content.
     * Data goes to a hidden sibling first and is then moved into place.
     * Missing parent directories are created.
     *
     * @return The number of bytes written.
     * @throws IOException if any step fails; the temporary file is removed in that case.
     */
    public static long writeAtomically(Path target, InputStream content) throws IOException {
        Path dir = target.toAbsolutePath().getParent();
        Files.createDirectories(dir);
        Path partial = dir.resolve("." + target.getFileName() + PARTIAL_SUFFIX);
        try {
            long written = Files.copy(content, partial, StandardCopyOption.REPLACE_EXISTING);
            try {
                Files.move(partial, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(partial, target, StandardCopyOption.REPLACE_EXISTING);
            }
            return written;
        } catch (IOException e) {
            try {
                Files.deleteIfExists(partial);
            } catch (IOException suppressed) {
                e.addSuppressed(suppressed);
            }
            throw e;
        }
    }
}
