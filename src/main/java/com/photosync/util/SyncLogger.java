package com.photosync.util;

/**
 * Logging facade handed to the sync components.
 * The context is usually the simple name of the calling component.
 */
public interface SyncLogger {

    void info(String context, String message);

    void warn(String context, String message);

    void error(String context, String message, Throwable error);

    /**
     * Logs an error that is expected to repeat (e.g. the same download failure for many items).
     * Only the first occurrence is written immediately, repeats are summarized on {@link #flush()}.
     */
    void recurringError(String context, String message, Throwable error);

    /**
     * Writes summaries of aggregated recurring errors.
     */
    void flush();
}
