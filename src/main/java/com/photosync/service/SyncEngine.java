package com.photosync.service;

import com.photosync.model.DownloadRequest;
import com.photosync.model.ItemMetadata;
import com.photosync.model.ItemRange;
import com.photosync.model.MediaItem;
import com.photosync.model.TimeRange;
import com.photosync.model.TimeWindow;
import com.photosync.remote.AuthorizationException;
import com.photosync.remote.RemoteLibraryClient;
import com.photosync.remote.RemoteLibraryException;
import com.photosync.repository.SyncDatabaseManager;
import com.photosync.util.SyncLogger;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Set;

/**
 * Coordinates synchronization of the remote library into the sync root.
 * <ol>
 *   <li>Fetch item metadata for the time windows not covered yet and record new items.</li>
 *   <li>Download the content of all pending items in batches, retrying failures once.</li>
 * </ol>
 * Every step is driven by the state store, so running {@link #drive} again after an
 * interruption picks up where the previous run stopped. Runs are single-threaded.
 * <p>
 * {@link AuthorizationException} is never handled here and aborts the current run.
 */
public class SyncEngine {

    private static final String CONTEXT = "SyncEngine";
    public static final int DEFAULT_BATCH_SIZE = 16;

    private final SyncDatabaseManager dbManager;
    private final RemoteLibraryClient client;
    private final Path rootPath;
    private final PathMapper pathMapper;
    private final SyncLogger logger;
    private final int batchSize;
    private final Clock clock;

    public SyncEngine(SyncDatabaseManager dbManager, RemoteLibraryClient client, Path rootPath, SyncLogger logger) {
        this(dbManager, client, rootPath, new DatePathMapper(), logger, DEFAULT_BATCH_SIZE, Clock.systemUTC());
    }

    public SyncEngine(SyncDatabaseManager dbManager, RemoteLibraryClient client, Path rootPath,
                      PathMapper pathMapper, SyncLogger logger, int batchSize, Clock clock) {
        if (batchSize < 1) {
            throw new IllegalArgumentException("Batch size must be positive: " + batchSize);
        }
        this.dbManager = dbManager;
        this.client = client;
        this.rootPath = rootPath;
        this.pathMapper = pathMapper;
        this.logger = logger;
        this.batchSize = batchSize;
        this.clock = clock;
    }

    /**
     * Fetches metadata, then downloads content if the metadata pass completed.
     *
     * @param explicitRange      Range to list, or null to let the engine decide.
     * @param useWindowHeuristic Only list before the oldest and after the newest known item.
     */
    public void drive(TimeRange explicitRange, boolean useWindowHeuristic) {
        try {
            if (fetchMetadata(explicitRange, useWindowHeuristic)) {
                downloadPending();
            } else {
                logger.warn(CONTEXT, "Metadata fetch incomplete, skipping downloads for this run");
            }
        } finally {
            logger.flush();
        }
    }

    /**
     * Computes the windows to list, requests each one and records every item returned.
     * Known items are skipped by the store, so overlapping windows are harmless.
     *
     * @return false if listing any window failed. Items recorded before the failure stay recorded.
     */
    public boolean fetchMetadata(TimeRange explicitRange, boolean useWindowHeuristic) {
        List<TimeWindow> windows = computeWindows(explicitRange, useWindowHeuristic);
        logger.info(CONTEXT, "Fetching metadata for " + windows);

        boolean complete = true;
        for (TimeWindow window : windows) {
            int seen = 0;
            int added = 0;
            try {
                for (ItemMetadata item : client.listItems(window)) {
                    seen++;
                    if (recordItem(item)) {
                        added++;
                    }
                }
            } catch (AuthorizationException e) {
                throw e;
            } catch (RemoteLibraryException e) {
                logger.error(CONTEXT, "Listing window " + window + " failed after " + seen + " items", e);
                complete = false;
            }
            logger.info(CONTEXT, "Window " + window + ": " + seen + " items listed, " + added + " new");
        }
        return complete;
    }

    private boolean recordItem(ItemMetadata item) {
        try {
            if (dbManager.addItem(item, pathMapper.directoryFor(item))) {
                logger.info(CONTEXT, "Added " + item.getFilename() + " (" + item.getId() + ")");
                return true;
            }
            // Already known: expected on every incremental run
            return false;
        } catch (AuthorizationException e) {
            throw e;
        } catch (RuntimeException e) {
            // Unparsable or incomplete metadata, a failing path mapper or a rejected row
            logger.recurringError(CONTEXT, "Could not record item metadata", e);
            return false;
        }
    }

    /**
     * Decides which time windows still need listing.
     * <ul>
     *   <li>An explicit range is used as the only window.</li>
     *   <li>With the heuristic, an empty store gives [epoch, now]; otherwise [epoch, oldest) and (newest, now].
     *   Items created between the oldest and newest known item are not found this way; disable the
     *   heuristic for a full rescan.</li>
     *   <li>Without it, [epoch, now].</li>
     * </ul>
     */
    public List<TimeWindow> computeWindows(TimeRange explicitRange, boolean useWindowHeuristic) {
        Instant now = clock.instant();
        if (explicitRange != null) {
            Instant start = explicitRange.getStart() != null ? explicitRange.getStart() : Instant.EPOCH;
            Instant end = explicitRange.getEnd() != null ? explicitRange.getEnd() : now;
            return List.of(TimeWindow.closed(start, end));
        }
        if (useWindowHeuristic) {
            ItemRange extremes = dbManager.queryExtremes();
            if (extremes.isEmptyStoreSentinel()) {
                return List.of(TimeWindow.closed(Instant.EPOCH, now));
            }
            return List.of(
                    new TimeWindow(Instant.EPOCH, true, extremes.getOldest(), false),
                    new TimeWindow(extremes.getNewest(), false, now, true));
        }
        return List.of(TimeWindow.closed(Instant.EPOCH, now));
    }

    /**
     * Downloads all pending items, oldest first, in batches.
     * Items failing in their batch are collected and retried once in a second pass after all
     * batches ran. Items failing again stay pending for the next run.
     */
    public DownloadSummary downloadPending() {
        List<MediaItem> retryPool = new ArrayList<>();
        int downloaded = 0;

        List<MediaItem> batch = new ArrayList<>(batchSize);
        for (MediaItem item : dbManager.pendingItems()) {
            batch.add(item);
            if (batch.size() == batchSize) {
                downloaded += attemptBatch(batch, retryPool);
                batch = new ArrayList<>(batchSize);
            }
        }
        if (!batch.isEmpty()) {
            downloaded += attemptBatch(batch, retryPool);
        }

        List<MediaItem> stillFailing = new ArrayList<>();
        if (!retryPool.isEmpty()) {
            logger.info(CONTEXT, "Retrying " + retryPool.size() + " failed downloads");
            for (int from = 0; from < retryPool.size(); from += batchSize) {
                List<MediaItem> retryBatch = retryPool.subList(from, Math.min(from + batchSize, retryPool.size()));
                downloaded += attemptBatch(retryBatch, stillFailing);
            }
        }

        List<String> deferred = new ArrayList<>();
        for (MediaItem item : stillFailing) {
            deferred.add(item.getId());
        }
        if (!deferred.isEmpty()) {
            logger.warn(CONTEXT, deferred.size() + " items could not be downloaded and stay pending until the next run: " + deferred);
        }

        DownloadSummary summary = new DownloadSummary(downloaded, retryPool.size(), deferred);
        logger.info(CONTEXT, "Download pass finished: " + summary);
        return summary;
    }

    /**
     * Requests one batch and records the outcome. Only ids confirmed by the client are marked downloaded.
     *
     * @param failures Receives the items of the batch that were not written.
     * @return Number of items marked downloaded.
     */
    private int attemptBatch(List<MediaItem> batch, List<MediaItem> failures) {
        List<DownloadRequest> requests = new ArrayList<>(batch.size());
        for (MediaItem item : batch) {
            requests.add(new DownloadRequest(item.getId(), rootPath.resolve(item.getPath()), item.getFilename(), item.getMediaKind()));
        }

        Set<String> written;
        try {
            written = client.batchFetchContent(requests);
        } catch (AuthorizationException e) {
            throw e;
        } catch (RemoteLibraryException e) {
            logger.error(CONTEXT, "Batch of " + batch.size() + " downloads failed", e);
            written = Collections.emptySet();
        }
        if (written == null) {
            written = Collections.emptySet();
        }

        List<String> succeeded = new ArrayList<>();
        for (MediaItem item : batch) {
            if (written.contains(item.getId())) {
                succeeded.add(item.getId());
            } else {
                failures.add(item);
            }
        }
        dbManager.markDownloaded(succeeded, true);
        if (!succeeded.isEmpty()) {
            logger.info(CONTEXT, "Downloaded " + succeeded.size() + " of " + batch.size() + " items");
        }
        return succeeded.size();
    }

    /**
     * Checks the files of all downloaded items below the engine's root.
     *
     * @see #resync(Path)
     */
    public int resync() {
        return resync(rootPath);
    }

    /**
     * Demotes every downloaded item whose file is missing under {@code rootDirectory} back to pending.
     * Nothing is downloaded here; run {@link #downloadPending()} afterwards to restore the files.
     *
     * @return Number of vanished items found.
     */
    public int resync(Path rootDirectory) {
        int checked = 0;
        int vanished = 0;
        for (MediaItem item : dbManager.downloadedItems()) {
            checked++;
            Path expected = rootDirectory.resolve(item.getPath()).resolve(item.getFilename());
            if (!Files.exists(expected)) {
                logger.info(CONTEXT, "File vanished, marking pending again: " + expected);
                dbManager.markDownloaded(item.getId(), false);
                vanished++;
            }
        }
        logger.info(CONTEXT, "Resync checked " + checked + " items, " + vanished + " vanished");
        return vanished;
    }
}
