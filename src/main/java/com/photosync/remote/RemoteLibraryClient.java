package com.photosync.remote;

import com.photosync.model.DownloadRequest;
import com.photosync.model.ItemMetadata;
import com.photosync.model.TimeWindow;

import java.util.List;
import java.util.Set;

/**
 * Access to the remote media library.
 * <p>
 * Implementations throw {@link AuthorizationException} when the service rejects a call
 * entirely and {@link RemoteLibraryException} for other failures of a whole call.
 */
public interface RemoteLibraryClient {

    /**
     * Lists the items created within the window. Pagination happens inside the returned
     * iterable; its order is whatever the service returns. Implementations may return items
     * slightly outside the window when the service filters at a coarser granularity.
     */
    Iterable<ItemMetadata> listItems(TimeWindow window);

    /**
     * Writes the content of each requested item to its target directory, creating the directory
     * if needed. Videos are fetched as the full-quality stream, photos as the original.
     * A file must only appear under its final name once completely written.
     *
     * @return Ids whose content was written; every other requested item failed for this attempt.
     */
    Set<String> batchFetchContent(List<DownloadRequest> requests);

    /**
     * Looks up a single item.
     */
    ItemMetadata getItem(String id);
}
