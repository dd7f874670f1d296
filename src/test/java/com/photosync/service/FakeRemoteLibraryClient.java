package com.photosync.service;

import com.photosync.model.DownloadRequest;
import com.photosync.model.ItemMetadata;
import com.photosync.model.TimeWindow;
import com.photosync.remote.RemoteLibraryClient;
import com.photosync.util.FileUtils;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.*;

/**
 * In-memory library for engine tests.
 * Listing returns the library items inside the requested window in the order they were added.
 * Downloads write a small file per item and can be told to fail an item a number of times.
 */
class FakeRemoteLibraryClient implements RemoteLibraryClient {

    private final List<ItemMetadata> library = new ArrayList<>();
    private final List<TimeWindow> requestedWindows = new ArrayList<>();
    private final List<Integer> batchSizes = new ArrayList<>();
    private final Map<String, Integer> attempts = new HashMap<>();
    private final Map<String, Integer> remainingFailures = new HashMap<>();

    void addToLibrary(ItemMetadata... items) {
        library.addAll(Arrays.asList(items));
    }

    /**
     * Lets the next {@code times} download attempts of the item fail. Use Integer.MAX_VALUE for permanent failure.
     */
    void failDownload(String id, int times) {
        remainingFailures.put(id, times);
    }

    int attemptsFor(String id) {
        return attempts.getOrDefault(id, 0);
    }

    List<TimeWindow> getRequestedWindows() {
        return requestedWindows;
    }

    List<Integer> getBatchSizes() {
        return batchSizes;
    }

    @Override
    public Iterable<ItemMetadata> listItems(TimeWindow window) {
        requestedWindows.add(window);
        List<ItemMetadata> matching = new ArrayList<>();
        for (ItemMetadata item : library) {
            if (window.contains(item.getCreationInstant())) {
                matching.add(item);
            }
        }
        return matching;
    }

    @Override
    public Set<String> batchFetchContent(List<DownloadRequest> requests) {
        batchSizes.add(requests.size());
        Set<String> written = new HashSet<>();
        for (DownloadRequest request : requests) {
            attempts.merge(request.getId(), 1, Integer::sum);
            int failures = remainingFailures.getOrDefault(request.getId(), 0);
            if (failures > 0) {
                remainingFailures.put(request.getId(), failures == Integer.MAX_VALUE ? failures : failures - 1);
                continue;
            }
            try {
                byte[] content = ("content of " + request.getId()).getBytes(StandardCharsets.UTF_8);
                FileUtils.writeAtomically(request.getTargetFile(), new ByteArrayInputStream(content));
            } catch (IOException e) {
                throw new UncheckedIOException(e);
            }
            written.add(request.getId());
        }
        return written;
    }

    @Override
    public ItemMetadata getItem(String id) {
        for (ItemMetadata item : library) {
            if (item.getId().equals(id)) {
                return item;
            }
        }
        return null;
    }
}
