package com.photosync.service;

import com.photosync.model.DownloadStatus;
import com.photosync.model.ItemMetadata;
import com.photosync.model.MediaKind;
import com.photosync.model.TimeRange;
import com.photosync.model.TimeWindow;
import com.photosync.remote.AuthorizationException;
import com.photosync.remote.RemoteLibraryClient;
import com.photosync.remote.RemoteLibraryException;
import com.photosync.repository.SyncDatabaseManager;
import com.photosync.util.SyncLogger;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * Tests for {@link SyncEngine} against a real state store in a temporary directory
 * and an in-memory remote library.
 */
@ExtendWith(MockitoExtension.class)
class SyncEngineTest {

    private static final Instant NOW = Instant.parse("2024-06-01T00:00:00Z");

    @TempDir
    Path tempDir;

    @Mock
    private SyncLogger logger;

    private SyncDatabaseManager dbManager;
    private FakeRemoteLibraryClient client;
    private SyncEngine engine;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);
        dbManager = new SyncDatabaseManager(tempDir, clock);
        client = new FakeRemoteLibraryClient();
        engine = new SyncEngine(dbManager, client, tempDir, new DatePathMapper(), logger, SyncEngine.DEFAULT_BATCH_SIZE, clock);
    }

    private static ItemMetadata photo(String id, String creationTime) {
        return new ItemMetadata(id, creationTime, id + ".jpg", "image/jpeg", MediaKind.PHOTO, null);
    }

    /**
     * Adds {@code count} photos one day apart, named item-01, item-02, ... oldest first.
     */
    private List<String> addPendingPhotos(int count) {
        List<String> ids = new ArrayList<>();
        Instant base = Instant.parse("2020-01-01T08:00:00Z");
        for (int i = 1; i <= count; i++) {
            String id = String.format("item-%02d", i);
            ItemMetadata item = photo(id, base.plusSeconds(86400L * i).toString());
            client.addToLibrary(item);
            dbManager.addItem(item, new DatePathMapper().directoryFor(item));
            ids.add(id);
        }
        return ids;
    }

    // --- Windowing ---

    @Test
    void testComputeWindows_EmptyStoreWithHeuristic_SingleFullWindow() {
        List<TimeWindow> windows = engine.computeWindows(null, true);
        assertEquals(List.of(TimeWindow.closed(Instant.EPOCH, NOW)), windows);
    }

    @Test
    void testComputeWindows_PopulatedStoreWithHeuristic_WindowsOutsideKnownRange() {
        Instant t1 = Instant.parse("2015-05-05T05:05:05Z");
        Instant t2 = Instant.parse("2021-09-09T09:09:09Z");
        dbManager.addItem(photo("old", t1.toString()), "a/");
        dbManager.addItem(photo("mid", "2018-01-01T00:00:00Z"), "a/");
        dbManager.addItem(photo("new", t2.toString()), "a/");

        List<TimeWindow> windows = engine.computeWindows(null, true);

        assertEquals(2, windows.size());
        assertEquals(new TimeWindow(Instant.EPOCH, true, t1, false), windows.get(0));
        assertEquals(new TimeWindow(t2, false, NOW, true), windows.get(1));
    }

    @Test
    void testComputeWindows_NoHeuristic_FullWindowEvenWhenPopulated() {
        dbManager.addItem(photo("x", "2019-01-01T00:00:00Z"), "a/");
        assertEquals(List.of(TimeWindow.closed(Instant.EPOCH, NOW)), engine.computeWindows(null, false));
    }

    @Test
    void testComputeWindows_ExplicitRangeWinsOverHeuristic() {
        dbManager.addItem(photo("x", "2019-01-01T00:00:00Z"), "a/");
        Instant start = Instant.parse("2010-01-01T00:00:00Z");
        Instant end = Instant.parse("2011-01-01T00:00:00Z");

        assertEquals(List.of(TimeWindow.closed(start, end)), engine.computeWindows(new TimeRange(start, end), true));
        assertEquals(List.of(TimeWindow.closed(Instant.EPOCH, end)), engine.computeWindows(new TimeRange(null, end), true));
    }

    // --- Metadata ---

    @Test
    void testFetchMetadata_UnsortedListingAndRerun_RecordsEachItemOnce() {
        client.addToLibrary(
                photo("c", "2022-03-03T00:00:00Z"),
                photo("a", "2020-01-01T00:00:00Z"),
                photo("b", "2021-02-02T00:00:00Z"));

        assertTrue(engine.fetchMetadata(null, false));
        assertTrue(engine.fetchMetadata(null, false));

        assertEquals(3, dbManager.countItems(DownloadStatus.PENDING));
        assertEquals(1, dbManager.getTransactions("a").size());
        assertEquals("2020/01/01/", dbManager.getItem("a").getPath());
        verify(logger, never()).error(anyString(), anyString(), any());
        verify(logger, never()).recurringError(anyString(), anyString(), any());
    }

    @Test
    void testFetchMetadata_Heuristic_MissesItemsBetweenKnownExtremes() {
        client.addToLibrary(photo("old", "2015-01-01T00:00:00Z"), photo("new", "2020-01-01T00:00:00Z"));
        engine.fetchMetadata(null, true);

        client.addToLibrary(
                photo("backfilled", "2017-06-01T00:00:00Z"),
                photo("older", "2012-01-01T00:00:00Z"),
                photo("newer", "2023-01-01T00:00:00Z"));
        engine.fetchMetadata(null, true);

        assertNotNull(dbManager.getItem("older"));
        assertNotNull(dbManager.getItem("newer"));
        assertNull(dbManager.getItem("backfilled"), "Heuristic windows do not cover the known range");

        engine.fetchMetadata(null, false);
        assertNotNull(dbManager.getItem("backfilled"));
    }

    @Test
    void testFetchMetadata_MalformedItem_DoesNotAbortWindow() {
        ItemMetadata broken = new ItemMetadata("broken", "not a date", "b.jpg", "image/jpeg", MediaKind.PHOTO, null);
        ItemMetadata noTime = new ItemMetadata("no-time", null, "t.jpg", "image/jpeg", MediaKind.PHOTO, null);
        ItemMetadata noKind = new ItemMetadata("no-kind", "2020-01-01T12:00:00Z", "k.jpg", "image/jpeg", null, null);
        RemoteLibraryClient listing = mock(RemoteLibraryClient.class);
        when(listing.listItems(any())).thenReturn(List.of(
                photo("good-1", "2020-01-01T00:00:00Z"), broken, noTime, noKind, photo("good-2", "2020-01-02T00:00:00Z")));
        SyncEngine withBrokenItems = new SyncEngine(dbManager, listing, tempDir, new DatePathMapper(), logger, 16,
                Clock.fixed(NOW, ZoneOffset.UTC));

        assertTrue(withBrokenItems.fetchMetadata(null, false));

        assertNotNull(dbManager.getItem("good-1"));
        assertNotNull(dbManager.getItem("good-2"));
        assertNull(dbManager.getItem("no-time"));
        assertNull(dbManager.getItem("no-kind"));
        verify(logger, times(3)).recurringError(anyString(), anyString(), any(RuntimeException.class));
    }

    @Test
    void testFetchMetadata_FailingPathMapper_SkipsOnlyThatItemInEveryWindow() {
        dbManager.addItem(photo("known", "2020-01-01T00:00:00Z"), "2020/01/01/");
        client.addToLibrary(photo("old-bad", "2010-01-01T00:00:00Z"), photo("old-good", "2011-01-01T00:00:00Z"),
                photo("new-good", "2023-01-01T00:00:00Z"));
        PathMapper picky = item -> {
            if (item.getId().endsWith("bad")) {
                throw new IllegalStateException("no folder for " + item.getId());
            }
            return "flat/";
        };
        SyncEngine withPickyMapper = new SyncEngine(dbManager, client, tempDir, picky, logger, 16,
                Clock.fixed(NOW, ZoneOffset.UTC));

        assertTrue(withPickyMapper.fetchMetadata(null, true));

        assertNull(dbManager.getItem("old-bad"));
        assertNotNull(dbManager.getItem("old-good"));
        assertNotNull(dbManager.getItem("new-good"));
        verify(logger).recurringError(anyString(), anyString(), any(IllegalStateException.class));
    }

    @Test
    void testFetchMetadata_HeuristicOnPopulatedStore_ListsBothOuterWindows() {
        dbManager.addItem(photo("oldest", "2019-01-01T00:00:00Z"), "2019/01/01/");
        dbManager.addItem(photo("newest", "2021-01-01T00:00:00Z"), "2021/01/01/");

        assertTrue(engine.fetchMetadata(null, true));

        assertEquals(List.of(
                new TimeWindow(Instant.EPOCH, true, Instant.parse("2019-01-01T00:00:00Z"), false),
                new TimeWindow(Instant.parse("2021-01-01T00:00:00Z"), false, NOW, true)),
                client.getRequestedWindows());
    }

    @Test
    void testDrive_ListingFailure_KeepsPartialItemsAndSkipsDownload() {
        RemoteLibraryClient failing = mock(RemoteLibraryClient.class);
        when(failing.listItems(any())).thenReturn(() -> new Iterator<>() {
            private boolean served;

            @Override
            public boolean hasNext() {
                if (served) {
                    throw new RemoteLibraryException("connection reset");
                }
                return true;
            }

            @Override
            public ItemMetadata next() {
                served = true;
                return photo("first", "2020-01-01T00:00:00Z");
            }
        });
        SyncEngine failingEngine = new SyncEngine(dbManager, failing, tempDir, new DatePathMapper(), logger, 16,
                Clock.fixed(NOW, ZoneOffset.UTC));

        failingEngine.drive(null, true);

        assertNotNull(dbManager.getItem("first"));
        assertEquals(DownloadStatus.PENDING, dbManager.getItem("first").getStatus());
        verify(failing, never()).batchFetchContent(any());
        verify(logger).error(anyString(), contains("failed"), any(RemoteLibraryException.class));
    }

    @Test
    void testDrive_AuthorizationFailure_IsPropagated() {
        RemoteLibraryClient rejecting = mock(RemoteLibraryClient.class);
        when(rejecting.listItems(any())).thenThrow(new AuthorizationException("token expired"));
        SyncEngine rejectedEngine = new SyncEngine(dbManager, rejecting, tempDir, logger);

        assertThrows(AuthorizationException.class, () -> rejectedEngine.drive(null, true));
        verify(logger).flush();
    }

    @Test
    void testDownloadPending_AuthorizationFailure_IsPropagated() {
        addPendingPhotos(3);
        RemoteLibraryClient rejecting = mock(RemoteLibraryClient.class);
        when(rejecting.batchFetchContent(any())).thenThrow(new AuthorizationException("revoked"));
        SyncEngine rejectedEngine = new SyncEngine(dbManager, rejecting, tempDir, logger);

        assertThrows(AuthorizationException.class, rejectedEngine::downloadPending);
        assertEquals(3, dbManager.countItems(DownloadStatus.PENDING));
    }

    // --- Downloads ---

    @Test
    void testDrive_FreshLibrary_DownloadsEverythingIntoDateFolders() {
        client.addToLibrary(
                photo("p1", "2019-07-04T10:00:00Z"),
                new ItemMetadata("v1", "2020-02-29T23:30:00Z", "movie.mp4", "video/mp4", MediaKind.VIDEO, null));

        engine.drive(null, true);

        assertEquals(2, dbManager.countItems(DownloadStatus.DOWNLOADED));
        assertTrue(Files.exists(tempDir.resolve("2019/07/04/p1.jpg")));
        assertTrue(Files.exists(tempDir.resolve("2020/02/29/movie.mp4")));
        verify(logger).flush();
    }

    @Test
    void testDownloadPending_FailuresRetriedOnceInSecondPass() {
        List<String> ids = addPendingPhotos(20);
        String third = ids.get(2);
        String seventh = ids.get(6);
        client.failDownload(third, 1);
        client.failDownload(seventh, 1);

        DownloadSummary summary = engine.downloadPending();

        assertEquals(20, dbManager.countItems(DownloadStatus.DOWNLOADED));
        assertEquals(20, summary.getDownloaded());
        assertEquals(2, summary.getRetried());
        assertTrue(summary.getDeferredIds().isEmpty());
        for (String id : ids) {
            int expected = id.equals(third) || id.equals(seventh) ? 2 : 1;
            assertEquals(expected, client.attemptsFor(id), "attempts for " + id);
        }
        // Two regular batches, then one retry batch
        assertEquals(List.of(16, 4, 2), client.getBatchSizes());
    }

    @Test
    void testDownloadPending_PermanentFailuresInBatch_AreNonFatal() {
        List<String> ids = addPendingPhotos(16);
        client.failDownload(ids.get(4), Integer.MAX_VALUE);
        client.failDownload(ids.get(11), Integer.MAX_VALUE);

        DownloadSummary summary = assertDoesNotThrow(() -> engine.downloadPending());

        assertEquals(14, dbManager.countItems(DownloadStatus.DOWNLOADED));
        assertEquals(2, dbManager.countItems(DownloadStatus.PENDING));
        assertEquals(List.of(ids.get(4), ids.get(11)), summary.getDeferredIds());
        assertEquals(2, client.attemptsFor(ids.get(4)));
        verify(logger).warn(anyString(), contains("stay pending"));

        // The next run picks them up again
        client.failDownload(ids.get(4), 0);
        client.failDownload(ids.get(11), 0);
        engine.downloadPending();
        assertEquals(16, dbManager.countItems(DownloadStatus.DOWNLOADED));
    }

    @Test
    void testDownloadPending_FetchesOldestFirst() {
        client.addToLibrary(photo("newest", "2023-01-01T00:00:00Z"), photo("oldest", "2001-01-01T00:00:00Z"));
        engine.fetchMetadata(null, false);

        RemoteLibraryClient recording = mock(RemoteLibraryClient.class);
        when(recording.batchFetchContent(any())).thenReturn(Set.of());
        new SyncEngine(dbManager, recording, tempDir, new DatePathMapper(), logger, 1, Clock.fixed(NOW, ZoneOffset.UTC))
                .downloadPending();

        var inOrder = inOrder(recording);
        inOrder.verify(recording).batchFetchContent(argThat(r -> r.get(0).getId().equals("oldest")));
        inOrder.verify(recording).batchFetchContent(argThat(r -> r.get(0).getId().equals("newest")));
    }

    @Test
    void testDownloadPending_BatchCallFailure_RetriesWholeBatch() {
        addPendingPhotos(3);
        RemoteLibraryClient flaky = mock(RemoteLibraryClient.class);
        when(flaky.batchFetchContent(any()))
                .thenThrow(new RemoteLibraryException("HTTP 503"))
                .thenAnswer(invocation -> client.batchFetchContent(invocation.getArgument(0)));
        SyncEngine flakyEngine = new SyncEngine(dbManager, flaky, tempDir, logger);

        DownloadSummary summary = flakyEngine.downloadPending();

        assertEquals(3, summary.getDownloaded());
        assertEquals(3, summary.getRetried());
        assertEquals(3, dbManager.countItems(DownloadStatus.DOWNLOADED));
    }

    @Test
    void testDownloadPending_IgnoresIdsOutsideTheBatch() {
        addPendingPhotos(2);

        RemoteLibraryClient overReporting = mock(RemoteLibraryClient.class);
        when(overReporting.batchFetchContent(any())).thenReturn(Set.of("item-01", "item-02", "unknown"));
        DownloadSummary summary = new SyncEngine(dbManager, overReporting, tempDir, new DatePathMapper(), logger, 2,
                Clock.fixed(NOW, ZoneOffset.UTC)).downloadPending();

        assertEquals(2, summary.getDownloaded());
        assertEquals(DownloadStatus.DOWNLOADED, dbManager.getItem("item-01").getStatus());
        assertTrue(dbManager.getTransactions("unknown").isEmpty());
    }

    // --- Resync ---

    @Test
    void testResync_VanishedFileIsDemotedAndRestored() throws Exception {
        addPendingPhotos(3);
        engine.downloadPending();
        assertEquals(3, dbManager.countItems(DownloadStatus.DOWNLOADED));

        Path removed = tempDir.resolve(dbManager.getItem("item-02").getPath()).resolve("item-02.jpg");
        Files.delete(removed);

        assertEquals(1, engine.resync());
        assertEquals(DownloadStatus.PENDING, dbManager.getItem("item-02").getStatus());
        assertEquals(DownloadStatus.DOWNLOADED, dbManager.getItem("item-01").getStatus());
        assertEquals(1, client.attemptsFor("item-02"), "resync must not download");

        engine.downloadPending();
        assertEquals(DownloadStatus.DOWNLOADED, dbManager.getItem("item-02").getStatus());
        assertTrue(Files.exists(removed));
        assertEquals(2, client.attemptsFor("item-02"));
        assertEquals(1, client.attemptsFor("item-01"));
    }

    @Test
    void testResync_OtherRootDirectory_AllFilesMissing() {
        addPendingPhotos(2);
        engine.downloadPending();

        assertEquals(2, engine.resync(tempDir.resolve("elsewhere")));
        assertEquals(2, dbManager.countItems(DownloadStatus.PENDING));
    }

    @Test
    void testResync_NothingVanished_ReturnsZero() {
        addPendingPhotos(2);
        engine.downloadPending();
        assertEquals(0, engine.resync());
    }

    @Test
    void testConstructor_RejectsNonPositiveBatchSize() {
        assertThrows(IllegalArgumentException.class, () ->
                new SyncEngine(dbManager, client, tempDir, new DatePathMapper(), logger, 0, Clock.systemUTC()));
    }
}
