package com.photosync.repository;

import com.photosync.model.DownloadStatus;
import com.photosync.model.ItemMetadata;
import com.photosync.model.ItemRange;
import com.photosync.model.MediaItem;
import com.photosync.model.MediaKind;
import com.photosync.model.TransactionLogEntry;

import java.io.File;
import java.nio.file.Path;
import java.sql.*;
import java.time.Clock;
import java.time.Instant;
import java.util.*;

/**
 * Manages the sync state database (sync.db).
 * The database lives in the .photosync folder of the sync root and records every
 * remote item seen so far, its download status, an append-only transaction log
 * and the stored authorization blob.
 * <p>
 * Each public mutating method runs in its own transaction; nothing spans calls.
 * The database is expected to be owned by a single engine instance.
 */
public class SyncDatabaseManager {
    public static final String DB_FOLDER = ".photosync";
    private static final String DB_NAME = "sync.db";
    private static final int CURRENT_DB_VERSION = 1;
    private static final int PAGE_SIZE = 500;

    private static final String SQL_CREATE_METADATA = """
            CREATE TABLE IF NOT EXISTS metadata (
            version integer PRIMARY KEY
            );""";

    private static final String SQL_CREATE_ITEMS = """
            CREATE TABLE IF NOT EXISTS items (
             id text PRIMARY KEY,
             creation_time integer NOT NULL,
             path text NOT NULL,
             filename text NOT NULL,
             mime_type text,
             media_kind text NOT NULL,
             status text NOT NULL DEFAULT 'PENDING'
            );""";

    private static final String SQL_CREATE_TRANSACTIONS = """
            CREATE TABLE IF NOT EXISTS transactions (
             item_id text NOT NULL,
             event text NOT NULL,
             time integer NOT NULL
            );""";

    private static final String SQL_CREATE_OAUTH = """
            CREATE TABLE IF NOT EXISTS oauth (
             id text PRIMARY KEY,
             credentials blob
            );""";

    private static final String SQL_INDEX_ITEMS_STATUS_TIME =
            "CREATE INDEX IF NOT EXISTS idx_items_status_time ON items(status, creation_time, id);";
    private static final String SQL_INDEX_ITEMS_TIME = "CREATE INDEX IF NOT EXISTS idx_items_time ON items(creation_time);";
    private static final String SQL_INDEX_TRANSACTIONS_ITEM = "CREATE INDEX IF NOT EXISTS idx_transactions_item ON transactions(item_id);";

    private final String connectionUrl;
    private final Clock clock;

    public SyncDatabaseManager(Path syncRoot) {
        this(syncRoot, Clock.systemUTC());
    }

    public SyncDatabaseManager(Path syncRoot, Clock clock) {
        File dbFolder = syncRoot.resolve(DB_FOLDER).toFile();
        if (!dbFolder.exists()) {
            if (!dbFolder.mkdirs()) {
                throw new DatabaseException("Could not create sync database directory: " + dbFolder.getAbsolutePath());
            }
        }
        File dbFile = new File(dbFolder, DB_NAME);
        this.connectionUrl = "jdbc:sqlite:" + dbFile.getAbsolutePath();
        this.clock = clock;
        initialize();
    }

    // Constructor for testing purposes, e.g. with a shared in-memory database
    SyncDatabaseManager(String connectionUrl, Clock clock) {
        this.connectionUrl = connectionUrl;
        this.clock = clock;
        initialize();
    }

    private Connection connect() throws SQLException {
        return DriverManager.getConnection(connectionUrl);
    }

    /**
     * Creates the schema and runs pending migrations in a single transaction.
     */
    private void initialize() {
        try (Connection conn = connect()) {
            // WAL is not supported for in-memory databases
            if (!connectionUrl.contains(":memory:") && !connectionUrl.contains("mode=memory")) {
                try (Statement stmt = conn.createStatement()) {
                    stmt.execute("PRAGMA journal_mode=WAL;");
                    stmt.execute("PRAGMA synchronous=NORMAL;");
                }
            }

            conn.setAutoCommit(false);
            try (Statement stmt = conn.createStatement()) {
                int version = 0;
                if (getExistingColumns(conn, "metadata").contains("version")) {
                    try (ResultSet rs = stmt.executeQuery("SELECT version FROM metadata ORDER BY version DESC LIMIT 1")) {
                        if (rs.next()) {
                            version = rs.getInt("version");
                        }
                    }
                }

                if (version < CURRENT_DB_VERSION) {
                    migrate(conn, version);
                }
                conn.commit();
            } catch (SQLException e) {
                conn.rollback();
                throw e;
            }
        } catch (SQLException e) {
            throw new DatabaseException("Sync database initialization failed", e);
        }
    }

    private void migrate(Connection conn, int currentVersion) throws SQLException {
        try (Statement stmt = conn.createStatement()) {
            createTablesIfNotExist(stmt);
            stmt.execute("INSERT OR REPLACE INTO metadata (version) VALUES (" + CURRENT_DB_VERSION + ");");
        }
        if (currentVersion > 0) {
            System.out.println("Migrated sync database from version " + currentVersion + " to " + CURRENT_DB_VERSION);
        }
    }

    private void createTablesIfNotExist(Statement stmt) throws SQLException {
        stmt.execute(SQL_CREATE_METADATA);
        stmt.execute(SQL_CREATE_ITEMS);
        stmt.execute(SQL_CREATE_TRANSACTIONS);
        stmt.execute(SQL_CREATE_OAUTH);

        stmt.execute(SQL_INDEX_ITEMS_STATUS_TIME);
        stmt.execute(SQL_INDEX_ITEMS_TIME);
        stmt.execute(SQL_INDEX_TRANSACTIONS_ITEM);
    }

    private Set<String> getExistingColumns(Connection conn, String tableName) throws SQLException {
        Set<String> columns = new HashSet<>();
        try (ResultSet rs = conn.getMetaData().getColumns(null, null, tableName, null)) {
            while (rs.next()) {
                columns.add(rs.getString("COLUMN_NAME"));
            }
        }
        return columns;
    }

    // --- Items ---

    /**
     * Records a newly observed remote item with status PENDING and logs an ADDED transaction.
     *
     * @param metadata The remote metadata.
     * @param path     Directory, relative to the sync root, the content will be stored in.
     * @return false without touching the database if the id is already known.
     * @throws java.time.format.DateTimeParseException if the creation time cannot be parsed.
     * @throws DatabaseException if the row violates a column constraint, e.g. a missing filename.
     */
    public boolean addItem(ItemMetadata metadata, String path) {
        long creationTime = metadata.getCreationInstant().toEpochMilli();
        String mediaKind = metadata.getMediaKind() != null ? metadata.getMediaKind().name() : null;
        String sql = "INSERT INTO items(id, creation_time, path, filename, mime_type, media_kind, status) " +
                     "VALUES(?,?,?,?,?,?,?)";

        try (Connection conn = connect()) {
            conn.setAutoCommit(false);
            try (PreparedStatement exists = conn.prepareStatement("SELECT 1 FROM items WHERE id = ?");
                 PreparedStatement pstmt = conn.prepareStatement(sql)) {
                exists.setString(1, metadata.getId());
                try (ResultSet rs = exists.executeQuery()) {
                    if (rs.next()) {
                        conn.rollback();
                        return false;
                    }
                }

                pstmt.setString(1, metadata.getId());
                pstmt.setLong(2, creationTime);
                pstmt.setString(3, path);
                pstmt.setString(4, metadata.getFilename());
                pstmt.setString(5, metadata.getMimeType());
                pstmt.setString(6, mediaKind);
                pstmt.setString(7, DownloadStatus.PENDING.name());
                pstmt.executeUpdate();
                recordTransaction(conn, metadata.getId(), TransactionLogEntry.EventKind.ADDED);
                conn.commit();
                return true;
            } catch (SQLException e) {
                conn.rollback();
                throw e;
            }
        } catch (SQLException e) {
            throw new DatabaseException("Failed to add item " + metadata.getId(), e);
        }
    }

    /**
     * Returns the creation times of the oldest and newest known items.
     * An empty store yields (now, epoch).
     */
    public ItemRange queryExtremes() {
        String sql = "SELECT MIN(creation_time) AS oldest, MAX(creation_time) AS newest, COUNT(*) AS total FROM items";
        try (Connection conn = connect();
             Statement stmt = conn.createStatement();
             ResultSet rs = stmt.executeQuery(sql)) {
            if (rs.next() && rs.getLong("total") > 0) {
                return new ItemRange(Instant.ofEpochMilli(rs.getLong("oldest")), Instant.ofEpochMilli(rs.getLong("newest")));
            }
        } catch (SQLException e) {
            throw new DatabaseException("Failed to query item time range", e);
        }
        return new ItemRange(clock.instant(), Instant.EPOCH);
    }

    /**
     * Items not yet present locally, oldest first.
     * The returned iterable is lazy and can be iterated again; every iteration starts a fresh query.
     */
    public Iterable<MediaItem> pendingItems() {
        return itemsWithStatus(DownloadStatus.PENDING);
    }

    /**
     * Items recorded as present locally, oldest first. Lazy and restartable like {@link #pendingItems()}.
     */
    public Iterable<MediaItem> downloadedItems() {
        return itemsWithStatus(DownloadStatus.DOWNLOADED);
    }

    private Iterable<MediaItem> itemsWithStatus(DownloadStatus status) {
        return () -> new StatusPageIterator(status);
    }

    /**
     * Sets the status of the given items in one transaction.
     * A DOWNLOADED transaction is appended per item only when {@code downloaded} is true.
     */
    public void markDownloaded(Collection<String> ids, boolean downloaded) {
        if (ids == null || ids.isEmpty()) {
            return;
        }
        String sql = "UPDATE items SET status = ? WHERE id = ?";
        DownloadStatus status = downloaded ? DownloadStatus.DOWNLOADED : DownloadStatus.PENDING;

        try (Connection conn = connect()) {
            conn.setAutoCommit(false);
            try (PreparedStatement pstmt = conn.prepareStatement(sql)) {
                for (String id : ids) {
                    pstmt.setString(1, status.name());
                    pstmt.setString(2, id);
                    pstmt.addBatch();
                }
                pstmt.executeBatch();

                if (downloaded) {
                    for (String id : ids) {
                        recordTransaction(conn, id, TransactionLogEntry.EventKind.DOWNLOADED);
                    }
                }
                conn.commit();
            } catch (SQLException e) {
                conn.rollback();
                throw e;
            }
        } catch (SQLException e) {
            throw new DatabaseException("Failed to mark " + ids.size() + " items as " + status, e);
        }
    }

    public void markDownloaded(String id, boolean downloaded) {
        markDownloaded(List.of(id), downloaded);
    }

    public MediaItem getItem(String id) {
        String sql = "SELECT * FROM items WHERE id = ?";
        try (Connection conn = connect();
             PreparedStatement pstmt = conn.prepareStatement(sql)) {
            pstmt.setString(1, id);
            try (ResultSet rs = pstmt.executeQuery()) {
                if (rs.next()) {
                    return mapResultSetToItem(rs);
                }
            }
        } catch (SQLException e) {
            throw new DatabaseException("Failed to get item " + id, e);
        }
        return null;
    }

    public int countItems(DownloadStatus status) {
        String sql = "SELECT COUNT(*) FROM items WHERE status = ?";
        try (Connection conn = connect();
             PreparedStatement pstmt = conn.prepareStatement(sql)) {
            pstmt.setString(1, status.name());
            try (ResultSet rs = pstmt.executeQuery()) {
                if (rs.next()) {
                    return rs.getInt(1);
                }
            }
        } catch (SQLException e) {
            throw new DatabaseException("Failed to count items with status " + status, e);
        }
        return 0;
    }

    private MediaItem mapResultSetToItem(ResultSet rs) throws SQLException {
        return new MediaItem(
                rs.getString("id"),
                Instant.ofEpochMilli(rs.getLong("creation_time")),
                rs.getString("path"),
                rs.getString("filename"),
                rs.getString("mime_type"),
                MediaKind.valueOf(rs.getString("media_kind")),
                DownloadStatus.valueOf(rs.getString("status"))
        );
    }

    /**
     * Walks the items of one status page by page, keyed on (creation_time, id).
     * Each page is read with its own short-lived connection, so status updates made
     * by the consumer between pages neither block nor cause items to be seen twice.
     */
    private class StatusPageIterator implements Iterator<MediaItem> {
        private final DownloadStatus status;
        private Deque<MediaItem> page = new ArrayDeque<>();
        private MediaItem last;
        private boolean exhausted;

        StatusPageIterator(DownloadStatus status) {
            this.status = status;
        }

        @Override
        public boolean hasNext() {
            if (page.isEmpty() && !exhausted) {
                page = fetchPage();
                exhausted = page.size() < PAGE_SIZE;
            }
            return !page.isEmpty();
        }

        @Override
        public MediaItem next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            last = page.poll();
            return last;
        }

        private Deque<MediaItem> fetchPage() {
            String sql = last == null
                    ? "SELECT * FROM items WHERE status = ? ORDER BY creation_time ASC, id ASC LIMIT ?"
                    : "SELECT * FROM items WHERE status = ? AND (creation_time > ? OR (creation_time = ? AND id > ?)) " +
                      "ORDER BY creation_time ASC, id ASC LIMIT ?";
            Deque<MediaItem> result = new ArrayDeque<>();
            try (Connection conn = connect();
                 PreparedStatement pstmt = conn.prepareStatement(sql)) {
                pstmt.setString(1, status.name());
                if (last == null) {
                    pstmt.setInt(2, PAGE_SIZE);
                } else {
                    long lastTime = last.getCreationTime().toEpochMilli();
                    pstmt.setLong(2, lastTime);
                    pstmt.setLong(3, lastTime);
                    pstmt.setString(4, last.getId());
                    pstmt.setInt(5, PAGE_SIZE);
                }
                try (ResultSet rs = pstmt.executeQuery()) {
                    while (rs.next()) {
                        result.add(mapResultSetToItem(rs));
                    }
                }
            } catch (SQLException e) {
                throw new DatabaseException("Failed to read " + status + " items", e);
            }
            return result;
        }
    }

    // --- Transaction log ---

    private void recordTransaction(Connection conn, String itemId, TransactionLogEntry.EventKind event) throws SQLException {
        String sql = "INSERT INTO transactions(item_id, event, time) VALUES(?, ?, ?)";
        try (PreparedStatement pstmt = conn.prepareStatement(sql)) {
            pstmt.setString(1, itemId);
            pstmt.setString(2, event.name());
            pstmt.setLong(3, clock.instant().toEpochMilli());
            pstmt.executeUpdate();
        }
    }

    /**
     * Returns the audit trail of one item in chronological order.
     */
    public List<TransactionLogEntry> getTransactions(String itemId) {
        List<TransactionLogEntry> entries = new ArrayList<>();
        String sql = "SELECT item_id, event, time FROM transactions WHERE item_id = ? ORDER BY time ASC, rowid ASC";
        try (Connection conn = connect();
             PreparedStatement pstmt = conn.prepareStatement(sql)) {
            pstmt.setString(1, itemId);
            try (ResultSet rs = pstmt.executeQuery()) {
                while (rs.next()) {
                    entries.add(new TransactionLogEntry(
                            rs.getString("item_id"),
                            TransactionLogEntry.EventKind.valueOf(rs.getString("event")),
                            Instant.ofEpochMilli(rs.getLong("time"))));
                }
            }
        } catch (SQLException e) {
            throw new DatabaseException("Failed to load transactions for " + itemId, e);
        }
        return entries;
    }

    // --- Credentials ---

    /**
     * Stores an opaque credential blob, replacing any previous blob for the identity.
     */
    public void storeCredential(String identity, byte[] blob) {
        String sql = "INSERT INTO oauth(id, credentials) VALUES(?, ?) " +
                     "ON CONFLICT(id) DO UPDATE SET credentials = excluded.credentials";
        try (Connection conn = connect();
             PreparedStatement pstmt = conn.prepareStatement(sql)) {
            pstmt.setString(1, identity);
            pstmt.setBytes(2, blob);
            pstmt.executeUpdate();
        } catch (SQLException e) {
            throw new DatabaseException("Failed to store credentials for " + identity, e);
        }
    }

    /**
     * @return The stored blob, or null if nothing is stored for the identity.
     */
    public byte[] getCredential(String identity) {
        String sql = "SELECT credentials FROM oauth WHERE id = ?";
        try (Connection conn = connect();
             PreparedStatement pstmt = conn.prepareStatement(sql)) {
            pstmt.setString(1, identity);
            try (ResultSet rs = pstmt.executeQuery()) {
                if (rs.next()) {
                    return rs.getBytes("credentials");
                }
            }
        } catch (SQLException e) {
            throw new DatabaseException("Failed to load credentials for " + identity, e);
        }
        return null;
    }
}
