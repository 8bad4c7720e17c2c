package de.bsommerfeld.sqlcontents.db;

import de.bsommerfeld.sqlcontents.core.config.DatabaseConfig;
import de.bsommerfeld.sqlcontents.core.error.NoSuchFileException;
import de.bsommerfeld.sqlcontents.core.error.StorageException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Integration tests for SqlDatabase against a real temporary SQLite file.
 */
class SqlDatabaseTest {

    @TempDir
    Path tempDir;

    private SqlDatabase db;
    private UserStore users;

    @BeforeEach
    void setUp() {
        db = TestDatabases.create(tempDir);
        users = new UserStore();
    }

    @Test
    void constructor_shouldApplyAllTables() {
        List<String> tables = db.inTransaction(conn -> {
            List<String> names = new java.util.ArrayList<>();
            try (PreparedStatement ps = conn.prepareStatement(
                    "SELECT name FROM sqlite_master WHERE type = 'table' AND name NOT LIKE 'sqlite_%' ORDER BY name");
                    ResultSet rs = ps.executeQuery()) {
                while (rs.next())
                    names.add(rs.getString(1));
            }
            return names;
        });

        assertEquals(List.of("directories", "files", "remote_checkpoints", "users"), tables);
    }

    @Test
    void constructor_shouldBeIdempotentOnExistingDatabase() {
        db.runInTransaction(conn -> users.ensureUser(conn, "alice"));

        SqlDatabase reopened = TestDatabases.create(tempDir);

        assertEquals(List.of("alice"), reopened.inTransaction(users::listUsers));
    }

    @Test
    void constructor_shouldCreateMissingParentDirectory() {
        Path nested = tempDir.resolve("a").resolve("b").resolve("contents.db");
        DatabaseConfig config = new DatabaseConfig();
        config.setUrl("jdbc:sqlite:" + nested.toAbsolutePath());

        new SqlDatabase(config);

        assertTrue(Files.exists(nested));
    }

    @Test
    void constructor_shouldSwitchToWriteAheadLog() {
        String mode = db.inReadTransaction(conn -> {
            try (PreparedStatement ps = conn.prepareStatement("PRAGMA journal_mode");
                    ResultSet rs = ps.executeQuery()) {
                return rs.next() ? rs.getString(1) : null;
            }
        });

        assertEquals("wal", mode);
    }

    @Test
    void inReadTransaction_shouldNotWaitForAnotherUsersWriter() throws Exception {
        DatabaseConfig config = new DatabaseConfig();
        config.setUrl("jdbc:sqlite:" + tempDir.resolve("busy.db").toAbsolutePath());
        config.setBusyTimeoutMillis(300);
        SqlDatabase busyDb = new SqlDatabase(config);
        busyDb.runInTransaction(conn -> users.ensureUser(conn, "alice"));

        CountDownLatch writing = new CountDownLatch(1);
        CountDownLatch readFinished = new CountDownLatch(1);
        ExecutorService executor = Executors.newSingleThreadExecutor();
        try {
            Future<?> writer = executor.submit(() -> busyDb.runInTransaction(conn -> {
                users.ensureUser(conn, "bob");
                writing.countDown();
                awaitReader(readFinished);
            }));
            assertTrue(writing.await(10, TimeUnit.SECONDS));

            List<String> seen = busyDb.inReadTransaction(users::listUsers);
            readFinished.countDown();
            writer.get(10, TimeUnit.SECONDS);

            assertEquals(List.of("alice"), seen);
        } finally {
            readFinished.countDown();
            executor.shutdownNow();
        }
        assertEquals(List.of("alice", "bob"), busyDb.inReadTransaction(users::listUsers));
    }

    @Test
    void inTransaction_domainException_shouldRollBackAndPropagate() {
        assertThrows(NoSuchFileException.class, () -> db.runInTransaction(conn -> {
            users.ensureUser(conn, "alice");
            throw new NoSuchFileException("x");
        }));

        assertTrue(db.inTransaction(users::listUsers).isEmpty());
    }

    @Test
    void inTransaction_sqlException_shouldBeWrapped() {
        var ex = assertThrows(StorageException.class, () -> db.runInTransaction(conn -> {
            try (PreparedStatement ps = conn.prepareStatement("SELECT * FROM no_such_table")) {
                ps.executeQuery();
            }
        }));

        assertNotNull(ex.getCause());
    }

    @Test
    void connections_shouldEnforceForeignKeys() {
        // files.parent_name must reference an existing directory
        assertThrows(StorageException.class, () -> db.runInTransaction(conn -> {
            users.ensureUser(conn, "alice");
            try (PreparedStatement ps = conn.prepareStatement(SqlLoader.load("insert-file"))) {
                ps.setString(1, "alice");
                ps.setString(2, "/missing/");
                ps.setString(3, "a.txt");
                ps.setBytes(4, new byte[] { 1 });
                ps.setLong(5, 0);
                ps.executeUpdate();
            }
        }));
    }

    @Test
    void schema_shouldRejectDirectoryThatSkipsALevel() {
        var ex = assertThrows(StorageException.class, () -> db.runInTransaction(conn -> {
            users.ensureUser(conn, "alice");
            insertDirectory(conn, "/", null);
            insertDirectory(conn, "/a/b/", "/");
        }));

        assertTrue(ex.getCause().getMessage().contains("CHECK"));
    }

    @Test
    void schema_shouldRejectRootWithParent() {
        assertThrows(StorageException.class, () -> db.runInTransaction(conn -> {
            users.ensureUser(conn, "alice");
            insertDirectory(conn, "/", "/");
        }));
    }

    private static void awaitReader(CountDownLatch latch) {
        try {
            if (!latch.await(10, TimeUnit.SECONDS))
                throw new IllegalStateException("Reader did not finish");
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException(e);
        }
    }

    private static void insertDirectory(java.sql.Connection conn, String name, String parent)
            throws java.sql.SQLException {
        try (PreparedStatement ps = conn.prepareStatement(SqlLoader.load("insert-directory"))) {
            ps.setString(1, "alice");
            ps.setString(2, name);
            ps.setString(3, parent == null ? null : "alice");
            ps.setString(4, parent);
            ps.executeUpdate();
        }
    }
}
