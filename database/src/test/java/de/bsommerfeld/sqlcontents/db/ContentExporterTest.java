package de.bsommerfeld.sqlcontents.db;

import de.bsommerfeld.sqlcontents.core.crypto.Crypto;
import de.bsommerfeld.sqlcontents.core.crypto.CryptoFactory;
import de.bsommerfeld.sqlcontents.core.domain.ExportedContent;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Integration tests for ContentExporter against a real temporary SQLite
 * database.
 */
class ContentExporterTest {

    private static final Instant T0 = Instant.parse("2024-03-01T12:00:00Z");
    private static final CryptoFactory KEYS = CryptoFactory.singlePassword("export-secret");

    @TempDir
    Path tempDir;

    private SqlDatabase db;
    private MutableClock clock;
    private FileStore files;
    private CheckpointStore checkpoints;
    private ContentExporter exporter;

    @BeforeEach
    void setUp() {
        db = TestDatabases.create(tempDir);
        clock = new MutableClock(T0);
        files = new FileStore(clock);
        checkpoints = new CheckpointStore(clock);
        exporter = new ContentExporter(db);
        DirectoryStore directories = new DirectoryStore(files);
        db.runInTransaction(conn -> {
            for (String user : List.of("alice", "bob")) {
                new UserStore().ensureUser(conn, user);
                directories.ensureDirectory(conn, user, "");
                directories.ensureDirectory(conn, user, "nb");
            }
        });
    }

    @Test
    void exportFiles_shouldReturnOnlyNotebooksInTimestampOrder() {
        saveFile("bob", "nb/second.ipynb", "2", Duration.ofMinutes(2));
        saveFile("alice", "nb/first.ipynb", "1", Duration.ofMinutes(1));
        saveFile("alice", "nb/readme.txt", "not a notebook", Duration.ofMinutes(3));
        saveFile("alice", "nb/UPPER.IPYNB", "wrong case", Duration.ofMinutes(4));

        List<ExportedContent> exported = exporter.exportFiles(KEYS, null, null);

        assertEquals(List.of("nb/first.ipynb", "nb/second.ipynb"),
                exported.stream().map(ExportedContent::path).toList());
        assertEquals("alice", exported.get(0).userId());
        assertArrayEquals(bytes("1"), exported.get(0).content());
        assertEquals(T0.plus(Duration.ofMinutes(1)), exported.get(0).lastModified());
    }

    @Test
    void exportFiles_shouldHonourHalfOpenBounds() {
        saveFile("alice", "nb/a.ipynb", "a", Duration.ofMinutes(1));
        saveFile("alice", "nb/b.ipynb", "b", Duration.ofMinutes(2));
        saveFile("alice", "nb/c.ipynb", "c", Duration.ofMinutes(3));

        List<ExportedContent> exported = exporter.exportFiles(KEYS,
                T0.plus(Duration.ofMinutes(2)), T0.plus(Duration.ofMinutes(3)));

        assertEquals(List.of("nb/b.ipynb"), exported.stream().map(ExportedContent::path).toList());
    }

    @Test
    void exportFiles_shouldSkipCorruptedRows() {
        saveFile("alice", "nb/good.ipynb", "good", Duration.ofMinutes(1));
        Crypto foreign = CryptoFactory.singlePassword("foreign").forUser("alice");
        clock.set(T0.plus(Duration.ofMinutes(2)));
        db.runInTransaction(conn -> files.saveFile(conn, "alice", "nb/bad.ipynb", bytes("bad"), foreign, 0));

        List<ExportedContent> exported = exporter.exportFiles(KEYS, null, null);

        assertEquals(List.of("nb/good.ipynb"), exported.stream().map(ExportedContent::path).toList());
    }

    @Test
    void exportCheckpoints_shouldStreamAllCheckpointsInOrder() {
        clock.set(T0.plus(Duration.ofMinutes(5)));
        db.runInTransaction(conn -> checkpoints.save(conn, "bob", "nb/x.ipynb", bytes("x"), KEYS.forUser("bob"), 0));
        clock.set(T0.plus(Duration.ofMinutes(1)));
        db.runInTransaction(
                conn -> checkpoints.save(conn, "alice", "nb/y.ipynb", bytes("y"), KEYS.forUser("alice"), 0));

        List<String> users = new java.util.ArrayList<>();
        exporter.exportCheckpoints(KEYS, null, null, exported -> users.add(exported.userId()));

        assertEquals(List.of("alice", "bob"), users);
    }

    private void saveFile(String user, String path, String content, Duration offset) {
        clock.set(T0.plus(offset));
        db.runInTransaction(conn -> files.saveFile(conn, user, path, bytes(content), KEYS.forUser(user), 0));
    }

    private static byte[] bytes(String s) {
        return s.getBytes(StandardCharsets.UTF_8);
    }
}
