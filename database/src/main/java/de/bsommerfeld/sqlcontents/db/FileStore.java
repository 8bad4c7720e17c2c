package de.bsommerfeld.sqlcontents.db;

import com.google.inject.Inject;
import com.google.inject.Singleton;
import de.bsommerfeld.sqlcontents.core.crypto.Crypto;
import de.bsommerfeld.sqlcontents.core.domain.FileRecord;
import de.bsommerfeld.sqlcontents.core.error.FileExistsException;
import de.bsommerfeld.sqlcontents.core.error.FileTooLargeException;
import de.bsommerfeld.sqlcontents.core.error.NoSuchDirectoryException;
import de.bsommerfeld.sqlcontents.core.error.NoSuchFileException;
import de.bsommerfeld.sqlcontents.core.path.ApiPaths;
import de.bsommerfeld.sqlcontents.core.path.SplitPath;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Savepoint;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * The {@code files} table: exactly one current row per path.
 *
 * <h3>Save</h3>
 * {@link #saveFile} inserts first and, when the unique constraint reports an
 * existing row, rolls back to a savepoint and updates that row instead. Two
 * concurrent first saves of the same path therefore both succeed, the later
 * one winning. There is exactly one fallback; a failing update surfaces.
 */
@Singleton
public class FileStore {

    private static final Logger LOG = LoggerFactory.getLogger(FileStore.class);

    private final Clock clock;

    @Inject
    public FileStore() {
        this(Clock.systemUTC());
    }

    FileStore(Clock clock) {
        this.clock = clock;
    }

    /**
     * @param withContent whether to read and decrypt the content
     * @param crypto      used only when {@code withContent} is set
     * @throws NoSuchFileException if no row exists for the path
     */
    public FileRecord getFile(Connection conn, String userId, String apiPath, boolean withContent, Crypto crypto)
            throws SQLException {
        SplitPath split = ApiPaths.splitApiFilepath(apiPath);
        String sql = SqlLoader.load(withContent ? "select-file-with-content" : "select-file");
        try (PreparedStatement ps = conn.prepareStatement(sql)) {
            bindPath(ps, 1, userId, split);
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next())
                    throw new NoSuchFileException(apiPath);
                byte[] content = withContent ? crypto.decrypt(rs.getBytes("content")) : null;
                return mapFile(rs, content);
            }
        }
    }

    public long getFileId(Connection conn, String userId, String apiPath) throws SQLException {
        return getFile(conn, userId, apiPath, false, null).id();
    }

    public boolean fileExists(Connection conn, String userId, String apiPath) throws SQLException {
        try {
            getFile(conn, userId, apiPath, false, null);
            return true;
        } catch (NoSuchFileException e) {
            return false;
        }
    }

    /** Files directly inside {@code canonicalDir}, ordered by name, without content. */
    public List<FileRecord> filesInDirectory(Connection conn, String userId, String canonicalDir)
            throws SQLException {
        List<FileRecord> files = new ArrayList<>();
        try (PreparedStatement ps = conn.prepareStatement(SqlLoader.load("select-files-in-directory"))) {
            ps.setString(1, userId);
            ps.setString(2, canonicalDir);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next())
                    files.add(mapFile(rs, null));
            }
        }
        return files;
    }

    /**
     * Encrypts {@code plaintext} and writes it as the current content of the
     * path, creating the row or overwriting it.
     *
     * @param maxSizeBytes limit on the encrypted size, {@code 0} for none
     * @throws FileTooLargeException    if the encrypted content exceeds the
     *                                  limit; nothing is written
     * @throws NoSuchDirectoryException if the parent directory does not exist
     */
    public void saveFile(Connection conn, String userId, String apiPath, byte[] plaintext, Crypto crypto,
            long maxSizeBytes) throws SQLException {
        byte[] stored = encryptWithinLimit(apiPath, plaintext, crypto, maxSizeBytes);
        SplitPath split = ApiPaths.splitApiFilepath(apiPath);
        long now = clock.millis();

        Savepoint savepoint = conn.setSavepoint();
        try (PreparedStatement ps = conn.prepareStatement(SqlLoader.load("insert-file"))) {
            ps.setString(1, userId);
            ps.setString(2, split.directory());
            ps.setString(3, split.name());
            ps.setBytes(4, stored);
            ps.setLong(5, now);
            ps.executeUpdate();
            conn.releaseSavepoint(savepoint);
            LOG.debug("Inserted file {} for {} ({} bytes)", apiPath, userId, stored.length);
            return;
        } catch (SQLException e) {
            if (!SqlErrors.isUniqueViolation(e)) {
                SqlErrors.discardSavepoint(conn, savepoint, e);
                if (SqlErrors.isForeignKeyViolation(e))
                    throw new NoSuchDirectoryException(ApiPaths.toApiPath(split.directory()));
                throw e;
            }
            conn.rollback(savepoint);
            conn.releaseSavepoint(savepoint);
        }

        try (PreparedStatement ps = conn.prepareStatement(SqlLoader.load("update-file-content"))) {
            ps.setBytes(1, stored);
            ps.setLong(2, now);
            bindPath(ps, 3, userId, split);
            ps.executeUpdate();
        }
        LOG.debug("Updated file {} for {} ({} bytes)", apiPath, userId, stored.length);
    }

    /** @throws NoSuchFileException if no row exists for the path */
    public void deleteFile(Connection conn, String userId, String apiPath) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement(SqlLoader.load("delete-file"))) {
            bindPath(ps, 1, userId, ApiPaths.splitApiFilepath(apiPath));
            if (ps.executeUpdate() == 0)
                throw new NoSuchFileException(apiPath);
        }
        LOG.debug("Deleted file {} for {}", apiPath, userId);
    }

    /**
     * Moves a file. The row keeps its id; its timestamp is refreshed.
     *
     * @throws FileExistsException      if the target path is occupied
     * @throws NoSuchFileException      if the source does not exist
     * @throws NoSuchDirectoryException if the target directory does not exist
     */
    public void renameFile(Connection conn, String userId, String oldApiPath, String newApiPath)
            throws SQLException {
        if (fileExists(conn, userId, newApiPath))
            throw new FileExistsException(newApiPath);

        SplitPath target = ApiPaths.splitApiFilepath(newApiPath);
        try (PreparedStatement ps = conn.prepareStatement(SqlLoader.load("rename-file"))) {
            ps.setString(1, target.directory());
            ps.setString(2, target.name());
            ps.setLong(3, clock.millis());
            bindPath(ps, 4, userId, ApiPaths.splitApiFilepath(oldApiPath));
            if (ps.executeUpdate() == 0)
                throw new NoSuchFileException(oldApiPath);
        } catch (SQLException e) {
            if (SqlErrors.isForeignKeyViolation(e))
                throw new NoSuchDirectoryException(ApiPaths.toApiPath(target.directory()));
            if (SqlErrors.isUniqueViolation(e))
                throw new FileExistsException(newApiPath);
            throw e;
        }
        LOG.debug("Renamed file {} -> {} for {}", oldApiPath, newApiPath, userId);
    }

    // =====================================================================
    // Row primitives for re-encryption
    // =====================================================================

    public List<Long> selectFileIds(Connection conn, String userId) throws SQLException {
        return RowContent.selectIds(conn, "select-file-ids-for-user", userId);
    }

    /**
     * Reads the stored bytes of one row. Inside an immediate transaction
     * the row cannot change until commit.
     */
    public byte[] lockContent(Connection conn, long fileId) throws SQLException {
        return RowContent.read(conn, "select-file-content", fileId);
    }

    public void updateContent(Connection conn, long fileId, byte[] stored) throws SQLException {
        RowContent.write(conn, "update-file-content-by-id", fileId, stored);
    }

    static byte[] encryptWithinLimit(String apiPath, byte[] plaintext, Crypto crypto, long maxSizeBytes) {
        byte[] stored = crypto.encrypt(plaintext);
        if (maxSizeBytes > 0 && stored.length > maxSizeBytes)
            throw new FileTooLargeException(apiPath, stored.length, maxSizeBytes);
        return stored;
    }

    private static void bindPath(PreparedStatement ps, int from, String userId, SplitPath split)
            throws SQLException {
        ps.setString(from, userId);
        ps.setString(from + 1, split.directory());
        ps.setString(from + 2, split.name());
    }

    private static FileRecord mapFile(ResultSet rs, byte[] content) throws SQLException {
        return new FileRecord(
                rs.getLong("id"),
                rs.getString("parent_name"),
                rs.getString("name"),
                Instant.ofEpochMilli(rs.getLong("created_at")),
                content);
    }
}
