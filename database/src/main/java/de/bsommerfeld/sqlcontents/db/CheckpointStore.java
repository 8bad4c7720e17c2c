package de.bsommerfeld.sqlcontents.db;

import com.google.inject.Inject;
import com.google.inject.Singleton;
import de.bsommerfeld.sqlcontents.core.crypto.Crypto;
import de.bsommerfeld.sqlcontents.core.domain.CheckpointRecord;
import de.bsommerfeld.sqlcontents.core.error.FileTooLargeException;
import de.bsommerfeld.sqlcontents.core.error.NoSuchCheckpointException;
import de.bsommerfeld.sqlcontents.core.path.ApiPaths;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * The {@code remote_checkpoints} table: an append-only log of file
 * snapshots, keyed by full file path but not foreign-keyed to
 * {@code files}. Checkpoints survive deletion of their file and are moved
 * explicitly when a file or directory is renamed.
 *
 * <p>
 * The current checkpoint of a path is the one with the greatest
 * {@code last_modified}, ties broken by the greater id.
 */
@Singleton
public class CheckpointStore {

    private static final Logger LOG = LoggerFactory.getLogger(CheckpointStore.class);

    private final Clock clock;

    @Inject
    public CheckpointStore() {
        this(Clock.systemUTC());
    }

    CheckpointStore(Clock clock) {
        this.clock = clock;
    }

    /**
     * Appends a new checkpoint. Never overwrites.
     *
     * @return the new checkpoint without content
     * @throws FileTooLargeException if the encrypted content exceeds
     *                               {@code maxSizeBytes}; nothing is written
     */
    public CheckpointRecord save(Connection conn, String userId, String apiPath, byte[] plaintext, Crypto crypto,
            long maxSizeBytes) throws SQLException {
        byte[] stored = FileStore.encryptWithinLimit(apiPath, plaintext, crypto, maxSizeBytes);
        String path = ApiPaths.fromApiFilename(apiPath);
        long now = clock.millis();

        try (PreparedStatement ps = conn.prepareStatement(SqlLoader.load("insert-checkpoint"),
                Statement.RETURN_GENERATED_KEYS)) {
            ps.setString(1, userId);
            ps.setString(2, path);
            ps.setBytes(3, stored);
            ps.setLong(4, now);
            ps.executeUpdate();
            try (ResultSet keys = ps.getGeneratedKeys()) {
                if (!keys.next())
                    throw new SQLException("No id generated for checkpoint of " + path);
                long id = keys.getLong(1);
                LOG.debug("Saved checkpoint {} of {} for {}", id, apiPath, userId);
                return new CheckpointRecord(id, path, Instant.ofEpochMilli(now), null);
            }
        }
    }

    /** @throws NoSuchCheckpointException if no checkpoint has this id and path */
    public CheckpointRecord get(Connection conn, String userId, String apiPath, long checkpointId, Crypto crypto)
            throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement(SqlLoader.load("select-checkpoint"))) {
            ps.setString(1, userId);
            ps.setString(2, ApiPaths.fromApiFilename(apiPath));
            ps.setLong(3, checkpointId);
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next())
                    throw new NoSuchCheckpointException(apiPath, checkpointId);
                return mapCheckpoint(rs, crypto.decrypt(rs.getBytes("content")));
            }
        }
    }

    /** Checkpoints of one path, newest first, without content. */
    public List<CheckpointRecord> list(Connection conn, String userId, String apiPath) throws SQLException {
        List<CheckpointRecord> result = new ArrayList<>();
        try (PreparedStatement ps = conn.prepareStatement(SqlLoader.load("select-checkpoints"))) {
            ps.setString(1, userId);
            ps.setString(2, ApiPaths.fromApiFilename(apiPath));
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next())
                    result.add(mapCheckpoint(rs, null));
            }
        }
        return result;
    }

    /** The current checkpoint of every path of the user, ordered by path. */
    public List<CheckpointRecord> latestPerPath(Connection conn, String userId) throws SQLException {
        List<CheckpointRecord> result = new ArrayList<>();
        try (PreparedStatement ps = conn.prepareStatement(SqlLoader.load("select-latest-checkpoints"))) {
            ps.setString(1, userId);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next())
                    result.add(mapCheckpoint(rs, null));
            }
        }
        return result;
    }

    /** @throws NoSuchCheckpointException if nothing matched */
    public void deleteOne(Connection conn, String userId, String apiPath, long checkpointId) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement(SqlLoader.load("delete-checkpoint"))) {
            ps.setString(1, userId);
            ps.setString(2, ApiPaths.fromApiFilename(apiPath));
            ps.setLong(3, checkpointId);
            if (ps.executeUpdate() == 0)
                throw new NoSuchCheckpointException(apiPath, checkpointId);
        }
    }

    /** Deletes every checkpoint of one path; returns how many. */
    public int deleteAll(Connection conn, String userId, String apiPath) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement(SqlLoader.load("delete-checkpoints"))) {
            ps.setString(1, userId);
            ps.setString(2, ApiPaths.fromApiFilename(apiPath));
            return ps.executeUpdate();
        }
    }

    public int purgeUser(Connection conn, String userId) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement(SqlLoader.load("delete-checkpoints-for-user"))) {
            ps.setString(1, userId);
            return ps.executeUpdate();
        }
    }

    /** @throws NoSuchCheckpointException if nothing matched */
    public void moveOne(Connection conn, String userId, String srcApiPath, String destApiPath, long checkpointId)
            throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement(SqlLoader.load("move-checkpoint"))) {
            ps.setString(1, ApiPaths.fromApiFilename(destApiPath));
            ps.setString(2, userId);
            ps.setString(3, ApiPaths.fromApiFilename(srcApiPath));
            ps.setLong(4, checkpointId);
            if (ps.executeUpdate() == 0)
                throw new NoSuchCheckpointException(srcApiPath, checkpointId);
        }
    }

    /**
     * Moves the checkpoints of a renamed file. Only the exact path is
     * rewritten, never paths below it.
     *
     * @return number of checkpoints moved
     */
    public int moveFile(Connection conn, String userId, String oldApiPath, String newApiPath) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement(SqlLoader.load("move-checkpoints"))) {
            ps.setString(1, ApiPaths.fromApiFilename(newApiPath));
            ps.setString(2, userId);
            ps.setString(3, ApiPaths.fromApiFilename(oldApiPath));
            return ps.executeUpdate();
        }
    }

    /**
     * Moves the checkpoints of a renamed directory: the exact path and every
     * path under {@code old + "/"}. A sibling sharing the textual prefix
     * ({@code a} vs. {@code ab}) is not touched.
     *
     * @return number of checkpoints moved
     */
    public int moveAll(Connection conn, String userId, String oldApiPath, String newApiPath) throws SQLException {
        String oldPath = ApiPaths.fromApiFilename(oldApiPath);
        String newPath = ApiPaths.fromApiFilename(newApiPath);

        int moved = moveFile(conn, userId, oldApiPath, newApiPath);
        try (PreparedStatement ps = conn.prepareStatement(SqlLoader.load("move-checkpoints-under"))) {
            ps.setString(1, newPath + "/");
            ps.setString(2, oldPath + "/");
            ps.setString(3, userId);
            moved += ps.executeUpdate();
        }
        if (moved > 0) {
            LOG.debug("Moved {} checkpoints {} -> {} for {}", moved, oldApiPath, newApiPath, userId);
        }
        return moved;
    }

    // =====================================================================
    // Row primitives for re-encryption
    // =====================================================================

    public List<Long> selectCheckpointIds(Connection conn, String userId) throws SQLException {
        return RowContent.selectIds(conn, "select-checkpoint-ids-for-user", userId);
    }

    public byte[] lockContent(Connection conn, long checkpointId) throws SQLException {
        return RowContent.read(conn, "select-checkpoint-content", checkpointId);
    }

    public void updateContent(Connection conn, long checkpointId, byte[] stored) throws SQLException {
        RowContent.write(conn, "update-checkpoint-content-by-id", checkpointId, stored);
    }

    private static CheckpointRecord mapCheckpoint(ResultSet rs, byte[] content) throws SQLException {
        return new CheckpointRecord(
                rs.getLong("id"),
                rs.getString("path"),
                Instant.ofEpochMilli(rs.getLong("last_modified")),
                content);
    }
}
