package de.bsommerfeld.sqlcontents.db;

import com.google.inject.Inject;
import com.google.inject.Singleton;
import de.bsommerfeld.sqlcontents.core.domain.DirectoryListing;
import de.bsommerfeld.sqlcontents.core.domain.FileRecord;
import de.bsommerfeld.sqlcontents.core.error.DirectoryExistsException;
import de.bsommerfeld.sqlcontents.core.error.DirectoryNotEmptyException;
import de.bsommerfeld.sqlcontents.core.error.NoSuchDirectoryException;
import de.bsommerfeld.sqlcontents.core.error.RenameIntoDescendantException;
import de.bsommerfeld.sqlcontents.core.error.RenameRootException;
import de.bsommerfeld.sqlcontents.core.path.ApiPaths;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.List;

/**
 * The {@code directories} table. All public methods take API paths and throw
 * domain exceptions carrying those API paths.
 *
 * <h3>Rename</h3>
 * A directory rename rewrites the directory row and then all descendant rows
 * in one statement. The self reference is deferred for the rest of the
 * transaction, since the children point at a parent name that no longer
 * exists between the two statements. Files follow their directory through
 * {@code ON UPDATE CASCADE}; no file row is written from here.
 */
@Singleton
public class DirectoryStore {

    private static final Logger LOG = LoggerFactory.getLogger(DirectoryStore.class);

    private final FileStore fileStore;

    @Inject
    public DirectoryStore(FileStore fileStore) {
        this.fileStore = fileStore;
    }

    /**
     * @throws DirectoryExistsException if the directory already exists
     * @throws NoSuchDirectoryException if its parent does not exist
     */
    public void createDirectory(Connection conn, String userId, String apiPath) throws SQLException {
        try {
            insertDirectory(conn, userId, ApiPaths.fromApiDirname(apiPath));
        } catch (SQLException e) {
            if (SqlErrors.isUniqueViolation(e))
                throw new DirectoryExistsException(apiPath);
            if (SqlErrors.isForeignKeyViolation(e))
                throw new NoSuchDirectoryException(parentApiPath(apiPath));
            throw e;
        }
        LOG.debug("Created directory {} for {}", apiPath, userId);
    }

    /**
     * Creates the directory unless it exists. Safe against a concurrent
     * creator: the losing insert is rolled back to a savepoint.
     *
     * @throws NoSuchDirectoryException if its parent does not exist
     */
    public void ensureDirectory(Connection conn, String userId, String apiPath) throws SQLException {
        String name = ApiPaths.fromApiDirname(apiPath);
        try {
            SqlErrors.ignoreUniqueViolation(conn, c -> insertDirectory(c, userId, name));
        } catch (SQLException e) {
            if (SqlErrors.isForeignKeyViolation(e))
                throw new NoSuchDirectoryException(parentApiPath(apiPath));
            throw e;
        }
    }

    public boolean dirExists(Connection conn, String userId, String apiPath) throws SQLException {
        return exists(conn, userId, ApiPaths.fromApiDirname(apiPath));
    }

    /**
     * Lists the direct children of a directory. Files and subdirectories are
     * fetched independently; neither carries content.
     *
     * @throws NoSuchDirectoryException if the directory does not exist
     */
    public DirectoryListing getDirectory(Connection conn, String userId, String apiPath) throws SQLException {
        String name = ApiPaths.fromApiDirname(apiPath);
        if (!exists(conn, userId, name))
            throw new NoSuchDirectoryException(apiPath);
        return listChildren(conn, userId, name);
    }

    /**
     * Lists the direct children of a canonical directory without checking
     * that it exists. A missing directory yields an empty listing.
     */
    public DirectoryListing listChildren(Connection conn, String userId, String canonicalDir) throws SQLException {
        List<FileRecord> files = fileStore.filesInDirectory(conn, userId, canonicalDir);
        List<String> subdirectories = subdirectories(conn, userId, canonicalDir);
        return new DirectoryListing(canonicalDir, files, subdirectories);
    }

    /** Canonical names of the direct subdirectories, ordered by name. */
    public List<String> subdirectories(Connection conn, String userId, String canonicalDir) throws SQLException {
        List<String> names = new ArrayList<>();
        try (PreparedStatement ps = conn.prepareStatement(SqlLoader.load("select-subdirectories"))) {
            ps.setString(1, userId);
            ps.setString(2, canonicalDir);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next())
                    names.add(rs.getString("name"));
            }
        }
        return names;
    }

    /**
     * Deletes an empty directory.
     *
     * @throws NoSuchDirectoryException   if the directory does not exist
     * @throws DirectoryNotEmptyException if it still holds files or
     *                                    subdirectories
     */
    public void deleteDirectory(Connection conn, String userId, String apiPath) throws SQLException {
        int deleted;
        try (PreparedStatement ps = conn.prepareStatement(SqlLoader.load("delete-directory"))) {
            ps.setString(1, userId);
            ps.setString(2, ApiPaths.fromApiDirname(apiPath));
            deleted = ps.executeUpdate();
        } catch (SQLException e) {
            if (SqlErrors.isForeignKeyViolation(e))
                throw new DirectoryNotEmptyException(apiPath);
            throw e;
        }
        if (deleted == 0)
            throw new NoSuchDirectoryException(apiPath);
        LOG.debug("Deleted directory {} for {}", apiPath, userId);
    }

    /**
     * Moves a directory and its whole subtree to {@code newApiPath}.
     *
     * @throws RenameRootException           if {@code oldApiPath} is the root
     * @throws NoSuchDirectoryException      if the source or the target's
     *                                       parent does not exist
     * @throws DirectoryExistsException      if the target exists
     * @throws RenameIntoDescendantException if the target lies inside the
     *                                       source
     */
    public void renameDirectory(Connection conn, String userId, String oldApiPath, String newApiPath)
            throws SQLException {
        String oldName = ApiPaths.fromApiDirname(oldApiPath);
        String newName = ApiPaths.fromApiDirname(newApiPath);

        if (ApiPaths.ROOT.equals(oldName))
            throw new RenameRootException();
        if (!exists(conn, userId, oldName))
            throw new NoSuchDirectoryException(oldApiPath);
        if (exists(conn, userId, newName))
            throw new DirectoryExistsException(newApiPath);
        if (ApiPaths.isWithin(newName, oldName))
            throw new RenameIntoDescendantException(newApiPath);

        String newParent = ApiPaths.parentDirectory(newName);
        if (!exists(conn, userId, newParent))
            throw new NoSuchDirectoryException(ApiPaths.toApiPath(newParent));

        try (Statement stmt = conn.createStatement()) {
            stmt.execute("PRAGMA defer_foreign_keys = ON");
        }

        try (PreparedStatement ps = conn.prepareStatement(SqlLoader.load("rename-directory"))) {
            ps.setString(1, newName);
            ps.setString(2, newParent);
            ps.setString(3, userId);
            ps.setString(4, oldName);
            ps.executeUpdate();
        }

        int descendants;
        try (PreparedStatement ps = conn.prepareStatement(SqlLoader.load("rename-descendant-directories"))) {
            ps.setString(1, newName);
            ps.setString(2, oldName);
            ps.setString(3, userId);
            descendants = ps.executeUpdate();
        }
        LOG.debug("Renamed directory {} -> {} for {} ({} descendants)", oldApiPath, newApiPath, userId,
                descendants);
    }

    private boolean exists(Connection conn, String userId, String canonicalName) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement(SqlLoader.load("count-directory"))) {
            ps.setString(1, userId);
            ps.setString(2, canonicalName);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() && rs.getInt(1) != 0;
            }
        }
    }

    private void insertDirectory(Connection conn, String userId, String name) throws SQLException {
        String parent = ApiPaths.parentDirectory(name);
        try (PreparedStatement ps = conn.prepareStatement(SqlLoader.load("insert-directory"))) {
            ps.setString(1, userId);
            ps.setString(2, name);
            ps.setString(3, parent == null ? null : userId);
            ps.setString(4, parent);
            ps.executeUpdate();
        }
    }

    private static String parentApiPath(String apiPath) {
        String parent = ApiPaths.parentDirectory(ApiPaths.fromApiDirname(apiPath));
        return parent == null ? "" : ApiPaths.toApiPath(parent);
    }
}
