package de.bsommerfeld.sqlcontents.db;

import com.google.inject.Singleton;
import de.bsommerfeld.sqlcontents.core.path.ApiPaths;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Rows of the {@code users} table and whole-user removal.
 *
 * <p>
 * Like every store, this class never opens a transaction itself; callers
 * pass the connection of the transaction they are running in.
 */
@Singleton
public class UserStore {

    private static final Logger LOG = LoggerFactory.getLogger(UserStore.class);

    /** Inserts the user unless it already exists. */
    public void ensureUser(Connection conn, String userId) throws SQLException {
        boolean created = SqlErrors.ignoreUniqueViolation(conn, c -> {
            try (PreparedStatement ps = c.prepareStatement(SqlLoader.load("insert-user"))) {
                ps.setString(1, userId);
                ps.executeUpdate();
            }
        });
        if (created) {
            LOG.info("Created user {}", userId);
        }
    }

    public List<String> listUsers(Connection conn) throws SQLException {
        List<String> users = new ArrayList<>();
        try (PreparedStatement ps = conn.prepareStatement(SqlLoader.load("select-users"));
                ResultSet rs = ps.executeQuery()) {
            while (rs.next())
                users.add(rs.getString("id"));
        }
        return users;
    }

    /**
     * Deletes every row owned by {@code userId}: files, directories
     * (deepest first, so no parent goes before its children), checkpoints
     * and finally the user itself.
     */
    public void purgeUser(Connection conn, String userId) throws SQLException {
        int files = executeForUser(conn, "delete-files-for-user", userId);

        List<String> directories = new ArrayList<>();
        try (PreparedStatement ps = conn.prepareStatement(SqlLoader.load("select-directories-for-user"))) {
            ps.setString(1, userId);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next())
                    directories.add(rs.getString("name"));
            }
        }
        directories.sort(Comparator.<String>comparingInt(ApiPaths::depth).reversed());
        try (PreparedStatement ps = conn.prepareStatement(SqlLoader.load("delete-directory"))) {
            for (String name : directories) {
                ps.setString(1, userId);
                ps.setString(2, name);
                ps.executeUpdate();
            }
        }

        int checkpoints = executeForUser(conn, "delete-checkpoints-for-user", userId);
        executeForUser(conn, "delete-user", userId);

        LOG.info("Purged user {}: {} files, {} directories, {} checkpoints",
                userId, files, directories.size(), checkpoints);
    }

    private int executeForUser(Connection conn, String statement, String userId) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement(SqlLoader.load(statement))) {
            ps.setString(1, userId);
            return ps.executeUpdate();
        }
    }
}
