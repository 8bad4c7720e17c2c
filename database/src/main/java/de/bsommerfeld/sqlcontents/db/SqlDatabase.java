package de.bsommerfeld.sqlcontents.db;

import com.google.inject.Inject;
import com.google.inject.Singleton;
import de.bsommerfeld.sqlcontents.core.config.DatabaseConfig;
import de.bsommerfeld.sqlcontents.core.error.StorageException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.sqlite.SQLiteConfig;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;

/**
 * Connection and transaction handling for the SQLite store.
 *
 * <p>
 * The schema is applied from {@code schema.sql} on every startup. Every DDL
 * statement uses {@code IF NOT EXISTS} so it is safe to re-run.
 *
 * <h3>Connection strategy</h3>
 * A new {@link Connection} is opened per operation and closed immediately
 * after. SQLite serializes writes at the file level anyway, so pooling
 * provides no benefit. Every connection enforces foreign keys and waits up to
 * the configured busy timeout for a competing writer. The database runs in
 * WAL journal mode, so readers see the last committed state while a writer
 * holds the lock.
 *
 * <h3>Transaction boundaries</h3>
 * {@link #inTransaction} runs one unit of work that may write and opens it
 * with {@code BEGIN IMMEDIATE}. {@link #inReadTransaction} opens a deferred
 * transaction that never asks for the write lock. Both commit on success and
 * roll back on any exception. Domain exceptions propagate unchanged; a
 * {@link SQLException} is rethrown as {@link StorageException}.
 *
 * <h3>Row locks</h3>
 * SQLite has no {@code SELECT ... FOR UPDATE}. The immediate transaction
 * takes the database write lock at {@code BEGIN}, so any row read inside it
 * stays unchanged by other writers until commit.
 *
 * @see SqlLoader
 */
@Singleton
public class SqlDatabase {

    private static final Logger LOG = LoggerFactory.getLogger(SqlDatabase.class);
    private static final String URL_PREFIX = "jdbc:sqlite:";

    private final String dbUrl;
    private final int busyTimeoutMillis;

    @Inject
    public SqlDatabase(DatabaseConfig config) {
        this.dbUrl = config.getUrl();
        this.busyTimeoutMillis = config.getBusyTimeoutMillis();
        ensureParentDirectory();
        initialize();
    }

    Connection getConnection() throws SQLException {
        return openConnection(SQLiteConfig.TransactionMode.IMMEDIATE);
    }

    Connection getReadConnection() throws SQLException {
        return openConnection(SQLiteConfig.TransactionMode.DEFERRED);
    }

    private Connection openConnection(SQLiteConfig.TransactionMode transactionMode) throws SQLException {
        SQLiteConfig config = new SQLiteConfig();
        config.enforceForeignKeys(true);
        config.setBusyTimeout(busyTimeoutMillis);
        config.setTransactionMode(transactionMode);
        return DriverManager.getConnection(dbUrl, config.toProperties());
    }

    public String getUrl() {
        return dbUrl;
    }

    /**
     * Runs {@code work} in a single transaction on a fresh connection.
     *
     * @throws StorageException if the database fails outside of any domain
     *                          condition
     */
    public <T> T inTransaction(SqlWork<T> work) {
        try (Connection conn = getConnection()) {
            return runAndCommit(conn, work);
        } catch (SQLException e) {
            throw new StorageException("Database operation failed: " + e.getMessage(), e);
        }
    }

    /**
     * Runs {@code work} in a deferred transaction for queries. It does not
     * wait for a writer of another user and reads the last committed state.
     * Writing inside it would compete for the lock like any other writer.
     */
    public <T> T inReadTransaction(SqlWork<T> work) {
        try (Connection conn = getReadConnection()) {
            return runAndCommit(conn, work);
        } catch (SQLException e) {
            throw new StorageException("Database read failed: " + e.getMessage(), e);
        }
    }

    /** Variant of {@link #inTransaction(SqlWork)} without a result. */
    public void runInTransaction(SqlAction action) {
        inTransaction(conn -> {
            action.run(conn);
            return null;
        });
    }

    private static <T> T runAndCommit(Connection conn, SqlWork<T> work) throws SQLException {
        conn.setAutoCommit(false);
        try {
            T result = work.run(conn);
            conn.commit();
            return result;
        } catch (SQLException | RuntimeException e) {
            try {
                conn.rollback();
            } catch (SQLException rollbackFailure) {
                e.addSuppressed(rollbackFailure);
            }
            throw e;
        }
    }

    private void ensureParentDirectory() {
        if (!dbUrl.startsWith(URL_PREFIX)) {
            return;
        }
        String location = dbUrl.substring(URL_PREFIX.length());
        if (location.isEmpty() || location.startsWith(":") || location.startsWith("file:")) {
            return;
        }
        int query = location.indexOf('?');
        Path dbFile = Paths.get(query < 0 ? location : location.substring(0, query)).toAbsolutePath();
        Path parent = dbFile.getParent();
        try {
            if (parent != null && !Files.exists(parent))
                Files.createDirectories(parent);
        } catch (IOException e) {
            throw new StorageException("Failed to create database directory " + parent, e);
        }
    }

    private void initialize() {
        LOG.info("Initializing Database at {}", dbUrl);
        try (Connection conn = getConnection()) {
            enableWriteAheadLog(conn);
            applySchema(conn);
        } catch (SQLException e) {
            throw new StorageException("Database initialization failed", e);
        }
    }

    /**
     * Switches the file to WAL mode. The mode is stored in the database file,
     * so later connections inherit it. In-memory databases stay in
     * {@code memory} mode.
     */
    private void enableWriteAheadLog(Connection conn) throws SQLException {
        try (Statement stmt = conn.createStatement();
                ResultSet rs = stmt.executeQuery("PRAGMA journal_mode = WAL")) {
            String mode = rs.next() ? rs.getString(1) : null;
            LOG.debug("Journal mode is {}", mode);
        }
    }

    /**
     * Applies the full DDL from {@code schema.sql}. Splits on semicolons at
     * line ends and executes each statement individually inside one
     * transaction.
     */
    private void applySchema(Connection conn) throws SQLException {
        String schemaSql;
        try (InputStream schemaStream = getClass().getClassLoader().getResourceAsStream("schema.sql")) {
            if (schemaStream == null) {
                throw new SQLException("schema.sql not found in classpath");
            }
            schemaSql = new String(schemaStream.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new SQLException("Failed to read schema.sql", e);
        }

        conn.setAutoCommit(false);
        try (Statement stmt = conn.createStatement()) {
            for (String sql : schemaSql.split(";\\s*(\\r?\\n|$)")) {
                if (isBlankOrComment(sql))
                    continue;
                stmt.execute(sql.trim());
            }
            conn.commit();
            LOG.info("Database schema applied.");
        } catch (SQLException e) {
            conn.rollback();
            throw new SQLException("Schema application failed", e);
        }
    }

    private static boolean isBlankOrComment(String sql) {
        for (String line : sql.split("\\r?\\n")) {
            String trimmed = line.trim();
            if (!trimmed.isEmpty() && !trimmed.startsWith("--"))
                return false;
        }
        return true;
    }

    /** Unit of work that produces a result. */
    @FunctionalInterface
    public interface SqlWork<T> {
        T run(Connection conn) throws SQLException;
    }

    /** Unit of work without a result. */
    @FunctionalInterface
    public interface SqlAction {
        void run(Connection conn) throws SQLException;
    }
}
