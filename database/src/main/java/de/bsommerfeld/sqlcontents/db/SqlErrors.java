package de.bsommerfeld.sqlcontents.db;

import org.sqlite.SQLiteErrorCode;
import org.sqlite.SQLiteException;

import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Savepoint;

/**
 * Classifies constraint violations reported by the SQLite driver.
 *
 * <p>
 * The extended result code is checked first. The message check covers
 * exceptions that were re-wrapped on their way up and lost their
 * {@link SQLiteException} type, and drivers that report only the primary
 * {@code SQLITE_CONSTRAINT} code.
 */
final class SqlErrors {

    private SqlErrors() {
    }

    /** Unique or primary key violation. */
    static boolean isUniqueViolation(SQLException e) {
        SQLiteErrorCode code = resultCode(e);
        return code == SQLiteErrorCode.SQLITE_CONSTRAINT_UNIQUE
                || code == SQLiteErrorCode.SQLITE_CONSTRAINT_PRIMARYKEY
                || messageContains(e, "UNIQUE constraint failed");
    }

    static boolean isForeignKeyViolation(SQLException e) {
        return resultCode(e) == SQLiteErrorCode.SQLITE_CONSTRAINT_FOREIGNKEY
                || messageContains(e, "FOREIGN KEY constraint failed");
    }

    static boolean isCheckViolation(SQLException e) {
        return resultCode(e) == SQLiteErrorCode.SQLITE_CONSTRAINT_CHECK
                || messageContains(e, "CHECK constraint failed");
    }

    /**
     * Runs {@code action} under a savepoint and swallows a unique violation
     * by rolling back to it. Every other failure propagates. Returns whether
     * the action took effect.
     *
     * <p>
     * Used instead of {@code INSERT OR IGNORE}, which would also ignore
     * {@code CHECK} and {@code NOT NULL} failures.
     */
    static boolean ignoreUniqueViolation(Connection conn, SqlDatabase.SqlAction action) throws SQLException {
        Savepoint savepoint = conn.setSavepoint();
        try {
            action.run(conn);
        } catch (SQLException e) {
            if (!isUniqueViolation(e)) {
                discardSavepoint(conn, savepoint, e);
                throw e;
            }
            conn.rollback(savepoint);
            conn.releaseSavepoint(savepoint);
            return false;
        }
        conn.releaseSavepoint(savepoint);
        return true;
    }

    /**
     * Rolls back to {@code savepoint} and releases it before {@code failure}
     * is rethrown, so the caller's transaction is left without an open
     * savepoint. A failure of either call is attached to {@code failure}.
     */
    static void discardSavepoint(Connection conn, Savepoint savepoint, Exception failure) {
        try {
            conn.rollback(savepoint);
            conn.releaseSavepoint(savepoint);
        } catch (SQLException e) {
            failure.addSuppressed(e);
        }
    }

    private static SQLiteErrorCode resultCode(SQLException e) {
        for (Throwable t = e; t != null; t = t.getCause()) {
            if (t instanceof SQLiteException sqliteException) {
                return sqliteException.getResultCode();
            }
        }
        return null;
    }

    private static boolean messageContains(SQLException e, String fragment) {
        for (Throwable t = e; t != null; t = t.getCause()) {
            if (t.getMessage() != null && t.getMessage().contains(fragment)) {
                return true;
            }
        }
        return false;
    }
}
