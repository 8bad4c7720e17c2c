package de.bsommerfeld.sqlcontents.db;

import com.google.inject.Inject;
import com.google.inject.Singleton;
import de.bsommerfeld.sqlcontents.core.crypto.CryptoFactory;
import de.bsommerfeld.sqlcontents.core.domain.ExportedContent;
import de.bsommerfeld.sqlcontents.core.error.CorruptedFileException;
import de.bsommerfeld.sqlcontents.core.path.ApiPaths;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;

/**
 * Bulk read of decrypted notebooks across all users, e.g. for indexing or
 * analytics. Rows are delivered in ascending timestamp order, optionally
 * restricted to {@code [min, max)}. A row that cannot be decrypted is skipped
 * with a warning instead of aborting the export.
 */
@Singleton
public class ContentExporter {

    private static final Logger LOG = LoggerFactory.getLogger(ContentExporter.class);

    private final SqlDatabase database;

    @Inject
    public ContentExporter(SqlDatabase database) {
        this.database = database;
    }

    /**
     * Streams current notebook files ({@code *.ipynb}).
     *
     * @param min inclusive lower bound on {@code created_at}, {@code null}
     *            for none
     * @param max exclusive upper bound, {@code null} for none
     */
    public void exportFiles(CryptoFactory cryptoFactory, Instant min, Instant max, Consumer<ExportedContent> sink) {
        export("select-notebook-files", "files", cryptoFactory, min, max, sink);
    }

    /** Streams checkpoints; same contract as {@link #exportFiles}. */
    public void exportCheckpoints(CryptoFactory cryptoFactory, Instant min, Instant max,
            Consumer<ExportedContent> sink) {
        export("select-notebook-checkpoints", "remote_checkpoints", cryptoFactory, min, max, sink);
    }

    public List<ExportedContent> exportFiles(CryptoFactory cryptoFactory, Instant min, Instant max) {
        List<ExportedContent> result = new ArrayList<>();
        exportFiles(cryptoFactory, min, max, result::add);
        return result;
    }

    public List<ExportedContent> exportCheckpoints(CryptoFactory cryptoFactory, Instant min, Instant max) {
        List<ExportedContent> result = new ArrayList<>();
        exportCheckpoints(cryptoFactory, min, max, result::add);
        return result;
    }

    private void export(String statement, String table, CryptoFactory cryptoFactory, Instant min, Instant max,
            Consumer<ExportedContent> sink) {
        long lower = min == null ? Long.MIN_VALUE : min.toEpochMilli();
        long upper = max == null ? Long.MAX_VALUE : max.toEpochMilli();
        boolean files = "files".equals(table);

        int[] skipped = { 0 };
        database.inReadTransaction(conn -> {
            try (PreparedStatement ps = conn.prepareStatement(SqlLoader.load(statement))) {
                ps.setLong(1, lower);
                ps.setLong(2, upper);
                try (ResultSet rs = ps.executeQuery()) {
                    while (rs.next()) {
                        ExportedContent exported = decryptRow(rs, table, files, cryptoFactory);
                        if (exported == null) {
                            skipped[0]++;
                            continue;
                        }
                        sink.accept(exported);
                    }
                }
            }
            return null;
        });
        if (skipped[0] > 0) {
            LOG.warn("Skipped {} corrupted rows in table {}", skipped[0], table);
        }
    }

    private ExportedContent decryptRow(ResultSet rs, String table, boolean files, CryptoFactory cryptoFactory)
            throws SQLException {
        long id = rs.getLong("id");
        String userId = rs.getString("user_id");
        String path = files
                ? rs.getString("parent_name") + rs.getString("name")
                : rs.getString("path");
        long timestamp = rs.getLong(files ? "created_at" : "last_modified");
        try {
            byte[] content = cryptoFactory.forUser(userId).decrypt(rs.getBytes("content"));
            return new ExportedContent(id, userId, ApiPaths.toApiPath(path), Instant.ofEpochMilli(timestamp),
                    content);
        } catch (CorruptedFileException e) {
            LOG.warn("Corrupted file with id {} in table {}.", id, table);
            return null;
        }
    }
}
