package de.bsommerfeld.sqlcontents.manager;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.base.Preconditions;
import com.google.inject.Inject;
import com.google.inject.Singleton;
import de.bsommerfeld.sqlcontents.core.config.StorageConfig;
import de.bsommerfeld.sqlcontents.core.crypto.Crypto;
import de.bsommerfeld.sqlcontents.core.crypto.CryptoFactory;
import de.bsommerfeld.sqlcontents.core.domain.CheckpointRecord;
import de.bsommerfeld.sqlcontents.core.domain.DirectoryListing;
import de.bsommerfeld.sqlcontents.core.domain.FileRecord;
import de.bsommerfeld.sqlcontents.core.error.CorruptedFileException;
import de.bsommerfeld.sqlcontents.core.error.DirectoryExistsException;
import de.bsommerfeld.sqlcontents.core.error.DirectoryNotEmptyException;
import de.bsommerfeld.sqlcontents.core.error.FileExistsException;
import de.bsommerfeld.sqlcontents.core.error.NoSuchDirectoryException;
import de.bsommerfeld.sqlcontents.core.error.NoSuchFileException;
import de.bsommerfeld.sqlcontents.core.event.ContentsEventBus;
import de.bsommerfeld.sqlcontents.core.event.ContentsEvents.CheckpointCreatedEvent;
import de.bsommerfeld.sqlcontents.core.event.ContentsEvents.CheckpointRestoredEvent;
import de.bsommerfeld.sqlcontents.core.event.ContentsEvents.DirectoryCreatedEvent;
import de.bsommerfeld.sqlcontents.core.event.ContentsEvents.FileSavedEvent;
import de.bsommerfeld.sqlcontents.core.event.ContentsEvents.PathDeletedEvent;
import de.bsommerfeld.sqlcontents.core.event.ContentsEvents.PathRenamedEvent;
import de.bsommerfeld.sqlcontents.core.event.ContentsEvents.UserPurgedEvent;
import de.bsommerfeld.sqlcontents.core.path.ApiPaths;
import de.bsommerfeld.sqlcontents.db.CheckpointStore;
import de.bsommerfeld.sqlcontents.db.DirectoryStore;
import de.bsommerfeld.sqlcontents.db.FileStore;
import de.bsommerfeld.sqlcontents.db.SqlDatabase;
import de.bsommerfeld.sqlcontents.db.UserStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.StandardCharsets;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Base64;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Contents API for a single user on top of the SQLite stores.
 *
 * <p>
 * Every public operation normalizes its path arguments first (rejecting
 * {@code ..} above the root with {@code PathOutsideRootException}) and then
 * runs as exactly one transaction. Events are posted on the
 * {@link ContentsEventBus} only after that transaction has committed.
 *
 * <h3>Content encoding</h3>
 * Notebooks are stored as their UTF-8 JSON serialization. Files are stored
 * as raw bytes: text content is UTF-8 encoded, base64 content is decoded
 * before it is stored. Reading a file without a requested format tries
 * UTF-8 text first and falls back to base64.
 */
@Singleton
public class ContentsManager {

    private static final Logger LOG = LoggerFactory.getLogger(ContentsManager.class);

    private final SqlDatabase database;
    private final UserStore userStore;
    private final DirectoryStore directoryStore;
    private final FileStore fileStore;
    private final CheckpointStore checkpointStore;
    private final ContentsEventBus eventBus;
    private final ObjectMapper objectMapper;

    private final String userId;
    private final long maxFileSizeBytes;
    private final Crypto crypto;

    @Inject
    public ContentsManager(SqlDatabase database, UserStore userStore, DirectoryStore directoryStore,
            FileStore fileStore, CheckpointStore checkpointStore, CryptoFactory cryptoFactory,
            StorageConfig storageConfig, ContentsEventBus eventBus, ObjectMapper objectMapper) {
        this.database = database;
        this.userStore = userStore;
        this.directoryStore = directoryStore;
        this.fileStore = fileStore;
        this.checkpointStore = checkpointStore;
        this.eventBus = eventBus;
        this.objectMapper = objectMapper;

        this.userId = Preconditions.checkNotNull(storageConfig.getUserId(), "storage.user-id must be set");
        this.maxFileSizeBytes = storageConfig.getMaxFileSizeBytes();
        this.crypto = cryptoFactory.forUser(userId);

        if (storageConfig.isCreateUserOnStartup()) {
            ensureUser();
        }
        LOG.info("Contents manager ready for user '{}'", userId);
    }

    public String getUserId() {
        return userId;
    }

    /** Creates the user row and the root directory if they are missing. */
    public void ensureUser() {
        database.runInTransaction(conn -> {
            userStore.ensureUser(conn, userId);
            directoryStore.ensureDirectory(conn, userId, "");
        });
    }

    // =====================================================================
    // Queries
    // =====================================================================

    public boolean dirExists(String path) {
        String apiPath = ApiPaths.normalizeApiPath(path);
        return database.inReadTransaction(conn -> directoryStore.dirExists(conn, userId, apiPath));
    }

    public boolean fileExists(String path) {
        String apiPath = ApiPaths.normalizeApiPath(path);
        return database.inReadTransaction(conn -> fileStore.fileExists(conn, userId, apiPath));
    }

    /**
     * Reads a file, notebook or directory.
     *
     * @param type   expected type, or {@code null} to detect it
     * @param format requested encoding for files, or {@code null} to detect it
     * @throws NoSuchFileException      if nothing exists at the path
     * @throws NoSuchDirectoryException if a directory was requested and none
     *                                  exists
     */
    public ContentModel get(String path, boolean withContent, ContentModel.Type type, ContentModel.Format format) {
        String apiPath = ApiPaths.normalizeApiPath(path);
        return database.inReadTransaction(conn -> read(conn, apiPath, withContent, type, format));
    }

    public ContentModel get(String path) {
        return get(path, true, null, null);
    }

    // =====================================================================
    // Mutations
    // =====================================================================

    /**
     * Writes a model to {@code path}. Files and notebooks are created or
     * overwritten; directories are created if missing. A path holds either a
     * file or a directory, never both.
     *
     * @return the stored model without content
     * @throws FileExistsException      if a directory is saved over a file
     * @throws DirectoryExistsException if a file is saved over a directory
     */
    public ContentModel save(ContentModel model, String path) {
        Preconditions.checkNotNull(model, "model");
        Preconditions.checkArgument(model.type() != null, "No model type provided");
        String apiPath = ApiPaths.normalizeApiPath(path);

        ContentModel saved = database.inTransaction(conn -> {
            if (model.type() == ContentModel.Type.DIRECTORY) {
                if (!apiPath.isEmpty() && fileStore.fileExists(conn, userId, apiPath))
                    throw new FileExistsException(apiPath);
                directoryStore.ensureDirectory(conn, userId, apiPath);
            } else {
                Preconditions.checkArgument(model.content() != null, "No file content provided");
                if (directoryStore.dirExists(conn, userId, apiPath))
                    throw new DirectoryExistsException(apiPath);
                fileStore.saveFile(conn, userId, apiPath, encode(model), crypto, maxFileSizeBytes);
            }
            return read(conn, apiPath, false, model.type(), null);
        });

        if (model.type() == ContentModel.Type.DIRECTORY) {
            eventBus.post(new DirectoryCreatedEvent(userId, apiPath));
        } else {
            eventBus.post(new FileSavedEvent(userId, apiPath));
        }
        return saved;
    }

    /**
     * Renames a file or directory and moves its checkpoints along in the same
     * transaction.
     *
     * @throws NoSuchFileException      if nothing exists at {@code oldPath}
     * @throws FileExistsException      if a file occupies {@code newPath}
     * @throws DirectoryExistsException if a directory occupies {@code newPath}
     */
    public void rename(String oldPath, String newPath) {
        String oldApiPath = ApiPaths.normalizeApiPath(oldPath);
        String newApiPath = ApiPaths.normalizeApiPath(newPath);

        database.runInTransaction(conn -> {
            if (fileStore.fileExists(conn, userId, oldApiPath)) {
                if (directoryStore.dirExists(conn, userId, newApiPath))
                    throw new DirectoryExistsException(newApiPath);
                fileStore.renameFile(conn, userId, oldApiPath, newApiPath);
                checkpointStore.moveFile(conn, userId, oldApiPath, newApiPath);
            } else if (directoryStore.dirExists(conn, userId, oldApiPath)) {
                if (!oldApiPath.isEmpty() && fileStore.fileExists(conn, userId, newApiPath))
                    throw new FileExistsException(newApiPath);
                directoryStore.renameDirectory(conn, userId, oldApiPath, newApiPath);
                checkpointStore.moveAll(conn, userId, oldApiPath, newApiPath);
            } else {
                throw new NoSuchFileException(oldApiPath);
            }
        });

        LOG.info("Renamed {} -> {} for {}", oldApiPath, newApiPath, userId);
        eventBus.post(new PathRenamedEvent(userId, oldApiPath, newApiPath));
    }

    /**
     * Deletes a file together with its checkpoints, or an empty directory.
     *
     * @throws IllegalArgumentException for the root directory
     * @throws NoSuchFileException      if nothing exists at the path
     * @throws DirectoryNotEmptyException if the directory still has children
     */
    public void delete(String path) {
        String apiPath = ApiPaths.normalizeApiPath(path);
        Preconditions.checkArgument(!apiPath.isEmpty(), "Can't delete the root directory");

        database.runInTransaction(conn -> {
            if (fileStore.fileExists(conn, userId, apiPath)) {
                fileStore.deleteFile(conn, userId, apiPath);
                checkpointStore.deleteAll(conn, userId, apiPath);
            } else if (directoryStore.dirExists(conn, userId, apiPath)) {
                directoryStore.deleteDirectory(conn, userId, apiPath);
            } else {
                throw new NoSuchFileException(apiPath);
            }
        });

        LOG.info("Deleted {} for {}", apiPath, userId);
        eventBus.post(new PathDeletedEvent(userId, apiPath));
    }

    // =====================================================================
    // Checkpoints
    // =====================================================================

    /** Snapshots the current content of a file. */
    public CheckpointInfo createCheckpoint(String path) {
        String apiPath = ApiPaths.normalizeApiPath(path);
        CheckpointRecord checkpoint = database.inTransaction(conn -> {
            FileRecord file = fileStore.getFile(conn, userId, apiPath, true, crypto);
            return checkpointStore.save(conn, userId, apiPath, file.content(), crypto, maxFileSizeBytes);
        });
        eventBus.post(new CheckpointCreatedEvent(userId, apiPath, checkpoint.id()));
        return CheckpointInfo.of(checkpoint);
    }

    /**
     * Walks the whole tree and checkpoints every notebook in one transaction.
     *
     * @return the new checkpoints keyed by notebook path, in walk order
     */
    public Map<String, CheckpointInfo> checkpointAllNotebooks() {
        Map<String, CheckpointRecord> created = database.inTransaction(conn -> {
            Map<String, CheckpointRecord> checkpoints = new LinkedHashMap<>();
            Deque<String> pending = new ArrayDeque<>();
            pending.push("");
            while (!pending.isEmpty()) {
                DirectoryListing listing = directoryStore.getDirectory(conn, userId, pending.pop());
                for (FileRecord file : listing.files()) {
                    if (ContentModel.Type.forFileName(file.name()) != ContentModel.Type.NOTEBOOK)
                        continue;
                    String notebookPath = ApiPaths.toApiPath(file.path());
                    FileRecord notebook = fileStore.getFile(conn, userId, notebookPath, true, crypto);
                    checkpoints.put(notebookPath, checkpointStore.save(conn, userId, notebookPath,
                            notebook.content(), crypto, maxFileSizeBytes));
                }
                for (String subdirectory : listing.subdirectories()) {
                    pending.push(ApiPaths.toApiPath(subdirectory));
                }
            }
            return checkpoints;
        });

        Map<String, CheckpointInfo> result = new LinkedHashMap<>();
        created.forEach((path, checkpoint) -> {
            eventBus.post(new CheckpointCreatedEvent(userId, path, checkpoint.id()));
            result.put(path, CheckpointInfo.of(checkpoint));
        });
        LOG.info("Checkpointed {} notebooks for {}", result.size(), userId);
        return result;
    }

    /** Checkpoints of a path, newest first. */
    public List<CheckpointInfo> listCheckpoints(String path) {
        String apiPath = ApiPaths.normalizeApiPath(path);
        List<CheckpointRecord> records = database.inReadTransaction(
                conn -> checkpointStore.list(conn, userId, apiPath));
        List<CheckpointInfo> result = new ArrayList<>(records.size());
        for (CheckpointRecord record : records) {
            result.add(CheckpointInfo.of(record));
        }
        return result;
    }

    /** Overwrites the file at {@code path} with the checkpoint's content. */
    public void restoreCheckpoint(long checkpointId, String path) {
        String apiPath = ApiPaths.normalizeApiPath(path);
        database.runInTransaction(conn -> {
            CheckpointRecord checkpoint = checkpointStore.get(conn, userId, apiPath, checkpointId, crypto);
            fileStore.saveFile(conn, userId, apiPath, checkpoint.content(), crypto, maxFileSizeBytes);
        });
        LOG.info("Restored checkpoint {} of {} for {}", checkpointId, apiPath, userId);
        eventBus.post(new CheckpointRestoredEvent(userId, apiPath, checkpointId));
    }

    public void deleteCheckpoint(long checkpointId, String path) {
        String apiPath = ApiPaths.normalizeApiPath(path);
        database.runInTransaction(conn -> checkpointStore.deleteOne(conn, userId, apiPath, checkpointId));
    }

    // =====================================================================
    // Purge
    // =====================================================================

    /**
     * Removes every row of this manager's user. Call {@link #ensureUser()}
     * before using the manager again.
     */
    public void purgeUser() {
        purgeUser(userId);
    }

    /** Removes every row of {@code purgedUserId}; other users are untouched. */
    public void purgeUser(String purgedUserId) {
        database.runInTransaction(conn -> userStore.purgeUser(conn, purgedUserId));
        LOG.info("Purged all contents of user '{}'", purgedUserId);
        eventBus.post(new UserPurgedEvent(purgedUserId));
    }

    // =====================================================================
    // Model conversion
    // =====================================================================

    private ContentModel read(Connection conn, String apiPath, boolean withContent, ContentModel.Type type,
            ContentModel.Format format) throws SQLException {
        if (type == ContentModel.Type.DIRECTORY
                || (type == null && directoryStore.dirExists(conn, userId, apiPath))) {
            return readDirectory(conn, apiPath, withContent);
        }
        FileRecord file = fileStore.getFile(conn, userId, apiPath, withContent, crypto);
        ContentModel.Type fileType = type != null ? type : ContentModel.Type.forFileName(file.name());
        if (fileType == ContentModel.Type.NOTEBOOK) {
            return notebookModel(apiPath, file, format);
        }
        return fileModel(apiPath, file, format);
    }

    private ContentModel readDirectory(Connection conn, String apiPath, boolean withContent) throws SQLException {
        if (!withContent) {
            if (!directoryStore.dirExists(conn, userId, apiPath))
                throw new NoSuchDirectoryException(apiPath);
            return ContentModel.directory(apiPath);
        }

        DirectoryListing listing = directoryStore.getDirectory(conn, userId, apiPath);
        List<ContentModel> children = new ArrayList<>();
        for (String subdirectory : listing.subdirectories()) {
            children.add(ContentModel.directory(ApiPaths.toApiPath(subdirectory)));
        }
        for (FileRecord file : listing.files()) {
            String childPath = ApiPaths.toApiPath(file.path());
            children.add(new ContentModel(file.name(), childPath, ContentModel.Type.forFileName(file.name()),
                    null, null, file.createdAt(), null));
        }
        return ContentModel.directory(apiPath, children);
    }

    private ContentModel notebookModel(String apiPath, FileRecord file, ContentModel.Format format) {
        Preconditions.checkArgument(format == null || format == ContentModel.Format.JSON,
                "Notebooks can only be read as json, not %s", format);
        if (!file.hasContent()) {
            return withTimestamp(new ContentModel(file.name(), apiPath, ContentModel.Type.NOTEBOOK, null, null,
                    null, null), file);
        }
        JsonNode notebook;
        try {
            notebook = objectMapper.readTree(file.content());
        } catch (IOException e) {
            throw new CorruptedFileException("Notebook " + apiPath + " is not valid JSON", e);
        }
        return withTimestamp(ContentModel.notebook(apiPath, notebook), file);
    }

    private ContentModel fileModel(String apiPath, FileRecord file, ContentModel.Format format) {
        Preconditions.checkArgument(format != ContentModel.Format.JSON, "Files can't be read as json");
        if (!file.hasContent()) {
            return withTimestamp(new ContentModel(file.name(), apiPath, ContentModel.Type.FILE, null, null,
                    null, null), file);
        }
        if (format != ContentModel.Format.BASE64) {
            try {
                String text = StandardCharsets.UTF_8.newDecoder()
                        .decode(ByteBuffer.wrap(file.content()))
                        .toString();
                return withTimestamp(ContentModel.textFile(apiPath, text), file);
            } catch (CharacterCodingException e) {
                if (format == ContentModel.Format.TEXT)
                    throw new IllegalArgumentException(apiPath + " is not UTF-8 encoded", e);
                LOG.debug("{} is not UTF-8 text, reading as base64", apiPath);
            }
        }
        String base64 = Base64.getEncoder().encodeToString(file.content());
        return withTimestamp(ContentModel.base64File(apiPath, base64), file);
    }

    private static ContentModel withTimestamp(ContentModel model, FileRecord file) {
        return new ContentModel(model.name(), model.path(), model.type(), model.format(), model.mimetype(),
                file.createdAt(), model.content());
    }

    private byte[] encode(ContentModel model) {
        if (model.type() == ContentModel.Type.NOTEBOOK) {
            try {
                return objectMapper.writeValueAsBytes(model.content());
            } catch (JsonProcessingException e) {
                throw new IllegalArgumentException("Notebook content can't be serialized as JSON", e);
            }
        }
        Preconditions.checkArgument(model.content() instanceof String, "File content must be a string");
        String content = (String) model.content();
        if (model.format() == ContentModel.Format.BASE64) {
            return Base64.getDecoder().decode(content);
        }
        Preconditions.checkArgument(model.format() == ContentModel.Format.TEXT,
                "File format must be text or base64, not %s", model.format());
        return content.getBytes(StandardCharsets.UTF_8);
    }
}
