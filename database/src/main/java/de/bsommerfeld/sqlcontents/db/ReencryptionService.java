package de.bsommerfeld.sqlcontents.db;

import com.google.inject.Inject;
import com.google.inject.Singleton;
import de.bsommerfeld.sqlcontents.core.crypto.Crypto;
import de.bsommerfeld.sqlcontents.core.crypto.CryptoFactory;
import de.bsommerfeld.sqlcontents.core.crypto.FallbackCrypto;
import de.bsommerfeld.sqlcontents.core.crypto.NoEncryption;
import de.bsommerfeld.sqlcontents.core.event.ContentsEventBus;
import de.bsommerfeld.sqlcontents.core.event.ContentsEvents;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;

/**
 * Migrates stored content from one key set to another while the store
 * stays online.
 *
 * <p>
 * Each user is migrated in one transaction: all files first, then all
 * checkpoints. Every row is read inside the immediate transaction, decrypted
 * with the new key falling back to the old one, and written back under the
 * new key. Rows that already carry the new key decrypt on the first attempt,
 * so re-running a migration converges instead of failing.
 *
 * <p>
 * Correctness of the single transaction depends on checkpoints always being
 * written from application-supplied content rather than copied inside the
 * database. A checkpoint created concurrently from a file this run has not
 * yet seen would otherwise keep the old key.
 *
 * <p>
 * Rolling out a new key therefore works in three steps: configure
 * {@code [new, old]} as passwords so readers accept both, run
 * {@link #reencryptAllUsers}, then drop the old password.
 */
@Singleton
public class ReencryptionService {

    private static final Logger LOG = LoggerFactory.getLogger(ReencryptionService.class);

    private final SqlDatabase database;
    private final UserStore userStore;
    private final FileStore fileStore;
    private final CheckpointStore checkpointStore;
    private final ContentsEventBus eventBus;

    @Inject
    public ReencryptionService(SqlDatabase database, UserStore userStore, FileStore fileStore,
            CheckpointStore checkpointStore, ContentsEventBus eventBus) {
        this.database = database;
        this.userStore = userStore;
        this.fileStore = fileStore;
        this.checkpointStore = checkpointStore;
        this.eventBus = eventBus;
    }

    /**
     * Re-encrypts every row of every user.
     *
     * @throws IllegalArgumentException if {@code newFactory} yields
     *                                  {@link NoEncryption}; use
     *                                  {@link #unencryptAllUsers} instead
     */
    public List<Summary> reencryptAllUsers(CryptoFactory oldFactory, CryptoFactory newFactory) {
        List<String> users = database.inReadTransaction(userStore::listUsers);
        for (String userId : users) {
            if (newFactory.forUser(userId) instanceof NoEncryption) {
                throw new IllegalArgumentException(
                        "Cannot re-encrypt to NoEncryption for user " + userId + ", unencrypt instead");
            }
        }
        LOG.info("Re-encrypting content of {} users", users.size());
        List<Summary> summaries = new ArrayList<>(users.size());
        for (String userId : users) {
            summaries.add(reencryptUser(userId, oldFactory.forUser(userId), newFactory.forUser(userId)));
        }
        return summaries;
    }

    /**
     * Re-encrypts every row of one user under {@code newCrypto}, accepting
     * content written under either key.
     *
     * @throws IllegalArgumentException if {@code newCrypto} is
     *                                  {@link NoEncryption}; nothing is
     *                                  touched
     */
    public Summary reencryptUser(String userId, Crypto oldCrypto, Crypto newCrypto) {
        if (newCrypto instanceof NoEncryption) {
            throw new IllegalArgumentException(
                    "Cannot re-encrypt to NoEncryption for user " + userId + ", unencrypt instead");
        }
        Crypto decrypt = FallbackCrypto.of(newCrypto, oldCrypto);
        return migrate(userId, decrypt, newCrypto);
    }

    /** Decrypts every row of every user and stores it as plaintext. */
    public List<Summary> unencryptAllUsers(CryptoFactory oldFactory) {
        List<String> users = database.inReadTransaction(userStore::listUsers);
        LOG.info("Decrypting content of {} users", users.size());
        List<Summary> summaries = new ArrayList<>(users.size());
        for (String userId : users) {
            summaries.add(unencryptUser(userId, oldFactory.forUser(userId)));
        }
        return summaries;
    }

    /**
     * Decrypts every row of one user with {@code oldCrypto} and stores it as
     * plaintext. Rows that are already plaintext stay as they are.
     */
    public Summary unencryptUser(String userId, Crypto oldCrypto) {
        Crypto decrypt = oldCrypto instanceof NoEncryption
                ? oldCrypto
                : FallbackCrypto.of(oldCrypto, NoEncryption.INSTANCE);
        return migrate(userId, decrypt, NoEncryption.INSTANCE);
    }

    private Summary migrate(String userId, Crypto decrypt, Crypto encrypt) {
        LOG.info("Begin re-encryption for user {}", userId);
        eventBus.post(new ContentsEvents.ReencryptionStartedEvent(userId));

        List<Long> files = new ArrayList<>();
        List<Long> checkpoints = new ArrayList<>();
        database.runInTransaction(conn -> {
            LOG.info("Re-encrypting files for {}", userId);
            for (long fileId : fileStore.selectFileIds(conn, userId)) {
                reencryptFile(conn, fileId, decrypt, encrypt);
                files.add(fileId);
            }
            LOG.info("Re-encrypting checkpoints for {}", userId);
            for (long checkpointId : checkpointStore.selectCheckpointIds(conn, userId)) {
                reencryptCheckpoint(conn, checkpointId, decrypt, encrypt);
                checkpoints.add(checkpointId);
            }
        });

        for (long id : files)
            eventBus.post(new ContentsEvents.RowReencryptedEvent(userId, "files", id));
        for (long id : checkpoints)
            eventBus.post(new ContentsEvents.RowReencryptedEvent(userId, "remote_checkpoints", id));
        eventBus.post(new ContentsEvents.ReencryptionFinishedEvent(userId, files.size(), checkpoints.size()));

        LOG.info("Finished re-encryption for user {} ({} files, {} checkpoints)",
                userId, files.size(), checkpoints.size());
        return new Summary(userId, files.size(), checkpoints.size());
    }

    private void reencryptFile(Connection conn, long fileId, Crypto decrypt, Crypto encrypt) throws SQLException {
        LOG.debug("Begin encrypting files row {}.", fileId);
        byte[] content = fileStore.lockContent(conn, fileId);
        fileStore.updateContent(conn, fileId, encrypt.encrypt(decrypt.decrypt(content)));
        LOG.debug("Done encrypting files row {}.", fileId);
    }

    private void reencryptCheckpoint(Connection conn, long checkpointId, Crypto decrypt, Crypto encrypt)
            throws SQLException {
        LOG.debug("Begin encrypting remote_checkpoints row {}.", checkpointId);
        byte[] content = checkpointStore.lockContent(conn, checkpointId);
        checkpointStore.updateContent(conn, checkpointId, encrypt.encrypt(decrypt.decrypt(content)));
        LOG.debug("Done encrypting remote_checkpoints row {}.", checkpointId);
    }

    /** Rows migrated for one user. */
    public record Summary(String userId, int files, int checkpoints) {
    }
}
