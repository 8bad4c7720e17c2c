package de.bsommerfeld.sqlcontents.manager;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.inject.Guice;
import com.google.inject.Injector;
import de.bsommerfeld.sqlcontents.core.config.StorageConfig;
import de.bsommerfeld.sqlcontents.core.crypto.CryptoFactory;
import de.bsommerfeld.sqlcontents.core.domain.ExportedContent;
import de.bsommerfeld.sqlcontents.core.event.ContentsEventBus;
import de.bsommerfeld.sqlcontents.core.util.StorageUtils;
import de.bsommerfeld.sqlcontents.db.CheckpointStore;
import de.bsommerfeld.sqlcontents.db.ContentExporter;
import de.bsommerfeld.sqlcontents.db.DirectoryStore;
import de.bsommerfeld.sqlcontents.db.FileStore;
import de.bsommerfeld.sqlcontents.db.ReencryptionService;
import de.bsommerfeld.sqlcontents.db.SqlDatabase;
import de.bsommerfeld.sqlcontents.db.UserStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.PrintStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;

/**
 * Command line entry point for maintenance jobs that run across all users.
 *
 * <pre>
 * sqlcontents-admin [--config &lt;file&gt;] &lt;command&gt; [args]
 *
 *   list-users
 *   reencrypt &lt;old-password|-&gt; &lt;new-password&gt;
 *   unencrypt &lt;old-password&gt;
 *   export-notebooks &lt;out-dir&gt;
 *   export-checkpoints &lt;out-dir&gt;
 *   checkpoint-all &lt;user&gt;
 * </pre>
 *
 * <h3>Key rotation</h3>
 * Rotating from password A to B is a three step rollout: configure
 * {@code passwords = ["B", "A"]} so both keys decrypt, run
 * {@code reencrypt A B}, then drop A from the configuration. A {@code -} as
 * old password means the rows are currently stored unencrypted.
 *
 * <h3>Exit codes</h3>
 * {@code 0} on success, {@code 1} on a usage error, {@code 2} if the job
 * failed. Re-encryption is idempotent, so a failed run can simply be
 * repeated.
 */
public final class ContentsAdmin {

    private static final Logger LOG = LoggerFactory.getLogger(ContentsAdmin.class);

    static final int EXIT_OK = 0;
    static final int EXIT_USAGE = 1;
    static final int EXIT_FAILURE = 2;

    private static final String NO_PASSWORD = "-";

    private ContentsAdmin() {
    }

    public static void main(String[] args) {
        System.exit(run(args, System.out, System.err));
    }

    /** Runs one command and returns the process exit code. */
    static int run(String[] args, PrintStream out, PrintStream err) {
        List<String> arguments = new ArrayList<>(Arrays.asList(args));
        Path configPath = StorageUtils.getDefaultConfigFile();
        if (arguments.size() >= 2 && "--config".equals(arguments.get(0))) {
            configPath = Paths.get(arguments.get(1));
            arguments = arguments.subList(2, arguments.size());
        }
        if (arguments.isEmpty()) {
            printUsage(err);
            return EXIT_USAGE;
        }

        String command = arguments.get(0);
        List<String> params = arguments.subList(1, arguments.size());
        if (!hasValidArity(command, params.size())) {
            printUsage(err);
            return EXIT_USAGE;
        }

        try {
            Injector injector = Guice.createInjector(new ContentsModule(configPath));
            switch (command) {
                case "list-users":
                    listUsers(injector, out);
                    break;
                case "reencrypt":
                    reencrypt(injector, params.get(0), params.get(1), out);
                    break;
                case "unencrypt":
                    unencrypt(injector, params.get(0), out);
                    break;
                case "export-notebooks":
                    export(injector, Paths.get(params.get(0)), false, out);
                    break;
                case "export-checkpoints":
                    export(injector, Paths.get(params.get(0)), true, out);
                    break;
                case "checkpoint-all":
                    checkpointAll(injector, params.get(0), out);
                    break;
                default:
                    throw new IllegalStateException("Unhandled command " + command);
            }
            return EXIT_OK;
        } catch (IllegalArgumentException e) {
            err.println("Error: " + e.getMessage());
            return EXIT_USAGE;
        } catch (Exception e) {
            LOG.error("Command '{}' failed", command, e);
            err.println("Failed: " + e.getMessage());
            return EXIT_FAILURE;
        }
    }

    private static boolean hasValidArity(String command, int count) {
        switch (command) {
            case "list-users":
                return count == 0;
            case "reencrypt":
                return count == 2;
            case "unencrypt":
            case "export-notebooks":
            case "export-checkpoints":
            case "checkpoint-all":
                return count == 1;
            default:
                return false;
        }
    }

    // =====================================================================
    // Commands
    // =====================================================================

    private static void listUsers(Injector injector, PrintStream out) {
        SqlDatabase database = injector.getInstance(SqlDatabase.class);
        UserStore userStore = injector.getInstance(UserStore.class);
        List<String> users = database.inReadTransaction(userStore::listUsers);
        users.forEach(out::println);
    }

    private static void reencrypt(Injector injector, String oldPassword, String newPassword, PrintStream out) {
        if (NO_PASSWORD.equals(newPassword)) {
            throw new IllegalArgumentException("Use 'unencrypt' to remove encryption");
        }
        ReencryptionService service = injector.getInstance(ReencryptionService.class);
        List<ReencryptionService.Summary> summaries = service.reencryptAllUsers(
                passwordFactory(oldPassword), CryptoFactory.singlePassword(newPassword));
        printSummaries(summaries, out);
    }

    private static void unencrypt(Injector injector, String oldPassword, PrintStream out) {
        ReencryptionService service = injector.getInstance(ReencryptionService.class);
        printSummaries(service.unencryptAllUsers(passwordFactory(oldPassword)), out);
    }

    /**
     * Writes every decryptable notebook (or checkpoint) to
     * {@code outDir/<user>/<path>}. Checkpoints get their id appended so
     * several snapshots of one path don't collide.
     */
    private static void export(Injector injector, Path outDir, boolean checkpoints, PrintStream out) {
        ContentExporter exporter = injector.getInstance(ContentExporter.class);
        CryptoFactory cryptoFactory = injector.getInstance(CryptoFactory.class);
        int[] written = {0};
        Consumer<ExportedContent> sink = content -> {
            String fileName = checkpoints ? content.path() + "." + content.id() : content.path();
            writeExport(outDir, content.userId(), fileName, content.content());
            written[0]++;
        };
        if (checkpoints) {
            exporter.exportCheckpoints(cryptoFactory, null, null, sink);
        } else {
            exporter.exportFiles(cryptoFactory, null, null, sink);
        }
        out.println("Exported " + written[0] + (checkpoints ? " checkpoints" : " notebooks") + " to " + outDir);
    }

    /**
     * Checkpoints every notebook of one existing user. The user is not
     * created if missing.
     */
    private static void checkpointAll(Injector injector, String userId, PrintStream out) {
        SqlDatabase database = injector.getInstance(SqlDatabase.class);
        if (!database.inReadTransaction(injector.getInstance(UserStore.class)::listUsers).contains(userId)) {
            throw new IllegalArgumentException("Unknown user '" + userId + "'");
        }
        StorageConfig storage = new StorageConfig();
        storage.setUserId(userId);
        storage.setCreateUserOnStartup(false);
        storage.setMaxFileSizeBytes(injector.getInstance(StorageConfig.class).getMaxFileSizeBytes());

        ContentsManager manager = new ContentsManager(database, injector.getInstance(UserStore.class),
                injector.getInstance(DirectoryStore.class), injector.getInstance(FileStore.class),
                injector.getInstance(CheckpointStore.class), injector.getInstance(CryptoFactory.class), storage,
                injector.getInstance(ContentsEventBus.class), injector.getInstance(ObjectMapper.class));
        Map<String, CheckpointInfo> created = manager.checkpointAllNotebooks();
        created.forEach((path, checkpoint) -> out.println(path + " -> checkpoint " + checkpoint.id()));
        out.println("Checkpointed " + created.size() + " notebooks of " + userId);
    }

    // =====================================================================
    // Helpers
    // =====================================================================

    private static CryptoFactory passwordFactory(String password) {
        return NO_PASSWORD.equals(password) ? CryptoFactory.noEncryption() : CryptoFactory.singlePassword(password);
    }

    private static void writeExport(Path outDir, String userId, String relativePath, byte[] content) {
        Path userDir = outDir.resolve(userId).normalize();
        Path target = userDir.resolve(relativePath).normalize();
        if (!userDir.startsWith(outDir.normalize()) || !target.startsWith(userDir)) {
            throw new IllegalStateException("Refusing to export outside " + outDir + ": " + userId + "/"
                    + relativePath);
        }
        try {
            Files.createDirectories(target.getParent());
            Files.write(target, content);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write " + target, e);
        }
    }

    private static void printSummaries(List<ReencryptionService.Summary> summaries, PrintStream out) {
        for (ReencryptionService.Summary summary : summaries) {
            out.printf("%s: %d files, %d checkpoints%n", summary.userId(), summary.files(), summary.checkpoints());
        }
        out.println("Processed " + summaries.size() + " users");
    }

    private static void printUsage(PrintStream err) {
        err.println("Usage: sqlcontents-admin [--config <file>] <command> [args]");
        err.println("  list-users");
        err.println("  reencrypt <old-password|-> <new-password>");
        err.println("  unencrypt <old-password>");
        err.println("  export-notebooks <out-dir>");
        err.println("  export-checkpoints <out-dir>");
        err.println("  checkpoint-all <user>");
    }
}
