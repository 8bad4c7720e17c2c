package de.bsommerfeld.sqlcontents.core.config;

import com.fasterxml.jackson.databind.JsonMappingException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ContentsConfigLoaderTest {

    @TempDir
    Path tempDir;

    @AfterEach
    void clearOverride() {
        System.clearProperty(ContentsConfigLoader.DB_URL_PROPERTY);
    }

    @Test
    void load_missingFile_shouldReturnDefaults() throws Exception {
        var config = ContentsConfigLoader.load(tempDir.resolve("absent.toml"));

        assertEquals(5000, config.getDatabase().getBusyTimeoutMillis());
        assertFalse(config.getCrypto().isEncryptionEnabled());
    }

    @Test
    void load_shouldReadAllSections() throws Exception {
        Path file = tempDir.resolve("config.toml");
        Files.writeString(file, """
                [database]
                url = "jdbc:sqlite:/tmp/contents.db"
                busy-timeout-millis = 250

                [storage]
                user-id = "alice"
                max-file-size-bytes = 1024
                create-user-on-startup = false

                [crypto]
                passwords = ["new-secret", "old-secret"]
                allow-unencrypted-reads = true
                """);

        var config = ContentsConfigLoader.load(file);

        assertEquals("jdbc:sqlite:/tmp/contents.db", config.getDatabase().getUrl());
        assertEquals(250, config.getDatabase().getBusyTimeoutMillis());
        assertEquals("alice", config.getStorage().getUserId());
        assertEquals(1024, config.getStorage().getMaxFileSizeBytes());
        assertFalse(config.getStorage().isCreateUserOnStartup());
        assertEquals(List.of("new-secret", "old-secret"), config.getCrypto().getPasswords());
        assertTrue(config.getCrypto().isAllowUnencryptedReads());
    }

    @Test
    void load_partialFile_shouldKeepDefaultsForMissingKeys() throws Exception {
        Path file = tempDir.resolve("config.toml");
        Files.writeString(file, """
                [storage]
                user-id = "bob"
                """);

        var config = ContentsConfigLoader.load(file);

        assertEquals("bob", config.getStorage().getUserId());
        assertEquals(StorageConfig.UNLIMITED, config.getStorage().getMaxFileSizeBytes());
        assertEquals(5000, config.getDatabase().getBusyTimeoutMillis());
    }

    @Test
    void load_unknownKey_shouldFail() throws Exception {
        Path file = tempDir.resolve("config.toml");
        Files.writeString(file, """
                [storage]
                max-file-size = 10
                """);

        assertThrows(JsonMappingException.class, () -> ContentsConfigLoader.load(file));
    }

    @Test
    void load_systemProperty_shouldOverrideUrl() throws Exception {
        System.setProperty(ContentsConfigLoader.DB_URL_PROPERTY, "jdbc:sqlite:/override.db");

        var config = ContentsConfigLoader.load(tempDir.resolve("absent.toml"));

        assertEquals("jdbc:sqlite:/override.db", config.getDatabase().getUrl());
    }

    @Test
    void write_thenLoad_shouldPreserveValues() throws Exception {
        var config = new ContentsConfig();
        config.getStorage().setUserId("carol");
        config.getCrypto().setPasswords(List.of("pw"));
        Path file = tempDir.resolve("nested").resolve("config.toml");

        ContentsConfigLoader.write(file, config);
        var loaded = ContentsConfigLoader.load(file);

        assertEquals("carol", loaded.getStorage().getUserId());
        assertEquals(List.of("pw"), loaded.getCrypto().getPasswords());
    }
}
