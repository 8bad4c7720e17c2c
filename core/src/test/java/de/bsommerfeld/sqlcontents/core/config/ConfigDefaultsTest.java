package de.bsommerfeld.sqlcontents.core.config;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ConfigDefaultsTest {

    @Test
    void contentsConfig_shouldInitializeAllSections() {
        var config = new ContentsConfig();

        assertNotNull(config.getDatabase());
        assertNotNull(config.getStorage());
        assertNotNull(config.getCrypto());
    }

    @Test
    void databaseConfig_shouldDefaultToSqliteFile() {
        var database = new DatabaseConfig();

        assertTrue(database.getUrl().startsWith("jdbc:sqlite:"));
        assertTrue(database.getUrl().endsWith("sqlcontents.db"));
        assertEquals(5000, database.getBusyTimeoutMillis());
    }

    @Test
    void storageConfig_shouldBeUnlimitedByDefault() {
        var storage = new StorageConfig();

        assertEquals(StorageConfig.UNLIMITED, storage.getMaxFileSizeBytes());
        assertTrue(storage.isCreateUserOnStartup());
        assertNotNull(storage.getUserId());
    }

    @Test
    void cryptoConfig_shouldBeDisabledWithoutPasswords() {
        var crypto = new CryptoConfig();

        assertFalse(crypto.isEncryptionEnabled());
        assertFalse(crypto.isAllowUnencryptedReads());
        assertTrue(crypto.getPasswords().isEmpty());
    }
}
