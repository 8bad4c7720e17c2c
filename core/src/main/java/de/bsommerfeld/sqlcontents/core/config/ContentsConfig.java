package de.bsommerfeld.sqlcontents.core.config;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Root of the TOML configuration. Each section maps to one nested class:
 *
 * <pre>
 * [database]
 * url = "jdbc:sqlite:/var/lib/sqlcontents/sqlcontents.db"
 * busy-timeout-millis = 5000
 *
 * [storage]
 * user-id = "alice"
 * max-file-size-bytes = 0
 * create-user-on-startup = true
 *
 * [crypto]
 * passwords = ["new-secret", "old-secret"]
 * allow-unencrypted-reads = false
 * </pre>
 *
 * @see ContentsConfigLoader
 */
public class ContentsConfig {

    @JsonProperty("database")
    private DatabaseConfig database = new DatabaseConfig();

    @JsonProperty("storage")
    private StorageConfig storage = new StorageConfig();

    @JsonProperty("crypto")
    private CryptoConfig crypto = new CryptoConfig();

    public DatabaseConfig getDatabase() {
        return database;
    }

    public StorageConfig getStorage() {
        return storage;
    }

    public CryptoConfig getCrypto() {
        return crypto;
    }
}
