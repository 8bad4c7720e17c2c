package de.bsommerfeld.sqlcontents.manager;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.inject.AbstractModule;
import com.google.inject.Provides;
import com.google.inject.Singleton;
import de.bsommerfeld.sqlcontents.core.config.ContentsConfig;
import de.bsommerfeld.sqlcontents.core.config.ContentsConfigLoader;
import de.bsommerfeld.sqlcontents.core.config.CryptoConfig;
import de.bsommerfeld.sqlcontents.core.config.DatabaseConfig;
import de.bsommerfeld.sqlcontents.core.config.StorageConfig;
import de.bsommerfeld.sqlcontents.core.crypto.CryptoFactory;
import de.bsommerfeld.sqlcontents.core.util.StorageUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Guice module wiring configuration, database, crypto and the contents
 * manager.
 *
 * <p>
 * The configuration is read from {@code config.toml} in the application
 * data directory unless a path or a ready {@link ContentsConfig} is given.
 * Stores, the event bus and the manager are {@code @Singleton} classes and
 * bind themselves just in time.
 */
public class ContentsModule extends AbstractModule {

    private static final Logger LOG = LoggerFactory.getLogger(ContentsModule.class);

    private final Path configPath;
    private final ContentsConfig preloaded;

    public ContentsModule() {
        this(StorageUtils.getDefaultConfigFile());
    }

    public ContentsModule(Path configPath) {
        this.configPath = configPath;
        this.preloaded = null;
    }

    public ContentsModule(ContentsConfig config) {
        this.configPath = null;
        this.preloaded = config;
    }

    @Override
    protected void configure() {
        ContentsConfig config = preloaded;
        if (config == null) {
            try {
                config = ContentsConfigLoader.load(configPath);
            } catch (Exception e) {
                // Config is vital, fail fast
                throw new RuntimeException("Failed to load Contents Configuration", e);
            }
        }

        bind(ContentsConfig.class).toInstance(config);

        // Sub-configs for convenience
        bind(DatabaseConfig.class).toInstance(config.getDatabase());
        bind(StorageConfig.class).toInstance(config.getStorage());
        bind(CryptoConfig.class).toInstance(config.getCrypto());

        bind(CryptoFactory.class).toInstance(createCryptoFactory(config.getCrypto()));
    }

    @Provides
    @Singleton
    ObjectMapper provideObjectMapper() {
        return new ObjectMapper();
    }

    /**
     * No passwords means no encryption. Otherwise the first password encrypts
     * and every password is tried on reads, followed by plaintext if
     * unencrypted reads are allowed.
     */
    static CryptoFactory createCryptoFactory(CryptoConfig crypto) {
        if (!crypto.isEncryptionEnabled()) {
            LOG.warn("No crypto passwords configured, contents are stored unencrypted");
            return CryptoFactory.noEncryption();
        }
        List<String> passwords = new ArrayList<>(crypto.getPasswords());
        if (crypto.isAllowUnencryptedReads()) {
            passwords.add(null);
        }
        return CryptoFactory.fallbackPasswords(passwords);
    }
}
