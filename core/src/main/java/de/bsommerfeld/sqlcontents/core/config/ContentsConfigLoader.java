package de.bsommerfeld.sqlcontents.core.config;

import com.fasterxml.jackson.dataformat.toml.TomlMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Reads {@link ContentsConfig} from a TOML file. A missing file yields the
 * defaults. Unknown keys are rejected so that a misspelled key fails loudly
 * instead of silently falling back to its default.
 *
 * <p>
 * The database URL can be overridden without touching the file, through the
 * system property {@value #DB_URL_PROPERTY} or the environment variable
 * {@value #DB_URL_ENV} (property wins).
 */
public final class ContentsConfigLoader {

    public static final String DB_URL_PROPERTY = "sqlcontents.db.url";
    public static final String DB_URL_ENV = "SQLCONTENTS_DB_URL";

    private static final Logger LOG = LoggerFactory.getLogger(ContentsConfigLoader.class);
    private static final TomlMapper MAPPER = new TomlMapper();

    private ContentsConfigLoader() {
    }

    public static ContentsConfig load(Path configPath) throws IOException {
        ContentsConfig config;
        if (Files.exists(configPath)) {
            LOG.info("Loading configuration from: {}", configPath.toAbsolutePath());
            config = MAPPER.readValue(configPath.toFile(), ContentsConfig.class);
        } else {
            LOG.info("No configuration at {}, using defaults.", configPath.toAbsolutePath());
            config = new ContentsConfig();
        }
        applyOverrides(config);
        return config;
    }

    /** Writes {@code config} as TOML, creating parent directories as needed. */
    public static void write(Path configPath, ContentsConfig config) throws IOException {
        Path parent = configPath.toAbsolutePath().getParent();
        if (parent != null && !Files.exists(parent)) {
            Files.createDirectories(parent);
        }
        MAPPER.writeValue(configPath.toFile(), config);
    }

    static void applyOverrides(ContentsConfig config) {
        String url = System.getProperty(DB_URL_PROPERTY);
        if (url == null || url.isEmpty()) {
            url = System.getenv(DB_URL_ENV);
        }
        if (url != null && !url.isEmpty()) {
            LOG.info("Database URL overridden from environment.");
            config.getDatabase().setUrl(url);
        }
    }
}
