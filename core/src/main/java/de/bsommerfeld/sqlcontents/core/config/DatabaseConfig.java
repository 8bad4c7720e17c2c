package de.bsommerfeld.sqlcontents.core.config;

import com.fasterxml.jackson.annotation.JsonProperty;
import de.bsommerfeld.sqlcontents.core.util.StorageUtils;

/**
 * JDBC connection settings.
 */
public class DatabaseConfig {

    // JDBC URL of the SQLite database, default lives in the app data directory
    @JsonProperty("url")
    private String url = "jdbc:sqlite:" + StorageUtils.getDefaultDatabaseFile().toAbsolutePath();

    // Milliseconds a statement waits for a competing writer before failing
    @JsonProperty("busy-timeout-millis")
    private int busyTimeoutMillis = 5000;

    public String getUrl() {
        return url;
    }

    public void setUrl(String url) {
        this.url = url;
    }

    public int getBusyTimeoutMillis() {
        return busyTimeoutMillis;
    }

    public void setBusyTimeoutMillis(int busyTimeoutMillis) {
        this.busyTimeoutMillis = busyTimeoutMillis;
    }
}
