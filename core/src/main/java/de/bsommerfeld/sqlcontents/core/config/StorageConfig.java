package de.bsommerfeld.sqlcontents.core.config;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Per-user storage behaviour of the contents manager.
 */
public class StorageConfig {

    /** Size limit value meaning "no limit". */
    public static final long UNLIMITED = 0;

    @JsonProperty("user-id")
    private String userId = System.getProperty("user.name", "default");

    // Limit on the stored (encrypted) size of files and checkpoints, 0 = unlimited
    @JsonProperty("max-file-size-bytes")
    private long maxFileSizeBytes = UNLIMITED;

    // Create the user row and its root directory when the manager starts
    @JsonProperty("create-user-on-startup")
    private boolean createUserOnStartup = true;

    public String getUserId() {
        return userId;
    }

    public void setUserId(String userId) {
        this.userId = userId;
    }

    public long getMaxFileSizeBytes() {
        return maxFileSizeBytes;
    }

    public void setMaxFileSizeBytes(long maxFileSizeBytes) {
        this.maxFileSizeBytes = maxFileSizeBytes;
    }

    public boolean isCreateUserOnStartup() {
        return createUserOnStartup;
    }

    public void setCreateUserOnStartup(boolean createUserOnStartup) {
        this.createUserOnStartup = createUserOnStartup;
    }
}
