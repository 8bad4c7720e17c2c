package de.bsommerfeld.sqlcontents.core.config;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.List;

/**
 * Encryption settings. The first password encrypts new writes; the others
 * only decrypt, which is how a key rotation is rolled out before the
 * re-encryption job has migrated every row.
 */
public class CryptoConfig {

    // Master passwords, newest first. Empty = no encryption
    @JsonProperty("passwords")
    private List<String> passwords = new ArrayList<>();

    // Also accept unencrypted rows on read (while a plaintext store is being encrypted)
    @JsonProperty("allow-unencrypted-reads")
    private boolean allowUnencryptedReads = false;

    public List<String> getPasswords() {
        return passwords;
    }

    public void setPasswords(List<String> passwords) {
        this.passwords = passwords;
    }

    public boolean isAllowUnencryptedReads() {
        return allowUnencryptedReads;
    }

    public void setAllowUnencryptedReads(boolean allowUnencryptedReads) {
        this.allowUnencryptedReads = allowUnencryptedReads;
    }

    @JsonIgnore
    public boolean isEncryptionEnabled() {
        return passwords != null && !passwords.isEmpty();
    }
}
