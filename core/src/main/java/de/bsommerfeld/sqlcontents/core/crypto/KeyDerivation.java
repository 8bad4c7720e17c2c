package de.bsommerfeld.sqlcontents.core.crypto;

import javax.crypto.SecretKey;
import javax.crypto.SecretKeyFactory;
import javax.crypto.spec.PBEKeySpec;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;

/**
 * Derives per-user AES keys from a master password. The user id is the salt,
 * so every user ends up with a distinct key while only one secret has to be
 * configured.
 *
 * <p>
 * Parameters are fixed: changing any of them makes every previously written
 * row unreadable.
 */
public final class KeyDerivation {

    static final String ALGORITHM = "PBKDF2WithHmacSHA256";
    static final int ITERATIONS = 100_000;
    static final int KEY_BITS = 256;

    private KeyDerivation() {
    }

    /**
     * @param password ASCII master password
     * @param userId   ASCII user id, used as salt
     * @throws IllegalArgumentException if either argument is not ASCII
     */
    public static SecretKey deriveKey(String password, String userId) {
        requireAscii(password, "password");
        requireAscii(userId, "userId");

        PBEKeySpec spec = new PBEKeySpec(password.toCharArray(),
                userId.getBytes(StandardCharsets.US_ASCII), ITERATIONS, KEY_BITS);
        try {
            byte[] raw = SecretKeyFactory.getInstance(ALGORITHM).generateSecret(spec).getEncoded();
            return new SecretKeySpec(raw, "AES");
        } catch (GeneralSecurityException e) {
            // PBKDF2WithHmacSHA256 ships with every JDK since 8
            throw new IllegalStateException(ALGORITHM + " not available", e);
        } finally {
            spec.clearPassword();
        }
    }

    private static void requireAscii(String value, String name) {
        if (value == null || !StandardCharsets.US_ASCII.newEncoder().canEncode(value)) {
            throw new IllegalArgumentException(name + " must be a non-null ASCII string");
        }
    }
}
