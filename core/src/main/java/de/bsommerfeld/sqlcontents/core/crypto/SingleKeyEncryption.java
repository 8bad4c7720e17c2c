package de.bsommerfeld.sqlcontents.core.crypto;

import de.bsommerfeld.sqlcontents.core.error.CorruptedFileException;

import javax.crypto.Cipher;
import javax.crypto.SecretKey;
import javax.crypto.spec.GCMParameterSpec;
import java.nio.ByteBuffer;
import java.security.GeneralSecurityException;
import java.security.SecureRandom;
import java.util.Arrays;

/**
 * Authenticated encryption with a single AES-256-GCM key.
 *
 * <p>
 * Token layout: {@code version (1) | nonce (12) | ciphertext + tag (n + 16)}.
 * A fresh random nonce is drawn for every message, so encrypting the same
 * plaintext twice yields different tokens.
 */
public final class SingleKeyEncryption implements Crypto {

    private static final byte VERSION = (byte) 0x80;
    private static final String TRANSFORMATION = "AES/GCM/NoPadding";
    private static final int NONCE_LENGTH = 12;
    private static final int TAG_BITS = 128;
    private static final int MIN_TOKEN_LENGTH = 1 + NONCE_LENGTH + TAG_BITS / 8;

    private static final SecureRandom RANDOM = new SecureRandom();

    private final SecretKey key;

    public SingleKeyEncryption(SecretKey key) {
        this.key = key;
    }

    /** Derives the key for {@code userId} from {@code password}. */
    public static SingleKeyEncryption fromPassword(String password, String userId) {
        return new SingleKeyEncryption(KeyDerivation.deriveKey(password, userId));
    }

    @Override
    public byte[] encrypt(byte[] plaintext) {
        byte[] nonce = new byte[NONCE_LENGTH];
        RANDOM.nextBytes(nonce);
        try {
            Cipher cipher = Cipher.getInstance(TRANSFORMATION);
            cipher.init(Cipher.ENCRYPT_MODE, key, new GCMParameterSpec(TAG_BITS, nonce));
            byte[] ct = cipher.doFinal(plaintext);
            return ByteBuffer.allocate(1 + NONCE_LENGTH + ct.length)
                    .put(VERSION)
                    .put(nonce)
                    .put(ct)
                    .array();
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("AES-GCM encryption failed", e);
        }
    }

    @Override
    public byte[] decrypt(byte[] token) {
        if (token == null || token.length < MIN_TOKEN_LENGTH) {
            throw new CorruptedFileException("Token too short to be AES-GCM content");
        }
        if (token[0] != VERSION) {
            throw new CorruptedFileException("Unknown token version: " + (token[0] & 0xFF));
        }
        byte[] nonce = Arrays.copyOfRange(token, 1, 1 + NONCE_LENGTH);
        try {
            Cipher cipher = Cipher.getInstance(TRANSFORMATION);
            cipher.init(Cipher.DECRYPT_MODE, key, new GCMParameterSpec(TAG_BITS, nonce));
            return cipher.doFinal(token, 1 + NONCE_LENGTH, token.length - 1 - NONCE_LENGTH);
        } catch (GeneralSecurityException e) {
            throw new CorruptedFileException("Content could not be authenticated", e);
        }
    }

    @Override
    public String toString() {
        return "SingleKeyEncryption";
    }
}
