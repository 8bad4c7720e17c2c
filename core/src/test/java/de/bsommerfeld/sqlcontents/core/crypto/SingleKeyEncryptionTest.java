package de.bsommerfeld.sqlcontents.core.crypto;

import de.bsommerfeld.sqlcontents.core.error.CorruptedFileException;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

class SingleKeyEncryptionTest {

    private static SingleKeyEncryption aliceKey;
    private static SingleKeyEncryption otherPassword;
    private static SingleKeyEncryption bobKey;

    @BeforeAll
    static void deriveKeys() {
        aliceKey = SingleKeyEncryption.fromPassword("secret", "alice");
        otherPassword = SingleKeyEncryption.fromPassword("other", "alice");
        bobKey = SingleKeyEncryption.fromPassword("secret", "bob");
    }

    @Test
    void decrypt_shouldRestorePlaintext() {
        byte[] plain = "hello".getBytes(StandardCharsets.UTF_8);

        byte[] token = aliceKey.encrypt(plain);

        assertArrayEquals(plain, aliceKey.decrypt(token));
    }

    @Test
    void encrypt_shouldUseVersionByteAndFreshNonce() {
        byte[] plain = "same".getBytes(StandardCharsets.UTF_8);

        byte[] first = aliceKey.encrypt(plain);
        byte[] second = aliceKey.encrypt(plain);

        assertEquals((byte) 0x80, first[0]);
        // version + nonce + ciphertext + 16 byte tag
        assertEquals(1 + 12 + plain.length + 16, first.length);
        assertFalse(java.util.Arrays.equals(first, second));
    }

    @Test
    void decrypt_withOtherPassword_shouldThrowCorrupted() {
        byte[] token = aliceKey.encrypt(new byte[] { 1, 2, 3 });

        assertThrows(CorruptedFileException.class, () -> otherPassword.decrypt(token));
    }

    @Test
    void decrypt_withOtherUsersKey_shouldThrowCorrupted() {
        byte[] token = aliceKey.encrypt(new byte[] { 1, 2, 3 });

        assertThrows(CorruptedFileException.class, () -> bobKey.decrypt(token));
    }

    @Test
    void decrypt_plaintextInput_shouldThrowCorrupted() {
        byte[] plain = "not a token at all, just text".getBytes(StandardCharsets.UTF_8);

        assertThrows(CorruptedFileException.class, () -> aliceKey.decrypt(plain));
        assertThrows(CorruptedFileException.class, () -> aliceKey.decrypt(new byte[0]));
    }

    @Test
    void decrypt_tamperedToken_shouldThrowCorrupted() {
        byte[] token = aliceKey.encrypt("payload".getBytes(StandardCharsets.UTF_8));
        token[token.length - 1] ^= 0x01;

        assertThrows(CorruptedFileException.class, () -> aliceKey.decrypt(token));
    }

    @Test
    void fromPassword_nonAscii_shouldBeRejected() {
        assertThrows(IllegalArgumentException.class, () -> SingleKeyEncryption.fromPassword("pässword", "alice"));
        assertThrows(IllegalArgumentException.class, () -> SingleKeyEncryption.fromPassword("secret", "ålice"));
    }
}
