package de.bsommerfeld.sqlcontents.core.crypto;

import de.bsommerfeld.sqlcontents.core.error.CorruptedFileException;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class FallbackCryptoTest {

    private static final byte[] PLAIN = "notebook".getBytes(StandardCharsets.UTF_8);

    private static SingleKeyEncryption newKey;
    private static SingleKeyEncryption oldKey;

    @BeforeAll
    static void deriveKeys() {
        newKey = SingleKeyEncryption.fromPassword("new", "alice");
        oldKey = SingleKeyEncryption.fromPassword("old", "alice");
    }

    @Test
    void encrypt_shouldUseFirstStrategy() {
        var fallback = FallbackCrypto.of(newKey, oldKey);

        byte[] token = fallback.encrypt(PLAIN);

        assertArrayEquals(PLAIN, newKey.decrypt(token));
        assertThrows(CorruptedFileException.class, () -> oldKey.decrypt(token));
    }

    @Test
    void decrypt_shouldFallBackToLaterStrategies() {
        var fallback = FallbackCrypto.of(newKey, oldKey);

        assertArrayEquals(PLAIN, fallback.decrypt(oldKey.encrypt(PLAIN)));
        assertArrayEquals(PLAIN, fallback.decrypt(newKey.encrypt(PLAIN)));
    }

    @Test
    void decrypt_withNoEncryptionLast_shouldPassPlaintextThrough() {
        var fallback = FallbackCrypto.of(newKey, NoEncryption.INSTANCE);

        assertArrayEquals(PLAIN, fallback.decrypt(PLAIN));
    }

    @Test
    void decrypt_allFailing_shouldAggregateSuppressed() {
        var fallback = FallbackCrypto.of(newKey, oldKey);
        byte[] foreign = SingleKeyEncryption.fromPassword("third", "alice").encrypt(PLAIN);

        var ex = assertThrows(CorruptedFileException.class, () -> fallback.decrypt(foreign));

        assertEquals(2, ex.getSuppressed().length);
    }

    @Test
    void constructor_noEncryptionBeforeLast_shouldBeRejected() {
        assertThrows(IllegalArgumentException.class,
                () -> FallbackCrypto.of(NoEncryption.INSTANCE, newKey));
        assertThrows(IllegalArgumentException.class,
                () -> new FallbackCrypto(List.of(newKey, NoEncryption.INSTANCE, oldKey)));
    }

    @Test
    void constructor_emptyList_shouldBeRejected() {
        assertThrows(IllegalArgumentException.class, () -> new FallbackCrypto(List.of()));
    }

    @Test
    void cryptos_shouldBeImmutableCopy() {
        var fallback = FallbackCrypto.of(newKey, oldKey);

        assertEquals(List.of(newKey, oldKey), fallback.cryptos());
        assertThrows(UnsupportedOperationException.class, () -> fallback.cryptos().clear());
    }
}
