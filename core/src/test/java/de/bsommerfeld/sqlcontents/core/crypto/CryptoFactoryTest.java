package de.bsommerfeld.sqlcontents.core.crypto;

import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class CryptoFactoryTest {

    @Test
    void noEncryption_shouldReturnIdentityForEveryone() {
        var factory = CryptoFactory.noEncryption();

        assertSame(NoEncryption.INSTANCE, factory.forUser("alice"));
        assertSame(NoEncryption.INSTANCE, factory.forUser("bob"));
    }

    @Test
    void singlePassword_shouldDeriveDistinctKeysPerUser() {
        var factory = CryptoFactory.singlePassword("secret");
        byte[] plain = "x".getBytes(StandardCharsets.UTF_8);

        Crypto alice = factory.forUser("alice");
        Crypto bob = factory.forUser("bob");

        assertInstanceOf(SingleKeyEncryption.class, alice);
        assertThrows(RuntimeException.class, () -> bob.decrypt(alice.encrypt(plain)));
    }

    @Test
    void singlePassword_shouldMemoizePerUser() {
        var factory = CryptoFactory.singlePassword("secret");

        assertSame(factory.forUser("alice"), factory.forUser("alice"));
        assertNotSame(factory.forUser("alice"), factory.forUser("bob"));
    }

    @Test
    void memoized_shouldCallDelegateOncePerUser() {
        var calls = new AtomicInteger();
        var factory = CryptoFactory.memoized(userId -> {
            calls.incrementAndGet();
            return NoEncryption.INSTANCE;
        });

        factory.forUser("alice");
        factory.forUser("alice");
        factory.forUser("bob");

        assertEquals(2, calls.get());
    }

    @Test
    void fallbackPasswords_nullLast_shouldEndWithNoEncryption() {
        var factory = CryptoFactory.fallbackPasswords(Arrays.asList("new", null));

        var crypto = assertInstanceOf(FallbackCrypto.class, factory.forUser("alice"));

        assertEquals(2, crypto.cryptos().size());
        assertSame(NoEncryption.INSTANCE, crypto.cryptos().get(1));
    }

    @Test
    void fallbackPasswords_nullBeforeLast_shouldBeRejectedEagerly() {
        assertThrows(IllegalArgumentException.class,
                () -> CryptoFactory.fallbackPasswords(Arrays.asList(null, "new")));
    }

    @Test
    void fallbackPasswords_empty_shouldBeRejected() {
        assertThrows(IllegalArgumentException.class,
                () -> CryptoFactory.fallbackPasswords(java.util.List.of()));
    }
}
