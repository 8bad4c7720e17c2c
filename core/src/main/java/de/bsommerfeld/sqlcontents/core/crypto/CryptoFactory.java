package de.bsommerfeld.sqlcontents.core.crypto;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Resolves the {@link Crypto} to use for a given user. Keys are derived per
 * user, so a single configured password yields a distinct key for everyone.
 *
 * <p>
 * The password-based factories memoize their result per user id: PBKDF2 with
 * 100k iterations is deliberately slow and must not run on every request.
 */
@FunctionalInterface
public interface CryptoFactory {

    Crypto forUser(String userId);

    /** Every user gets {@link NoEncryption}. */
    static CryptoFactory noEncryption() {
        return userId -> NoEncryption.INSTANCE;
    }

    /** Every user gets a {@link SingleKeyEncryption} derived from {@code password}. */
    static CryptoFactory singlePassword(String password) {
        return memoized(userId -> SingleKeyEncryption.fromPassword(password, userId));
    }

    /**
     * Every user gets a {@link FallbackCrypto} over keys derived from
     * {@code passwords}, in order. A {@code null} entry stands for
     * {@link NoEncryption} and is only legal as the last entry.
     */
    static CryptoFactory fallbackPasswords(List<String> passwords) {
        List<String> copy = new ArrayList<>(passwords);
        if (copy.isEmpty()) {
            throw new IllegalArgumentException("At least one password is required");
        }
        if (copy.subList(0, copy.size() - 1).contains(null)) {
            throw new IllegalArgumentException("NoEncryption is only supported as the last fallback.");
        }
        return memoized(userId -> {
            List<Crypto> cryptos = new ArrayList<>(copy.size());
            for (String password : copy) {
                cryptos.add(password == null
                        ? NoEncryption.INSTANCE
                        : SingleKeyEncryption.fromPassword(password, userId));
            }
            return new FallbackCrypto(cryptos);
        });
    }

    /** Caches the delegate's result per user id for the lifetime of the factory. */
    static CryptoFactory memoized(CryptoFactory delegate) {
        Map<String, Crypto> cache = new ConcurrentHashMap<>();
        return userId -> cache.computeIfAbsent(userId, delegate::forUser);
    }
}
