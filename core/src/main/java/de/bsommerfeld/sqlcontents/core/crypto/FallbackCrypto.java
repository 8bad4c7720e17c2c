package de.bsommerfeld.sqlcontents.core.crypto;

import de.bsommerfeld.sqlcontents.core.error.CorruptedFileException;

import java.util.ArrayList;
import java.util.List;

/**
 * Ordered list of strategies for key rotation. {@link #encrypt} always uses
 * the first entry; {@link #decrypt} tries every entry in order and returns the
 * first success.
 *
 * <p>
 * {@link NoEncryption} accepts any input, so it is only allowed as the last
 * entry. Anything after it could never be reached.
 */
public final class FallbackCrypto implements Crypto {

    private final List<Crypto> cryptos;

    /**
     * @throws IllegalArgumentException if the list is empty or contains a
     *                                  {@link NoEncryption} before its last
     *                                  position
     */
    public FallbackCrypto(List<? extends Crypto> cryptos) {
        if (cryptos == null || cryptos.isEmpty()) {
            throw new IllegalArgumentException("FallbackCrypto needs at least one strategy");
        }
        for (int i = 0; i < cryptos.size() - 1; i++) {
            if (cryptos.get(i) instanceof NoEncryption) {
                throw new IllegalArgumentException("NoEncryption is only supported as the last fallback.");
            }
        }
        this.cryptos = List.copyOf(cryptos);
    }

    public static FallbackCrypto of(Crypto... cryptos) {
        return new FallbackCrypto(List.of(cryptos));
    }

    public List<Crypto> cryptos() {
        return cryptos;
    }

    @Override
    public byte[] encrypt(byte[] plaintext) {
        return cryptos.get(0).encrypt(plaintext);
    }

    @Override
    public byte[] decrypt(byte[] ciphertext) {
        List<CorruptedFileException> errors = new ArrayList<>(cryptos.size());
        for (Crypto crypto : cryptos) {
            try {
                return crypto.decrypt(ciphertext);
            } catch (CorruptedFileException e) {
                errors.add(e);
            }
        }
        CorruptedFileException aggregate = new CorruptedFileException(
                "None of " + cryptos.size() + " strategies could decrypt the content");
        errors.forEach(aggregate::addSuppressed);
        throw aggregate;
    }

    @Override
    public String toString() {
        return "FallbackCrypto" + cryptos;
    }
}
