package de.bsommerfeld.sqlcontents.core.crypto;

import de.bsommerfeld.sqlcontents.core.error.CorruptedFileException;

/**
 * Encryption strategy applied to file and checkpoint content on its way into
 * and out of the database. The stores never interpret stored bytes; they only
 * hand them to {@link #decrypt} and size-check the output of
 * {@link #encrypt}.
 *
 * <p>
 * The variant set is closed:
 * <ul>
 * <li>{@link NoEncryption}: identity</li>
 * <li>{@link SingleKeyEncryption}: one AES-256-GCM key</li>
 * <li>{@link FallbackCrypto}: ordered list used during key rotation</li>
 * </ul>
 * Closing it lets {@link FallbackCrypto} check its placement rule at
 * construction time.
 */
public sealed interface Crypto permits NoEncryption, SingleKeyEncryption, FallbackCrypto {

    byte[] encrypt(byte[] plaintext);

    /**
     * @throws CorruptedFileException if {@code ciphertext} cannot be
     *                                authenticated or decoded
     */
    byte[] decrypt(byte[] ciphertext);
}
