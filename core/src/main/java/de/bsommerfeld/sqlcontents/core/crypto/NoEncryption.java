package de.bsommerfeld.sqlcontents.core.crypto;

/**
 * Identity strategy. Decryption never fails, which is why it may only appear
 * last in a {@link FallbackCrypto}.
 */
public final class NoEncryption implements Crypto {

    public static final NoEncryption INSTANCE = new NoEncryption();

    private NoEncryption() {
    }

    @Override
    public byte[] encrypt(byte[] plaintext) {
        return plaintext;
    }

    @Override
    public byte[] decrypt(byte[] ciphertext) {
        return ciphertext;
    }

    @Override
    public String toString() {
        return "NoEncryption";
    }
}
