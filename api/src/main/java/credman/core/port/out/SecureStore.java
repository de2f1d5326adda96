package credman.core.port.out;

import credman.core.model.SecureStoreException;

/**
 * Authenticated encryption for credential material at rest.
 *
 * <p>Only the token record repository calls this port. Decrypted bytes must
 * never be cached by implementations.
 */
public interface SecureStore {

    /**
     * Encrypt plaintext bytes.
     *
     * @param plaintext bytes to protect
     * @return self-describing ciphertext
     */
    byte[] encrypt(byte[] plaintext);

    /**
     * Decrypt ciphertext produced by {@link #encrypt(byte[])}.
     *
     * @param ciphertext protected bytes
     * @return the plaintext
     * @throws SecureStoreException if the ciphertext is corrupt, was tampered with,
     *         or was written with an unknown key
     */
    byte[] decrypt(byte[] ciphertext);
}
