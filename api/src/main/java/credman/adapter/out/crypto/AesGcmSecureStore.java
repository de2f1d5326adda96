package credman.adapter.out.crypto;

import java.nio.BufferUnderflowException;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.SecureRandom;
import java.util.Base64;
import java.util.Optional;
import javax.crypto.Cipher;
import javax.crypto.SecretKey;
import javax.crypto.spec.GCMParameterSpec;
import javax.crypto.spec.SecretKeySpec;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import credman.core.model.SecureStoreException;
import credman.core.port.out.SecureStore;

/**
 * AES-256-GCM encryption of credential records at rest.
 *
 * <p>Every encryption uses a fresh random IV, so encrypting the same record
 * twice yields different ciphertext. The GCM tag makes tampering detectable.
 *
 * <h2>Configuration</h2>
 * <pre>
 * credman.encryption.key=${CREDMAN_ENCRYPTION_KEY}  # Base64-encoded 256-bit key
 * credman.encryption.key-id=v1
 * </pre>
 *
 * <p>Without a configured key an ephemeral key is generated, and stored
 * credentials become unreadable after a restart.
 *
 * <h2>Encrypted Data Format</h2>
 * <pre>
 * [keyIdLength (1 byte)][keyId (variable)][IV (12 bytes)][ciphertext][authTag (16 bytes)]
 * </pre>
 */
@ApplicationScoped
public class AesGcmSecureStore implements SecureStore {

    private static final Logger LOG = Logger.getLogger(AesGcmSecureStore.class);

    private static final String ALGORITHM = "AES/GCM/NoPadding";
    private static final int KEY_LENGTH = 32;
    private static final int IV_LENGTH = 12;
    private static final int TAG_LENGTH_BITS = 128;

    private final SecretKey secretKey;
    private final String keyId;
    private final byte[] keyIdBytes;
    private final SecureRandom secureRandom;

    @Inject
    public AesGcmSecureStore(
            @ConfigProperty(name = "credman.encryption.key") Optional<String> encryptionKey,
            @ConfigProperty(name = "credman.encryption.key-id", defaultValue = "v1") String keyId) {
        this.secureRandom = new SecureRandom();
        this.keyId = keyId;
        this.keyIdBytes = keyId.getBytes(StandardCharsets.UTF_8);
        if (keyIdBytes.length == 0 || keyIdBytes.length > 255) {
            throw new IllegalArgumentException("Encryption key ID must be 1 to 255 bytes");
        }

        if (encryptionKey.isPresent() && !encryptionKey.get().isBlank()) {
            final byte[] keyBytes = Base64.getDecoder().decode(encryptionKey.get().trim());
            if (keyBytes.length != KEY_LENGTH) {
                throw new IllegalArgumentException(
                        "Encryption key must be 256 bits (32 bytes). Got: " + keyBytes.length + " bytes");
            }
            this.secretKey = new SecretKeySpec(keyBytes, "AES");
            LOG.infof("Credential encryption enabled with key ID: %s", keyId);
        } else {
            final byte[] keyBytes = new byte[KEY_LENGTH];
            secureRandom.nextBytes(keyBytes);
            this.secretKey = new SecretKeySpec(keyBytes, "AES");
            LOG.warn("No credman.encryption.key configured. Using an ephemeral key; "
                    + "stored credentials will not survive a restart.");
        }
    }

    @Override
    public byte[] encrypt(byte[] plaintext) {
        try {
            final byte[] iv = new byte[IV_LENGTH];
            secureRandom.nextBytes(iv);

            final Cipher cipher = Cipher.getInstance(ALGORITHM);
            cipher.init(Cipher.ENCRYPT_MODE, secretKey, new GCMParameterSpec(TAG_LENGTH_BITS, iv));
            final byte[] ciphertext = cipher.doFinal(plaintext);

            final ByteBuffer buffer = ByteBuffer.allocate(1 + keyIdBytes.length + IV_LENGTH + ciphertext.length);
            buffer.put((byte) keyIdBytes.length);
            buffer.put(keyIdBytes);
            buffer.put(iv);
            buffer.put(ciphertext);
            return buffer.array();
        } catch (GeneralSecurityException e) {
            throw new SecureStoreException("Failed to encrypt credentials", e);
        }
    }

    @Override
    public byte[] decrypt(byte[] data) {
        try {
            final ByteBuffer buffer = ByteBuffer.wrap(data);

            final int keyIdLength = buffer.get() & 0xFF;
            final byte[] dataKeyId = new byte[keyIdLength];
            buffer.get(dataKeyId);
            final String dataKeyIdValue = new String(dataKeyId, StandardCharsets.UTF_8);
            if (!keyId.equals(dataKeyIdValue)) {
                throw new SecureStoreException(
                        "Credentials were encrypted with key " + dataKeyIdValue + ", current key is " + keyId);
            }

            final byte[] iv = new byte[IV_LENGTH];
            buffer.get(iv);
            final byte[] ciphertext = new byte[buffer.remaining()];
            buffer.get(ciphertext);

            final Cipher cipher = Cipher.getInstance(ALGORITHM);
            cipher.init(Cipher.DECRYPT_MODE, secretKey, new GCMParameterSpec(TAG_LENGTH_BITS, iv));
            return cipher.doFinal(ciphertext);
        } catch (BufferUnderflowException e) {
            throw new SecureStoreException("Encrypted credentials are truncated", e);
        } catch (GeneralSecurityException e) {
            throw new SecureStoreException("Failed to decrypt credentials", e);
        }
    }

    /**
     * Generate a new encryption key for {@code credman.encryption.key}.
     *
     * @return Base64-encoded 256-bit key
     */
    public static String generateKey() {
        final byte[] key = new byte[KEY_LENGTH];
        new SecureRandom().nextBytes(key);
        return Base64.getEncoder().encodeToString(key);
    }
}
