package credman.adapter.out.storage;

import java.io.IOException;
import java.time.Instant;
import java.util.Arrays;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import credman.core.config.StorageConfig;
import credman.core.model.CredentialException;
import credman.core.model.TenantSlot;
import credman.core.model.TokenRecord;
import credman.core.port.out.CredentialStorage;
import credman.core.port.out.SecureStore;
import credman.core.port.out.TokenRecordRepository;

/**
 * Token record repository that encrypts records before they reach storage.
 *
 * <p>Records are serialized to JSON together with the slot they belong to,
 * encrypted with the {@link SecureStore} and written under the slot's
 * {@link SlotKeys}. A decrypted record naming a different slot is rejected.
 *
 * <p>Every failure, including corrupt or undecryptable data, is reported as
 * STORAGE_ERROR for the affected slot only.
 */
@ApplicationScoped
public class EncryptedTokenRecordRepository implements TokenRecordRepository {

    private static final Logger LOG = Logger.getLogger(EncryptedTokenRecordRepository.class);

    private static final ObjectMapper OBJECT_MAPPER =
            new ObjectMapper().configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    private static final int FORMAT_VERSION = 1;

    private final CredentialStorage storage;
    private final SecureStore secureStore;
    private final Map<TenantSlot, SlotKeys> keys = new EnumMap<>(TenantSlot.class);

    @Inject
    public EncryptedTokenRecordRepository(CredentialStorage storage, SecureStore secureStore, StorageConfig config) {
        this.storage = storage;
        this.secureStore = secureStore;
        for (var slot : TenantSlot.values()) {
            keys.put(slot, SlotKeys.of(config.keyPrefix(), slot));
        }
    }

    @Override
    public Uni<Void> put(TenantSlot slot, TokenRecord record) {
        return Uni.createFrom()
                .item(() -> encrypt(slot, record))
                .flatMap(ciphertext -> storage.put(keys.get(slot).record(), ciphertext))
                .onItem()
                .invoke(() -> LOG.debugf("Stored credentials for slot %s", slot))
                .onFailure(e -> !(e instanceof CredentialException))
                .transform(e -> CredentialException.storageError(slot, e));
    }

    @Override
    public Uni<Optional<TokenRecord>> get(TenantSlot slot) {
        return storage.get(keys.get(slot).record())
                .map(found -> found.map(ciphertext -> decrypt(slot, ciphertext)))
                .onFailure(e -> !(e instanceof CredentialException))
                .transform(e -> CredentialException.storageError(slot, e));
    }

    @Override
    public Uni<Void> clear(TenantSlot slot) {
        final var namespace = keys.get(slot).namespace();
        return storage.keys(namespace)
                .flatMap(found -> {
                    if (found.isEmpty()) {
                        return Uni.createFrom().voidItem();
                    }
                    return Uni.join()
                            .all(found.stream().map(storage::delete).toList())
                            .andFailFast()
                            .replaceWithVoid();
                })
                .onItem()
                .invoke(() -> LOG.debugf("Cleared credentials for slot %s", slot))
                .onFailure(e -> !(e instanceof CredentialException))
                .transform(e -> CredentialException.storageError(slot, e));
    }

    private byte[] encrypt(TenantSlot slot, TokenRecord record) {
        final var stored = new StoredTokenRecord(
                FORMAT_VERSION,
                slot.id(),
                record.accessToken(),
                record.refreshToken(),
                record.expiresAt().toEpochMilli(),
                record.tenantId(),
                record.user());
        byte[] plaintext = null;
        try {
            plaintext = OBJECT_MAPPER.writeValueAsBytes(stored);
            return secureStore.encrypt(plaintext);
        } catch (IOException e) {
            LOG.debugf("Could not serialize record for slot %s: %s", slot, e.getClass().getSimpleName());
            throw CredentialException.storageError(slot, null);
        } finally {
            if (plaintext != null) {
                Arrays.fill(plaintext, (byte) 0);
            }
        }
    }

    private TokenRecord decrypt(TenantSlot slot, byte[] ciphertext) {
        final byte[] plaintext = secureStore.decrypt(ciphertext);
        try {
            final var stored = OBJECT_MAPPER.readValue(plaintext, StoredTokenRecord.class);
            if (!slot.id().equals(stored.slot())) {
                LOG.warnf("Stored record under slot %s names a different slot", slot);
                throw CredentialException.storageError(slot, null);
            }
            return new TokenRecord(
                    stored.accessToken(),
                    stored.refreshToken(),
                    Instant.ofEpochMilli(stored.expiresAt()),
                    stored.tenantId(),
                    stored.user());
        } catch (IOException | IllegalArgumentException e) {
            // parser messages may quote plaintext, so the cause is not kept
            LOG.debugf("Could not parse record for slot %s: %s", slot, e.getClass().getSimpleName());
            throw CredentialException.storageError(slot, null);
        } finally {
            Arrays.fill(plaintext, (byte) 0);
        }
    }

    /**
     * Serialized form of a token record.
     */
    record StoredTokenRecord(
            int version,
            String slot,
            String accessToken,
            String refreshToken,
            long expiresAt,
            String tenantId,
            String user) {}
}
