package credman.core.port.out;

import java.util.Optional;

import io.smallrye.mutiny.Uni;

import credman.core.model.TenantSlot;
import credman.core.model.TokenRecord;

/**
 * Slot-namespaced persistence of token records.
 *
 * <p>Every read decrypts and returns a fresh record. Failures surface as
 * {@link credman.core.model.CredentialException} with kind STORAGE_ERROR.
 */
public interface TokenRecordRepository {

    /**
     * Store the record for a slot, replacing only that slot's record.
     */
    Uni<Void> put(TenantSlot slot, TokenRecord record);

    /**
     * Read the record for a slot.
     *
     * @return the record, or empty if none is stored
     */
    Uni<Optional<TokenRecord>> get(TenantSlot slot);

    /**
     * Remove everything stored under the slot's namespace. Succeeds when nothing is stored.
     */
    Uni<Void> clear(TenantSlot slot);
}
