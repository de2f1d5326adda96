package credman.core.port.in;

import java.util.Map;
import java.util.Optional;

import io.smallrye.mutiny.Uni;

import credman.core.model.DeviceCodeSession;
import credman.core.model.DeviceCodeStatus;
import credman.core.model.SlotStatus;
import credman.core.model.TenantSlot;
import credman.core.model.TokenRecord;

/**
 * Inbound port for managing the credentials of both tenant slots.
 *
 * <p>All failures are reported as {@link credman.core.model.CredentialException}.
 */
public interface CredentialManagement {

    /**
     * Start a device code sign-in for a slot.
     *
     * @param slot     slot to authenticate
     * @param tenantId tenant the issued token must belong to; must agree with the configured tenant, if any
     * @return the session the user must complete
     */
    Uni<DeviceCodeSession> signIn(TenantSlot slot, Optional<String> tenantId);

    /**
     * Check a sign-in session, polling the provider at most once.
     *
     * @param slot      slot the session belongs to
     * @param sessionId handle returned by {@link #signIn}
     * @return the session status
     */
    Uni<DeviceCodeStatus> checkStatus(TenantSlot slot, String sessionId);

    /**
     * Get a usable access token, refreshing it first if it expires soon.
     */
    Uni<TokenRecord> getToken(TenantSlot slot);

    /**
     * Refresh the slot's token. Concurrent calls for the same slot share one provider call.
     */
    Uni<TokenRecord> refresh(TenantSlot slot);

    /**
     * Forget all credentials and any sign-in session for a slot. Idempotent.
     */
    Uni<Void> signOut(TenantSlot slot);

    /**
     * Sign out of both slots.
     */
    Uni<Void> signOutAll();

    /**
     * Current status of a slot.
     */
    Uni<SlotStatus> status(TenantSlot slot);

    /**
     * Current status of every slot.
     */
    Uni<Map<TenantSlot, SlotStatus>> statuses();
}
