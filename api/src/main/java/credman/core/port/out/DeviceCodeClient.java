package credman.core.port.out;

import java.util.Optional;

import io.smallrye.mutiny.Uni;

import credman.core.model.DeviceCodeSession;
import credman.core.model.IssuedTokens;
import credman.core.model.PollOutcome;
import credman.core.model.TenantSlot;

/**
 * Client for the identity provider's device authorization and token endpoints.
 *
 * <p>Implementations map transport failures to PROVIDER_UNREACHABLE and error
 * payloads to PROVIDER_REJECTED. Raw provider payloads never leave the adapter.
 */
public interface DeviceCodeClient {

    /**
     * Request a device code for a slot.
     *
     * @param slot     slot being authenticated
     * @param tenantId tenant to authenticate against, or empty for the default authority
     * @return a new session; nothing is persisted
     */
    Uni<DeviceCodeSession> start(TenantSlot slot, Optional<String> tenantId);

    /**
     * Poll the token endpoint once with the session's device code.
     */
    Uni<PollOutcome> poll(DeviceCodeSession session);

    /**
     * Exchange a refresh token for new tokens.
     *
     * @param refreshToken the stored refresh token
     * @param slot         slot the token belongs to
     * @param tenantId     tenant the token was issued for
     * @return new tokens, including a rotated refresh token if the provider issued one
     */
    Uni<IssuedTokens> refresh(String refreshToken, TenantSlot slot, String tenantId);
}
