package credman.core.model;

import java.time.Instant;
import java.util.Optional;

/**
 * Summary of one slot for status reporting and feature gating.
 *
 * @param slot      the slot
 * @param state     derived authentication state
 * @param user      signed-in user, when credentials are stored
 * @param tenantId  tenant of the stored credentials
 * @param expiresAt expiry of the stored access token
 * @param error     human-readable message when {@code state} is ERROR or EXPIRED
 */
public record SlotStatus(
        TenantSlot slot,
        AuthState state,
        Optional<String> user,
        Optional<String> tenantId,
        Optional<Instant> expiresAt,
        Optional<String> error) {

    public SlotStatus {
        if (user == null) {
            user = Optional.empty();
        }
        if (tenantId == null) {
            tenantId = Optional.empty();
        }
        if (expiresAt == null) {
            expiresAt = Optional.empty();
        }
        if (error == null) {
            error = Optional.empty();
        }
    }

    public static SlotStatus of(TenantSlot slot, AuthState state) {
        return new SlotStatus(slot, state, Optional.empty(), Optional.empty(), Optional.empty(), Optional.empty());
    }

    public static SlotStatus failed(TenantSlot slot, AuthState state, String error) {
        return new SlotStatus(slot, state, Optional.empty(), Optional.empty(), Optional.empty(), Optional.of(error));
    }

    public static SlotStatus withRecord(TenantSlot slot, AuthState state, TokenRecord record) {
        return new SlotStatus(
                slot,
                state,
                Optional.of(record.user()),
                Optional.of(record.tenantId()),
                Optional.of(record.expiresAt()),
                Optional.empty());
    }

    /**
     * Dependent features must refuse to operate unless this returns true.
     */
    public boolean isAuthenticated() {
        return state == AuthState.AUTHENTICATED;
    }
}
