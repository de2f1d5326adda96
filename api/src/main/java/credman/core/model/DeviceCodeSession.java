package credman.core.model;

import java.time.Instant;
import java.util.Optional;

/**
 * An in-flight device authorization request for one slot.
 *
 * <p>The device code authenticates polling requests and is never exposed to
 * callers of the HTTP facade; callers refer to the session by {@link #id()}.
 *
 * @param id                  public handle returned to the caller
 * @param slot                slot being authenticated
 * @param deviceCode          provider device code (secret)
 * @param userCode            code the user enters at the verification URI
 * @param verificationUri     where the user completes sign-in
 * @param message             provider instructions for the user
 * @param expiresAt           provider-issued expiry of the device code
 * @param pollIntervalSeconds minimum seconds between polls
 * @param expectedTenantId    tenant the issued token must belong to, if known
 * @param authorityTenant     tenant segment used on provider endpoints
 */
public record DeviceCodeSession(
        String id,
        TenantSlot slot,
        String deviceCode,
        String userCode,
        String verificationUri,
        String message,
        Instant expiresAt,
        int pollIntervalSeconds,
        Optional<String> expectedTenantId,
        String authorityTenant) {

    public DeviceCodeSession {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Session ID is required");
        }
        if (slot == null) {
            throw new IllegalArgumentException("Slot is required");
        }
        if (deviceCode == null || deviceCode.isBlank()) {
            throw new IllegalArgumentException("Device code is required");
        }
        if (userCode == null || userCode.isBlank()) {
            throw new IllegalArgumentException("User code is required");
        }
        if (expiresAt == null) {
            throw new IllegalArgumentException("Expiry is required");
        }
        if (pollIntervalSeconds <= 0) {
            throw new IllegalArgumentException("Poll interval must be positive");
        }
        if (expectedTenantId == null) {
            expectedTenantId = Optional.empty();
        }
        if (message == null) {
            message = "";
        }
    }

    public boolean isExpired(Instant now) {
        return !expiresAt.isAfter(now);
    }

    /**
     * Copy of this session with a longer poll interval (provider asked to slow down).
     */
    public DeviceCodeSession withPollInterval(int seconds) {
        return new DeviceCodeSession(
                id,
                slot,
                deviceCode,
                userCode,
                verificationUri,
                message,
                expiresAt,
                seconds,
                expectedTenantId,
                authorityTenant);
    }

    @Override
    public String toString() {
        return "DeviceCodeSession[id=" + id + ", slot=" + slot + ", expiresAt=" + expiresAt
                + ", pollIntervalSeconds=" + pollIntervalSeconds + "]";
    }
}
