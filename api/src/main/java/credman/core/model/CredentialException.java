package credman.core.model;

import java.util.Optional;

/**
 * Typed failure raised by credential operations.
 *
 * <p>Messages are fixed, caller-safe strings. They never contain token
 * material, device codes or raw provider payloads.
 */
public class CredentialException extends RuntimeException {

    private final CredentialErrorKind kind;
    private final TenantSlot slot;
    private final Long retryAfterSeconds;

    public CredentialException(CredentialErrorKind kind, TenantSlot slot, String message) {
        this(kind, slot, message, null, null);
    }

    public CredentialException(CredentialErrorKind kind, TenantSlot slot, String message, Throwable cause) {
        this(kind, slot, message, null, cause);
    }

    private CredentialException(
            CredentialErrorKind kind, TenantSlot slot, String message, Long retryAfterSeconds, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.slot = slot;
        this.retryAfterSeconds = retryAfterSeconds;
    }

    public static CredentialException providerUnreachable(TenantSlot slot, Throwable cause) {
        return new CredentialException(
                CredentialErrorKind.PROVIDER_UNREACHABLE, slot, "Identity provider is unreachable", cause);
    }

    public static CredentialException providerRejected(TenantSlot slot) {
        return new CredentialException(
                CredentialErrorKind.PROVIDER_REJECTED, slot, "Identity provider rejected the request");
    }

    public static CredentialException refreshFailed(TenantSlot slot) {
        return new CredentialException(
                CredentialErrorKind.REFRESH_FAILED, slot, "Token refresh failed, sign in again");
    }

    public static CredentialException tenantMismatch(TenantSlot slot) {
        return new CredentialException(
                CredentialErrorKind.TENANT_MISMATCH, slot, "Stored credentials belong to a different tenant");
    }

    public static CredentialException storageError(TenantSlot slot, Throwable cause) {
        return new CredentialException(
                CredentialErrorKind.STORAGE_ERROR, slot, "Credential storage is unavailable", cause);
    }

    public static CredentialException invalidRequest(String message) {
        return new CredentialException(CredentialErrorKind.INVALID_REQUEST, null, message);
    }

    public static CredentialException unknownSession(TenantSlot slot) {
        return new CredentialException(
                CredentialErrorKind.UNKNOWN_SESSION, slot, "No sign-in session with that handle exists");
    }

    public static CredentialException alreadyAuthenticating(TenantSlot slot) {
        return new CredentialException(
                CredentialErrorKind.ALREADY_AUTHENTICATING, slot, "Sign-in already in progress for " + slot);
    }

    public static CredentialException notAuthenticated(TenantSlot slot) {
        return new CredentialException(
                CredentialErrorKind.NOT_AUTHENTICATED, slot, "Not authenticated to the " + slot + " tenant");
    }

    public static CredentialException expired(TenantSlot slot) {
        return new CredentialException(
                CredentialErrorKind.NOT_AUTHENTICATED, slot, "Credentials for the " + slot + " tenant have expired");
    }

    public static CredentialException rateLimited(TenantSlot slot, long retryAfterSeconds) {
        return new CredentialException(
                CredentialErrorKind.RATE_LIMITED,
                slot,
                "Polling too frequently, retry after %d seconds".formatted(retryAfterSeconds),
                retryAfterSeconds,
                null);
    }

    public CredentialErrorKind kind() {
        return kind;
    }

    public Optional<TenantSlot> slot() {
        return Optional.ofNullable(slot);
    }

    public Optional<Long> retryAfterSeconds() {
        return Optional.ofNullable(retryAfterSeconds);
    }
}
