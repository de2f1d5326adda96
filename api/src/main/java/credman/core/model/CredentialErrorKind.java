package credman.core.model;

/**
 * Failure categories surfaced by the credential manager.
 *
 * <p>The kind is the only failure detail that may be logged alongside a slot.
 */
public enum CredentialErrorKind {
    /** Network failure talking to the identity provider. Transient. */
    PROVIDER_UNREACHABLE,
    /** The identity provider answered with an error payload. */
    PROVIDER_REJECTED,
    /** A token was issued for a different tenant than requested. */
    TENANT_MISMATCH,
    /** The refresh-token exchange failed. The slot requires a new sign-in. */
    REFRESH_FAILED,
    /** Reading or writing encrypted credentials failed. */
    STORAGE_ERROR,
    /** The caller supplied invalid input. */
    INVALID_REQUEST,
    /** No device code session with the given handle exists for the slot. */
    UNKNOWN_SESSION,
    /** A device code session is already in flight for the slot. */
    ALREADY_AUTHENTICATING,
    /** The slot holds no usable credentials. */
    NOT_AUTHENTICATED,
    /** The caller polled before the session's poll interval elapsed. */
    RATE_LIMITED
}
