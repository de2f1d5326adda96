package credman.core.model;

/**
 * Authentication state of a slot, derived from stored credentials and any
 * in-flight device code session. Never persisted.
 */
public enum AuthState {
    NOT_AUTHENTICATED,
    AUTHENTICATING,
    AUTHENTICATED,
    EXPIRED,
    ERROR
}
