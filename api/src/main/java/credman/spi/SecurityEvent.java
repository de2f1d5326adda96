package credman.spi;

import java.time.Instant;

/**
 * Sealed interface representing security events raised while managing credentials.
 *
 * <p>Events identify the slot, tenants and failure category only. No event
 * type has a field able to hold a token, device code or provider payload.
 *
 * <p>Event types:
 * <ul>
 *   <li>{@link TenantMismatch} - token issued for an unexpected tenant</li>
 *   <li>{@link RefreshFailed} - refresh-token exchange failed</li>
 *   <li>{@link SignInDenied} - user declined a device code sign-in</li>
 *   <li>{@link StorageFailure} - encrypted storage could not be read or written</li>
 *   <li>{@link SignedOut} - credentials for a slot were removed</li>
 * </ul>
 */
public sealed interface SecurityEvent {

    Instant timestamp();

    /**
     * Slot identifier ("source" or "target").
     */
    String slot();

    Severity severity();

    /**
     * Severity levels for security events.
     */
    enum Severity {
        /** Informational events (e.g., sign-out). */
        INFO,
        /** Events requiring attention (e.g., failed refresh). */
        WARNING,
        /** Events indicating a possible attack or misconfiguration. */
        CRITICAL
    }

    /**
     * A token was issued for, or stored under, a different tenant than expected.
     *
     * @param timestamp        when the mismatch was detected
     * @param slot             affected slot
     * @param expectedTenantId tenant the slot is bound to
     * @param actualTenantId   tenant found in the token
     */
    record TenantMismatch(Instant timestamp, String slot, String expectedTenantId, String actualTenantId)
            implements SecurityEvent {

        @Override
        public Severity severity() {
            return Severity.CRITICAL;
        }
    }

    /**
     * A refresh-token exchange failed.
     *
     * @param timestamp when the refresh failed
     * @param slot      affected slot
     * @param errorKind failure category
     */
    record RefreshFailed(Instant timestamp, String slot, String errorKind) implements SecurityEvent {

        @Override
        public Severity severity() {
            return Severity.WARNING;
        }
    }

    /**
     * The user declined a device code sign-in.
     *
     * @param timestamp when the denial was observed
     * @param slot      affected slot
     */
    record SignInDenied(Instant timestamp, String slot) implements SecurityEvent {

        @Override
        public Severity severity() {
            return Severity.INFO;
        }
    }

    /**
     * Reading or writing encrypted credentials failed.
     *
     * @param timestamp when the failure occurred
     * @param slot      affected slot
     * @param operation storage operation ("read", "write" or "clear")
     */
    record StorageFailure(Instant timestamp, String slot, String operation) implements SecurityEvent {

        @Override
        public Severity severity() {
            return Severity.WARNING;
        }
    }

    /**
     * Credentials for a slot were removed.
     *
     * @param timestamp when sign-out completed
     * @param slot      affected slot
     */
    record SignedOut(Instant timestamp, String slot) implements SecurityEvent {

        @Override
        public Severity severity() {
            return Severity.INFO;
        }
    }
}
