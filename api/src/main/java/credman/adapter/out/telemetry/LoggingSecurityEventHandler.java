package credman.adapter.out.telemetry;

import org.jboss.logging.Logger;

import credman.spi.SecurityEvent;
import credman.spi.SecurityEventHandler;

/**
 * Security event handler that logs events to the {@code credman.security} category.
 *
 * <p>Messages name the slot and the failure category only. Tenant identifiers
 * carried by an event are not logged.
 *
 * <p>Log levels follow event severity:
 * <ul>
 *   <li>INFO severity → INFO level</li>
 *   <li>WARNING severity → WARN level</li>
 *   <li>CRITICAL severity → ERROR level</li>
 * </ul>
 */
public class LoggingSecurityEventHandler implements SecurityEventHandler {

    private static final Logger LOG = Logger.getLogger("credman.security");

    @Override
    public String name() {
        return "logging";
    }

    @Override
    public int priority() {
        return 0;
    }

    @Override
    public void handle(SecurityEvent event) {
        final var message = formatEvent(event);
        switch (event.severity()) {
            case INFO -> LOG.info(message);
            case WARNING -> LOG.warn(message);
            case CRITICAL -> LOG.error(message);
        }
    }

    static String formatEvent(SecurityEvent event) {
        if (event instanceof SecurityEvent.TenantMismatch e) {
            return String.format("TENANT_MISMATCH: slot=%s", e.slot());
        }
        if (event instanceof SecurityEvent.RefreshFailed e) {
            return String.format("REFRESH_FAILED: slot=%s kind=%s", e.slot(), e.errorKind());
        }
        if (event instanceof SecurityEvent.SignInDenied e) {
            return String.format("SIGN_IN_DENIED: slot=%s", e.slot());
        }
        if (event instanceof SecurityEvent.StorageFailure e) {
            return String.format("STORAGE_ERROR: slot=%s operation=%s", e.slot(), e.operation());
        }
        if (event instanceof SecurityEvent.SignedOut e) {
            return String.format("SIGNED_OUT: slot=%s", e.slot());
        }
        return "SECURITY_EVENT: slot=" + event.slot();
    }
}
