package credman.adapter.out.telemetry;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;

import java.time.Instant;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import credman.spi.SecurityEvent;

@DisplayName("LoggingSecurityEventHandler")
class LoggingSecurityEventHandlerTest {

    private static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");

    @Test
    @DisplayName("should not log tenant identifiers of a mismatch")
    void shouldOmitTenantIds() {
        final var message = LoggingSecurityEventHandler.formatEvent(
                new SecurityEvent.TenantMismatch(NOW, "source", "tenant-expected", "tenant-actual"));

        assertEquals("TENANT_MISMATCH: slot=source", message);
        assertFalse(message.contains("tenant-actual"));
    }

    @Test
    @DisplayName("should include the error kind of a failed refresh")
    void shouldIncludeRefreshKind() {
        assertEquals(
                "REFRESH_FAILED: slot=target kind=REFRESH_FAILED",
                LoggingSecurityEventHandler.formatEvent(new SecurityEvent.RefreshFailed(NOW, "target", "REFRESH_FAILED")));
    }

    @Test
    @DisplayName("should include the storage operation")
    void shouldIncludeStorageOperation() {
        assertEquals(
                "STORAGE_ERROR: slot=source operation=read",
                LoggingSecurityEventHandler.formatEvent(new SecurityEvent.StorageFailure(NOW, "source", "read")));
    }

    @Test
    @DisplayName("should handle every event type without failing")
    void shouldHandleEveryEventType() {
        final var handler = new LoggingSecurityEventHandler();

        handler.handle(new SecurityEvent.SignInDenied(NOW, "source"));
        handler.handle(new SecurityEvent.SignedOut(NOW, "target"));
        handler.handle(new SecurityEvent.TenantMismatch(NOW, "source", "a", "b"));

        assertEquals("logging", handler.name());
    }
}
