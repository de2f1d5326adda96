package credman.adapter.out.telemetry;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Instant;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import credman.spi.SecurityEvent;

@DisplayName("MetricsSecurityEventHandler")
class MetricsSecurityEventHandlerTest {

    private static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");

    private SimpleMeterRegistry registry;
    private MetricsSecurityEventHandler handler;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        handler = new MetricsSecurityEventHandler(registry);
    }

    @Test
    @DisplayName("should be unavailable without a registry")
    void shouldBeUnavailableWithoutRegistry() {
        assertFalse(new MetricsSecurityEventHandler().isAvailable());
        assertTrue(handler.isAvailable());
    }

    @Test
    @DisplayName("should count every event by type and slot")
    void shouldCountEvents() {
        handler.handle(new SecurityEvent.SignedOut(NOW, "source"));
        handler.handle(new SecurityEvent.SignedOut(NOW, "source"));

        var counter = registry.find("credman.security.events.total")
                .tag("event_type", "SignedOut")
                .tag("slot", "source")
                .tag("severity", "info")
                .counter();
        assertEquals(2.0, counter.count());
    }

    @Test
    @DisplayName("should count tenant mismatches")
    void shouldCountTenantMismatches() {
        handler.handle(new SecurityEvent.TenantMismatch(NOW, "target", "expected", "actual"));

        assertEquals(
                1.0,
                registry.find("credman.security.tenant_mismatch")
                        .tag("slot", "target")
                        .counter()
                        .count());
    }

    @Test
    @DisplayName("should count refresh failures by kind")
    void shouldCountRefreshFailures() {
        handler.handle(new SecurityEvent.RefreshFailed(NOW, "source", "PROVIDER_REJECTED"));

        assertEquals(
                1.0,
                registry.find("credman.security.refresh.failures")
                        .tag("kind", "PROVIDER_REJECTED")
                        .counter()
                        .count());
        assertNull(registry.find("credman.security.storage.failures").counter());
    }

    @Test
    @DisplayName("should count storage failures by operation")
    void shouldCountStorageFailures() {
        handler.handle(new SecurityEvent.StorageFailure(NOW, "target", "write"));

        assertEquals(
                1.0,
                registry.find("credman.security.storage.failures")
                        .tag("operation", "write")
                        .counter()
                        .count());
    }
}
