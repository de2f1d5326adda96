package credman.adapter.out.telemetry;

import java.util.Locale;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;

import credman.spi.SecurityEvent;
import credman.spi.SecurityEventHandler;

/**
 * Security event handler that records events as Micrometer counters.
 *
 * <p>Metrics recorded:
 * <ul>
 *   <li>{@code credman.security.events.total} - all events by type, severity and slot</li>
 *   <li>{@code credman.security.tenant_mismatch} - rejected tokens by slot</li>
 *   <li>{@code credman.security.refresh.failures} - failed refreshes by slot and kind</li>
 *   <li>{@code credman.security.storage.failures} - storage failures by slot and operation</li>
 * </ul>
 */
public class MetricsSecurityEventHandler implements SecurityEventHandler {

    private MeterRegistry registry;

    public MetricsSecurityEventHandler() {
        // Default constructor for ServiceLoader
    }

    public MetricsSecurityEventHandler(MeterRegistry registry) {
        this.registry = registry;
    }

    /**
     * Called by the dispatcher after ServiceLoader instantiation.
     */
    public void setMeterRegistry(MeterRegistry registry) {
        this.registry = registry;
    }

    @Override
    public String name() {
        return "metrics";
    }

    @Override
    public int priority() {
        return 10;
    }

    @Override
    public boolean isAvailable() {
        return registry != null;
    }

    @Override
    public void handle(SecurityEvent event) {
        if (registry == null) {
            return;
        }

        Counter.builder("credman.security.events.total")
                .description("Total security events")
                .tag("event_type", event.getClass().getSimpleName())
                .tag("severity", event.severity().name().toLowerCase(Locale.ROOT))
                .tag("slot", event.slot())
                .register(registry)
                .increment();

        if (event instanceof SecurityEvent.TenantMismatch e) {
            Counter.builder("credman.security.tenant_mismatch")
                    .description("Tokens rejected for belonging to an unexpected tenant")
                    .tag("slot", e.slot())
                    .register(registry)
                    .increment();
        } else if (event instanceof SecurityEvent.RefreshFailed e) {
            Counter.builder("credman.security.refresh.failures")
                    .description("Failed token refreshes")
                    .tag("slot", e.slot())
                    .tag("kind", e.errorKind())
                    .register(registry)
                    .increment();
        } else if (event instanceof SecurityEvent.StorageFailure e) {
            Counter.builder("credman.security.storage.failures")
                    .description("Credential storage failures")
                    .tag("slot", e.slot())
                    .tag("operation", e.operation())
                    .register(registry)
                    .increment();
        }
    }
}
