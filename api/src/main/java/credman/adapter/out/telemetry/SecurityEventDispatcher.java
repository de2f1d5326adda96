package credman.adapter.out.telemetry;

import java.util.Comparator;
import java.util.List;
import java.util.ServiceLoader;
import java.util.concurrent.Executor;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.micrometer.core.instrument.MeterRegistry;
import io.smallrye.mutiny.infrastructure.Infrastructure;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import credman.core.port.out.SecurityEventPublisher;
import credman.spi.SecurityEvent;
import credman.spi.SecurityEventHandler;

/**
 * Publishes security events to the handlers registered through {@link ServiceLoader}.
 *
 * <p>Handlers run in priority order (highest first) on the Mutiny worker pool,
 * so credential operations never wait for them. A failing handler does not
 * keep the event from the others.
 */
@ApplicationScoped
public class SecurityEventDispatcher implements SecurityEventPublisher {

    private static final Logger LOG = Logger.getLogger(SecurityEventDispatcher.class);

    private final List<SecurityEventHandler> handlers;
    private final Executor executor;

    @Inject
    public SecurityEventDispatcher(
            MeterRegistry meterRegistry,
            @ConfigProperty(name = "credman.security-events.enabled", defaultValue = "true") boolean enabled) {
        this(meterRegistry, enabled, Infrastructure.getDefaultWorkerPool());
    }

    SecurityEventDispatcher(MeterRegistry meterRegistry, boolean enabled, Executor executor) {
        this.executor = executor;
        this.handlers = enabled ? loadHandlers(meterRegistry) : List.of();
        if (!enabled) {
            LOG.debug("Security events are disabled");
        } else if (handlers.isEmpty()) {
            LOG.warn("No security event handlers available, events will be dropped");
        } else {
            LOG.debugf(
                    "Security event handlers: %s",
                    handlers.stream().map(SecurityEventHandler::name).toList());
        }
    }

    private static List<SecurityEventHandler> loadHandlers(MeterRegistry meterRegistry) {
        return ServiceLoader.load(SecurityEventHandler.class).stream()
                .map(ServiceLoader.Provider::get)
                .peek(handler -> {
                    if (handler instanceof MetricsSecurityEventHandler metrics) {
                        metrics.setMeterRegistry(meterRegistry);
                    }
                })
                .filter(SecurityEventHandler::isAvailable)
                .sorted(Comparator.comparingInt(SecurityEventHandler::priority).reversed())
                .toList();
    }

    @Override
    public void publish(SecurityEvent event) {
        if (handlers.isEmpty()) {
            return;
        }
        executor.execute(() -> deliver(event));
    }

    private void deliver(SecurityEvent event) {
        for (var handler : handlers) {
            try {
                handler.handle(event);
            } catch (RuntimeException e) {
                LOG.warnf(
                        "Security event handler %s failed on %s: %s",
                        handler.name(),
                        event.getClass().getSimpleName(),
                        e.getClass().getSimpleName());
            }
        }
    }

    /**
     * Handlers that receive events, in delivery order. Empty when disabled.
     */
    public List<SecurityEventHandler> getHandlers() {
        return handlers;
    }
}
