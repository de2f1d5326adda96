package credman.adapter.in.health;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import org.eclipse.microprofile.health.HealthCheck;
import org.eclipse.microprofile.health.HealthCheckResponse;
import org.eclipse.microprofile.health.Readiness;

import credman.core.service.CredentialStorageProviderRegistry;
import credman.spi.StorageProviderException;

/**
 * Readiness of the selected credential storage provider.
 *
 * <p>Reports DOWN when no provider can be selected. Otherwise delegates to
 * the provider's own health check, if it has one.
 */
@Readiness
@ApplicationScoped
public class CredentialStorageHealthCheck implements HealthCheck {

    private static final String NAME = "credential-storage";

    private final CredentialStorageProviderRegistry registry;

    @Inject
    public CredentialStorageHealthCheck(CredentialStorageProviderRegistry registry) {
        this.registry = registry;
    }

    @Override
    public HealthCheckResponse call() {
        try {
            final var provider = registry.getSelectedProvider();
            return provider.healthCheck()
                    .orElseGet(() -> HealthCheckResponse.named(NAME)
                            .withData("provider", provider.name())
                            .up()
                            .build());
        } catch (StorageProviderException e) {
            return HealthCheckResponse.named(NAME)
                    .withData("error", e.getMessage())
                    .down()
                    .build();
        }
    }
}
