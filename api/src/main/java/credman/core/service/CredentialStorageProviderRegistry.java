package credman.core.service;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Instance;
import jakarta.inject.Inject;

import org.jboss.logging.Logger;

import credman.core.config.StorageConfig;
import credman.core.port.out.CredentialStorage;
import credman.spi.CredentialStorageProvider;
import credman.spi.StorageProviderException;

/**
 * Registry for credential storage providers.
 *
 * <p>Discovers available providers via CDI and selects one based on
 * configuration and availability.
 *
 * <p>Selection order:
 * <ol>
 *   <li>Configured provider ({@code credman.storage.provider})</li>
 *   <li>Highest priority available provider</li>
 * </ol>
 *
 * <p>A configured provider that is missing or unavailable is an error rather
 * than a silent fallback, since falling back from file to memory storage
 * would lose credentials on restart.
 */
@ApplicationScoped
public class CredentialStorageProviderRegistry {

    private static final Logger LOG = Logger.getLogger(CredentialStorageProviderRegistry.class);

    private final Instance<CredentialStorageProvider> providers;
    private final StorageConfig config;

    private volatile CredentialStorageProvider selectedProvider;
    private volatile CredentialStorage storage;

    @Inject
    public CredentialStorageProviderRegistry(Instance<CredentialStorageProvider> providers, StorageConfig config) {
        this.providers = providers;
        this.config = config;
    }

    /**
     * Get the storage created by the selected provider.
     */
    public synchronized CredentialStorage getStorage() {
        if (storage == null) {
            storage = getSelectedProvider().createStorage();
        }
        return storage;
    }

    public synchronized CredentialStorageProvider getSelectedProvider() {
        if (selectedProvider == null) {
            selectedProvider = selectProvider();
        }
        return selectedProvider;
    }

    private CredentialStorageProvider selectProvider() {
        final var availableProviders = getAvailableProviders().stream()
                .sorted(Comparator.comparingInt(CredentialStorageProvider::priority).reversed())
                .toList();

        LOG.debugf(
                "Available credential storage providers: %s",
                availableProviders.stream().map(CredentialStorageProvider::name).toList());

        final var configuredProvider = config.provider().filter(p -> !p.isBlank());
        if (configuredProvider.isPresent()) {
            Optional<CredentialStorageProvider> configured = availableProviders.stream()
                    .filter(p -> p.name().equals(configuredProvider.get()))
                    .findFirst();
            if (configured.isEmpty()) {
                throw new StorageProviderException(
                        "Configured credential storage provider is not available: " + configuredProvider.get());
            }
            LOG.infof("Using configured credential storage provider: %s", configuredProvider.get());
            return configured.get();
        }

        if (!availableProviders.isEmpty()) {
            final var provider = availableProviders.get(0);
            LOG.infof(
                    "Using credential storage provider: %s (priority: %d)", provider.name(), provider.priority());
            return provider;
        }

        throw new StorageProviderException("No credential storage providers available");
    }

    /**
     * Get all available providers (for health checks).
     */
    public List<CredentialStorageProvider> getAvailableProviders() {
        return providers.stream().filter(CredentialStorageProvider::isAvailable).toList();
    }
}
