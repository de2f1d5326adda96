package credman.adapter.out.storage;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Inject;

import credman.core.port.out.CredentialStorage;
import credman.core.service.CredentialStorageProviderRegistry;

/**
 * CDI producer for credential storage.
 *
 * <p>Delegates to the {@link CredentialStorageProviderRegistry}, which selects
 * the storage provider based on configuration and availability.
 *
 * @see credman.spi.CredentialStorageProvider
 */
@ApplicationScoped
public class CredentialStorageProducer {

    private final CredentialStorageProviderRegistry registry;

    @Inject
    public CredentialStorageProducer(CredentialStorageProviderRegistry registry) {
        this.registry = registry;
    }

    @Produces
    @ApplicationScoped
    public CredentialStorage credentialStorage() {
        return registry.getStorage();
    }
}
