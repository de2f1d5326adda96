package credman.adapter.out.storage.memory;

import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;

import jakarta.enterprise.context.ApplicationScoped;

import org.eclipse.microprofile.health.HealthCheckResponse;
import org.jboss.logging.Logger;

import credman.core.port.out.CredentialStorage;
import credman.spi.CredentialStorageProvider;

/**
 * In-memory credential storage provider.
 *
 * <p>Always available, lowest priority.
 *
 * <p><strong>Warning:</strong> users must sign in again after every restart.
 */
@ApplicationScoped
public class InMemoryCredentialStorageProvider implements CredentialStorageProvider {

    private static final Logger LOG = Logger.getLogger(InMemoryCredentialStorageProvider.class);
    private static final int PRIORITY = 0;

    private final AtomicBoolean warningLogged = new AtomicBoolean(false);
    private volatile InMemoryCredentialStorage storage;

    @Override
    public String name() {
        return "memory";
    }

    @Override
    public int priority() {
        return PRIORITY;
    }

    @Override
    public boolean isAvailable() {
        return true;
    }

    @Override
    public synchronized CredentialStorage createStorage() {
        if (warningLogged.compareAndSet(false, true)) {
            LOG.warn("Credential storage is in-memory only; sign-ins do not survive a restart");
        }
        if (storage == null) {
            storage = new InMemoryCredentialStorage();
        }
        return storage;
    }

    @Override
    public Optional<HealthCheckResponse> healthCheck() {
        return Optional.of(HealthCheckResponse.named("credential-storage-memory")
                .up()
                .withData("type", "in-memory")
                .withData("entries", storage != null ? storage.size() : 0)
                .build());
    }
}
