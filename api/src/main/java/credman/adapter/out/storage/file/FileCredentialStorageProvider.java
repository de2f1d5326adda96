package credman.adapter.out.storage.file;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import org.eclipse.microprofile.health.HealthCheckResponse;

import credman.core.config.StorageConfig;
import credman.core.port.out.CredentialStorage;
import credman.spi.CredentialStorageProvider;
import credman.spi.StorageProviderException;

/**
 * File-based credential storage provider. Preferred over memory storage.
 */
@ApplicationScoped
public class FileCredentialStorageProvider implements CredentialStorageProvider {

    private static final int PRIORITY = 100;

    private final StorageConfig config;
    private volatile FileCredentialStorage storage;

    @Inject
    public FileCredentialStorageProvider(StorageConfig config) {
        this.config = config;
    }

    @Override
    public String name() {
        return "file";
    }

    @Override
    public int priority() {
        return PRIORITY;
    }

    @Override
    public boolean isAvailable() {
        return !config.file().directory().isBlank();
    }

    @Override
    public synchronized CredentialStorage createStorage() {
        if (storage == null) {
            try {
                storage = new FileCredentialStorage(directory());
            } catch (RuntimeException e) {
                throw new StorageProviderException("Failed to initialize file credential storage", e);
            }
        }
        return storage;
    }

    @Override
    public Optional<HealthCheckResponse> healthCheck() {
        final var directory = directory();
        final var writable = Files.isDirectory(directory) && Files.isWritable(directory);
        return Optional.of(HealthCheckResponse.named("credential-storage-file")
                .status(writable)
                .withData("type", "file")
                .withData("directory", directory.toString())
                .build());
    }

    private Path directory() {
        return Path.of(config.file().directory());
    }
}
