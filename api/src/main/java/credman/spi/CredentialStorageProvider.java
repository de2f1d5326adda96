package credman.spi;

import java.util.Optional;

import org.eclipse.microprofile.health.HealthCheckResponse;

import credman.core.port.out.CredentialStorage;

/**
 * SPI for encrypted credential storage backends.
 *
 * <p>Providers are CDI beans. Storage only ever receives ciphertext, so a
 * backend needs no knowledge of tokens or slots.
 *
 * <p>Built-in providers:
 * <ul>
 *   <li>file (priority: 100) - one file per key in a local directory</li>
 *   <li>memory (priority: 0) - process memory, lost on restart</li>
 * </ul>
 *
 * <p>Provider selection order:
 * <ol>
 *   <li>Configured provider ({@code credman.storage.provider})</li>
 *   <li>Highest priority available provider</li>
 * </ol>
 */
public interface CredentialStorageProvider {

    /**
     * Return the provider name for configuration selection.
     *
     * @return provider name (e.g., "file", "memory", "keyring")
     */
    String name();

    /**
     * Return the provider priority for automatic selection.
     *
     * @return priority value (higher = more preferred)
     */
    int priority();

    /**
     * Check if this provider can be used. Must return quickly.
     */
    boolean isAvailable();

    /**
     * Create the storage implementation.
     *
     * @return credential storage
     * @throws StorageProviderException if the backend cannot be initialized
     */
    CredentialStorage createStorage();

    /**
     * Create a health response for this backend.
     *
     * @return health check response, or empty if not supported
     */
    default Optional<HealthCheckResponse> healthCheck() {
        return Optional.empty();
    }
}
