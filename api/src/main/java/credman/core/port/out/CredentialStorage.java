package credman.core.port.out;

import java.util.Optional;
import java.util.Set;

import io.smallrye.mutiny.Uni;

/**
 * Key/value storage for encrypted credential blobs.
 *
 * <p>Implementations only ever see ciphertext. Keys are opaque strings built
 * by the repository; implementations must not interpret them beyond prefix
 * matching in {@link #keys(String)}.
 *
 * <h2>Implementation Requirements</h2>
 * <ul>
 *   <li>{@link #put} replaces an existing value atomically</li>
 *   <li>{@link #delete} of a missing key succeeds</li>
 *   <li>All operations MUST be non-blocking (return Uni)</li>
 * </ul>
 */
public interface CredentialStorage {

    Uni<Void> put(String key, byte[] value);

    Uni<Optional<byte[]>> get(String key);

    Uni<Void> delete(String key);

    /**
     * List keys starting with the given prefix.
     *
     * @param prefix key prefix
     * @return matching keys
     */
    Uni<Set<String>> keys(String prefix);
}
