package credman.adapter.out.storage.memory;

import java.util.Arrays;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.stream.Collectors;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import credman.core.port.out.CredentialStorage;

/**
 * In-memory credential storage.
 *
 * <p>Intended for development and testing only. Credentials are lost on restart.
 * Values are copied on the way in and out so callers cannot mutate stored bytes.
 */
public class InMemoryCredentialStorage implements CredentialStorage {

    private static final Logger LOG = Logger.getLogger(InMemoryCredentialStorage.class);

    private final ConcurrentMap<String, byte[]> entries = new ConcurrentHashMap<>();

    public InMemoryCredentialStorage() {
        LOG.info("Initialized in-memory credential storage");
    }

    @Override
    public Uni<Void> put(String key, byte[] value) {
        return Uni.createFrom().item(() -> {
            entries.put(key, Arrays.copyOf(value, value.length));
            LOG.debugf("Stored credential entry: %s", key);
            return null;
        });
    }

    @Override
    public Uni<Optional<byte[]>> get(String key) {
        return Uni.createFrom()
                .item(() -> Optional.ofNullable(entries.get(key)).map(v -> Arrays.copyOf(v, v.length)));
    }

    @Override
    public Uni<Void> delete(String key) {
        return Uni.createFrom().item(() -> {
            entries.remove(key);
            return null;
        });
    }

    @Override
    public Uni<Set<String>> keys(String prefix) {
        return Uni.createFrom().item(() -> entries.keySet().stream()
                .filter(k -> k.startsWith(prefix))
                .collect(Collectors.toUnmodifiableSet()));
    }

    /**
     * Get the number of stored entries (for health checks).
     */
    public int size() {
        return entries.size();
    }
}
