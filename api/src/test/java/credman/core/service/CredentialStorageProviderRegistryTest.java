package credman.core.service;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import java.util.List;
import java.util.stream.Stream;

import jakarta.enterprise.inject.Instance;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import credman.adapter.out.storage.memory.InMemoryCredentialStorage;
import credman.core.port.out.CredentialStorage;
import credman.mock.TestConfigs;
import credman.spi.CredentialStorageProvider;
import credman.spi.StorageProviderException;

@DisplayName("CredentialStorageProviderRegistry")
class CredentialStorageProviderRegistryTest {

    private static CredentialStorageProvider provider(String name, int priority, boolean available) {
        final var storage = new InMemoryCredentialStorage();
        return new CredentialStorageProvider() {
            @Override
            public String name() {
                return name;
            }

            @Override
            public int priority() {
                return priority;
            }

            @Override
            public boolean isAvailable() {
                return available;
            }

            @Override
            public CredentialStorage createStorage() {
                return storage;
            }
        };
    }

    @SuppressWarnings("unchecked")
    private static CredentialStorageProviderRegistry registry(String configured, CredentialStorageProvider... all) {
        final Instance<CredentialStorageProvider> instance = mock(Instance.class);
        when(instance.stream()).thenAnswer(invocation -> Stream.of(all));
        return new CredentialStorageProviderRegistry(instance, TestConfigs.storage(configured, "unused"));
    }

    @Test
    @DisplayName("should pick the highest priority available provider")
    void shouldPickHighestPriority() {
        final var registry = registry(
                null, provider("memory", 0, true), provider("file", 100, true), provider("vault", 200, false));

        assertEquals("file", registry.getSelectedProvider().name());
        assertEquals(List.of("memory", "file"), registry.getAvailableProviders().stream()
                .map(CredentialStorageProvider::name)
                .toList());
    }

    @Test
    @DisplayName("should honor the configured provider")
    void shouldHonorConfiguredProvider() {
        final var memory = provider("memory", 0, true);
        final var registry = registry("memory", memory, provider("file", 100, true));

        assertSame(memory, registry.getSelectedProvider());
        assertSame(memory.createStorage(), registry.getStorage());
    }

    @Test
    @DisplayName("should fail instead of falling back when the configured provider is unavailable")
    void shouldFailForUnavailableConfiguredProvider() {
        final var registry = registry("file", provider("memory", 0, true), provider("file", 100, false));

        assertThrows(StorageProviderException.class, registry::getSelectedProvider);
    }

    @Test
    @DisplayName("should fail when no provider is available")
    void shouldFailWithoutProviders() {
        final var registry = registry(null);

        assertThrows(StorageProviderException.class, registry::getStorage);
    }
}
