package credman.adapter.in.health;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import org.eclipse.microprofile.health.HealthCheckResponse;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import credman.adapter.out.storage.memory.InMemoryCredentialStorageProvider;
import credman.core.service.CredentialStorageProviderRegistry;
import credman.spi.StorageProviderException;

@DisplayName("CredentialStorageHealthCheck")
class CredentialStorageHealthCheckTest {

    private CredentialStorageProviderRegistry registry;
    private CredentialStorageHealthCheck healthCheck;

    @BeforeEach
    void setUp() {
        registry = mock(CredentialStorageProviderRegistry.class);
        healthCheck = new CredentialStorageHealthCheck(registry);
    }

    @Test
    @DisplayName("should delegate to the selected provider")
    void shouldDelegateToProvider() {
        when(registry.getSelectedProvider()).thenReturn(new InMemoryCredentialStorageProvider());

        final var response = healthCheck.call();

        assertEquals(HealthCheckResponse.Status.UP, response.getStatus());
        assertEquals("credential-storage-memory", response.getName());
    }

    @Test
    @DisplayName("should report DOWN when no provider can be selected")
    void shouldReportDownWithoutProvider() {
        when(registry.getSelectedProvider()).thenThrow(new StorageProviderException("No providers"));

        final var response = healthCheck.call();

        assertEquals(HealthCheckResponse.Status.DOWN, response.getStatus());
        assertEquals("credential-storage", response.getName());
    }
}
