package credman.system.filter;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import java.util.Optional;

import jakarta.ws.rs.container.ContainerRequestContext;
import jakarta.ws.rs.core.UriInfo;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import credman.adapter.in.rest.AntiForgeryTokens;
import credman.core.config.AntiForgeryConfig;

@DisplayName("AntiForgeryFilter")
class AntiForgeryFilterTest {

    private static final String TOKEN = "expected-token";

    private ContainerRequestContext requestContext;
    private UriInfo uriInfo;

    @BeforeEach
    void setUp() {
        requestContext = mock(ContainerRequestContext.class);
        uriInfo = mock(UriInfo.class);
        when(requestContext.getUriInfo()).thenReturn(uriInfo);
    }

    private static AntiForgeryFilter filter(boolean enabled) {
        final var config = mock(AntiForgeryConfig.class);
        when(config.enabled()).thenReturn(enabled);
        when(config.headerName()).thenReturn("X-CSRF-Token");
        when(config.token()).thenReturn(Optional.of(TOKEN));
        return new AntiForgeryFilter(new AntiForgeryTokens(config));
    }

    private void request(String method, String path, String header) {
        when(requestContext.getMethod()).thenReturn(method);
        when(uriInfo.getPath()).thenReturn(path);
        when(requestContext.getHeaderString("X-CSRF-Token")).thenReturn(header);
    }

    @Nested
    @DisplayName("Protected endpoints")
    class ProtectedEndpoints {

        @Test
        @DisplayName("should allow a request carrying the token")
        void shouldAllowValidToken() {
            request("POST", "/device-code/start", TOKEN);

            assertNull(filter(true).filter(requestContext).await().indefinitely());
        }

        @Test
        @DisplayName("should reject a request without the token")
        void shouldRejectMissingToken() {
            request("POST", "/auth/signout", null);

            final var response = filter(true).filter(requestContext).await().indefinitely();

            assertNotNull(response);
            assertEquals(403, response.getStatus());
        }

        @Test
        @DisplayName("should reject a request with the wrong token")
        void shouldRejectWrongToken() {
            request("POST", "/device-code/start/", "expected-tokem");

            final var response = filter(true).filter(requestContext).await().indefinitely();

            assertEquals(403, response.getStatus());
        }
    }

    @Nested
    @DisplayName("Unprotected requests")
    class UnprotectedRequests {

        @Test
        @DisplayName("should not check polling requests")
        void shouldSkipGet() {
            request("GET", "/device-code/status", null);

            assertNull(filter(true).filter(requestContext).await().indefinitely());
        }

        @Test
        @DisplayName("should not check token reads")
        void shouldSkipTokenRead() {
            request("GET", "/auth/token", null);

            assertNull(filter(true).filter(requestContext).await().indefinitely());
        }

        @Test
        @DisplayName("should not check anything when disabled")
        void shouldSkipWhenDisabled() {
            request("POST", "/auth/signout", null);

            assertNull(filter(false).filter(requestContext).await().indefinitely());
        }
    }
}
