package credman.adapter.in.problem;

import static org.junit.jupiter.api.Assertions.assertEquals;

import io.quarkiverse.resteasy.problem.HttpProblem;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import credman.core.model.CredentialException;
import credman.core.model.TenantSlot;

@DisplayName("GlobalExceptionMappers")
class GlobalExceptionMappersTest {

    private final GlobalExceptionMappers mappers = new GlobalExceptionMappers();

    @Test
    @DisplayName("should not echo argument error messages")
    void shouldNotEchoArgumentErrors() {
        var response = mappers.mapIllegalArgumentException(
                new IllegalArgumentException("Unrecognized field \"access_token\": eyJhbGciOi"));

        assertEquals(400, response.getStatus());
        var problem = (HttpProblem) response.getEntity();
        assertEquals("Invalid request", problem.getDetail());
    }

    @Test
    @DisplayName("should add Retry-After to rate limited responses")
    void shouldAddRetryAfter() {
        var response = mappers.mapCredentialException(CredentialException.rateLimited(TenantSlot.SOURCE, 7));

        assertEquals(429, response.getStatus());
        assertEquals("7", response.getHeaderString("Retry-After"));
    }
}
