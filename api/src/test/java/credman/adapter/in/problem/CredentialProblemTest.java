package credman.adapter.in.problem;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;

import jakarta.ws.rs.core.Response.Status;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import credman.core.model.CredentialErrorKind;
import credman.core.model.CredentialException;
import credman.core.model.TenantSlot;

@DisplayName("CredentialProblem")
class CredentialProblemTest {

    @Test
    @DisplayName("should map every error kind to its status")
    void shouldMapStatuses() {
        assertEquals(Status.BAD_GATEWAY, CredentialProblem.status(CredentialErrorKind.PROVIDER_UNREACHABLE));
        assertEquals(Status.BAD_GATEWAY, CredentialProblem.status(CredentialErrorKind.PROVIDER_REJECTED));
        assertEquals(Status.UNAUTHORIZED, CredentialProblem.status(CredentialErrorKind.TENANT_MISMATCH));
        assertEquals(Status.UNAUTHORIZED, CredentialProblem.status(CredentialErrorKind.REFRESH_FAILED));
        assertEquals(Status.UNAUTHORIZED, CredentialProblem.status(CredentialErrorKind.NOT_AUTHENTICATED));
        assertEquals(Status.INTERNAL_SERVER_ERROR, CredentialProblem.status(CredentialErrorKind.STORAGE_ERROR));
        assertEquals(Status.BAD_REQUEST, CredentialProblem.status(CredentialErrorKind.INVALID_REQUEST));
        assertEquals(Status.NOT_FOUND, CredentialProblem.status(CredentialErrorKind.UNKNOWN_SESSION));
        assertEquals(Status.CONFLICT, CredentialProblem.status(CredentialErrorKind.ALREADY_AUTHENTICATING));
        assertEquals(Status.TOO_MANY_REQUESTS, CredentialProblem.status(CredentialErrorKind.RATE_LIMITED));
    }

    @Test
    @DisplayName("should carry kind, slot and retry hint")
    void shouldCarryKindSlotAndRetryHint() {
        var problem = CredentialProblem.from(CredentialException.rateLimited(TenantSlot.TARGET, 5));

        assertEquals(429, problem.getStatusCode());
        assertEquals("Too Many Requests", problem.getTitle());
        assertEquals("RATE_LIMITED", problem.getParameters().get("kind"));
        assertEquals("target", problem.getParameters().get("slot"));
        assertEquals(5L, problem.getParameters().get("retryAfter"));
    }

    @Test
    @DisplayName("should omit slot when the error has none")
    void shouldOmitMissingSlot() {
        var problem = CredentialProblem.from(CredentialException.invalidRequest("Invalid tenant ID"));

        assertEquals(400, problem.getStatusCode());
        assertEquals("Invalid tenant ID", problem.getDetail());
        assertFalse(problem.getParameters().containsKey("slot"));
    }
}
