package credman.adapter.in.problem;

import jakarta.ws.rs.core.Response.Status;

import io.quarkiverse.resteasy.problem.HttpProblem;

import credman.core.model.CredentialErrorKind;
import credman.core.model.CredentialException;

/**
 * RFC 7807 Problem Details factory for credential manager errors.
 *
 * <p>Problems carry the error kind and slot so clients can branch on them.
 * Details are the fixed messages of {@link CredentialException}; provider
 * payloads are never included.
 */
public final class CredentialProblem {

    private CredentialProblem() {
        // Utility class - prevent instantiation
    }

    public static HttpProblem from(CredentialException e) {
        final var builder = HttpProblem.builder()
                .withTitle(title(e.kind()))
                .withStatus(status(e.kind()))
                .withDetail(e.getMessage())
                .with("kind", e.kind().name());
        e.slot().ifPresent(slot -> builder.with("slot", slot.id()));
        e.retryAfterSeconds().ifPresent(seconds -> builder.with("retryAfter", seconds));
        return builder.build();
    }

    public static HttpProblem badRequest(String detail) {
        return HttpProblem.builder()
                .withTitle("Bad Request")
                .withStatus(Status.BAD_REQUEST)
                .withDetail(detail)
                .with("kind", CredentialErrorKind.INVALID_REQUEST.name())
                .build();
    }

    public static HttpProblem forbidden(String detail) {
        return HttpProblem.builder()
                .withTitle("Forbidden")
                .withStatus(Status.FORBIDDEN)
                .withDetail(detail)
                .build();
    }

    public static HttpProblem internalError(String detail) {
        return HttpProblem.builder()
                .withTitle("Internal Server Error")
                .withStatus(Status.INTERNAL_SERVER_ERROR)
                .withDetail(detail)
                .build();
    }

    /**
     * HTTP status for an error kind.
     */
    public static Status status(CredentialErrorKind kind) {
        return switch (kind) {
            case PROVIDER_UNREACHABLE, PROVIDER_REJECTED -> Status.BAD_GATEWAY;
            case TENANT_MISMATCH, REFRESH_FAILED, NOT_AUTHENTICATED -> Status.UNAUTHORIZED;
            case STORAGE_ERROR -> Status.INTERNAL_SERVER_ERROR;
            case INVALID_REQUEST -> Status.BAD_REQUEST;
            case UNKNOWN_SESSION -> Status.NOT_FOUND;
            case ALREADY_AUTHENTICATING -> Status.CONFLICT;
            case RATE_LIMITED -> Status.TOO_MANY_REQUESTS;
        };
    }

    private static String title(CredentialErrorKind kind) {
        return switch (kind) {
            case PROVIDER_UNREACHABLE -> "Identity Provider Unreachable";
            case PROVIDER_REJECTED -> "Identity Provider Error";
            case TENANT_MISMATCH -> "Tenant Mismatch";
            case REFRESH_FAILED -> "Refresh Failed";
            case STORAGE_ERROR -> "Storage Error";
            case INVALID_REQUEST -> "Bad Request";
            case UNKNOWN_SESSION -> "Session Not Found";
            case ALREADY_AUTHENTICATING -> "Sign-In In Progress";
            case NOT_AUTHENTICATED -> "Not Authenticated";
            case RATE_LIMITED -> "Too Many Requests";
        };
    }
}
