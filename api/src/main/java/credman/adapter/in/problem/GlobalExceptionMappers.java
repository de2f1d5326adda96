package credman.adapter.in.problem;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.ws.rs.core.Response;

import io.quarkiverse.resteasy.problem.HttpProblem;
import org.jboss.logging.Logger;
import org.jboss.resteasy.reactive.server.ServerExceptionMapper;

import credman.core.model.CredentialException;
import credman.spi.StorageProviderException;

/**
 * Global exception mappers for converting exceptions to RFC 7807 Problem Details.
 *
 * <p>Only the error kind and slot are logged; exception causes are not, since
 * they may originate from provider responses.
 */
@ApplicationScoped
public class GlobalExceptionMappers {

    private static final Logger LOG = Logger.getLogger(GlobalExceptionMappers.class);
    private static final String PROBLEM_JSON = "application/problem+json";

    @ServerExceptionMapper
    public Response mapCredentialException(CredentialException e) {
        final var slot = e.slot().map(Object::toString).orElse("-");
        final var status = CredentialProblem.status(e.kind());
        if (status.getFamily() == Response.Status.Family.SERVER_ERROR) {
            LOG.warnf("Request failed for slot %s: %s", slot, e.kind());
        } else {
            LOG.debugf("Request rejected for slot %s: %s", slot, e.kind());
        }
        final var builder = Response.status(status)
                .type(PROBLEM_JSON)
                .entity(CredentialProblem.from(e));
        e.retryAfterSeconds().ifPresent(seconds -> builder.header("Retry-After", seconds));
        return builder.build();
    }

    @ServerExceptionMapper
    public Response mapStorageProviderException(StorageProviderException e) {
        LOG.errorf("Credential storage is not available: %s", e.getMessage());
        return toResponse(CredentialProblem.internalError("Credential storage is unavailable"));
    }

    /**
     * Argument errors may come from framework or parsing code, so their
     * messages are not returned to the caller.
     */
    @ServerExceptionMapper
    public Response mapIllegalArgumentException(IllegalArgumentException e) {
        LOG.debugf("Invalid request: %s", e.getClass().getSimpleName());
        return toResponse(CredentialProblem.badRequest("Invalid request"));
    }

    private Response toResponse(HttpProblem problem) {
        return Response.status(problem.getStatus())
                .type(PROBLEM_JSON)
                .entity(problem)
                .build();
    }
}
