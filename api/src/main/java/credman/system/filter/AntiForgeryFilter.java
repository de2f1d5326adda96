package credman.system.filter;

import java.util.Set;

import jakarta.inject.Inject;
import jakarta.ws.rs.HttpMethod;
import jakarta.ws.rs.Priorities;
import jakarta.ws.rs.container.ContainerRequestContext;
import jakarta.ws.rs.core.Response;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;
import org.jboss.resteasy.reactive.server.ServerRequestFilter;

import credman.adapter.in.problem.CredentialProblem;
import credman.adapter.in.rest.AntiForgeryTokens;

/**
 * Reactive filter that rejects state-changing requests without the anti-forgery token.
 *
 * <p>Runs before the resource method, so a forged request never starts a
 * sign-in or clears credentials.
 */
public class AntiForgeryFilter {

    private static final Logger LOG = Logger.getLogger(AntiForgeryFilter.class);

    static final Set<String> PROTECTED_PATHS = Set.of("/device-code/start", "/auth/signout");

    private final AntiForgeryTokens tokens;

    @Inject
    public AntiForgeryFilter(AntiForgeryTokens tokens) {
        this.tokens = tokens;
    }

    /**
     * @param requestContext the request context
     * @return Uni with null to continue, or Response to abort
     */
    @ServerRequestFilter(priority = Priorities.AUTHENTICATION - 100)
    public Uni<Response> filter(ContainerRequestContext requestContext) {
        if (!tokens.enabled() || !isProtected(requestContext)) {
            return Uni.createFrom().nullItem();
        }
        final var presented = requestContext.getHeaderString(tokens.headerName());
        if (tokens.matches(presented)) {
            return Uni.createFrom().nullItem();
        }
        LOG.warnf("Rejected %s %s: missing or invalid anti-forgery token",
                requestContext.getMethod(), requestContext.getUriInfo().getPath());
        return Uni.createFrom()
                .item(Response.status(Response.Status.FORBIDDEN)
                        .type("application/problem+json")
                        .entity(CredentialProblem.forbidden("Invalid CSRF token"))
                        .build());
    }

    private static boolean isProtected(ContainerRequestContext requestContext) {
        if (!HttpMethod.POST.equals(requestContext.getMethod())) {
            return false;
        }
        var path = requestContext.getUriInfo().getPath();
        if (path.length() > 1 && path.endsWith("/")) {
            path = path.substring(0, path.length() - 1);
        }
        return PROTECTED_PATHS.contains(path);
    }
}
