package credman.adapter.in.rest;

import java.time.Clock;
import java.util.Optional;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.QueryParam;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;

import io.smallrye.mutiny.Uni;

import credman.adapter.in.dto.DeviceCodeStartResponse;
import credman.adapter.in.dto.DeviceCodeStatusResponse;
import credman.adapter.in.dto.SignInRequest;
import credman.adapter.in.problem.CredentialProblem;
import credman.core.model.TenantSlot;
import credman.core.port.in.CredentialManagement;

/**
 * REST resource for the device code sign-in flow.
 *
 * <p>Starting a sign-in requires the anti-forgery token. Status checks are
 * limited to one provider poll per session interval.
 */
@Path("/device-code")
@ApplicationScoped
@Produces(MediaType.APPLICATION_JSON)
public class DeviceCodeResource {

    private final CredentialManagement credentials;
    private final Clock clock;

    @Inject
    public DeviceCodeResource(CredentialManagement credentials, Clock clock) {
        this.credentials = credentials;
        this.clock = clock;
    }

    /**
     * Start a device code sign-in for a slot.
     *
     * @param request slot and optional tenant
     * @return the user code and verification URI
     */
    @POST
    @Path("/start")
    @Consumes(MediaType.APPLICATION_JSON)
    public Uni<Response> start(SignInRequest request) {
        if (request == null) {
            throw CredentialProblem.badRequest("Request body is required");
        }
        final var slot = requireSlot(request.slot());
        final var tenantId = Optional.ofNullable(request.tenantId()).filter(t -> !t.isBlank());
        return credentials
                .signIn(slot, tenantId)
                .map(session -> Response.ok(DeviceCodeStartResponse.fromModel(session, clock.instant()))
                        .build());
    }

    /**
     * Check a sign-in session.
     *
     * @param slotId    slot the session belongs to
     * @param sessionId session handle returned by start
     * @return the session status
     */
    @GET
    @Path("/status")
    public Uni<Response> status(@QueryParam("slot") String slotId, @QueryParam("session") String sessionId) {
        final var slot = requireSlot(slotId);
        if (sessionId == null || sessionId.isBlank()) {
            throw CredentialProblem.badRequest("session is required");
        }
        return credentials
                .checkStatus(slot, sessionId.trim())
                .map(status -> Response.ok(DeviceCodeStatusResponse.fromModel(status)).build());
    }

    static TenantSlot requireSlot(String slotId) {
        if (slotId == null || slotId.isBlank()) {
            throw CredentialProblem.badRequest("slot is required");
        }
        return TenantSlot.fromId(slotId)
                .orElseThrow(() -> CredentialProblem.badRequest("slot must be 'source' or 'target'"));
    }
}
