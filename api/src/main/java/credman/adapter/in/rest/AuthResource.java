package credman.adapter.in.rest;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.QueryParam;
import jakarta.ws.rs.core.CacheControl;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;

import io.smallrye.mutiny.Uni;

import credman.adapter.in.dto.AntiForgeryTokenResponse;
import credman.adapter.in.dto.AuthStatusResponse;
import credman.adapter.in.dto.SignOutRequest;
import credman.adapter.in.dto.SignOutResponse;
import credman.adapter.in.dto.TokenResponse;
import credman.core.port.in.CredentialManagement;

/**
 * REST resource for signed-in credentials: tokens, status and sign-out.
 */
@Path("/auth")
@ApplicationScoped
@Produces(MediaType.APPLICATION_JSON)
public class AuthResource {

    private final CredentialManagement credentials;
    private final AntiForgeryTokens antiForgery;

    @Inject
    public AuthResource(CredentialManagement credentials, AntiForgeryTokens antiForgery) {
        this.credentials = credentials;
        this.antiForgery = antiForgery;
    }

    /**
     * Get a usable access token for a slot, refreshing it first if needed.
     */
    @GET
    @Path("/token")
    public Uni<Response> token(@QueryParam("slot") String slotId) {
        final var slot = DeviceCodeResource.requireSlot(slotId);
        return credentials.getToken(slot).map(record -> Response.ok(TokenResponse.fromModel(record))
                .cacheControl(noStore())
                .build());
    }

    /**
     * Status of both slots.
     */
    @GET
    @Path("/status")
    public Uni<Response> status() {
        return credentials
                .statuses()
                .map(statuses -> Response.ok(AuthStatusResponse.fromModel(statuses)).build());
    }

    /**
     * Sign out of one slot, or of both when no slot is given.
     */
    @POST
    @Path("/signout")
    @Consumes(MediaType.APPLICATION_JSON)
    public Uni<Response> signOut(SignOutRequest request) {
        if (request == null || request.slot() == null || request.slot().isBlank()) {
            return credentials
                    .signOutAll()
                    .map(ignored -> Response.ok(new SignOutResponse(true, "Signed out of all slots"))
                            .build());
        }
        final var slot = DeviceCodeResource.requireSlot(request.slot());
        return credentials
                .signOut(slot)
                .map(ignored -> Response.ok(new SignOutResponse(true, "Signed out of " + slot))
                        .build());
    }

    /**
     * Token to echo in the anti-forgery header on state-changing requests.
     */
    @GET
    @Path("/anti-forgery-token")
    public Response antiForgeryToken() {
        return Response.ok(new AntiForgeryTokenResponse(antiForgery.token(), antiForgery.headerName()))
                .cacheControl(noStore())
                .build();
    }

    private static CacheControl noStore() {
        final var cacheControl = new CacheControl();
        cacheControl.setNoStore(true);
        return cacheControl;
    }
}
