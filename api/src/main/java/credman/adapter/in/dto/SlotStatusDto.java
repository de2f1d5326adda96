package credman.adapter.in.dto;

import java.util.Locale;

import com.fasterxml.jackson.annotation.JsonInclude;

import credman.core.model.SlotStatus;

/**
 * DTO for the status of one slot.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record SlotStatusDto(
        String state, boolean authenticated, String user, String tenantId, String expiresAt, String error) {

    public static SlotStatusDto fromModel(SlotStatus status) {
        return new SlotStatusDto(
                status.state().name().toLowerCase(Locale.ROOT),
                status.isAuthenticated(),
                status.user().orElse(null),
                status.tenantId().orElse(null),
                status.expiresAt().map(Object::toString).orElse(null),
                status.error().orElse(null));
    }
}
