package credman.adapter.in.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

import credman.core.model.DeviceCodeStatus;

/**
 * DTO for a sign-in session status.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record DeviceCodeStatusResponse(
        String status, String message, String user, String tenantId, String expiresAt, Integer pollIntervalSeconds) {

    public static DeviceCodeStatusResponse fromModel(DeviceCodeStatus status) {
        return new DeviceCodeStatusResponse(
                status.status().value(),
                status.message().orElse(null),
                status.user().orElse(null),
                status.tenantId().orElse(null),
                status.expiresAt().map(Object::toString).orElse(null),
                status.pollIntervalSeconds().orElse(null));
    }
}
