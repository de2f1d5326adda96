package credman.adapter.in.dto;

import java.util.Map;

import credman.core.model.SlotStatus;
import credman.core.model.TenantSlot;

/**
 * Status of both slots.
 */
public record AuthStatusResponse(SlotStatusDto source, SlotStatusDto target) {

    public static AuthStatusResponse fromModel(Map<TenantSlot, SlotStatus> statuses) {
        return new AuthStatusResponse(
                SlotStatusDto.fromModel(statuses.get(TenantSlot.SOURCE)),
                SlotStatusDto.fromModel(statuses.get(TenantSlot.TARGET)));
    }
}
