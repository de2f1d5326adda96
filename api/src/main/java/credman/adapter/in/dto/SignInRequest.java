package credman.adapter.in.dto;

/**
 * Request body for starting a device code sign-in.
 *
 * @param slot     "source" or "target"
 * @param tenantId optional tenant the signed-in account must belong to
 */
public record SignInRequest(String slot, String tenantId) {}
