package credman.adapter.in.dto;

/**
 * Anti-forgery token and the header it must be sent in.
 */
public record AntiForgeryTokenResponse(String token, String headerName) {}
