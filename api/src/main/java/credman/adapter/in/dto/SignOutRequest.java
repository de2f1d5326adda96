package credman.adapter.in.dto;

/**
 * Request body for signing out. A missing slot signs out of both slots.
 */
public record SignOutRequest(String slot) {}
