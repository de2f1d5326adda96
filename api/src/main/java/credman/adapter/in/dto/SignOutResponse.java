package credman.adapter.in.dto;

public record SignOutResponse(boolean success, String message) {}
