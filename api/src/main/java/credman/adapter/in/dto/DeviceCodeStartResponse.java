package credman.adapter.in.dto;

import java.time.Duration;
import java.time.Instant;

import credman.core.model.DeviceCodeSession;

/**
 * What the user needs to complete a sign-in. The device code itself is never returned.
 */
public record DeviceCodeStartResponse(
        String sessionId,
        String userCode,
        String verificationUri,
        String message,
        long expiresInSeconds,
        int pollIntervalSeconds) {

    public static DeviceCodeStartResponse fromModel(DeviceCodeSession session, Instant now) {
        final long remaining = Math.max(0, Duration.between(now, session.expiresAt()).getSeconds());
        return new DeviceCodeStartResponse(
                session.id(),
                session.userCode(),
                session.verificationUri(),
                session.message(),
                remaining,
                session.pollIntervalSeconds());
    }
}
