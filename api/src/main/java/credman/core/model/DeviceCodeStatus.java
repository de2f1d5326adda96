package credman.core.model;

import java.time.Instant;
import java.util.Optional;

/**
 * Caller-visible result of checking a device code session.
 *
 * @param status              one of the stable status values
 * @param message             human-readable detail (always set for ERROR)
 * @param user                signed-in user when COMPLETED
 * @param tenantId            tenant of the issued token when COMPLETED
 * @param expiresAt           access token expiry when COMPLETED
 * @param pollIntervalSeconds interval to wait before the next poll when PENDING
 */
public record DeviceCodeStatus(
        Status status,
        Optional<String> message,
        Optional<String> user,
        Optional<String> tenantId,
        Optional<Instant> expiresAt,
        Optional<Integer> pollIntervalSeconds) {

    /**
     * Stable status values exposed to callers.
     */
    public enum Status {
        PENDING("pending"),
        COMPLETED("completed"),
        EXPIRED("expired"),
        ERROR("error");

        private final String value;

        Status(String value) {
            this.value = value;
        }

        public String value() {
            return value;
        }
    }

    public DeviceCodeStatus {
        if (status == null) {
            throw new IllegalArgumentException("Status is required");
        }
        if (message == null) {
            message = Optional.empty();
        }
        if (user == null) {
            user = Optional.empty();
        }
        if (tenantId == null) {
            tenantId = Optional.empty();
        }
        if (expiresAt == null) {
            expiresAt = Optional.empty();
        }
        if (pollIntervalSeconds == null) {
            pollIntervalSeconds = Optional.empty();
        }
    }

    public static DeviceCodeStatus pending(int pollIntervalSeconds) {
        return new DeviceCodeStatus(
                Status.PENDING,
                Optional.of("Waiting for the user to complete sign-in"),
                Optional.empty(),
                Optional.empty(),
                Optional.empty(),
                Optional.of(pollIntervalSeconds));
    }

    public static DeviceCodeStatus completed(TokenRecord record) {
        return new DeviceCodeStatus(
                Status.COMPLETED,
                Optional.empty(),
                Optional.of(record.user()),
                Optional.of(record.tenantId()),
                Optional.of(record.expiresAt()),
                Optional.empty());
    }

    public static DeviceCodeStatus expired() {
        return new DeviceCodeStatus(
                Status.EXPIRED,
                Optional.of("Device code has expired, start sign-in again"),
                Optional.empty(),
                Optional.empty(),
                Optional.empty(),
                Optional.empty());
    }

    public static DeviceCodeStatus error(String message) {
        return new DeviceCodeStatus(
                Status.ERROR, Optional.of(message), Optional.empty(), Optional.empty(), Optional.empty(), Optional.empty());
    }

    public boolean isTerminal() {
        return status != Status.PENDING;
    }
}
