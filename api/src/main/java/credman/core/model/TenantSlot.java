package credman.core.model;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

/**
 * The two independent identity contexts managed by the credential manager.
 *
 * <p>Every storage key, validation and API operation is parameterized by a slot.
 * Slots never share storage keys or in-memory state.
 */
public enum TenantSlot {
    SOURCE("source"),
    TARGET("target");

    private final String id;

    TenantSlot(String id) {
        this.id = id;
    }

    /**
     * Wire and storage identifier of the slot.
     *
     * @return lower-case identifier ("source" or "target")
     */
    public String id() {
        return id;
    }

    /**
     * Parse a slot identifier as supplied by a caller.
     *
     * @param value the raw identifier (case-insensitive, surrounding whitespace ignored)
     * @return the slot, or empty if the value names no slot
     */
    public static Optional<TenantSlot> fromId(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        final var normalized = value.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values()).filter(s -> s.id.equals(normalized)).findFirst();
    }

    @Override
    public String toString() {
        return id;
    }
}
