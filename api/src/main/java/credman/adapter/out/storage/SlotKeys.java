package credman.adapter.out.storage;

import credman.core.model.TenantSlot;

/**
 * Storage key namespace of one slot.
 *
 * <p>Keys are derived from the slot alone, so a lookup for one slot can never
 * address an entry of the other slot.
 *
 * @param namespace prefix shared by every key of the slot, e.g. {@code credman:slot:source:}
 */
public record SlotKeys(String namespace) {

    private static final String RECORD = "record";

    public static SlotKeys of(String keyPrefix, TenantSlot slot) {
        return new SlotKeys(keyPrefix + "slot:" + slot.id() + ":");
    }

    /**
     * Key holding the slot's encrypted token record.
     */
    public String record() {
        return namespace + RECORD;
    }
}
