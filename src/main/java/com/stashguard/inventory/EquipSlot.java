package com.stashguard.inventory;

import java.util.Optional;

/**
 * Canonical equipment slots and the numeric codes templates use for them.
 */
public enum EquipSlot {

    NONE(0, "none"),
    HEAD(1, "head"),
    CHEST(2, "chest"),
    LEGS(3, "legs"),
    FEET(4, "feet"),
    MAIN_HAND(5, "main_hand"),
    OFF_HAND(6, "off_hand"),
    BELT(7, "belt"),
    BACK(8, "back");

    private final int code;
    private final String slotName;

    EquipSlot(int code, String slotName) {
        this.code = code;
        this.slotName = slotName;
    }

    public int getCode() {
        return code;
    }

    public String getSlotName() {
        return slotName;
    }

    /**
     * Maps a template slot code to a slot. Unknown codes map to {@link #NONE}.
     */
    public static EquipSlot fromCode(int code) {
        for (EquipSlot slot : values()) {
            if (slot.code == code) {
                return slot;
            }
        }
        return NONE;
    }

    /**
     * Looks up a wearable slot by its canonical name. {@code "none"} is not a wearable slot.
     *
     * @param slotName the declared slot name
     * @return the slot, or empty if the name is not one of the canonical wearable slots
     */
    public static Optional<EquipSlot> fromSlotName(String slotName) {
        if (slotName == null) {
            return Optional.empty();
        }
        for (EquipSlot slot : values()) {
            if (slot != NONE && slot.slotName.equals(slotName)) {
                return Optional.of(slot);
            }
        }
        return Optional.empty();
    }

    @Override
    public String toString() {
        return slotName;
    }
}
