package com.stashguard.inventory;

/**
 * Read-only catalog definition of an item kind.
 *
 * @param id namespaced key, for example {@code weapon:sword}
 * @param name display name used in validation messages
 * @param gridWidth footprint width when unrotated
 * @param gridHeight footprint height when unrotated
 * @param maxStack largest legal stack count
 * @param stackable whether stacks above one are allowed at all
 * @param container whether the item may hold nested contents
 * @param containerWidth interior width, only meaningful for containers
 * @param containerHeight interior height, only meaningful for containers
 * @param equipSlotCode numeric slot code, see {@link EquipSlot}
 */
public record ItemTemplate(
    String id,
    String name,
    int gridWidth,
    int gridHeight,
    int maxStack,
    boolean stackable,
    boolean container,
    int containerWidth,
    int containerHeight,
    int equipSlotCode
) {

    /**
     * Resolves the slot this template may be worn in.
     *
     * @return the mapped slot, {@link EquipSlot#NONE} for non-equippable templates
     */
    public EquipSlot equipSlot() {
        return EquipSlot.fromCode(equipSlotCode);
    }

    /**
     * Effective footprint width for the given rotation.
     */
    public int effectiveWidth(boolean rotated) {
        return rotated ? gridHeight : gridWidth;
    }

    /**
     * Effective footprint height for the given rotation.
     */
    public int effectiveHeight(boolean rotated) {
        return rotated ? gridWidth : gridHeight;
    }
}
