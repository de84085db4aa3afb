package com.stashguard.inventory;

import java.util.List;

/**
 * One submitted item node. Nested contents make this a tree.
 *
 * <p>Numeric fields are kept as submitted (possibly fractional) so validation can reject
 * non-integral counts and positions; the sanitizer produces the canonical integral form.
 * Absent optional fields are {@code null}.
 *
 * @param templateId template key, {@code namespace:name}
 * @param count stack count
 * @param x grid column, grid-resident and contained items only
 * @param y grid row, grid-resident and contained items only
 * @param rotated swaps the template footprint when true
 * @param condition wear value in [0, 100]
 * @param slot equipment slot name, equipped items only
 * @param contents nested items, legal only for container templates
 */
public record InventoryItem(
    String templateId,
    Double count,
    Double x,
    Double y,
    Boolean rotated,
    Double condition,
    String slot,
    List<InventoryItem> contents
) {

    public InventoryItem {
        if (contents != null) {
            contents = List.copyOf(contents);
        }
    }

    /**
     * Creates a bare item with only a template and a count.
     */
    public static InventoryItem of(String templateId, double count) {
        return new InventoryItem(templateId, count, null, null, null, null, null, null);
    }

    public InventoryItem withPosition(double x, double y) {
        return new InventoryItem(templateId, count, x, y, rotated, condition, slot, contents);
    }

    public InventoryItem withRotation(Boolean rotated) {
        return new InventoryItem(templateId, count, x, y, rotated, condition, slot, contents);
    }

    public InventoryItem withCondition(Double condition) {
        return new InventoryItem(templateId, count, x, y, rotated, condition, slot, contents);
    }

    public InventoryItem withSlot(String slot) {
        return new InventoryItem(templateId, count, x, y, rotated, condition, slot, contents);
    }

    public InventoryItem withContents(List<InventoryItem> contents) {
        return new InventoryItem(templateId, count, x, y, rotated, condition, slot, contents);
    }

    /**
     * @return true only when the rotation flag is present and set
     */
    public boolean isRotated() {
        return Boolean.TRUE.equals(rotated);
    }

    public boolean hasPosition() {
        return x != null && y != null;
    }

    public boolean hasContents() {
        return contents != null;
    }
}
