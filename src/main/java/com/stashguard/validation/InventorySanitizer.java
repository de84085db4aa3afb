package com.stashguard.validation;

import com.stashguard.inventory.InventoryItem;

import java.util.ArrayList;
import java.util.List;

/**
 * Reduces accepted items to the canonical shape that gets persisted.
 *
 * <p>Defaults are encoded by absence: no rotation field means unrotated, no condition field
 * means full condition, no contents field means empty. Sanitizing a sanitized item returns
 * an equal item.
 */
public class InventorySanitizer {

    /**
     * Sanitizes one accepted item and its contents.
     */
    public InventoryItem sanitize(InventoryItem item) {
        Double condition = null;
        if (item.condition() != null) {
            double rounded = Math.round(item.condition() * 10) / 10.0;
            if (rounded < ItemValidator.MAX_CONDITION) {
                condition = rounded;
            }
        }

        List<InventoryItem> contents = null;
        if (item.contents() != null && !item.contents().isEmpty()) {
            contents = sanitizeAll(item.contents());
        }

        return new InventoryItem(
            item.templateId(),
            truncate(item.count()),
            truncate(item.x()),
            truncate(item.y()),
            item.isRotated() ? Boolean.TRUE : null,
            condition,
            item.slot(),
            contents
        );
    }

    /**
     * Sanitizes a whole section, preserving order.
     */
    public List<InventoryItem> sanitizeAll(List<InventoryItem> items) {
        List<InventoryItem> sanitized = new ArrayList<>(items.size());
        for (InventoryItem item : items) {
            sanitized.add(sanitize(item));
        }
        return sanitized;
    }

    private static Double truncate(Double value) {
        return value == null ? null : Math.floor(value);
    }
}
