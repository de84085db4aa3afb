package com.stashguard.inventory;

/**
 * Dimensions and capacity of one rectangular inventory grid.
 */
public record GridSpec(String label, int width, int height, int maxItems) {

    public static final GridSpec STASH = new GridSpec("stash", 10, 10, 100);
    public static final GridSpec EXPEDITION = new GridSpec("expedition", 4, 4, 16);

    public GridSpec {
        if (width <= 0 || height <= 0) {
            throw new IllegalArgumentException("Grid dimensions must be positive: " + width + "x" + height);
        }
        if (maxItems < 0) {
            throw new IllegalArgumentException("Grid capacity cannot be negative: " + maxItems);
        }
    }
}
