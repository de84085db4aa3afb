package com.stashguard.validation;

/**
 * Cell claim table for one rectangular coordinate space.
 * The first rectangle to claim a cell keeps it.
 */
final class OccupancyGrid {

    private final int width;
    private final int height;
    private final boolean[] claimed;

    OccupancyGrid(int width, int height) {
        this.width = width;
        this.height = height;
        this.claimed = new boolean[Math.max(0, width) * Math.max(0, height)];
    }

    /**
     * @return true if the rectangle lies entirely inside the space
     */
    boolean contains(double x, double y, int rectWidth, int rectHeight) {
        return x >= 0 && y >= 0 && x + rectWidth <= width && y + rectHeight <= height;
    }

    /**
     * Claims every cell of an in-bounds rectangle, scanning columns then rows.
     *
     * @return null if all cells were free, otherwise the first cell already taken as {@code {x, y}}
     */
    int[] claim(int x, int y, int rectWidth, int rectHeight) {
        for (int dx = 0; dx < rectWidth; dx++) {
            for (int dy = 0; dy < rectHeight; dy++) {
                int index = (y + dy) * width + (x + dx);
                if (claimed[index]) {
                    return new int[] {x + dx, y + dy};
                }
                claimed[index] = true;
            }
        }
        return null;
    }
}
