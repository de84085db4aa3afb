package com.stashguard.inventory;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class GridSpecTest {

    @Test
    void testFixedGrids() {
        assertEquals(10, GridSpec.STASH.width());
        assertEquals(10, GridSpec.STASH.height());
        assertEquals(100, GridSpec.STASH.maxItems());
        assertEquals(4, GridSpec.EXPEDITION.width());
        assertEquals(16, GridSpec.EXPEDITION.maxItems());
    }

    @Test
    void testRotatedFootprint() {
        ItemTemplate sword = new ItemTemplate("weapon:sword", "Sword", 2, 1, 1, false, false, 0, 0, 5);

        assertEquals(2, sword.effectiveWidth(false));
        assertEquals(1, sword.effectiveHeight(false));
        assertEquals(1, sword.effectiveWidth(true));
        assertEquals(2, sword.effectiveHeight(true));
    }

    @Test
    void testInvalidGridRejected() {
        assertThrows(IllegalArgumentException.class, () -> new GridSpec("bad", 0, 4, 16));
    }
}
