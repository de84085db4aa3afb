package com.stashguard.inventory;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class EquipSlotTest {

    @Test
    void testCodeTable() {
        assertEquals(EquipSlot.NONE, EquipSlot.fromCode(0));
        assertEquals(EquipSlot.HEAD, EquipSlot.fromCode(1));
        assertEquals(EquipSlot.CHEST, EquipSlot.fromCode(2));
        assertEquals(EquipSlot.MAIN_HAND, EquipSlot.fromCode(5));
        assertEquals(EquipSlot.BACK, EquipSlot.fromCode(8));
    }

    @Test
    void testUnknownCodesMapToNone() {
        assertEquals(EquipSlot.NONE, EquipSlot.fromCode(9));
        assertEquals(EquipSlot.NONE, EquipSlot.fromCode(-1));
    }

    @Test
    void testSlotNames() {
        assertEquals(EquipSlot.OFF_HAND, EquipSlot.fromSlotName("off_hand").orElseThrow());
        assertEquals("main_hand", EquipSlot.MAIN_HAND.toString());
        assertTrue(EquipSlot.fromSlotName("none").isEmpty());
        assertTrue(EquipSlot.fromSlotName("HEAD").isEmpty());
        assertTrue(EquipSlot.fromSlotName(null).isEmpty());
    }
}
