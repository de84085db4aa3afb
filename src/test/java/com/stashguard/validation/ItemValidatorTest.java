package com.stashguard.validation;

import com.stashguard.inventory.InventoryItem;
import com.stashguard.inventory.ItemTemplate;
import com.stashguard.templates.TestCatalog;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class ItemValidatorTest {

    private ItemValidator validator;
    private Map<String, ItemTemplate> templates;

    @BeforeEach
    void setUp() {
        validator = new ItemValidator();
        templates = TestCatalog.templates();
    }

    @Test
    void testValidItemPasses() {
        assertTrue(validator.validate(InventoryItem.of("weapon:sword", 1), templates, 0).isValid());
        assertTrue(validator.validate(InventoryItem.of("ammo:rounds", 60), templates, 0).isValid());
    }

    @Test
    void testMissingTemplateId() {
        ValidationResult result = validator.validate(new InventoryItem(null, 1.0, null, null, null, null, null, null), templates, 0);

        assertEquals(FailureCode.MISSING_TEMPLATE_ID, result.failure().code());
        assertEquals("Missing template ID", result.message());

        assertEquals(FailureCode.MISSING_TEMPLATE_ID,
            validator.validate(InventoryItem.of("", 1), templates, 0).failure().code());
    }

    @Test
    void testMalformedTemplateId() {
        ValidationResult result = validator.validate(InventoryItem.of("Weapon:Sword", 1), templates, 0);

        assertEquals(FailureCode.INVALID_TEMPLATE_ID, result.failure().code());
        assertEquals("Invalid template ID format: \"Weapon:Sword\"", result.message());

        assertFalse(validator.validate(InventoryItem.of("sword", 1), templates, 0).isValid());
        assertFalse(validator.validate(InventoryItem.of("weapon:sword:extra", 1), templates, 0).isValid());
    }

    @Test
    void testUnknownTemplate() {
        ValidationResult result = validator.validate(InventoryItem.of("weapon:laser", 1), templates, 0);

        assertEquals(FailureCode.UNKNOWN_TEMPLATE, result.failure().code());
        assertEquals("Unknown item: \"weapon:laser\"", result.message());
    }

    @Test
    void testStackCountRules() {
        assertEquals("Invalid stack size", validator.validate(InventoryItem.of("ammo:rounds", 0), templates, 0).message());
        assertEquals("Invalid stack size", validator.validate(InventoryItem.of("ammo:rounds", 2.5), templates, 0).message());
        assertEquals("Invalid stack size",
            validator.validate(new InventoryItem("ammo:rounds", null, null, null, null, null, null, null), templates, 0).message());

        ValidationResult tooMany = validator.validate(InventoryItem.of("ammo:rounds", 61), templates, 0);
        assertEquals(FailureCode.INVALID_STACK, tooMany.failure().code());
        assertEquals("Stack 61 exceeds max 60", tooMany.message());
    }

    @Test
    void testNonStackableItemRejectsCountAboveOne() {
        ItemTemplate flask = new ItemTemplate("misc:flask", "Flask", 1, 1, 5, false, false, 0, 0, 0);
        Map<String, ItemTemplate> withFlask = new HashMap<>(templates);
        withFlask.put(flask.id(), flask);

        ValidationResult result = validator.validate(InventoryItem.of("misc:flask", 2), withFlask, 0);

        assertEquals(FailureCode.NOT_STACKABLE, result.failure().code());
        assertEquals("\"Flask\" is not stackable", result.message());
    }

    @Test
    void testConditionRange() {
        assertTrue(validator.validate(InventoryItem.of("weapon:sword", 1).withCondition(0.0), templates, 0).isValid());
        assertTrue(validator.validate(InventoryItem.of("weapon:sword", 1).withCondition(100.0), templates, 0).isValid());

        ValidationResult result = validator.validate(InventoryItem.of("weapon:sword", 1).withCondition(100.5), templates, 0);
        assertEquals(FailureCode.INVALID_CONDITION, result.failure().code());
        assertEquals("Condition must be 0-100", result.message());

        assertFalse(validator.validate(InventoryItem.of("weapon:sword", 1).withCondition(-1.0), templates, 0).isValid());
    }

    @Test
    void testContentsRequireContainer() {
        InventoryItem sword = InventoryItem.of("weapon:sword", 1)
            .withContents(List.of(InventoryItem.of("misc:coin", 5).withPosition(0, 0)));

        ValidationResult result = validator.validate(sword, templates, 0);

        assertEquals(FailureCode.NOT_A_CONTAINER, result.failure().code());
        assertEquals("\"Sword\" is not a container", result.message());
    }

    @Test
    void testEmptyContentsOnNonContainerStillRejected() {
        ValidationResult result = validator.validate(InventoryItem.of("weapon:sword", 1).withContents(List.of()), templates, 0);

        assertEquals(FailureCode.NOT_A_CONTAINER, result.failure().code());
    }

    @Test
    @DisplayName("Depth 2 nesting is accepted, depth 3 is rejected")
    void testNestingDepth() {
        InventoryItem coin = InventoryItem.of("misc:coin", 10).withPosition(0, 0);
        InventoryItem pouch = InventoryItem.of("bag:pouch", 1).withPosition(0, 0).withContents(List.of(coin));
        InventoryItem backpack = InventoryItem.of("bag:backpack", 1).withContents(List.of(pouch));

        assertTrue(validator.validate(backpack, templates, 0).isValid());

        InventoryItem innerPouch = InventoryItem.of("bag:pouch", 1).withPosition(0, 0).withContents(List.of(coin));
        InventoryItem middlePouch = InventoryItem.of("bag:pouch", 1).withPosition(0, 0).withContents(List.of(innerPouch));
        InventoryItem tooDeep = InventoryItem.of("bag:backpack", 1).withContents(List.of(middlePouch));

        ValidationResult result = validator.validate(tooDeep, templates, 0);
        assertEquals(FailureCode.NESTING_TOO_DEEP, result.failure().code());
        assertEquals("Contents[0]: Contents[0]: Container nesting too deep", result.message());
    }

    @Test
    void testEmptyContentsAtMaxDepthAllowed() {
        InventoryItem emptyPouch = InventoryItem.of("bag:pouch", 1).withPosition(0, 0).withContents(List.of());
        InventoryItem pouch = InventoryItem.of("bag:pouch", 1).withPosition(0, 0).withContents(List.of(emptyPouch));
        InventoryItem backpack = InventoryItem.of("bag:backpack", 1).withContents(List.of(pouch));

        assertTrue(validator.validate(backpack, templates, 0).isValid());
    }

    @Test
    void testContentsPlacement() {
        InventoryItem missing = InventoryItem.of("misc:coin", 1);
        assertEquals("Contents[0]: Missing position",
            validator.validate(InventoryItem.of("bag:pouch", 1).withContents(List.of(missing)), templates, 0).message());

        InventoryItem outside = InventoryItem.of("weapon:sword", 1).withPosition(1, 0);
        ValidationResult outOfBounds = validator.validate(
            InventoryItem.of("bag:pouch", 1).withContents(List.of(outside)), templates, 0);
        assertEquals(FailureCode.OUT_OF_BOUNDS, outOfBounds.failure().code());
        assertEquals("Contents[0]: Outside container bounds", outOfBounds.message());

        InventoryItem first = InventoryItem.of("weapon:sword", 1).withPosition(0, 0);
        InventoryItem second = InventoryItem.of("misc:coin", 1).withPosition(1, 0);
        ValidationResult overlap = validator.validate(
            InventoryItem.of("bag:backpack", 1).withContents(List.of(first, second)), templates, 0);
        assertEquals(FailureCode.OVERLAP, overlap.failure().code());
        assertEquals("Contents[1]: Overlaps within container", overlap.message());
    }

    @Test
    void testRotatedContentsUseSwappedFootprint() {
        // Sword is 2x1; rotated it fits a 1-wide column of the 2x2 pouch.
        InventoryItem rotated = InventoryItem.of("weapon:sword", 1).withPosition(1, 0).withRotation(true);

        assertTrue(validator.validate(InventoryItem.of("bag:pouch", 1).withContents(List.of(rotated)), templates, 0).isValid());
    }

    @Test
    void testChildFailureIsPrefixedWithIndex() {
        InventoryItem bad = InventoryItem.of("misc:coin", 101).withPosition(0, 0);
        InventoryItem good = InventoryItem.of("misc:coin", 1).withPosition(1, 1);

        ValidationResult result = validator.validate(
            InventoryItem.of("bag:backpack", 1).withContents(List.of(good, bad)), templates, 0);

        assertEquals("Contents[1]: Stack 101 exceeds max 100", result.message());
    }
}
