package com.stashguard.validation;

import com.stashguard.inventory.EquipSlot;
import com.stashguard.inventory.InventoryItem;
import com.stashguard.inventory.ItemTemplate;

import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Validates worn items against the fixed set of equipment slots.
 * Placement is slot identity only; equipped items have no grid coordinates.
 */
public class EquipmentValidator {

    private final ItemValidator itemValidator;

    public EquipmentValidator(ItemValidator itemValidator) {
        this.itemValidator = itemValidator;
    }

    /**
     * Validates the equipment section.
     *
     * @param items submitted equipped items, each declaring its slot
     * @param templates template catalog keyed by id
     * @return ok, or the first failure, located by entry index
     */
    public ValidationResult validateEquipment(List<InventoryItem> items, Map<String, ItemTemplate> templates) {
        if (items == null) {
            return ValidationResult.fail(FailureCode.MALFORMED_PAYLOAD, "Equipment must be an array");
        }

        Set<EquipSlot> usedSlots = EnumSet.noneOf(EquipSlot.class);
        for (int i = 0; i < items.size(); i++) {
            InventoryItem item = items.get(i);
            String label = "Equipment[" + i + "]";

            String slotName = item == null ? null : item.slot();
            if (slotName == null || slotName.isEmpty()) {
                return ValidationResult.fail(FailureCode.MISSING_SLOT, "Missing slot").within(label);
            }
            Optional<EquipSlot> declared = EquipSlot.fromSlotName(slotName);
            if (declared.isEmpty()) {
                return ValidationResult.fail(FailureCode.INVALID_SLOT, "Invalid slot \"" + slotName + "\"").within(label);
            }
            if (!usedSlots.add(declared.get())) {
                return ValidationResult.fail(FailureCode.DUPLICATE_SLOT, "Duplicate slot \"" + slotName + "\"").within(label);
            }

            String slotted = label + " (" + slotName + ")";
            ValidationResult itemResult = itemValidator.validate(item, templates, 0);
            if (!itemResult.isValid()) {
                return itemResult.within(slotted);
            }

            ItemTemplate template = templates.get(item.templateId());
            if (template == null) {
                return ValidationResult.fail(FailureCode.UNKNOWN_TEMPLATE,
                    "Unknown item \"" + item.templateId() + "\"").within(label);
            }

            EquipSlot expected = template.equipSlot();
            if (expected == EquipSlot.NONE) {
                return ValidationResult.fail(FailureCode.NOT_EQUIPPABLE,
                    "\"" + template.name() + "\" cannot be equipped").within(slotted);
            }
            if (expected != declared.get()) {
                return ValidationResult.fail(FailureCode.WRONG_SLOT,
                    "\"" + template.name() + "\" goes in " + expected.getSlotName() + ", not " + slotName).within(slotted);
            }
        }
        return ValidationResult.ok();
    }
}
