package com.stashguard.validation;

import com.stashguard.inventory.GridSpec;
import com.stashguard.inventory.InventoryItem;
import com.stashguard.inventory.ItemTemplate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;

/**
 * Validates the client-declared placement of items on a rectangular grid.
 *
 * <p>This does not search for a packing. Items are checked in submission order and the
 * first item to claim a cell keeps it, so a later item overlapping an earlier one is the
 * one reported.
 */
public class GridValidator {

    private static final Logger LOGGER = LoggerFactory.getLogger(GridValidator.class);

    private final ItemValidator itemValidator;

    public GridValidator(ItemValidator itemValidator) {
        this.itemValidator = itemValidator;
    }

    /**
     * Validates every item of one grid section.
     *
     * @param items submitted items, in submission order
     * @param templates template catalog keyed by id
     * @param grid grid dimensions and capacity
     * @return ok, or the first failure, located by item index
     */
    public ValidationResult validateGrid(List<InventoryItem> items, Map<String, ItemTemplate> templates, GridSpec grid) {
        if (items == null) {
            return ValidationResult.fail(FailureCode.MALFORMED_PAYLOAD, "Items must be an array");
        }
        if (items.size() > grid.maxItems()) {
            return ValidationResult.fail(FailureCode.TOO_MANY_ITEMS,
                "Too many items (" + items.size() + " > " + grid.maxItems() + ")");
        }

        OccupancyGrid cells = new OccupancyGrid(grid.width(), grid.height());
        for (int i = 0; i < items.size(); i++) {
            InventoryItem item = items.get(i);
            String label = "Item " + i;

            ValidationResult itemResult = itemValidator.validate(item, templates, 0);
            if (!itemResult.isValid()) {
                return itemResult.within(label);
            }

            ItemTemplate template = templates.get(item.templateId());
            if (template == null) {
                return ValidationResult.fail(FailureCode.UNKNOWN_TEMPLATE,
                    "Unknown template \"" + item.templateId() + "\"").within(label);
            }

            if (!item.hasPosition()) {
                return ValidationResult.fail(FailureCode.MISSING_POSITION, "Missing position").within(label);
            }
            String position = "(" + ItemValidator.format(item.x()) + ", " + ItemValidator.format(item.y()) + ")";
            if (item.x() < 0 || item.y() < 0) {
                return ValidationResult.fail(FailureCode.INVALID_POSITION, "Negative position " + position).within(label);
            }
            if (!ItemValidator.isWholeNumber(item.x()) || !ItemValidator.isWholeNumber(item.y())) {
                return ValidationResult.fail(FailureCode.INVALID_POSITION,
                    "Position must be whole cells " + position).within(label);
            }

            String named = label + " \"" + template.name() + "\"";
            int width = template.effectiveWidth(item.isRotated());
            int height = template.effectiveHeight(item.isRotated());
            if (item.x() + width > grid.width()) {
                return ValidationResult.fail(FailureCode.OUT_OF_BOUNDS, "Overflows grid width").within(named);
            }
            if (item.y() + height > grid.height()) {
                return ValidationResult.fail(FailureCode.OUT_OF_BOUNDS, "Overflows grid height").within(named);
            }

            int[] conflict = cells.claim(item.x().intValue(), item.y().intValue(), width, height);
            if (conflict != null) {
                return ValidationResult.fail(FailureCode.OVERLAP,
                    "Overlaps at (" + conflict[0] + ", " + conflict[1] + ")").within(named);
            }
        }

        LOGGER.debug("Validated {} items on {} grid {}x{}", items.size(), grid.label(), grid.width(), grid.height());
        return ValidationResult.ok();
    }
}
