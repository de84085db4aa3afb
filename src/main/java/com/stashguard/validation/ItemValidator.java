package com.stashguard.validation;

import com.stashguard.inventory.InventoryItem;
import com.stashguard.inventory.ItemTemplate;

import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Checks one item, and recursively its contents, against its template.
 *
 * <p>Rules are checked in a fixed order and the first failure wins: template id format,
 * template existence, stack count, rotation, condition, then contents. Shared by grid and
 * equipment validation.
 */
public class ItemValidator {

    /** Deepest level that may exist; items at this depth may not hold contents. */
    public static final int MAX_CONTAINER_DEPTH = 2;

    public static final int MAX_CONDITION = 100;

    private static final Pattern TEMPLATE_ID_PATTERN = Pattern.compile("^[a-z0-9_]+:[a-z0-9_]+$");

    /**
     * Validates an item at the given nesting depth.
     *
     * @param item the submitted item
     * @param templates template catalog keyed by id
     * @param depth 0 for items placed directly in a grid or slot
     * @return ok, or the first failure
     */
    public ValidationResult validate(InventoryItem item, Map<String, ItemTemplate> templates, int depth) {
        if (item == null) {
            return ValidationResult.fail(FailureCode.MALFORMED_PAYLOAD, "Item must be an object");
        }

        String templateId = item.templateId();
        if (templateId == null || templateId.isEmpty()) {
            return ValidationResult.fail(FailureCode.MISSING_TEMPLATE_ID, "Missing template ID");
        }
        if (!TEMPLATE_ID_PATTERN.matcher(templateId).matches()) {
            return ValidationResult.fail(FailureCode.INVALID_TEMPLATE_ID,
                "Invalid template ID format: \"" + templateId + "\"");
        }

        ItemTemplate template = templates.get(templateId);
        if (template == null) {
            return ValidationResult.fail(FailureCode.UNKNOWN_TEMPLATE, "Unknown item: \"" + templateId + "\"");
        }

        Double count = item.count();
        if (count == null || !isWholeNumber(count) || count < 1) {
            return ValidationResult.fail(FailureCode.INVALID_STACK, "Invalid stack size");
        }
        if (count > template.maxStack()) {
            return ValidationResult.fail(FailureCode.INVALID_STACK,
                "Stack " + format(count) + " exceeds max " + template.maxStack());
        }
        if (!template.stackable() && count > 1) {
            return ValidationResult.fail(FailureCode.NOT_STACKABLE, "\"" + template.name() + "\" is not stackable");
        }

        // Rotation is typed as Boolean once parsed, so only the condition range remains.
        Double condition = item.condition();
        if (condition != null && (condition.isNaN() || condition < 0 || condition > MAX_CONDITION)) {
            return ValidationResult.fail(FailureCode.INVALID_CONDITION, "Condition must be 0-" + MAX_CONDITION);
        }

        if (item.hasContents()) {
            return validateContents(item.contents(), template, templates, depth);
        }
        return ValidationResult.ok();
    }

    private ValidationResult validateContents(
            List<InventoryItem> contents,
            ItemTemplate container,
            Map<String, ItemTemplate> templates,
            int depth) {

        if (!container.container()) {
            return ValidationResult.fail(FailureCode.NOT_A_CONTAINER, "\"" + container.name() + "\" is not a container");
        }
        if (contents.isEmpty()) {
            return ValidationResult.ok();
        }
        if (depth >= MAX_CONTAINER_DEPTH) {
            return ValidationResult.fail(FailureCode.NESTING_TOO_DEEP, "Container nesting too deep");
        }

        OccupancyGrid interior = new OccupancyGrid(container.containerWidth(), container.containerHeight());
        for (int i = 0; i < contents.size(); i++) {
            String label = "Contents[" + i + "]";
            InventoryItem child = contents.get(i);

            ValidationResult childResult = validate(child, templates, depth + 1);
            if (!childResult.isValid()) {
                return childResult.within(label);
            }

            ItemTemplate childTemplate = templates.get(child.templateId());
            if (!child.hasPosition()) {
                return ValidationResult.fail(FailureCode.MISSING_POSITION, "Missing position").within(label);
            }
            if (!isWholeNumber(child.x()) || !isWholeNumber(child.y())) {
                return ValidationResult.fail(FailureCode.INVALID_POSITION,
                    "Position must be whole cells (" + format(child.x()) + ", " + format(child.y()) + ")").within(label);
            }

            int width = childTemplate.effectiveWidth(child.isRotated());
            int height = childTemplate.effectiveHeight(child.isRotated());
            if (!interior.contains(child.x(), child.y(), width, height)) {
                return ValidationResult.fail(FailureCode.OUT_OF_BOUNDS, "Outside container bounds").within(label);
            }
            if (interior.claim(child.x().intValue(), child.y().intValue(), width, height) != null) {
                return ValidationResult.fail(FailureCode.OVERLAP, "Overlaps within container").within(label);
            }
        }
        return ValidationResult.ok();
    }

    static boolean isWholeNumber(Double value) {
        return value != null && !value.isInfinite() && !value.isNaN() && value == Math.rint(value);
    }

    /**
     * Formats a submitted number the way a client wrote it: {@code 3} rather than {@code 3.0}.
     */
    static String format(Double value) {
        if (value == null) {
            return "null";
        }
        if (isWholeNumber(value) && Math.abs(value) < 1e15) {
            return Long.toString(value.longValue());
        }
        return value.toString();
    }
}
