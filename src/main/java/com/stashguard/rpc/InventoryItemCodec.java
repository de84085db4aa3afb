package com.stashguard.rpc;

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.stashguard.inventory.InventoryItem;
import com.stashguard.validation.FailureCode;
import com.stashguard.validation.InventoryValidationException;
import com.stashguard.validation.ValidationFailure;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Converts between the JSON wire form of inventory items and {@link InventoryItem}.
 *
 * <p>Parsing enforces field types only: a field that is present must have the JSON type its
 * schema declares. Semantic rules (patterns, ranges, templates) belong to the validators.
 * Wire names: {@code t, n, x, y, r, c, slot, contents}.
 */
public final class InventoryItemCodec {

    private InventoryItemCodec() {
    }

    /**
     * Parses one inventory section.
     *
     * @param section the section value, absent or null meaning empty
     * @param itemLabel label format for top-level entries, e.g. {@code "Item %d"}
     * @param notArrayMessage reason reported when the section is not an array
     * @param slotted true for the equipment section, whose top-level items carry a {@code slot};
     *                elsewhere {@code slot} is ignored
     * @return the parsed items in submission order
     * @throws InventoryValidationException on the first field of the wrong type
     */
    public static List<InventoryItem> parseSection(
            JsonElement section, String itemLabel, String notArrayMessage, boolean slotted)
            throws InventoryValidationException {
        if (section == null || section.isJsonNull()) {
            return Collections.emptyList();
        }
        if (!section.isJsonArray()) {
            throw new InventoryValidationException(ValidationFailure.of(FailureCode.MALFORMED_PAYLOAD, notArrayMessage));
        }
        return parseItems(section.getAsJsonArray(), itemLabel, slotted);
    }

    private static List<InventoryItem> parseItems(JsonArray array, String labelFormat, boolean slotted)
            throws InventoryValidationException {
        List<InventoryItem> items = new ArrayList<>(array.size());
        for (int i = 0; i < array.size(); i++) {
            String label = String.format(labelFormat, i);
            try {
                items.add(parseItem(array.get(i), slotted));
            } catch (InventoryValidationException e) {
                throw new InventoryValidationException(e.getFailure().within(label));
            }
        }
        return items;
    }

    private static InventoryItem parseItem(JsonElement element, boolean slotted) throws InventoryValidationException {
        if (element == null || !element.isJsonObject()) {
            throw malformed(FailureCode.MALFORMED_PAYLOAD, "Item must be an object");
        }
        JsonObject object = element.getAsJsonObject();

        String templateId = optionalString(object, "t", FailureCode.MISSING_TEMPLATE_ID, "Missing template ID");
        Double count = optionalNumber(object, "n", FailureCode.INVALID_STACK, "Invalid stack size");
        Double x = optionalNumber(object, "x", FailureCode.INVALID_POSITION, "Invalid position");
        Double y = optionalNumber(object, "y", FailureCode.INVALID_POSITION, "Invalid position");

        Boolean rotated = null;
        JsonElement r = object.get("r");
        if (r != null && !r.isJsonNull()) {
            if (!r.isJsonPrimitive() || !r.getAsJsonPrimitive().isBoolean()) {
                throw malformed(FailureCode.INVALID_ROTATION, "Invalid rotation value");
            }
            rotated = r.getAsBoolean();
        }

        Double condition = optionalNumber(object, "c", FailureCode.INVALID_CONDITION, "Condition must be 0-100");
        String slot = slotted ? optionalString(object, "slot", FailureCode.INVALID_SLOT, "Invalid slot value") : null;

        List<InventoryItem> contents = null;
        JsonElement contentsElement = object.get("contents");
        if (contentsElement != null && !contentsElement.isJsonNull()) {
            if (!contentsElement.isJsonArray()) {
                throw malformed(FailureCode.INVALID_CONTENTS, "Contents must be an array");
            }
            contents = parseItems(contentsElement.getAsJsonArray(), "Contents[%d]", false);
        }

        return new InventoryItem(templateId, count, x, y, rotated, condition, slot, contents);
    }

    /**
     * Writes items in their persisted JSON form. Absent fields are omitted and whole numbers
     * are written without a fractional part.
     */
    public static JsonArray toJson(List<InventoryItem> items) {
        JsonArray array = new JsonArray();
        for (InventoryItem item : items) {
            array.add(toJson(item));
        }
        return array;
    }

    public static JsonObject toJson(InventoryItem item) {
        JsonObject object = new JsonObject();
        object.addProperty("t", item.templateId());
        addNumber(object, "n", item.count());
        addNumber(object, "x", item.x());
        addNumber(object, "y", item.y());
        if (item.rotated() != null) {
            object.addProperty("r", item.rotated());
        }
        addNumber(object, "c", item.condition());
        if (item.slot() != null) {
            object.addProperty("slot", item.slot());
        }
        if (item.contents() != null) {
            object.add("contents", toJson(item.contents()));
        }
        return object;
    }

    private static void addNumber(JsonObject object, String field, Double value) {
        if (value == null) {
            return;
        }
        if (value == Math.rint(value) && Math.abs(value) < 1e15) {
            object.addProperty(field, value.longValue());
        } else {
            object.addProperty(field, value);
        }
    }

    private static String optionalString(JsonObject object, String field, FailureCode code, String reason)
            throws InventoryValidationException {
        JsonElement value = object.get(field);
        if (value == null || value.isJsonNull()) {
            return null;
        }
        if (!value.isJsonPrimitive() || !value.getAsJsonPrimitive().isString()) {
            throw malformed(code, reason);
        }
        return value.getAsString();
    }

    private static Double optionalNumber(JsonObject object, String field, FailureCode code, String reason)
            throws InventoryValidationException {
        JsonElement value = object.get(field);
        if (value == null || value.isJsonNull()) {
            return null;
        }
        if (!value.isJsonPrimitive() || !value.getAsJsonPrimitive().isNumber()) {
            throw malformed(code, reason);
        }
        return value.getAsDouble();
    }

    private static InventoryValidationException malformed(FailureCode code, String reason) {
        return new InventoryValidationException(ValidationFailure.of(code, reason));
    }
}
