package com.stashguard.templates;

import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonPrimitive;
import com.stashguard.inventory.ItemTemplate;
import com.stashguard.persistence.DocumentPath;
import com.stashguard.persistence.DocumentStore;
import com.stashguard.persistence.StoreException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Comparator;
import java.util.HashMap;
import java.util.Map;
import java.util.TreeMap;

/**
 * Template catalog read from the {@code items} collection of a document store.
 * The document id is the template key.
 */
public class StoreTemplateCatalog implements TemplateCatalog {

    private static final Logger LOGGER = LoggerFactory.getLogger(StoreTemplateCatalog.class);

    public static final String COLLECTION = "items";

    private final DocumentStore store;

    public StoreTemplateCatalog(DocumentStore store) {
        this.store = store;
    }

    @Override
    public Map<String, ItemTemplate> listAll() throws CatalogUnavailableException {
        Map<String, JsonObject> documents;
        try {
            documents = store.list(COLLECTION);
        } catch (StoreException e) {
            throw new CatalogUnavailableException("Failed to read item catalog: " + e.getMessage(), e);
        }

        Map<String, ItemTemplate> templates = new HashMap<>();
        for (Map.Entry<String, JsonObject> entry : documents.entrySet()) {
            try {
                templates.put(entry.getKey(), fromDocument(entry.getKey(), entry.getValue()));
            } catch (IllegalArgumentException e) {
                LOGGER.warn("Skipping malformed item template '{}': {}", entry.getKey(), e.getMessage());
            }
        }
        return templates;
    }

    /**
     * Writes catalog documents into the store, one document per template id.
     * Every document is checked before the first write, so a malformed entry writes nothing.
     * Each template is its own commit: a store failure partway through keeps the templates
     * already written, and the import can be rerun.
     *
     * @param documents catalog documents keyed by template id
     * @return the number of templates written
     * @throws IllegalArgumentException if an entry is not a valid template document
     * @throws StoreException if a write fails
     */
    public int importCatalog(JsonObject documents) throws StoreException {
        Map<DocumentPath, ItemTemplate> templates = new TreeMap<>(Comparator.comparing(DocumentPath::id));
        for (Map.Entry<String, JsonElement> entry : documents.entrySet()) {
            if (!entry.getValue().isJsonObject()) {
                throw new IllegalArgumentException("Template '" + entry.getKey() + "' must be an object");
            }
            try {
                templates.put(DocumentPath.of(COLLECTION, entry.getKey()),
                    fromDocument(entry.getKey(), entry.getValue().getAsJsonObject()));
            } catch (IllegalArgumentException e) {
                throw new IllegalArgumentException("Template '" + entry.getKey() + "': " + e.getMessage(), e);
            }
        }

        int written = 0;
        for (Map.Entry<DocumentPath, ItemTemplate> entry : templates.entrySet()) {
            try {
                store.batch().set(entry.getKey(), toDocument(entry.getValue())).commit();
            } catch (StoreException e) {
                LOGGER.error("Catalog import stopped at '{}' after writing {} of {} templates",
                             entry.getKey().id(), written, templates.size());
                throw e;
            }
            written++;
        }
        LOGGER.info("Imported {} item templates", templates.size());
        return templates.size();
    }

    /**
     * Maps a catalog document to a template.
     *
     * @throws IllegalArgumentException if a required field is missing or has the wrong type
     */
    public static ItemTemplate fromDocument(String id, JsonObject document) {
        boolean container = optionalBoolean(document, "is_container");
        return new ItemTemplate(
            id,
            document.has("item_name") ? requireString(document, "item_name") : id,
            requirePositiveInt(document, "grid_width"),
            requirePositiveInt(document, "grid_height"),
            requireInt(document, "max_stack"),
            optionalBoolean(document, "is_stackable"),
            container,
            container ? requirePositiveInt(document, "container_grid_width") : 0,
            container ? requirePositiveInt(document, "container_grid_height") : 0,
            document.has("equip_slot") ? requireInt(document, "equip_slot") : 0
        );
    }

    /**
     * Maps a template back to its catalog document shape.
     */
    public static JsonObject toDocument(ItemTemplate template) {
        JsonObject document = new JsonObject();
        document.addProperty("item_name", template.name());
        document.addProperty("grid_width", template.gridWidth());
        document.addProperty("grid_height", template.gridHeight());
        document.addProperty("max_stack", template.maxStack());
        document.addProperty("is_stackable", template.stackable());
        document.addProperty("is_container", template.container());
        if (template.container()) {
            document.addProperty("container_grid_width", template.containerWidth());
            document.addProperty("container_grid_height", template.containerHeight());
        }
        document.addProperty("equip_slot", template.equipSlotCode());
        return document;
    }

    private static int requireInt(JsonObject document, String field) {
        JsonPrimitive value = requirePrimitive(document, field);
        if (!value.isNumber()) {
            throw new IllegalArgumentException("Field '" + field + "' must be a number");
        }
        double number = value.getAsDouble();
        if (number != Math.rint(number) || number < 0 || number > Integer.MAX_VALUE) {
            throw new IllegalArgumentException("Field '" + field + "' must be a non-negative integer, got " + value);
        }
        return (int) number;
    }

    private static int requirePositiveInt(JsonObject document, String field) {
        int value = requireInt(document, field);
        if (value < 1) {
            throw new IllegalArgumentException("Field '" + field + "' must be at least 1");
        }
        return value;
    }

    private static String requireString(JsonObject document, String field) {
        JsonPrimitive value = requirePrimitive(document, field);
        if (!value.isString()) {
            throw new IllegalArgumentException("Field '" + field + "' must be a string");
        }
        return value.getAsString();
    }

    private static boolean optionalBoolean(JsonObject document, String field) {
        JsonElement value = document.get(field);
        if (value == null || value.isJsonNull()) {
            return false;
        }
        if (!value.isJsonPrimitive() || !value.getAsJsonPrimitive().isBoolean()) {
            throw new IllegalArgumentException("Field '" + field + "' must be a boolean");
        }
        return value.getAsBoolean();
    }

    private static JsonPrimitive requirePrimitive(JsonObject document, String field) {
        JsonElement value = document.get(field);
        if (value == null || !value.isJsonPrimitive()) {
            throw new IllegalArgumentException("Missing field '" + field + "'");
        }
        return value.getAsJsonPrimitive();
    }
}
