package com.stashguard.templates;

import com.stashguard.inventory.ItemTemplate;

import java.util.Map;

/**
 * Source of item template definitions, keyed by template id.
 */
public interface TemplateCatalog {

    /**
     * Loads the complete catalog.
     *
     * @return every known template keyed by id
     * @throws CatalogUnavailableException if the backing store cannot be read
     */
    Map<String, ItemTemplate> listAll() throws CatalogUnavailableException;
}
