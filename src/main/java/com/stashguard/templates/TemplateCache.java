package com.stashguard.templates;

import com.stashguard.inventory.ItemTemplate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.Map;
import java.util.Optional;

/**
 * Read-through cache over the template catalog with bounded staleness.
 *
 * <p>The whole catalog is loaded on first use and again once the freshness window has
 * elapsed since the last load. Reloads are not serialized: callers that observe an
 * expired cache at the same moment may each reload, and the last one to finish wins.
 * A failed load leaves the previous snapshot in place and propagates the failure.
 */
public class TemplateCache {

    private static final Logger LOGGER = LoggerFactory.getLogger(TemplateCache.class);

    public static final Duration DEFAULT_TTL = Duration.ofSeconds(60);

    private final TemplateCatalog catalog;
    private final Clock clock;
    private final long ttlMillis;

    private volatile Snapshot snapshot;

    public TemplateCache(TemplateCatalog catalog, Clock clock) {
        this(catalog, clock, DEFAULT_TTL);
    }

    public TemplateCache(TemplateCatalog catalog, Clock clock, Duration ttl) {
        this.catalog = catalog;
        this.clock = clock;
        this.ttlMillis = ttl.toMillis();
    }

    /**
     * Returns the current catalog, loading it first if the cache is empty or expired.
     *
     * @return immutable template map keyed by id
     * @throws CatalogUnavailableException if a required load fails
     */
    public Map<String, ItemTemplate> templates() throws CatalogUnavailableException {
        long now = clock.millis();
        Snapshot current = snapshot;
        if (current != null && now - current.loadedAt() < ttlMillis) {
            return current.templates();
        }
        return reload(now).templates();
    }

    /**
     * Looks up one template.
     *
     * @param templateId the template key
     * @return the template, or empty if the catalog has no such key
     * @throws CatalogUnavailableException if a required load fails
     */
    public Optional<ItemTemplate> get(String templateId) throws CatalogUnavailableException {
        return Optional.ofNullable(templates().get(templateId));
    }

    /**
     * Drops the cached catalog so the next access reloads it.
     */
    public void invalidate() {
        snapshot = null;
        LOGGER.debug("Template cache invalidated");
    }

    private Snapshot reload(long now) throws CatalogUnavailableException {
        Map<String, ItemTemplate> loaded;
        try {
            loaded = catalog.listAll();
        } catch (CatalogUnavailableException e) {
            LOGGER.error("Failed to load item templates: {}", e.getMessage());
            throw e;
        }
        if (loaded == null) {
            throw new CatalogUnavailableException("Template catalog returned no data");
        }

        Snapshot fresh = new Snapshot(Map.copyOf(loaded), now);
        snapshot = fresh;
        LOGGER.info("Loaded {} item templates", fresh.templates().size());
        return fresh;
    }

    private record Snapshot(Map<String, ItemTemplate> templates, long loadedAt) {}
}
