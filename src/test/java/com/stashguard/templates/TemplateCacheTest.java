package com.stashguard.templates;

import com.stashguard.inventory.ItemTemplate;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

import java.time.Clock;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

public class TemplateCacheTest {

    @Mock
    private TemplateCatalog catalog;

    @Mock
    private Clock clock;

    private TemplateCache cache;
    private Map<String, ItemTemplate> templates;

    @BeforeEach
    void setUp() {
        MockitoAnnotations.openMocks(this);
        templates = TestCatalog.templates();
        cache = new TemplateCache(catalog, clock);
    }

    @Test
    void testFirstUseLoadsCatalog() throws Exception {
        when(clock.millis()).thenReturn(1_000L);
        when(catalog.listAll()).thenReturn(templates);

        assertEquals(templates.size(), cache.templates().size());
        assertEquals("Sword", cache.get("weapon:sword").orElseThrow().name());
        verify(catalog, times(1)).listAll();
    }

    @Test
    @DisplayName("A fresh cache is served without reloading")
    void testFreshCacheNotReloaded() throws Exception {
        when(clock.millis()).thenReturn(1_000L, 30_000L, 60_999L);
        when(catalog.listAll()).thenReturn(templates);

        cache.templates();
        cache.templates();
        cache.templates();

        verify(catalog, times(1)).listAll();
    }

    @Test
    void testExpiredCacheReloads() throws Exception {
        when(clock.millis()).thenReturn(1_000L, 61_000L);
        when(catalog.listAll()).thenReturn(templates, Map.of());

        assertFalse(cache.templates().isEmpty());
        assertTrue(cache.templates().isEmpty());
        verify(catalog, times(2)).listAll();
    }

    @Test
    void testFailedLoadPropagates() throws Exception {
        when(clock.millis()).thenReturn(1_000L);
        when(catalog.listAll()).thenThrow(new CatalogUnavailableException("store down"));

        assertThrows(CatalogUnavailableException.class, () -> cache.templates());
    }

    @Test
    @DisplayName("A failed reload propagates and the next call retries the load")
    void testFailedReloadNeverInstallsEmptyCatalog() throws Exception {
        when(clock.millis()).thenReturn(1_000L, 70_000L, 70_001L);
        when(catalog.listAll())
            .thenReturn(templates)
            .thenThrow(new CatalogUnavailableException("store down"))
            .thenReturn(templates);

        cache.templates();
        assertThrows(CatalogUnavailableException.class, () -> cache.templates());
        assertEquals(templates.size(), cache.templates().size());
        verify(catalog, times(3)).listAll();
    }

    @Test
    void testNullCatalogResultTreatedAsUnavailable() throws Exception {
        when(clock.millis()).thenReturn(1_000L);
        when(catalog.listAll()).thenReturn(null);

        assertThrows(CatalogUnavailableException.class, () -> cache.templates());
    }

    @Test
    void testInvalidateForcesReload() throws Exception {
        when(clock.millis()).thenReturn(1_000L);
        when(catalog.listAll()).thenReturn(templates);

        cache.templates();
        cache.invalidate();
        cache.templates();

        verify(catalog, times(2)).listAll();
    }

    @Test
    void testUnknownTemplateIsEmpty() throws Exception {
        when(clock.millis()).thenReturn(1_000L);
        when(catalog.listAll()).thenReturn(templates);

        assertTrue(cache.get("weapon:laser").isEmpty());
    }
}
