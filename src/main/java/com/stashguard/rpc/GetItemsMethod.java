package com.stashguard.rpc;

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.stashguard.identity.AuthenticationException;
import com.stashguard.identity.IdentityVerifier;
import com.stashguard.inventory.ItemTemplate;
import com.stashguard.templates.CatalogUnavailableException;
import com.stashguard.templates.StoreTemplateCatalog;
import com.stashguard.templates.TemplateCache;

import java.util.Map;
import java.util.TreeMap;

/**
 * {@code getItems}: reads item templates from the cache.
 *
 * <p>With {@code params.id}, returns that template's document. Without it, returns every
 * template document as an array ordered by id. Each document carries its {@code id}.
 */
public class GetItemsMethod implements RpcMethod {

    public static final String NAME = "getItems";

    private final IdentityVerifier identityVerifier;
    private final TemplateCache templateCache;

    public GetItemsMethod(IdentityVerifier identityVerifier, TemplateCache templateCache) {
        this.identityVerifier = identityVerifier;
        this.templateCache = templateCache;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public JsonElement invoke(RpcCall call) throws RpcException {
        try {
            identityVerifier.verify(call.credential());
        } catch (AuthenticationException e) {
            throw new RpcException(RpcStatus.UNAUTHENTICATED, "Must be authenticated", e);
        }

        JsonElement idElement = call.params().get("id");
        try {
            if (idElement == null || idElement.isJsonNull()) {
                return listAll();
            }
            if (!idElement.isJsonPrimitive() || !idElement.getAsJsonPrimitive().isString()
                    || idElement.getAsString().isBlank()) {
                throw new RpcException(RpcStatus.INVALID_ARGUMENT, "Invalid item id");
            }

            String id = idElement.getAsString();
            ItemTemplate template = templateCache.get(id)
                .orElseThrow(() -> new RpcException(RpcStatus.NOT_FOUND, "Item not found for id: \"" + id + "\""));
            return document(template);
        } catch (CatalogUnavailableException e) {
            throw new RpcException(RpcStatus.UNAVAILABLE, "Item templates are temporarily unavailable", e);
        }
    }

    private JsonArray listAll() throws CatalogUnavailableException, RpcException {
        Map<String, ItemTemplate> templates = new TreeMap<>(templateCache.templates());
        if (templates.isEmpty()) {
            throw new RpcException(RpcStatus.NOT_FOUND, "No item templates found");
        }
        JsonArray array = new JsonArray();
        for (ItemTemplate template : templates.values()) {
            array.add(document(template));
        }
        return array;
    }

    private static JsonObject document(ItemTemplate template) {
        JsonObject document = StoreTemplateCatalog.toDocument(template);
        document.addProperty("id", template.id());
        return document;
    }
}
