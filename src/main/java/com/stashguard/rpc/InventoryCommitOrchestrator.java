package com.stashguard.rpc;

import com.google.gson.JsonObject;
import com.stashguard.identity.AuthenticationException;
import com.stashguard.identity.IdentityVerifier;
import com.stashguard.inventory.GridSpec;
import com.stashguard.inventory.InventoryItem;
import com.stashguard.inventory.ItemTemplate;
import com.stashguard.persistence.DocumentPath;
import com.stashguard.persistence.DocumentStore;
import com.stashguard.persistence.FieldValue;
import com.stashguard.persistence.StoreException;
import com.stashguard.persistence.WriteBatch;
import com.stashguard.templates.CatalogUnavailableException;
import com.stashguard.templates.TemplateCache;
import com.stashguard.validation.EquipmentValidator;
import com.stashguard.validation.FailureCode;
import com.stashguard.validation.GridValidator;
import com.stashguard.validation.InventorySanitizer;
import com.stashguard.validation.InventoryValidationException;
import com.stashguard.validation.ValidationFailure;
import com.stashguard.validation.ValidationResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Runs a full inventory upload: authenticate, rate limit, validate all three sections,
 * sanitize, and commit everything in one atomic batch.
 *
 * <p>Validation short-circuits on the first failure in the order stash, expedition,
 * equipment. Nothing is written unless every section passes.
 */
public class InventoryCommitOrchestrator {

    private static final Logger LOGGER = LoggerFactory.getLogger(InventoryCommitOrchestrator.class);

    public static final String PLAYERS_COLLECTION = "players";
    public static final String CURRENT_DOCUMENT = "current";

    private final IdentityVerifier identityVerifier;
    private final RateLimiter rateLimiter;
    private final TemplateCache templateCache;
    private final GridValidator gridValidator;
    private final EquipmentValidator equipmentValidator;
    private final InventorySanitizer sanitizer;
    private final DocumentStore store;

    public InventoryCommitOrchestrator(
            IdentityVerifier identityVerifier,
            RateLimiter rateLimiter,
            TemplateCache templateCache,
            GridValidator gridValidator,
            EquipmentValidator equipmentValidator,
            InventorySanitizer sanitizer,
            DocumentStore store) {
        this.identityVerifier = identityVerifier;
        this.rateLimiter = rateLimiter;
        this.templateCache = templateCache;
        this.gridValidator = gridValidator;
        this.equipmentValidator = equipmentValidator;
        this.sanitizer = sanitizer;
        this.store = store;
    }

    /**
     * Validates and commits one upload.
     *
     * @param credential the caller's credential
     * @param params {@code {stash: [...], expedition: [...], equipment: [...]}}, each optional
     * @return per-section item counts of what was written
     * @throws RpcException on any rejection; nothing has been written when this is thrown
     */
    public UploadResult upload(String credential, JsonObject params) throws RpcException {
        String playerId = authenticate(credential);

        if (!rateLimiter.tryAcquire(playerId)) {
            throw new RpcException(RpcStatus.RESOURCE_EXHAUSTED, "Please wait before saving again");
        }

        JsonObject request = params == null ? new JsonObject() : params;
        List<InventoryItem> stash = parse(request, "stash", "Item %d", "Items must be an array", "Stash", false);
        List<InventoryItem> expedition = parse(request, "expedition", "Item %d", "Items must be an array", "Expedition", false);
        List<InventoryItem> equipment = parse(request, "equipment", "Equipment[%d]", "Equipment must be an array", "Equipment", true);

        Map<String, ItemTemplate> templates;
        try {
            templates = templateCache.templates();
        } catch (CatalogUnavailableException e) {
            throw new RpcException(RpcStatus.UNAVAILABLE, "Item templates are temporarily unavailable", e);
        }

        check(gridValidator.validateGrid(stash, templates, GridSpec.STASH), "Stash", playerId);
        check(gridValidator.validateGrid(expedition, templates, GridSpec.EXPEDITION), "Expedition", playerId);
        check(equipmentValidator.validateEquipment(equipment, templates), "Equipment", playerId);

        List<InventoryItem> cleanStash = sanitizer.sanitizeAll(stash);
        List<InventoryItem> cleanExpedition = sanitizer.sanitizeAll(expedition);
        List<InventoryItem> cleanEquipment = sanitizer.sanitizeAll(equipment);

        DocumentPath player = DocumentPath.of(PLAYERS_COLLECTION, playerId);
        Map<String, FieldValue> playerUpdate = new LinkedHashMap<>();
        playerUpdate.put("lastUpdated", FieldValue.serverTimestamp());
        playerUpdate.put("updateCount", FieldValue.increment(1));

        WriteBatch batch = store.batch()
            .set(player.child("stash", CURRENT_DOCUMENT), sectionDocument(cleanStash))
            .set(player.child("expedition", CURRENT_DOCUMENT), sectionDocument(cleanExpedition))
            .set(player.child("equipment", CURRENT_DOCUMENT), sectionDocument(cleanEquipment))
            .merge(player, playerUpdate);
        try {
            batch.commit();
        } catch (StoreException e) {
            LOGGER.error("Failed to commit inventory for player {}", playerId, e);
            throw new RpcException(RpcStatus.UNAVAILABLE, "Failed to save inventory, please retry", e);
        }

        UploadResult result = new UploadResult(cleanStash.size(), cleanExpedition.size(), cleanEquipment.size());
        LOGGER.info("Committed inventory for player {}: stash={}, expedition={}, equipment={}",
                    playerId, result.stashCount(), result.expeditionCount(), result.equipmentCount());
        return result;
    }

    private String authenticate(String credential) throws RpcException {
        String playerId;
        try {
            playerId = identityVerifier.verify(credential);
        } catch (AuthenticationException e) {
            LOGGER.debug("Rejected upload credential: {}", e.getMessage());
            throw new RpcException(RpcStatus.UNAUTHENTICATED, "Must be authenticated", e);
        }
        if (playerId == null || playerId.isBlank() || playerId.contains("/")
                || playerId.equals(".") || playerId.equals("..")) {
            LOGGER.warn("Identity verifier returned an unusable player id: '{}'", playerId);
            throw new RpcException(RpcStatus.UNAUTHENTICATED, "Must be authenticated");
        }
        return playerId;
    }

    private static List<InventoryItem> parse(
            JsonObject request,
            String field,
            String itemLabel,
            String notArrayMessage,
            String section,
            boolean slotted) throws RpcException {
        try {
            return InventoryItemCodec.parseSection(request.get(field), itemLabel, notArrayMessage, slotted);
        } catch (InventoryValidationException e) {
            throw rejection(e.getFailure(), section);
        }
    }

    private static void check(ValidationResult result, String section, String playerId) throws RpcException {
        if (result.isValid()) {
            return;
        }
        RpcException rejection = rejection(result.failure(), section);
        LOGGER.warn("Rejected inventory upload from player {}: {}", playerId, rejection.getMessage());
        throw rejection;
    }

    private static RpcException rejection(ValidationFailure failure, String section) {
        RpcStatus status = failure.code() == FailureCode.UNKNOWN_TEMPLATE ? RpcStatus.NOT_FOUND : RpcStatus.INVALID_ARGUMENT;
        return new RpcException(status, section + " validation failed: " + failure.message());
    }

    private static Map<String, FieldValue> sectionDocument(List<InventoryItem> items) {
        Map<String, FieldValue> fields = new LinkedHashMap<>();
        fields.put("items", FieldValue.of(InventoryItemCodec.toJson(items)));
        fields.put("lastUpdated", FieldValue.serverTimestamp());
        return fields;
    }
}
