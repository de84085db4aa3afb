package com.stashguard.rpc;

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;

import java.util.Map;

/**
 * Size and shape limits enforced on request bodies before any domain logic runs.
 */
public final class PayloadLimits {

    public static final int MAX_PAYLOAD_CHARS = 256 * 1024;
    public static final int MAX_NESTING_DEPTH = 16;
    public static final int MAX_ARRAY_LENGTH = 1024;
    public static final int MAX_OBJECT_KEYS = 256;
    private static final int MAX_KEY_LENGTH = 256;

    private PayloadLimits() {
    }

    /**
     * Checks the raw body length.
     *
     * @throws RpcException with {@link RpcStatus#INVALID_ARGUMENT} if the body is too large
     */
    public static void validateSize(String body) throws RpcException {
        if (body.length() > MAX_PAYLOAD_CHARS) {
            throw new RpcException(RpcStatus.INVALID_ARGUMENT,
                "Payload size " + body.length() + " exceeds limit of " + MAX_PAYLOAD_CHARS + " characters");
        }
    }

    /**
     * Checks nesting depth, array lengths and object sizes of a parsed body.
     *
     * @throws RpcException with {@link RpcStatus#INVALID_ARGUMENT} on the first violated limit
     */
    public static void validateShape(JsonElement json) throws RpcException {
        validate(json, 0);
    }

    private static void validate(JsonElement json, int depth) throws RpcException {
        if (depth > MAX_NESTING_DEPTH) {
            throw new RpcException(RpcStatus.INVALID_ARGUMENT,
                "JSON nesting depth exceeds limit of " + MAX_NESTING_DEPTH);
        }
        if (json == null || json.isJsonNull() || json.isJsonPrimitive()) {
            return;
        }

        if (json.isJsonArray()) {
            JsonArray array = json.getAsJsonArray();
            if (array.size() > MAX_ARRAY_LENGTH) {
                throw new RpcException(RpcStatus.INVALID_ARGUMENT,
                    "Array length " + array.size() + " exceeds limit of " + MAX_ARRAY_LENGTH);
            }
            for (JsonElement element : array) {
                validate(element, depth + 1);
            }
            return;
        }

        JsonObject object = json.getAsJsonObject();
        if (object.size() > MAX_OBJECT_KEYS) {
            throw new RpcException(RpcStatus.INVALID_ARGUMENT,
                "Object has " + object.size() + " keys, exceeding limit of " + MAX_OBJECT_KEYS);
        }
        for (Map.Entry<String, JsonElement> entry : object.entrySet()) {
            if (entry.getKey().length() > MAX_KEY_LENGTH) {
                throw new RpcException(RpcStatus.INVALID_ARGUMENT,
                    "Object key exceeds maximum length of " + MAX_KEY_LENGTH + " characters");
            }
            validate(entry.getValue(), depth + 1);
        }
    }
}
