package com.stashguard.rpc;

import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Decodes request envelopes and routes them to registered methods.
 *
 * <p>Every failure, expected or not, comes back as an error response; nothing escapes to the
 * transport.
 */
public class RpcDispatcher {

    private static final Logger LOGGER = LoggerFactory.getLogger(RpcDispatcher.class);

    private final RpcMethodRegistry registry;

    public RpcDispatcher(RpcMethodRegistry registry) {
        this.registry = registry;
    }

    /**
     * Dispatches one raw request body.
     *
     * @param body the request body, {@code {"id": ..., "method": ..., "params": {...}}}
     * @param credential bearer credential from the transport, or null
     * @return the response to send
     */
    public RpcResponse dispatch(String body, String credential) {
        String id = null;
        String method = null;
        try {
            JsonObject request = decode(body);
            id = optionalString(request, "id", "Request id must be a string");
            method = optionalString(request, "method", "Method must be a string");
            if (method == null || method.isEmpty()) {
                throw new RpcException(RpcStatus.INVALID_ARGUMENT, "Missing method");
            }

            RpcMethod target = registry.get(method);
            if (target == null) {
                LOGGER.warn("RPC method not registered: {}", method);
                throw new RpcException(RpcStatus.METHOD_NOT_FOUND, "Unknown method: " + method);
            }

            JsonElement params = request.get("params");
            if (params != null && !params.isJsonNull() && !params.isJsonObject()) {
                throw new RpcException(RpcStatus.INVALID_ARGUMENT, "Params must be an object");
            }
            RpcCall call = new RpcCall(id, method,
                credential, params == null || params.isJsonNull() ? null : params.getAsJsonObject());

            JsonElement result = target.invoke(call);
            LOGGER.debug("RPC success: id={}, method={}", id, method);
            return RpcResponse.success(id, result);

        } catch (RpcException e) {
            LOGGER.debug("RPC error: id={}, method={}, status={}, message={}", id, method, e.getStatus(), e.getMessage());
            return RpcResponse.error(id, e);
        } catch (RuntimeException e) {
            LOGGER.error("Unexpected error in RPC dispatch for method {}", method, e);
            return RpcResponse.error(id, RpcStatus.INTERNAL, "Internal error");
        }
    }

    private JsonObject decode(String body) throws RpcException {
        if (body == null || body.isBlank()) {
            throw new RpcException(RpcStatus.INVALID_ARGUMENT, "Empty request body");
        }
        PayloadLimits.validateSize(body);

        JsonElement parsed;
        try {
            parsed = JsonParser.parseString(body);
        } catch (JsonParseException e) {
            throw new RpcException(RpcStatus.INVALID_ARGUMENT, "Malformed JSON request", e);
        }
        if (!parsed.isJsonObject()) {
            throw new RpcException(RpcStatus.INVALID_ARGUMENT, "Request must be a JSON object");
        }
        PayloadLimits.validateShape(parsed);
        return parsed.getAsJsonObject();
    }

    private static String optionalString(JsonObject object, String field, String message) throws RpcException {
        JsonElement value = object.get(field);
        if (value == null || value.isJsonNull()) {
            return null;
        }
        if (!value.isJsonPrimitive() || !value.getAsJsonPrimitive().isString()) {
            throw new RpcException(RpcStatus.INVALID_ARGUMENT, message);
        }
        return value.getAsString();
    }
}
