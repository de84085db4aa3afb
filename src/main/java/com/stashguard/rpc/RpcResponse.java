package com.stashguard.rpc;

import com.google.gson.JsonElement;
import com.google.gson.JsonNull;
import com.google.gson.JsonObject;

/**
 * Response envelope for one RPC call.
 *
 * @param status null on success, otherwise the failure status
 * @param body the JSON body sent to the caller
 */
public record RpcResponse(RpcStatus status, JsonObject body) {

    public static final int PROTOCOL_VERSION = 1;

    /**
     * Builds a successful response.
     */
    public static RpcResponse success(String id, JsonElement result) {
        JsonObject response = envelope(id, true);
        response.add("result", result == null ? JsonNull.INSTANCE : result);
        return new RpcResponse(null, response);
    }

    /**
     * Builds an error response.
     */
    public static RpcResponse error(String id, RpcStatus status, String message) {
        JsonObject response = envelope(id, false);

        JsonObject error = new JsonObject();
        error.addProperty("code", status.name());
        error.addProperty("message", message);
        response.add("error", error);

        return new RpcResponse(status, response);
    }

    public static RpcResponse error(String id, RpcException e) {
        return error(id, e.getStatus(), e.getMessage());
    }

    public boolean isSuccess() {
        return status == null;
    }

    /**
     * @return the HTTP status code this response is sent with
     */
    public int httpStatus() {
        return status == null ? 200 : status.getHttpStatus();
    }

    private static JsonObject envelope(String id, boolean success) {
        JsonObject response = new JsonObject();
        response.addProperty("protocol", PROTOCOL_VERSION);
        response.addProperty("type", "rpc_response");
        response.addProperty("id", id);
        response.addProperty("success", success);
        return response;
    }
}
