package com.stashguard.rpc;

import com.google.gson.JsonObject;

/**
 * One decoded RPC request.
 *
 * @param id caller-chosen correlation id, echoed in the response; may be null
 * @param method registered method name
 * @param credential bearer credential from the transport, or null if none was sent
 * @param params method parameters, never null
 */
public record RpcCall(String id, String method, String credential, JsonObject params) {

    public RpcCall {
        params = params == null ? new JsonObject() : params;
    }
}
