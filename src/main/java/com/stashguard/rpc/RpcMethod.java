package com.stashguard.rpc;

import com.google.gson.JsonElement;

/**
 * A server method callable through the {@link RpcDispatcher}.
 */
public interface RpcMethod {

    /**
     * @return the name clients call this method by
     */
    String name();

    /**
     * Executes the call.
     *
     * @param call the decoded request
     * @return the result payload
     * @throws RpcException for any failure the caller should see
     */
    JsonElement invoke(RpcCall call) throws RpcException;
}
