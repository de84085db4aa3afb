package com.stashguard.rpc;

import com.google.gson.JsonElement;

/**
 * {@code uploadPlayerInv}: replaces the caller's stash, expedition and equipment.
 */
public class UploadPlayerInventoryMethod implements RpcMethod {

    public static final String NAME = "uploadPlayerInv";

    private final InventoryCommitOrchestrator orchestrator;

    public UploadPlayerInventoryMethod(InventoryCommitOrchestrator orchestrator) {
        this.orchestrator = orchestrator;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public JsonElement invoke(RpcCall call) throws RpcException {
        return orchestrator.upload(call.credential(), call.params()).toJson();
    }
}
