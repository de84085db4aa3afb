package com.stashguard.rpc;

import com.google.gson.JsonObject;

/**
 * Outcome of a committed inventory upload: how many top-level items each section holds.
 */
public record UploadResult(int stashCount, int expeditionCount, int equipmentCount) {

    public JsonObject toJson() {
        JsonObject counts = new JsonObject();
        counts.addProperty("stash", stashCount);
        counts.addProperty("expedition", expeditionCount);
        counts.addProperty("equipment", equipmentCount);

        JsonObject result = new JsonObject();
        result.addProperty("success", true);
        result.add("itemCounts", counts);
        return result;
    }
}
