package com.kitchensync.backend.sync.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

public record SyncStatusResponse(
        String lastSyncedAt,                                // 沒同步過是 null
        @JsonProperty("isConsistent") boolean isConsistent,
        DataTypes dataTypes
) {
    /** 各正規化 section 在伺服器上的列數 */
    public record DataTypes(
            long inventory,
            long recipes,
            long mealPlans,
            long shoppingList,
            long cookware
    ) {}
}
