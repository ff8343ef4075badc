package com.kitchensync.backend.sync.gate;

import com.kitchensync.backend.entitlement.service.EntitlementService;
import com.kitchensync.backend.entitlement.service.EntitlementService.Tier;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Clock;

/**
 * 依使用者目前的權益方案回答各種上限，以及能不能用自訂儲存位置。
 */
@Component
@RequiredArgsConstructor
public class SyncFeatureGate {

    public static final String FEATURE_CUSTOM_STORAGE_AREAS = "customStorageAreas";

    private final EntitlementService entitlementService;
    private final SyncLimitProperties props;
    private final Clock clock;

    /** null = 不限 */
    public Integer cookwareLimitOrNull(Long userId) {
        return props.cookwareLimitOrNull(tierOf(userId));
    }

    /** null = 不限 */
    public Integer pantryLimitOrNull(Long userId) {
        return props.pantryLimitOrNull(tierOf(userId));
    }

    public boolean canUseCustomStorageAreas(Long userId) {
        var allowed = props.getCustomStorageTiers();
        return allowed != null && allowed.contains(tierOf(userId));
    }

    private Tier tierOf(Long userId) {
        return entitlementService.resolveTier(userId, clock.instant());
    }
}
