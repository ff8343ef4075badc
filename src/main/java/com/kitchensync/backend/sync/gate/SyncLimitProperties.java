package com.kitchensync.backend.sync.gate;

import com.kitchensync.backend.entitlement.service.EntitlementService.Tier;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

@Data
@Component
@ConfigurationProperties(prefix = "app.sync.limits")
public class SyncLimitProperties {

    /** 各方案 cookware 上限；-1 = 不限 */
    private Map<Tier, Integer> cookware = defaultCookware();

    /** 各方案庫存（inventory）上限；-1 = 不限 */
    private Map<Tier, Integer> pantry = defaultPantry();

    /** 可以使用自訂儲存位置的方案 */
    private Set<Tier> customStorageTiers = EnumSet.of(Tier.TRIAL, Tier.MONTHLY, Tier.YEARLY);

    private static Map<Tier, Integer> defaultCookware() {
        Map<Tier, Integer> m = new EnumMap<>(Tier.class);
        m.put(Tier.NONE, 5);
        m.put(Tier.TRIAL, -1);
        m.put(Tier.MONTHLY, -1);
        m.put(Tier.YEARLY, -1);
        return m;
    }

    private static Map<Tier, Integer> defaultPantry() {
        Map<Tier, Integer> m = new EnumMap<>(Tier.class);
        m.put(Tier.NONE, 25);
        m.put(Tier.TRIAL, -1);
        m.put(Tier.MONTHLY, -1);
        m.put(Tier.YEARLY, -1);
        return m;
    }

    /** 沒設定的方案視為不限 */
    public Integer cookwareLimitOrNull(Tier tier) {
        return limitOrNull(cookware, tier);
    }

    public Integer pantryLimitOrNull(Tier tier) {
        return limitOrNull(pantry, tier);
    }

    private static Integer limitOrNull(Map<Tier, Integer> limits, Tier tier) {
        Integer v = (limits == null) ? null : limits.get(tier);
        return (v == null || v < 0) ? null : v;
    }
}
