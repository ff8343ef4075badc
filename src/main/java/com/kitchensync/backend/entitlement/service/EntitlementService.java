package com.kitchensync.backend.entitlement.service;

import com.kitchensync.backend.entitlement.repo.UserEntitlementRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.Locale;

@RequiredArgsConstructor
@Service
public class EntitlementService {

    public enum Tier { NONE, TRIAL, MONTHLY, YEARLY }

    private final UserEntitlementRepository repo;

    /** 同時有多筆有效權益時取最高：YEARLY > MONTHLY > TRIAL */
    @Transactional(readOnly = true)
    public Tier resolveTier(Long userId, Instant nowUtc) {
        var list = repo.findActive(userId, nowUtc, PageRequest.of(0, 5));
        Tier best = Tier.NONE;
        for (var e : list) {
            Tier t = parseTier(e.getEntitlementType());
            if (t.ordinal() > best.ordinal()) best = t;
        }
        return best;
    }

    static Tier parseTier(String raw) {
        if (raw == null) return Tier.NONE;
        return switch (raw.trim().toUpperCase(Locale.ROOT)) {
            case "TRIAL" -> Tier.TRIAL;
            case "MONTHLY" -> Tier.MONTHLY;
            case "YEARLY" -> Tier.YEARLY;
            default -> Tier.NONE;
        };
    }
}
