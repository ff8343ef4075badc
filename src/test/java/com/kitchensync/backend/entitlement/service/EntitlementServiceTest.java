package com.kitchensync.backend.entitlement.service;

import com.kitchensync.backend.entitlement.entity.UserEntitlementEntity;
import com.kitchensync.backend.entitlement.repo.UserEntitlementRepository;
import org.junit.jupiter.api.Test;
import org.mockito.Mockito;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;

class EntitlementServiceTest {

    private static UserEntitlementEntity ent(String type) {
        UserEntitlementEntity e = new UserEntitlementEntity();
        e.setEntitlementType(type);
        return e;
    }

    @Test
    void no_active_entitlement_should_be_none() {
        UserEntitlementRepository repo = Mockito.mock(UserEntitlementRepository.class);
        Mockito.when(repo.findActive(eq(1L), any(Instant.class), any())).thenReturn(List.of());

        assertEquals(EntitlementService.Tier.NONE, new EntitlementService(repo).resolveTier(1L, Instant.now()));
    }

    @Test
    void highest_tier_should_win() {
        UserEntitlementRepository repo = Mockito.mock(UserEntitlementRepository.class);
        Mockito.when(repo.findActive(eq(1L), any(Instant.class), any()))
                .thenReturn(List.of(ent("trial"), ent("YEARLY"), ent("MONTHLY")));

        assertEquals(EntitlementService.Tier.YEARLY, new EntitlementService(repo).resolveTier(1L, Instant.now()));
    }

    @Test
    void unknown_type_should_be_ignored() {
        assertEquals(EntitlementService.Tier.NONE, EntitlementService.parseTier("LIFETIME"));
        assertEquals(EntitlementService.Tier.NONE, EntitlementService.parseTier(null));
    }
}
